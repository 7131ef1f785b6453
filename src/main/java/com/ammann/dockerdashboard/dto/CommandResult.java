/* (C)2026 */
package com.ammann.dockerdashboard.dto;

/**
 * Output of one executed command, as handed over by the command runner.
 *
 * @param action   the source label (e.g. {@code ps}, {@code stats})
 * @param command  the command line that was executed
 * @param stdout   the captured standard output
 * @param stderr   the captured standard error
 * @param exitCode the process exit code
 */
public record CommandResult(
        String action, String command, String stdout, String stderr, int exitCode) {

    public boolean succeeded() {
        return exitCode == 0;
    }
}
