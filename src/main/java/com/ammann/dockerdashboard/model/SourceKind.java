/* (C)2026 */
package com.ammann.dockerdashboard.model;

import java.util.Locale;
import java.util.Optional;

/**
 * Command output sources a refresh cycle can deliver.
 *
 * <p>The {@link #action()} string is the label the command-execution side attaches to
 * each result ({@code ps}, {@code compose_ls}, ...).
 */
public enum SourceKind {
    VERSION,
    INFO,
    PS,
    IMAGES,
    STATS,
    COMPOSE_LS,
    SYSTEM_DF;

    public String action() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Resolves the source for a result's action label.
     *
     * @param action the action label, case-insensitive
     * @return the source, or empty if the label is not a known source
     */
    public static Optional<SourceKind> fromAction(String action) {
        if (action == null || action.isBlank()) {
            return Optional.empty();
        }
        String normalized = action.trim().toUpperCase(Locale.ROOT);
        for (SourceKind kind : values()) {
            if (kind.name().equals(normalized)) {
                return Optional.of(kind);
            }
        }
        return Optional.empty();
    }
}
