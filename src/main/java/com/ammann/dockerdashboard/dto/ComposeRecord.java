/* (C)2026 */
package com.ammann.dockerdashboard.dto;

/**
 * One compose project.
 *
 * @param name        the project name
 * @param status      the project status text (e.g. "running(3)")
 * @param configFiles the compose file list text
 */
public record ComposeRecord(String name, String status, String configFiles) {}
