/* (C)2026 */
package com.ammann.dockerdashboard.dto;

import java.util.Locale;

/**
 * One row of the container listing.
 *
 * @param id     the container identifier, unique within one listing
 * @param name   the container name
 * @param status the human-readable status (e.g. "Up 5 hours", "Exited (0) 1 hour ago")
 * @param ports  the port mapping text, {@code "--"} if none
 */
public record ContainerRecord(String id, String name, String status, String ports) {

    /**
     * Classifies a status text as running.
     *
     * <p>A status is running if it contains {@code up} or {@code running}, ignoring case.
     *
     * @param status the status text, may be {@code null}
     * @return {@code true} if the status describes a running container
     */
    public static boolean isRunningStatus(String status) {
        if (status == null) {
            return false;
        }
        String normalized = status.toLowerCase(Locale.ROOT);
        return normalized.contains("up") || normalized.contains("running");
    }

    public boolean isRunning() {
        return isRunningStatus(status);
    }
}
