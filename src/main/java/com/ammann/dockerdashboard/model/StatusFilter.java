/* (C)2026 */
package com.ammann.dockerdashboard.model;

/** Container state filter of the dashboard. */
public enum StatusFilter {
    ALL,
    RUNNING,
    EXITED
}
