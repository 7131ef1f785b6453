/* (C)2026 */
package com.ammann.dockerdashboard.model;

/** Severity class of a ranked row's bar. */
public enum UsageLevel {
    OK,
    WARN,
    DANGER
}
