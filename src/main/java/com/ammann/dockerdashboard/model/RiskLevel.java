/* (C)2026 */
package com.ammann.dockerdashboard.model;

/** Whether an action can be undone by the user. */
public enum RiskLevel {
    SAFE,
    DANGER
}
