/* (C)2026 */
package com.ammann.dockerdashboard.model;

/** Kind of record a selection entry points at. */
public enum SelectionKind {
    CONTAINER,
    IMAGE,
    STAT,
    COMPOSE
}
