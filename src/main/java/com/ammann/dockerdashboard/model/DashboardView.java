/* (C)2026 */
package com.ammann.dockerdashboard.model;

/**
 * Dashboard tab whose records are currently listed.
 *
 * <p>Each view lists exactly one record kind, see {@link #selectionKind()}.
 */
public enum DashboardView {
    CONTAINERS(SelectionKind.CONTAINER),
    IMAGES(SelectionKind.IMAGE),
    STATS(SelectionKind.STAT),
    COMPOSE(SelectionKind.COMPOSE);

    private final SelectionKind selectionKind;

    DashboardView(SelectionKind selectionKind) {
        this.selectionKind = selectionKind;
    }

    public SelectionKind selectionKind() {
        return selectionKind;
    }
}
