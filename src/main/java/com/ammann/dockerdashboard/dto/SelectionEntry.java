/* (C)2026 */
package com.ammann.dockerdashboard.dto;

import com.ammann.dockerdashboard.model.SelectionKind;

/**
 * A selectable row of the active view.
 *
 * @param kind     the record kind
 * @param key      the record identity
 * @param title    the primary display text
 * @param subtitle the secondary display text
 * @param target   the sanitized command argument, or {@code null} if the row cannot be targeted
 */
public record SelectionEntry(
        SelectionKind kind, String key, String title, String subtitle, String target) {

    public Selection toSelection() {
        return new Selection(kind, key);
    }
}
