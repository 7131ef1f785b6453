/* (C)2026 */
package com.ammann.dockerdashboard.dto;

/**
 * Whether an action button is enabled for the current selection.
 *
 * @param disabled {@code true} if the action must not be dispatched
 * @param reason   why the action is disabled, {@code null} when enabled
 * @param target   the resolved target, may be {@code null}
 */
public record ActionState(boolean disabled, String reason, String target) {

    public static ActionState enabled(String target) {
        return new ActionState(false, null, target);
    }

    public static ActionState disabled(String reason, String target) {
        return new ActionState(true, reason, target);
    }
}
