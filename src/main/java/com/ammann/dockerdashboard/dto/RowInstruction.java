/* (C)2026 */
package com.ammann.dockerdashboard.dto;

/**
 * One step of reconciling the displayed rows with a new ranked view.
 *
 * @param type the kind of change
 * @param name the row identity (container name)
 * @param row  the new row content, {@code null} for {@link Type#REMOVE}
 */
public record RowInstruction(Type type, String name, RankedRow row) {

    public enum Type {
        /** A newly visible row; render with an enter transition. */
        ADD,
        /** A row that stays visible; update value, level and tooltip in place. */
        UPDATE,
        /** A row that left the visible set; play an exit transition before dropping it. */
        REMOVE
    }

    public static RowInstruction add(RankedRow row) {
        return new RowInstruction(Type.ADD, row.name(), row);
    }

    public static RowInstruction update(RankedRow row) {
        return new RowInstruction(Type.UPDATE, row.name(), row);
    }

    public static RowInstruction remove(String name) {
        return new RowInstruction(Type.REMOVE, name, null);
    }
}
