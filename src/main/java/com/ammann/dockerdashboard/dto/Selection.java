/* (C)2026 */
package com.ammann.dockerdashboard.dto;

import com.ammann.dockerdashboard.model.SelectionKind;

/**
 * The record the user has selected, remembered across refreshes.
 *
 * @param kind the selected record kind
 * @param key  the identity of the selected record
 */
public record Selection(SelectionKind kind, String key) {}
