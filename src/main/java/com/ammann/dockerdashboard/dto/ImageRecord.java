/* (C)2026 */
package com.ammann.dockerdashboard.dto;

/**
 * One row of the image listing.
 *
 * @param repository the repository name
 * @param tag        the image tag
 * @param id         the image identifier, possibly digest-prefixed
 * @param size       the size text as printed by the image listing
 */
public record ImageRecord(String repository, String tag, String id, String size) {}
