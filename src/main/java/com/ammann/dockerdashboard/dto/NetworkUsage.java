/* (C)2026 */
package com.ammann.dockerdashboard.dto;

/**
 * Parsed {@code "<rx> / <tx>"} network text. Unparseable sides are 0.
 *
 * @param rxBytes the received bytes
 * @param txBytes the transmitted bytes
 */
public record NetworkUsage(double rxBytes, double txBytes) {}
