/* (C)2026 */
package com.ammann.dockerdashboard.model;

/** Resource dimension the top-N view is sorted by. */
public enum RankDimension {
    CPU,
    MEM,
    NET
}
