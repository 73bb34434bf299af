package com.packlabels.core.layout;

/**
 * Zero-based page, column and row of one grid cell.
 */
public record GridPosition(int page, int column, int row) {
}
