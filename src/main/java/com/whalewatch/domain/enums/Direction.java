package com.whalewatch.domain.enums;

/**
 * Flow direction of an event relative to the watched entity.
 * Cumulative window counters are kept separately per direction.
 */
public enum Direction {
    IN,
    OUT
}
