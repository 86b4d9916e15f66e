package com.turnqueue.message;

/**
 * How prominently a message should be shown, from least to most important.
 */
public enum Importance {
    HIDDEN,
    VERBOSE,
    LOW,
    NORMAL,
    HIGH,
    VERY_HIGH
}
