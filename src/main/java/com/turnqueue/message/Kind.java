package com.turnqueue.message;

/**
 * The purpose of a message.
 */
public enum Kind {
    DISPLAY,
    DEBUG,
    WARNING,
    ERROR
}
