package com.syncbridge.core.model;

/**
 * Result reported by a downstream application for one event.
 */
public enum AckResult {
    OK,
    ERROR
}
