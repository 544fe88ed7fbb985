package com.syncbridge.core.model;

import java.time.Instant;

/**
 * One entry of an append-only stream. Offsets start at 1 and increase strictly per stream key.
 */
public record StreamEntry(
    String streamKey,
    long offset,
    String payload,
    Instant appendedAt
) {
}
