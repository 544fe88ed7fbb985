package com.syncbridge.core.model;

import java.time.Instant;

/**
 * Position of one named consumer in one stream: the offset of the last fully processed entry.
 * A cursor is a value; consumers receive it, advance it and hand it back for persistence.
 */
public record StreamCursor(
    String streamKey,
    String consumerName,
    long offset,
    Instant updatedAt
) {
    /**
     * Cursor positioned before the first entry of the stream.
     */
    public static StreamCursor initial(String streamKey, String consumerName) {
        return new StreamCursor(streamKey, consumerName, 0L, null);
    }

    public StreamCursor advanceTo(long newOffset, Instant now) {
        if (newOffset < offset) {
            throw new IllegalArgumentException(String.format(
                "Cursor %s/%s cannot move back from %d to %d", streamKey, consumerName, offset, newOffset));
        }
        return new StreamCursor(streamKey, consumerName, newOffset, now);
    }
}
