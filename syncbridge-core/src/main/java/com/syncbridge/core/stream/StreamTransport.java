package com.syncbridge.core.stream;

import com.syncbridge.core.exception.TransientIOException;
import com.syncbridge.core.model.StreamEntry;
import java.util.List;
import java.util.Optional;

/**
 * Append-only, per-key ordered logs with any number of independent readers.
 * Readers keep their own position; the transport holds no consumer state.
 *
 * Implementations throw {@link TransientIOException} when the log is unreachable.
 */
public interface StreamTransport {

    /**
     * Append an entry to a stream.
     *
     * @param streamKey The stream key
     * @param payload The serialized message
     * @return The offset assigned to the entry, strictly greater than every earlier offset of the stream
     */
    long append(String streamKey, String payload);

    /**
     * Read entries after a position, in offset order.
     *
     * @param streamKey The stream key
     * @param afterOffset Offset of the last entry already processed (0 for the beginning)
     * @param maxEntries Maximum number of entries to return
     * @return Entries with offset greater than afterOffset
     */
    List<StreamEntry> read(String streamKey, long afterOffset, int maxEntries);

    /**
     * Read the entry at an exact offset.
     */
    Optional<StreamEntry> readAt(String streamKey, long offset);

    /**
     * Offset of the newest entry, 0 for an empty or unknown stream.
     */
    long latestOffset(String streamKey);

    /**
     * Keys of all streams starting with the given prefix.
     */
    List<String> streamKeys(String prefix);
}
