package com.syncbridge.core.repository;

import com.syncbridge.core.model.StreamCursor;
import java.util.Optional;

/**
 * Durable storage for consumer positions.
 */
public interface CursorRepository {

    Optional<StreamCursor> find(String streamKey, String consumerName);

    /**
     * Persist a cursor. A commit never moves a stored cursor backwards.
     */
    void commit(StreamCursor cursor);
}
