package com.syncbridge.engine.persistence;

import com.syncbridge.core.model.StreamCursor;
import com.syncbridge.core.repository.CursorRepository;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory implementation of CursorRepository.
 */
public class InMemoryCursorRepository implements CursorRepository {

    private final Map<String, StreamCursor> cursors = new ConcurrentHashMap<>();

    @Override
    public Optional<StreamCursor> find(String streamKey, String consumerName) {
        return Optional.ofNullable(cursors.get(key(streamKey, consumerName)));
    }

    @Override
    public void commit(StreamCursor cursor) {
        cursors.merge(key(cursor.streamKey(), cursor.consumerName()), cursor,
            (stored, incoming) -> incoming.offset() >= stored.offset() ? incoming : stored);
    }

    private String key(String streamKey, String consumerName) {
        return streamKey + "#" + consumerName;
    }
}
