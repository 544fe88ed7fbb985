package com.syncbridge.engine.stream;

import com.syncbridge.core.model.StreamEntry;
import com.syncbridge.core.stream.StreamTransport;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory implementation of StreamTransport.
 * For single-process deployments and testing.
 */
public class InMemoryStreamTransport implements StreamTransport {

    private final Map<String, List<StreamEntry>> streams = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemoryStreamTransport(Clock clock) {
        this.clock = clock;
    }

    @Override
    public long append(String streamKey, String payload) {
        List<StreamEntry> stream = streams.computeIfAbsent(streamKey, k -> new ArrayList<>());
        synchronized (stream) {
            long offset = stream.size() + 1L;
            stream.add(new StreamEntry(streamKey, offset, payload, clock.instant()));
            return offset;
        }
    }

    @Override
    public List<StreamEntry> read(String streamKey, long afterOffset, int maxEntries) {
        List<StreamEntry> stream = streams.get(streamKey);
        if (stream == null) {
            return List.of();
        }
        synchronized (stream) {
            // offsets are 1-based and dense, so offset N sits at index N - 1
            int from = (int) Math.min(Math.max(afterOffset, 0), stream.size());
            int to = Math.min(from + maxEntries, stream.size());
            return List.copyOf(stream.subList(from, to));
        }
    }

    @Override
    public Optional<StreamEntry> readAt(String streamKey, long offset) {
        List<StreamEntry> stream = streams.get(streamKey);
        if (stream == null || offset < 1) {
            return Optional.empty();
        }
        synchronized (stream) {
            return offset <= stream.size() ? Optional.of(stream.get((int) offset - 1)) : Optional.empty();
        }
    }

    @Override
    public long latestOffset(String streamKey) {
        List<StreamEntry> stream = streams.get(streamKey);
        if (stream == null) {
            return 0L;
        }
        synchronized (stream) {
            return stream.size();
        }
    }

    @Override
    public List<String> streamKeys(String prefix) {
        return streams.keySet().stream()
            .filter(key -> key.startsWith(prefix))
            .sorted()
            .toList();
    }
}
