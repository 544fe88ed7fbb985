package com.syncbridge.recovery;

import com.syncbridge.core.exception.MalformedMessageException;
import com.syncbridge.core.model.EventEnvelope;
import com.syncbridge.core.model.StreamCursor;
import com.syncbridge.core.model.StreamEntry;
import com.syncbridge.core.model.TrackingRecord;
import com.syncbridge.core.payload.PayloadRegistry;
import com.syncbridge.core.repository.CursorRepository;
import com.syncbridge.core.repository.TrackingRepository;
import com.syncbridge.core.stream.StreamTransport;
import com.syncbridge.engine.codec.SyncMessageCodec;
import com.syncbridge.engine.stream.StreamKeyResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;

/**
 * Recreates tracking records for events that reached a stream but whose record was never written,
 * e.g. when the publisher crashed between append and insert.
 *
 * Each event stream is scanned from a cursor of its own. Reconciling is idempotent: records that
 * already exist are left untouched, whatever their status. Entries whose payload does not decode
 * against its registered schema are skipped.
 */
public class TrackingReconciler {

    private static final Logger log = LoggerFactory.getLogger(TrackingReconciler.class);

    public static final String CONSUMER_NAME = "tracking-reconciler";

    private final StreamTransport transport;
    private final CursorRepository cursorRepository;
    private final TrackingRepository trackingRepository;
    private final SyncMessageCodec codec;
    private final PayloadRegistry payloadRegistry;
    private final StreamKeyResolver keyResolver;
    private final Clock clock;

    public TrackingReconciler(
            StreamTransport transport,
            CursorRepository cursorRepository,
            TrackingRepository trackingRepository,
            SyncMessageCodec codec,
            PayloadRegistry payloadRegistry,
            StreamKeyResolver keyResolver,
            Clock clock) {
        this.transport = transport;
        this.cursorRepository = cursorRepository;
        this.trackingRepository = trackingRepository;
        this.codec = codec;
        this.payloadRegistry = payloadRegistry;
        this.keyResolver = keyResolver;
        this.clock = clock;
    }

    /**
     * Reconcile every event stream of one consumer application.
     *
     * @return Number of tracking records created
     */
    public int reconcileApplication(String consumerApplication, int batchSize) {
        int created = 0;
        for (String streamKey : transport.streamKeys(keyResolver.applicationPrefix(consumerApplication))) {
            if (!keyResolver.isAckStream(streamKey)) {
                created += reconcile(consumerApplication, streamKey, batchSize);
            }
        }
        return created;
    }

    /**
     * Scan one event stream from the reconciler's cursor and insert any missing records.
     *
     * @return Number of tracking records created
     */
    public int reconcile(String consumerApplication, String streamKey, int batchSize) {
        StreamCursor cursor = cursorRepository.find(streamKey, CONSUMER_NAME)
            .orElseGet(() -> StreamCursor.initial(streamKey, CONSUMER_NAME));
        int created = 0;
        while (true) {
            List<StreamEntry> entries = transport.read(streamKey, cursor.offset(), batchSize);
            if (entries.isEmpty()) {
                break;
            }
            for (StreamEntry entry : entries) {
                if (restore(consumerApplication, entry)) {
                    created++;
                }
                cursor = cursor.advanceTo(entry.offset(), clock.instant());
            }
            cursorRepository.commit(cursor);
            if (entries.size() < batchSize) {
                break;
            }
        }
        if (created > 0) {
            log.warn("Restored {} missing tracking records from {}", created, streamKey);
        }
        return created;
    }

    private boolean restore(String consumerApplication, StreamEntry entry) {
        EventEnvelope envelope;
        try {
            envelope = codec.decodeEnvelope(entry.payload());
            payloadRegistry.decode(envelope.eventType(), envelope.data());
        } catch (MalformedMessageException e) {
            log.warn("Skipping undecodable entry {}@{}: {}", entry.streamKey(), entry.offset(), e.getMessage());
            return false;
        }
        TrackingRecord record = TrackingRecord.published(
            envelope, consumerApplication, entry.streamKey(), entry.offset(), envelope.timestamp());
        boolean inserted = trackingRepository.insertIfAbsent(record);
        if (inserted) {
            log.info("Restored tracking record for {} ({}) from {}@{}",
                envelope.eventId(), envelope.eventType(), entry.streamKey(), entry.offset());
        }
        return inserted;
    }
}
