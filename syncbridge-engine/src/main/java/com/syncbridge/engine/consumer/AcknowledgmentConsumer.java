package com.syncbridge.engine.consumer;

import com.syncbridge.core.exception.MalformedMessageException;
import com.syncbridge.core.exception.UnknownEventReferenceException;
import com.syncbridge.core.model.AcknowledgmentMessage;
import com.syncbridge.core.model.StreamCursor;
import com.syncbridge.core.model.StreamEntry;
import com.syncbridge.core.repository.CursorRepository;
import com.syncbridge.core.stream.StreamTransport;
import com.syncbridge.engine.codec.SyncMessageCodec;
import com.syncbridge.engine.logging.LoggingContext;
import com.syncbridge.engine.metrics.SyncMetrics;
import com.syncbridge.engine.stream.StreamKeyResolver;
import com.syncbridge.engine.support.TransientFailures;
import com.syncbridge.engine.tracking.AckOutcome;
import com.syncbridge.engine.tracking.TrackingService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Reads one consumer application's acknowledgment stream and applies each acknowledgment
 * to its tracking record.
 *
 * The cursor is committed after every message whose effect is durable. Messages that can
 * never be applied (malformed, unknown event) are logged and skipped. While the tracking
 * store is unavailable the same message is retried with backoff, so the cursor never
 * passes a message that was not processed.
 */
public class AcknowledgmentConsumer {

    private static final Logger log = LoggerFactory.getLogger(AcknowledgmentConsumer.class);

    private final String consumerApplication;
    private final String streamKey;
    private final String consumerName;
    private final StreamTransport transport;
    private final CursorRepository cursorRepository;
    private final SyncMessageCodec codec;
    private final TrackingService trackingService;
    private final ConsumerSettings settings;
    private final SyncMetrics metrics;
    private final Clock clock;

    private final AtomicReference<StreamCursor> cursor = new AtomicReference<>();
    private volatile ScheduledExecutorService scheduler;
    private volatile boolean stopRequested = false;

    public AcknowledgmentConsumer(
            String consumerApplication,
            StreamKeyResolver keyResolver,
            StreamTransport transport,
            CursorRepository cursorRepository,
            SyncMessageCodec codec,
            TrackingService trackingService,
            ConsumerSettings settings,
            SyncMetrics metrics,
            Clock clock) {
        this.consumerApplication = consumerApplication;
        this.streamKey = keyResolver.ackStreamKey(consumerApplication);
        this.consumerName = "ack-consumer-" + consumerApplication;
        this.transport = transport;
        this.cursorRepository = cursorRepository;
        this.codec = codec;
        this.trackingService = trackingService;
        this.settings = settings;
        this.metrics = metrics;
        this.clock = clock;
    }

    /**
     * Start polling on a dedicated thread from the last committed cursor.
     */
    public synchronized void start() {
        if (scheduler != null) {
            log.warn("Acknowledgment consumer for {} already running", consumerApplication);
            return;
        }
        stopRequested = false;
        cursor.set(currentCursor());
        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "ack-consumer-" + consumerApplication);
            t.setDaemon(true);
            return t;
        });
        scheduler.scheduleWithFixedDelay(
            this::pollLoop,
            0,
            settings.pollInterval().toMillis(),
            TimeUnit.MILLISECONDS
        );
        log.info("Started acknowledgment consumer on {} at offset {}", streamKey, cursor.get().offset());
    }

    /**
     * Stop polling. The cursor stays committed up to the last fully processed message.
     */
    public synchronized void stop() {
        stopRequested = true;
        ScheduledExecutorService running = scheduler;
        scheduler = null;
        if (running == null) {
            return;
        }
        running.shutdown();
        try {
            if (!running.awaitTermination(30, TimeUnit.SECONDS)) {
                running.shutdownNow();
            }
        } catch (InterruptedException e) {
            running.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("Stopped acknowledgment consumer on {}", streamKey);
    }

    /**
     * The last committed position, or the start of the stream.
     */
    public StreamCursor currentCursor() {
        return cursorRepository.find(streamKey, consumerName)
            .orElseGet(() -> StreamCursor.initial(streamKey, consumerName));
    }

    /**
     * Process one batch after the given cursor.
     *
     * @return The cursor after the last processed message
     */
    public StreamCursor pollOnce(StreamCursor from) {
        StreamCursor position = from;
        List<StreamEntry> entries = transport.read(streamKey, position.offset(), settings.batchSize());
        try (LoggingContext ctx = LoggingContext.forConsumer(consumerName)) {
            for (StreamEntry entry : entries) {
                if (!process(entry)) {
                    break;
                }
                position = position.advanceTo(entry.offset(), clock.instant());
                cursorRepository.commit(position);
            }
        }
        return position;
    }

    public String getStreamKey() {
        return streamKey;
    }

    public String getConsumerName() {
        return consumerName;
    }

    // ========== Helper Methods ==========

    private void pollLoop() {
        if (stopRequested) return;

        try {
            StreamCursor before = cursor.get();
            StreamCursor after = pollOnce(before);
            cursor.set(after);
            // drain without waiting for the next tick while full batches keep arriving
            while (!stopRequested && after.offset() - before.offset() >= settings.batchSize()) {
                before = after;
                after = pollOnce(before);
                cursor.set(after);
            }
        } catch (Exception e) {
            log.error("Acknowledgment poll on {} failed", streamKey, e);
        }
    }

    /**
     * Apply one entry.
     *
     * @return false if processing was abandoned because the consumer is stopping
     */
    private boolean process(StreamEntry entry) {
        AcknowledgmentMessage ack;
        try {
            ack = codec.decodeAck(entry.payload());
        } catch (MalformedMessageException e) {
            metrics.ackMalformed(consumerApplication);
            log.warn("Skipping malformed acknowledgment at {}@{}: {}", streamKey, entry.offset(), e.getMessage());
            return true;
        }

        int attempt = 1;
        while (true) {
            try (LoggingContext ctx = LoggingContext.forEvent(ack.eventId(), ack.tenantId(), null)) {
                AckOutcome outcome = trackingService.applyAcknowledgment(ack, entry.offset());
                metrics.ackApplied(consumerApplication, outcome.name());
                return true;
            } catch (UnknownEventReferenceException e) {
                metrics.ackUnknown(consumerApplication);
                log.warn("Discarding acknowledgment at {}@{}: {}", streamKey, entry.offset(), e.getMessage());
                return true;
            } catch (RuntimeException e) {
                if (!TransientFailures.isTransient(e)) {
                    throw e;
                }
                metrics.ackStoreRetried(consumerApplication);
                long backoffMs = settings.storeRetry().computeBackoff(Math.min(attempt, 32)).toMillis();
                log.warn("Tracking store unavailable applying ack for {} (attempt {}), retrying in {}ms: {}",
                    ack.eventId(), attempt, backoffMs, e.getMessage());
                if (stopRequested || !TransientFailures.pause(backoffMs)) {
                    return false;
                }
                attempt++;
            }
        }
    }
}
