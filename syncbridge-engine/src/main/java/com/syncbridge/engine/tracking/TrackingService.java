package com.syncbridge.engine.tracking;

import com.syncbridge.core.exception.OptimisticLockException;
import com.syncbridge.core.exception.UnknownEventReferenceException;
import com.syncbridge.core.model.AckResult;
import com.syncbridge.core.model.AcknowledgmentMessage;
import com.syncbridge.core.model.TrackingRecord;
import com.syncbridge.core.model.TrackingStatus;
import com.syncbridge.core.repository.TrackingRepository;
import com.syncbridge.engine.metrics.SyncMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Applies acknowledgments to tracking records and runs the time-based lifecycle sweeps.
 *
 * Every transition is a compare-and-swap on the record version. Losing a race re-reads
 * the record and re-evaluates, so an acknowledgment is applied at most once.
 */
public class TrackingService {

    private static final Logger log = LoggerFactory.getLogger(TrackingService.class);
    private static final int MAX_CAS_ATTEMPTS = 5;

    private final TrackingRepository repository;
    private final int retryBudget;
    private final SyncMetrics metrics;
    private final Clock clock;

    public TrackingService(TrackingRepository repository, int retryBudget, SyncMetrics metrics, Clock clock) {
        if (retryBudget < 1) {
            throw new IllegalArgumentException("retryBudget must be >= 1");
        }
        this.repository = repository;
        this.retryBudget = retryBudget;
        this.metrics = metrics;
        this.clock = clock;
    }

    public Optional<TrackingRecord> getEventStatus(String eventId) {
        return repository.findById(eventId);
    }

    /**
     * Apply an acknowledgment that was not read from an ack stream.
     */
    public AckOutcome applyAcknowledgment(AcknowledgmentMessage ack) {
        return applyAcknowledgment(ack, TrackingRecord.NO_ACK_OFFSET);
    }

    /**
     * Apply one acknowledgment read at the given offset of the consumer application's ack stream.
     * Re-reading the same entry after a crash is recognised by its offset, not by the sender's clock.
     *
     * @throws UnknownEventReferenceException if no record matches the event, tenant and application
     */
    public AckOutcome applyAcknowledgment(AcknowledgmentMessage ack, long ackOffset) {
        OptimisticLockException lastConflict = null;
        for (int attempt = 1; attempt <= MAX_CAS_ATTEMPTS; attempt++) {
            TrackingRecord record = repository.findById(ack.eventId())
                .orElseThrow(() -> new UnknownEventReferenceException(ack.eventId(), "no tracking record"));
            if (!record.tenantId().equals(ack.tenantId())) {
                throw new UnknownEventReferenceException(ack.eventId(),
                    "tenant " + ack.tenantId() + " does not own the event");
            }
            if (!record.targetApplication().equals(ack.consumerApplication())) {
                throw new UnknownEventReferenceException(ack.eventId(),
                    "event was not delivered to " + ack.consumerApplication());
            }
            if (record.status().isTerminal() || record.isReplayedAck(ackOffset)) {
                log.debug("Ignoring duplicate ack for {} at offset {} (status {}, lastAckOffset {})",
                    ack.eventId(), ackOffset, record.status(), record.lastAckOffset());
                return AckOutcome.DUPLICATE;
            }

            TrackingRecord updated = ack.result() == AckResult.OK
                ? record.withAcknowledged(ack.ackTimestamp(), ackOffset)
                : record.withErrorAck(ack.errorDetail(), ack.ackTimestamp(), ackOffset, retryBudget);

            try {
                repository.update(updated);
            } catch (OptimisticLockException e) {
                log.debug("Concurrent update of {} on attempt {}, re-reading", ack.eventId(), attempt);
                lastConflict = e;
                continue;
            }

            AckOutcome outcome = outcomeOf(updated);
            if (outcome == AckOutcome.FAILED) {
                log.warn("Event {} failed after {} error acks: {}",
                    ack.eventId(), updated.retryCount(), updated.lastError());
            } else {
                log.info("Applied {} ack for event {} -> {}", ack.result(), ack.eventId(), updated.status());
            }
            return outcome;
        }
        throw lastConflict;
    }

    /**
     * Expire PUBLISHED records whose ack window has elapsed.
     *
     * @return Number of records expired
     */
    public int expireStale(Duration ackWindow, int batchSize) {
        Instant now = clock.instant();
        List<TrackingRecord> stale = repository.findPublishedBefore(now.minus(ackWindow), batchSize);
        int expired = 0;
        for (TrackingRecord record : stale) {
            try {
                repository.update(record.withExpired(now));
                expired++;
            } catch (OptimisticLockException e) {
                log.debug("Record {} changed while expiring, skipping", record.eventId());
            }
        }
        if (expired > 0) {
            metrics.eventsExpired(expired);
            log.info("Expired {} unacknowledged events older than {}", expired, ackWindow);
        }
        return expired;
    }

    /**
     * PUBLISHED records of a tenant older than the given age, oldest first.
     */
    public List<TrackingRecord> getUnacknowledged(String tenantId, Duration olderThan, int limit) {
        return repository.findUnacknowledged(tenantId, clock.instant().minus(olderThan), limit);
    }

    /**
     * Delete terminal records published longer ago than the retention.
     *
     * @return Number of records deleted
     */
    public int purgeTerminal(Duration retention) {
        int purged = repository.deleteTerminalBefore(clock.instant().minus(retention));
        if (purged > 0) {
            metrics.eventsPurged(purged);
            log.info("Purged {} terminal tracking records older than {}", purged, retention);
        }
        return purged;
    }

    public int getRetryBudget() {
        return retryBudget;
    }

    private static AckOutcome outcomeOf(TrackingRecord updated) {
        if (updated.status() == TrackingStatus.ACKNOWLEDGED) {
            return AckOutcome.ACKNOWLEDGED;
        }
        return updated.status() == TrackingStatus.FAILED ? AckOutcome.FAILED : AckOutcome.RETRY_RECORDED;
    }
}
