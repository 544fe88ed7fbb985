package com.syncbridge.engine.tracking;

import com.syncbridge.core.exception.UnknownEventReferenceException;
import com.syncbridge.core.model.AcknowledgmentMessage;
import com.syncbridge.core.model.TrackingRecord;
import com.syncbridge.core.model.TrackingStatus;
import com.syncbridge.engine.test.SyncTestHarness;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TrackingServiceTest {

    private SyncTestHarness harness;
    private TrackingService tracking;
    private String eventId;

    @BeforeEach
    void setUp() {
        harness = new SyncTestHarness();
        tracking = harness.trackingService;
        eventId = harness.publisher.publish("credit.allocated", "T1", "Organization", "E1",
            harness.creditAllocated("alloc-1", 100), "billing");
    }

    @Test
    @DisplayName("OK ack acknowledges the event at the ack timestamp")
    void okAck() {
        harness.clock.advanceSeconds(4);
        Instant ackAt = harness.clock.instant();

        AckOutcome outcome = tracking.applyAcknowledgment(AcknowledgmentMessage.ok(eventId, "T1", "crm", ackAt));

        TrackingRecord record = tracking.getEventStatus(eventId).orElseThrow();
        assertThat(outcome).isEqualTo(AckOutcome.ACKNOWLEDGED);
        assertThat(record.status()).isEqualTo(TrackingStatus.ACKNOWLEDGED);
        assertThat(record.acknowledgedAt()).isEqualTo(ackAt);
    }

    @Test
    @DisplayName("Error acks below the budget keep the event PUBLISHED; the budget-th fails it")
    void retryBudgetBoundary() {
        for (int i = 1; i < SyncTestHarness.RETRY_BUDGET; i++) {
            harness.clock.advanceSeconds(1);
            AckOutcome outcome = tracking.applyAcknowledgment(
                AcknowledgmentMessage.error(eventId, "T1", "crm", "timeout " + i, harness.clock.instant()));
            assertThat(outcome).isEqualTo(AckOutcome.RETRY_RECORDED);
            TrackingRecord record = tracking.getEventStatus(eventId).orElseThrow();
            assertThat(record.status()).isEqualTo(TrackingStatus.PUBLISHED);
            assertThat(record.retryCount()).isEqualTo(i);
            assertThat(record.lastError()).isEqualTo("timeout " + i);
        }

        harness.clock.advanceSeconds(1);
        AckOutcome last = tracking.applyAcknowledgment(
            AcknowledgmentMessage.error(eventId, "T1", "crm", "still broken", harness.clock.instant()));

        TrackingRecord record = tracking.getEventStatus(eventId).orElseThrow();
        assertThat(last).isEqualTo(AckOutcome.FAILED);
        assertThat(record.status()).isEqualTo(TrackingStatus.FAILED);
        assertThat(record.retryCount()).isEqualTo(SyncTestHarness.RETRY_BUDGET);
        assertThat(record.lastError()).isEqualTo("still broken");
    }

    @Test
    @DisplayName("Re-applying the ack read at the same ack-stream offset changes nothing")
    void duplicateAckIsNoOp() {
        harness.clock.advanceSeconds(1);
        AcknowledgmentMessage error = AcknowledgmentMessage.error(eventId, "T1", "crm", "boom", harness.clock.instant());

        assertThat(tracking.applyAcknowledgment(error, 1)).isEqualTo(AckOutcome.RETRY_RECORDED);
        TrackingRecord afterFirst = tracking.getEventStatus(eventId).orElseThrow();
        assertThat(tracking.applyAcknowledgment(error, 1)).isEqualTo(AckOutcome.DUPLICATE);

        assertThat(tracking.getEventStatus(eventId).orElseThrow()).isEqualTo(afterFirst);
    }

    @Test
    @DisplayName("Distinct error acks sharing one ack timestamp each count toward the budget")
    void errorAcksWithSameTimestampReachFailed() {
        Instant sameInstant = harness.clock.instant().plusSeconds(5);

        AckOutcome last = null;
        for (int i = 1; i <= SyncTestHarness.RETRY_BUDGET; i++) {
            last = tracking.applyAcknowledgment(
                AcknowledgmentMessage.error(eventId, "T1", "crm", "rejected " + i, sameInstant), i);
        }

        TrackingRecord record = tracking.getEventStatus(eventId).orElseThrow();
        assertThat(last).isEqualTo(AckOutcome.FAILED);
        assertThat(record.status()).isEqualTo(TrackingStatus.FAILED);
        assertThat(record.retryCount()).isEqualTo(SyncTestHarness.RETRY_BUDGET);
    }

    @Test
    @DisplayName("An OK ack stamped earlier than a previous error ack still acknowledges the event")
    void okAckWithEarlierTimestampApplies() {
        Instant publishedAt = tracking.getEventStatus(eventId).orElseThrow().publishedAt();
        tracking.applyAcknowledgment(
            AcknowledgmentMessage.error(eventId, "T1", "crm", "busy", publishedAt.plusSeconds(10)), 1);

        AckOutcome outcome = tracking.applyAcknowledgment(
            AcknowledgmentMessage.ok(eventId, "T1", "crm", publishedAt.plusSeconds(9)), 2);

        TrackingRecord record = tracking.getEventStatus(eventId).orElseThrow();
        assertThat(outcome).isEqualTo(AckOutcome.ACKNOWLEDGED);
        assertThat(record.status()).isEqualTo(TrackingStatus.ACKNOWLEDGED);
        assertThat(record.acknowledgedAt()).isEqualTo(publishedAt.plusSeconds(9));
        assertThat(record.lastAckOffset()).isEqualTo(2);
    }

    @Test
    @DisplayName("Terminal records ignore later acks")
    void terminalIsFinal() {
        harness.clock.advanceSeconds(1);
        Instant okAt = harness.clock.instant();
        tracking.applyAcknowledgment(AcknowledgmentMessage.ok(eventId, "T1", "crm", okAt));
        harness.clock.advanceSeconds(1);

        AckOutcome outcome = tracking.applyAcknowledgment(
            AcknowledgmentMessage.error(eventId, "T1", "crm", "late error", harness.clock.instant()));

        TrackingRecord record = tracking.getEventStatus(eventId).orElseThrow();
        assertThat(outcome).isEqualTo(AckOutcome.DUPLICATE);
        assertThat(record.status()).isEqualTo(TrackingStatus.ACKNOWLEDGED);
        assertThat(record.acknowledgedAt()).isEqualTo(okAt);
        assertThat(record.retryCount()).isZero();
    }

    @Test
    @DisplayName("An ack stamped before publication is clamped to publishedAt")
    void ackBeforePublishClamped() {
        Instant publishedAt = tracking.getEventStatus(eventId).orElseThrow().publishedAt();

        tracking.applyAcknowledgment(AcknowledgmentMessage.ok(eventId, "T1", "crm", publishedAt.minusSeconds(30)));

        assertThat(tracking.getEventStatus(eventId).orElseThrow().acknowledgedAt()).isEqualTo(publishedAt);
    }

    @Test
    @DisplayName("Acks for unknown events, other tenants or other applications are rejected")
    void unknownReferences() {
        Instant now = harness.clock.instant();

        assertThatThrownBy(() -> tracking.applyAcknowledgment(AcknowledgmentMessage.ok("nope", "T1", "crm", now)))
            .isInstanceOf(UnknownEventReferenceException.class);
        assertThatThrownBy(() -> tracking.applyAcknowledgment(AcknowledgmentMessage.ok(eventId, "T2", "crm", now)))
            .isInstanceOf(UnknownEventReferenceException.class);
        assertThatThrownBy(() -> tracking.applyAcknowledgment(AcknowledgmentMessage.ok(eventId, "T1", "erp", now)))
            .isInstanceOf(UnknownEventReferenceException.class);

        assertThat(tracking.getEventStatus(eventId).orElseThrow().status()).isEqualTo(TrackingStatus.PUBLISHED);
    }

    @Test
    @DisplayName("Events without an ack inside the window expire; younger ones stay pending")
    void expireStale() {
        harness.clock.advanceMinutes(50);
        String younger = harness.publisher.publish("credit.allocated", "T1", "Organization", "E2",
            harness.creditAllocated("alloc-2", 1), "billing");
        harness.clock.advanceMinutes(20);

        int expired = tracking.expireStale(Duration.ofHours(1), 100);

        assertThat(expired).isEqualTo(1);
        assertThat(tracking.getEventStatus(eventId).orElseThrow().status()).isEqualTo(TrackingStatus.EXPIRED);
        assertThat(tracking.getEventStatus(younger).orElseThrow().status()).isEqualTo(TrackingStatus.PUBLISHED);
    }

    @Test
    @DisplayName("Unacknowledged listing only returns PUBLISHED events older than the cutoff")
    void unacknowledgedListing() {
        harness.clock.advanceMinutes(30);
        harness.publisher.publish("credit.allocated", "T1", "Organization", "E2",
            harness.creditAllocated("alloc-2", 1), "billing");

        assertThat(tracking.getUnacknowledged("T1", Duration.ofMinutes(10), 10))
            .extracting(TrackingRecord::eventId)
            .containsExactly(eventId);
        assertThat(tracking.getUnacknowledged("T2", Duration.ZERO, 10)).isEmpty();
    }

    @Test
    @DisplayName("Purge removes terminal records past retention and keeps pending ones")
    void purgeTerminal() {
        String pending = harness.publisher.publish("credit.allocated", "T1", "Organization", "E2",
            harness.creditAllocated("alloc-2", 1), "billing");
        tracking.applyAcknowledgment(AcknowledgmentMessage.ok(eventId, "T1", "crm", harness.clock.instant()));
        harness.clock.advance(Duration.ofDays(8));

        int purged = tracking.purgeTerminal(Duration.ofDays(7));

        assertThat(purged).isEqualTo(1);
        assertThat(tracking.getEventStatus(eventId)).isEmpty();
        assertThat(tracking.getEventStatus(pending)).isPresent();
    }
}
