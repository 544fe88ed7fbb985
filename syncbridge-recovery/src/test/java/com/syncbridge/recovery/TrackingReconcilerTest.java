package com.syncbridge.recovery;

import com.syncbridge.core.model.AcknowledgmentMessage;
import com.syncbridge.core.model.EventEnvelope;
import com.syncbridge.core.model.StreamCursor;
import com.syncbridge.core.model.TrackingRecord;
import com.syncbridge.core.model.TrackingStatus;
import com.syncbridge.engine.test.SyncTestHarness;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class TrackingReconcilerTest {

    private static final String STREAM = "crm:sync:credits:credit_allocated";

    private SyncTestHarness harness;
    private TrackingReconciler reconciler;

    @BeforeEach
    void setUp() {
        harness = new SyncTestHarness();
        reconciler = new TrackingReconciler(harness.transport, harness.cursorRepository,
            harness.trackingRepository, harness.codec, harness.payloadRegistry, harness.keyResolver, harness.clock);
    }

    @Test
    @DisplayName("An event appended without a tracking record gets a PUBLISHED record")
    void restoresMissingRecord() {
        EventEnvelope envelope = EventEnvelope.create("credit.allocated", "T1", "Organization", "E1",
            harness.creditAllocated("a-1", 100), "billing", harness.clock.instant());
        long offset = harness.transport.append(STREAM, harness.codec.encodeEnvelope(envelope));

        assertThat(reconciler.reconcileApplication("crm", 10)).isEqualTo(1);

        TrackingRecord record = harness.trackingRepository.findById(envelope.eventId()).orElseThrow();
        assertThat(record.status()).isEqualTo(TrackingStatus.PUBLISHED);
        assertThat(record.targetApplication()).isEqualTo("crm");
        assertThat(record.streamKey()).isEqualTo(STREAM);
        assertThat(record.streamOffset()).isEqualTo(offset);
        assertThat(record.publishedAt()).isEqualTo(envelope.timestamp());
    }

    @Test
    @DisplayName("Existing records keep their state and reruns create nothing")
    void existingRecordsUntouched() {
        String eventId = harness.publisher.publish("credit.allocated", "T1", "Organization", "E1",
            harness.creditAllocated("a-1", 100), "billing");
        harness.trackingService.applyAcknowledgment(
            AcknowledgmentMessage.ok(eventId, "T1", "crm", harness.clock.instant()));
        harness.publisher.publish("credit.allocated", "T1", "Organization", "E2",
            harness.creditAllocated("a-2", 5), "billing");

        assertThat(reconciler.reconcile("crm", STREAM, 1)).isZero();
        assertThat(reconciler.reconcile("crm", STREAM, 1)).isZero();

        assertThat(harness.trackingRepository.findById(eventId).orElseThrow().status())
            .isEqualTo(TrackingStatus.ACKNOWLEDGED);
        assertThat(harness.cursorRepository.find(STREAM, TrackingReconciler.CONSUMER_NAME))
            .map(StreamCursor::offset)
            .hasValue(2L);
    }

    @Test
    @DisplayName("Ack streams and undecodable entries are skipped")
    void skipsAckStreamAndGarbage() {
        harness.appendAck(AcknowledgmentMessage.ok("e-1", "T1", "crm", harness.clock.instant()));
        harness.transport.append(STREAM, "{garbage");

        assertThat(reconciler.reconcileApplication("crm", 10)).isZero();
        assertThat(harness.cursorRepository.find(STREAM, TrackingReconciler.CONSUMER_NAME))
            .map(StreamCursor::offset)
            .hasValue(1L);
        assertThat(harness.cursorRepository.find(harness.keyResolver.ackStreamKey("crm"),
            TrackingReconciler.CONSUMER_NAME)).isEmpty();
    }

    @Test
    @DisplayName("Entries whose payload fails its schema are skipped and the cursor moves past them")
    void skipsInvalidPayload() {
        EventEnvelope invalid = EventEnvelope.create("credit.allocated", "T1", "Organization", "E1",
            harness.creditAllocated("a-1", 0), "billing", harness.clock.instant());
        EventEnvelope valid = EventEnvelope.create("credit.allocated", "T1", "Organization", "E2",
            harness.creditAllocated("a-2", 10), "billing", harness.clock.instant());
        harness.transport.append(STREAM, harness.codec.encodeEnvelope(invalid));
        harness.transport.append(STREAM, harness.codec.encodeEnvelope(valid));

        assertThat(reconciler.reconcile("crm", STREAM, 10)).isEqualTo(1);

        assertThat(harness.trackingRepository.findById(invalid.eventId())).isEmpty();
        assertThat(harness.trackingRepository.findById(valid.eventId())).isPresent();
        assertThat(harness.cursorRepository.find(STREAM, TrackingReconciler.CONSUMER_NAME))
            .map(StreamCursor::offset)
            .hasValue(2L);
    }
}
