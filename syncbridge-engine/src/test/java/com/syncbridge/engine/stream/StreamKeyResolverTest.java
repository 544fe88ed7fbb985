package com.syncbridge.engine.stream;

import com.syncbridge.core.exception.MalformedMessageException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class StreamKeyResolverTest {

    private final StreamKeyResolver resolver = new StreamKeyResolver();

    @Test
    @DisplayName("Event types downstream consumers already read keep their established streams")
    void establishedRoutes() {
        assertThat(resolver.eventStreamKey("crm", "credit.allocated")).isEqualTo("crm:sync:credits:credit_allocated");
        assertThat(resolver.eventStreamKey("crm", "credit.config_updated"))
            .isEqualTo("crm:sync:credits:credit_config_updated");
        assertThat(resolver.eventStreamKey("crm", "organization.created")).isEqualTo("crm:sync:organization:org_created");
        assertThat(resolver.eventStreamKey("crm", "role.assigned")).isEqualTo("crm:sync:permissions:role_assigned");
        assertThat(resolver.eventStreamKey("crm", "role.unassigned")).isEqualTo("crm:sync:permissions:role_unassigned");
        assertThat(resolver.eventStreamKey("crm", "role.updated")).isEqualTo("crm:sync:role:role_updated");
        assertThat(resolver.eventStreamKey("erp", "user.created")).isEqualTo("erp:sync:user:user_created");
    }

    @Test
    @DisplayName("Other event types derive their stream from prefix and subtype")
    void derivedRoutes() {
        assertThat(resolver.eventStreamKey("erp", "role.permission.granted"))
            .isEqualTo("erp:sync:role:role_permission_granted");
        assertThat(resolver.eventStreamKey("crm", "invoice.paid")).isEqualTo("crm:sync:invoice:invoice_paid");
    }

    @Test
    @DisplayName("Ack streams are per application")
    void ackStreamKey() {
        assertThat(resolver.ackStreamKey("crm")).isEqualTo("crm:sync:ack");
        assertThat(resolver.isAckStream("crm:sync:ack")).isTrue();
        assertThat(resolver.isAckStream("crm:sync:credits:credit_allocated")).isFalse();
    }

    @Test
    @DisplayName("Undotted event types and segments containing ':' are rejected")
    void rejectsBadSegments() {
        assertThatThrownBy(() -> resolver.eventStreamKey("crm", "allocated"))
            .isInstanceOf(MalformedMessageException.class);
        assertThatThrownBy(() -> resolver.eventStreamKey("crm", "credit."))
            .isInstanceOf(MalformedMessageException.class);
        assertThatThrownBy(() -> resolver.ackStreamKey("crm:eu"))
            .isInstanceOf(MalformedMessageException.class);
    }
}
