package com.syncbridge.core.payload;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.syncbridge.core.exception.MalformedMessageException;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.assertj.core.api.Assertions.*;

class PayloadRegistryTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final PayloadRegistry registry = PayloadRegistry.withDefaults(objectMapper);

    private JsonNode json(String text) throws Exception {
        return objectMapper.readTree(text);
    }

    @Test
    void decodesCreditAllocationAndIgnoresUnknownFields() throws Exception {
        EventPayload payload = registry.decode("credit.allocated",
            json("{\"amount\": 100, \"reason\": \"onboarding\", \"futureField\": true}"));

        assertThat(payload).isInstanceOf(CreditAllocatedPayload.class);
        CreditAllocatedPayload credit = (CreditAllocatedPayload) payload;
        assertThat(credit.amount()).isEqualByComparingTo(BigDecimal.valueOf(100));
        assertThat(credit.reason()).isEqualTo("onboarding");
    }

    @Test
    void rejectsNonPositiveCreditAmount() throws Exception {
        assertThatThrownBy(() -> registry.decode("credit.allocated", json("{\"amount\": 0}")))
            .isInstanceOf(MalformedMessageException.class)
            .hasMessageContaining("positive");
    }

    @Test
    void rejectsMissingRequiredField() throws Exception {
        assertThatThrownBy(() -> registry.decode("role.updated", json("{\"roleName\": \"Admin\"}")))
            .isInstanceOf(MalformedMessageException.class)
            .hasMessageContaining("roleId");
    }

    @Test
    void rejectsWrongShape() throws Exception {
        assertThatThrownBy(() -> registry.decode("user.created", json("[1, 2]")))
            .isInstanceOf(MalformedMessageException.class);
        assertThatThrownBy(() -> registry.decode("credit.allocated", json("{\"amount\": \"lots\"}")))
            .isInstanceOf(MalformedMessageException.class);
        assertThatThrownBy(() -> registry.decode("organization.created", null))
            .isInstanceOf(MalformedMessageException.class);
    }

    @Test
    void unknownEventTypesPassThroughOpaque() throws Exception {
        JsonNode data = json("{\"anything\": 1}");

        EventPayload payload = registry.decode("invoice.paid", data);

        assertThat(payload).isEqualTo(new OpaquePayload(data));
        assertThat(registry.isKnown("invoice.paid")).isFalse();
    }

    @Test
    void typedDecodeChecksTheSchema() throws Exception {
        RolePayload role = registry.decode("role.permissions_changed",
            json("{\"roleId\": \"r-1\", \"permissions\": [\"crm.read\"]}"), RolePayload.class);

        assertThat(role.permissions()).containsExactly("crm.read");
        assertThatThrownBy(() -> registry.decode("role.assigned",
                json("{\"userId\": \"u\", \"roleId\": \"r\"}"), RolePayload.class))
            .isInstanceOf(MalformedMessageException.class);
    }
}
