package com.syncbridge.core.payload;

import java.math.BigDecimal;

/**
 * {@code credit.allocated}: credits granted to an entity.
 */
public record CreditAllocatedPayload(
    String allocationId,
    BigDecimal amount,
    String reason
) implements EventPayload {

    @Override
    public void validate() {
        EventPayload.require(amount != null, "credit.allocated requires amount");
        EventPayload.require(amount.signum() > 0, "credit.allocated amount must be positive");
    }
}
