package com.syncbridge.core.payload;

import java.math.BigDecimal;

/**
 * {@code credit.config_updated}: the credit cost of an operation changed.
 */
public record CreditConfigUpdatedPayload(
    String operationCode,
    BigDecimal creditCost,
    String scope
) implements EventPayload {

    @Override
    public void validate() {
        EventPayload.require(EventPayload.present(operationCode), "credit.config_updated requires operationCode");
        EventPayload.require(creditCost != null && creditCost.signum() >= 0,
            "credit.config_updated requires a non-negative creditCost");
    }
}
