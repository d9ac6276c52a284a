package com.alphix.liquidity.common.errors;

import com.alphix.liquidity.common.DomainError;

public final class CalculationFailedError extends DomainError {

    public CalculationFailedError(final String details) {
        super("CALCULATION_FAILED", details, 502);
    }
}
