package com.alphix.liquidity.common.errors;

import com.alphix.liquidity.common.DomainError;

public final class StepOutOfOrderError extends DomainError {

    public StepOutOfOrderError(final String details) {
        super("STEP_OUT_OF_ORDER", details, 409);
    }
}
