package com.alphix.liquidity.common.errors;

import com.alphix.liquidity.common.DomainError;

public final class StepInProgressError extends DomainError {

    public StepInProgressError(final String details) {
        super("STEP_IN_PROGRESS", details, 409);
    }
}
