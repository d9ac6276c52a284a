package com.alphix.liquidity.common.errors;

import com.alphix.liquidity.common.DomainError;

public final class PreparationFailedError extends DomainError {

    public PreparationFailedError(final String details) {
        super("PREPARATION_FAILED", details, 502);
    }
}
