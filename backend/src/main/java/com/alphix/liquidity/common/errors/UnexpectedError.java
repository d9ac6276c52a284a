package com.alphix.liquidity.common.errors;

import com.alphix.liquidity.common.DomainError;

public final class UnexpectedError extends DomainError {

    public UnexpectedError(final String details) {
        super("UNEXPECTED_ERROR", details, 500);
    }
}
