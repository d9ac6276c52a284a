package com.alphix.liquidity.common.errors;

import com.alphix.liquidity.common.DomainError;

public final class InvalidPriceError extends DomainError {

    public InvalidPriceError(final String details) {
        super("INVALID_PRICE", details, 400);
    }

    @Override
    public boolean isLocal() {
        return true;
    }
}
