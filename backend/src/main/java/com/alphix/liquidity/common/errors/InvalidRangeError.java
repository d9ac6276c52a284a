package com.alphix.liquidity.common.errors;

import com.alphix.liquidity.common.DomainError;

/**
 * Tick range rejected before any collaborator is contacted.
 */
public final class InvalidRangeError extends DomainError {

    public InvalidRangeError(final String details) {
        super("INVALID_RANGE", details, 400);
    }

    @Override
    public boolean isLocal() {
        return true;
    }
}
