package com.alphix.liquidity.common.errors;

import com.alphix.liquidity.common.DomainError;

/**
 * Aligned range collapsed below one tick-spacing unit. Callers must not apply it.
 */
public final class RangeTooNarrowError extends DomainError {

    private final int tickSpacing;

    public RangeTooNarrowError(final String details, final int tickSpacing) {
        super("RANGE_TOO_NARROW", details, 422);
        this.tickSpacing = tickSpacing;
    }

    public int tickSpacing() {
        return tickSpacing;
    }

    @Override
    public boolean isLocal() {
        return true;
    }
}
