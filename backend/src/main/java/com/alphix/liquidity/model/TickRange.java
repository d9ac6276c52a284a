// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.alphix.liquidity.model;

import com.alphix.liquidity.common.DomainError;
import com.alphix.liquidity.common.Result;
import com.alphix.liquidity.common.errors.InvalidRangeError;
import com.alphix.liquidity.util.TickPriceMath;

/**
 * Half-open position bounds in ticks. Replaced wholesale, never mutated.
 */
public record TickRange(int lower, int upper) {

    public TickRange {
        if (lower >= upper) {
            throw new IllegalArgumentException("lower must be below upper: " + lower + " >= " + upper);
        }
    }

    /**
     * Validates a user-supplied pair against the pool's usable bounds for {@code spacing}.
     */
    public static Result<TickRange, DomainError> of(final int lower, final int upper, final int spacing) {
        if (lower >= upper) {
            return Result.err(new InvalidRangeError("Invalid tick range: lower " + lower + " >= upper " + upper));
        }
        int min = TickPriceMath.minUsableTick(spacing);
        int max = TickPriceMath.maxUsableTick(spacing);
        if (lower < min || upper > max) {
            return Result.err(new InvalidRangeError(
                    "Tick range [" + lower + ", " + upper + "] outside pool bounds [" + min + ", " + max + "]"));
        }
        if (lower % spacing != 0 || upper % spacing != 0) {
            return Result.err(new InvalidRangeError(
                    "Ticks must be multiples of spacing " + spacing + ": [" + lower + ", " + upper + "]"));
        }
        if (upper - lower < spacing) {
            return Result.err(new InvalidRangeError("Tick range narrower than one spacing unit"));
        }
        return Result.ok(new TickRange(lower, upper));
    }

    public static TickRange fullRange(final int spacing) {
        return new TickRange(TickPriceMath.minUsableTick(spacing), TickPriceMath.maxUsableTick(spacing));
    }

    public boolean isFullRange(final int spacing) {
        return lower <= TickPriceMath.minUsableTick(spacing) && upper >= TickPriceMath.maxUsableTick(spacing);
    }

    /**
     * True when the pool price sits inside the range, i.e. both tokens are needed.
     */
    public boolean isActiveAt(final int currentTick) {
        return currentTick >= lower && currentTick <= upper;
    }
}
