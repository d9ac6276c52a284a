package com.alphix.liquidity.util;

import com.alphix.liquidity.common.DomainError;
import com.alphix.liquidity.common.Result;
import com.alphix.liquidity.common.errors.InvalidPriceError;
import com.alphix.liquidity.constants.DepositConstants;
import com.alphix.liquidity.model.PoolOrdering;
import com.alphix.liquidity.model.RoundMode;
import com.alphix.liquidity.model.TokenRef;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.MathContext;

/**
 * Conversions between pool ticks and human prices.
 *
 * All prices are expressed as "one unit of base costs N units of quote". The pool's own
 * coordinate (price = 1.0001^tick) prices canonical0 in canonical1 raw units, so whether the
 * exponent is negated depends only on whether base is canonical0, never on the order the user
 * picked the tokens in.
 *
 * Pure functions, no I/O.
 */
public final class TickPriceMath {

    private static final double LN_10 = Math.log(10.0);
    private static final MathContext MC = MathContext.DECIMAL128;

    private TickPriceMath() {
    }

    /**
     * Display price of {@code base} denominated in {@code quote} at {@code tick}.
     * Returns {@code +Infinity} or {@code 0.0} when the result leaves double range.
     */
    public static double tickToPrice(final int tick,
                                     final TokenRef quote,
                                     final TokenRef base,
                                     final PoolOrdering ordering) {
        int sign = direction(quote, base, ordering);
        double exponent = sign * (double) tick * DepositConstants.LN_TICK_BASE
                + (base.decimals() - quote.decimals()) * LN_10;
        return Math.exp(exponent);
    }

    /**
     * Real-valued inverse of {@link #tickToPrice}. Not rounded and not clamped.
     */
    public static Result<Double, DomainError> priceToTick(final double price,
                                                          final TokenRef quote,
                                                          final TokenRef base,
                                                          final PoolOrdering ordering) {
        if (Double.isNaN(price) || Double.isInfinite(price) || price <= 0.0) {
            return Result.err(new InvalidPriceError("Price must be a positive finite number, got " + price));
        }
        int sign = direction(quote, base, ordering);
        double rawLog = Math.log(price) - (base.decimals() - quote.decimals()) * LN_10;
        return Result.ok(sign * rawLog / DepositConstants.LN_TICK_BASE);
    }

    /**
     * Converts a typed price straight to a usable tick, rounding in {@code mode}.
     */
    public static Result<Integer, DomainError> priceToAlignedTick(final double price,
                                                                  final TokenRef quote,
                                                                  final TokenRef base,
                                                                  final PoolOrdering ordering,
                                                                  final int spacing,
                                                                  final RoundMode mode) {
        return priceToTick(price, quote, base, ordering)
                .map(tick -> alignTickToSpacing(clampToInt(Math.round(tick)), spacing, mode));
    }

    /**
     * Rounds {@code tick} to a multiple of {@code spacing} in the given direction, then clamps it
     * into the usable bounds for that spacing.
     */
    public static int alignTickToSpacing(final int tick, final int spacing, final RoundMode mode) {
        requireSpacing(spacing);
        long aligned = mode == RoundMode.DOWN
                ? Math.floorDiv((long) tick, spacing) * spacing
                : -Math.floorDiv(-(long) tick, spacing) * spacing;
        long min = minUsableTick(spacing);
        long max = maxUsableTick(spacing);
        return (int) Math.max(min, Math.min(max, aligned));
    }

    /**
     * Lowest tick that is a multiple of {@code spacing} and not below the pool minimum.
     */
    public static int minUsableTick(final int spacing) {
        requireSpacing(spacing);
        return -(DepositConstants.MAX_TICK / spacing) * spacing;
    }

    public static int maxUsableTick(final int spacing) {
        requireSpacing(spacing);
        return (DepositConstants.MAX_TICK / spacing) * spacing;
    }

    public static boolean isUsable(final int tick, final int spacing) {
        return tick % spacing == 0 && tick >= minUsableTick(spacing) && tick <= maxUsableTick(spacing);
    }

    /**
     * Exact price of {@code base} in {@code quote} from a pool's Q64.96 square-root price.
     */
    public static Result<BigDecimal, DomainError> sqrtPriceX96ToPrice(final BigInteger sqrtPriceX96,
                                                                      final TokenRef quote,
                                                                      final TokenRef base,
                                                                      final PoolOrdering ordering) {
        if (sqrtPriceX96 == null || sqrtPriceX96.signum() <= 0) {
            return Result.err(new InvalidPriceError("sqrtPriceX96 must be positive"));
        }
        BigDecimal numerator = new BigDecimal(sqrtPriceX96.multiply(sqrtPriceX96));
        BigDecimal denominator = new BigDecimal(DepositConstants.Q96.multiply(DepositConstants.Q96));
        // canonical0 priced in canonical1, human units
        BigDecimal canonicalPrice = numerator.divide(denominator, MC)
                .scaleByPowerOfTen(ordering.canonical0().decimals() - ordering.canonical1().decimals());
        if (direction(quote, base, ordering) > 0) {
            return Result.ok(canonicalPrice);
        }
        return Result.ok(BigDecimal.ONE.divide(canonicalPrice, MC));
    }

    static int clampToInt(final long value) {
        return (int) Math.max(Integer.MIN_VALUE, Math.min(Integer.MAX_VALUE, value));
    }

    private static int direction(final TokenRef quote, final TokenRef base, final PoolOrdering ordering) {
        if (!ordering.contains(quote) || !ordering.contains(base) || quote.sameToken(base)) {
            throw new IllegalArgumentException("quote and base must be the two pool tokens");
        }
        return ordering.isCanonical0(base) ? 1 : -1;
    }

    private static void requireSpacing(final int spacing) {
        if (spacing <= 0) {
            throw new IllegalArgumentException("tick spacing must be positive, got " + spacing);
        }
    }
}
