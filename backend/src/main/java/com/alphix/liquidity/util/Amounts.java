package com.alphix.liquidity.util;

import com.alphix.liquidity.common.DomainError;
import com.alphix.liquidity.common.Result;
import com.alphix.liquidity.common.errors.ValidationError;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.RoundingMode;

/**
 * Parsing and unit conversion for user-typed token amounts.
 */
public final class Amounts {

    private Amounts() {
    }

    /**
     * Accepts "1,5", "1.5", "1e-3" and display placeholders such as "..."; blank means zero.
     */
    public static Result<BigDecimal, DomainError> parse(final String raw) {
        if (raw == null) {
            return Result.ok(BigDecimal.ZERO);
        }
        String cleaned = raw.trim().replace("...", "").replace(',', '.');
        if (cleaned.isEmpty() || ".".equals(cleaned)) {
            return Result.ok(BigDecimal.ZERO);
        }
        BigDecimal value;
        try {
            value = new BigDecimal(cleaned);
        } catch (NumberFormatException e) {
            return Result.err(new ValidationError("Not a number: " + raw));
        }
        if (value.signum() < 0) {
            return Result.err(new ValidationError("Amount must not be negative: " + raw));
        }
        return Result.ok(value.signum() == 0 ? BigDecimal.ZERO : value.stripTrailingZeros());
    }

    /**
     * Human amount to integer token units. Digits beyond {@code decimals} are truncated.
     */
    public static BigInteger toRawUnits(final BigDecimal amount, final int decimals) {
        return amount.movePointRight(decimals).setScale(0, RoundingMode.DOWN).toBigIntegerExact();
    }

    public static BigDecimal fromRawUnits(final BigInteger raw, final int decimals) {
        BigDecimal value = new BigDecimal(raw).movePointLeft(decimals);
        return value.signum() == 0 ? BigDecimal.ZERO : value.stripTrailingZeros();
    }

    /**
     * Fixed-point string for the wire: never scientific notation.
     */
    public static String toPlainString(final BigDecimal amount) {
        return amount == null ? "0" : amount.toPlainString();
    }
}
