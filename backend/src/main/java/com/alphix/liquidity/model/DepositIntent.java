package com.alphix.liquidity.model;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * What the user wants to deposit. token0/token1 follow the user's order, not the pool's.
 * Amounts are human units; missing amounts are zero. Rebuilt on every edit.
 */
public record DepositIntent(
        TokenRef token0,
        TokenRef token1,
        BigDecimal token0Amount,
        BigDecimal token1Amount,
        TickRange range,
        InputSide activeInputSide
) {
    public DepositIntent {
        Objects.requireNonNull(token0, "token0");
        Objects.requireNonNull(token1, "token1");
        Objects.requireNonNull(range, "range");
        token0Amount = normalize(token0Amount);
        token1Amount = normalize(token1Amount);
        activeInputSide = activeInputSide != null ? activeInputSide : InputSide.TOKEN0;
    }

    public record PrimaryInput(TokenRef token, BigDecimal amount) {}

    public BigDecimal amountOf(final InputSide side) {
        return side == InputSide.TOKEN0 ? token0Amount : token1Amount;
    }

    public TokenRef tokenOf(final InputSide side) {
        return side == InputSide.TOKEN0 ? token0 : token1;
    }

    /**
     * Tokens with a positive amount, in user order.
     */
    public List<TokenRef> involvedTokens() {
        List<TokenRef> tokens = new ArrayList<>(2);
        if (token0Amount.signum() > 0) {
            tokens.add(token0);
        }
        if (token1Amount.signum() > 0) {
            tokens.add(token1);
        }
        return Collections.unmodifiableList(tokens);
    }

    public boolean hasAnyAmount() {
        return token0Amount.signum() > 0 || token1Amount.signum() > 0;
    }

    /**
     * The amount the preparer should size the deposit from: the typed side when positive,
     * otherwise whichever side is positive, otherwise token0.
     */
    public PrimaryInput primaryInput() {
        InputSide active = activeInputSide;
        if (amountOf(active).signum() > 0) {
            return new PrimaryInput(tokenOf(active), amountOf(active));
        }
        InputSide other = active.other();
        if (amountOf(other).signum() > 0) {
            return new PrimaryInput(tokenOf(other), amountOf(other));
        }
        return new PrimaryInput(token0, token0Amount);
    }

    public PoolOrdering ordering() {
        return PoolOrdering.of(token0, token1);
    }

    private static BigDecimal normalize(final BigDecimal amount) {
        if (amount == null || amount.signum() == 0) {
            return BigDecimal.ZERO;
        }
        return amount.stripTrailingZeros();
    }
}
