package com.alphix.liquidity.model;

import java.util.Objects;

/**
 * One side of a pool as configured for the depositor.
 */
public record TokenRef(
        String symbol,
        String address,
        int decimals,
        int displayDecimals
) {
    public TokenRef {
        Objects.requireNonNull(symbol, "symbol");
        Objects.requireNonNull(address, "address");
        if (decimals < 0 || decimals > 77) {
            throw new IllegalArgumentException("decimals out of range: " + decimals);
        }
    }

    public boolean sameAddress(final String other) {
        return other != null && address.equalsIgnoreCase(other);
    }

    public boolean sameToken(final TokenRef other) {
        return other != null && sameAddress(other.address);
    }
}
