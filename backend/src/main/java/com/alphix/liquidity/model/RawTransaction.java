package com.alphix.liquidity.model;

import java.math.BigInteger;

/**
 * Call to submit as-is: target, ABI-encoded calldata, native value in wei.
 */
public record RawTransaction(String to, String data, BigInteger value) {

    public RawTransaction {
        value = value != null ? value : BigInteger.ZERO;
    }
}
