// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.alphix.liquidity.model;

import org.web3j.utils.Numeric;

import java.math.BigInteger;

/**
 * Pool-level identity of the two tokens. canonical0 has the lower address; a tick's raw price
 * is canonical0 priced in canonical1.
 */
public record PoolOrdering(TokenRef canonical0, TokenRef canonical1) {

    public static PoolOrdering of(final TokenRef a, final TokenRef b) {
        BigInteger addressA = Numeric.toBigInt(a.address());
        BigInteger addressB = Numeric.toBigInt(b.address());
        int cmp = addressA.compareTo(addressB);
        if (cmp == 0) {
            throw new IllegalArgumentException("Pool tokens must differ: " + a.address());
        }
        return cmp < 0 ? new PoolOrdering(a, b) : new PoolOrdering(b, a);
    }

    public boolean isCanonical0(final TokenRef token) {
        return canonical0.sameToken(token);
    }

    public boolean contains(final TokenRef token) {
        return canonical0.sameToken(token) || canonical1.sameToken(token);
    }
}
