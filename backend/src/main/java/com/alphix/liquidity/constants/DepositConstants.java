// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.alphix.liquidity.constants;

import java.math.BigInteger;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Centralized constants for tick math, range presets and deposit orchestration.
 */
public final class DepositConstants {

    private DepositConstants() {
        // Prevent instantiation
    }

    // ========================================
    // TICK BOUNDS
    // ========================================

    /**
     * Lowest tick representable by a concentrated-liquidity pool.
     */
    public static final int MIN_TICK = -887272;

    /**
     * Highest tick representable by a concentrated-liquidity pool.
     */
    public static final int MAX_TICK = 887272;

    /**
     * Base of the tick coordinate: price = 1.0001^tick.
     */
    public static final double TICK_BASE = 1.0001;

    public static final double LN_TICK_BASE = Math.log(TICK_BASE);

    /**
     * 2^96, fixed-point scale of sqrtPriceX96.
     */
    public static final BigInteger Q96 = BigInteger.ONE.shiftLeft(96);

    // ========================================
    // RANGE PRESETS
    // ========================================

    public static final String PRESET_FULL_RANGE = "Full Range";

    /**
     * Named percentage presets, widest first.
     */
    public static final Map<String, Double> PRESET_PERCENTAGES;

    static {
        Map<String, Double> presets = new LinkedHashMap<>();
        presets.put("±15%", 0.15);
        presets.put("±8%", 0.08);
        presets.put("±3%", 0.03);
        presets.put("±1%", 0.01);
        presets.put("±0.5%", 0.005);
        presets.put("±0.1%", 0.001);
        PRESET_PERCENTAGES = Collections.unmodifiableMap(presets);
    }

    // ========================================
    // AUTHORIZATION
    // ========================================

    /**
     * Canonical Permit2 deployment address (same on every chain).
     */
    public static final String PERMIT2_ADDRESS = "0x000000000022D473030F116dDEE9F6B43aC78BA3";

    public static final String APPROVAL_TYPE_ERC20 = "ERC20_TO_PERMIT2";

    public static final String APPROVAL_TYPE_PERMIT2 = "PERMIT2_SIGNATURE_FOR_PM";

    /**
     * JSON-RPC error code a wallet returns when the user declines a request.
     */
    public static final int USER_REJECTED_CODE = 4001;

    // ========================================
    // AMOUNTS
    // ========================================

    public static final BigInteger MAX_UINT256 = BigInteger.ONE.shiftLeft(256).subtract(BigInteger.ONE);

    /**
     * Calculator answers at or above this value are sentinels for "no amount needed".
     */
    public static final BigInteger DEPENDENT_AMOUNT_SENTINEL = MAX_UINT256.shiftRight(1);

    /**
     * Default quiet period before a paired-amount calculation is issued.
     */
    public static final long DEFAULT_DEBOUNCE_MS = 700;
}
