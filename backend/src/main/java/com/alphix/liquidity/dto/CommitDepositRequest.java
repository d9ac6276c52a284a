// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.alphix.liquidity.dto;

import jakarta.validation.constraints.NotNull;

/**
 * CommitDepositRequest - amounts as typed by the user plus the chosen tick range.
 *
 * Amounts are strings so that "1,5" and "1e-3" reach the parser untouched; a blank amount means
 * that side is not deposited.
 */
public class CommitDepositRequest {
    public String token0Amount;

    public String token1Amount;

    @NotNull(message = "tickLower is required")
    public Integer tickLower;

    @NotNull(message = "tickUpper is required")
    public Integer tickUpper;

    public String activeInputSide;

    // Default constructor for Jackson
    public CommitDepositRequest() {}

    public CommitDepositRequest(String token0Amount, String token1Amount, Integer tickLower, Integer tickUpper,
                                String activeInputSide) {
        this.token0Amount = token0Amount;
        this.token1Amount = token1Amount;
        this.tickLower = tickLower;
        this.tickUpper = tickUpper;
        this.activeInputSide = activeInputSide;
    }
}
