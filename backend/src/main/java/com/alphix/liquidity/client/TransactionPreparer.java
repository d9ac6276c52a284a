// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.alphix.liquidity.client;

import com.alphix.liquidity.model.DepositIntent;
import com.alphix.liquidity.model.PreparedStep;

import java.util.concurrent.CompletableFuture;

/**
 * Answers "what is the next step for this deposit" given current chain state. Safe to call
 * repeatedly with the same intent.
 */
public interface TransactionPreparer {

    /**
     * @param tokenJustProcessed symbol of the token whose approval or permit just landed, or null
     */
    record PrepareRequest(DepositIntent intent, String owner, long chainId, String tokenJustProcessed) {}

    CompletableFuture<PreparedStep> prepare(PrepareRequest request);
}
