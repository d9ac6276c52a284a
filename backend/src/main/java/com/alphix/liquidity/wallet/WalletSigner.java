// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.alphix.liquidity.wallet;

import com.fasterxml.jackson.databind.JsonNode;

import java.math.BigInteger;
import java.util.concurrent.CompletableFuture;

/**
 * Signing and sending capability of the connected wallet. Every call may be declined by the
 * user, in which case the future fails with {@link WalletRejectedException}.
 */
public interface WalletSigner {

    enum ReceiptStatus {
        CONFIRMED,
        REVERTED
    }

    /**
     * Address of the connected account, or null when no wallet is connected.
     */
    String account();

    CompletableFuture<Long> chainId();

    CompletableFuture<String> approve(String tokenAddress, String spender, BigInteger amount);

    /**
     * Signs EIP-712 typed data ({@code domain, types, primaryType, message}) and returns the
     * 65-byte signature as hex.
     */
    CompletableFuture<String> signTypedData(JsonNode typedData);

    CompletableFuture<String> sendTransaction(String to, String data, BigInteger value);

    CompletableFuture<ReceiptStatus> waitForReceipt(String txHash);
}
