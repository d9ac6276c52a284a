package com.alphix.liquidity.wallet;

import com.fasterxml.jackson.databind.JsonNode;

import java.math.BigInteger;
import java.util.concurrent.CompletableFuture;

/**
 * Used when no wallet is configured. Has no account, so every deposit step is refused up front.
 */
public class DisconnectedWalletSigner implements WalletSigner {

    @Override
    public String account() {
        return null;
    }

    @Override
    public CompletableFuture<Long> chainId() {
        return notConnected();
    }

    @Override
    public CompletableFuture<String> approve(String tokenAddress, String spender, BigInteger amount) {
        return notConnected();
    }

    @Override
    public CompletableFuture<String> signTypedData(JsonNode typedData) {
        return notConnected();
    }

    @Override
    public CompletableFuture<String> sendTransaction(String to, String data, BigInteger value) {
        return notConnected();
    }

    @Override
    public CompletableFuture<ReceiptStatus> waitForReceipt(String txHash) {
        return notConnected();
    }

    private static <T> CompletableFuture<T> notConnected() {
        return CompletableFuture.failedFuture(new IllegalStateException("No wallet configured"));
    }
}
