package com.alphix.liquidity.common.errors;

import com.alphix.liquidity.common.DomainError;

public final class NetworkMismatchError extends DomainError {

    private final long expectedChainId;
    private final long actualChainId;

    public NetworkMismatchError(final long expectedChainId, final long actualChainId) {
        super("NETWORK_MISMATCH",
                "Wallet is connected to chain " + actualChainId + ", expected chain " + expectedChainId,
                412);
        this.expectedChainId = expectedChainId;
        this.actualChainId = actualChainId;
    }

    public long expectedChainId() {
        return expectedChainId;
    }

    public long actualChainId() {
        return actualChainId;
    }
}
