package com.alphix.liquidity.common.errors;

import com.alphix.liquidity.common.DomainError;

public final class TransactionRevertedError extends DomainError {

    private final String txHash;

    public TransactionRevertedError(final String details, final String txHash) {
        super("TRANSACTION_REVERTED", details, 422);
        this.txHash = txHash;
    }

    public String txHash() {
        return txHash;
    }
}
