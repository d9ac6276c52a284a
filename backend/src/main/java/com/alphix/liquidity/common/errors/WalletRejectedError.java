package com.alphix.liquidity.common.errors;

import com.alphix.liquidity.common.DomainError;

public final class WalletRejectedError extends DomainError {

    public WalletRejectedError(final String details) {
        super("WALLET_REJECTED", details, 409);
    }
}
