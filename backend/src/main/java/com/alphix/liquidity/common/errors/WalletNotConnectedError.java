package com.alphix.liquidity.common.errors;

import com.alphix.liquidity.common.DomainError;

public final class WalletNotConnectedError extends DomainError {

    public WalletNotConnectedError(final String details) {
        super("WALLET_NOT_CONNECTED", details, 412);
    }
}
