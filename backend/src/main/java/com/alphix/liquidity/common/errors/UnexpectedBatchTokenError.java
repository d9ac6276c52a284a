package com.alphix.liquidity.common.errors;

import com.alphix.liquidity.common.DomainError;

/**
 * A batch permit names a token address that is not part of the deposit.
 */
public final class UnexpectedBatchTokenError extends DomainError {

    private final String tokenAddress;

    public UnexpectedBatchTokenError(final String tokenAddress) {
        super("UNEXPECTED_BATCH_TOKEN", "Permit batch references token " + tokenAddress
                + " which is not part of this deposit", 422);
        this.tokenAddress = tokenAddress;
    }

    public String tokenAddress() {
        return tokenAddress;
    }
}
