package com.alphix.liquidity.common;

/**
 * Carries a {@link DomainError} out of a controller so the exception handler can render it.
 */
public class DomainErrorException extends RuntimeException {

    private final DomainError error;

    public DomainErrorException(final DomainError error) {
        super(error.code() + ": " + error.message(), null, false, false);
        this.error = error;
    }

    public DomainError error() {
        return error;
    }
}
