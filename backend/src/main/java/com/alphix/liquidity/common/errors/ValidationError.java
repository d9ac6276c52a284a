package com.alphix.liquidity.common.errors;

import com.alphix.liquidity.common.DomainError;

public final class ValidationError extends DomainError {

    public enum Type {
        REQUEST,
        NOT_FOUND
    }

    private final Type type;

    public ValidationError(final String details) {
        this(details, Type.REQUEST);
    }

    public ValidationError(final String details, final Type type) {
        super("VALIDATION_ERROR", details, type == Type.NOT_FOUND ? 404 : 400);
        this.type = type;
    }

    public Type type() {
        return type;
    }

    @Override
    public boolean isLocal() {
        return true;
    }
}
