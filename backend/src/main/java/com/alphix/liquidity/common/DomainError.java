// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.alphix.liquidity.common;

/**
 * Base type for domain-level errors surfaced to the depositor.
 */
public abstract class DomainError {

    private final String code;
    private final String message;
    private final int httpStatus;

    protected DomainError(final String code, final String message, final int httpStatus) {
        this.code = code;
        this.message = message;
        this.httpStatus = httpStatus;
    }

    public String code() {
        return code;
    }

    public String message() {
        return message;
    }

    public int httpStatus() {
        return httpStatus;
    }

    /**
     * True when the error is detected from local input alone, without contacting any collaborator.
     */
    public boolean isLocal() {
        return false;
    }

    @Override
    public String toString() {
        return code + ": " + message;
    }
}
