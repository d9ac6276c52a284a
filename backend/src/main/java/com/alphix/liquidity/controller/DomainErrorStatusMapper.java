package com.alphix.liquidity.controller;

import com.alphix.liquidity.common.DomainError;
import com.alphix.liquidity.common.errors.NetworkMismatchError;
import com.alphix.liquidity.common.errors.RangeTooNarrowError;
import com.alphix.liquidity.common.errors.StepInProgressError;
import com.alphix.liquidity.common.errors.StepOutOfOrderError;
import com.alphix.liquidity.common.errors.ValidationError;
import com.alphix.liquidity.common.errors.WalletNotConnectedError;
import com.alphix.liquidity.common.errors.WalletRejectedError;
import org.springframework.http.HttpStatus;

/**
 * Centralizes DomainError -> HttpStatus mapping so all controllers respond consistently.
 */
final class DomainErrorStatusMapper {

    private DomainErrorStatusMapper() {
    }

    static HttpStatus map(final DomainError error) {
        if (error instanceof ValidationError validationError) {
            return validationError.type() == ValidationError.Type.NOT_FOUND
                    ? HttpStatus.NOT_FOUND
                    : HttpStatus.BAD_REQUEST;
        }
        if (error instanceof StepInProgressError
                || error instanceof StepOutOfOrderError
                || error instanceof WalletRejectedError) {
            return HttpStatus.CONFLICT;
        }
        if (error instanceof NetworkMismatchError || error instanceof WalletNotConnectedError) {
            return HttpStatus.PRECONDITION_FAILED;
        }
        if (error instanceof RangeTooNarrowError) {
            return HttpStatus.UNPROCESSABLE_ENTITY;
        }
        HttpStatus derived = HttpStatus.resolve(error.httpStatus());
        return derived != null ? derived : HttpStatus.INTERNAL_SERVER_ERROR;
    }
}
