// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.alphix.liquidity.dto;

import com.alphix.liquidity.common.DomainError;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;

/**
 * Error body returned by every endpoint.
 *
 * <pre>
 * {
 *   "error": "RANGE_TOO_NARROW",
 *   "message": "Range of ±0.001% is narrower than one tick spacing (200)",
 *   "timestamp": "2025-10-19T10:15:30Z",
 *   "path": "/api/liquidity/range-presets",
 *   "status": 422,
 *   "local": true
 * }
 * </pre>
 *
 * {@code local} tells the client the request can be fixed without retrying against the wallet
 * or a collaborator; it is absent for errors that did not come from the deposit taxonomy.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ErrorResponse(
        String error,
        String message,
        String timestamp,
        String path,
        int status,
        Boolean local,
        String requestId,
        Object details
) {

    public static ErrorResponse of(DomainError domainError, int status, String path, String requestId) {
        return new ErrorResponse(domainError.code(), domainError.message(), Instant.now().toString(), path, status,
            domainError.isLocal(), requestId, null);
    }

    public static ErrorResponse of(String error, String message, int status, String path) {
        return new ErrorResponse(error, message, Instant.now().toString(), path, status, null, null, null);
    }

    public ErrorResponse withDetails(Object details) {
        return new ErrorResponse(error, message, timestamp, path, status, local, requestId, details);
    }
}
