// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.alphix.liquidity.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.Map;

/**
 * Session view returned after every step. Only the fields of the current step are set.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record DepositSessionResponse(
        String sessionId,
        String step,
        boolean working,
        Map<String, Boolean> tokenCompletionStatus,
        int involvedCount,
        int completedCount,
        Approval approval,
        Permit permit,
        Transaction transaction,
        String txHash
) {
    public record Approval(String tokenSymbol, String tokenAddress, String spender, String amount) {}

    public record Permit(String tokenSymbol, String permit2Address, JsonNode typedData) {}

    public record Transaction(String to, String data, String value) {}
}
