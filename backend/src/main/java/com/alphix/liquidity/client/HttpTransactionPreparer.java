// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.alphix.liquidity.client;

import com.alphix.liquidity.config.DepositProperties;
import com.alphix.liquidity.model.DepositIntent;
import com.alphix.liquidity.model.PreparedStep;
import com.alphix.liquidity.util.Amounts;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.springframework.stereotype.Service;

import java.net.http.HttpClient;
import java.util.concurrent.CompletableFuture;

@Service
public class HttpTransactionPreparer extends JsonApiClient implements TransactionPreparer {

    static final String PATH = "/api/liquidity/prepare-mint-tx";

    private final PreparedStepParser parser;

    public HttpTransactionPreparer(final HttpClient httpClient,
                                   final ObjectMapper mapper,
                                   final DepositProperties properties,
                                   final PreparedStepParser parser) {
        super(httpClient, mapper, properties);
        this.parser = parser;
    }

    @Override
    public CompletableFuture<PreparedStep> prepare(final PrepareRequest request) {
        DepositIntent intent = request.intent();
        DepositIntent.PrimaryInput primary = intent.primaryInput();
        ObjectNode body = mapper.createObjectNode()
                .put("userAddress", request.owner())
                .put("token0Symbol", intent.token0().symbol())
                .put("token1Symbol", intent.token1().symbol())
                .put("inputAmount", Amounts.toPlainString(primary.amount()))
                .put("inputTokenSymbol", primary.token().symbol())
                .put("userTickLower", intent.range().lower())
                .put("userTickUpper", intent.range().upper())
                .put("chainId", request.chainId());
        if (request.tokenJustProcessed() != null) {
            body.put("tokenJustProcessed", request.tokenJustProcessed());
        }
        return post(PATH, body).thenApply(root -> parser.parse(root, intent));
    }
}
