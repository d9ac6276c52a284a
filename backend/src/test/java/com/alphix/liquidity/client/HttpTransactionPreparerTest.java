// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.alphix.liquidity.client;

import com.alphix.liquidity.client.TransactionPreparer.PrepareRequest;
import com.alphix.liquidity.config.DepositProperties;
import com.alphix.liquidity.model.DepositIntent;
import com.alphix.liquidity.model.InputSide;
import com.alphix.liquidity.model.PreparedStep;
import com.alphix.liquidity.model.TickRange;
import com.alphix.liquidity.model.TokenRef;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class HttpTransactionPreparerTest {

    private static final TokenRef WETH = new TokenRef("WETH", "0x4200000000000000000000000000000000000006", 18, 4);
    private static final TokenRef USDC = new TokenRef("USDC", "0x036CbD53842c5426634e7929541eC2318f3dCF7e", 6, 2);

    @Mock
    private HttpClient httpClient;

    @Mock
    private HttpResponse<String> response;

    private HttpTransactionPreparer preparer;

    @BeforeEach
    void setUp() {
        DepositProperties properties = new DepositProperties();
        properties.getPrepareApi().setBaseUrl("http://api.test/");
        preparer = new HttpTransactionPreparer(httpClient, new ObjectMapper(), properties, new PreparedStepParser());
    }

    @Test
    void testPostsToPrepareEndpoint() {
        when(response.statusCode()).thenReturn(200);
        when(response.body()).thenReturn("""
            {"needsApproval": false, "transaction": {"to": "0x00000000000000000000000000000000000000bb", "data": "0x01"}}
            """);
        doReturn(CompletableFuture.completedFuture(response)).when(httpClient).sendAsync(any(), any());

        PreparedStep step = preparer.prepare(request()).join();

        assertThat(step).isInstanceOf(PreparedStep.ReadyToMint.class);
        ArgumentCaptor<HttpRequest> sent = ArgumentCaptor.forClass(HttpRequest.class);
        verify(httpClient).sendAsync(sent.capture(), any());
        assertThat(sent.getValue().uri().toString()).isEqualTo("http://api.test/api/liquidity/prepare-mint-tx");
        assertThat(sent.getValue().method()).isEqualTo("POST");
    }

    @Test
    void testErrorStatusFailsWithServerMessage() {
        when(response.statusCode()).thenReturn(500);
        when(response.body()).thenReturn("{\"message\": \"Pool not initialized\"}");
        doReturn(CompletableFuture.completedFuture(response)).when(httpClient).sendAsync(any(), any());

        assertThatThrownBy(() -> preparer.prepare(request()).join())
            .isInstanceOf(CompletionException.class)
            .hasCauseInstanceOf(CollaboratorException.class)
            .hasMessageContaining("Pool not initialized");
    }

    private static PrepareRequest request() {
        DepositIntent intent = new DepositIntent(WETH, USDC, new BigDecimal("0.5"), null, new TickRange(-600, 600),
            InputSide.TOKEN0);
        return new PrepareRequest(intent, "0x00000000000000000000000000000000000000aa", 84532L, null);
    }
}
