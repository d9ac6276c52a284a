// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.alphix.liquidity.service;

import com.alphix.liquidity.client.LiquidityCalculator;
import com.alphix.liquidity.client.LiquidityCalculator.CalculationRequest;
import com.alphix.liquidity.client.LiquidityCalculator.LiquidityQuote;
import com.alphix.liquidity.constants.DepositConstants;
import com.alphix.liquidity.metrics.DepositMetrics;
import com.alphix.liquidity.model.InputSide;
import com.alphix.liquidity.model.TokenRef;
import com.alphix.liquidity.service.AmountCalculationService.CalculationInput;
import com.alphix.liquidity.service.AmountCalculationService.CalculationOutcome;
import com.alphix.liquidity.service.AmountCalculationService.Status;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class AmountCalculationServiceTest {

    private static final TokenRef WETH = new TokenRef("WETH", "0x0000000000000000000000000000000000000001", 18, 4);
    private static final TokenRef USDC = new TokenRef("USDC", "0x0000000000000000000000000000000000000002", 6, 2);

    @Mock
    private LiquidityCalculator calculator;

    private ScheduledExecutorService scheduler;
    private SimpleMeterRegistry registry;
    private AmountCalculationService service;

    @BeforeEach
    void setUp() {
        scheduler = Executors.newSingleThreadScheduledExecutor();
        registry = new SimpleMeterRegistry();
        service = new AmountCalculationService(calculator, new DepositMetrics(registry), scheduler, 50, 84532L);
    }

    @AfterEach
    void tearDown() {
        scheduler.shutdownNow();
    }

    @Test
    @DisplayName("Typed token0 amount is sent in raw units and token1 comes back as the dependent amount")
    void testAppliesDependentAmount() {
        when(calculator.calculate(any())).thenReturn(quote(BigInteger.TEN.pow(18), BigInteger.valueOf(2_000_500_000L)));

        CalculationOutcome outcome = service.calculate(input("1", null, InputSide.TOKEN0, 0)).join();

        assertThat(outcome.status()).isEqualTo(Status.APPLIED);
        assertThat(outcome.dependentAmount()).isEqualByComparingTo("2000.5");
        ArgumentCaptor<CalculationRequest> request = ArgumentCaptor.forClass(CalculationRequest.class);
        verify(calculator).calculate(request.capture());
        assertThat(request.getValue().inputAmount()).isEqualTo(BigInteger.TEN.pow(18));
        assertThat(request.getValue().inputTokenSymbol()).isEqualTo("WETH");
        assertThat(request.getValue().chainId()).isEqualTo(84532L);
    }

    @Test
    @DisplayName("Out-of-range position is one-sided without asking the calculator")
    void testOutOfRangeSkipsCalculator() {
        CalculationOutcome outcome = service.calculate(input(null, "500", InputSide.TOKEN1, 5000)).join();

        assertThat(outcome.status()).isEqualTo(Status.APPLIED);
        assertThat(outcome.dependentAmount()).isEqualByComparingTo("0");
        assertThat(outcome.quote().amount1()).isEqualTo(BigInteger.valueOf(500_000_000L));
        verify(calculator, never()).calculate(any());
    }

    @Test
    void testInvalidRangeFails() {
        CalculationInput inverted = new CalculationInput(WETH, USDC, "1", null, 600, -600, InputSide.TOKEN0, 0);

        CalculationOutcome outcome = service.calculate(inverted).join();

        assertThat(outcome.status()).isEqualTo(Status.FAILED);
        assertThat(outcome.error().code()).isEqualTo("INVALID_RANGE");
    }

    @Test
    void testBlankAmountIsSkipped() {
        assertThat(service.calculate(input("", null, InputSide.TOKEN0, 0)).join().status()).isEqualTo(Status.SKIPPED);
        assertThat(service.calculate(input("abc", null, InputSide.TOKEN0, 0)).join().status()).isEqualTo(Status.SKIPPED);
    }

    @Test
    @DisplayName("Calculator error clears the dependent amount")
    void testCalculatorFailure() {
        when(calculator.calculate(any())).thenReturn(CompletableFuture.failedFuture(new RuntimeException("pool not found")));

        CalculationOutcome outcome = service.calculate(input("1", null, InputSide.TOKEN0, 0)).join();

        assertThat(outcome.status()).isEqualTo(Status.FAILED);
        assertThat(outcome.error().code()).isEqualTo("CALCULATION_FAILED");
        assertThat(outcome.error().message()).contains("pool not found");
        assertThat(outcome.dependentAmount()).isNull();
    }

    @Test
    @DisplayName("Dependent amount at the max-uint sentinel is treated as zero")
    void testSentinelDependentAmount() {
        when(calculator.calculate(any())).thenReturn(quote(BigInteger.TEN.pow(18), DepositConstants.MAX_UINT256));

        CalculationOutcome outcome = service.calculate(input("1", null, InputSide.TOKEN0, 0)).join();

        assertThat(outcome.dependentAmount()).isEqualByComparingTo("0");
    }

    @Test
    @DisplayName("Newer input within the quiet period supersedes the older one")
    void testDebounceSupersedes() {
        when(calculator.calculate(any())).thenReturn(quote(BigInteger.TEN.pow(18), BigInteger.valueOf(4_000_000_000L)));

        CompletableFuture<CalculationOutcome> first = service.request("form", input("1", null, InputSide.TOKEN0, 0));
        CompletableFuture<CalculationOutcome> second = service.request("form", input("2", null, InputSide.TOKEN0, 0));

        assertThat(first.join().status()).isEqualTo(Status.SUPERSEDED);
        assertThat(second.orTimeout(2, TimeUnit.SECONDS).join().status()).isEqualTo(Status.APPLIED);
        verify(calculator, times(1)).calculate(any());
    }

    @Test
    @DisplayName("Result for an input that changed while in flight is discarded")
    void testStaleResultDiscarded() {
        CompletableFuture<LiquidityQuote> slow = new CompletableFuture<>();
        when(calculator.calculate(any())).thenReturn(slow, quote(BigInteger.TEN.pow(18), BigInteger.ONE));

        CompletableFuture<CalculationOutcome> first = service.request("form", input("1", null, InputSide.TOKEN0, 0));
        verify(calculator, timeout(2000)).calculate(any());
        CompletableFuture<CalculationOutcome> second = service.request("form", input("3", null, InputSide.TOKEN0, 0));
        slow.complete(quote(BigInteger.TEN.pow(18), BigInteger.valueOf(2_000_000_000L)).join());

        assertThat(first.orTimeout(2, TimeUnit.SECONDS).join().status()).isEqualTo(Status.SUPERSEDED);
        assertThat(second.orTimeout(2, TimeUnit.SECONDS).join().status()).isEqualTo(Status.APPLIED);
    }

    @Test
    @DisplayName("Keys are released once their latest request resolves")
    void testResolvedKeysAreReleased() {
        when(calculator.calculate(any())).thenReturn(quote(BigInteger.TEN.pow(18), BigInteger.ONE));

        List<CompletableFuture<CalculationOutcome>> results = new ArrayList<>();
        for (int i = 0; i < 50; i++) {
            results.add(service.request("form-" + i, input("1", null, InputSide.TOKEN0, 0)));
        }
        results.forEach(result -> assertThat(result.orTimeout(2, TimeUnit.SECONDS).join().status())
            .isEqualTo(Status.APPLIED));

        assertThat(service.trackedKeys()).isZero();
    }

    @Test
    void testClearSupersedesPending() {
        CompletableFuture<CalculationOutcome> pending = service.request("form", input("1", null, InputSide.TOKEN0, 0));

        service.clear("form");

        assertThat(pending.join().status()).isEqualTo(Status.SUPERSEDED);
        assertThat(registry.counter("liquidity.calculation.total", "outcome", "superseded").count()).isEqualTo(1.0);
    }

    private static CalculationInput input(String amount0, String amount1, InputSide side, Integer currentTick) {
        return new CalculationInput(WETH, USDC, amount0, amount1, -600, 600, side, currentTick);
    }

    private static CompletableFuture<LiquidityQuote> quote(BigInteger amount0, BigInteger amount1) {
        return CompletableFuture.completedFuture(
            new LiquidityQuote(BigInteger.valueOf(123456), -600, 600, amount0, amount1, 0, "2000", "1882", "2123"));
    }
}
