// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.alphix.liquidity.service;

import com.alphix.liquidity.client.LiquidityCalculator;
import com.alphix.liquidity.client.LiquidityCalculator.CalculationRequest;
import com.alphix.liquidity.client.LiquidityCalculator.LiquidityQuote;
import com.alphix.liquidity.common.DomainError;
import com.alphix.liquidity.common.Result;
import com.alphix.liquidity.common.errors.CalculationFailedError;
import com.alphix.liquidity.common.errors.InvalidRangeError;
import com.alphix.liquidity.config.DepositProperties;
import com.alphix.liquidity.constants.DepositConstants;
import com.alphix.liquidity.metrics.DepositMetrics;
import com.alphix.liquidity.model.InputSide;
import com.alphix.liquidity.model.TickRange;
import com.alphix.liquidity.model.TokenRef;
import com.alphix.liquidity.util.Amounts;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Debounced paired-amount lookup.
 *
 * Each key (one per deposit form) keeps only its latest request. A request waits for the quiet
 * period; a newer request for the same key supersedes it. A result that comes back after its
 * request stopped being current is discarded rather than applied. A key is forgotten once its
 * latest request resolves.
 */
@Service
public class AmountCalculationService {

    private static final Logger logger = LoggerFactory.getLogger(AmountCalculationService.class);

    public enum Status {
        APPLIED,
        FAILED,
        SUPERSEDED,
        SKIPPED
    }

    /**
     * One snapshot of the deposit form. Amounts are the raw typed strings.
     */
    public record CalculationInput(
            TokenRef token0,
            TokenRef token1,
            String amount0,
            String amount1,
            Integer tickLower,
            Integer tickUpper,
            InputSide inputSide,
            Integer currentPoolTick
    ) {}

    /**
     * dependentAmount is the human amount for the side the user did not type; null when cleared.
     */
    public record CalculationOutcome(
            Status status,
            CalculationInput input,
            LiquidityQuote quote,
            BigDecimal dependentAmount,
            DomainError error
    ) {
        static CalculationOutcome applied(CalculationInput input, LiquidityQuote quote, BigDecimal dependent) {
            return new CalculationOutcome(Status.APPLIED, input, quote, dependent, null);
        }

        static CalculationOutcome failed(CalculationInput input, DomainError error) {
            return new CalculationOutcome(Status.FAILED, input, null, null, error);
        }

        static CalculationOutcome skipped(CalculationInput input) {
            return new CalculationOutcome(Status.SKIPPED, input, null, null, null);
        }

        static CalculationOutcome superseded(CalculationInput input) {
            return new CalculationOutcome(Status.SUPERSEDED, input, null, null, null);
        }
    }

    private record Pending(CalculationInput input, ScheduledFuture<?> timer, CompletableFuture<CalculationOutcome> result) {}

    private final LiquidityCalculator calculator;
    private final DepositMetrics metrics;
    private final ScheduledExecutorService scheduler;
    private final long debounceMs;
    private final long chainId;
    private final Map<String, Pending> pending = new ConcurrentHashMap<>();
    private final Map<String, CompletableFuture<CalculationOutcome>> latest = new ConcurrentHashMap<>();

    @Autowired
    public AmountCalculationService(final LiquidityCalculator calculator,
                                    final DepositProperties properties,
                                    final DepositMetrics metrics) {
        this(calculator, metrics, Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "amount-debounce");
            thread.setDaemon(true);
            return thread;
        }), properties.getDebounceMs(), properties.getChainId());
    }

    AmountCalculationService(final LiquidityCalculator calculator,
                             final DepositMetrics metrics,
                             final ScheduledExecutorService scheduler,
                             final long debounceMs,
                             final long chainId) {
        this.calculator = calculator;
        this.metrics = metrics;
        this.scheduler = scheduler;
        this.debounceMs = debounceMs;
        this.chainId = chainId;
    }

    /**
     * Schedules a calculation for {@code key} after the quiet period, superseding any request for
     * the same key that has not fired yet.
     */
    public CompletableFuture<CalculationOutcome> request(final String key, final CalculationInput input) {
        CompletableFuture<CalculationOutcome> result = new CompletableFuture<>();
        latest.put(key, result);
        ScheduledFuture<?> timer = scheduler.schedule(() -> fire(key, input, result), debounceMs, TimeUnit.MILLISECONDS);
        Pending previous = pending.put(key, new Pending(input, timer, result));
        if (previous != null && previous.timer().cancel(false)) {
            complete(previous.result(), CalculationOutcome.superseded(previous.input()));
        }
        return result;
    }

    /**
     * Forgets {@code key}; anything in flight for it is discarded on arrival.
     */
    public void clear(final String key) {
        latest.remove(key);
        Pending previous = pending.remove(key);
        if (previous != null && previous.timer().cancel(false)) {
            complete(previous.result(), CalculationOutcome.superseded(previous.input()));
        }
    }

    private void fire(final String key, final CalculationInput input, final CompletableFuture<CalculationOutcome> result) {
        pending.computeIfPresent(key, (k, p) -> p.result() == result ? null : p);
        calculate(input).whenComplete((outcome, ex) -> {
            CalculationOutcome resolved = ex == null ? outcome
                    : CalculationOutcome.failed(input, new CalculationFailedError(unwrap(ex).getMessage()));
            if (latest.get(key) != result) {
                logger.debug("Discarding calculation for {}: input changed while it was in flight", key);
                resolved = CalculationOutcome.superseded(input);
            }
            latest.remove(key, result);
            complete(result, resolved);
        });
    }

    /**
     * Runs the calculation immediately, without debouncing.
     */
    public CompletableFuture<CalculationOutcome> calculate(final CalculationInput input) {
        if (input.tickLower() == null || input.tickUpper() == null || input.tickLower() >= input.tickUpper()) {
            return CompletableFuture.completedFuture(
                    CalculationOutcome.failed(input, new InvalidRangeError("Invalid tick range")));
        }
        InputSide side = input.inputSide() != null ? input.inputSide() : InputSide.TOKEN0;
        TokenRef primaryToken = side == InputSide.TOKEN0 ? input.token0() : input.token1();
        TokenRef dependentToken = side == InputSide.TOKEN0 ? input.token1() : input.token0();
        Result<BigDecimal, DomainError> parsed = Amounts.parse(side == InputSide.TOKEN0 ? input.amount0() : input.amount1());
        if (parsed.isErr() || parsed.getValueUnsafe().signum() <= 0) {
            return CompletableFuture.completedFuture(CalculationOutcome.skipped(input));
        }
        BigInteger primaryRaw = Amounts.toRawUnits(parsed.getValueUnsafe(), primaryToken.decimals());

        Integer currentTick = input.currentPoolTick();
        if (currentTick != null && !new TickRange(input.tickLower(), input.tickUpper()).isActiveAt(currentTick)) {
            // out of range: the position holds only one token
            LiquidityQuote oneSided = new LiquidityQuote(BigInteger.ZERO, input.tickLower(), input.tickUpper(),
                    side == InputSide.TOKEN0 ? primaryRaw : BigInteger.ZERO,
                    side == InputSide.TOKEN1 ? primaryRaw : BigInteger.ZERO,
                    currentTick, null, null, null);
            return CompletableFuture.completedFuture(CalculationOutcome.applied(input, oneSided, BigDecimal.ZERO));
        }

        CalculationRequest request = new CalculationRequest(input.token0(), input.token1(), primaryRaw,
                primaryToken.symbol(), input.tickLower(), input.tickUpper(), chainId);
        CompletableFuture<LiquidityQuote> call;
        try {
            call = calculator.calculate(request);
            if (call == null) {
                call = CompletableFuture.failedFuture(new IllegalStateException("Calculator returned no result"));
            }
        } catch (RuntimeException e) {
            call = CompletableFuture.failedFuture(e);
        }
        return call.handle((quote, ex) -> {
            if (ex != null) {
                String message = unwrap(ex).getMessage();
                logger.warn("Liquidity calculation failed for {}/{}: {}", input.token0().symbol(),
                        input.token1().symbol(), message);
                return CalculationOutcome.failed(input, new CalculationFailedError(
                        message != null ? message : "Calculation failed"));
            }
            BigInteger dependentRaw = side == InputSide.TOKEN0 ? quote.amount1() : quote.amount0();
            return CalculationOutcome.applied(input, quote, dependentAmount(dependentRaw, dependentToken));
        });
    }

    int trackedKeys() {
        return latest.size();
    }

    static BigDecimal dependentAmount(final BigInteger raw, final TokenRef token) {
        if (raw == null || raw.compareTo(DepositConstants.DEPENDENT_AMOUNT_SENTINEL) >= 0) {
            return BigDecimal.ZERO;
        }
        return Amounts.fromRawUnits(raw, token.decimals());
    }

    private void complete(final CompletableFuture<CalculationOutcome> result, final CalculationOutcome outcome) {
        if (result.complete(outcome)) {
            metrics.recordCalculation(outcome.status().name().toLowerCase());
        }
    }

    private static Throwable unwrap(final Throwable ex) {
        return ex instanceof CompletionException && ex.getCause() != null ? ex.getCause() : ex;
    }

    @PreDestroy
    public void shutdown() {
        scheduler.shutdownNow();
    }
}
