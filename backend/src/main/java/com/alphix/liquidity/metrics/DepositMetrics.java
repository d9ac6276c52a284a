// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.alphix.liquidity.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Metrics collector for deposit orchestration.
 *
 * Provides Micrometer metrics for:
 * - Prepared steps by kind
 * - Confirmed approvals, permits and mints
 * - Failures by step and error code
 * - Callbacks dropped after a reset
 * - Mint confirmation latency
 *
 * CARDINALITY SAFETY:
 * - Tags use step names and error codes, never addresses or tx hashes
 */
@Component
public class DepositMetrics {

    private final MeterRegistry meterRegistry;
    private final Counter approvalsConfirmed;
    private final Counter permitsConfirmed;
    private final Counter depositsCompleted;
    private final Counter zombieCallbacks;
    private final Counter resets;
    private final Timer mintConfirmationTime;
    private final AtomicInteger activeSessions = new AtomicInteger(0);

    public DepositMetrics(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;

        this.approvalsConfirmed = Counter.builder("liquidity.deposit.approval.confirmed")
            .description("ERC20 approvals confirmed on-chain")
            .register(meterRegistry);

        this.permitsConfirmed = Counter.builder("liquidity.deposit.permit.confirmed")
            .description("Permit transactions confirmed on-chain")
            .register(meterRegistry);

        this.depositsCompleted = Counter.builder("liquidity.deposit.completed.total")
            .description("Deposits that reached the done state")
            .register(meterRegistry);

        this.zombieCallbacks = Counter.builder("liquidity.deposit.zombie.dropped")
            .description("Step results discarded because the session was reset while they were in flight")
            .register(meterRegistry);

        this.resets = Counter.builder("liquidity.deposit.reset.total")
            .description("Sessions reset to input")
            .register(meterRegistry);

        this.mintConfirmationTime = Timer.builder("liquidity.deposit.mint.confirmation.time")
            .description("Time from sending the mint transaction to its receipt")
            .register(meterRegistry);

        Gauge.builder("liquidity.deposit.sessions.active", activeSessions, AtomicInteger::get)
            .description("Open deposit sessions")
            .register(meterRegistry);
    }

    /**
     * Record the preparer's answer, tagged by step kind (approve, permit2Sign, mint).
     */
    public void recordPrepared(String step) {
        meterRegistry.counter("liquidity.deposit.prepared.total", "step", step).increment();
    }

    public void recordApprovalConfirmed() {
        approvalsConfirmed.increment();
    }

    /**
     * Record a confirmed permit and how many tokens its signature covered.
     */
    public void recordPermitConfirmed(int tokensCovered) {
        permitsConfirmed.increment();
        meterRegistry.summary("liquidity.deposit.permit.tokens").record(tokensCovered);
    }

    public Timer.Sample startMint() {
        return Timer.start(meterRegistry);
    }

    public void recordDepositCompleted(Timer.Sample sample) {
        depositsCompleted.increment();
        if (sample != null) {
            sample.stop(mintConfirmationTime);
        }
    }

    public void recordFailure(String step, String errorCode) {
        meterRegistry.counter("liquidity.deposit.failed.by_reason",
            "step", step,
            "reason", errorCode == null ? "unknown" : errorCode).increment();
    }

    public void recordZombieDropped() {
        zombieCallbacks.increment();
    }

    public void recordReset() {
        resets.increment();
    }

    /**
     * Record the outcome of a paired-amount calculation (applied, failed, superseded, skipped).
     */
    public void recordCalculation(String outcome) {
        meterRegistry.counter("liquidity.calculation.total", "outcome", outcome).increment();
    }

    public void setActiveSessions(int count) {
        activeSessions.set(count);
    }
}
