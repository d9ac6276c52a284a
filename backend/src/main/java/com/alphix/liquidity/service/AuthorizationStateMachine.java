// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.alphix.liquidity.service;

import com.alphix.liquidity.client.TransactionPreparer;
import com.alphix.liquidity.common.DomainError;
import com.alphix.liquidity.common.Result;
import com.alphix.liquidity.common.errors.NetworkMismatchError;
import com.alphix.liquidity.common.errors.PreparationFailedError;
import com.alphix.liquidity.common.errors.StepInProgressError;
import com.alphix.liquidity.common.errors.StepOutOfOrderError;
import com.alphix.liquidity.common.errors.TransactionRevertedError;
import com.alphix.liquidity.common.errors.UnexpectedBatchTokenError;
import com.alphix.liquidity.common.errors.UnexpectedError;
import com.alphix.liquidity.common.errors.ValidationError;
import com.alphix.liquidity.common.errors.WalletNotConnectedError;
import com.alphix.liquidity.common.errors.WalletRejectedError;
import com.alphix.liquidity.metrics.DepositMetrics;
import com.alphix.liquidity.model.DepositIntent;
import com.alphix.liquidity.model.DepositState;
import com.alphix.liquidity.model.PreparedStep;
import com.alphix.liquidity.model.TickRange;
import com.alphix.liquidity.model.TokenRef;
import com.alphix.liquidity.wallet.PermitCallEncoder;
import com.alphix.liquidity.wallet.WalletRejectedException;
import com.alphix.liquidity.wallet.WalletSigner;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.function.Supplier;
import java.util.function.UnaryOperator;

/**
 * Step sequencer for one deposit session: input, approve*, permit2Sign?, mint, done.
 *
 * The machine never plans the full sequence. After every confirmed wallet action it asks the
 * {@link TransactionPreparer} again, naming the token just processed, and branches on the answer.
 *
 * Concurrency:
 * - At most one step is in flight; a second call gets {@link StepInProgressError}.
 * - {@link #reset()} bumps a generation counter. Any callback from an earlier generation is
 *   dropped without touching state or ledger.
 * - Every operation completes with a {@link Result}; its future never completes exceptionally.
 */
public class AuthorizationStateMachine {

    private static final Logger logger = LoggerFactory.getLogger(AuthorizationStateMachine.class);

    private static final String STEP_PREPARE = "prepare";
    private static final String STEP_APPROVE = "approve";
    private static final String STEP_PERMIT = "permit2Sign";
    private static final String STEP_MINT = "mint";

    /**
     * Consistent view of the session at one instant.
     */
    public record Snapshot(DepositState state, DepositIntent intent, CompletionLedger ledger, boolean working) {}

    private enum OnFailure {
        STAY,
        RETURN_TO_INPUT
    }

    private static final class StepFailure extends RuntimeException {
        private final DomainError error;
        private final OnFailure onFailure;

        StepFailure(final DomainError error, final OnFailure onFailure) {
            super(error.message(), null, false, false);
            this.error = error;
            this.onFailure = onFailure;
        }
    }

    private static final class Detached extends RuntimeException {
        Detached() {
            super("step detached by reset", null, false, false);
        }
    }

    private record Ticket(long generation, DepositState state, String step) {}

    private final String sessionId;
    private final TransactionPreparer preparer;
    private final WalletSigner signer;
    private final PermitCallEncoder permitEncoder;
    private final DepositMetrics metrics;
    private final DepositEventListener listener;
    private final long expectedChainId;
    private final int tickSpacing;

    private final Object lock = new Object();
    private DepositState state = DepositState.input();
    private DepositIntent intent;
    private CompletionLedger ledger = CompletionLedger.empty();
    private long generation;
    private boolean working;

    public AuthorizationStateMachine(final String sessionId,
                                     final TransactionPreparer preparer,
                                     final WalletSigner signer,
                                     final PermitCallEncoder permitEncoder,
                                     final DepositMetrics metrics,
                                     final DepositEventListener listener,
                                     final long expectedChainId,
                                     final int tickSpacing) {
        this.sessionId = sessionId;
        this.preparer = preparer;
        this.signer = signer;
        this.permitEncoder = permitEncoder;
        this.metrics = metrics;
        this.listener = listener != null ? listener : DepositEventListener.NONE;
        this.expectedChainId = expectedChainId;
        this.tickSpacing = tickSpacing;
    }

    public String sessionId() {
        return sessionId;
    }

    public Snapshot snapshot() {
        synchronized (lock) {
            return new Snapshot(state, intent, ledger, working);
        }
    }

    public DepositState state() {
        synchronized (lock) {
            return state;
        }
    }

    public CompletionLedger ledger() {
        synchronized (lock) {
            return ledger;
        }
    }

    public boolean isWorking() {
        synchronized (lock) {
            return working;
        }
    }

    // ========================================
    // OPERATIONS
    // ========================================

    /**
     * Validates {@code newIntent} locally, then asks the preparer for the first step. A session
     * outside Input is reset first so no stale payload survives a changed intent.
     */
    public CompletableFuture<Result<DepositState, DomainError>> commit(final DepositIntent newIntent) {
        DomainError invalid = validate(newIntent);
        if (invalid != null) {
            logger.warn("[session={}] Rejected intent: {}", sessionId, invalid.message());
            return completed(Result.err(invalid));
        }
        final Ticket ticket;
        final DepositState before;
        final boolean wasReset;
        synchronized (lock) {
            if (working && newIntent.equals(intent)) {
                return completed(Result.err(new StepInProgressError("A step is already in progress for this deposit")));
            }
            before = state;
            wasReset = !(state instanceof DepositState.Input) || working;
            if (wasReset) {
                resetLocked();
            }
            intent = newIntent;
            ledger = CompletionLedger.forIntent(newIntent);
            working = true;
            ticket = new Ticket(generation, state, STEP_PREPARE);
        }
        if (wasReset) {
            logger.info("[session={}] Intent replaced while in {}, reset to input", sessionId, before.name());
            metrics.recordReset();
            if (!(before instanceof DepositState.Input)) {
                listener.onStateChanged(sessionId, before, DepositState.input());
            }
        }
        logger.info("[session={}] Committing deposit of {} {} / {} {} in [{}, {}]", sessionId,
                newIntent.token0Amount().toPlainString(), newIntent.token0().symbol(),
                newIntent.token1Amount().toPlainString(), newIntent.token1().symbol(),
                newIntent.range().lower(), newIntent.range().upper());
        return prepareNext(ticket, newIntent, null)
                .handle((result, ex) -> ex == null ? result : recover(ticket, ex));
    }

    /**
     * Sends the pending ERC20 approval, waits for it, then re-prepares naming the approved token.
     */
    public CompletableFuture<Result<DepositState, DomainError>> confirmApproval() {
        Result<Ticket, DomainError> begun = begin(DepositState.Approving.class, STEP_APPROVE);
        if (begun.isErr()) {
            return completed(Result.err(begun.getErrorUnsafe()));
        }
        final Ticket ticket = begun.getValueUnsafe();
        final DepositState.Approving approving = (DepositState.Approving) ticket.state();
        final PreparedStep.NeedsErc20Approval approval = approving.approval();
        logger.info("[session={}] Approving {} for spender {}", sessionId, approval.token().symbol(), approval.spender());

        return ensureNetwork()
                .thenCompose(ignored -> sendAndConfirm(ticket,
                        () -> signer.approve(approval.token().address(), approval.spender(), approval.amount()),
                        OnFailure.RETURN_TO_INPUT))
                .thenCompose(txHash -> {
                    ensureAttached(ticket);
                    metrics.recordApprovalConfirmed();
                    logger.info("[session={}] Approval confirmed for {} tx={}", sessionId, approval.token().symbol(), txHash);
                    return prepareNext(ticket, approving.intent(), approval.token().symbol());
                })
                .handle((result, ex) -> ex == null ? result : recover(ticket, ex));
    }

    /**
     * Signs the pending permit, submits it to Permit2, waits, marks every covered token complete
     * in one update, then re-prepares.
     */
    public CompletableFuture<Result<DepositState, DomainError>> signAndSubmit() {
        Result<Ticket, DomainError> begun = begin(DepositState.PermitSigning.class, STEP_PERMIT);
        if (begun.isErr()) {
            return completed(Result.err(begun.getErrorUnsafe()));
        }
        final Ticket ticket = begun.getValueUnsafe();
        final DepositState.PermitSigning signing = (DepositState.PermitSigning) ticket.state();
        final PreparedStep.NeedsPermitSignature permit = signing.permit();
        final String owner = signer.account();

        return ensureNetwork()
                .thenCompose(ignored -> call(() -> signer.signTypedData(permit.typedData())))
                .thenCompose(signature -> {
                    ensureAttached(ticket);
                    String data = permitEncoder.encode(owner, permit.message(), signature);
                    return sendAndConfirm(ticket,
                            () -> signer.sendTransaction(permit.permit2Address(), data, BigInteger.ZERO),
                            OnFailure.RETURN_TO_INPUT);
                })
                .thenCompose(txHash -> {
                    List<TokenRef> covered = coveredTokens(permit, signing.intent());
                    List<String> symbols = new ArrayList<>();
                    for (TokenRef token : covered) {
                        symbols.add(token.symbol());
                    }
                    updateLedger(ticket, current -> current.markComplete(symbols));
                    metrics.recordPermitConfirmed(symbols.size());
                    logger.info("[session={}] Permit confirmed for {} tx={}", sessionId, symbols, txHash);
                    String justProcessed = permit.tokenSymbol() != null ? permit.tokenSymbol() : symbols.get(0);
                    return prepareNext(ticket, signing.intent(), justProcessed);
                })
                .handle((result, ex) -> ex == null ? result : recover(ticket, ex));
    }

    /**
     * Sends the prepared mint. A revert leaves the session in Minting so the user can retry
     * without re-authorizing.
     */
    public CompletableFuture<Result<DepositState, DomainError>> execute() {
        Result<Ticket, DomainError> begun = begin(DepositState.Minting.class, STEP_MINT);
        if (begun.isErr()) {
            return completed(Result.err(begun.getErrorUnsafe()));
        }
        final Ticket ticket = begun.getValueUnsafe();
        final DepositState.Minting minting = (DepositState.Minting) ticket.state();
        final Timer.Sample sample = metrics.startMint();

        return ensureNetwork()
                .thenCompose(ignored -> sendAndConfirm(ticket,
                        () -> signer.sendTransaction(minting.transaction().to(), minting.transaction().data(),
                                minting.transaction().value()),
                        OnFailure.STAY))
                .thenApply(txHash -> {
                    Result<DepositState, DomainError> done = transition(ticket,
                            new DepositState.Done(minting.intent(), txHash), UnaryOperator.identity());
                    metrics.recordDepositCompleted(sample);
                    listener.onDepositCompleted(sessionId, minting.intent(), txHash);
                    return done;
                })
                .handle((result, ex) -> ex == null ? result : recover(ticket, ex));
    }

    /**
     * Returns to Input, clearing the prepared step and ledger. Idempotent. An in-flight step keeps
     * running on-chain but its result is ignored.
     */
    public void reset() {
        final DepositState before;
        final boolean changed;
        synchronized (lock) {
            before = state;
            changed = !(state instanceof DepositState.Input) || working || intent != null;
            if (!changed) {
                return;
            }
            resetLocked();
        }
        logger.info("[session={}] Reset from {}", sessionId, before.name());
        metrics.recordReset();
        if (!(before instanceof DepositState.Input)) {
            listener.onStateChanged(sessionId, before, DepositState.input());
        }
    }

    /**
     * Resets the session when {@code edited} differs from the intent a pending step was prepared
     * for. Returns whether a reset happened.
     */
    public boolean onIntentChanged(final DepositIntent edited) {
        synchronized (lock) {
            if (intent == null || intent.equals(edited)) {
                return false;
            }
        }
        reset();
        return true;
    }

    // ========================================
    // TRANSITIONS
    // ========================================

    private Result<Ticket, DomainError> begin(final Class<? extends DepositState> expected, final String step) {
        if (signer.account() == null) {
            return Result.err(new WalletNotConnectedError("Connect a wallet before continuing"));
        }
        synchronized (lock) {
            if (working) {
                return Result.err(new StepInProgressError("A step is already in progress for this deposit"));
            }
            if (!expected.isInstance(state)) {
                return Result.err(new StepOutOfOrderError("Cannot " + step + " while in state " + state.name()));
            }
            working = true;
            return Result.ok(new Ticket(generation, state, step));
        }
    }

    private Result<DepositState, DomainError> enter(final Ticket ticket,
                                                    final DepositIntent forIntent,
                                                    final PreparedStep step,
                                                    final String justProcessed) {
        final DepositState next;
        if (step instanceof PreparedStep.NeedsErc20Approval approval) {
            next = new DepositState.Approving(forIntent, approval);
        } else if (step instanceof PreparedStep.NeedsPermitSignature permit) {
            coveredTokens(permit, forIntent);
            next = new DepositState.PermitSigning(forIntent, permit);
        } else if (step instanceof PreparedStep.ReadyToMint ready) {
            next = new DepositState.Minting(forIntent, ready.transaction());
        } else {
            throw new StepFailure(new UnexpectedError("Unknown prepared step " + step), OnFailure.STAY);
        }
        metrics.recordPrepared(next.name());
        return transition(ticket, next, current -> {
            CompletionLedger updated = current;
            if (justProcessed != null && !stillNeedsApproval(step, justProcessed, forIntent)) {
                updated = updated.markComplete(justProcessed);
            }
            if (step instanceof PreparedStep.ReadyToMint) {
                List<String> all = new ArrayList<>();
                for (TokenRef token : forIntent.involvedTokens()) {
                    all.add(token.symbol());
                }
                updated = updated.markComplete(all);
            }
            return updated;
        });
    }

    private Result<DepositState, DomainError> transition(final Ticket ticket,
                                                         final DepositState next,
                                                         final UnaryOperator<CompletionLedger> ledgerUpdate) {
        final DepositState before;
        synchronized (lock) {
            ensureAttachedLocked(ticket);
            before = state;
            state = next;
            ledger = ledgerUpdate.apply(ledger);
            working = false;
        }
        listener.onStateChanged(sessionId, before, next);
        return Result.ok(next);
    }

    private void updateLedger(final Ticket ticket, final UnaryOperator<CompletionLedger> update) {
        synchronized (lock) {
            ensureAttachedLocked(ticket);
            ledger = update.apply(ledger);
        }
    }

    /**
     * Maps a failed step onto the error taxonomy and applies its failure policy. Never throws.
     */
    private Result<DepositState, DomainError> recover(final Ticket ticket, final Throwable ex) {
        Throwable cause = unwrap(ex);
        if (cause instanceof Detached) {
            return dropZombie(ticket);
        }
        final DomainError error;
        final OnFailure onFailure;
        if (cause instanceof StepFailure failure) {
            error = failure.error;
            onFailure = failure.onFailure;
        } else if (cause instanceof WalletRejectedException) {
            error = new WalletRejectedError("Request rejected in wallet");
            onFailure = OnFailure.STAY;
        } else {
            logger.error("[session={}] {} failed unexpectedly", sessionId, ticket.step(), cause);
            error = new UnexpectedError(ticket.step() + " failed: " + cause.getMessage());
            onFailure = OnFailure.STAY;
        }

        final DepositState before;
        final DepositState after;
        synchronized (lock) {
            if (ticket.generation() != generation) {
                return dropZombie(ticket);
            }
            working = false;
            before = state;
            if (onFailure == OnFailure.RETURN_TO_INPUT) {
                resetLocked();
            } else if (state instanceof DepositState.Input) {
                intent = null;
                ledger = CompletionLedger.empty();
            }
            after = state;
        }
        metrics.recordFailure(ticket.step(), error.code());
        listener.onError(sessionId, before, error);
        if (before != after) {
            listener.onStateChanged(sessionId, before, after);
        }
        return Result.err(error);
    }

    private Result<DepositState, DomainError> dropZombie(final Ticket ticket) {
        logger.debug("[session={}] Dropping {} result from generation {} after reset", sessionId, ticket.step(),
                ticket.generation());
        metrics.recordZombieDropped();
        return Result.err(new StepOutOfOrderError("Deposit was reset while " + ticket.step() + " was in flight"));
    }

    private void resetLocked() {
        generation++;
        working = false;
        state = DepositState.input();
        intent = null;
        ledger = CompletionLedger.empty();
    }

    private void ensureAttached(final Ticket ticket) {
        synchronized (lock) {
            ensureAttachedLocked(ticket);
        }
    }

    private void ensureAttachedLocked(final Ticket ticket) {
        if (ticket.generation() != generation) {
            throw new Detached();
        }
    }

    // ========================================
    // COLLABORATOR CALLS
    // ========================================

    private CompletableFuture<Result<DepositState, DomainError>> prepareNext(final Ticket ticket,
                                                                          final DepositIntent forIntent,
                                                                          final String justProcessed) {
        OnFailure onFailure = justProcessed == null ? OnFailure.STAY : OnFailure.RETURN_TO_INPUT;
        TransactionPreparer.PrepareRequest request =
                new TransactionPreparer.PrepareRequest(forIntent, signer.account(), expectedChainId, justProcessed);
        return call(() -> preparer.prepare(request))
                .handle((step, ex) -> {
                    if (ex != null) {
                        Throwable cause = unwrap(ex);
                        throw new StepFailure(new PreparationFailedError(
                                "Could not prepare next step: " + cause.getMessage()), onFailure);
                    }
                    if (step == null) {
                        throw new StepFailure(new PreparationFailedError("Preparer returned no step"), onFailure);
                    }
                    return enter(ticket, forIntent, step, justProcessed);
                });
    }

    private CompletableFuture<Void> ensureNetwork() {
        return call(signer::chainId).thenAccept(actual -> {
            long chainId = actual != null ? actual : -1L;
            if (chainId != expectedChainId) {
                throw new StepFailure(new NetworkMismatchError(expectedChainId, chainId), OnFailure.STAY);
            }
        });
    }

    private CompletableFuture<String> sendAndConfirm(final Ticket ticket,
                                                     final Supplier<CompletableFuture<String>> send,
                                                     final OnFailure onRevert) {
        return call(send).thenCompose(txHash -> call(() -> signer.waitForReceipt(txHash))
                .thenApply(status -> {
                    if (status != WalletSigner.ReceiptStatus.CONFIRMED) {
                        throw new StepFailure(new TransactionRevertedError(
                                ticket.step() + " transaction reverted", txHash), onRevert);
                    }
                    return txHash;
                }));
    }

    /**
     * Maps the permit's token addresses onto the intent's tokens. Any address outside the intent
     * fails the step and sends the session back to Input.
     */
    private static List<TokenRef> coveredTokens(final PreparedStep.NeedsPermitSignature permit,
                                                final DepositIntent forIntent) {
        List<TokenRef> covered = new ArrayList<>();
        for (String address : permit.tokenAddresses()) {
            TokenRef match = forIntent.token0().sameAddress(address) ? forIntent.token0()
                    : forIntent.token1().sameAddress(address) ? forIntent.token1()
                    : null;
            if (match == null) {
                throw new StepFailure(new UnexpectedBatchTokenError(address), OnFailure.RETURN_TO_INPUT);
            }
            if (!covered.contains(match)) {
                covered.add(match);
            }
        }
        if (covered.isEmpty()) {
            TokenRef bySymbol = forIntent.token0().symbol().equals(permit.tokenSymbol()) ? forIntent.token0()
                    : forIntent.token1().symbol().equals(permit.tokenSymbol()) ? forIntent.token1()
                    : null;
            if (bySymbol == null) {
                throw new StepFailure(new UnexpectedBatchTokenError(String.valueOf(permit.tokenSymbol())),
                        OnFailure.RETURN_TO_INPUT);
            }
            covered.add(bySymbol);
        }
        return covered;
    }

    /**
     * True when the next step still authorizes {@code symbol}, either as another ERC20 approval or
     * as a permit covering it.
     */
    private static boolean stillNeedsApproval(final PreparedStep step, final String symbol,
                                              final DepositIntent forIntent) {
        if (step instanceof PreparedStep.NeedsErc20Approval approval) {
            return symbol.equals(approval.token().symbol());
        }
        if (step instanceof PreparedStep.NeedsPermitSignature permit) {
            for (TokenRef covered : coveredTokens(permit, forIntent)) {
                if (symbol.equals(covered.symbol())) {
                    return true;
                }
            }
        }
        return false;
    }

    private DomainError validate(final DepositIntent candidate) {
        if (candidate == null) {
            return new ValidationError("Deposit intent is required");
        }
        if (candidate.token0().sameToken(candidate.token1())) {
            return new ValidationError("Deposit tokens must differ");
        }
        if (!candidate.hasAnyAmount()) {
            return new ValidationError("Enter an amount for at least one token");
        }
        TickRange range = candidate.range();
        Result<TickRange, DomainError> checked = TickRange.of(range.lower(), range.upper(), tickSpacing);
        if (checked.isErr()) {
            return checked.getErrorUnsafe();
        }
        if (signer.account() == null) {
            return new WalletNotConnectedError("Connect a wallet before continuing");
        }
        return null;
    }

    private static <T> CompletableFuture<T> call(final Supplier<CompletableFuture<T>> supplier) {
        try {
            CompletableFuture<T> future = supplier.get();
            return future != null ? future : CompletableFuture.failedFuture(
                    new IllegalStateException("collaborator returned no future"));
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    private static Throwable unwrap(final Throwable ex) {
        Throwable current = ex;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    private static CompletableFuture<Result<DepositState, DomainError>> completed(
            final Result<DepositState, DomainError> result) {
        return CompletableFuture.completedFuture(result);
    }
}
