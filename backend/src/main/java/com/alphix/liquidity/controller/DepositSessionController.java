// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.alphix.liquidity.controller;

import com.alphix.liquidity.common.DomainError;
import com.alphix.liquidity.common.DomainErrorException;
import com.alphix.liquidity.common.Result;
import com.alphix.liquidity.common.errors.ValidationError;
import com.alphix.liquidity.dto.CommitDepositRequest;
import com.alphix.liquidity.dto.CreateSessionRequest;
import com.alphix.liquidity.dto.DepositSessionResponse;
import com.alphix.liquidity.model.DepositIntent;
import com.alphix.liquidity.model.DepositState;
import com.alphix.liquidity.model.PreparedStep;
import com.alphix.liquidity.model.RawTransaction;
import com.alphix.liquidity.service.AuthorizationStateMachine;
import com.alphix.liquidity.service.CompletionTracker;
import com.alphix.liquidity.service.DepositSessionRegistry;
import com.alphix.liquidity.service.DepositSessionRegistry.Session;
import com.alphix.liquidity.validation.DepositRequestValidator;
import io.opentelemetry.instrumentation.annotations.WithSpan;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.concurrent.CompletableFuture;
import java.util.function.Function;

/**
 * Deposit session endpoints: open a session for a token pair, commit an intent, then drive
 * approve / permit / mint until the session reaches {@code done}.
 *
 * Step endpoints return asynchronously; a failed step answers with the error and leaves the
 * session wherever the state machine put it (GET shows the result).
 */
@RestController
@RequestMapping("/api/deposits/sessions")
public class DepositSessionController {

    private final DepositSessionRegistry registry;
    private final DepositRequestValidator validator;
    private final CompletionTracker tracker;

    public DepositSessionController(DepositSessionRegistry registry,
                                    DepositRequestValidator validator,
                                    CompletionTracker tracker) {
        this.registry = registry;
        this.validator = validator;
        this.tracker = tracker;
    }

    @PostMapping
    @WithSpan
    public ResponseEntity<DepositSessionResponse> create(@Valid @RequestBody CreateSessionRequest request) {
        Session session = orThrow(registry.create(request.token0Symbol(), request.token1Symbol()));
        return ResponseEntity.status(HttpStatus.CREATED).body(toResponse(session));
    }

    @GetMapping("/{sessionId}")
    public DepositSessionResponse get(@PathVariable String sessionId) {
        return toResponse(orThrow(registry.find(sessionId)));
    }

    @PostMapping("/{sessionId}/commit")
    @WithSpan
    public CompletableFuture<DepositSessionResponse> commit(@PathVariable String sessionId,
                                                            @Valid @RequestBody CommitDepositRequest request) {
        Session session = orThrow(registry.find(sessionId));
        DepositIntent intent = orThrow(validator.toIntent(request, session.token0(), session.token1()));
        return run(session, machine -> machine.commit(intent));
    }

    /**
     * Reports an edit of amounts or range. A session past Input is reset.
     */
    @PutMapping("/{sessionId}/intent")
    public DepositSessionResponse editIntent(@PathVariable String sessionId,
                                             @Valid @RequestBody CommitDepositRequest request) {
        Session session = orThrow(registry.find(sessionId));
        DepositIntent edited = orThrow(validator.toIntent(request, session.token0(), session.token1()));
        session.machine().onIntentChanged(edited);
        return toResponse(session);
    }

    @PostMapping("/{sessionId}/approve")
    @WithSpan
    public CompletableFuture<DepositSessionResponse> approve(@PathVariable String sessionId) {
        Session session = orThrow(registry.find(sessionId));
        return run(session, AuthorizationStateMachine::confirmApproval);
    }

    @PostMapping("/{sessionId}/permit")
    @WithSpan
    public CompletableFuture<DepositSessionResponse> permit(@PathVariable String sessionId) {
        Session session = orThrow(registry.find(sessionId));
        return run(session, AuthorizationStateMachine::signAndSubmit);
    }

    @PostMapping("/{sessionId}/mint")
    @WithSpan
    public CompletableFuture<DepositSessionResponse> mint(@PathVariable String sessionId) {
        Session session = orThrow(registry.find(sessionId));
        return run(session, AuthorizationStateMachine::execute);
    }

    @PostMapping("/{sessionId}/reset")
    public DepositSessionResponse reset(@PathVariable String sessionId) {
        Session session = orThrow(registry.find(sessionId));
        session.machine().reset();
        return toResponse(session);
    }

    @DeleteMapping("/{sessionId}")
    public ResponseEntity<Void> close(@PathVariable String sessionId) {
        if (!registry.close(sessionId)) {
            throw new DomainErrorException(
                new ValidationError("Deposit session not found: " + sessionId, ValidationError.Type.NOT_FOUND));
        }
        return ResponseEntity.noContent().build();
    }

    // ========================================
    // MAPPING
    // ========================================

    private CompletableFuture<DepositSessionResponse> run(
            Session session,
            Function<AuthorizationStateMachine, CompletableFuture<Result<DepositState, DomainError>>> step) {
        return step.apply(session.machine()).thenApply(result -> {
            orThrow(result);
            return toResponse(session);
        });
    }

    DepositSessionResponse toResponse(Session session) {
        AuthorizationStateMachine.Snapshot snapshot = session.machine().snapshot();
        CompletionTracker.Progress progress = tracker.progress(snapshot.intent(), snapshot.ledger());
        DepositSessionResponse.Approval approval = null;
        DepositSessionResponse.Permit permit = null;
        DepositSessionResponse.Transaction transaction = null;
        String txHash = null;

        DepositState state = snapshot.state();
        if (state instanceof DepositState.Approving approving) {
            PreparedStep.NeedsErc20Approval step = approving.approval();
            approval = new DepositSessionResponse.Approval(step.token().symbol(), step.token().address(),
                step.spender(), step.amount().toString());
        } else if (state instanceof DepositState.PermitSigning signing) {
            PreparedStep.NeedsPermitSignature step = signing.permit();
            permit = new DepositSessionResponse.Permit(step.tokenSymbol(), step.permit2Address(), step.typedData());
        } else if (state instanceof DepositState.Minting minting) {
            transaction = toTransaction(minting.transaction());
        } else if (state instanceof DepositState.Done done) {
            txHash = done.txHash();
        }

        return new DepositSessionResponse(
            session.id(),
            state.name(),
            snapshot.working(),
            snapshot.ledger().asMap(),
            progress.involvedCount(),
            progress.completedCount(),
            approval,
            permit,
            transaction,
            txHash
        );
    }

    private static DepositSessionResponse.Transaction toTransaction(RawTransaction tx) {
        return new DepositSessionResponse.Transaction(tx.to(), tx.data(), tx.value().toString());
    }

    private static <T> T orThrow(Result<T, DomainError> result) {
        return result.orElseThrow(DomainErrorException::new);
    }
}
