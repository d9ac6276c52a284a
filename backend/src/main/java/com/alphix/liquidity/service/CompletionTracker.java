// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.alphix.liquidity.service;

import com.alphix.liquidity.model.DepositIntent;
import com.alphix.liquidity.model.TokenRef;
import org.springframework.stereotype.Component;

/**
 * Progress view over a deposit: how many tokens need authorization and how many have it.
 * Read-only; it never feeds back into the state machine.
 */
@Component
public class CompletionTracker {

    public record Progress(int involvedCount, int completedCount) {

        public static final Progress NONE = new Progress(0, 0);

        public boolean isComplete() {
            return involvedCount > 0 && completedCount == involvedCount;
        }
    }

    public Progress progress(final DepositIntent intent, final CompletionLedger ledger) {
        if (intent == null) {
            return Progress.NONE;
        }
        int involved = 0;
        int completed = 0;
        for (TokenRef token : intent.involvedTokens()) {
            involved++;
            if (ledger.isComplete(token.symbol())) {
                completed++;
            }
        }
        return new Progress(involved, completed);
    }

    public Progress progress(final AuthorizationStateMachine machine) {
        AuthorizationStateMachine.Snapshot snapshot = machine.snapshot();
        return progress(snapshot.intent(), snapshot.ledger());
    }
}
