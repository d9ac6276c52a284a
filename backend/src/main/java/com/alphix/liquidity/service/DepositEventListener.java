package com.alphix.liquidity.service;

import com.alphix.liquidity.common.DomainError;
import com.alphix.liquidity.model.DepositIntent;
import com.alphix.liquidity.model.DepositState;

/**
 * Observer for a deposit session. Called outside the state machine's lock, on whichever thread
 * completed the step.
 */
public interface DepositEventListener {

    DepositEventListener NONE = new DepositEventListener() {
    };

    default void onStateChanged(String sessionId, DepositState from, DepositState to) {
    }

    /**
     * Fired exactly once per deposit, when the mint is confirmed.
     */
    default void onDepositCompleted(String sessionId, DepositIntent intent, String txHash) {
    }

    default void onError(String sessionId, DepositState state, DomainError error) {
    }
}
