package com.alphix.liquidity.service;

import com.alphix.liquidity.common.DomainError;
import com.alphix.liquidity.model.DepositIntent;
import com.alphix.liquidity.model.DepositState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class LoggingDepositEventListener implements DepositEventListener {

    private static final Logger logger = LoggerFactory.getLogger(LoggingDepositEventListener.class);

    @Override
    public void onStateChanged(String sessionId, DepositState from, DepositState to) {
        logger.info("[session={}] {} -> {}", sessionId, from.name(), to.name());
    }

    @Override
    public void onDepositCompleted(String sessionId, DepositIntent intent, String txHash) {
        logger.info("[session={}] Deposit completed: {} {} + {} {} in [{}, {}] tx={}",
                sessionId,
                intent.token0Amount().toPlainString(), intent.token0().symbol(),
                intent.token1Amount().toPlainString(), intent.token1().symbol(),
                intent.range().lower(), intent.range().upper(), txHash);
    }

    @Override
    public void onError(String sessionId, DepositState state, DomainError error) {
        logger.warn("[session={}] {} failed in state {}: {}", sessionId, error.code(), state.name(), error.message());
    }
}
