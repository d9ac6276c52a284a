// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.alphix.liquidity.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.util.HashSet;
import java.util.Set;

/**
 * Startup validation of the deposit configuration.
 *
 * Checks that:
 * 1. A chain id is configured (network checks compare against it)
 * 2. Tick spacing is positive
 * 3. Every token has a symbol, a unique address and sane decimals
 *
 * Problems are logged only; startup continues.
 */
@Component
public class StartupValidation {

    private static final Logger logger = LoggerFactory.getLogger(StartupValidation.class);

    private final DepositProperties properties;

    public StartupValidation(DepositProperties properties) {
        this.properties = properties;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void validateDepositConfig() {
        logger.info("Running startup validation for deposit configuration...");
        boolean allValid = validate();
        if (allValid) {
            logger.info("Deposit configuration valid: chainId={}, tickSpacing={}, tokens={}",
                    properties.getChainId(), properties.getTickSpacing(), properties.getTokens().size());
        } else {
            logger.warn("Deposit configuration has problems; deposit sessions may fail");
        }
    }

    boolean validate() {
        boolean allValid = true;

        if (properties.getChainId() <= 0) {
            logger.error("deposit.chain-id is not set");
            allValid = false;
        }
        if (properties.getTickSpacing() <= 0) {
            logger.error("deposit.tick-spacing must be positive, got {}", properties.getTickSpacing());
            allValid = false;
        }

        Set<String> addresses = new HashSet<>();
        for (DepositProperties.Token token : properties.getTokens()) {
            if (token.getSymbol() == null || token.getSymbol().isBlank()) {
                logger.error("Token with address {} has no symbol", token.getAddress());
                allValid = false;
            }
            if (token.getAddress() == null || !addresses.add(token.getAddress().toLowerCase())) {
                logger.error("Token {} has a missing or duplicate address", token.getSymbol());
                allValid = false;
            }
            if (token.getDecimals() < 0 || token.getDecimals() > 36) {
                logger.error("Token {} has unsupported decimals {}", token.getSymbol(), token.getDecimals());
                allValid = false;
            }
        }
        if (properties.getTokens().size() < 2) {
            logger.warn("Fewer than two tokens configured; no pool can be deposited into");
        }
        return allValid;
    }
}
