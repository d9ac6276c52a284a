// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.alphix.liquidity.config;

import com.alphix.liquidity.wallet.DisconnectedWalletSigner;
import com.alphix.liquidity.wallet.WalletSigner;
import com.alphix.liquidity.wallet.Web3jWalletSigner;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.web3j.crypto.Credentials;
import org.web3j.protocol.Web3j;
import org.web3j.protocol.http.HttpService;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Wires the wallet used for approvals, permits and mints. Without {@code deposit.wallet.rpc-url}
 * and {@code deposit.wallet.private-key} the application runs with no connected wallet.
 */
@Configuration
public class WalletConfig {

    private static final Logger logger = LoggerFactory.getLogger(WalletConfig.class);

    @Bean(destroyMethod = "shutdown")
    public ExecutorService walletExecutor() {
        return Executors.newCachedThreadPool(runnable -> {
            Thread thread = new Thread(runnable, "wallet-io");
            thread.setDaemon(true);
            return thread;
        });
    }

    @Bean
    public WalletSigner walletSigner(DepositProperties properties, ObjectMapper mapper, ExecutorService walletExecutor) {
        DepositProperties.Wallet wallet = properties.getWallet();
        if (isBlank(wallet.getRpcUrl()) || isBlank(wallet.getPrivateKey())) {
            logger.warn("deposit.wallet not configured; deposit steps will report WALLET_NOT_CONNECTED");
            return new DisconnectedWalletSigner();
        }
        Web3j web3j = Web3j.build(new HttpService(wallet.getRpcUrl()));
        Credentials credentials = Credentials.create(wallet.getPrivateKey());
        logger.info("Wallet {} connected via {}", credentials.getAddress(), wallet.getRpcUrl());
        return new Web3jWalletSigner(web3j, credentials, mapper, walletExecutor,
                properties.getReceipt().getPollIntervalMs(), properties.getReceipt().getMaxAttempts());
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
