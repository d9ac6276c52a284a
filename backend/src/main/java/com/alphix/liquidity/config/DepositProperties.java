// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.alphix.liquidity.config;

import com.alphix.liquidity.constants.DepositConstants;
import com.alphix.liquidity.model.TokenRef;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Deposit orchestration settings bound from {@code deposit.*}.
 */
@Component
@ConfigurationProperties(prefix = "deposit")
public class DepositProperties {

    private long chainId;
    private int tickSpacing = 60;
    private long debounceMs = DepositConstants.DEFAULT_DEBOUNCE_MS;
    private int maxSessions = 1000;
    private PrepareApi prepareApi = new PrepareApi();
    private Receipt receipt = new Receipt();
    private Wallet wallet = new Wallet();
    private List<Token> tokens = new ArrayList<>();

    public Optional<TokenRef> tokenBySymbol(String symbol) {
        if (symbol == null) {
            return Optional.empty();
        }
        return tokens.stream()
                .filter(t -> symbol.equalsIgnoreCase(t.getSymbol()))
                .findFirst()
                .map(Token::toTokenRef);
    }

    public Optional<TokenRef> tokenByAddress(String address) {
        if (address == null) {
            return Optional.empty();
        }
        return tokens.stream()
                .filter(t -> address.equalsIgnoreCase(t.getAddress()))
                .findFirst()
                .map(Token::toTokenRef);
    }

    public long getChainId() {
        return chainId;
    }

    public void setChainId(long chainId) {
        this.chainId = chainId;
    }

    public int getTickSpacing() {
        return tickSpacing;
    }

    public void setTickSpacing(int tickSpacing) {
        this.tickSpacing = tickSpacing;
    }

    public long getDebounceMs() {
        return debounceMs;
    }

    public void setDebounceMs(long debounceMs) {
        this.debounceMs = debounceMs;
    }

    public int getMaxSessions() {
        return maxSessions;
    }

    public void setMaxSessions(int maxSessions) {
        this.maxSessions = maxSessions;
    }

    public PrepareApi getPrepareApi() {
        return prepareApi;
    }

    public void setPrepareApi(PrepareApi prepareApi) {
        this.prepareApi = prepareApi;
    }

    public Receipt getReceipt() {
        return receipt;
    }

    public void setReceipt(Receipt receipt) {
        this.receipt = receipt;
    }

    public Wallet getWallet() {
        return wallet;
    }

    public void setWallet(Wallet wallet) {
        this.wallet = wallet;
    }

    public List<Token> getTokens() {
        return tokens;
    }

    public void setTokens(List<Token> tokens) {
        this.tokens = tokens;
    }

    /**
     * HTTP API hosting prepare-mint-tx, calculate-liquidity-parameters and get-pool-state.
     */
    public static class PrepareApi {
        private String baseUrl = "http://localhost:3000";
        private long timeoutMs = 5000;

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public long getTimeoutMs() {
            return timeoutMs;
        }

        public void setTimeoutMs(long timeoutMs) {
            this.timeoutMs = timeoutMs;
        }
    }

    public static class Receipt {
        private long pollIntervalMs = 2000;
        private int maxAttempts = 90;

        public long getPollIntervalMs() {
            return pollIntervalMs;
        }

        public void setPollIntervalMs(long pollIntervalMs) {
            this.pollIntervalMs = pollIntervalMs;
        }

        public int getMaxAttempts() {
            return maxAttempts;
        }

        public void setMaxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
        }
    }

    public static class Wallet {
        private String rpcUrl;
        private String privateKey;

        public String getRpcUrl() {
            return rpcUrl;
        }

        public void setRpcUrl(String rpcUrl) {
            this.rpcUrl = rpcUrl;
        }

        public String getPrivateKey() {
            return privateKey;
        }

        public void setPrivateKey(String privateKey) {
            this.privateKey = privateKey;
        }
    }

    public static class Token {
        private String symbol;
        private String address;
        private int decimals = 18;
        private int displayDecimals = 4;

        public TokenRef toTokenRef() {
            return new TokenRef(symbol, address, decimals, displayDecimals);
        }

        public String getSymbol() {
            return symbol;
        }

        public void setSymbol(String symbol) {
            this.symbol = symbol;
        }

        public String getAddress() {
            return address;
        }

        public void setAddress(String address) {
            this.address = address;
        }

        public int getDecimals() {
            return decimals;
        }

        public void setDecimals(int decimals) {
            this.decimals = decimals;
        }

        public int getDisplayDecimals() {
            return displayDecimals;
        }

        public void setDisplayDecimals(int displayDecimals) {
            this.displayDecimals = displayDecimals;
        }
    }
}
