package com.alphix.liquidity.config;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class StartupValidationTest {

    @Test
    void testValidConfiguration() {
        DepositProperties properties = properties(84532L,
            token("WETH", "0x4200000000000000000000000000000000000006"),
            token("USDC", "0x036CbD53842c5426634e7929541eC2318f3dCF7e"));

        assertThat(new StartupValidation(properties).validate()).isTrue();
    }

    @Test
    void testMissingChainId() {
        DepositProperties properties = properties(0L, token("WETH", "0x4200000000000000000000000000000000000006"));

        assertThat(new StartupValidation(properties).validate()).isFalse();
    }

    @Test
    void testDuplicateAddressIgnoringCase() {
        DepositProperties properties = properties(84532L,
            token("USDC", "0x036CbD53842c5426634e7929541eC2318f3dCF7e"),
            token("USDC2", "0x036cbd53842c5426634e7929541ec2318f3dcf7e"));

        assertThat(new StartupValidation(properties).validate()).isFalse();
    }

    @Test
    void testDisconnectedWalletWhenNotConfigured() {
        WalletConfig config = new WalletConfig();

        assertThat(config.walletSigner(new DepositProperties(), null, null).account()).isNull();
    }

    private static DepositProperties properties(long chainId, DepositProperties.Token... tokens) {
        DepositProperties properties = new DepositProperties();
        properties.setChainId(chainId);
        properties.setTokens(List.of(tokens));
        return properties;
    }

    private static DepositProperties.Token token(String symbol, String address) {
        DepositProperties.Token token = new DepositProperties.Token();
        token.setSymbol(symbol);
        token.setAddress(address);
        return token;
    }
}
