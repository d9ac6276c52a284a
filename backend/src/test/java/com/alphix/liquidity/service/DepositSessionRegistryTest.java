package com.alphix.liquidity.service;

import com.alphix.liquidity.client.TransactionPreparer;
import com.alphix.liquidity.common.DomainError;
import com.alphix.liquidity.common.Result;
import com.alphix.liquidity.config.DepositProperties;
import com.alphix.liquidity.metrics.DepositMetrics;
import com.alphix.liquidity.service.DepositSessionRegistry.Session;
import com.alphix.liquidity.wallet.PermitCallEncoder;
import com.alphix.liquidity.wallet.WalletSigner;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@ExtendWith(MockitoExtension.class)
class DepositSessionRegistryTest {

    @Mock
    private TransactionPreparer preparer;

    @Mock
    private WalletSigner signer;

    private SimpleMeterRegistry meterRegistry;
    private DepositProperties properties;
    private DepositSessionRegistry registry;

    @BeforeEach
    void setUp() {
        properties = new DepositProperties();
        properties.setMaxSessions(2);
        properties.setTokens(List.of(
            token("WETH", "0x4200000000000000000000000000000000000006"),
            token("USDC", "0x036CbD53842c5426634e7929541eC2318f3dCF7e")));
        meterRegistry = new SimpleMeterRegistry();
        registry = new DepositSessionRegistry(properties, preparer, signer, new PermitCallEncoder(),
            new DepositMetrics(meterRegistry), DepositEventListener.NONE);
    }

    @Test
    void testCreateFindClose() {
        Session session = registry.create("WETH", "USDC").getValueUnsafe();

        assertThat(session.token0().symbol()).isEqualTo("WETH");
        assertThat(registry.find(session.id()).getValueUnsafe()).isSameAs(session);
        assertThat(meterRegistry.get("liquidity.deposit.sessions.active").gauge().value()).isEqualTo(1.0);

        assertThat(registry.close(session.id())).isTrue();
        assertThat(registry.close(session.id())).isFalse();
        assertThat(registry.find(session.id()).getErrorUnsafe().httpStatus()).isEqualTo(404);
    }

    @Test
    void testRejectsUnknownAndIdenticalTokens() {
        assertThat(registry.create("WETH", "DOGE").isErr()).isTrue();
        assertThat(registry.create("USDC", "USDC").isErr()).isTrue();
    }

    @Test
    void testSessionLimit() {
        registry.create("WETH", "USDC");
        registry.create("USDC", "WETH");

        Result<Session, DomainError> third = registry.create("WETH", "USDC");

        assertThat(third.getErrorUnsafe().message()).contains("max 2");
        assertThat(registry.size()).isEqualTo(2);
    }

    private static DepositProperties.Token token(String symbol, String address) {
        DepositProperties.Token token = new DepositProperties.Token();
        token.setSymbol(symbol);
        token.setAddress(address);
        return token;
    }
}
