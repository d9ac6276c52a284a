package com.alphix.liquidity.service;

import com.alphix.liquidity.client.TransactionPreparer;
import com.alphix.liquidity.common.DomainError;
import com.alphix.liquidity.common.Result;
import com.alphix.liquidity.common.errors.ValidationError;
import com.alphix.liquidity.config.DepositProperties;
import com.alphix.liquidity.metrics.DepositMetrics;
import com.alphix.liquidity.model.TokenRef;
import com.alphix.liquidity.wallet.PermitCallEncoder;
import com.alphix.liquidity.wallet.WalletSigner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory deposit sessions, one {@link AuthorizationStateMachine} per token pair the user opened.
 */
@Service
public class DepositSessionRegistry {

    private static final Logger logger = LoggerFactory.getLogger(DepositSessionRegistry.class);

    public record Session(String id, TokenRef token0, TokenRef token1, AuthorizationStateMachine machine,
                          Instant createdAt) {}

    private final DepositProperties properties;
    private final TransactionPreparer preparer;
    private final WalletSigner signer;
    private final PermitCallEncoder permitEncoder;
    private final DepositMetrics metrics;
    private final DepositEventListener listener;
    private final Map<String, Session> sessions = new ConcurrentHashMap<>();

    public DepositSessionRegistry(DepositProperties properties,
                                  TransactionPreparer preparer,
                                  WalletSigner signer,
                                  PermitCallEncoder permitEncoder,
                                  DepositMetrics metrics,
                                  DepositEventListener listener) {
        this.properties = properties;
        this.preparer = preparer;
        this.signer = signer;
        this.permitEncoder = permitEncoder;
        this.metrics = metrics;
        this.listener = listener;
    }

    public Result<Session, DomainError> create(String token0Symbol, String token1Symbol) {
        Optional<TokenRef> token0 = properties.tokenBySymbol(token0Symbol);
        if (token0.isEmpty()) {
            return Result.err(new ValidationError("Unknown token: " + token0Symbol));
        }
        Optional<TokenRef> token1 = properties.tokenBySymbol(token1Symbol);
        if (token1.isEmpty()) {
            return Result.err(new ValidationError("Unknown token: " + token1Symbol));
        }
        if (token0.get().sameToken(token1.get())) {
            return Result.err(new ValidationError("token0 and token1 must differ"));
        }
        if (sessions.size() >= properties.getMaxSessions()) {
            return Result.err(new ValidationError("Too many open deposit sessions (max "
                    + properties.getMaxSessions() + ")"));
        }

        String id = UUID.randomUUID().toString();
        AuthorizationStateMachine machine = new AuthorizationStateMachine(id, preparer, signer, permitEncoder,
                metrics, listener, properties.getChainId(), properties.getTickSpacing());
        Session session = new Session(id, token0.get(), token1.get(), machine, Instant.now());
        sessions.put(id, session);
        metrics.setActiveSessions(sessions.size());
        logger.info("[session={}] Opened for {}/{}", id, token0Symbol, token1Symbol);
        return Result.ok(session);
    }

    public Result<Session, DomainError> find(String id) {
        Session session = id != null ? sessions.get(id) : null;
        if (session == null) {
            return Result.err(new ValidationError("Deposit session not found: " + id, ValidationError.Type.NOT_FOUND));
        }
        return Result.ok(session);
    }

    /**
     * Resets and forgets the session. Returns false when it did not exist.
     */
    public boolean close(String id) {
        Session removed = sessions.remove(id);
        if (removed == null) {
            return false;
        }
        removed.machine().reset();
        metrics.setActiveSessions(sessions.size());
        logger.info("[session={}] Closed", id);
        return true;
    }

    public int size() {
        return sessions.size();
    }
}
