package com.alphix.liquidity.client;

import com.alphix.liquidity.config.DepositProperties;
import com.alphix.liquidity.model.TokenRef;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.springframework.stereotype.Service;

import java.math.BigInteger;
import java.net.http.HttpClient;
import java.util.concurrent.CompletableFuture;

@Service
public class HttpPoolStateReader extends JsonApiClient implements PoolStateReader {

    static final String PATH = "/api/liquidity/get-pool-state";

    public HttpPoolStateReader(final HttpClient httpClient,
                               final ObjectMapper mapper,
                               final DepositProperties properties) {
        super(httpClient, mapper, properties);
    }

    @Override
    public CompletableFuture<PoolState> read(final TokenRef token0, final TokenRef token1, final long chainId) {
        ObjectNode body = mapper.createObjectNode()
                .put("token0Symbol", token0.symbol())
                .put("token1Symbol", token1.symbol())
                .put("chainId", chainId);
        return post(PATH, body).thenApply(HttpPoolStateReader::toPoolState);
    }

    static PoolState toPoolState(final JsonNode root) {
        JsonNode tick = root.hasNonNull("currentPoolTick") ? root.path("currentPoolTick") : root.path("tick");
        if (!tick.canConvertToInt()) {
            throw new CollaboratorException("Pool state is missing the current tick");
        }
        try {
            return new PoolState(
                    root.path("poolId").asText(null),
                    tick.asInt(),
                    new BigInteger(root.path("sqrtPriceX96").asText("0")),
                    new BigInteger(root.path("liquidity").asText("0")),
                    root.path("currentPrice").asText(null));
        } catch (NumberFormatException e) {
            throw new CollaboratorException("Pool state has a non-integer field", e);
        }
    }
}
