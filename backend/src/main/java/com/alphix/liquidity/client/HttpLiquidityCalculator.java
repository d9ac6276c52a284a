package com.alphix.liquidity.client;

import com.alphix.liquidity.config.DepositProperties;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.springframework.stereotype.Service;

import java.math.BigInteger;
import java.net.http.HttpClient;
import java.util.concurrent.CompletableFuture;

@Service
public class HttpLiquidityCalculator extends JsonApiClient implements LiquidityCalculator {

    static final String PATH = "/api/liquidity/calculate-liquidity-parameters";

    public HttpLiquidityCalculator(final HttpClient httpClient,
                                   final ObjectMapper mapper,
                                   final DepositProperties properties) {
        super(httpClient, mapper, properties);
    }

    @Override
    public CompletableFuture<LiquidityQuote> calculate(final CalculationRequest request) {
        ObjectNode body = mapper.createObjectNode()
                .put("token0Symbol", request.token0().symbol())
                .put("token1Symbol", request.token1().symbol())
                .put("inputAmount", request.inputAmount().toString())
                .put("inputTokenSymbol", request.inputTokenSymbol())
                .put("userTickLower", request.tickLower())
                .put("userTickUpper", request.tickUpper())
                .put("chainId", request.chainId());
        return post(PATH, body).thenApply(HttpLiquidityCalculator::toQuote);
    }

    static LiquidityQuote toQuote(final JsonNode root) {
        try {
            return new LiquidityQuote(
                    new BigInteger(root.path("liquidity").asText("0")),
                    root.path("finalTickLower").asInt(),
                    root.path("finalTickUpper").asInt(),
                    new BigInteger(required(root, "amount0")),
                    new BigInteger(required(root, "amount1")),
                    root.hasNonNull("currentPoolTick") ? root.path("currentPoolTick").asInt() : null,
                    root.path("currentPrice").asText(null),
                    root.path("priceAtTickLower").asText(null),
                    root.path("priceAtTickUpper").asText(null));
        } catch (NumberFormatException e) {
            throw new CollaboratorException("Calculator returned a non-integer amount", e);
        }
    }

    private static String required(final JsonNode root, final String field) {
        if (!root.hasNonNull(field)) {
            throw new CollaboratorException("Calculator response is missing " + field);
        }
        return root.path(field).asText();
    }
}
