package com.alphix.liquidity.client;

import com.alphix.liquidity.model.TokenRef;

import java.math.BigInteger;
import java.util.concurrent.CompletableFuture;

/**
 * Pairs a one-sided amount with the other side for a tick range. Amounts are raw token units.
 */
public interface LiquidityCalculator {

    record CalculationRequest(
            TokenRef token0,
            TokenRef token1,
            BigInteger inputAmount,
            String inputTokenSymbol,
            int tickLower,
            int tickUpper,
            long chainId
    ) {}

    /**
     * amount0/amount1 follow the request's token0/token1, not the pool's ordering.
     */
    record LiquidityQuote(
            BigInteger liquidity,
            int finalTickLower,
            int finalTickUpper,
            BigInteger amount0,
            BigInteger amount1,
            Integer currentPoolTick,
            String currentPrice,
            String priceAtTickLower,
            String priceAtTickUpper
    ) {}

    CompletableFuture<LiquidityQuote> calculate(CalculationRequest request);
}
