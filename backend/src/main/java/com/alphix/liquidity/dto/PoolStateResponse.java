package com.alphix.liquidity.dto;

public record PoolStateResponse(
        String poolId,
        int currentPoolTick,
        String sqrtPriceX96,
        String liquidity,
        String currentPrice,
        String baseSymbol,
        String quoteSymbol
) {}
