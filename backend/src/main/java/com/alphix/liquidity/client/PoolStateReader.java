package com.alphix.liquidity.client;

import com.alphix.liquidity.model.TokenRef;

import java.math.BigInteger;
import java.util.concurrent.CompletableFuture;

public interface PoolStateReader {

    record PoolState(String poolId, int currentTick, BigInteger sqrtPriceX96, BigInteger liquidity, String currentPrice) {}

    CompletableFuture<PoolState> read(TokenRef token0, TokenRef token1, long chainId);
}
