package com.alphix.liquidity.dto;

import jakarta.validation.constraints.NotBlank;

/**
 * Paired-amount request. key identifies the form so newer requests supersede older ones.
 */
public record CalculationRequest(
        @NotBlank(message = "key is required") String key,
        @NotBlank(message = "token0Symbol is required") String token0Symbol,
        @NotBlank(message = "token1Symbol is required") String token1Symbol,
        String amount0,
        String amount1,
        Integer tickLower,
        Integer tickUpper,
        String inputSide,
        Integer currentPoolTick
) {}
