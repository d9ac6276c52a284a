package com.alphix.liquidity.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record CalculationResponse(
        String status,
        String dependentField,
        String dependentAmount,
        String liquidity,
        Integer currentPoolTick,
        String currentPrice,
        String priceAtTickLower,
        String priceAtTickUpper,
        String errorCode,
        String errorMessage
) {}
