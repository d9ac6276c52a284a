package com.alphix.liquidity.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record RangePresetResponse(
        String preset,
        int tickLower,
        int tickUpper,
        String minPrice,
        String maxPrice,
        boolean fullRange,
        String baseSymbol,
        String quoteSymbol
) {}
