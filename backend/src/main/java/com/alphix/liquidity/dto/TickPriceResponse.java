package com.alphix.liquidity.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Price of baseSymbol in quoteSymbol at a tick. price is "∞" or "0" outside double range.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TickPriceResponse(
        Double tick,
        Integer alignedTick,
        String price,
        String baseSymbol,
        String quoteSymbol
) {}
