package com.alphix.liquidity.dto;

import jakarta.validation.constraints.NotBlank;

/**
 * Opens a deposit session for a token pair, in the order the user picked them.
 */
public record CreateSessionRequest(
        @NotBlank(message = "token0Symbol is required") String token0Symbol,
        @NotBlank(message = "token1Symbol is required") String token1Symbol
) {}
