package com.alphix.liquidity.validation;

import com.alphix.liquidity.common.DomainError;
import com.alphix.liquidity.common.Result;
import com.alphix.liquidity.common.errors.ValidationError;
import com.alphix.liquidity.config.DepositProperties;
import com.alphix.liquidity.dto.CommitDepositRequest;
import com.alphix.liquidity.model.DepositIntent;
import com.alphix.liquidity.model.InputSide;
import com.alphix.liquidity.model.TickRange;
import com.alphix.liquidity.model.TokenRef;
import com.alphix.liquidity.util.Amounts;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.Optional;

/**
 * Turns a commit request into a {@link DepositIntent} for the session's token pair.
 */
@Component
public class DepositRequestValidator {

    private final DepositProperties properties;

    public DepositRequestValidator(DepositProperties properties) {
        this.properties = properties;
    }

    public Result<DepositIntent, DomainError> toIntent(CommitDepositRequest request, TokenRef token0, TokenRef token1) {
        if (request == null) {
            return Result.err(new ValidationError("Request body is required"));
        }
        if (request.tickLower == null || request.tickUpper == null) {
            return Result.err(new ValidationError("tickLower and tickUpper are required"));
        }
        Result<BigDecimal, DomainError> amount0 = Amounts.parse(request.token0Amount);
        if (amount0.isErr()) {
            return Result.err(amount0.getErrorUnsafe());
        }
        Result<BigDecimal, DomainError> amount1 = Amounts.parse(request.token1Amount);
        if (amount1.isErr()) {
            return Result.err(amount1.getErrorUnsafe());
        }
        Optional<InputSide> parsedSide = InputSide.parse(request.activeInputSide);
        if (parsedSide.isEmpty()) {
            return Result.err(new ValidationError("activeInputSide must be TOKEN0 or TOKEN1, got: "
                + request.activeInputSide));
        }
        InputSide side = parsedSide.get();
        return TickRange.of(request.tickLower, request.tickUpper, properties.getTickSpacing())
            .map(range -> new DepositIntent(token0, token1, amount0.getValueUnsafe(), amount1.getValueUnsafe(),
                range, side));
    }
}
