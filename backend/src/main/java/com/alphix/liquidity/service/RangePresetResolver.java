package com.alphix.liquidity.service;

import com.alphix.liquidity.common.DomainError;
import com.alphix.liquidity.common.Result;
import com.alphix.liquidity.common.errors.InvalidRangeError;
import com.alphix.liquidity.common.errors.RangeTooNarrowError;
import com.alphix.liquidity.constants.DepositConstants;
import com.alphix.liquidity.model.PoolOrdering;
import com.alphix.liquidity.model.RoundMode;
import com.alphix.liquidity.model.TickRange;
import com.alphix.liquidity.model.TokenRef;
import com.alphix.liquidity.util.TickPriceMath;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.Optional;

/**
 * Turns a percentage preset around the current pool tick into an aligned tick range.
 *
 * The lower bound is aligned up and the upper bound down, so alignment never widens the range
 * past what the preset asked for.
 */
@Service
public class RangePresetResolver {

    private static final Logger logger = LoggerFactory.getLogger(RangePresetResolver.class);

    /**
     * Where the range is centered. Either the tick is known or a price (base in quote) is.
     */
    public record Center(Integer tick, Double price, TokenRef quote, TokenRef base, PoolOrdering ordering) {

        public static Center atTick(final int tick) {
            return new Center(tick, null, null, null, null);
        }

        public static Center atPrice(final double price, final TokenRef quote, final TokenRef base,
                                     final PoolOrdering ordering) {
            return new Center(null, price, quote, base, ordering);
        }
    }

    public Result<TickRange, DomainError> resolve(final String preset, final Center center, final int tickSpacing) {
        if (DepositConstants.PRESET_FULL_RANGE.equalsIgnoreCase(preset)) {
            return Result.ok(fullRange(tickSpacing));
        }
        Double percentage = DepositConstants.PRESET_PERCENTAGES.get(preset);
        if (percentage == null) {
            return Result.err(new InvalidRangeError("Unknown range preset: " + preset));
        }
        return resolve(percentage, center, tickSpacing);
    }

    /**
     * Range of {@code ±percentage} around {@code center}; {@code 0 < percentage < 1}.
     */
    public Result<TickRange, DomainError> resolve(final double percentage, final Center center, final int tickSpacing) {
        if (!(percentage > 0.0 && percentage < 1.0)) {
            return Result.err(new InvalidRangeError("Percentage must be within (0, 1), got " + percentage));
        }
        if (tickSpacing <= 0) {
            return Result.err(new InvalidRangeError("Tick spacing must be positive, got " + tickSpacing));
        }
        return centerTick(center).flatMap(centerTick -> {
            long deltaUpper = Math.round(Math.log(1.0 + percentage) / DepositConstants.LN_TICK_BASE);
            long deltaLower = Math.round(Math.log(1.0 - percentage) / DepositConstants.LN_TICK_BASE);
            int lower = TickPriceMath.alignTickToSpacing(clamp(centerTick + deltaLower), tickSpacing, RoundMode.UP);
            int upper = TickPriceMath.alignTickToSpacing(clamp(centerTick + deltaUpper), tickSpacing, RoundMode.DOWN);
            if (upper - lower < tickSpacing) {
                logger.debug("Preset {} around tick {} collapses to [{}, {}] at spacing {}",
                        percentage, centerTick, lower, upper, tickSpacing);
                return Result.err(new RangeTooNarrowError(
                        "Range of ±" + (percentage * 100) + "% is narrower than one tick spacing (" + tickSpacing + ")",
                        tickSpacing));
            }
            return Result.ok(new TickRange(lower, upper));
        });
    }

    public TickRange fullRange(final int tickSpacing) {
        return TickRange.fullRange(tickSpacing);
    }

    /**
     * Name of the preset that would produce {@code range} around {@code centerTick}, if any.
     */
    public Optional<String> detectPreset(final TickRange range, final int centerTick, final int tickSpacing) {
        if (range.isFullRange(tickSpacing)) {
            return Optional.of(DepositConstants.PRESET_FULL_RANGE);
        }
        for (Map.Entry<String, Double> entry : DepositConstants.PRESET_PERCENTAGES.entrySet()) {
            Result<TickRange, DomainError> expected = resolve(entry.getValue(), Center.atTick(centerTick), tickSpacing);
            if (expected.isOk() && expected.getValueUnsafe().equals(range)) {
                return Optional.of(entry.getKey());
            }
        }
        return Optional.empty();
    }

    private Result<Integer, DomainError> centerTick(final Center center) {
        if (center == null) {
            return Result.err(new InvalidRangeError("Center tick or price is required"));
        }
        if (center.tick() != null) {
            return Result.ok(center.tick());
        }
        if (center.price() == null || center.quote() == null || center.base() == null || center.ordering() == null) {
            return Result.err(new InvalidRangeError("Center price requires both tokens and their ordering"));
        }
        return TickPriceMath.priceToTick(center.price(), center.quote(), center.base(), center.ordering())
                .map(tick -> clamp(Math.round(tick)));
    }

    private static int clamp(final long tick) {
        return (int) Math.max(DepositConstants.MIN_TICK, Math.min(DepositConstants.MAX_TICK, tick));
    }
}
