package com.alphix.liquidity.service;

import com.alphix.liquidity.model.PoolOrdering;
import com.alphix.liquidity.model.TickRange;
import com.alphix.liquidity.model.TokenRef;
import com.alphix.liquidity.util.TickPriceMath;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Min/max price strings for a tick range, in whichever direction the user is viewing prices.
 */
@Service
public class RangeDisplayService {

    public static final String INFINITY = "∞";
    public static final String ZERO = "0";

    private static final double ZERO_THRESHOLD = 1e-11;
    private static final double INFINITY_THRESHOLD = 1e30;

    private final RangePresetResolver presetResolver;

    public RangeDisplayService(RangePresetResolver presetResolver) {
        this.presetResolver = presetResolver;
    }

    public record RangeDisplay(
            String minPrice,
            String maxPrice,
            boolean fullRange,
            String preset,
            String baseSymbol,
            String quoteSymbol
    ) {}

    /**
     * @param centerTick current pool tick, used only for preset detection; may be null
     */
    public RangeDisplay display(TickRange range, TokenRef quote, TokenRef base, int tickSpacing, Integer centerTick) {
        PoolOrdering ordering = PoolOrdering.of(quote, base);
        double atLower = TickPriceMath.tickToPrice(range.lower(), quote, base, ordering);
        double atUpper = TickPriceMath.tickToPrice(range.upper(), quote, base, ordering);
        boolean lowerAtLimit = range.lower() <= TickPriceMath.minUsableTick(tickSpacing);
        boolean upperAtLimit = range.upper() >= TickPriceMath.maxUsableTick(tickSpacing);

        // price rises with tick only when base is canonical0
        boolean ascending = ordering.isCanonical0(base);
        double min = ascending ? atLower : atUpper;
        double max = ascending ? atUpper : atLower;
        boolean minAtLimit = ascending ? lowerAtLimit : upperAtLimit;
        boolean maxAtLimit = ascending ? upperAtLimit : lowerAtLimit;

        int decimals = quote.displayDecimals();
        String minText = minAtLimit ? ZERO : format(min, decimals);
        String maxText = maxAtLimit ? INFINITY : format(max, decimals);

        String preset = null;
        if (centerTick != null) {
            preset = presetResolver.detectPreset(range, centerTick, tickSpacing).orElse(null);
        } else if (range.isFullRange(tickSpacing)) {
            preset = presetResolver.detectPreset(range, 0, tickSpacing).orElse(null);
        }
        return new RangeDisplay(minText, maxText, range.isFullRange(tickSpacing), preset, base.symbol(), quote.symbol());
    }

    public static String format(double value, int decimals) {
        if (Double.isNaN(value)) {
            return "";
        }
        if (value >= 0 && value < ZERO_THRESHOLD) {
            return ZERO;
        }
        if (Double.isInfinite(value) || value > INFINITY_THRESHOLD) {
            return INFINITY;
        }
        return BigDecimal.valueOf(value).setScale(decimals, RoundingMode.HALF_UP).toPlainString();
    }
}
