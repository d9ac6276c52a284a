package com.alphix.liquidity.controller;

import com.alphix.liquidity.client.LiquidityCalculator.LiquidityQuote;
import com.alphix.liquidity.client.PoolStateReader;
import com.alphix.liquidity.common.DomainError;
import com.alphix.liquidity.common.DomainErrorException;
import com.alphix.liquidity.common.Result;
import com.alphix.liquidity.common.errors.ValidationError;
import com.alphix.liquidity.config.DepositProperties;
import com.alphix.liquidity.constants.DepositConstants;
import com.alphix.liquidity.dto.CalculationRequest;
import com.alphix.liquidity.dto.CalculationResponse;
import com.alphix.liquidity.dto.PoolStateResponse;
import com.alphix.liquidity.dto.RangePresetResponse;
import com.alphix.liquidity.dto.TickPriceResponse;
import com.alphix.liquidity.model.InputSide;
import com.alphix.liquidity.model.PoolOrdering;
import com.alphix.liquidity.model.RoundMode;
import com.alphix.liquidity.model.TickRange;
import com.alphix.liquidity.model.TokenRef;
import com.alphix.liquidity.service.AmountCalculationService;
import com.alphix.liquidity.service.AmountCalculationService.CalculationInput;
import com.alphix.liquidity.service.AmountCalculationService.CalculationOutcome;
import com.alphix.liquidity.service.RangeDisplayService;
import com.alphix.liquidity.service.RangePresetResolver;
import com.alphix.liquidity.util.TickPriceMath;
import io.opentelemetry.instrumentation.annotations.WithSpan;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Stateless helpers for the deposit form: range presets, tick/price conversion, paired amounts
 * and pool state. Prices are always "base in quote".
 */
@RestController
@RequestMapping("/api/liquidity")
public class LiquidityMathController {

    private final DepositProperties properties;
    private final RangePresetResolver presetResolver;
    private final RangeDisplayService displayService;
    private final AmountCalculationService amountCalculationService;
    private final PoolStateReader poolStateReader;

    public LiquidityMathController(DepositProperties properties,
                                   RangePresetResolver presetResolver,
                                   RangeDisplayService displayService,
                                   AmountCalculationService amountCalculationService,
                                   PoolStateReader poolStateReader) {
        this.properties = properties;
        this.presetResolver = presetResolver;
        this.displayService = displayService;
        this.amountCalculationService = amountCalculationService;
        this.poolStateReader = poolStateReader;
    }

    /**
     * Resolves one preset ("±3%", "Full Range") or a custom percentage (0.02 = ±2%).
     */
    @GetMapping("/range-preset")
    public RangePresetResponse rangePreset(@RequestParam String baseSymbol,
                                           @RequestParam String quoteSymbol,
                                           @RequestParam(required = false) String preset,
                                           @RequestParam(required = false) Double percentage,
                                           @RequestParam(required = false) Integer centerTick,
                                           @RequestParam(required = false) Double centerPrice) {
        TokenRef base = token(baseSymbol);
        TokenRef quote = token(quoteSymbol);
        RangePresetResolver.Center center = center(base, quote, centerTick, centerPrice);
        int spacing = properties.getTickSpacing();
        Result<TickRange, DomainError> range;
        String label;
        if (preset != null && !preset.isBlank()) {
            range = presetResolver.resolve(preset, center, spacing);
            label = preset;
        } else if (percentage != null) {
            range = presetResolver.resolve(percentage, center, spacing);
            label = null;
        } else {
            throw new DomainErrorException(new ValidationError("preset or percentage is required"));
        }
        return toPresetResponse(label, orThrow(range), quote, base, spacing);
    }

    /**
     * Every standard preset around the center. Presets too narrow for the pool's spacing are left out.
     */
    @GetMapping("/range-presets")
    public List<RangePresetResponse> rangePresets(@RequestParam String baseSymbol,
                                                  @RequestParam String quoteSymbol,
                                                  @RequestParam(required = false) Integer centerTick,
                                                  @RequestParam(required = false) Double centerPrice) {
        TokenRef base = token(baseSymbol);
        TokenRef quote = token(quoteSymbol);
        RangePresetResolver.Center center = center(base, quote, centerTick, centerPrice);
        int spacing = properties.getTickSpacing();
        List<RangePresetResponse> presets = new ArrayList<>();
        for (String preset : DepositConstants.PRESET_PERCENTAGES.keySet()) {
            Result<TickRange, DomainError> range = presetResolver.resolve(preset, center, spacing);
            if (range.isOk()) {
                presets.add(toPresetResponse(preset, range.getValueUnsafe(), quote, base, spacing));
            }
        }
        presets.add(toPresetResponse(DepositConstants.PRESET_FULL_RANGE, presetResolver.fullRange(spacing),
            quote, base, spacing));
        return presets;
    }

    @GetMapping("/tick-to-price")
    public TickPriceResponse tickToPrice(@RequestParam int tick,
                                         @RequestParam String baseSymbol,
                                         @RequestParam String quoteSymbol) {
        TokenRef base = token(baseSymbol);
        TokenRef quote = token(quoteSymbol);
        double price = TickPriceMath.tickToPrice(tick, quote, base, ordering(quote, base));
        return new TickPriceResponse((double) tick, null,
            RangeDisplayService.format(price, quote.displayDecimals()), base.symbol(), quote.symbol());
    }

    @GetMapping("/price-to-tick")
    public TickPriceResponse priceToTick(@RequestParam double price,
                                         @RequestParam String baseSymbol,
                                         @RequestParam String quoteSymbol,
                                         @RequestParam(defaultValue = "DOWN") RoundMode round) {
        TokenRef base = token(baseSymbol);
        TokenRef quote = token(quoteSymbol);
        PoolOrdering ordering = ordering(quote, base);
        double tick = orThrow(TickPriceMath.priceToTick(price, quote, base, ordering));
        int aligned = orThrow(TickPriceMath.priceToAlignedTick(price, quote, base, ordering,
            properties.getTickSpacing(), round));
        return new TickPriceResponse(tick, aligned, RangeDisplayService.format(price, quote.displayDecimals()),
            base.symbol(), quote.symbol());
    }

    /**
     * Debounced paired-amount lookup. A request replaced by a newer one for the same key answers
     * {@code SUPERSEDED}; the caller keeps whatever it shows.
     */
    @PostMapping("/quote")
    @WithSpan
    public CompletableFuture<CalculationResponse> quote(@Valid @RequestBody CalculationRequest request) {
        TokenRef token0 = token(request.token0Symbol());
        TokenRef token1 = token(request.token1Symbol());
        InputSide side = parseSide(request.inputSide());
        CalculationInput input = new CalculationInput(token0, token1, request.amount0(), request.amount1(),
            request.tickLower(), request.tickUpper(), side, request.currentPoolTick());
        return amountCalculationService.request(request.key(), input)
            .thenApply(outcome -> toCalculationResponse(outcome, side));
    }

    /**
     * Drops the form's pending lookup, e.g. when the user clears both amounts.
     */
    @DeleteMapping("/quote/{key}")
    public ResponseEntity<Void> clearQuote(@PathVariable String key) {
        amountCalculationService.clear(key);
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/pool-state")
    @WithSpan
    public CompletableFuture<PoolStateResponse> poolState(@RequestParam String baseSymbol,
                                                          @RequestParam String quoteSymbol) {
        TokenRef base = token(baseSymbol);
        TokenRef quote = token(quoteSymbol);
        PoolOrdering ordering = ordering(quote, base);
        return poolStateReader.read(ordering.canonical0(), ordering.canonical1(), properties.getChainId())
            .thenApply(state -> {
                String price = TickPriceMath.sqrtPriceX96ToPrice(state.sqrtPriceX96(), quote, base, ordering)
                    .map(value -> value.toPlainString())
                    .getOrElse(state.currentPrice());
                return new PoolStateResponse(
                    state.poolId(),
                    state.currentTick(),
                    state.sqrtPriceX96() != null ? state.sqrtPriceX96().toString() : null,
                    state.liquidity() != null ? state.liquidity().toString() : null,
                    price,
                    base.symbol(),
                    quote.symbol()
                );
            });
    }

    // ========================================
    // HELPERS
    // ========================================

    private RangePresetResponse toPresetResponse(String preset, TickRange range, TokenRef quote, TokenRef base,
                                                 int spacing) {
        RangeDisplayService.RangeDisplay display = displayService.display(range, quote, base, spacing, null);
        return new RangePresetResponse(
            preset != null ? preset : display.preset(),
            range.lower(),
            range.upper(),
            display.minPrice(),
            display.maxPrice(),
            display.fullRange(),
            display.baseSymbol(),
            display.quoteSymbol()
        );
    }

    private static CalculationResponse toCalculationResponse(CalculationOutcome outcome, InputSide side) {
        String dependentField = side == InputSide.TOKEN0 ? "amount1" : "amount0";
        LiquidityQuote quote = outcome.quote();
        DomainError error = outcome.error();
        return new CalculationResponse(
            outcome.status().name(),
            dependentField,
            outcome.dependentAmount() != null ? outcome.dependentAmount().toPlainString() : null,
            quote != null && quote.liquidity() != null ? quote.liquidity().toString() : null,
            quote != null ? quote.currentPoolTick() : null,
            quote != null ? quote.currentPrice() : null,
            quote != null ? quote.priceAtTickLower() : null,
            quote != null ? quote.priceAtTickUpper() : null,
            error != null ? error.code() : null,
            error != null ? error.message() : null
        );
    }

    private RangePresetResolver.Center center(TokenRef base, TokenRef quote, Integer centerTick, Double centerPrice) {
        if (centerTick != null) {
            return RangePresetResolver.Center.atTick(centerTick);
        }
        if (centerPrice != null) {
            return RangePresetResolver.Center.atPrice(centerPrice, quote, base, ordering(quote, base));
        }
        throw new DomainErrorException(new ValidationError("centerTick or centerPrice is required"));
    }

    private TokenRef token(String symbol) {
        return properties.tokenBySymbol(symbol)
            .orElseThrow(() -> new DomainErrorException(new ValidationError("Unknown token: " + symbol)));
    }

    private static PoolOrdering ordering(TokenRef quote, TokenRef base) {
        if (quote.sameToken(base)) {
            throw new DomainErrorException(new ValidationError("baseSymbol and quoteSymbol must differ"));
        }
        return PoolOrdering.of(quote, base);
    }

    private static InputSide parseSide(String side) {
        return InputSide.parse(side).orElseThrow(() ->
            new DomainErrorException(new ValidationError("inputSide must be TOKEN0 or TOKEN1, got: " + side)));
    }

    private static <T> T orThrow(Result<T, DomainError> result) {
        return result.orElseThrow(DomainErrorException::new);
    }
}
