package com.alphix.liquidity.service;

import com.alphix.liquidity.model.TickRange;
import com.alphix.liquidity.model.TokenRef;
import com.alphix.liquidity.service.RangeDisplayService.RangeDisplay;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class RangeDisplayServiceTest {

    private static final TokenRef LOW = new TokenRef("LOW", "0x0000000000000000000000000000000000000001", 18, 4);
    private static final TokenRef HIGH = new TokenRef("HIGH", "0x0000000000000000000000000000000000000002", 18, 4);

    private final RangeDisplayService service = new RangeDisplayService(new RangePresetResolver());

    @Test
    void testNarrowRangeAroundParity() {
        RangeDisplay display = service.display(new TickRange(-60, 60), HIGH, LOW, 60, 0);

        assertThat(display.minPrice()).isEqualTo("0.9940");
        assertThat(display.maxPrice()).isEqualTo("1.0060");
        assertThat(display.fullRange()).isFalse();
        assertThat(display.preset()).isEqualTo("±1%");
        assertThat(display.baseSymbol()).isEqualTo("LOW");
        assertThat(display.quoteSymbol()).isEqualTo("HIGH");
    }

    @Test
    void testInvertedViewKeepsMinBelowMax() {
        RangeDisplay display = service.display(new TickRange(0, 6960), LOW, HIGH, 60, null);

        assertThat(Double.parseDouble(display.minPrice())).isLessThan(Double.parseDouble(display.maxPrice()));
        assertThat(display.maxPrice()).isEqualTo("1.0000");
    }

    @Test
    void testFullRangeRendersZeroAndInfinity() {
        RangeDisplay display = service.display(TickRange.fullRange(60), HIGH, LOW, 60, null);

        assertThat(display.minPrice()).isEqualTo(RangeDisplayService.ZERO);
        assertThat(display.maxPrice()).isEqualTo(RangeDisplayService.INFINITY);
        assertThat(display.fullRange()).isTrue();
        assertThat(display.preset()).isEqualTo("Full Range");
    }

    @Test
    void testFormat() {
        assertThat(RangeDisplayService.format(1e-12, 4)).isEqualTo("0");
        assertThat(RangeDisplayService.format(Double.POSITIVE_INFINITY, 4)).isEqualTo("∞");
        assertThat(RangeDisplayService.format(1e31, 4)).isEqualTo("∞");
        assertThat(RangeDisplayService.format(1234.56789, 2)).isEqualTo("1234.57");
    }
}
