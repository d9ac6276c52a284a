// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.alphix.liquidity.service;

import com.alphix.liquidity.common.DomainError;
import com.alphix.liquidity.common.Result;
import com.alphix.liquidity.model.PoolOrdering;
import com.alphix.liquidity.model.TickRange;
import com.alphix.liquidity.model.TokenRef;
import com.alphix.liquidity.service.RangePresetResolver.Center;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("Range preset resolution")
class RangePresetResolverTest {

    private final RangePresetResolver resolver = new RangePresetResolver();

    @Test
    @DisplayName("±3% around tick 0 at spacing 60: lower aligned up, upper aligned down")
    void testThreePercent() {
        Result<TickRange, DomainError> range = resolver.resolve("±3%", Center.atTick(0), 60);

        assertThat(range.getValueUnsafe()).isEqualTo(new TickRange(-300, 240));
    }

    @Test
    void testFifteenPercentOffCenter() {
        assertThat(resolver.resolve(0.15, Center.atTick(1000), 60).getValueUnsafe())
            .isEqualTo(new TickRange(-600, 2340));
    }

    @Test
    @DisplayName("Preset near the max tick is clamped to the usable bound")
    void testClampNearMaxTick() {
        TickRange range = resolver.resolve("±15%", Center.atTick(887_000), 60).getValueUnsafe();

        assertThat(range.upper()).isEqualTo(887_220);
        assertThat(range.lower()).isEqualTo(885_420);
    }

    @Test
    @DisplayName("±0.001% at spacing 200 is narrower than one spacing unit")
    void testRangeTooNarrow() {
        Result<TickRange, DomainError> range = resolver.resolve(0.00001, Center.atTick(0), 200);

        assertThat(range.isErr()).isTrue();
        assertThat(range.getErrorUnsafe().code()).isEqualTo("RANGE_TOO_NARROW");
        assertThat(resolver.resolve("±0.1%", Center.atTick(0), 60).getErrorUnsafe().code())
            .isEqualTo("RANGE_TOO_NARROW");
    }

    @Test
    void testFullRange() {
        TickRange range = resolver.resolve("Full Range", null, 60).getValueUnsafe();

        assertThat(range).isEqualTo(new TickRange(-887_220, 887_220));
        assertThat(range.isFullRange(60)).isTrue();
    }

    @Test
    @DisplayName("Without a center tick the center price is converted first")
    void testCenterPriceFallback() {
        TokenRef a = new TokenRef("A", "0x0000000000000000000000000000000000000001", 18, 4);
        TokenRef b = new TokenRef("B", "0x0000000000000000000000000000000000000002", 18, 4);
        Center center = Center.atPrice(2.0, b, a, PoolOrdering.of(a, b));

        assertThat(resolver.resolve("±1%", center, 60).getValueUnsafe()).isEqualTo(new TickRange(6840, 7020));
    }

    @Test
    void testInvalidInputs() {
        assertThat(resolver.resolve("±42%", Center.atTick(0), 60).getErrorUnsafe().code()).isEqualTo("INVALID_RANGE");
        assertThat(resolver.resolve(1.5, Center.atTick(0), 60).getErrorUnsafe().code()).isEqualTo("INVALID_RANGE");
        assertThat(resolver.resolve(0.03, null, 60).getErrorUnsafe().code()).isEqualTo("INVALID_RANGE");
    }

    @Test
    void testDetectPreset() {
        assertThat(resolver.detectPreset(new TickRange(-300, 240), 0, 60)).contains("±3%");
        assertThat(resolver.detectPreset(new TickRange(-887_220, 887_220), 0, 60)).contains("Full Range");
        assertThat(resolver.detectPreset(new TickRange(-120, 600), 0, 60)).isEmpty();
    }
}
