package com.alphix.liquidity.util;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.math.BigInteger;

import static org.assertj.core.api.Assertions.assertThat;

class AmountsTest {

    @Test
    void testParseAcceptsCommaAndScientific() {
        assertThat(Amounts.parse("1,5").getValueUnsafe()).isEqualByComparingTo("1.5");
        assertThat(Amounts.parse("1e-3").getValueUnsafe()).isEqualByComparingTo("0.001");
        assertThat(Amounts.parse(" 2.50 ").getValueUnsafe()).isEqualByComparingTo("2.5");
    }

    @Test
    void testParseBlankAndPlaceholderAreZero() {
        assertThat(Amounts.parse(null).getValueUnsafe()).isEqualByComparingTo(BigDecimal.ZERO);
        assertThat(Amounts.parse("").getValueUnsafe()).isEqualByComparingTo(BigDecimal.ZERO);
        assertThat(Amounts.parse("...").getValueUnsafe()).isEqualByComparingTo(BigDecimal.ZERO);
    }

    @Test
    void testParseRejectsGarbageAndNegatives() {
        assertThat(Amounts.parse("abc").isErr()).isTrue();
        assertThat(Amounts.parse("-1").getErrorUnsafe().code()).isEqualTo("VALIDATION_ERROR");
    }

    @Test
    void testRawUnitsTruncate() {
        assertThat(Amounts.toRawUnits(new BigDecimal("1.2345678"), 6)).isEqualTo(BigInteger.valueOf(1_234_567));
        assertThat(Amounts.toRawUnits(new BigDecimal("1"), 18)).isEqualTo(BigInteger.TEN.pow(18));
        assertThat(Amounts.fromRawUnits(BigInteger.valueOf(1_500_000), 6)).isEqualByComparingTo("1.5");
        assertThat(Amounts.toPlainString(new BigDecimal("1e-9"))).isEqualTo("0.000000001");
    }
}
