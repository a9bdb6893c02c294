package com.commissionaudit.common.util;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.junit.jupiter.api.Assertions.*;

class AmountUtilsTest {

    @Test
    void parseAmount_ShouldHandleNull() {
        assertEquals(BigDecimal.ZERO, AmountUtils.parseAmount(null));
    }

    @Test
    void parseAmount_ShouldHandleNumbers() {
        assertEquals(new BigDecimal("10.5"), AmountUtils.parseAmount(10.5));
        assertEquals(new BigDecimal("100"), AmountUtils.parseAmount(100));
        assertEquals(new BigDecimal("0.015"), AmountUtils.parseAmount(new BigDecimal("0.015")));
    }

    @Test
    void parseAmount_ShouldNotRoundWhileParsing() {
        assertEquals(new BigDecimal("12.3456"), AmountUtils.parseAmount("12.3456"));
    }

    @Test
    void parseAmount_ShouldHandleThousandsSeparatorsAndCurrency() {
        assertEquals(new BigDecimal("1234.50"), AmountUtils.parseAmount("$1,234.50"));
        assertEquals(new BigDecimal("1000"), AmountUtils.parseAmount("1 000"));
        assertEquals(new BigDecimal("12.5"), AmountUtils.parseAmount("12.5%"));
    }

    @Test
    void parseAmount_ShouldReadOnlyLeadingNumber() {
        assertEquals(new BigDecimal("0.5"), AmountUtils.parseAmount(".5"));
        assertEquals(new BigDecimal("50"), AmountUtils.parseAmount("50 units"));
        assertEquals(new BigDecimal("-20"), AmountUtils.parseAmount("-20"));
    }

    @Test
    void parseAmount_ShouldNotSearchInsideText() {
        assertEquals(BigDecimal.ZERO, AmountUtils.parseAmount("(1,250.00)"));
        assertEquals(BigDecimal.ZERO, AmountUtils.parseAmount("PO 2024 pending"));
        assertEquals(BigDecimal.ZERO, AmountUtils.parseAmount(" USD 50.00 "));
    }

    @Test
    void parseAmount_ShouldReturnZeroForText() {
        assertEquals(BigDecimal.ZERO, AmountUtils.parseAmount("n/a"));
        assertEquals(BigDecimal.ZERO, AmountUtils.parseAmount(Double.NaN));
    }

    @Test
    void parseStrict_ShouldRejectLabelsContainingNumbers() {
        assertNull(AmountUtils.parseStrict("Tier 2 commission"));
        assertNull(AmountUtils.parseStrict("FINAL COMMISSION"));
        assertNull(AmountUtils.parseStrict(true));
        assertNull(AmountUtils.parseStrict(null));
        assertNull(AmountUtils.parseStrict(Double.POSITIVE_INFINITY));
    }

    @Test
    void parseStrict_ShouldAcceptDecoratedNumbers() {
        assertEquals(new BigDecimal("150.00"), AmountUtils.parseStrict("$150.00"));
        assertEquals(new BigDecimal("2500"), AmountUtils.parseStrict("2,500"));
        assertEquals(new BigDecimal("3"), AmountUtils.parseStrict("3%"));
        assertEquals(new BigDecimal("-12.5"), AmountUtils.parseStrict("-12.5"));
        assertEquals(new BigDecimal("150.0"), AmountUtils.parseStrict(150.0));
    }

    @Test
    void round_ShouldUseHalfUpToCents() {
        assertEquals(new BigDecimal("1.01"), AmountUtils.round(new BigDecimal("1.005")));
        assertEquals(new BigDecimal("75.00"), AmountUtils.round(new BigDecimal("75")));
        assertNull(AmountUtils.round(null));
    }

    @Test
    void isPositive_ShouldRejectZeroNegativeAndNull() {
        assertTrue(AmountUtils.isPositive(new BigDecimal("0.01")));
        assertFalse(AmountUtils.isPositive(BigDecimal.ZERO));
        assertFalse(AmountUtils.isPositive(new BigDecimal("-1")));
        assertFalse(AmountUtils.isPositive(null));
    }
}
