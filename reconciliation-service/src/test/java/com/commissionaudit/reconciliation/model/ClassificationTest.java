package com.commissionaudit.reconciliation.model;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.junit.jupiter.api.Assertions.*;

class ClassificationTest {

    @Test
    void of_ShouldKeepExactToleranceAligned() {
        assertEquals(Classification.ALIGNED, Classification.of(new BigDecimal("0.01")));
        assertEquals(Classification.ALIGNED, Classification.of(new BigDecimal("-0.01")));
        assertEquals(Classification.ALIGNED, Classification.of(BigDecimal.ZERO));
    }

    @Test
    void of_ShouldFlagBeyondTolerance() {
        assertEquals(Classification.UNDERPAID, Classification.of(new BigDecimal("0.011")));
        assertEquals(Classification.OVERPAID, Classification.of(new BigDecimal("-0.011")));
    }
}
