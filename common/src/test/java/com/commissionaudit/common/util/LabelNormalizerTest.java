package com.commissionaudit.common.util;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class LabelNormalizerTest {

    @Test
    void normalize_ShouldIgnoreCaseSpacingAndPunctuation() {
        assertEquals("shiptostate", LabelNormalizer.normalize("Ship To State"));
        assertEquals("shiptostate", LabelNormalizer.normalize("ship_to_state"));
        assertEquals("shiptostate", LabelNormalizer.normalize(" SHIP-TO-STATE "));
        assertEquals("customercurrentperiodnewproductsales",
                LabelNormalizer.normalize("Customer_ Current_Period_New_Product_sales"));
    }

    @Test
    void normalize_ShouldHandleNullAndNumbers() {
        assertEquals("", LabelNormalizer.normalize(null));
        assertEquals("1500", LabelNormalizer.normalize(1500));
    }

    @Test
    void containsLabel_ShouldMatchInsideLongerText() {
        assertTrue(LabelNormalizer.containsLabel("FINAL COMMISSION:", "final commission"));
        assertTrue(LabelNormalizer.containsLabel("Amount Due Salesperson", "amount due"));
        assertFalse(LabelNormalizer.containsLabel("Commission", "final commission"));
    }

    @Test
    void containsLabel_ShouldNeverMatchEmptyPattern() {
        assertFalse(LabelNormalizer.containsLabel("anything", " - "));
    }

    @Test
    void isBlank_ShouldTreatWhitespaceAsBlank() {
        assertTrue(LabelNormalizer.isBlank(null));
        assertTrue(LabelNormalizer.isBlank("   "));
        assertFalse(LabelNormalizer.isBlank(0.0));
    }
}
