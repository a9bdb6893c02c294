package com.commissionaudit.reconciliation.service.extraction;

import com.commissionaudit.common.util.LabelNormalizer;
import com.commissionaudit.reconciliation.model.ReportedField;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.util.List;

/**
 * Label patterns for one summary figure and where to look for its value.
 *
 * Patterns are matched by normalized substring, so rule order matters:
 * product-type rules go before the generic total rules, otherwise
 * "Incentive Commission Total" would be read as the final commission.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class SummaryLabelRule {

    private static final List<AdjacentCell> DEFAULT_SEARCH_ORDER = List.of(
            AdjacentCell.RIGHT,
            AdjacentCell.TWO_RIGHT,
            AdjacentCell.DOWN,
            AdjacentCell.DIAGONAL_DOWN_RIGHT,
            AdjacentCell.LEFT);

    private static final List<SummaryLabelRule> DEFAULT_RULES = List.of(
            of(ReportedField.REPEAT_COMMISSION, "repeat product commission", "repeat commission"),
            of(ReportedField.NEW_COMMISSION, "new product commission", "new commission"),
            of(ReportedField.INCENTIVE_COMMISSION, "incentive product commission", "incentive commission"),
            of(ReportedField.STATE_BONUS, "additional state commission", "added state commission",
                    "added state commisison", "state bonus"),
            of(ReportedField.AMOUNT_DUE_TO_PAYEE, "amount due salesperson", "amount due to salesperson",
                    "salesperson amount due", "amount due"),
            of(ReportedField.FINAL_COMMISSION, "final commission", "total commission amount", "commission total"),
            of(ReportedField.SUM_OF_COMMISSION, "sum of total commission", "sum of commission"),
            of(ReportedField.TOTAL_REVENUE, "total revenue", "gross revenue"));

    ReportedField field;
    List<String> patterns;
    List<AdjacentCell> searchOrder;

    public static SummaryLabelRule of(ReportedField field, String... patterns) {
        return new SummaryLabelRule(field, List.of(patterns), DEFAULT_SEARCH_ORDER);
    }

    public static List<SummaryLabelRule> defaultRules() {
        return DEFAULT_RULES;
    }

    public boolean matches(Object cellText) {
        for (String pattern : patterns) {
            if (LabelNormalizer.containsLabel(cellText, pattern)) {
                return true;
            }
        }
        return false;
    }
}
