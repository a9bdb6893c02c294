package com.commissionaudit.reconciliation.service.extraction;

import com.commissionaudit.common.util.AmountUtils;
import com.commissionaudit.common.util.LabelNormalizer;
import com.commissionaudit.reconciliation.model.ClassificationSignals;
import com.commissionaudit.reconciliation.model.HeaderMap;
import com.commissionaudit.reconciliation.model.ProductClass;
import com.commissionaudit.reconciliation.model.Transaction;
import com.commissionaudit.reconciliation.policy.CommissionPolicy;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Turns one detail row into a {@link Transaction}.
 *
 * Columns are found by alias rather than position: payer exports rename and
 * reorder columns freely. Rows without a region or with non-positive sales
 * are not commissionable and yield null.
 */
@Component
public class FieldExtractor {

    private static final Set<String> TRUTHY = Set.of("true", "yes", "y", "x", "1");

    public Transaction extract(List<?> row, HeaderMap headerMap) {
        return extract(row, headerMap, 0);
    }

    public Transaction extract(List<?> row, HeaderMap headerMap, int sourceRow) {
        String region = text(resolve(row, headerMap, DetailField.REGION)).toUpperCase(Locale.ROOT);
        if (region.isEmpty()) {
            return null;
        }

        BigDecimal salesAmount = resolveSalesAmount(row, headerMap);
        if (!AmountUtils.isPositive(salesAmount)) {
            return null;
        }

        Object repeatCell = resolve(row, headerMap, DetailField.REPEAT_COMMISSION);
        Object newCell = resolve(row, headerMap, DetailField.NEW_COMMISSION);
        Object incentiveCell = resolve(row, headerMap, DetailField.INCENTIVE_COMMISSION);
        Object totalCell = resolve(row, headerMap, DetailField.TOTAL_COMMISSION);

        BigDecimal repeatCommission = AmountUtils.parseAmount(repeatCell);
        BigDecimal newCommission = AmountUtils.parseAmount(newCell);
        BigDecimal incentiveCommission = AmountUtils.parseAmount(incentiveCell);
        BigDecimal totalCommission = AmountUtils.parseAmount(totalCell);

        BigDecimal reportedCommission = AmountUtils.isPositive(totalCommission)
                ? totalCommission
                : repeatCommission.add(newCommission).add(incentiveCommission);

        boolean reportedPresent = !LabelNormalizer.isBlank(repeatCell)
                || !LabelNormalizer.isBlank(newCell)
                || !LabelNormalizer.isBlank(incentiveCell)
                || !LabelNormalizer.isBlank(totalCell);

        Object newProductCell = resolve(row, headerMap, DetailField.NEW_PRODUCT_SALES);

        ClassificationSignals signals = ClassificationSignals.builder()
                .incentiveFlag(isTruthy(resolve(row, headerMap, DetailField.INCENTIVE_FLAG)))
                .incentiveCommission(incentiveCommission)
                .newCommission(newCommission)
                .newProductSales(AmountUtils.parseAmount(newProductCell))
                .newProductFlag(isTruthy(newProductCell)
                        || isNewPurchase(resolve(row, headerMap, DetailField.PURCHASE_TYPE)))
                .repeatCommission(repeatCommission)
                .build();

        return Transaction.builder()
                .sourceRow(sourceRow)
                .region(region)
                .invoiceId(text(resolve(row, headerMap, DetailField.INVOICE)))
                .itemCode(text(resolve(row, headerMap, DetailField.ITEM_CODE)))
                .customerId(text(resolve(row, headerMap, DetailField.CUSTOMER)))
                .salesAmount(salesAmount)
                .productClass(ProductClass.classify(signals))
                .reportedCommission(reportedCommission)
                .reportedCommissionPresent(reportedPresent)
                .reportedRepeatCommission(repeatCommission)
                .reportedNewCommission(newCommission)
                .reportedIncentiveCommission(incentiveCommission)
                .incentiveRateOverride(resolveRateOverride(row, headerMap))
                .build();
    }

    /**
     * First non-blank cell among the field's aliases, in alias order.
     */
    Object resolve(List<?> row, HeaderMap headerMap, DetailField field) {
        for (String alias : field.getAliases()) {
            for (Integer col : headerMap.columnsFor(alias)) {
                if (col < row.size() && !LabelNormalizer.isBlank(row.get(col))) {
                    return row.get(col);
                }
            }
        }
        return null;
    }

    private BigDecimal resolveSalesAmount(List<?> row, HeaderMap headerMap) {
        Object salesCell = resolve(row, headerMap, DetailField.SALES_AMOUNT);
        if (salesCell != null) {
            return AmountUtils.parseAmount(salesCell);
        }

        // No revenue column: rebuild it from quantity, price and discount
        Object quantity = resolve(row, headerMap, DetailField.QUANTITY);
        Object unitPrice = resolve(row, headerMap, DetailField.UNIT_PRICE);
        if (quantity == null || unitPrice == null) {
            return BigDecimal.ZERO;
        }
        return AmountUtils.parseAmount(quantity)
                .multiply(AmountUtils.parseAmount(unitPrice))
                .subtract(AmountUtils.parseAmount(resolve(row, headerMap, DetailField.LINE_DISCOUNT)));
    }

    private BigDecimal resolveRateOverride(List<?> row, HeaderMap headerMap) {
        BigDecimal rate = AmountUtils.parseStrict(resolve(row, headerMap, DetailField.INCENTIVE_RATE));
        if (rate == null || rate.signum() <= 0) {
            return null;
        }
        return CommissionPolicy.normalizeRate(rate);
    }

    private static boolean isTruthy(Object cell) {
        if (cell == null) {
            return false;
        }
        if (cell instanceof Boolean) {
            return (Boolean) cell;
        }
        if (cell instanceof Number) {
            return AmountUtils.isPositive(AmountUtils.parseAmount(cell));
        }
        String value = cell.toString().trim().toLowerCase(Locale.ROOT);
        if (TRUTHY.contains(value)) {
            return true;
        }
        BigDecimal numeric = AmountUtils.parseStrict(value);
        return numeric != null && numeric.signum() > 0;
    }

    private static boolean isNewPurchase(Object cell) {
        if (cell == null) {
            return false;
        }
        if (isTruthy(cell)) {
            return true;
        }
        return LabelNormalizer.normalize(cell).startsWith("new");
    }

    private static String text(Object cell) {
        if (cell == null) {
            return "";
        }
        if (cell instanceof Double) {
            double d = (Double) cell;
            if (d == Math.rint(d) && !Double.isInfinite(d)) {
                return String.valueOf((long) d);
            }
        }
        return cell.toString().trim();
    }
}
