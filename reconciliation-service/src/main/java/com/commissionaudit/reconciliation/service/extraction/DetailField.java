package com.commissionaudit.reconciliation.service.extraction;

import java.util.List;

/**
 * Semantic columns of a detail sheet and the header spellings seen for each,
 * most specific first.
 */
public enum DetailField {

    REGION("ship to state", "shiptostate", "state", "ship state", "bill to state", "billing state", "region", "st"),
    INVOICE("invoice no", "invoice number", "invoice #", "invoice"),
    ITEM_CODE("item code", "item number", "item", "sku", "part number"),
    CUSTOMER("customer no", "customer number", "customer id", "customer"),
    SALES_AMOUNT("total discounted revenue", "total revenue", "line subtotal", "subtotal", "net sales",
            "revenue", "extended price", "line total", "net amount", "sales amount", "sales", "amount"),
    QUANTITY("quantity", "qty", "quantity shipped", "qty shipped"),
    UNIT_PRICE("unit price", "price"),
    LINE_DISCOUNT("line discount", "line discount amt", "discount amount", "discount"),
    REPEAT_COMMISSION("repeat product commission", "repeat commission"),
    NEW_COMMISSION("new product commission", "new commission"),
    INCENTIVE_COMMISSION("incentive product commission", "incentive commission"),
    TOTAL_COMMISSION("total commission", "line commission", "commission"),
    INCENTIVE_FLAG("is incentivized", "incentivized", "incentive product", "on incentive list", "incentive"),
    INCENTIVE_RATE("incentive rate override", "incentive commission rate", "incentive rate"),
    NEW_PRODUCT_SALES("customer current period new product sales", "new product sales", "new product"),
    PURCHASE_TYPE("purchase type", "new repeat", "new or repeat", "is new");

    private final List<String> aliases;

    DetailField(String... aliases) {
        this.aliases = List.of(aliases);
    }

    public List<String> getAliases() {
        return aliases;
    }
}
