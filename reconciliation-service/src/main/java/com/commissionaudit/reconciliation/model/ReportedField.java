package com.commissionaudit.reconciliation.model;

/**
 * Figures the payer may state on the summary sheet.
 *
 * The total-commission fields carry a rank; lower rank is the stronger signal
 * for "what the payer says it paid".
 */
public enum ReportedField {

    AMOUNT_DUE_TO_PAYEE("amountDueToPayee", 3),
    FINAL_COMMISSION("finalCommission", 1),
    SUM_OF_COMMISSION("sumOfCommission", 2),
    REPEAT_COMMISSION("repeatCommission", 0),
    NEW_COMMISSION("newCommission", 0),
    INCENTIVE_COMMISSION("incentiveCommission", 0),
    STATE_BONUS("stateBonus", 0),
    TOTAL_REVENUE("totalRevenue", 0);

    private final String key;
    private final int totalSignalRank;

    ReportedField(String key, int totalSignalRank) {
        this.key = key;
        this.totalSignalRank = totalSignalRank;
    }

    public String getKey() {
        return key;
    }

    public int getTotalSignalRank() {
        return totalSignalRank;
    }

    public boolean isTotalSignal() {
        return totalSignalRank > 0;
    }
}
