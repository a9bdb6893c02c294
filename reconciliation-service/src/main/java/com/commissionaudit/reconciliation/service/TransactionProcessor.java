package com.commissionaudit.reconciliation.service;

import com.commissionaudit.reconciliation.model.ProcessedLine;
import com.commissionaudit.reconciliation.model.Transaction;
import com.commissionaudit.reconciliation.policy.CommissionPolicy;
import com.commissionaudit.reconciliation.policy.CommissionTier;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;

/**
 * Recomputes the commission of a single transaction under a given tier.
 */
@Component
public class TransactionProcessor {

    public ProcessedLine process(Transaction transaction, CommissionTier tier, CommissionPolicy policy) {
        BigDecimal rate = policy.rateFor(tier, transaction);

        return ProcessedLine.builder()
                .transaction(transaction)
                .tier(tier)
                .appliedRate(rate)
                .recomputedCommission(transaction.getSalesAmount().multiply(rate))
                .build();
    }
}
