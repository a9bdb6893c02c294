package com.commissionaudit.reconciliation.config;

import com.commissionaudit.reconciliation.policy.CommissionPolicy;
import com.commissionaudit.reconciliation.policy.CommissionTier;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * Builds the immutable {@link CommissionPolicy} from commission.policy.*.
 * An invalid tier table fails startup.
 */
@Slf4j
@Configuration
public class CommissionPolicyConfig {

    @Bean
    public CommissionPolicy commissionPolicy(CommissionPolicyProperties properties) {
        List<CommissionTier> tiers = properties.getTiers().stream()
                .map(tier -> CommissionTier.builder()
                        .name(tier.getName())
                        .min(tier.getMin())
                        .max(tier.getMax())
                        .repeatRate(tier.getRepeatRate())
                        .newRate(tier.getNewRate())
                        .incentiveRate(tier.getIncentiveRate())
                        .bonus(tier.getBonus())
                        .build())
                .toList();

        CommissionPolicy policy = new CommissionPolicy(tiers, properties.getIncentiveRateOverride());

        for (CommissionTier tier : policy.getTiers()) {
            log.info("Commission tier {}: [{}, {}] repeat={} new={} incentive={} bonus={}",
                    tier.getName(), tier.getMin(), tier.isUnbounded() ? "inf" : tier.getMax(),
                    tier.getRepeatRate(), tier.getNewRate(), tier.getIncentiveRate(), tier.getBonus());
        }
        if (policy.getIncentiveRateOverride() != null) {
            log.info("Incentive rate override: {}", policy.getIncentiveRateOverride());
        }
        return policy;
    }
}
