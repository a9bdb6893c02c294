package com.commissionaudit.reconciliation.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Tier table as written in application.yml under commission.policy.
 */
@Data
@Component
@Validated
@ConfigurationProperties(prefix = "commission.policy")
public class CommissionPolicyProperties {

    @Valid
    @NotEmpty(message = "commission.policy.tiers must list at least one tier")
    private List<Tier> tiers = new ArrayList<>();

    /** Policy-wide incentive rate; beats the tier rate, loses to a per-row override. */
    @PositiveOrZero
    private BigDecimal incentiveRateOverride;

    @Data
    public static class Tier {

        @NotBlank
        private String name;

        @NotNull
        private BigDecimal min;

        // empty = unbounded
        private BigDecimal max;

        @NotNull
        private BigDecimal repeatRate;

        @NotNull
        private BigDecimal newRate;

        @NotNull
        private BigDecimal incentiveRate;

        @PositiveOrZero
        private BigDecimal bonus = BigDecimal.ZERO;
    }
}
