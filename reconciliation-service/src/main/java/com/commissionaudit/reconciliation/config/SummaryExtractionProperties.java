package com.commissionaudit.reconciliation.config;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

import java.math.BigDecimal;

/**
 * Window for the last-resort "largest plausible number" guess on the summary sheet.
 */
@Data
@Component
@Validated
@NoArgsConstructor
@AllArgsConstructor
@ConfigurationProperties(prefix = "commission.summary")
public class SummaryExtractionProperties {

    @NotNull
    @PositiveOrZero
    private BigDecimal heuristicMin = new BigDecimal("100");

    @NotNull
    @PositiveOrZero
    private BigDecimal heuristicMax = new BigDecimal("10000");
}
