package com.commissionaudit.reconciliation.config;

import jakarta.validation.constraints.Positive;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

/**
 * Upload admission limits, checked before any workbook is reconciled.
 */
@Data
@Component
@Validated
@NoArgsConstructor
@AllArgsConstructor
@ConfigurationProperties(prefix = "commission.processing")
public class ProcessingProperties {

    @Positive
    private int maxRows = 50_000;

    @Positive
    private long maxFileSizeBytes = 50L * 1024 * 1024;

    @Positive
    private int maxFilesPerBatch = 20;
}
