package com.commissionaudit.reconciliation.service;

import com.commissionaudit.common.dto.reconciliation.BatchReconciliationDto;
import com.commissionaudit.common.dto.reconciliation.CommissionTierDto;
import com.commissionaudit.common.dto.reconciliation.ReconciliationReportDto;
import com.commissionaudit.common.exception.ValidationException;
import com.commissionaudit.common.infrastructure.RequestCorrelationFilter;
import com.commissionaudit.common.util.AmountUtils;
import com.commissionaudit.reconciliation.config.ProcessingProperties;
import com.commissionaudit.reconciliation.model.ReconciliationResult;
import com.commissionaudit.reconciliation.model.WorkbookGrids;
import com.commissionaudit.reconciliation.policy.CommissionPolicy;
import com.commissionaudit.reconciliation.service.workbook.WorkbookGridReader;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.function.Function;

/**
 * Entry point for uploaded commission workbooks.
 *
 * Admits the file, decodes it with {@link WorkbookGridReader}, runs
 * {@link CommissionReconciliationService} and maps the result for the API.
 * Controllers only delegate to this service.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class WorkbookReconciliationService {

    private final WorkbookGridReader workbookGridReader;
    private final CommissionReconciliationService reconciliationService;
    private final ReconciliationReportMapper reportMapper;
    private final ProcessingProperties processingProperties;
    private final CommissionPolicy commissionPolicy;

    public ReconciliationReportDto reconcileUpload(MultipartFile file) {
        return withRequestId(requestId -> {
            Reconciled reconciled = reconcileFile(file, requestId);
            ReconciliationReportDto report = reportMapper.toReport(reconciled.grids(), reconciled.result());
            report.setRequestId(requestId);
            return report;
        });
    }

    /**
     * Reconcile several workbooks and combine the recomputed totals per region.
     * Any invalid file rejects the whole batch.
     */
    public BatchReconciliationDto reconcileBatch(List<MultipartFile> files) {
        return withRequestId(requestId -> reconcileBatch(files, requestId));
    }

    private BatchReconciliationDto reconcileBatch(List<MultipartFile> files, String requestId) {
        if (files == null || files.isEmpty()) {
            throw new ValidationException("files", "At least one file is required");
        }
        if (files.size() > processingProperties.getMaxFilesPerBatch()) {
            throw new ValidationException("files", String.format(
                    "At most %d files per upload, got %d", processingProperties.getMaxFilesPerBatch(), files.size()));
        }
        files.forEach(this::validateFile);

        log.info("[{}] 📥 Batch reconciliation started - {} files", requestId, files.size());

        List<ReconciliationReportDto> reports = new ArrayList<>(files.size());
        List<ReconciliationResult> results = new ArrayList<>(files.size());
        BigDecimal totalWithBonus = BigDecimal.ZERO;
        BigDecimal totalOwed = BigDecimal.ZERO;

        for (MultipartFile file : files) {
            Reconciled reconciled = reconcileFile(file, requestId);
            results.add(reconciled.result());
            ReconciliationReportDto report = reportMapper.toReport(reconciled.grids(), reconciled.result());
            report.setRequestId(requestId);
            reports.add(report);
            totalWithBonus = totalWithBonus.add(reconciled.result().getGrand().getTotalWithBonus());
            totalOwed = totalOwed.add(reconciled.result().getTotals().getTotalOwed());
        }

        log.info("[{}] ✅ Batch reconciliation completed - files: {}, total with bonus: {}, owed: {}",
                requestId, files.size(), totalWithBonus, totalOwed);

        return BatchReconciliationDto.builder()
                .requestId(requestId)
                .fileCount(files.size())
                .message(String.format("Reconciled %d workbooks", files.size()))
                .files(reports)
                .combinedRegions(reportMapper.combineRegions(results))
                .totalWithBonus(AmountUtils.round(totalWithBonus))
                .totalOwed(AmountUtils.round(totalOwed))
                .build();
    }

    public List<CommissionTierDto> getPolicy() {
        return reportMapper.toTierDtos(commissionPolicy);
    }

    private Reconciled reconcileFile(MultipartFile file, String requestId) {
        long startTime = System.currentTimeMillis();
        validateFile(file);

        log.info("[{}] 📥 Reconciliation started - File: {}, Size: {} bytes",
                requestId, file.getOriginalFilename(), file.getSize());

        try {
            WorkbookGrids grids = workbookGridReader.read(file.getInputStream(), file.getOriginalFilename());
            ReconciliationResult result = reconciliationService.reconcile(grids);

            long duration = System.currentTimeMillis() - startTime;
            log.info("[{}] ✅ Reconciliation completed in {}ms - Regions: {}, Transactions: {}, Skipped: {}, Owed: {}",
                    requestId, duration,
                    result.getRegions().size(),
                    result.getTransactionCount(),
                    result.getSkippedRows(),
                    result.getTotals().getTotalOwed());

            return new Reconciled(grids, result);

        } catch (IOException e) {
            log.error("[{}] ❌ Error reading Excel file: {}", requestId, e.getMessage(), e);
            throw new ValidationException("file", "Failed to read Excel file: " + e.getMessage());
        } catch (RuntimeException e) {
            log.error("[{}] ❌ Reconciliation failed for {}: {}", requestId, file.getOriginalFilename(), e.getMessage());
            throw e;
        }
    }

    private void validateFile(MultipartFile file) {
        if (file == null || file.isEmpty()) {
            throw new ValidationException("file", "File is required");
        }

        if (file.getSize() > processingProperties.getMaxFileSizeBytes()) {
            throw new ValidationException("file", String.format(
                    "File size exceeds maximum (%d bytes)", processingProperties.getMaxFileSizeBytes()));
        }

        String filename = file.getOriginalFilename();
        String lower = filename != null ? filename.toLowerCase(Locale.ROOT) : null;
        if (lower == null || (!lower.endsWith(".xlsx") && !lower.endsWith(".xls"))) {
            throw new ValidationException("file", "File must be an Excel file (.xlsx or .xls)");
        }
    }

    /**
     * Runs the work under the HTTP request's id. Callers outside a correlated request
     * get a fresh id in the MDC for the duration of the call.
     */
    private <T> T withRequestId(Function<String, T> work) {
        String requestId = RequestCorrelationFilter.currentRequestId();
        if (requestId != null) {
            return work.apply(requestId);
        }
        requestId = RequestCorrelationFilter.newRequestId();
        try (MDC.MDCCloseable ignored = MDC.putCloseable(RequestCorrelationFilter.MDC_KEY, requestId)) {
            return work.apply(requestId);
        }
    }

    private record Reconciled(WorkbookGrids grids, ReconciliationResult result) {
    }
}
