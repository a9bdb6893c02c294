package com.commissionaudit.reconciliation.controller;

import com.commissionaudit.common.dto.ApiResponse;
import com.commissionaudit.common.dto.reconciliation.BatchReconciliationDto;
import com.commissionaudit.common.dto.reconciliation.CommissionTierDto;
import com.commissionaudit.common.dto.reconciliation.ReconciliationReportDto;
import com.commissionaudit.reconciliation.service.WorkbookReconciliationService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

import java.util.List;

/**
 * REST Controller for commission audits.
 *
 * Controllers contain no business logic; everything is delegated to
 * WorkbookReconciliationService.
 */
@RestController
@RequestMapping("/api/commission")
@RequiredArgsConstructor
@Tag(name = "Commission audit", description = "Recompute and reconcile payer commission statements")
public class ReconciliationController {

    private final WorkbookReconciliationService workbookReconciliationService;

    @PostMapping(value = "/reconcile", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    @Operation(summary = "Reconcile one commission workbook (detail + summary sheets)")
    public ResponseEntity<ApiResponse<ReconciliationReportDto>> reconcile(
            @RequestParam("file") MultipartFile file) {

        ReconciliationReportDto report = workbookReconciliationService.reconcileUpload(file);
        return ResponseEntity.ok(ApiResponse.success(report, report.getMessage()));
    }

    @PostMapping(value = "/reconcile/batch", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    @Operation(summary = "Reconcile several workbooks and combine totals per region")
    public ResponseEntity<ApiResponse<BatchReconciliationDto>> reconcileBatch(
            @RequestParam("files") List<MultipartFile> files) {

        BatchReconciliationDto batch = workbookReconciliationService.reconcileBatch(files);
        return ResponseEntity.ok(ApiResponse.success(batch, batch.getMessage()));
    }

    @GetMapping("/policy")
    @Operation(summary = "Get the active commission tier table")
    public ResponseEntity<ApiResponse<List<CommissionTierDto>>> getPolicy() {
        return ResponseEntity.ok(ApiResponse.success(workbookReconciliationService.getPolicy()));
    }
}
