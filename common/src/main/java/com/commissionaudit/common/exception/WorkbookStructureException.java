package com.commissionaudit.common.exception;

import org.springframework.http.HttpStatus;

import java.util.List;

/**
 * Exception thrown when a workbook lacks a sheet the reconciliation needs.
 * Fatal for the whole run.
 */
public class WorkbookStructureException extends CommissionAuditException {

    private final List<String> availableSheets;

    public WorkbookStructureException(String missingSheet, List<String> availableSheets) {
        super(
            String.format("Workbook must contain a sheet whose name includes '%s'. Sheets found: %s",
                    missingSheet, availableSheets),
            HttpStatus.UNPROCESSABLE_ENTITY,
            "AUDIT_ERR_422"
        );
        this.availableSheets = List.copyOf(availableSheets);
    }

    public List<String> getAvailableSheets() {
        return availableSheets;
    }
}
