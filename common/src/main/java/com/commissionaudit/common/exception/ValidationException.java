package com.commissionaudit.common.exception;

import org.springframework.http.HttpStatus;

/**
 * Exception thrown when an upload fails admission checks.
 */
public class ValidationException extends CommissionAuditException {

    public ValidationException(String message) {
        super(message, HttpStatus.BAD_REQUEST, "AUDIT_ERR_400");
    }

    public ValidationException(String field, String message) {
        super(
            String.format("Validation failed for '%s': %s", field, message),
            HttpStatus.BAD_REQUEST,
            "AUDIT_ERR_400"
        );
    }
}
