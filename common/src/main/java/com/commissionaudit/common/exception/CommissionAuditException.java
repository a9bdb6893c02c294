package com.commissionaudit.common.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;

/**
 * Base exception for all commission audit business exceptions.
 */
@Getter
public class CommissionAuditException extends RuntimeException {

    private final HttpStatus status;
    private final String errorCode;

    public CommissionAuditException(String message) {
        super(message);
        this.status = HttpStatus.INTERNAL_SERVER_ERROR;
        this.errorCode = "AUDIT_ERR_001";
    }

    public CommissionAuditException(String message, HttpStatus status, String errorCode) {
        super(message);
        this.status = status;
        this.errorCode = errorCode;
    }

    public CommissionAuditException(String message, Throwable cause) {
        super(message, cause);
        this.status = HttpStatus.INTERNAL_SERVER_ERROR;
        this.errorCode = "AUDIT_ERR_001";
    }
}
