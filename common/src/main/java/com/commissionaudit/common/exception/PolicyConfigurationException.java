package com.commissionaudit.common.exception;

import org.springframework.http.HttpStatus;

/**
 * Exception thrown when the commission tier table is invalid (gap, overlap, bad rate).
 * Raised while the policy is loaded, before any transaction is processed.
 */
public class PolicyConfigurationException extends CommissionAuditException {

    public PolicyConfigurationException(String message) {
        super("Invalid commission policy: " + message, HttpStatus.INTERNAL_SERVER_ERROR, "AUDIT_ERR_500");
    }
}
