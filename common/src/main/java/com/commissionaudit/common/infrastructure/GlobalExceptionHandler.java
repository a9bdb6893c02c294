package com.commissionaudit.common.infrastructure;

import com.commissionaudit.common.dto.ApiResponse;
import com.commissionaudit.common.exception.CommissionAuditException;
import com.commissionaudit.common.exception.ValidationException;
import com.commissionaudit.common.exception.WorkbookStructureException;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.context.request.RequestContextHolder;
import org.springframework.web.context.request.ServletRequestAttributes;
import org.springframework.web.multipart.MaxUploadSizeExceededException;
import org.springframework.web.multipart.support.MissingServletRequestPartException;

/**
 * Global exception handler for all services.
 * Converts exceptions to standardized API responses.
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    /**
     * Check if the response has already been committed (body already written).
     * If committed, we should not attempt to write another response.
     */
    private boolean isResponseCommitted() {
        ServletRequestAttributes attrs = (ServletRequestAttributes) RequestContextHolder.getRequestAttributes();
        if (attrs != null) {
            HttpServletResponse response = attrs.getResponse();
            if (response != null && response.isCommitted()) {
                return true;
            }
        }
        return false;
    }

    @ExceptionHandler(ValidationException.class)
    public ResponseEntity<ApiResponse<Void>> handleValidation(ValidationException ex) {
        if (isResponseCommitted()) {
            log.warn("Response already committed, cannot write error for: {}", ex.getMessage());
            return null;
        }
        log.warn("Validation error: {}", ex.getMessage());
        return ResponseEntity
                .status(HttpStatus.BAD_REQUEST)
                .body(ApiResponse.error(ex.getMessage(), ex.getErrorCode()));
    }

    @ExceptionHandler(WorkbookStructureException.class)
    public ResponseEntity<ApiResponse<Void>> handleWorkbookStructure(WorkbookStructureException ex) {
        if (isResponseCommitted()) {
            log.warn("Response already committed, cannot write error for: {}", ex.getMessage());
            return null;
        }
        log.warn("Workbook structure error: {}", ex.getMessage());
        return ResponseEntity
                .status(ex.getStatus())
                .body(ApiResponse.error(ex.getMessage(), ex.getErrorCode()));
    }

    @ExceptionHandler(MaxUploadSizeExceededException.class)
    public ResponseEntity<ApiResponse<Void>> handleMaxUploadSize(MaxUploadSizeExceededException ex) {
        if (isResponseCommitted()) {
            log.warn("Response already committed, cannot write error for: {}", ex.getMessage());
            return null;
        }
        log.warn("Upload rejected: {}", ex.getMessage());
        return ResponseEntity
                .status(HttpStatus.PAYLOAD_TOO_LARGE)
                .body(ApiResponse.error("Uploaded file exceeds the maximum allowed size", "AUDIT_ERR_413"));
    }

    @ExceptionHandler(MissingServletRequestPartException.class)
    public ResponseEntity<ApiResponse<Void>> handleMissingPart(MissingServletRequestPartException ex) {
        if (isResponseCommitted()) {
            log.warn("Response already committed, cannot write error for: {}", ex.getMessage());
            return null;
        }
        log.warn("Missing request part: {}", ex.getRequestPartName());
        return ResponseEntity
                .status(HttpStatus.BAD_REQUEST)
                .body(ApiResponse.error("Missing upload part '" + ex.getRequestPartName() + "'", "AUDIT_ERR_400"));
    }

    @ExceptionHandler(CommissionAuditException.class)
    public ResponseEntity<ApiResponse<Void>> handleCommissionAuditException(CommissionAuditException ex) {
        if (isResponseCommitted()) {
            log.warn("Response already committed, cannot write error for: {}", ex.getMessage());
            return null;
        }
        log.error("Application error: {}", ex.getMessage());
        return ResponseEntity
                .status(ex.getStatus())
                .body(ApiResponse.error(ex.getMessage(), ex.getErrorCode()));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiResponse<Void>> handleGeneric(Exception ex) {
        if (isResponseCommitted()) {
            log.warn("Response already committed, cannot write error. Original exception: {}", ex.getMessage(), ex);
            return null;
        }
        log.error("Unexpected error: {}", ex.getMessage(), ex);
        return ResponseEntity
                .status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(ApiResponse.error("An unexpected error occurred", "AUDIT_ERR_500"));
    }
}
