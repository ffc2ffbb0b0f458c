package com.ledgerbook.journal.controller;

import com.ledgerbook.journal.controller.dto.ErrorResponseDto;
import com.ledgerbook.journal.repository.RecordNotFoundException;
import com.ledgerbook.journal.repository.SnapshotVersionConflictException;
import com.ledgerbook.journal.schedule.InvalidLoanParametersException;
import com.ledgerbook.journal.util.InvalidMonthFormatException;
import com.ledgerbook.journal.web.RequestContextHolder;
import jakarta.validation.ConstraintViolationException;
import java.util.HashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(InvalidMonthFormatException.class)
    public ResponseEntity<ErrorResponseDto> handleInvalidMonth(InvalidMonthFormatException ex) {
        Map<String, Object> details = new HashMap<>();
        details.put("value", ex.rejectedValue());
        details.put("expected", "YYYY-MM");
        return build(HttpStatus.BAD_REQUEST, "INVALID_MONTH_FORMAT", ex.getMessage(), details);
    }

    @ExceptionHandler(InvalidLoanParametersException.class)
    public ResponseEntity<ErrorResponseDto> handleInvalidLoan(InvalidLoanParametersException ex) {
        return build(HttpStatus.BAD_REQUEST, "INVALID_LOAN_PARAMETERS", ex.getMessage(), Map.of());
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponseDto> handleIllegalArgument(IllegalArgumentException ex) {
        return build(HttpStatus.BAD_REQUEST, "INVALID_ARGUMENT", ex.getMessage(), Map.of());
    }

    @ExceptionHandler({MethodArgumentNotValidException.class, ConstraintViolationException.class})
    public ResponseEntity<ErrorResponseDto> handleValidation(Exception ex) {
        return build(HttpStatus.BAD_REQUEST, "VALIDATION_ERROR", ex.getMessage(), Map.of());
    }

    @ExceptionHandler({MissingServletRequestParameterException.class, MethodArgumentTypeMismatchException.class})
    public ResponseEntity<ErrorResponseDto> handleBadParameter(Exception ex) {
        return build(HttpStatus.BAD_REQUEST, "INVALID_PARAMETER", ex.getMessage(), Map.of());
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponseDto> handleUnreadable(HttpMessageNotReadableException ex) {
        String reason = ex.getMostSpecificCause() != null ? ex.getMostSpecificCause().getMessage() : ex.getMessage();
        return build(HttpStatus.BAD_REQUEST, "INVALID_REQUEST_BODY", "Request body could not be read",
                Map.of("reason", String.valueOf(reason)));
    }

    @ExceptionHandler(RecordNotFoundException.class)
    public ResponseEntity<ErrorResponseDto> handleNotFound(RecordNotFoundException ex) {
        return build(HttpStatus.NOT_FOUND, "NOT_FOUND", ex.getMessage(), Map.of(
                "recordType", ex.recordType(),
                "recordId", ex.recordId()
        ));
    }

    @ExceptionHandler(NoResourceFoundException.class)
    public ResponseEntity<ErrorResponseDto> handleNoResource(NoResourceFoundException ex) {
        return build(HttpStatus.NOT_FOUND, "NOT_FOUND", ex.getMessage(), Map.of());
    }

    @ExceptionHandler(SnapshotVersionConflictException.class)
    public ResponseEntity<ErrorResponseDto> handleConflict(SnapshotVersionConflictException ex) {
        return build(HttpStatus.CONFLICT, "SNAPSHOT_VERSION_CONFLICT", ex.getMessage(), Map.of(
                "expectedVersion", ex.expectedVersion(),
                "currentVersion", ex.actualVersion()
        ));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponseDto> handleGeneral(Exception ex) {
        log.error("Unhandled error", ex);
        return build(HttpStatus.INTERNAL_SERVER_ERROR, "INTERNAL_ERROR", "Unexpected error",
                Map.of("reason", String.valueOf(ex.getMessage())));
    }

    private ResponseEntity<ErrorResponseDto> build(HttpStatus status, String code, String message, Map<String, Object> details) {
        String traceId = RequestContextHolder.traceId().orElse(null);
        return ResponseEntity.status(status)
                .body(new ErrorResponseDto(code, message, details, traceId));
    }
}
