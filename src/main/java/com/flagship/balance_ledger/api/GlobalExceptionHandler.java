package com.flagship.balance_ledger.api;

import com.flagship.balance_ledger.exception.BalanceLimitExceededException;
import com.flagship.balance_ledger.exception.InsufficientFundsException;
import com.flagship.balance_ledger.exception.InvalidStateTransitionException;
import com.flagship.balance_ledger.exception.LedgerException;
import com.flagship.balance_ledger.exception.StorageException;
import com.flagship.balance_ledger.exception.TransactionNotFoundException;
import com.flagship.balance_ledger.exception.ValidationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Maps ledger failures onto HTTP statuses and a uniform {@link ApiError} body.
 *
 * 400 validation, 404 unknown transaction, 409 illegal state transition,
 * 422 insufficient funds or balance limit, 500 storage and anything unexpected.
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    private static final String VALIDATION_FAILED = "validation_failed";

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiError> handleBeanValidation(MethodArgumentNotValidException e) {
        log.warn("Validation failed: {}", e.getMessage());

        Map<String, String> errors = e.getBindingResult()
            .getFieldErrors()
            .stream()
            .collect(Collectors.toMap(
                error -> error.getField(),
                error -> error.getDefaultMessage() != null ? error.getDefaultMessage() : "Invalid value",
                (existing, replacement) -> existing,
                LinkedHashMap::new
            ));

        return respond(HttpStatus.BAD_REQUEST, VALIDATION_FAILED, "Request validation failed", errors);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ApiError> handleUnreadableBody(HttpMessageNotReadableException e) {
        log.warn("Malformed request body: {}", e.getMessage());
        return respond(HttpStatus.BAD_REQUEST, VALIDATION_FAILED, "Malformed request body", null);
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ApiError> handleTypeMismatch(MethodArgumentTypeMismatchException e) {
        log.warn("Invalid parameter: name={}, value={}", e.getName(), e.getValue());
        return respond(HttpStatus.BAD_REQUEST, VALIDATION_FAILED,
                "Invalid value for parameter '" + e.getName() + "'",
                Map.of(e.getName(), String.valueOf(e.getValue())));
    }

    @ExceptionHandler(MissingServletRequestParameterException.class)
    public ResponseEntity<ApiError> handleMissingParameter(MissingServletRequestParameterException e) {
        log.warn("Missing required parameter: {}", e.getParameterName());
        return respond(HttpStatus.BAD_REQUEST, VALIDATION_FAILED,
                "Required parameter '" + e.getParameterName() + "' is missing", null);
    }

    @ExceptionHandler(ValidationException.class)
    public ResponseEntity<ApiError> handleValidation(ValidationException e) {
        log.warn("Invalid request: field={}, error={}", e.getField(), e.getMessage());
        Map<String, String> details = e.getField() != null ? Map.of(e.getField(), e.getMessage()) : null;
        return respond(HttpStatus.BAD_REQUEST, e.getErrorCode(), e.getMessage(), details);
    }

    @ExceptionHandler(InsufficientFundsException.class)
    public ResponseEntity<ApiError> handleInsufficientFunds(InsufficientFundsException e) {
        Map<String, String> details = new LinkedHashMap<>();
        details.put("account_id", String.valueOf(e.getAccountId()));
        details.put("current_balance", e.getCurrentBalance().toPlainString());
        details.put("requested_amount", e.getRequestedAmount().toPlainString());

        return respond(HttpStatus.UNPROCESSABLE_ENTITY, e.getErrorCode(), e.getMessage(), details);
    }

    @ExceptionHandler(BalanceLimitExceededException.class)
    public ResponseEntity<ApiError> handleBalanceLimit(BalanceLimitExceededException e) {
        Map<String, String> details = new LinkedHashMap<>();
        details.put("account_id", String.valueOf(e.getAccountId()));
        details.put("current_balance", e.getCurrentBalance().toPlainString());
        details.put("requested_amount", e.getRequestedAmount().toPlainString());

        return respond(HttpStatus.UNPROCESSABLE_ENTITY, e.getErrorCode(), e.getMessage(), details);
    }

    @ExceptionHandler(TransactionNotFoundException.class)
    public ResponseEntity<ApiError> handleNotFound(TransactionNotFoundException e) {
        return respond(HttpStatus.NOT_FOUND, e.getErrorCode(), e.getMessage(),
                Map.of("transaction_id", String.valueOf(e.getTransactionId())));
    }

    /**
     * Also covers {@link com.flagship.balance_ledger.exception.AlreadyRolledBackException}.
     */
    @ExceptionHandler(InvalidStateTransitionException.class)
    public ResponseEntity<ApiError> handleInvalidState(InvalidStateTransitionException e) {
        log.warn("Invalid state transition: {}", e.getMessage());

        Map<String, String> details = new LinkedHashMap<>();
        details.put("transaction_id", String.valueOf(e.getTransactionId()));
        details.put("current_status", String.valueOf(e.getCurrentStatus()));
        details.put("target_status", String.valueOf(e.getTargetStatus()));

        return respond(HttpStatus.CONFLICT, e.getErrorCode(), e.getMessage(), details);
    }

    @ExceptionHandler(StorageException.class)
    public ResponseEntity<ApiError> handleStorage(StorageException e) {
        log.error("Storage failure", e);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, e.getErrorCode(), "A storage error occurred", null);
    }

    @ExceptionHandler(LedgerException.class)
    public ResponseEntity<ApiError> handleLedger(LedgerException e) {
        log.error("Unmapped ledger error", e);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, e.getErrorCode(), e.getMessage(), null);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiError> handleGenericException(Exception e) {
        log.error("Unexpected error", e);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "internal_error", "An unexpected error occurred", null);
    }

    private ResponseEntity<ApiError> respond(HttpStatus status, String error, String message,
                                             Map<String, String> details) {
        ApiError body = ApiError.builder()
            .error(error)
            .message(message)
            .details(details)
            .timestamp(Instant.now())
            .build();
        return ResponseEntity.status(status).body(body);
    }
}
