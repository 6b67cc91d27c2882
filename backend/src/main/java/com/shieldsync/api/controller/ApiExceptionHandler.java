package com.shieldsync.api.controller;

import com.shieldsync.api.dto.ErrorBody;
import com.shieldsync.common.InternalStateException;
import com.shieldsync.common.PoolClientException;
import com.shieldsync.common.TxInvalidArgumentException;
import com.shieldsync.common.UnknownAssetException;
import com.shieldsync.ingestion.relayer.RelayerException;
import com.shieldsync.ingestion.relayer.RelayerJobException;
import com.shieldsync.planner.InsufficientFundsException;
import com.shieldsync.tx.TxLimitException;
import com.shieldsync.tx.TxProofException;
import com.shieldsync.tx.TxSmallAmountException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.bind.support.WebExchangeBindException;
import org.springframework.web.server.ServerWebInputException;

import java.util.Map;
import java.util.Optional;

/**
 * Maps request validation failures to 400 and pool client errors to their status, all as ErrorBody.
 */
@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

    @ExceptionHandler(WebExchangeBindException.class)
    public ResponseEntity<ErrorBody> handleValidation(WebExchangeBindException ex) {
        String error = Optional.ofNullable(ex.getFieldError())
                .map(FieldError::getDefaultMessage)
                .filter(msg -> msg != null && !msg.isBlank())
                .orElse("VALIDATION_ERROR");
        return ResponseEntity.badRequest().body(ErrorBody.of(error, userFacingMessage(error, ex)));
    }

    @ExceptionHandler(ServerWebInputException.class)
    public ResponseEntity<ErrorBody> handleInput(ServerWebInputException ex) {
        return ResponseEntity.badRequest().body(ErrorBody.of("INVALID_REQUEST", ex.getReason()));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorBody> handleIllegalArgument(IllegalArgumentException ex) {
        return ResponseEntity.badRequest().body(ErrorBody.of("INVALID_REQUEST", ex.getMessage()));
    }

    @ExceptionHandler(PoolClientException.class)
    public ResponseEntity<ErrorBody> handlePoolClient(PoolClientException ex) {
        HttpStatus status = statusFor(ex.getErrorCode());
        if (status.is5xxServerError()) {
            log.warn("Request failed with {}: {}", ex.getErrorCode(), ex.getMessage());
        }
        return ResponseEntity.status(status).body(ErrorBody.of(ex.getErrorCode(), ex.getMessage(), detailsOf(ex)));
    }

    static Map<String, Object> detailsOf(PoolClientException ex) {
        if (ex instanceof InsufficientFundsException e) {
            return Map.of("needed", e.getNeeded(), "available", e.getAvailable());
        }
        if (ex instanceof TxSmallAmountException e) {
            return Map.of("amount", e.getAmount(), "minAmount", e.getMinAmount());
        }
        if (ex instanceof TxLimitException e) {
            return Map.of("amount", e.getAmount(), "limit", e.getLimit());
        }
        if (ex instanceof RelayerJobException e) {
            return Map.of("jobId", e.getJobId());
        }
        if (ex instanceof UnknownAssetException e) {
            return Map.of("asset", e.getAsset());
        }
        return Map.of();
    }

    static HttpStatus statusFor(String errorCode) {
        return switch (errorCode) {
            case RelayerException.ERROR_CODE, RelayerJobException.ERROR_CODE -> HttpStatus.BAD_GATEWAY;
            case TxSmallAmountException.ERROR_CODE, TxLimitException.ERROR_CODE, TxInvalidArgumentException.ERROR_CODE ->
                    HttpStatus.BAD_REQUEST;
            case InsufficientFundsException.ERROR_CODE -> HttpStatus.UNPROCESSABLE_ENTITY;
            case UnknownAssetException.ERROR_CODE -> HttpStatus.NOT_FOUND;
            case TxProofException.ERROR_CODE, InternalStateException.ERROR_CODE -> HttpStatus.INTERNAL_SERVER_ERROR;
            default -> HttpStatus.INTERNAL_SERVER_ERROR;
        };
    }

    private static String userFacingMessage(String errorCode, WebExchangeBindException ex) {
        return switch (errorCode) {
            case "INVALID_ADDRESS" -> "Invalid recipient address";
            case "INVALID_AMOUNT" -> "Amount must be a positive integer in wei";
            case "INVALID_FEE" -> "Fee must not be negative";
            case "INVALID_OUTPUTS" -> "Transfer needs at least one output";
            default -> ex.getFieldErrors().stream()
                    .findFirst()
                    .map(e -> e.getField() + ": " + e.getDefaultMessage())
                    .orElse("Validation failed");
        };
    }
}
