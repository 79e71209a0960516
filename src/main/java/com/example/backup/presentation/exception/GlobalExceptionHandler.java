package com.example.backup.presentation.exception;

import com.example.backup.domain.exception.BackupException;
import com.example.backup.domain.exception.PolicyViolationException;
import com.example.backup.presentation.dto.common.CommandResponse;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.stream.Collectors;

/**
 * 오류 종류별 HTTP 상태 매핑
 * 본문은 항상 status=failed 인 CommandResponse (errorKind/errorCode 포함)
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    public static final String INVALID_ARGUMENT = "INVALID_ARGUMENT";

    @ExceptionHandler(BackupException.class)
    public ResponseEntity<CommandResponse<Void>> handleBackupException(BackupException ex, HttpServletRequest request) {
        HttpStatus status = statusOf(ex);
        if (status.is5xxServerError()) {
            log.error("{} {} failed: kind={}, code={}, context={}", request.getMethod(), request.getRequestURI(),
                    ex.getKind(), ex.getCode(), ex.getContext(), ex);
        } else {
            log.warn("{} {} rejected: kind={}, code={}, message={}", request.getMethod(), request.getRequestURI(),
                    ex.getKind(), ex.getCode(), ex.getMessage());
        }
        return ResponseEntity.status(status).body(CommandResponse.failed(ex));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<CommandResponse<Void>> handleValidation(MethodArgumentNotValidException ex) {
        String message = ex.getBindingResult().getAllErrors().stream()
                .map(error -> error instanceof FieldError
                        ? ((FieldError) error).getField() + ": " + error.getDefaultMessage()
                        : error.getDefaultMessage())
                .collect(Collectors.joining(", "));
        log.warn("Request validation failed: {}", message);
        return badRequest(message);
    }

    @ExceptionHandler({IllegalArgumentException.class,
            MissingServletRequestParameterException.class,
            MethodArgumentTypeMismatchException.class,
            HttpMessageNotReadableException.class})
    public ResponseEntity<CommandResponse<Void>> handleBadRequest(Exception ex) {
        log.warn("Bad request: {}", ex.getMessage());
        return badRequest(ex.getMessage());
    }

    private ResponseEntity<CommandResponse<Void>> badRequest(String message) {
        return ResponseEntity.badRequest()
                .body(CommandResponse.failed("POLICY_VIOLATION", INVALID_ARGUMENT, message));
    }

    static HttpStatus statusOf(BackupException ex) {
        if (PolicyViolationException.NOT_FOUND.equals(ex.getCode())) {
            return HttpStatus.NOT_FOUND;
        }
        switch (ex.getKind()) {
            case TRANSIENT_IO:
                return HttpStatus.SERVICE_UNAVAILABLE;
            case BUSY:
            case GAP:
            case CANCELLED:
                return HttpStatus.CONFLICT;
            default:
                return HttpStatus.UNPROCESSABLE_ENTITY;
        }
    }
}
