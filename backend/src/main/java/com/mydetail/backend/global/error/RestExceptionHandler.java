package com.mydetail.backend.global.error;

import com.mydetail.backend.modules.permission.domain.PermissionErrorKind;
import com.mydetail.backend.modules.permission.domain.PermissionResolutionException;

import jakarta.servlet.http.HttpServletRequest;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.server.ResponseStatusException;

@ControllerAdvice
public class RestExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(RestExceptionHandler.class);

    @ExceptionHandler(ProblemException.class)
    public ResponseEntity<ProblemResponse> handleProblemException(ProblemException ex, HttpServletRequest request) {
        HttpStatus status = toHttpStatus(ex.getStatusCode());
        ProblemResponse body = ProblemResponse.of(status, ex.getCode(), ex.getDetailMessage(), request.getRequestURI());
        ResponseEntity.BodyBuilder builder = ResponseEntity.status(status);
        if (ex instanceof RetryableProblemException retryable) {
            builder.header(HttpHeaders.RETRY_AFTER, String.valueOf(retryable.getRetryAfterSeconds()));
        }
        return builder.body(body);
    }

    @ExceptionHandler(ResponseStatusException.class)
    public ResponseEntity<ProblemResponse> handleResponseStatusException(ResponseStatusException ex, HttpServletRequest request) {
        HttpStatus status = toHttpStatus(ex.getStatusCode());
        String message = ex.getReason() != null ? ex.getReason() : status.getReasonPhrase();
        ProblemResponse body = ProblemResponse.of(status, message, message, request.getRequestURI());
        return ResponseEntity.status(status).body(body);
    }

    /**
     * 권한 해석 실패. 잘못된 식별자는 400, 그 외는 모두 권한 없음으로 간주되는 503이다.
     */
    @ExceptionHandler(PermissionResolutionException.class)
    public ResponseEntity<ProblemResponse> handlePermissionResolution(PermissionResolutionException ex, HttpServletRequest request) {
        if (ex.getKind() == PermissionErrorKind.INVALID_ARGUMENT) {
            ProblemResponse body = ProblemResponse.of(HttpStatus.BAD_REQUEST, "permissions.invalid_principal",
                    ex.getMessage(), request.getRequestURI());
            return ResponseEntity.badRequest().body(body);
        }
        log.error("[ALERT][Permissions] resolution failed for principal={} kind={}", ex.getPrincipalId(), ex.getKind(), ex);
        return handleProblemException(RetryableProblemException.permissionsUnavailable(ex), request);
    }

    @ExceptionHandler(AccessDeniedException.class)
    public ResponseEntity<ProblemResponse> handleAccessDenied(AccessDeniedException ex, HttpServletRequest request) {
        ProblemResponse body = ProblemResponse.of(HttpStatus.FORBIDDEN, "forbidden", "capability required", request.getRequestURI());
        return ResponseEntity.status(HttpStatus.FORBIDDEN).body(body);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ProblemResponse> handleValidationException(MethodArgumentNotValidException ex, HttpServletRequest request) {
        HttpStatus status = HttpStatus.UNPROCESSABLE_ENTITY;
        StringBuilder sb = new StringBuilder();
        for (FieldError fieldError : ex.getBindingResult().getFieldErrors()) {
            sb.append(fieldError.getField()).append(": ").append(fieldError.getDefaultMessage()).append("; ");
        }
        String detail = sb.length() > 0 ? sb.substring(0, sb.length() - 2) : "Validation failed";
        ProblemResponse body = ProblemResponse.of(status, "validation_error", detail, request.getRequestURI());
        return ResponseEntity.status(status).body(body);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ProblemResponse> handleUnreadable(HttpMessageNotReadableException ex, HttpServletRequest request) {
        ProblemResponse body = ProblemResponse.of(HttpStatus.BAD_REQUEST, "malformed_request", "request body could not be read",
                request.getRequestURI());
        return ResponseEntity.badRequest().body(body);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ProblemResponse> handleGenericException(Exception ex, HttpServletRequest request) {
        log.error("Unhandled exception on {}", request.getRequestURI(), ex);
        HttpStatus status = HttpStatus.INTERNAL_SERVER_ERROR;
        ProblemResponse body = ProblemResponse.of(status, "internal_error", status.getReasonPhrase(), request.getRequestURI());
        return ResponseEntity.status(status).body(body);
    }

    private static HttpStatus toHttpStatus(HttpStatusCode statusCode) {
        return statusCode instanceof HttpStatus httpStatus
                ? httpStatus
                : HttpStatus.valueOf(statusCode.value());
    }
}
