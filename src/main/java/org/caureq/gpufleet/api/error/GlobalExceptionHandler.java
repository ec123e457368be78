package org.caureq.gpufleet.api.error;

import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.caureq.gpufleet.service.provider.ProviderException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.http.*;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;
import java.util.Map;

@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    private ApiError build(ErrorCode code, String msg, String cid, Map<String, Object> details) {
        return new ApiError(Instant.now(), code, msg, cid, details);
    }

    private String cid(HttpServletRequest req) {
        return req.getHeader("X-Correlation-Id");
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiError> handleValidation(MethodArgumentNotValidException ex,
                                                     HttpServletRequest req) {
        var fieldErrors = ex.getBindingResult().getFieldErrors().stream()
                .map(fe -> fe.getField() + ": " + fe.getDefaultMessage())
                .toList();
        return ResponseEntity.badRequest().body(
                build(ErrorCode.BAD_REQUEST, "Validation error", cid(req), Map.of("fieldErrors", fieldErrors))
        );
    }

    @ExceptionHandler(ApiException.class)
    public ResponseEntity<ApiError> handleApi(ApiException ex, HttpServletRequest req) {
        return ResponseEntity.status(ex.status()).body(
                build(ex.code(), ex.getMessage(), cid(req), ex.details())
        );
    }

    @ExceptionHandler(ProviderException.class)
    public ResponseEntity<ApiError> handleProvider(ProviderException ex, HttpServletRequest req) {
        HttpStatus status;
        ErrorCode code;

        if (ProviderException.TIMEOUT.equals(ex.code())) {
            status = HttpStatus.GATEWAY_TIMEOUT;
            code = ErrorCode.TIMEOUT;
        } else if (ex.retryable() || ex.status() >= 500) {
            status = HttpStatus.BAD_GATEWAY;
            code = ErrorCode.PROVIDER_5XX;
        } else {
            status = HttpStatus.BAD_REQUEST;
            code = ErrorCode.PROVIDER_4XX;
        }

        return ResponseEntity.status(status).body(
                build(code, ex.getMessage(), cid(req), ex.payload())
        );
    }

    @ExceptionHandler({IllegalArgumentException.class, HttpMessageNotReadableException.class,
            MethodArgumentTypeMismatchException.class})
    public ResponseEntity<ApiError> handleBadInput(Exception ex, HttpServletRequest req) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(
                build(ErrorCode.BAD_REQUEST, ex.getMessage(), cid(req), Map.of())
        );
    }

    @ExceptionHandler(DataIntegrityViolationException.class)
    public ResponseEntity<ApiError> handleConflict(DataIntegrityViolationException ex, HttpServletRequest req) {
        log.warn("write conflict on {}: {}", req.getRequestURI(), ex.getMostSpecificCause().getMessage());
        return ResponseEntity.status(HttpStatus.CONFLICT).body(
                build(ErrorCode.TOKEN_CONFLICT, "Concurrent update, retry", cid(req), Map.of())
        );
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiError> handleAny(Exception ex, HttpServletRequest req) {
        log.error("unhandled error on {}", req.getRequestURI(), ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(
                build(ErrorCode.INTERNAL_ERROR, ex.getMessage(), cid(req), Map.of())
        );
    }
}
