package com.sessiongate.gateway.http;

import com.sessiongate.shared.error.ErrorCode;
import com.sessiongate.shared.error.GatewayException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.Map;

/**
 * Maps the gateway's typed failures onto HTTP statuses with a {@code {"error", "message"}} body.
 */
@RestControllerAdvice
public class ErrorResponseAdvice {

    private static final Logger log = LoggerFactory.getLogger(ErrorResponseAdvice.class);

    @ExceptionHandler(GatewayException.class)
    public ResponseEntity<Map<String, String>> gatewayError(GatewayException e) {
        var status = statusFor(e.code());
        if (status.is5xxServerError()) {
            log.error("Request failed for session {}", e.sessionId(), e);
        }
        return ResponseEntity.status(status).body(Map.of("error", e.code().name(), "message", e.getMessage()));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, String>> badRequest(IllegalArgumentException e) {
        return ResponseEntity.badRequest().body(Map.of("error", "BAD_REQUEST", "message", String.valueOf(e.getMessage())));
    }

    static HttpStatus statusFor(ErrorCode code) {
        switch (code) {
            case ALREADY_ACTIVE:
            case SESSION_NOT_CONNECTED:
                return HttpStatus.CONFLICT;
            case NOT_FOUND:
                return HttpStatus.NOT_FOUND;
            case QUEUE_FULL:
                return HttpStatus.TOO_MANY_REQUESTS;
            default:
                return HttpStatus.INTERNAL_SERVER_ERROR;
        }
    }
}
