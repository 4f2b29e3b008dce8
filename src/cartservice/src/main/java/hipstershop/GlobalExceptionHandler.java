package hipstershop;

import hipstershop.faultsim.StorageUnavailableException;
import hipstershop.faultsim.UnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.TimeoutException;

/**
 * Maps cart failures to HTTP responses. Storage exhaustion is a 503 so callers know to retry later.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger logger = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(UnavailableException.class)
    public ResponseEntity<Map<String, Object>> handleUnavailable(UnavailableException ex) {
        logger.error("Cart storage unavailable during {}: {}", ex.getOperationName(), ex.getMessage());
        Map<String, Object> body = body("UNAVAILABLE", ex.getMessage());
        body.put("operation", ex.getOperationName());
        if (ex instanceof StorageUnavailableException) {
            body.put("attempts", ((StorageUnavailableException) ex).getAttempts());
        }
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(body);
    }

    @ExceptionHandler(TimeoutException.class)
    public ResponseEntity<Map<String, Object>> handleTimeout(TimeoutException ex) {
        logger.error("Cart request timed out");
        return ResponseEntity.status(HttpStatus.GATEWAY_TIMEOUT)
                .body(body("DEADLINE_EXCEEDED", "Cart request timed out"));
    }

    @ExceptionHandler(CartDataException.class)
    public ResponseEntity<Map<String, Object>> handleCartData(CartDataException ex) {
        logger.error("Corrupt cart data for user {}", ex.getUserId(), ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(body("DATA_ERROR", ex.getMessage()));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, Object>> handleIllegalArgument(IllegalArgumentException ex) {
        logger.warn("Invalid argument: {}", ex.getMessage());
        return ResponseEntity.badRequest().body(body("INVALID_REQUEST", ex.getMessage()));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleGeneric(Exception ex) {
        logger.error("Unexpected error", ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(body("INTERNAL_ERROR", "An unexpected error occurred"));
    }

    private static Map<String, Object> body(String error, String message) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", error);
        body.put("message", message);
        body.put("timestamp", Instant.now().toString());
        return body;
    }
}
