package quest.gekko.pulse.web.exception;

import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.ErrorResponse;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import quest.gekko.pulse.exception.AggregationIntegrityException;
import quest.gekko.pulse.exception.PipelineConfigurationException;
import quest.gekko.pulse.exception.PulseException;
import quest.gekko.pulse.exception.UnknownTitleException;

import java.util.LinkedHashMap;
import java.util.Map;

@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {
    static final String BAD_REQUEST_CODE = "ERR-REQ-400";
    static final String INTERNAL_CODE = "ERR-INT-500";

    @ExceptionHandler(UnknownTitleException.class)
    public ResponseEntity<Map<String, Object>> handleUnknownTitle(UnknownTitleException ex, HttpServletRequest request) {
        log.warn("Unknown title: {} for URL: {}", ex.getMessage(), request.getRequestURL());
        return body(HttpStatus.NOT_FOUND, ex.getMessage(), ex.getErrorCode());
    }

    @ExceptionHandler(AggregationIntegrityException.class)
    public ResponseEntity<Map<String, Object>> handleIntegrity(AggregationIntegrityException ex, HttpServletRequest request) {
        log.warn("Aggregation refused: {} for URL: {}", ex.getMessage(), request.getRequestURL());
        return body(HttpStatus.UNPROCESSABLE_ENTITY, ex.getMessage(), ex.getErrorCode());
    }

    // an unknown model name in a request body
    @ExceptionHandler(PipelineConfigurationException.class)
    public ResponseEntity<Map<String, Object>> handleConfiguration(PipelineConfigurationException ex, HttpServletRequest request) {
        log.warn("Bad request: {} for URL: {}", ex.getMessage(), request.getRequestURL());
        return body(HttpStatus.BAD_REQUEST, ex.getMessage(), ex.getErrorCode());
    }

    @ExceptionHandler({
            IllegalArgumentException.class,
            MissingServletRequestParameterException.class,
            MethodArgumentTypeMismatchException.class,
            HttpMessageNotReadableException.class
    })
    public ResponseEntity<Map<String, Object>> handleBadRequest(Exception ex, HttpServletRequest request) {
        log.warn("Bad request: {} for URL: {}", ex.getMessage(), request.getRequestURL());
        return body(HttpStatus.BAD_REQUEST, "Invalid request: " + ex.getMessage(), BAD_REQUEST_CODE);
    }

    @ExceptionHandler(PulseException.class)
    public ResponseEntity<Map<String, Object>> handlePulseException(PulseException ex, HttpServletRequest request) {
        log.error("Pipeline error for URL: {}", request.getRequestURL(), ex);
        return body(HttpStatus.INTERNAL_SERVER_ERROR, ex.getMessage(), ex.getErrorCode());
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleGeneralException(Exception ex, HttpServletRequest request) {
        // framework errors (no handler, wrong method, bad media type) keep their own status
        if (ex instanceof ErrorResponse framework) {
            HttpStatus status = HttpStatus.valueOf(framework.getStatusCode().value());
            log.warn("{} for URL: {}", status, request.getRequestURL());
            return body(status, ex.getMessage(), "ERR-HTTP-" + status.value());
        }
        log.error("Unexpected error for URL: {}", request.getRequestURL(), ex);
        return body(HttpStatus.INTERNAL_SERVER_ERROR, "An unexpected error occurred", INTERNAL_CODE);
    }

    private static ResponseEntity<Map<String, Object>> body(HttpStatus status, String error, String code) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", status.value());
        body.put("error", error);
        body.put("code", code);
        return ResponseEntity.status(status).body(body);
    }
}
