package io.github.hydrate.gateway.exception;

import io.github.hydrate.persistence.store.PersistenceException;
import io.github.hydrate.protocol.api.ErrorResponse;
import io.github.hydrate.runtime.error.ConfigurationException;
import io.github.hydrate.runtime.error.NotFoundException;
import io.github.hydrate.runtime.error.ValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.context.request.WebRequest;
import org.springframework.web.servlet.mvc.method.annotation.ResponseEntityExceptionHandler;

/**
 * Turns every failure into {@code {success:false, error}}. Spring MVC's own exceptions
 * (unknown path, wrong method, wrong content type) keep the status Spring assigns them.
 */
@RestControllerAdvice
public class GlobalExceptionHandler extends ResponseEntityExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(ValidationException.class)
    public ResponseEntity<ErrorResponse> handleValidation(ValidationException ex) {
        log.warn("Rejected request: {}", ex.getMessage());
        return respond(HttpStatus.BAD_REQUEST, ex.getMessage());
    }

    @ExceptionHandler(NotFoundException.class)
    public ResponseEntity<ErrorResponse> handleNotFound(NotFoundException ex) {
        log.warn("Not found: {}", ex.getMessage());
        return respond(HttpStatus.NOT_FOUND, ex.getMessage());
    }

    @ExceptionHandler(ConfigurationException.class)
    public ResponseEntity<ErrorResponse> handleConfiguration(ConfigurationException ex) {
        log.error("Server misconfigured: {}", ex.getMessage());
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, ex.getMessage());
    }

    @ExceptionHandler(PersistenceException.class)
    public ResponseEntity<ErrorResponse> handlePersistence(PersistenceException ex) {
        log.error("Store write failed", ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "server error");
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGeneric(Exception ex) {
        log.error("Unexpected error", ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "server error");
    }

    @Override
    protected ResponseEntity<Object> handleHttpMessageNotReadable(HttpMessageNotReadableException ex,
                                                                  HttpHeaders headers, HttpStatusCode status,
                                                                  WebRequest request) {
        for (Throwable cause = ex.getCause(); cause != null; cause = cause.getCause()) {
            if (cause instanceof RequestBodyTooLargeException) {
                log.warn("Rejected request body: {}", cause.getMessage());
                return ResponseEntity.status(HttpStatus.PAYLOAD_TOO_LARGE).body(ErrorResponse.of("request entity too large"));
            }
        }
        log.warn("Unreadable request body: {}", ex.getMessage());
        return ResponseEntity.status(status).headers(headers).body(ErrorResponse.of("malformed JSON body"));
    }

    @Override
    protected ResponseEntity<Object> handleExceptionInternal(Exception ex, Object body, HttpHeaders headers,
                                                             HttpStatusCode statusCode, WebRequest request) {
        String message = ex instanceof org.springframework.web.ErrorResponse mvcError
                && mvcError.getBody().getDetail() != null
                ? mvcError.getBody().getDetail()
                : ex.getMessage();
        if (statusCode.is5xxServerError()) {
            log.error("Request failed: {}", message, ex);
        } else {
            log.warn("Request failed with {}: {}", statusCode.value(), message);
        }
        return ResponseEntity.status(statusCode).headers(headers).body(ErrorResponse.of(message));
    }

    private static ResponseEntity<ErrorResponse> respond(HttpStatus status, String message) {
        return ResponseEntity.status(status).body(ErrorResponse.of(message));
    }
}
