package eu.virtualparadox.techrag.web;

import eu.virtualparadox.techrag.web.dto.MessageResponse;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Turns exceptions escaping the controllers into a short JSON message without internals.
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    static final String GENERIC_MESSAGE = "The request could not be processed, please try again later";

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<MessageResponse> handleValidation(final MethodArgumentNotValidException ex,
                                                            final HttpServletRequest request) {
        final FieldError firstError = ex.getBindingResult().getFieldError();
        final String message = firstError != null ? firstError.getDefaultMessage() : "Invalid request";
        log.warn("[{}] {} - invalid request: {}", request.getMethod(), request.getRequestURI(), message);
        return ResponseEntity.badRequest().body(new MessageResponse(message));
    }

    @ExceptionHandler(MissingServletRequestParameterException.class)
    public ResponseEntity<MessageResponse> handleMissingParameter(final MissingServletRequestParameterException ex,
                                                                  final HttpServletRequest request) {
        log.warn("[{}] {} - missing parameter {}", request.getMethod(), request.getRequestURI(), ex.getParameterName());
        return ResponseEntity.badRequest().body(new MessageResponse(ex.getParameterName() + " is required"));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<MessageResponse> handleIllegalArgument(final IllegalArgumentException ex,
                                                                 final HttpServletRequest request) {
        log.warn("[{}] {} - rejected: {}", request.getMethod(), request.getRequestURI(), ex.getMessage());
        return ResponseEntity.badRequest().body(new MessageResponse(ex.getMessage()));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<MessageResponse> handleUnexpected(final Exception ex, final HttpServletRequest request) {
        log.error("[{}] {} - request failed", request.getMethod(), request.getRequestURI(), ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(new MessageResponse(GENERIC_MESSAGE));
    }
}
