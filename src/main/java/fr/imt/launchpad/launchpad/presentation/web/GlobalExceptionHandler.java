package fr.imt.launchpad.launchpad.presentation.web;

import fr.imt.launchpad.launchpad.exception.LaunchpadException;
import fr.imt.launchpad.launchpad.exception.PipelineDefinitionException;
import fr.imt.launchpad.launchpad.exception.RunNotFoundException;
import fr.imt.launchpad.launchpad.presentation.web.dto.ErrorResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.HttpMediaTypeNotSupportedException;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.servlet.resource.NoResourceFoundException;

import java.util.stream.Collectors;

/**
 * Maps exceptions thrown by the REST controllers to {@link ErrorResponse} bodies.
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    // ===== Domain Exception Handlers =====

    @ExceptionHandler(RunNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleRunNotFound(RunNotFoundException ex) {
        return new ResponseEntity<>(new ErrorResponse(ex.getErrorCode(), ex.getMessage()), HttpStatus.NOT_FOUND);
    }

    @ExceptionHandler(PipelineDefinitionException.class)
    public ResponseEntity<ErrorResponse> handlePipelineDefinition(PipelineDefinitionException ex) {
        log.error("Pipeline definition is invalid: {}", ex.getMessage());
        return new ResponseEntity<>(new ErrorResponse(ex.getErrorCode(), ex.getMessage()), HttpStatus.INTERNAL_SERVER_ERROR);
    }

    /**
     * Fallback handler for any LaunchpadException not handled above.
     */
    @ExceptionHandler(LaunchpadException.class)
    public ResponseEntity<ErrorResponse> handleLaunchpadException(LaunchpadException ex) {
        log.error("Launchpad exception: {}", ex.getMessage(), ex);
        return new ResponseEntity<>(new ErrorResponse(ex.getErrorCode(), ex.getMessage()), HttpStatus.INTERNAL_SERVER_ERROR);
    }

    // ===== Framework Exception Handlers =====

    @ExceptionHandler(NoResourceFoundException.class)
    public ResponseEntity<ErrorResponse> handleNoResourceFound(NoResourceFoundException ex) {
        return new ResponseEntity<>(new ErrorResponse("NOT_FOUND", ex.getMessage()), HttpStatus.NOT_FOUND);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidationErrors(MethodArgumentNotValidException ex) {
        String errorMessage = ex.getBindingResult().getFieldErrors().stream()
                .map(error -> error.getField() + ": " + error.getDefaultMessage())
                .collect(Collectors.joining(", "));
        log.warn("Validation error: {}", errorMessage);
        return new ResponseEntity<>(new ErrorResponse("VALIDATION_FAILED", errorMessage), HttpStatus.BAD_REQUEST);
    }

    @ExceptionHandler(HttpRequestMethodNotSupportedException.class)
    public ResponseEntity<ErrorResponse> handleWrongHttpVerb(HttpRequestMethodNotSupportedException ex) {
        return new ResponseEntity<>(new ErrorResponse("METHOD_NOT_ALLOWED", ex.getMessage()), HttpStatus.METHOD_NOT_ALLOWED);
    }

    /**
     * Malformed JSON body.
     */
    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleMalformedRequest(HttpMessageNotReadableException ex) {
        log.warn("Malformed request: {}", ex.getMessage());
        return new ResponseEntity<>(new ErrorResponse("BAD_REQUEST", "Request body is not valid JSON"), HttpStatus.BAD_REQUEST);
    }

    @ExceptionHandler(HttpMediaTypeNotSupportedException.class)
    public ResponseEntity<ErrorResponse> handleUnsupportedMediaType(HttpMediaTypeNotSupportedException ex) {
        return new ResponseEntity<>(new ErrorResponse("UNSUPPORTED_MEDIA_TYPE",
                "API only accepts JSON. Please set 'Content-Type: application/json'"), HttpStatus.UNSUPPORTED_MEDIA_TYPE);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleIllegalArgument(IllegalArgumentException ex) {
        log.warn("Rejected request: {}", ex.getMessage());
        return new ResponseEntity<>(new ErrorResponse("INVALID_REQUEST", ex.getMessage()), HttpStatus.BAD_REQUEST);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(Exception ex) {
        log.error("Unhandled exception: ", ex);
        return new ResponseEntity<>(new ErrorResponse("INTERNAL_ERROR", "An internal server error occurred"),
                HttpStatus.INTERNAL_SERVER_ERROR);
    }

}
