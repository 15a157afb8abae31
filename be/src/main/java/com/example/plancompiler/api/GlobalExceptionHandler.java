package com.example.plancompiler.api;

import com.example.plancompiler.compiler.WorkflowCompilationException;
import com.example.plancompiler.definition.DefinitionValidationServiceException;
import com.example.plancompiler.definition.StateMachineDefinitionRejectedException;
import com.example.plancompiler.validation.ValidationError;
import com.example.plancompiler.validation.ValidationErrorKind;
import com.example.plancompiler.validation.WorkflowValidationException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.servlet.resource.NoResourceFoundException;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Central exception handling for the REST API.
 * <p>
 * Maps exceptions to HTTP status and {@link ErrorResponse} body: invalid plans → 400 with the
 * {@code errors} list, plans the compiler or the definition check cannot accept → 422, an
 * unreachable definition validation service → 502, unknown programs → 404. No stack traces in responses.
 * </p>
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);
    private static final int UNPROCESSABLE = 422;

    @ExceptionHandler(CompiledProgramNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleProgramNotFound(CompiledProgramNotFoundException ex) {
        log.warn("Compiled program not found: {}", ex.getProgramId());
        return ResponseEntity
                .status(HttpStatus.NOT_FOUND)
                .body(new ErrorResponse("Compiled program not found: " + ex.getProgramId()));
    }

    @ExceptionHandler(WorkflowValidationException.class)
    public ResponseEntity<ErrorResponse> handlePlanValidation(WorkflowValidationException ex) {
        log.warn("Workflow plan validation failed: {} errors={}", ex.getMessage(), ex.getErrors().size());
        return ResponseEntity
                .status(HttpStatus.BAD_REQUEST)
                .body(ErrorResponse.withErrors(ex.getMessage(), ex.getErrors()));
    }

    @ExceptionHandler(WorkflowCompilationException.class)
    public ResponseEntity<ErrorResponse> handleCompilation(WorkflowCompilationException ex) {
        log.warn("Workflow plan compilation aborted kind={}: {}", ex.getKind(), ex.getMessage());
        return ResponseEntity
                .status(UNPROCESSABLE)
                .body(ErrorResponse.withErrors("Workflow plan compilation aborted",
                        List.of(new ValidationError(ex.getKind(), "plan", ex.getMessage()))));
    }

    @ExceptionHandler(StateMachineDefinitionRejectedException.class)
    public ResponseEntity<ErrorResponse> handleDefinitionRejected(StateMachineDefinitionRejectedException ex) {
        log.warn("{} diagnostics={}", ex.getMessage(), ex.getDiagnostics().size());
        return ResponseEntity
                .status(UNPROCESSABLE)
                .body(ErrorResponse.withDiagnostics(ex.getMessage(), ex.getDiagnostics()));
    }

    @ExceptionHandler(DefinitionValidationServiceException.class)
    public ResponseEntity<ErrorResponse> handleDefinitionService(DefinitionValidationServiceException ex) {
        log.error("Definition validation service failed: {}", ex.getMessage());
        return ResponseEntity
                .status(HttpStatus.BAD_GATEWAY)
                .body(new ErrorResponse("Definition validation service failed: " + ex.getMessage()));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleBeanValidation(MethodArgumentNotValidException ex) {
        List<ValidationError> errors = ex.getBindingResult().getFieldErrors().stream()
                .map(fe -> new ValidationError(ValidationErrorKind.MISSING_REQUIRED_FIELD, fe.getField(),
                        fe.getDefaultMessage() != null ? fe.getDefaultMessage() : "invalid"))
                .collect(Collectors.toList());
        log.warn("Bean validation failed: {} field errors", errors.size());
        return ResponseEntity
                .status(HttpStatus.BAD_REQUEST)
                .body(ErrorResponse.withErrors("Validation failed", errors));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadable(HttpMessageNotReadableException ex) {
        log.warn("Unreadable request body: {}", ex.getMessage());
        return ResponseEntity
                .status(HttpStatus.BAD_REQUEST)
                .body(new ErrorResponse("Request body is not valid JSON"));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleIllegalArgument(IllegalArgumentException ex) {
        log.warn("Invalid request: {}", ex.getMessage());
        return ResponseEntity
                .status(HttpStatus.BAD_REQUEST)
                .body(new ErrorResponse(ex.getMessage() != null ? ex.getMessage() : "Invalid request"));
    }

    @ExceptionHandler(NoResourceFoundException.class)
    public ResponseEntity<ErrorResponse> handleNoResourceFound(NoResourceFoundException ex) {
        log.debug("Resource not found: {}", ex.getResourcePath());
        return ResponseEntity
                .status(HttpStatus.NOT_FOUND)
                .body(new ErrorResponse("Not found: " + ex.getResourcePath()));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGeneric(Exception ex) {
        log.error("Unhandled error: {}", ex.getMessage(), ex);
        return ResponseEntity
                .status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(new ErrorResponse("An error occurred while processing the workflow plan"));
    }
}
