package com.example.attendance.interfaces.api.error;

import com.example.attendance.application.exception.ApplicationException;
import com.example.attendance.application.exception.EmptyResultException;
import com.example.attendance.application.exception.StaffNotFoundException;
import com.example.attendance.application.exception.UnclassifiedStaffException;
import com.example.attendance.application.exception.UseCaseValidationException;
import com.example.attendance.domain.exception.DomainException;
import com.example.attendance.domain.exception.SheetFormatException;
import com.example.attendance.domain.exception.SourceFileNotFoundException;
import com.example.attendance.infrastructure.exception.InfrastructureException;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.multipart.support.MissingServletRequestPartException;

import java.util.Map;

/**
 * Centralized API-layer exception handler that maps domain/application/infrastructure failures to HTTP responses.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    /**
     * Maps {@link SheetFormatException} to a 400 response listing the missing punch columns.
     */
    @ExceptionHandler(SheetFormatException.class)
    public ResponseEntity<ErrorResponse> handleSheetFormat(SheetFormatException ex, HttpServletRequest request) {
        Map<String, Object> details = Map.of("sheet", ex.getSheetName(), "missingColumns", ex.getMissingMarkers());
        return buildResponse(ex, request, HttpStatus.BAD_REQUEST, "SHEET_FORMAT_ERROR", details);
    }

    @ExceptionHandler(SourceFileNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleSourceNotFound(SourceFileNotFoundException ex, HttpServletRequest request) {
        return buildResponse(ex, request, HttpStatus.NOT_FOUND, "SOURCE_NOT_FOUND", null);
    }

    /**
     * Maps generic domain validation exceptions to a 400 response.
     *
     * @param ex      thrown domain exception
     * @param request incoming HTTP request
     * @return response entity with serialized error payload
     */
    @ExceptionHandler(DomainException.class)
    public ResponseEntity<ErrorResponse> handleDomain(DomainException ex, HttpServletRequest request) {
        return buildResponse(ex, request, HttpStatus.BAD_REQUEST, "DOMAIN_ERROR", null);
    }

    /**
     * Maps {@link UnclassifiedStaffException} to a 409 response carrying the unknown name,
     * so a client can offer to add it to the roster.
     */
    @ExceptionHandler(UnclassifiedStaffException.class)
    public ResponseEntity<ErrorResponse> handleUnclassifiedStaff(UnclassifiedStaffException ex, HttpServletRequest request) {
        return buildResponse(ex, request, HttpStatus.CONFLICT, "UNCLASSIFIED_STAFF", Map.of("staffName", ex.getStaffName()));
    }

    @ExceptionHandler(StaffNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleStaffNotFound(StaffNotFoundException ex, HttpServletRequest request) {
        return buildResponse(ex, request, HttpStatus.NOT_FOUND, "STAFF_NOT_FOUND", null);
    }

    @ExceptionHandler(EmptyResultException.class)
    public ResponseEntity<ErrorResponse> handleEmptyResult(EmptyResultException ex, HttpServletRequest request) {
        return buildResponse(ex, request, HttpStatus.UNPROCESSABLE_ENTITY, "EMPTY_RESULT", null);
    }

    /**
     * Maps generic use-case validation exceptions to a 400 response.
     *
     * @param ex      thrown exception
     * @param request incoming HTTP request
     * @return response entity with serialized error payload
     */
    @ExceptionHandler(UseCaseValidationException.class)
    public ResponseEntity<ErrorResponse> handleUseCaseValidation(UseCaseValidationException ex, HttpServletRequest request) {
        return buildResponse(ex, request, HttpStatus.BAD_REQUEST, "USE_CASE_VALIDATION_ERROR", null);
    }

    /**
     * Maps other application-layer exceptions to a 422 response.
     */
    @ExceptionHandler(ApplicationException.class)
    public ResponseEntity<ErrorResponse> handleApplication(ApplicationException ex, HttpServletRequest request) {
        return buildResponse(ex, request, HttpStatus.UNPROCESSABLE_ENTITY, "APPLICATION_ERROR", null);
    }

    @ExceptionHandler({MissingServletRequestPartException.class, MissingServletRequestParameterException.class})
    public ResponseEntity<ErrorResponse> handleMissingInput(Exception ex, HttpServletRequest request) {
        return buildResponse(ex, request, HttpStatus.BAD_REQUEST, "BAD_REQUEST", null);
    }

    /**
     * Maps infrastructure exceptions to a 500 response.
     *
     * @param ex      thrown exception
     * @param request incoming HTTP request
     * @return response entity with serialized error payload
     */
    @ExceptionHandler(InfrastructureException.class)
    public ResponseEntity<ErrorResponse> handleInfrastructure(InfrastructureException ex, HttpServletRequest request) {
        log.error("Infrastructure failure on {}", request.getRequestURI(), ex);
        return buildResponse(ex, request, HttpStatus.INTERNAL_SERVER_ERROR, "INFRASTRUCTURE_ERROR", null);
    }

    /**
     * Fallback for unexpected exceptions.
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGeneric(Exception ex, HttpServletRequest request) {
        log.error("Unexpected failure on {}", request.getRequestURI(), ex);
        return buildResponse(ex, request, HttpStatus.INTERNAL_SERVER_ERROR, "UNEXPECTED_ERROR", null);
    }

    /**
     * Central helper that creates a consistent {@link ErrorResponse} envelope.
     *
     * @param error     exception that triggered the handler
     * @param request   incoming HTTP request
     * @param status    HTTP status code to return
     * @param errorCode application-specific error code
     * @param details   optional extra fields, may be {@code null}
     * @return response entity containing the serialized error
     */
    private ResponseEntity<ErrorResponse> buildResponse(Throwable error,
                                                       HttpServletRequest request,
                                                       HttpStatus status,
                                                       String errorCode,
                                                       Map<String, Object> details) {
        ErrorResponse response = ErrorResponse.of(status.value(), errorCode, error.getMessage(), request.getRequestURI(), details);
        return ResponseEntity.status(status).body(response);
    }
}
