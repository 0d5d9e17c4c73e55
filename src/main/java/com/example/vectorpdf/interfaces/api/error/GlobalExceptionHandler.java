package com.example.vectorpdf.interfaces.api.error;

import com.example.vectorpdf.application.exception.ApplicationException;
import com.example.vectorpdf.application.exception.AssemblyInvariantException;
import com.example.vectorpdf.domain.exception.AttributeValidationException;
import com.example.vectorpdf.domain.exception.DomainException;
import com.example.vectorpdf.domain.exception.StructuralElementException;
import com.example.vectorpdf.domain.exception.UnresolvableColorException;
import com.example.vectorpdf.domain.exception.UnsupportedElementException;
import com.example.vectorpdf.infrastructure.exception.InfrastructureException;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.Map;

/**
 * Centralized API-layer exception handler that maps domain/application/infrastructure failures to HTTP responses.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    /**
     * Maps malformed element trees to a 400 response.
     *
     * @param ex      thrown exception
     * @param request incoming HTTP request
     * @return response entity with serialized error payload
     */
    @ExceptionHandler(StructuralElementException.class)
    public ResponseEntity<ErrorResponse> handleStructural(StructuralElementException ex, HttpServletRequest request) {
        return buildResponse(ex, request, HttpStatus.BAD_REQUEST, "STRUCTURAL_ERROR");
    }

    /**
     * Maps unknown element tags to a 400 response.
     *
     * @param ex      thrown exception
     * @param request incoming HTTP request
     * @return response entity with serialized error payload
     */
    @ExceptionHandler(UnsupportedElementException.class)
    public ResponseEntity<ErrorResponse> handleUnsupported(UnsupportedElementException ex, HttpServletRequest request) {
        return buildResponse(ex, request, HttpStatus.BAD_REQUEST, "UNSUPPORTED_ELEMENT",
                Map.of("element", ex.getTag()));
    }

    /**
     * Maps attribute failures to a 400 response carrying the offending field.
     *
     * @param ex      thrown exception
     * @param request incoming HTTP request
     * @return response entity with serialized error payload
     */
    @ExceptionHandler(AttributeValidationException.class)
    public ResponseEntity<ErrorResponse> handleAttributeValidation(AttributeValidationException ex,
                                                                   HttpServletRequest request) {
        return buildResponse(ex, request, HttpStatus.BAD_REQUEST, "ATTRIBUTE_VALIDATION_ERROR", ex.toDetails());
    }

    /**
     * Maps color strings that are neither named nor hex to a 400 response.
     *
     * @param ex      thrown exception
     * @param request incoming HTTP request
     * @return response entity with serialized error payload
     */
    @ExceptionHandler(UnresolvableColorException.class)
    public ResponseEntity<ErrorResponse> handleUnresolvableColor(UnresolvableColorException ex,
                                                                 HttpServletRequest request) {
        return buildResponse(ex, request, HttpStatus.BAD_REQUEST, "UNRESOLVABLE_COLOR",
                Map.of("color", String.valueOf(ex.getColor())));
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
        return buildResponse(ex, request, HttpStatus.BAD_REQUEST, "DOMAIN_ERROR");
    }

    /**
     * Maps request bodies that are not JSON to a 400 response.
     *
     * @param ex      thrown exception
     * @param request incoming HTTP request
     * @return response entity with serialized error payload
     */
    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadable(HttpMessageNotReadableException ex, HttpServletRequest request) {
        ErrorResponse response = ErrorResponse.of(HttpStatus.BAD_REQUEST.value(), "MALFORMED_REQUEST",
                "Request body must be a JSON element tree", request.getRequestURI());
        return ResponseEntity.badRequest().body(response);
    }

    /**
     * Maps a broken assembly to a 500 response. This is a defect, not a client error.
     *
     * @param ex      thrown exception
     * @param request incoming HTTP request
     * @return response entity with serialized error payload
     */
    @ExceptionHandler(AssemblyInvariantException.class)
    public ResponseEntity<ErrorResponse> handleAssemblyInvariant(AssemblyInvariantException ex,
                                                                 HttpServletRequest request) {
        log.error("PDF assembly invariant violated on {}", request.getRequestURI(), ex);
        return buildResponse(ex, request, HttpStatus.INTERNAL_SERVER_ERROR, "ASSEMBLY_INVARIANT_ERROR");
    }

    /**
     * Maps other application-layer exceptions to a 500 response.
     *
     * @param ex      thrown exception
     * @param request incoming HTTP request
     * @return response entity with serialized error payload
     */
    @ExceptionHandler(ApplicationException.class)
    public ResponseEntity<ErrorResponse> handleApplication(ApplicationException ex, HttpServletRequest request) {
        return buildResponse(ex, request, HttpStatus.INTERNAL_SERVER_ERROR, "APPLICATION_ERROR");
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
        return buildResponse(ex, request, HttpStatus.INTERNAL_SERVER_ERROR, "INFRASTRUCTURE_ERROR");
    }

    /**
     * Fallback for unexpected exceptions.
     *
     * @param ex      thrown exception
     * @param request incoming HTTP request
     * @return response entity with serialized error payload
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGeneric(Exception ex, HttpServletRequest request) {
        log.error("Unexpected failure on {}", request.getRequestURI(), ex);
        return buildResponse(ex, request, HttpStatus.INTERNAL_SERVER_ERROR, "UNEXPECTED_ERROR");
    }

    private ResponseEntity<ErrorResponse> buildResponse(Throwable error,
                                                       HttpServletRequest request,
                                                       HttpStatus status,
                                                       String errorCode) {
        return buildResponse(error, request, status, errorCode, null);
    }

    /**
     * Central helper that creates a consistent {@link ErrorResponse} envelope.
     *
     * @param error     exception that triggered the handler
     * @param request   incoming HTTP request
     * @param status    HTTP status code to return
     * @param errorCode application-specific error code
     * @param details   optional structured details, may be {@code null}
     * @return response entity containing the serialized error
     */
    private ResponseEntity<ErrorResponse> buildResponse(Throwable error,
                                                       HttpServletRequest request,
                                                       HttpStatus status,
                                                       String errorCode,
                                                       Map<String, Object> details) {
        ErrorResponse response = ErrorResponse.withDetails(status.value(), errorCode, error.getMessage(),
                request.getRequestURI(), details);
        return ResponseEntity.status(status).body(response);
    }
}
