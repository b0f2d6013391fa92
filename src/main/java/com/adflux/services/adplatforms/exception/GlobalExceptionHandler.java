package com.adflux.services.adplatforms.exception;

import com.adflux.services.adplatforms.constants.ErrorType;
import com.adflux.services.adplatforms.constants.Platform;
import com.adflux.services.adplatforms.controller.ResponseStatuses;
import com.adflux.services.adplatforms.dto.response.ApiErrorDetail;
import com.adflux.services.adplatforms.dto.response.ApiResponse;
import com.adflux.services.adplatforms.dto.response.ResponseMeta;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.ConstraintViolationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Maps exceptions that reach the REST layer onto ApiResponse errors.
 *
 * The facade already turns platform failures into ApiResponse values, so most of
 * what lands here is request binding (bad JSON, unknown platform tags, bean validation)
 * or an exception thrown outside the facade.
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    private static final String KNOWN_PLATFORMS = Arrays.stream(Platform.values())
            .map(Platform::getValue)
            .collect(Collectors.joining(", "));

    // ========================
    // Platform Exceptions
    // ========================

    @ExceptionHandler(AdapterNotInitializedException.class)
    public ResponseEntity<ApiResponse<Void>> handleNotInitialized(
            AdapterNotInitializedException ex,
            HttpServletRequest request
    ) {
        log.warn("Platform not initialized: {} - Path: {}", ex.getMessage(), request.getRequestURI());
        return ResponseEntity
                .status(HttpStatus.CONFLICT)
                .body(ApiResponse.error(ex.getMessage(), ex.getErrorCode()));
    }

    @ExceptionHandler(NotAuthenticatedException.class)
    public ResponseEntity<ApiResponse<Void>> handleNotAuthenticated(
            NotAuthenticatedException ex,
            HttpServletRequest request
    ) {
        log.warn("{} not authenticated - Path: {}", ex.getPlatform().getDisplayName(), request.getRequestURI());
        ApiErrorDetail detail = ApiErrorDetail.of(ex.getErrorCode(), ex.getMessage(), ex.getPlatform(), ErrorType.AUTH);
        return ResponseEntity
                .status(HttpStatus.UNAUTHORIZED)
                .body(ApiResponse.error(detail));
    }

    @ExceptionHandler(InvalidCampaignException.class)
    public ResponseEntity<ApiResponse<Void>> handleInvalidCampaign(
            InvalidCampaignException ex,
            HttpServletRequest request
    ) {
        log.warn("Invalid campaign: {} - Path: {}", ex.getMessage(), request.getRequestURI());
        return ResponseEntity
                .status(HttpStatus.BAD_REQUEST)
                .body(ApiResponse.error(ex.getMessage(), ex.getErrorCode()));
    }

    /** Remote resources created before the failing step stay on the platform; their ids are returned */
    @ExceptionHandler(ResourceCreationException.class)
    public ResponseEntity<ApiResponse<Void>> handleResourceCreation(
            ResourceCreationException ex,
            HttpServletRequest request
    ) {
        log.error("Creation stopped at step '{}', partial ids {} - Path: {}",
                ex.getStep(), ex.getPartialIds(), request.getRequestURI());
        ApiResponse<Void> response = ApiResponse.error(ex.getMessage(), ex.getErrorCode());
        response.setMeta(ResponseMeta.builder().partialIds(ex.getPartialIds()).build());
        return ResponseEntity
                .status(HttpStatus.BAD_GATEWAY)
                .body(response);
    }

    @ExceptionHandler(PlatformApiException.class)
    public ResponseEntity<ApiResponse<Void>> handlePlatformApiException(
            PlatformApiException ex,
            HttpServletRequest request
    ) {
        ApiErrorDetail detail = ex.getDetail();
        HttpStatus status = ResponseStatuses.statusOf(detail);
        if (status.is5xxServerError()) {
            log.error("Platform API error {}: {} - Path: {}", detail.getCode(), ex.getMessage(), request.getRequestURI(), ex);
        } else {
            log.warn("Platform API error {}: {} - Path: {}", detail.getCode(), ex.getMessage(), request.getRequestURI());
        }
        return ResponseEntity
                .status(status)
                .body(ApiResponse.error(detail));
    }

    // ========================
    // Request Binding
    // ========================

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiResponse<Map<String, String>>> handleValidationErrors(
            MethodArgumentNotValidException ex
    ) {
        Map<String, String> fieldErrors = new LinkedHashMap<>();
        for (FieldError error : ex.getBindingResult().getFieldErrors()) {
            fieldErrors.putIfAbsent(error.getField(), error.getDefaultMessage());
        }
        ex.getBindingResult().getGlobalErrors()
                .forEach(error -> fieldErrors.putIfAbsent(error.getObjectName(), error.getDefaultMessage()));

        log.warn("Campaign request rejected: {}", fieldErrors);

        ApiResponse<Map<String, String>> response = ApiResponse.<Map<String, String>>builder()
                .success(false)
                .message("Validation failed")
                .data(fieldErrors)
                .error(ApiErrorDetail.builder()
                        .code("VALIDATION_ERROR")
                        .message(fieldErrors.size() + " field(s) have invalid values")
                        .type(ErrorType.VALIDATION)
                        .build())
                .build();

        return ResponseEntity
                .status(HttpStatus.BAD_REQUEST)
                .body(response);
    }

    @ExceptionHandler(ConstraintViolationException.class)
    public ResponseEntity<ApiResponse<Void>> handleConstraintViolation(
            ConstraintViolationException ex
    ) {
        log.warn("Constraint violation: {}", ex.getMessage());
        return ResponseEntity
                .status(HttpStatus.BAD_REQUEST)
                .body(ApiResponse.error(ex.getMessage(), "CONSTRAINT_VIOLATION"));
    }

    @ExceptionHandler(MissingServletRequestParameterException.class)
    public ResponseEntity<ApiResponse<Void>> handleMissingParameter(
            MissingServletRequestParameterException ex
    ) {
        return ResponseEntity
                .status(HttpStatus.BAD_REQUEST)
                .body(ApiResponse.error("Query parameter '" + ex.getParameterName() + "' is required",
                        "MISSING_PARAMETER"));
    }

    /** Path variables: unknown platform tags end up here through the String to Platform converter */
    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ApiResponse<Void>> handleTypeMismatch(
            MethodArgumentTypeMismatchException ex
    ) {
        String message = Platform.class.equals(ex.getRequiredType())
                ? "Unknown platform '" + ex.getValue() + "', expected one of: " + KNOWN_PLATFORMS
                : "Invalid value '" + ex.getValue() + "' for '" + ex.getName() + "'";
        log.debug("Path binding failed: {}", message);
        return ResponseEntity
                .status(HttpStatus.BAD_REQUEST)
                .body(ApiResponse.error(message, "INVALID_PARAMETER_TYPE"));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ApiResponse<Void>> handleNotReadable(
            HttpMessageNotReadableException ex
    ) {
        String message = mentionsUnknownPlatform(ex)
                ? "Request body names an unknown platform, expected one of: " + KNOWN_PLATFORMS
                : "Request body is not valid campaign JSON";
        log.debug("Unreadable request body: {}", ex.getMessage());
        return ResponseEntity
                .status(HttpStatus.BAD_REQUEST)
                .body(ApiResponse.error(message, "INVALID_REQUEST_BODY"));
    }

    // ========================
    // Fallback
    // ========================

    @ExceptionHandler(AdPlatformException.class)
    public ResponseEntity<ApiResponse<Void>> handleAdPlatformException(
            AdPlatformException ex,
            HttpServletRequest request
    ) {
        log.error("Ad platform error {} at path {}: {}", ex.getErrorCode(), request.getRequestURI(), ex.getMessage(), ex);
        return ResponseEntity
                .status(HttpStatus.BAD_GATEWAY)
                .body(ApiResponse.error(ex.getMessage(), ex.getErrorCode()));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiResponse<Void>> handleGenericException(
            Exception ex,
            HttpServletRequest request
    ) {
        log.error("Unexpected error at path {}: {}", request.getRequestURI(), ex.getMessage(), ex);
        return ResponseEntity
                .status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(ApiResponse.error("Unexpected error while handling the ad request", "INTERNAL_SERVER_ERROR"));
    }

    private static boolean mentionsUnknownPlatform(Throwable ex) {
        for (Throwable cause = ex; cause != null; cause = cause.getCause()) {
            String message = cause.getMessage();
            if (message != null && message.contains("Unknown platform")) {
                return true;
            }
            if (cause.getCause() == cause) {
                break;
            }
        }
        return false;
    }
}
