package com.adflux.services.adplatforms.controller;

import com.adflux.services.adplatforms.constants.AdPlatformConstants;
import com.adflux.services.adplatforms.constants.Platform;
import com.adflux.services.adplatforms.dto.response.ApiErrorDetail;
import com.adflux.services.adplatforms.dto.response.ApiResponse;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * HTTP status for a failed ApiResponse, derived from its error type.
 */
public final class ResponseStatuses {

    private ResponseStatuses() {
    }

    static <T> ResponseEntity<ApiResponse<T>> toEntity(ApiResponse<T> response, HttpStatus successStatus) {
        return ResponseEntity.status(response.isSuccessful() ? successStatus : statusOf(response.getError()))
                .body(response);
    }

    public static HttpStatus statusOf(ApiErrorDetail error) {
        if (error == null) {
            return HttpStatus.INTERNAL_SERVER_ERROR;
        }
        if (AdPlatformConstants.ERROR_NOT_INITIALIZED.equals(error.getCode())) {
            return HttpStatus.CONFLICT;
        }
        if (AdPlatformConstants.ERROR_INVALID_CAMPAIGN.equals(error.getCode())) {
            return HttpStatus.BAD_REQUEST;
        }
        if (error.getType() == null) {
            return HttpStatus.BAD_GATEWAY;
        }
        switch (error.getType()) {
            case VALIDATION: return HttpStatus.BAD_REQUEST;
            case NOT_FOUND: return HttpStatus.NOT_FOUND;
            case AUTH: return HttpStatus.UNAUTHORIZED;
            case RATE_LIMIT: return HttpStatus.TOO_MANY_REQUESTS;
            case TIMEOUT: return HttpStatus.GATEWAY_TIMEOUT;
            default: return HttpStatus.BAD_GATEWAY;
        }
    }

    /** Platform-keyed results with the wire tags as keys */
    static <T> Map<String, ApiResponse<T>> byTag(Map<Platform, ApiResponse<T>> results) {
        Map<String, ApiResponse<T>> tagged = new LinkedHashMap<>();
        results.forEach((platform, response) -> tagged.put(platform.getValue(), response));
        return tagged;
    }
}
