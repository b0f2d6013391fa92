package com.adflux.services.adplatforms.exception;

import com.adflux.services.adplatforms.dto.response.ApiErrorDetail;
import lombok.Getter;

/**
 * Thrown when a platform call failed after classification and, where allowed, retries.
 * The attached detail is what the caller eventually sees.
 */
@Getter
public class PlatformApiException extends AdPlatformException {

    private final transient ApiErrorDetail detail;

    public PlatformApiException(ApiErrorDetail detail) {
        super(detail.getMessage(), detail.getCode());
        this.detail = detail;
    }

    public PlatformApiException(ApiErrorDetail detail, Throwable cause) {
        super(detail.getMessage(), detail.getCode(), cause);
        this.detail = detail;
    }
}
