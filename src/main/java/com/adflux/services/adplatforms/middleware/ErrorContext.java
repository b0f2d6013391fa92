package com.adflux.services.adplatforms.middleware;

import com.adflux.services.adplatforms.dto.response.ApiErrorDetail;
import lombok.Builder;
import lombok.Getter;
import lombok.Setter;
import lombok.ToString;

/**
 * Classified failure of one attempt. Error middleware may rewrite the message
 * shown to the caller; the classification itself stays fixed.
 */
@Getter
@Setter
@Builder
@ToString(exclude = "error")
public class ErrorContext {

    private final Throwable error;
    private final ApiErrorDetail detail;
    private final long durationMs;
    private final int retryCount;
    private String message;

    /** Classification with the (possibly enriched) message applied */
    public ApiErrorDetail resolvedDetail() {
        return message == null || message.equals(detail.getMessage()) ? detail : detail.withMessage(message);
    }
}
