package com.adflux.services.adplatforms.constants;

/**
 * Error taxonomy shared by every platform.
 *
 * The retryable flag here is only the default used when a failure is classified
 * from the HTTP status alone; known platform codes carry their own flag.
 */
public enum ErrorType {
    NETWORK(true, "Check network connectivity and retry the request."),
    AUTH(false, "Reconnect the platform account to obtain a fresh access token."),
    RATE_LIMIT(true, "Wait for the rate-limit window to reset before sending more requests."),
    VALIDATION(false, "Review the campaign fields sent to the platform."),
    NOT_FOUND(false, "Verify the resource id; it may have been deleted on the platform."),
    SERVER(true, "The platform reported an internal error. Retry later."),
    TIMEOUT(true, "The platform did not answer in time. Retry the request."),
    UNKNOWN(false, "Inspect the platform response for details.");

    private final boolean retryable;
    private final String recommendedAction;

    ErrorType(boolean retryable, String recommendedAction) {
        this.retryable = retryable;
        this.recommendedAction = recommendedAction;
    }

    public boolean isRetryable() {
        return retryable;
    }

    public String getRecommendedAction() {
        return recommendedAction;
    }
}
