package com.adflux.services.adplatforms.classifier;

import com.adflux.services.adplatforms.constants.AdPlatformConstants;
import com.adflux.services.adplatforms.constants.ErrorType;
import com.adflux.services.adplatforms.constants.Platform;
import com.adflux.services.adplatforms.dto.response.ApiErrorDetail;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Maps transport and platform failures to {@link ApiErrorDetail}.
 *
 * Order of precedence:
 *   1. open circuit, timeout, network failure (no response)
 *   2. HTTP 401/403 -> AUTH, 429 -> RATE_LIMIT, >=500 -> SERVER
 *   3. known platform code from {@link PlatformErrorTable}
 *   4. 404 -> NOT_FOUND, anything else -> UNKNOWN (not retryable)
 *
 * When the body carries a platform code the result is always namespaced with it,
 * e.g. a 429 with TikTok body {"code": 42900} becomes TIKTOK_42900.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ErrorClassifier {

    private final ObjectMapper objectMapper;

    public ApiErrorDetail classify(Throwable error, Platform platform) {
        return classify(RawPlatformError.from(error, objectMapper), platform);
    }

    public ApiErrorDetail classify(RawPlatformError raw, Platform platform) {
        if (raw.isCircuitOpen()) {
            return build(platform.errorPrefix() + "_CIRCUIT_OPEN",
                    platform.getDisplayName() + " calls are suspended after repeated failures",
                    platform, null, ErrorType.SERVER, false);
        }
        if (raw.isTimeout()) {
            return build(AdPlatformConstants.ERROR_TIMEOUT, raw.getMessage(), platform, null, ErrorType.TIMEOUT, true);
        }
        if (raw.isNetwork()) {
            return build(AdPlatformConstants.ERROR_NETWORK, raw.getMessage(), platform, null, ErrorType.NETWORK, true);
        }

        Integer status = raw.getStatusCode();
        Optional<ErrorBodyParser.PlatformErrorCode> platformCode = ErrorBodyParser.extract(platform, raw.getBody());
        Optional<PlatformErrorTable.KnownError> known = platformCode
                .flatMap(pc -> PlatformErrorTable.lookup(platform, pc.code()));

        String code = platformCode
                .map(pc -> platform.errorPrefix() + "_" + pc.code())
                .orElseGet(() -> platform.errorPrefix() + fallbackSuffix(status));

        String message = known.map(PlatformErrorTable.KnownError::message)
                .or(() -> platformCode.map(ErrorBodyParser.PlatformErrorCode::message))
                .orElseGet(() -> fallbackMessage(status, raw.getMessage()));

        ErrorType statusType = typeForStatus(status);
        ErrorType type;
        boolean retryable;
        if (statusType != null) {
            type = statusType;
            retryable = statusType.isRetryable();
        } else if (known.isPresent()) {
            type = known.get().type();
            retryable = known.get().retryable();
        } else if (status != null && status == 404) {
            type = ErrorType.NOT_FOUND;
            retryable = false;
        } else {
            type = ErrorType.UNKNOWN;
            retryable = false;
        }

        ApiErrorDetail detail = build(code, message, platform, status, type, retryable);
        log.debug("Classified {} error: code={}, type={}, retryable={}", platform.getValue(), code, type, retryable);
        return detail;
    }

    private ApiErrorDetail build(String code, String message, Platform platform, Integer status,
                                 ErrorType type, boolean retryable) {
        return ApiErrorDetail.builder()
                .code(code)
                .message(message)
                .platform(platform)
                .httpStatus(status)
                .type(type)
                .retryable(retryable)
                .rateLimited(type == ErrorType.RATE_LIMIT)
                .authError(type == ErrorType.AUTH)
                .recommendedAction(type.getRecommendedAction())
                .build();
    }

    private ErrorType typeForStatus(Integer status) {
        if (status == null) return null;
        if (status == 401 || status == 403) return ErrorType.AUTH;
        if (status == 429) return ErrorType.RATE_LIMIT;
        if (status >= 500) return ErrorType.SERVER;
        return null;
    }

    private String fallbackSuffix(Integer status) {
        if (status == null) return "_UNKNOWN_ERROR";
        if (status == 401) return "_AUTH_ERROR";
        if (status == 403) return "_FORBIDDEN";
        if (status == 404) return "_NOT_FOUND";
        if (status == 429) return "_RATE_LIMIT";
        if (status >= 500) return "_SERVER_ERROR";
        return "_UNKNOWN_ERROR";
    }

    private String fallbackMessage(Integer status, String rawMessage) {
        if (status == null) return rawMessage != null ? rawMessage : "Unexpected platform error";
        if (status == 401) return "Authentication failed";
        if (status == 403) return "Permission denied";
        if (status == 404) return "Resource not found";
        if (status == 429) return "Rate limit exceeded";
        if (status >= 500) return "Platform server error (HTTP " + status + ")";
        return "Unexpected platform error (HTTP " + status + ")";
    }
}
