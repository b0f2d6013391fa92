package com.adflux.services.adplatforms.classifier;

import com.adflux.services.adplatforms.constants.Platform;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Reads the platform error code and message out of an error body.
 *
 * Shapes:
 *   Meta      {"error": {"code": 190, "message": "..."}}
 *   Google    {"error": {"code": 401, "status": "UNAUTHENTICATED", "message": "..."}}
 *   X         {"errors": [{"code": 88, "message": "..."}]}
 *   TikTok    {"code": 40100, "message": "..."}           (code 0 = OK)
 *   Snapchat  {"error": {"code": "NOT_FOUND"}} or {"error_code": "...", "display_message": "..."}
 */
public final class ErrorBodyParser {

    private ErrorBodyParser() {
    }

    public record PlatformErrorCode(String code, String message) {
    }

    public static Optional<PlatformErrorCode> extract(Platform platform, Map<String, Object> body) {
        if (platform == null || body == null || body.isEmpty()) return Optional.empty();

        switch (platform) {
            case META:
                return fromNested(body, "code");
            case GOOGLE: {
                Optional<PlatformErrorCode> byStatus = fromNested(body, "status");
                return byStatus.isPresent() ? byStatus : fromNested(body, "code");
            }
            case X:
                return fromErrorsArray(body);
            case TIKTOK: {
                String code = asString(body.get("code"));
                if (code == null || "0".equals(code)) return Optional.empty();
                return Optional.of(new PlatformErrorCode(code, asString(body.get("message"))));
            }
            case SNAPCHAT: {
                Optional<PlatformErrorCode> nested = fromNested(body, "code");
                if (nested.isPresent()) return nested;
                String code = asString(body.get("error_code"));
                if (code == null) return Optional.empty();
                String message = asString(body.get("display_message"));
                return Optional.of(new PlatformErrorCode(code,
                        message != null ? message : asString(body.get("debug_message"))));
            }
            default:
                return Optional.empty();
        }
    }

    /** True when a 2xx body still reports an error */
    public static boolean carriesError(Platform platform, Map<String, Object> body) {
        if (body == null) return false;
        if (platform == Platform.TIKTOK) {
            return extract(platform, body).isPresent();
        }
        return body.get("error") instanceof Map;
    }

    private static Optional<PlatformErrorCode> fromNested(Map<String, Object> body, String codeField) {
        Object error = body.get("error");
        if (!(error instanceof Map)) return Optional.empty();
        Map<?, ?> errorMap = (Map<?, ?>) error;
        String code = asString(errorMap.get(codeField));
        if (code == null) return Optional.empty();
        return Optional.of(new PlatformErrorCode(code, asString(errorMap.get("message"))));
    }

    private static Optional<PlatformErrorCode> fromErrorsArray(Map<String, Object> body) {
        Object errors = body.get("errors");
        if (!(errors instanceof List) || ((List<?>) errors).isEmpty()) return Optional.empty();
        Object first = ((List<?>) errors).get(0);
        if (!(first instanceof Map)) return Optional.empty();
        Map<?, ?> firstError = (Map<?, ?>) first;
        String code = asString(firstError.get("code"));
        if (code == null) return Optional.empty();
        return Optional.of(new PlatformErrorCode(code, asString(firstError.get("message"))));
    }

    private static String asString(Object value) {
        if (value == null) return null;
        String text = String.valueOf(value);
        return text.isBlank() ? null : text;
    }
}
