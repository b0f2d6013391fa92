package com.adflux.services.adplatforms.classifier;

import com.adflux.services.adplatforms.constants.ErrorType;
import com.adflux.services.adplatforms.constants.Platform;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

import static com.adflux.services.adplatforms.constants.ErrorType.*;

/**
 * Known platform error codes with their category, retry eligibility and message.
 * This table is the only place where a platform code is declared retryable.
 */
public final class PlatformErrorTable {

    private PlatformErrorTable() {
        throw new IllegalStateException("Table class cannot be instantiated");
    }

    public record KnownError(ErrorType type, boolean retryable, String message) {
    }

    private static final Map<Platform, Map<String, KnownError>> TABLE = new EnumMap<>(Platform.class);

    static {
        TABLE.put(Platform.META, Map.ofEntries(
                Map.entry("1", new KnownError(VALIDATION, false, "Unknown API error")),
                Map.entry("2", new KnownError(SERVER, true, "Temporary service error")),
                Map.entry("4", new KnownError(RATE_LIMIT, true, "Application request limit reached")),
                Map.entry("17", new KnownError(RATE_LIMIT, true, "User request limit reached")),
                Map.entry("100", new KnownError(VALIDATION, false, "Invalid parameter")),
                Map.entry("102", new KnownError(VALIDATION, false, "Session key invalid or no longer valid")),
                Map.entry("190", new KnownError(AUTH, false, "Access token expired or invalid")),
                Map.entry("200", new KnownError(NOT_FOUND, false, "Permission denied or resource not found")),
                Map.entry("294", new KnownError(VALIDATION, false, "Managing advertisements requires the ads_management permission")),
                Map.entry("2635", new KnownError(VALIDATION, false, "Deprecated API version")),
                Map.entry("1487395", new KnownError(VALIDATION, false, "Invalid targeting specification"))
        ));
        TABLE.put(Platform.GOOGLE, Map.ofEntries(
                Map.entry("AUTHENTICATION_ERROR", new KnownError(AUTH, false, "Authentication failed")),
                Map.entry("AUTHORIZATION_ERROR", new KnownError(AUTH, false, "Not authorized for this customer")),
                Map.entry("UNAUTHENTICATED", new KnownError(AUTH, false, "Authentication failed")),
                Map.entry("PERMISSION_DENIED", new KnownError(AUTH, false, "Permission denied")),
                Map.entry("CUSTOMER_NOT_FOUND", new KnownError(NOT_FOUND, false, "Customer not found")),
                Map.entry("NOT_FOUND", new KnownError(NOT_FOUND, false, "Resource not found")),
                Map.entry("INVALID_PAGE_TOKEN", new KnownError(VALIDATION, false, "Invalid page token")),
                Map.entry("INVALID_ARGUMENT", new KnownError(VALIDATION, false, "Invalid request argument")),
                Map.entry("QUOTA_EXCEEDED", new KnownError(RATE_LIMIT, true, "API quota exceeded")),
                Map.entry("RESOURCE_EXHAUSTED", new KnownError(RATE_LIMIT, true, "Resources exhausted")),
                Map.entry("REQUEST_ERROR", new KnownError(NETWORK, true, "Request error")),
                Map.entry("SERVER_ERROR", new KnownError(SERVER, true, "Internal server error")),
                Map.entry("INTERNAL", new KnownError(SERVER, true, "Internal server error")),
                Map.entry("UNAVAILABLE", new KnownError(SERVER, true, "Service unavailable")),
                Map.entry("DEADLINE_EXCEEDED", new KnownError(TIMEOUT, true, "Deadline exceeded"))
        ));
        TABLE.put(Platform.X, Map.ofEntries(
                Map.entry("32", new KnownError(AUTH, false, "Could not authenticate you")),
                Map.entry("34", new KnownError(NOT_FOUND, false, "Page does not exist")),
                Map.entry("88", new KnownError(RATE_LIMIT, true, "Rate limit exceeded")),
                Map.entry("89", new KnownError(VALIDATION, false, "Invalid or expired token")),
                Map.entry("130", new KnownError(SERVER, true, "Over capacity")),
                Map.entry("131", new KnownError(SERVER, true, "Internal error")),
                Map.entry("135", new KnownError(AUTH, false, "Timestamp out of bounds")),
                Map.entry("170", new KnownError(VALIDATION, false, "Missing required parameter")),
                Map.entry("185", new KnownError(VALIDATION, false, "Daily status update limit reached")),
                Map.entry("187", new KnownError(VALIDATION, false, "Duplicate status")),
                Map.entry("220", new KnownError(VALIDATION, false, "Credentials do not allow access to this resource"))
        ));
        TABLE.put(Platform.TIKTOK, Map.ofEntries(
                Map.entry("40001", new KnownError(VALIDATION, false, "Invalid parameter")),
                Map.entry("40002", new KnownError(VALIDATION, false, "Missing required parameter")),
                Map.entry("40003", new KnownError(VALIDATION, false, "Invalid parameter value")),
                Map.entry("40100", new KnownError(AUTH, false, "Access token invalid")),
                Map.entry("40101", new KnownError(AUTH, false, "Access token expired")),
                Map.entry("40301", new KnownError(AUTH, false, "Advertiser has no permission")),
                Map.entry("40400", new KnownError(NOT_FOUND, false, "Resource not found")),
                Map.entry("40900", new KnownError(VALIDATION, false, "Resource conflict")),
                Map.entry("42900", new KnownError(RATE_LIMIT, true, "Request frequency limit reached")),
                Map.entry("50000", new KnownError(SERVER, true, "Internal system error"))
        ));
        TABLE.put(Platform.SNAPCHAT, Map.ofEntries(
                Map.entry("INVALID_ARGUMENT", new KnownError(VALIDATION, false, "Invalid argument")),
                Map.entry("AUTHENTICATION_ERROR", new KnownError(AUTH, false, "Authentication failed")),
                Map.entry("AUTHORIZATION_ERROR", new KnownError(AUTH, false, "Not authorized")),
                Map.entry("NOT_FOUND", new KnownError(NOT_FOUND, false, "Resource not found")),
                Map.entry("RESOURCE_EXHAUSTED", new KnownError(RATE_LIMIT, true, "Rate limit exceeded")),
                Map.entry("UNAVAILABLE", new KnownError(SERVER, true, "Service unavailable")),
                Map.entry("DEADLINE_EXCEEDED", new KnownError(TIMEOUT, true, "Deadline exceeded")),
                Map.entry("INTERNAL", new KnownError(SERVER, true, "Internal error"))
        ));
    }

    public static Optional<KnownError> lookup(Platform platform, String code) {
        if (platform == null || code == null) return Optional.empty();
        return Optional.ofNullable(TABLE.getOrDefault(platform, Map.of()).get(code));
    }

    public static Map<String, KnownError> codesFor(Platform platform) {
        return Collections.unmodifiableMap(TABLE.getOrDefault(platform, Map.of()));
    }
}
