package com.adflux.services.adplatforms.dto.response;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.*;

import java.time.Clock;
import java.time.LocalDateTime;

/**
 * Uniform success/error contract returned for every platform operation
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
@Schema(description = "Standard API response wrapper")
public class ApiResponse<T> {

    private static volatile Clock clock = Clock.systemUTC();

    @Schema(description = "Indicates if request was successful", example = "true")
    private Boolean success;

    @Schema(description = "Response message", example = "Ad created on meta")
    private String message;

    @Schema(description = "Response data")
    private T data;

    @Schema(description = "Error details if request failed")
    private ApiErrorDetail error;

    @Schema(description = "Transport metadata")
    private ResponseMeta meta;

    @Schema(description = "Response timestamp")
    @Builder.Default
    private LocalDateTime timestamp = now();

    /**
     * Clock used to stamp responses. The application clock is installed at startup;
     * tests install a fixed one.
     */
    public static void useClock(Clock responseClock) {
        clock = responseClock != null ? responseClock : Clock.systemUTC();
    }

    private static LocalDateTime now() {
        return LocalDateTime.now(clock);
    }

    /**
     * Create success response with data
     */
    public static <T> ApiResponse<T> success(T data, String message) {
        return ApiResponse.<T>builder()
                .success(true)
                .message(message)
                .data(data)
                .timestamp(now())
                .build();
    }

    /**
     * Create success response with data and transport metadata
     */
    public static <T> ApiResponse<T> success(T data, String message, ResponseMeta meta) {
        ApiResponse<T> response = success(data, message);
        response.setMeta(meta);
        return response;
    }

    /**
     * Create success response without data
     */
    public static <T> ApiResponse<T> success(String message) {
        return success(null, message);
    }

    /**
     * Create error response
     */
    public static <T> ApiResponse<T> error(String message, String errorCode) {
        return error(ApiErrorDetail.builder()
                .code(errorCode)
                .message(message)
                .build());
    }

    public static <T> ApiResponse<T> error(ApiErrorDetail detail) {
        return ApiResponse.<T>builder()
                .success(false)
                .message(detail.getMessage())
                .error(detail)
                .timestamp(now())
                .build();
    }

    public static <T> ApiResponse<T> error(ApiErrorDetail detail, ResponseMeta meta) {
        ApiResponse<T> response = error(detail);
        response.setMeta(meta);
        return response;
    }

    @JsonIgnore
    public boolean isSuccessful() {
        return Boolean.TRUE.equals(success);
    }
}
