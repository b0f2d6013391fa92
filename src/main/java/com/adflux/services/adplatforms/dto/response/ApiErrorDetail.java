package com.adflux.services.adplatforms.dto.response;

import com.adflux.services.adplatforms.constants.ErrorType;
import com.adflux.services.adplatforms.constants.Platform;
import com.fasterxml.jackson.annotation.JsonInclude;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.*;

/**
 * Typed description of a failed platform call.
 */
@Getter
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
@ToString
@EqualsAndHashCode
@JsonInclude(JsonInclude.Include.NON_NULL)
@Schema(description = "Error details of a failed platform operation")
public class ApiErrorDetail {

    @Schema(description = "Platform-namespaced error code", example = "META_190")
    private String code;

    @Schema(description = "Human readable message", example = "Access token expired or invalid")
    private String message;

    @Schema(description = "Platform that produced the error", example = "meta")
    private Platform platform;

    @Schema(description = "HTTP status returned by the platform", example = "401")
    private Integer httpStatus;

    @Schema(description = "Error category", example = "AUTH")
    private ErrorType type;

    private boolean retryable;

    private boolean rateLimited;

    private boolean authError;

    @Schema(description = "Suggested next step for the caller")
    private String recommendedAction;

    public ApiErrorDetail withMessage(String newMessage) {
        return toBuilder().message(newMessage).build();
    }

    public static ApiErrorDetail of(String code, String message, Platform platform) {
        return ApiErrorDetail.builder()
                .code(code)
                .message(message)
                .platform(platform)
                .type(ErrorType.UNKNOWN)
                .build();
    }

    public static ApiErrorDetail of(String code, String message, Platform platform, ErrorType type) {
        return ApiErrorDetail.builder()
                .code(code)
                .message(message)
                .platform(platform)
                .type(type)
                .retryable(type.isRetryable())
                .rateLimited(type == ErrorType.RATE_LIMIT)
                .authError(type == ErrorType.AUTH)
                .recommendedAction(type.getRecommendedAction())
                .build();
    }
}
