package com.adflux.services.adplatforms.dto.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.*;

import java.util.Map;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
@Schema(description = "Transport metadata attached to a response")
public class ResponseMeta {

    @Schema(description = "Id of the last request sent to the platform", example = "meta_1760000000000_k2j9x0a")
    private String requestId;

    private RateLimitSnapshot rateLimit;

    @Schema(description = "Resources already created on the platform when a multi-step creation stopped")
    private Map<String, String> partialIds;

    @Schema(description = "Cursor for the next page, when the platform paginates")
    private String nextCursor;
}
