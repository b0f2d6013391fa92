package com.adflux.services.adplatforms.dto.request;

import com.adflux.services.adplatforms.constants.Platform;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotEmpty;
import lombok.*;

import java.util.List;
import java.util.Map;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
@Schema(description = "Read performance of one ad per platform")
public class MultiPlatformPerformanceRequest {

    @NotEmpty(message = "At least one ad id is required")
    @Schema(description = "Ad id keyed by platform", example = "{\"meta\": \"120210000\", \"tiktok\": \"170000\"}")
    private Map<Platform, String> adIds;

    @Schema(description = "Metric names; defaults apply when empty", example = "[\"impressions\", \"clicks\"]")
    private List<String> metrics;
}
