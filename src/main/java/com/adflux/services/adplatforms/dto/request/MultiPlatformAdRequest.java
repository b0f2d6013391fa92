package com.adflux.services.adplatforms.dto.request;

import com.adflux.services.adplatforms.constants.Platform;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import lombok.*;

import java.util.List;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
@Schema(description = "Publish one campaign on several platforms at once")
public class MultiPlatformAdRequest {

    @Valid
    @NotNull(message = "Campaign is required")
    private AdCampaign campaign;

    @NotEmpty(message = "At least one platform is required")
    @Schema(example = "[\"meta\", \"x\"]")
    private List<Platform> platforms;
}
