package com.adflux.services.adplatforms.dto.request;

import com.adflux.services.adplatforms.constants.CampaignStatus;
import com.adflux.services.adplatforms.constants.Platform;
import com.fasterxml.jackson.annotation.JsonInclude;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.*;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Platform-neutral job advertisement campaign.
 *
 * Adapters only read it; a per-platform copy is made with {@link #forPlatform(Platform)}
 * when the same campaign is fanned out to several platforms.
 */
@Getter
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
@ToString
@JsonInclude(JsonInclude.Include.NON_NULL)
@Schema(description = "Job advertisement campaign to publish on one platform")
public class AdCampaign {

    @Schema(description = "Campaign id once known", example = "cmp-001")
    private String id;

    @NotBlank(message = "Campaign name is required")
    @Schema(description = "Campaign name", example = "Backend Engineer - Bogota")
    private String name;

    @NotNull(message = "Start date is required")
    @Schema(description = "First day the ad may run", example = "2026-11-01")
    private LocalDate startDate;

    @NotNull(message = "End date is required")
    @Schema(description = "Last day the ad may run", example = "2026-11-30")
    private LocalDate endDate;

    @NotNull(message = "Budget is required")
    @Positive(message = "Budget must be positive")
    @Schema(description = "Total budget in major currency units", example = "600.00")
    private BigDecimal budget;

    @Positive(message = "Daily budget must be positive")
    @Schema(description = "Optional daily budget in major currency units", example = "20.00")
    private BigDecimal dailyBudget;

    @Valid
    @NotNull(message = "Ad content is required")
    private AdContent content;

    @Valid
    @NotNull(message = "Target audience is required")
    private TargetAudience targetAudience;

    @NotNull(message = "Platform is required")
    @Schema(description = "Target platform", example = "meta")
    private Platform platform;

    @Builder.Default
    @Schema(description = "Campaign status", example = "draft")
    private CampaignStatus status = CampaignStatus.DRAFT;

    public AdCampaign forPlatform(Platform target) {
        return toBuilder().platform(target).build();
    }

    public boolean hasDailyBudget() {
        return dailyBudget != null && dailyBudget.signum() > 0;
    }
}
