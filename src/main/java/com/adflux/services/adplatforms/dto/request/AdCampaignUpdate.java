package com.adflux.services.adplatforms.dto.request;

import com.adflux.services.adplatforms.constants.CampaignStatus;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Positive;
import lombok.*;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Partial update of a published ad. Null fields are left untouched.
 */
@Getter
@NoArgsConstructor
@AllArgsConstructor
@Builder
@ToString
@JsonInclude(JsonInclude.Include.NON_NULL)
@Schema(description = "Partial campaign update; only non-null fields are applied")
public class AdCampaignUpdate {

    private String name;

    private CampaignStatus status;

    @Positive
    private BigDecimal budget;

    @Positive
    private BigDecimal dailyBudget;

    private LocalDate startDate;

    private LocalDate endDate;

    @Valid
    private AdContent content;

    @Valid
    private TargetAudience targetAudience;

    @JsonIgnore
    public boolean touchesAdSet() {
        return budget != null || dailyBudget != null || startDate != null
                || endDate != null || targetAudience != null;
    }

    @JsonIgnore
    public boolean touchesCampaign() {
        return name != null || status != null;
    }

    @JsonIgnore
    public boolean isEmpty() {
        return !touchesAdSet() && !touchesCampaign() && content == null;
    }
}
