package com.adflux.services.adplatforms.dto.request;

import com.adflux.services.adplatforms.constants.Gender;
import com.fasterxml.jackson.annotation.JsonInclude;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.Valid;
import lombok.*;

import java.util.List;

/**
 * Audience definition translated by each adapter into its own targeting vocabulary
 */
@Getter
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
@ToString
@JsonInclude(JsonInclude.Include.NON_NULL)
@Schema(description = "Who should see the ad")
public class TargetAudience {

    @Schema(description = "ISO country codes", example = "[\"CO\", \"MX\"]")
    @Builder.Default
    private List<String> locations = List.of();

    @Valid
    private AgeRange ageRange;

    @Schema(description = "Genders to target", example = "[\"all\"]")
    @Builder.Default
    private List<Gender> genders = List.of();

    @Schema(description = "Interest keywords", example = "[\"software\", \"java\"]")
    @Builder.Default
    private List<String> interests = List.of();

    private List<String> jobTitles;

    @Schema(description = "Education levels", example = "[\"undergraduate\"]")
    private List<String> educationLevels;

    @Schema(description = "Language codes", example = "[\"es\"]")
    private List<String> languages;

    /** True when no gender restriction applies */
    public boolean targetsAllGenders() {
        return genders == null || genders.isEmpty() || genders.contains(Gender.ALL)
                || (genders.contains(Gender.MALE) && genders.contains(Gender.FEMALE));
    }

    public List<String> locationsOrDefault(String fallback) {
        return locations == null || locations.isEmpty() ? List.of(fallback) : locations;
    }

    public List<String> interestsOrEmpty() {
        return interests == null ? List.of() : interests;
    }
}
