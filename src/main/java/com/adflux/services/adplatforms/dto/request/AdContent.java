package com.adflux.services.adplatforms.dto.request;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import lombok.*;

/**
 * Creative content of a job advertisement
 */
@Getter
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
@ToString
@JsonInclude(JsonInclude.Include.NON_NULL)
@Schema(description = "Creative content of the ad")
public class AdContent {

    @NotBlank(message = "Title is required")
    @Schema(description = "Headline", example = "We are hiring a Backend Engineer")
    private String title;

    @NotBlank(message = "Description is required")
    @Schema(description = "Body text", example = "Join our platform team in Bogota.")
    private String description;

    @Schema(description = "Image URL", example = "https://cdn.example.com/jobs/backend.png")
    private String imageUrl;

    @Schema(description = "Video URL")
    private String videoUrl;

    @NotBlank(message = "Call to action is required")
    @Schema(description = "Call-to-action code", example = "apply_now")
    private String callToAction;

    @NotBlank(message = "Landing URL is required")
    @Schema(description = "Landing page URL", example = "https://jobs.example.com/backend")
    private String landingUrl;
}
