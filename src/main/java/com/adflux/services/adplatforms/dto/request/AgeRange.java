package com.adflux.services.adplatforms.dto.request;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.*;

@Getter
@NoArgsConstructor
@AllArgsConstructor
@Builder
@ToString
public class AgeRange {

    @Min(13)
    @Max(100)
    private Integer min;

    @Min(13)
    @Max(100)
    private Integer max;

    public int minOr(int fallback) {
        return min != null ? min : fallback;
    }

    public int maxOr(int fallback) {
        return max != null ? max : fallback;
    }

    /** True when [from, to] overlaps this range */
    public boolean overlaps(int from, int to) {
        return minOr(13) <= to && maxOr(100) >= from;
    }
}
