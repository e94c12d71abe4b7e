package com.baykanat.bloganalytics.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** POST /analytics/performance gövdesi. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Period-over-period performance request")
public class PerformanceRequest {

    @JsonProperty("period_size")
    @Schema(description = "day, week, month or year", example = "month", defaultValue = "month")
    private String periodSize;

    @Schema(description = "Optional filter tree over country.*, author.* and blog.*")
    private JsonNode filters;

    @JsonProperty("author_id")
    @Schema(description = "Restrict to one author", example = "42")
    private Long authorId;

    @Schema(description = "Inclusive start date (yyyy-MM-dd)", example = "2025-01-01")
    private String start;

    @Schema(description = "Inclusive end date (yyyy-MM-dd)", example = "2025-12-31")
    private String end;
}
