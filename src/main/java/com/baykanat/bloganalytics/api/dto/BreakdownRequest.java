package com.baykanat.bloganalytics.api.dto;

import com.fasterxml.jackson.databind.JsonNode;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** POST /analytics/breakdown gövdesi. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Dimension × period breakdown request")
public class BreakdownRequest {

    @NotBlank(message = "dimension is required")
    @Schema(description = "Grouping axis: country or user", example = "country", requiredMode = Schema.RequiredMode.REQUIRED)
    private String dimension;

    @Schema(description = "Optional filter tree")
    private JsonNode filters;

    @Schema(description = "Inclusive start date (yyyy-MM-dd)", example = "2025-01-01")
    private String start;

    @Schema(description = "Inclusive end date (yyyy-MM-dd)", example = "2025-01-31")
    private String end;

    @Schema(description = "Period granularity; chosen from the date span when omitted", example = "week")
    private String granularity;
}
