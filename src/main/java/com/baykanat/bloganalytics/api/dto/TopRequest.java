package com.baykanat.bloganalytics.api.dto;

import com.fasterxml.jackson.databind.JsonNode;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** POST /analytics/top gövdesi. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Top-N ranking request")
public class TopRequest {

    @NotBlank(message = "dimension is required")
    @Schema(description = "Ranking axis: blog, country or user", example = "blog", requiredMode = Schema.RequiredMode.REQUIRED)
    private String dimension;

    @Schema(description = "Optional filter tree", example = "{\"eq\": {\"field\": \"country.code\", \"value\": \"US\"}}")
    private JsonNode filters;

    @Schema(description = "Inclusive start date (yyyy-MM-dd)", example = "2025-01-01")
    private String start;

    @Schema(description = "Inclusive end date (yyyy-MM-dd)", example = "2025-01-31")
    private String end;

    @Min(value = 1, message = "limit must be at least 1")
    @Schema(description = "Maximum rows (default 10, capped by configuration)", example = "10")
    private Integer limit;
}
