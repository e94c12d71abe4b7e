package com.baykanat.bloganalytics.api.dto;

import com.fasterxml.jackson.databind.JsonNode;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** POST /analytics/time-series gövdesi. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "View time-series request")
public class TimeSeriesRequest {

    @Schema(description = "hour, day, week, month or year", example = "day", defaultValue = "day")
    private String granularity;

    @Schema(description = "Optional filter tree")
    private JsonNode filters;

    @Schema(description = "Inclusive start date (yyyy-MM-dd)", example = "2025-01-01")
    private String start;

    @Schema(description = "Inclusive end date (yyyy-MM-dd)", example = "2025-01-31")
    private String end;
}
