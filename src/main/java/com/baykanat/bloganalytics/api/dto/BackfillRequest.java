package com.baykanat.bloganalytics.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** POST /aggregations/backfill gövdesi. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Rollup backfill request")
public class BackfillRequest {

    @Builder.Default
    @Schema(description = "hour, day, week, month, year or all", example = "all", defaultValue = "all")
    private String granularity = "all";

    @Schema(description = "Inclusive start date; earliest event when omitted", example = "2025-01-01")
    private String start;

    @Schema(description = "Inclusive end date; now when omitted", example = "2025-01-31")
    private String end;

    @Schema(description = "Delete existing rollups in the window first", example = "false")
    private boolean clear;
}
