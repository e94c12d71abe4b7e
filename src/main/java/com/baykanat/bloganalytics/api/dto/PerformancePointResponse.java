package com.baykanat.bloganalytics.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Performance satırı; z (growth) null olabilir ve her zaman yazılır. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.ALWAYS)
@Schema(description = "Performance point")
public class PerformancePointResponse {

    @Schema(description = "Period with blogs created in it", example = "2025-01 (4 blogs)")
    private String x;

    @Schema(description = "Views in period", example = "120")
    private long y;

    @Schema(description = "Growth % against the previous period, null for the first period", example = "25.5", nullable = true)
    private Double z;
}
