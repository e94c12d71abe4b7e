package com.baykanat.bloganalytics.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Manuel aggregation / backfill sonucu. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Aggregation result")
public class AggregationResponse {

    @Schema(description = "Granularity that was aggregated", example = "day")
    private String granularity;

    @JsonProperty("rows_written")
    @Schema(description = "Rollup rows upserted", example = "57")
    private int rowsWritten;
}
