package com.baykanat.bloganalytics.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Top, breakdown ve time-series satırı: x etiket, y ve z endpoint'e göre metrik. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Chart point")
public class AnalyticsPointResponse {

    @Schema(description = "Label", example = "United States - 2025-01")
    private String x;

    @Schema(description = "Secondary metric (blog id or distinct blogs), or views for time-series", example = "12")
    private long y;

    @Schema(description = "Total views, or distinct blogs for time-series", example = "340")
    private long z;
}
