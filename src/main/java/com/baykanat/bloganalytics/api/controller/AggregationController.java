package com.baykanat.bloganalytics.api.controller;

import com.baykanat.bloganalytics.api.dto.AggregationResponse;
import com.baykanat.bloganalytics.api.dto.BackfillRequest;
import com.baykanat.bloganalytics.domain.model.Granularity;
import com.baykanat.bloganalytics.domain.service.AggregationService;
import com.baykanat.bloganalytics.domain.time.RequestDates;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** POST /aggregations/*: scheduler'ın çağırdığı rollup giriş noktalarını elle tetikler. */
@Slf4j
@RestController
@RequestMapping("/aggregations")
@RequiredArgsConstructor
@Tag(name = "Aggregations", description = "Manual rollup aggregation and backfill")
public class AggregationController {

    private final AggregationService aggregationService;

    @PostMapping("/views/{granularity}")
    @Operation(summary = "Aggregate views", description = "Upserts view rollups for the previous complete period")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Rollups written"),
            @ApiResponse(responseCode = "400", description = "Unsupported granularity")
    })
    public ResponseEntity<AggregationResponse> aggregateViews(
            @Parameter(description = "hour, day, week, month or year", example = "day")
            @PathVariable("granularity") String granularity) {
        Granularity resolved = Granularity.aggregatable(granularity);
        return ResponseEntity.ok(AggregationResponse.builder()
                .granularity(resolved.getToken())
                .rowsWritten(aggregationService.aggregateViews(resolved))
                .build());
    }

    @PostMapping("/creations/{granularity}")
    @Operation(summary = "Aggregate creations", description = "Upserts creation rollups for the previous complete period")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Rollups written"),
            @ApiResponse(responseCode = "400", description = "Unsupported granularity")
    })
    public ResponseEntity<AggregationResponse> aggregateCreations(
            @Parameter(description = "hour, day, week, month or year", example = "day")
            @PathVariable("granularity") String granularity) {
        Granularity resolved = Granularity.aggregatable(granularity);
        return ResponseEntity.ok(AggregationResponse.builder()
                .granularity(resolved.getToken())
                .rowsWritten(aggregationService.aggregateCreations(resolved))
                .build());
    }

    @PostMapping("/backfill")
    @Operation(summary = "Backfill rollups", description = "Recomputes view and creation rollups from raw events over a date range")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Rollups written"),
            @ApiResponse(responseCode = "400", description = "Unsupported granularity or invalid date")
    })
    public ResponseEntity<AggregationResponse> backfill(@RequestBody BackfillRequest request) {
        int written = aggregationService.backfill(request.getGranularity(),
                RequestDates.parse("start", request.getStart()),
                RequestDates.parse("end", request.getEnd()),
                request.isClear());
        return ResponseEntity.ok(AggregationResponse.builder()
                .granularity(request.getGranularity())
                .rowsWritten(written)
                .build());
    }
}
