package com.baykanat.bloganalytics.api.controller;

import com.baykanat.bloganalytics.api.dto.AnalyticsPointResponse;
import com.baykanat.bloganalytics.api.dto.BreakdownRequest;
import com.baykanat.bloganalytics.api.dto.PerformancePointResponse;
import com.baykanat.bloganalytics.api.dto.PerformanceRequest;
import com.baykanat.bloganalytics.api.dto.TimeSeriesRequest;
import com.baykanat.bloganalytics.api.dto.TopRequest;
import com.baykanat.bloganalytics.domain.mapper.AnalyticsMapper;
import com.baykanat.bloganalytics.domain.service.BreakdownAnalyticsService;
import com.baykanat.bloganalytics.domain.service.PerformanceAnalyticsService;
import com.baykanat.bloganalytics.domain.service.TimeSeriesAnalyticsService;
import com.baykanat.bloganalytics.domain.service.TopAnalyticsService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/** POST /analytics/*: top, breakdown, performance ve time-series sorguları; {x, y, z} listesi döner. */
@Slf4j
@RestController
@RequestMapping("/analytics")
@RequiredArgsConstructor
@Tag(name = "Analytics", description = "Blog view and creation analytics")
public class AnalyticsController {

    private final TopAnalyticsService topAnalyticsService;
    private final BreakdownAnalyticsService breakdownAnalyticsService;
    private final PerformanceAnalyticsService performanceAnalyticsService;
    private final TimeSeriesAnalyticsService timeSeriesAnalyticsService;
    private final AnalyticsMapper analyticsMapper;

    @PostMapping("/top")
    @Operation(summary = "Top-N ranking", description = "Ranks blogs, countries or users by total views")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Ranking computed"),
            @ApiResponse(responseCode = "400", description = "Invalid dimension, filter or date")
    })
    public ResponseEntity<List<AnalyticsPointResponse>> top(@Valid @RequestBody TopRequest request) {
        return ResponseEntity.ok(analyticsMapper.toTopPoints(topAnalyticsService.top(
                request.getDimension(), request.getFilters(), request.getStart(), request.getEnd(),
                request.getLimit())));
    }

    @PostMapping("/breakdown")
    @Operation(summary = "Dimension × period breakdown",
            description = "Distinct blogs and total views per country or user and period")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Breakdown computed"),
            @ApiResponse(responseCode = "400", description = "Invalid dimension, granularity, filter or date")
    })
    public ResponseEntity<List<AnalyticsPointResponse>> breakdown(@Valid @RequestBody BreakdownRequest request) {
        return ResponseEntity.ok(analyticsMapper.toBreakdownPoints(breakdownAnalyticsService.breakdown(
                request.getDimension(), request.getFilters(), request.getStart(), request.getEnd(),
                request.getGranularity())));
    }

    @PostMapping("/performance")
    @Operation(summary = "Period-over-period performance",
            description = "Views per period from rollups, with blogs created and growth against the previous period")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Series computed"),
            @ApiResponse(responseCode = "400", description = "Invalid period size, filter or date")
    })
    public ResponseEntity<List<PerformancePointResponse>> performance(@Valid @RequestBody PerformanceRequest request) {
        return ResponseEntity.ok(analyticsMapper.toPerformancePoints(performanceAnalyticsService.performance(
                request.getPeriodSize(), request.getFilters(), request.getAuthorId(),
                request.getStart(), request.getEnd())));
    }

    @PostMapping("/time-series")
    @Operation(summary = "View time series", description = "Views and distinct blogs per period from raw views")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Series computed"),
            @ApiResponse(responseCode = "400", description = "Invalid granularity, filter or date")
    })
    public ResponseEntity<List<AnalyticsPointResponse>> timeSeries(@Valid @RequestBody TimeSeriesRequest request) {
        return ResponseEntity.ok(analyticsMapper.toTimeSeriesPoints(timeSeriesAnalyticsService.timeSeries(
                request.getGranularity(), request.getFilters(), request.getStart(), request.getEnd())));
    }
}
