package com.baykanat.bloganalytics.domain.mapper;

import com.baykanat.bloganalytics.api.dto.AnalyticsPointResponse;
import com.baykanat.bloganalytics.api.dto.PerformancePointResponse;
import com.baykanat.bloganalytics.domain.model.BreakdownEntry;
import com.baykanat.bloganalytics.domain.model.PerformancePoint;
import com.baykanat.bloganalytics.domain.model.TimeSeriesPoint;
import com.baykanat.bloganalytics.domain.model.TopEntry;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;

import java.util.List;

/** Sorgu sonuçları → {x, y, z} grafik noktaları. */
@Mapper(componentModel = "spring")
public interface AnalyticsMapper {

    /** Top: x etiket, y ikincil metrik (blog id / farklı blog), z toplam view. */
    @Mapping(target = "x", source = "label")
    @Mapping(target = "y", source = "secondaryMetric")
    @Mapping(target = "z", source = "totalViews")
    AnalyticsPointResponse toPoint(TopEntry entry);

    List<AnalyticsPointResponse> toTopPoints(List<TopEntry> entries);

    /** Breakdown: x "etiket - periyot". */
    @Mapping(target = "x", expression = "java(entry.getLabel() + \" - \" + entry.getPeriod())")
    @Mapping(target = "y", source = "distinctBlogs")
    @Mapping(target = "z", source = "totalViews")
    AnalyticsPointResponse toPoint(BreakdownEntry entry);

    List<AnalyticsPointResponse> toBreakdownPoints(List<BreakdownEntry> entries);

    @Mapping(target = "x", source = "period")
    @Mapping(target = "y", source = "views")
    @Mapping(target = "z", source = "distinctBlogs")
    AnalyticsPointResponse toPoint(TimeSeriesPoint point);

    List<AnalyticsPointResponse> toTimeSeriesPoints(List<TimeSeriesPoint> points);

    /** Performance: x "periyot (n blogs)", z büyüme yüzdesi. */
    @Mapping(target = "x", expression = "java(point.getPeriod() + \" (\" + point.getBlogsCreated() + \" blogs)\")")
    @Mapping(target = "y", source = "views")
    @Mapping(target = "z", source = "growth")
    PerformancePointResponse toPoint(PerformancePoint point);

    List<PerformancePointResponse> toPerformancePoints(List<PerformancePoint> points);
}
