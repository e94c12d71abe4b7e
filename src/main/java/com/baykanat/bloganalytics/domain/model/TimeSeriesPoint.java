package com.baykanat.bloganalytics.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/** Ham view'lardan periyot başına view ve farklı blog sayısı. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TimeSeriesPoint {

    private Instant periodStart;
    private String period;
    private long views;
    private long distinctBlogs;
}
