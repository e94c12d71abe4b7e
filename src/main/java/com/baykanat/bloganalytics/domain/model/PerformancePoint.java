package com.baykanat.bloganalytics.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/** Performance serisinin bir periyodu; growth ilk periyotta ve 0→0 durumunda null. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PerformancePoint {

    private Instant periodStart;
    private String period;
    private long blogsCreated;
    private long views;
    private Double growth;
}
