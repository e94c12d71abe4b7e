package com.baykanat.bloganalytics.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/** Dimension değeri × periyot satırı. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BreakdownEntry {

    private String label;
    private Instant periodStart;
    private String period;
    private long distinctBlogs;
    private long totalViews;
}
