package com.baykanat.bloganalytics.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/** Rollup okumasında bucket başına toplanmış metrik. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BucketTotal {

    private Instant timeBucket;
    private long total;
}
