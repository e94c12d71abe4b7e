package com.baykanat.bloganalytics.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/** blog_creation_rollups satırı; (granularity, timeBucket, countryId, authorId) benzersiz, ikisi de null ise toplam satırı. */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class CreationRollup {

    private Granularity granularity;
    private Instant timeBucket;
    private Long countryId;
    private Long authorId;
    private long blogCount;

    public boolean isTotal() {
        return countryId == null && authorId == null;
    }
}
