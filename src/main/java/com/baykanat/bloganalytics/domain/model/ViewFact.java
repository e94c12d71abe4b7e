package com.baykanat.bloganalytics.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/** Aggregation için okunan ham blog_views satırı; blog'un country/author referansları ile zenginleştirilmiş. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ViewFact {

    private long viewId;
    private long blogId;
    private Long countryId;
    private long authorId;
    private Long userId;    // anonim view'larda null
    private Instant viewedAt;
}
