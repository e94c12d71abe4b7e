package com.baykanat.bloganalytics.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Top-N sırası: etiket, dimension'a bağlı ikincil metrik, toplam view. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TopEntry {

    private String label;
    private long secondaryMetric;
    private long totalViews;
}
