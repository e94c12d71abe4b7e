package com.baykanat.bloganalytics.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * blog_view_rollups satırı. (granularity, timeBucket, blogId, countryId, authorId) benzersizdir;
 * üç dimension da null ise satır o bucket'ın "tüm dimension'lar" toplamıdır.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class ViewRollup {

    private Granularity granularity;
    private Instant timeBucket;
    private Long blogId;
    private Long countryId;
    private Long authorId;
    private long viewCount;
    private long uniqueBlogsViewed;
    private long uniqueUsers;

    public boolean isTotal() {
        return blogId == null && countryId == null && authorId == null;
    }
}
