package com.baykanat.bloganalytics.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/** Aggregation için okunan ham blogs satırı. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreationFact {

    private long blogId;
    private Long countryId;
    private long authorId;
    private Instant createdAt;
}
