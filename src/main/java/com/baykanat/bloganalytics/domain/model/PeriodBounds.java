package com.baykanat.bloganalytics.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/** Yarı açık zaman penceresi [start, end). */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PeriodBounds {

    private Instant start;
    private Instant end;

    public boolean contains(Instant instant) {
        return !instant.isBefore(start) && instant.isBefore(end);
    }
}
