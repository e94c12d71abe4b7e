package com.baykanat.bloganalytics.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;

/** İstekteki dahil edici tarih sınırları; instant penceresi [start 00:00Z, end+1g 00:00Z). İki uç da opsiyonel. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TimeRange {

    private LocalDate start;
    private LocalDate end;

    /** Dahil edici alt sınır; yoksa null. */
    public Instant startInclusive() {
        return start == null ? null : start.atStartOfDay(ZoneOffset.UTC).toInstant();
    }

    /** Hariç tutulan üst sınır (end'in ertesi günü); yoksa null. */
    public Instant endExclusive() {
        return end == null ? null : end.plusDays(1).atStartOfDay(ZoneOffset.UTC).toInstant();
    }
}
