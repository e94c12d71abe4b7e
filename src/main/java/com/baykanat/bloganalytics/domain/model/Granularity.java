package com.baykanat.bloganalytics.domain.model;

import com.baykanat.bloganalytics.domain.exception.UnsupportedGranularityException;

import java.util.Arrays;
import java.util.Locale;

/** Zaman dilimi çözünürlüğü. Sıralama hour &lt; day &lt; week &lt; month &lt; year; RAW sadece pass-through etiketidir, aggregate edilmez. */
public enum Granularity {

    RAW("raw"),
    HOUR("hour"),
    DAY("day"),
    WEEK("week"),
    MONTH("month"),
    YEAR("year");

    private final String token;

    Granularity(String token) {
        this.token = token;
    }

    public String getToken() {
        return token;
    }

    /** Rollup tablolarına yazılabilen granularity mi (RAW hariç). */
    public boolean isAggregatable() {
        return this != RAW;
    }

    /**
     * Bu granularity'nin rollup'ı hangi daha ince rollup'tan türetilebilir; takvim olarak iç içe geçen en yakın seviye.
     * Haftalar aylara bölünmediği için MONTH, WEEK yerine DAY'den beslenir. HOUR için ham event okunur (RAW).
     */
    public Granularity finerSource() {
        return switch (this) {
            case HOUR -> RAW;
            case DAY -> HOUR;
            case WEEK, MONTH -> DAY;
            case YEAR -> MONTH;
            case RAW -> throw new UnsupportedGranularityException(token);
        };
    }

    /** PostgreSQL date_trunc birimi; sadece enum sabitlerinden üretilir, kullanıcı girdisi SQL'e gitmez. */
    public String sqlTruncUnit() {
        if (!isAggregatable()) {
            throw new UnsupportedGranularityException(token);
        }
        return token;
    }

    /** Token → Granularity (büyük/küçük harf duyarsız); bilinmeyen token UnsupportedGranularityException. */
    public static Granularity fromToken(String token) {
        if (token == null || token.isBlank()) {
            throw new UnsupportedGranularityException(String.valueOf(token));
        }
        String normalized = token.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(g -> g.token.equals(normalized))
                .findFirst()
                .orElseThrow(() -> new UnsupportedGranularityException(token));
    }

    /** Rollup entry point'leri için: token'ı çözer ve RAW'ı reddeder. */
    public static Granularity aggregatable(String token) {
        Granularity granularity = fromToken(token);
        if (!granularity.isAggregatable()) {
            throw new UnsupportedGranularityException(token);
        }
        return granularity;
    }

    /** Performance karşılaştırması için izin verilen periyotlar: day, week, month, year. */
    public static Granularity comparePeriod(String token) {
        Granularity granularity = fromToken(token);
        if (granularity == RAW || granularity == HOUR) {
            throw new UnsupportedGranularityException(token);
        }
        return granularity;
    }
}
