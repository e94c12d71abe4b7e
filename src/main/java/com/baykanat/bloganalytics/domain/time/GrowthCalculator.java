package com.baykanat.bloganalytics.domain.time;

import java.math.BigDecimal;
import java.math.RoundingMode;

/** Periyottan periyoda büyüme yüzdesi. */
public final class GrowthCalculator {

    private GrowthCalculator() {
    }

    /**
     * Sırasıyla: önceki periyot yok → null; önceki 0 ve şimdiki &gt; 0 → 100.0; ikisi de 0 → null;
     * aksi halde (current - previous) / previous * 100. İlk periyot asla 0'a çevrilmez.
     */
    public static Double growth(Long previous, long current) {
        if (previous == null) {
            return null;
        }
        if (previous == 0L) {
            return current > 0 ? 100.0 : null;
        }
        return (current - previous) / (double) previous * 100.0;
    }

    /** Yanıtlar için 2 ondalığa HALF_UP yuvarlar; null korunur. */
    public static Double round(Double growth) {
        if (growth == null) {
            return null;
        }
        return BigDecimal.valueOf(growth).setScale(2, RoundingMode.HALF_UP).doubleValue();
    }
}
