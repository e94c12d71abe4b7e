package com.baykanat.bloganalytics.domain.model;

import com.baykanat.bloganalytics.domain.exception.UnsupportedDimensionException;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/**
 * Top/Breakdown sorgularının gruplama ekseni; dimension'a özgü SQL ve etiket kuralları veri olarak burada tutulur.
 * Alias'lar: v=blog_views, b=blogs, a=authors, u=users, c=countries.
 */
public enum AnalyticsDimension {

    BLOG(List.of("blog", "item"), "b.id", "b.title", "b.title", "b.id", false),
    COUNTRY(List.of("country"), "c.id", "COALESCE(NULLIF(c.name, ''), c.code, 'Unknown')",
            "COALESCE(NULLIF(c.name, ''), c.code, 'Unknown')", "COUNT(DISTINCT v.blog_id)", true),
    USER(List.of("user", "author"), "a.id", "u.username", "u.username || ' (' || a.id || ')'",
            "COUNT(DISTINCT v.blog_id)", true);

    private final List<String> tokens;
    private final String keyExpression;
    private final String labelExpression;
    private final String qualifiedLabelExpression;
    private final String secondaryExpression;
    private final boolean secondaryAggregated;

    AnalyticsDimension(List<String> tokens, String keyExpression, String labelExpression,
                       String qualifiedLabelExpression, String secondaryExpression, boolean secondaryAggregated) {
        this.tokens = tokens;
        this.keyExpression = keyExpression;
        this.labelExpression = labelExpression;
        this.qualifiedLabelExpression = qualifiedLabelExpression;
        this.secondaryExpression = secondaryExpression;
        this.secondaryAggregated = secondaryAggregated;
    }

    /** Gruplama anahtarı kolonu; eşitlikte sıralama da buna göre (saklama sırası). */
    public String getKeyExpression() {
        return keyExpression;
    }

    /** Country'de isim yoksa kod kullanılır. */
    public String getLabelExpression() {
        return labelExpression;
    }

    /** Breakdown etiketi; user için "username (author id)". */
    public String getQualifiedLabelExpression() {
        return qualifiedLabelExpression;
    }

    /** BLOG için blog id'si, COUNTRY/USER için filtrelenmiş view kümesindeki farklı blog sayısı. */
    public String getSecondaryExpression() {
        return secondaryExpression;
    }

    /** Secondary ifade bir aggregate mi (GROUP BY'a eklenmez). */
    public boolean isSecondaryAggregated() {
        return secondaryAggregated;
    }

    public String getToken() {
        return tokens.get(0);
    }

    public static AnalyticsDimension fromToken(String token, List<AnalyticsDimension> allowed) {
        String normalized = token == null ? "" : token.trim().toLowerCase(Locale.ROOT);
        return allowed.stream()
                .filter(d -> d.tokens.contains(normalized))
                .findFirst()
                .orElseThrow(() -> new UnsupportedDimensionException(token,
                        allowed.stream().map(AnalyticsDimension::getToken).toList()));
    }

    public static AnalyticsDimension fromToken(String token) {
        return fromToken(token, Arrays.asList(values()));
    }
}
