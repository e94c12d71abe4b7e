package com.baykanat.bloganalytics.domain.filter;

import com.baykanat.bloganalytics.domain.exception.InvalidFilterException;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Noktalı alan yolu ("author.country.code"). Sadece identifier segmentleri kabul edilir; ham ifade asla.
 * İlişki geçişi için lookupPath() "author__country__code" biçimini verir; bu çeviri tek yerde yapılır.
 */
public final class FieldPath {

    public static final String LOOKUP_SEPARATOR = "__";

    private static final Pattern SEGMENT = Pattern.compile("[A-Za-z][A-Za-z0-9]*(_[A-Za-z0-9]+)*");
    private static final int MAX_SEGMENTS = 6;

    private final List<String> segments;

    private FieldPath(List<String> segments) {
        this.segments = segments;
    }

    /** Noktalı yolu doğrular; geçersiz segment, boş yol veya fazla derinlik InvalidFilterException. */
    public static FieldPath parse(String dotted) {
        if (dotted == null || dotted.isBlank()) {
            throw new InvalidFilterException("field must be a non-empty dotted path");
        }
        List<String> parts = Arrays.asList(dotted.split("\\.", -1));
        if (parts.size() > MAX_SEGMENTS) {
            throw new InvalidFilterException("field path too deep: " + dotted);
        }
        for (String part : parts) {
            if (!SEGMENT.matcher(part).matches()) {
                throw new InvalidFilterException("field must be a dotted identifier path: " + dotted);
            }
        }
        return new FieldPath(List.copyOf(parts));
    }

    public String dotted() {
        return String.join(".", segments);
    }

    /** İlişki geçiş yolu, ör. blog__country__code. */
    public String lookupPath() {
        return String.join(LOOKUP_SEPARATOR, segments);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FieldPath other)) return false;
        return segments.equals(other.segments);
    }

    @Override
    public int hashCode() {
        return Objects.hash(segments);
    }

    @Override
    public String toString() {
        return dotted();
    }
}
