package com.baykanat.bloganalytics.domain.filter;

import java.util.Arrays;
import java.util.Optional;

/** Leaf karşılaştırma operatörleri. */
public enum FilterOperator {

    EQ("eq"),
    LT("lt"),
    LTE("lte"),
    GT("gt"),
    GTE("gte"),
    /** Büyük/küçük harf duyarsız substring. */
    CONTAINS("contains"),
    /** Liste üyeliği. */
    IN("in");

    private final String key;

    FilterOperator(String key) {
        this.key = key;
    }

    public String getKey() {
        return key;
    }

    public static Optional<FilterOperator> fromKey(String key) {
        return Arrays.stream(values()).filter(op -> op.key.equals(key)).findFirst();
    }
}
