package com.baykanat.bloganalytics.infrastructure.persistence.filter;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/** Filtrelenebilir alanın SQL ifadesi ve değer dönüşümü için tipi. */
@Getter
@RequiredArgsConstructor
public class FilterColumn {

    public enum Type {
        TEXT,
        NUMBER,
        TIMESTAMP
    }

    private final String expression;
    private final Type type;
}
