package com.baykanat.bloganalytics.domain.exception;

import java.util.Collection;

/** Top/Breakdown için desteklenmeyen dimension değeri. */
public class UnsupportedDimensionException extends AnalyticsRequestException {

    public UnsupportedDimensionException(String dimension, Collection<String> allowed) {
        super("UNSUPPORTED_DIMENSION", "Unsupported dimension: " + dimension + ". Must be one of " + allowed);
    }
}
