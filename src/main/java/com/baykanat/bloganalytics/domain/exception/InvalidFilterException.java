package com.baykanat.bloganalytics.domain.exception;

/** Bozuk filter tree; her zaman çağırana yansıtılır, asla yutulmaz. */
public class InvalidFilterException extends AnalyticsRequestException {

    public InvalidFilterException(String message) {
        super("INVALID_FILTER", "Invalid filter: " + message);
    }

    public InvalidFilterException(String message, Throwable cause) {
        super("INVALID_FILTER", "Invalid filter: " + message, cause);
    }
}
