package com.baykanat.bloganalytics.domain.exception;

/** Bilinmeyen ya da bu entry point için izin verilmeyen granularity token'ı; çağrı için fataldir. */
public class UnsupportedGranularityException extends AnalyticsRequestException {

    private final String granularity;

    public UnsupportedGranularityException(String granularity) {
        super("UNSUPPORTED_GRANULARITY", "Unsupported granularity: " + granularity);
        this.granularity = granularity;
    }

    public String getGranularity() {
        return granularity;
    }
}
