package com.baykanat.bloganalytics.domain.exception;

/** İstemci kaynaklı analitik hatalarının ortak tabanı; GlobalExceptionHandler bunları 400'e, geri kalan her şeyi 500'e çevirir. */
public abstract class AnalyticsRequestException extends RuntimeException {

    private final String code;

    protected AnalyticsRequestException(String code, String message) {
        super(message);
        this.code = code;
    }

    protected AnalyticsRequestException(String code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    /** Hata türü kodu, ör. INVALID_FILTER. */
    public String getCode() {
        return code;
    }
}
