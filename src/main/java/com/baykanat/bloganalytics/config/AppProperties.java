package com.baykanat.bloganalytics.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/** app.* için tip güvenli configuration (sorgu limitleri, rollup scheduler cron'ları). */
@Configuration
@ConfigurationProperties(prefix = "app")
@Getter
@Setter
public class AppProperties {

    private AnalyticsProperties analytics = new AnalyticsProperties();
    private SchedulerProperties scheduler = new SchedulerProperties();

    @Getter
    @Setter
    public static class AnalyticsProperties {
        /** Top isteğinde limit verilmezse. */
        private int defaultTopLimit = 10;
        /** Top limit üst sınırı; daha büyük istekler buna indirilir. */
        private int maxTopLimit = 100;
    }

    @Getter
    @Setter
    public static class SchedulerProperties {
        private boolean enabled = true;
        private String zone = "UTC";
        private String hourlyCron = "0 5 * * * *";
        private String dailyCron = "0 10 0 * * *";
        private String weeklyCron = "0 20 0 * * MON";
        private String monthlyCron = "0 30 0 1 * *";
        private String yearlyCron = "0 40 0 1 1 *";
    }
}
