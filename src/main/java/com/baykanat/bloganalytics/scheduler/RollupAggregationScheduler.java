package com.baykanat.bloganalytics.scheduler;

import com.baykanat.bloganalytics.domain.model.Granularity;
import com.baykanat.bloganalytics.domain.service.AggregationService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * View ve creation rollup'larını her granularity için bir önceki tam periyot üzerinden yazar.
 * Cron'lar application.yaml'dan (app.scheduler.*-cron); hata olursa sadece log, bir sonraki tetikleme yeniden dener.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "app.scheduler", name = "enabled", havingValue = "true", matchIfMissing = true)
public class RollupAggregationScheduler {

    private final AggregationService aggregationService;

    @Scheduled(cron = "${app.scheduler.hourly-cron:0 5 * * * *}", zone = "${app.scheduler.zone:UTC}")
    public void aggregateHourly() {
        aggregate(Granularity.HOUR);
    }

    @Scheduled(cron = "${app.scheduler.daily-cron:0 10 0 * * *}", zone = "${app.scheduler.zone:UTC}")
    public void aggregateDaily() {
        aggregate(Granularity.DAY);
    }

    @Scheduled(cron = "${app.scheduler.weekly-cron:0 20 0 * * MON}", zone = "${app.scheduler.zone:UTC}")
    public void aggregateWeekly() {
        aggregate(Granularity.WEEK);
    }

    @Scheduled(cron = "${app.scheduler.monthly-cron:0 30 0 1 * *}", zone = "${app.scheduler.zone:UTC}")
    public void aggregateMonthly() {
        aggregate(Granularity.MONTH);
    }

    @Scheduled(cron = "${app.scheduler.yearly-cron:0 40 0 1 1 *}", zone = "${app.scheduler.zone:UTC}")
    public void aggregateYearly() {
        aggregate(Granularity.YEAR);
    }

    /** View ve creation ayrı denenir; biri düşerse diğeri yine çalışır. */
    void aggregate(Granularity granularity) {
        try {
            aggregationService.aggregateViews(granularity);
        } catch (Exception e) {
            log.error("Failed to aggregate {} views: {}", granularity.getToken(), e.getMessage(), e);
        }
        try {
            aggregationService.aggregateCreations(granularity);
        } catch (Exception e) {
            log.error("Failed to aggregate {} creations: {}", granularity.getToken(), e.getMessage(), e);
        }
    }
}
