package com.leadfunnel.backend.services.campaign;

import com.leadfunnel.backend.models.campaign.AdPost;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Periodic trigger for the ad scheduling pass.
 *
 * Configuration:
 * - Enable/disable via: ad-scheduler.enabled=true
 * - Cadence via: ad-scheduler.cron (default hourly, 09:00-18:00, Monday to Friday)
 * - Zone via: ad-scheduler.zone
 */
@Service
@RequiredArgsConstructor
@Slf4j
@ConditionalOnProperty(
        name = "ad-scheduler.enabled",
        havingValue = "true",
        matchIfMissing = true
)
public class AdSchedulerJob {

    private final AdSchedulingService adSchedulingService;
    private final MeterRegistry meterRegistry;

    @Scheduled(cron = "${ad-scheduler.cron:0 0 9-18 * * MON-FRI}", zone = "${ad-scheduler.zone:Asia/Kolkata}")
    public void runSchedulingPass() {
        log.info("Running scheduled task: checking and scheduling posts");
        Timer.Sample sample = Timer.start(meterRegistry);

        try {
            List<AdPost> created = adSchedulingService.checkAndSchedulePosts();

            Counter.builder("ad.scheduler.posts.scheduled")
                    .description("Number of ad posts created by the periodic scheduling pass")
                    .register(meterRegistry)
                    .increment(created.size());
            recordRun("success");

            log.info("Scheduled task finished: {} posts scheduled", created.size());
        } catch (Exception e) {
            recordRun("failure");
            log.error("Error in ad scheduler: {}", e.getMessage(), e);
        } finally {
            sample.stop(Timer.builder("ad.scheduler.duration")
                    .description("Duration of a scheduling pass")
                    .register(meterRegistry));
        }
    }

    private void recordRun(String outcome) {
        Counter.builder("ad.scheduler.runs")
                .description("Scheduling passes by outcome")
                .tag("outcome", outcome)
                .register(meterRegistry)
                .increment();
    }
}
