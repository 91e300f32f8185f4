package com.leadfunnel.backend.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Settings for the recurring ad scheduling pass.
 */
@Configuration
@ConfigurationProperties(prefix = "ad-scheduler")
@Data
public class AdSchedulerProperties {

    private boolean enabled = true;

    /**
     * Spring cron expression (second minute hour day month weekday).
     */
    private String cron = "0 0 9-18 * * MON-FRI";

    /**
     * Zone used both for cron evaluation and for the "local hour" of a post.
     */
    private String zone = "Asia/Kolkata";

    private int openingHour = 9;

    private int closingHour = 18;

    private int lookaheadHours = 24;

    private String location = "All India";
}
