package com.leadfunnel.backend.dto.campaign;

import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class PlatformAnalyticsDto {
    private Long impressions;
    private Long clicks;
    private Long leadsCaptured;
    private Double ctr; // percent
    private Double conversionRate; // percent
}
