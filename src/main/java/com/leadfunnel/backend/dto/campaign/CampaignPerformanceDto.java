package com.leadfunnel.backend.dto.campaign;

import com.leadfunnel.backend.enums.SocialPlatform;
import com.leadfunnel.backend.models.campaign.Campaign;
import lombok.Builder;
import lombok.Data;

import java.util.Map;

@Data
@Builder
public class CampaignPerformanceDto {
    private Campaign campaign;
    private Long totalPosts;
    private Long totalImpressions;
    private Long totalClicks;
    private Long totalLeads;
    private Double ctr; // percent, unrounded
    private Double conversionRate; // percent, unrounded
    private Map<SocialPlatform, PlatformAnalyticsDto> platformBreakdown; // always holds every platform
}
