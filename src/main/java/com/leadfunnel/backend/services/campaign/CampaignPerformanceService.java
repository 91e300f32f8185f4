package com.leadfunnel.backend.services.campaign;

import com.leadfunnel.backend.dto.campaign.CampaignPerformanceDto;
import com.leadfunnel.backend.dto.campaign.PlatformAnalyticsDto;
import com.leadfunnel.backend.enums.SocialPlatform;
import com.leadfunnel.backend.models.campaign.AdPost;
import com.leadfunnel.backend.models.campaign.Campaign;
import com.leadfunnel.backend.repositories.campaign.AdPostRepository;
import com.leadfunnel.backend.repositories.campaign.CampaignRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Rolls a campaign's ad posts up into campaign-level and per-platform
 * performance. Nothing is cached; every call reads the posts again.
 */
@Service
@Transactional(readOnly = true)
@RequiredArgsConstructor
@Slf4j
public class CampaignPerformanceService {

    private final CampaignRepository campaignRepository;
    private final AdPostRepository adPostRepository;

    /**
     * @return performance summary, or empty when the campaign does not exist
     */
    public Optional<CampaignPerformanceDto> getCampaignPerformance(Long campaignId) {
        Optional<Campaign> campaign = campaignRepository.findById(campaignId);
        if (campaign.isEmpty()) {
            log.warn("Performance requested for unknown campaign {}", campaignId);
            return Optional.empty();
        }

        List<AdPost> posts = adPostRepository.findByCampaignIdOrderByCreatedAtDesc(campaignId);
        log.debug("Aggregating {} posts for campaign {}", posts.size(), campaignId);

        // posts still scheduled carry zero metrics and are summed like the rest
        MetricTotals overall = new MetricTotals();
        Map<SocialPlatform, MetricTotals> byPlatform = new EnumMap<>(SocialPlatform.class);
        for (SocialPlatform platform : SocialPlatform.values()) {
            byPlatform.put(platform, new MetricTotals());
        }

        for (AdPost post : posts) {
            overall.add(post);
            if (post.getPlatform() == null) {
                log.warn("Ad post {} has no recognised platform, left out of the breakdown", post.getId());
                continue;
            }
            byPlatform.get(post.getPlatform()).add(post);
        }

        Map<SocialPlatform, PlatformAnalyticsDto> breakdown = new EnumMap<>(SocialPlatform.class);
        byPlatform.forEach((platform, totals) -> breakdown.put(platform, totals.toPlatformAnalytics()));

        return Optional.of(CampaignPerformanceDto.builder()
                .campaign(campaign.get())
                .totalPosts((long) posts.size())
                .totalImpressions(overall.impressions)
                .totalClicks(overall.clicks)
                .totalLeads(overall.leads)
                .ctr(percentage(overall.clicks, overall.impressions))
                .conversionRate(percentage(overall.leads, overall.clicks))
                .platformBreakdown(breakdown)
                .build());
    }

    /**
     * numerator / denominator * 100, or 0 when the denominator is 0.
     */
    static double percentage(long numerator, long denominator) {
        return denominator > 0 ? (numerator * 100.0) / denominator : 0.0;
    }

    private static final class MetricTotals {
        private long impressions;
        private long clicks;
        private long leads;

        void add(AdPost post) {
            impressions += valueOf(post.getImpressions());
            clicks += valueOf(post.getClicks());
            leads += valueOf(post.getLeadsCaptured());
        }

        PlatformAnalyticsDto toPlatformAnalytics() {
            return PlatformAnalyticsDto.builder()
                    .impressions(impressions)
                    .clicks(clicks)
                    .leadsCaptured(leads)
                    .ctr(percentage(clicks, impressions))
                    .conversionRate(percentage(leads, clicks))
                    .build();
        }

        private static long valueOf(Integer metric) {
            return metric != null ? metric : 0L;
        }
    }
}
