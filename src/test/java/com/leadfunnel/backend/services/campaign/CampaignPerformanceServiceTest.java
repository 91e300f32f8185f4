package com.leadfunnel.backend.services.campaign;

import com.leadfunnel.backend.dto.campaign.CampaignPerformanceDto;
import com.leadfunnel.backend.dto.campaign.PlatformAnalyticsDto;
import com.leadfunnel.backend.enums.AdPostStatus;
import com.leadfunnel.backend.enums.CampaignStatus;
import com.leadfunnel.backend.enums.SocialPlatform;
import com.leadfunnel.backend.models.campaign.AdPost;
import com.leadfunnel.backend.models.campaign.Campaign;
import com.leadfunnel.backend.repositories.campaign.AdPostRepository;
import com.leadfunnel.backend.repositories.campaign.CampaignRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class CampaignPerformanceServiceTest {

    @Mock
    private CampaignRepository campaignRepository;

    @Mock
    private AdPostRepository adPostRepository;

    @InjectMocks
    private CampaignPerformanceService performanceService;

    private Campaign testCampaign;

    @BeforeEach
    void setUp() {
        testCampaign = Campaign.builder()
                .id(1L)
                .name("Summer Internships")
                .messageTemplate("Join us")
                .status(CampaignStatus.ACTIVE)
                .build();
    }

    private AdPost post(SocialPlatform platform, AdPostStatus status, int impressions, int clicks, int leads) {
        return AdPost.builder()
                .campaignId(1L)
                .platform(platform)
                .status(status)
                .impressions(impressions)
                .clicks(clicks)
                .leadsCaptured(leads)
                .build();
    }

    @Test
    void getCampaignPerformance_WithNoPosts_ShouldReturnZeroesForEveryPlatform() {
        // Given
        when(campaignRepository.findById(1L)).thenReturn(Optional.of(testCampaign));
        when(adPostRepository.findByCampaignIdOrderByCreatedAtDesc(1L)).thenReturn(List.of());

        // When
        CampaignPerformanceDto performance = performanceService.getCampaignPerformance(1L).orElseThrow();

        // Then
        assertThat(performance.getCampaign()).isSameAs(testCampaign);
        assertThat(performance.getTotalPosts()).isZero();
        assertThat(performance.getTotalImpressions()).isZero();
        assertThat(performance.getTotalClicks()).isZero();
        assertThat(performance.getTotalLeads()).isZero();
        assertThat(performance.getCtr()).isZero();
        assertThat(performance.getConversionRate()).isZero();
        assertThat(performance.getPlatformBreakdown()).containsOnlyKeys(SocialPlatform.values());
        assertThat(performance.getPlatformBreakdown().values()).allSatisfy(platform -> {
            assertThat(platform.getImpressions()).isZero();
            assertThat(platform.getCtr()).isZero();
            assertThat(platform.getConversionRate()).isZero();
        });
    }

    @Test
    void getCampaignPerformance_WithTwoFacebookPosts_ShouldAggregateTotalsAndRates() {
        // Given
        when(campaignRepository.findById(1L)).thenReturn(Optional.of(testCampaign));
        when(adPostRepository.findByCampaignIdOrderByCreatedAtDesc(1L)).thenReturn(List.of(
                post(SocialPlatform.FACEBOOK, AdPostStatus.POSTED, 100, 10, 2),
                post(SocialPlatform.FACEBOOK, AdPostStatus.POSTED, 50, 5, 1)));

        // When
        CampaignPerformanceDto performance = performanceService.getCampaignPerformance(1L).orElseThrow();

        // Then
        assertThat(performance.getTotalPosts()).isEqualTo(2L);
        assertThat(performance.getTotalImpressions()).isEqualTo(150L);
        assertThat(performance.getTotalClicks()).isEqualTo(15L);
        assertThat(performance.getTotalLeads()).isEqualTo(3L);
        assertThat(performance.getCtr()).isEqualTo(10.0);
        assertThat(performance.getConversionRate()).isEqualTo(20.0);

        PlatformAnalyticsDto facebook = performance.getPlatformBreakdown().get(SocialPlatform.FACEBOOK);
        assertThat(facebook.getImpressions()).isEqualTo(150L);
        assertThat(facebook.getClicks()).isEqualTo(15L);
        assertThat(facebook.getLeadsCaptured()).isEqualTo(3L);
        assertThat(facebook.getCtr()).isEqualTo(10.0);
        assertThat(facebook.getConversionRate()).isEqualTo(20.0);

        assertThat(performance.getPlatformBreakdown().get(SocialPlatform.TWITTER).getImpressions()).isZero();
    }

    @Test
    void getCampaignPerformance_ShouldCountScheduledPostsWithZeroMetrics() {
        // Given
        when(campaignRepository.findById(1L)).thenReturn(Optional.of(testCampaign));
        when(adPostRepository.findByCampaignIdOrderByCreatedAtDesc(1L)).thenReturn(List.of(
                post(SocialPlatform.INSTAGRAM, AdPostStatus.POSTED, 400, 40, 4),
                post(SocialPlatform.INSTAGRAM, AdPostStatus.SCHEDULED, 0, 0, 0),
                post(SocialPlatform.TWITTER, AdPostStatus.FAILED, 0, 0, 0)));

        // When
        CampaignPerformanceDto performance = performanceService.getCampaignPerformance(1L).orElseThrow();

        // Then
        assertThat(performance.getTotalPosts()).isEqualTo(3L);
        assertThat(performance.getTotalImpressions()).isEqualTo(400L);
        assertThat(performance.getCtr()).isEqualTo(10.0);
        assertThat(performance.getConversionRate()).isEqualTo(10.0);
    }

    @Test
    void getCampaignPerformance_WithImpressionsButNoClicks_ShouldNotDivideByZero() {
        // Given
        when(campaignRepository.findById(1L)).thenReturn(Optional.of(testCampaign));
        when(adPostRepository.findByCampaignIdOrderByCreatedAtDesc(1L)).thenReturn(List.of(
                post(SocialPlatform.WHATSAPP, AdPostStatus.POSTED, 300, 0, 0)));

        // When
        CampaignPerformanceDto performance = performanceService.getCampaignPerformance(1L).orElseThrow();

        // Then
        assertThat(performance.getCtr()).isZero();
        assertThat(performance.getConversionRate()).isZero();
        assertThat(performance.getPlatformBreakdown().get(SocialPlatform.WHATSAPP).getConversionRate()).isZero();
    }

    @Test
    void getCampaignPerformance_WithUnrecognisedPlatform_ShouldCountInTotalsOnly() {
        // Given - stored platform values that match no platform load as null
        when(campaignRepository.findById(1L)).thenReturn(Optional.of(testCampaign));
        when(adPostRepository.findByCampaignIdOrderByCreatedAtDesc(1L)).thenReturn(List.of(
                post(null, AdPostStatus.POSTED, 100, 20, 5),
                post(SocialPlatform.TELEGRAM, AdPostStatus.POSTED, 100, 10, 1)));

        // When
        CampaignPerformanceDto performance = performanceService.getCampaignPerformance(1L).orElseThrow();

        // Then
        assertThat(performance.getTotalImpressions()).isEqualTo(200L);
        assertThat(performance.getPlatformBreakdown()).hasSize(5);
        long breakdownImpressions = performance.getPlatformBreakdown().values().stream()
                .mapToLong(PlatformAnalyticsDto::getImpressions)
                .sum();
        assertThat(breakdownImpressions).isEqualTo(100L);
    }

    @Test
    void getCampaignPerformance_WhenCampaignMissing_ShouldReturnEmpty() {
        // Given
        when(campaignRepository.findById(99L)).thenReturn(Optional.empty());

        // When
        Optional<CampaignPerformanceDto> performance = performanceService.getCampaignPerformance(99L);

        // Then
        assertThat(performance).isEmpty();
        verifyNoInteractions(adPostRepository);
    }

    @Test
    void percentage_ShouldReturnZeroForZeroDenominator() {
        assertThat(CampaignPerformanceService.percentage(5, 0)).isZero();
        assertThat(CampaignPerformanceService.percentage(1, 3)).isCloseTo(33.333, within(0.001));
    }
}
