package com.leadfunnel.backend.services.campaign;

import com.leadfunnel.backend.enums.AdPostStatus;
import com.leadfunnel.backend.enums.CampaignStatus;
import com.leadfunnel.backend.enums.SocialPlatform;
import com.leadfunnel.backend.exceptions.NoActiveCampaignException;
import com.leadfunnel.backend.models.campaign.AdPost;
import com.leadfunnel.backend.models.campaign.Campaign;
import com.leadfunnel.backend.repositories.campaign.AdPostRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class AdPostServiceTest {

    @Mock
    private AdPostRepository adPostRepository;

    @Mock
    private CampaignService campaignService;

    @Mock
    private AdSchedulingService schedulingService;

    @Mock
    private AdPostExecutionService executionService;

    private AdPostService adPostService;
    private Campaign activeCampaign;

    @BeforeEach
    void setUp() {
        adPostService = new AdPostService(adPostRepository, campaignService, schedulingService,
                executionService, new PostContentGenerator());
        activeCampaign = Campaign.builder()
                .id(1L)
                .name("Summer Internships")
                .messageTemplate("Join us")
                .status(CampaignStatus.ACTIVE)
                .build();
    }

    @Test
    void simulatePost_WithoutActiveCampaign_ShouldThrow() {
        when(campaignService.getActiveCampaign()).thenReturn(Optional.empty());

        assertThatThrownBy(() -> adPostService.simulatePost(SocialPlatform.FACEBOOK))
                .isInstanceOf(NoActiveCampaignException.class)
                .hasMessage("No active campaign");
        verifyNoInteractions(schedulingService, executionService);
    }

    @Test
    void simulatePost_ShouldCreateAndRunPostForPlatform() {
        // Given
        AdPost created = AdPost.builder().id(5L).campaignId(1L).platform(SocialPlatform.TWITTER).build();
        AdPost posted = AdPost.builder().id(5L).campaignId(1L).platform(SocialPlatform.TWITTER)
                .status(AdPostStatus.POSTED).impressions(700).build();
        when(campaignService.getActiveCampaign()).thenReturn(Optional.of(activeCampaign));
        when(schedulingService.createImmediatePosts(activeCampaign, List.of(SocialPlatform.TWITTER)))
                .thenReturn(List.of(created));
        when(executionService.runSocialPost(created)).thenReturn(posted);

        // When
        AdPost result = adPostService.simulatePost(SocialPlatform.TWITTER);

        // Then
        assertThat(result.getStatus()).isEqualTo(AdPostStatus.POSTED);
        assertThat(result.getImpressions()).isEqualTo(700);
    }

    @Test
    void runAllAds_ShouldCoverEveryPlatform() {
        // Given
        List<AdPost> created = Arrays.stream(SocialPlatform.values())
                .map(platform -> AdPost.builder().campaignId(1L).platform(platform).build())
                .toList();
        when(campaignService.getActiveCampaign()).thenReturn(Optional.of(activeCampaign));
        when(schedulingService.createImmediatePosts(eq(activeCampaign), anyList())).thenReturn(created);
        when(executionService.runAllSocialPosts(created)).thenReturn(created);

        // When
        List<AdPost> result = adPostService.runAllAds();

        // Then
        assertThat(result).hasSize(5);
        verify(schedulingService).createImmediatePosts(eq(activeCampaign),
                argThat(platforms -> platforms.size() == 5 && platforms.containsAll(List.of(SocialPlatform.values()))));
    }

    @Test
    void runAllAds_WithoutActiveCampaign_ShouldThrow() {
        when(campaignService.getActiveCampaign()).thenReturn(Optional.empty());

        assertThatThrownBy(() -> adPostService.runAllAds())
                .isInstanceOf(NoActiveCampaignException.class);
        verifyNoInteractions(schedulingService, executionService);
    }

    @Test
    void runCampaignPosts_WhenCampaignMissing_ShouldReturnEmpty() {
        when(campaignService.getCampaign(9L)).thenReturn(Optional.empty());

        assertThat(adPostService.runCampaignPosts(9L)).isEmpty();
        verifyNoInteractions(executionService);
    }

    @Test
    void runPost_WhenPostMissing_ShouldReturnEmpty() {
        when(adPostRepository.findById(3L)).thenReturn(Optional.empty());

        assertThat(adPostService.runPost(3L)).isEmpty();
        verify(executionService, never()).runSocialPost(any());
    }
}
