package com.leadfunnel.backend.services.campaign;

import com.leadfunnel.backend.dto.campaign.PreviewContentRequest;
import com.leadfunnel.backend.enums.SocialPlatform;
import com.leadfunnel.backend.exceptions.NoActiveCampaignException;
import com.leadfunnel.backend.models.campaign.AdPost;
import com.leadfunnel.backend.models.campaign.Campaign;
import com.leadfunnel.backend.repositories.campaign.AdPostRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * Ad post reads and the manual "post now" operations exposed to admins.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AdPostService {

    private final AdPostRepository adPostRepository;
    private final CampaignService campaignService;
    private final AdSchedulingService schedulingService;
    private final AdPostExecutionService executionService;
    private final PostContentGenerator contentGenerator;

    public List<AdPost> getAllPosts() {
        return adPostRepository.findAllByOrderByCreatedAtDesc();
    }

    public List<AdPost> getPostsForCampaign(Long campaignId) {
        return adPostRepository.findByCampaignIdOrderByCreatedAtDesc(campaignId);
    }

    public Optional<AdPost> getPost(Long postId) {
        return adPostRepository.findById(postId);
    }

    public Optional<AdPost> runPost(Long postId) {
        return adPostRepository.findById(postId).map(executionService::runSocialPost);
    }

    /**
     * Run every post of a campaign; posts that already ran come back unchanged.
     *
     * @return empty when the campaign does not exist
     */
    public Optional<List<AdPost>> runCampaignPosts(Long campaignId) {
        if (campaignService.getCampaign(campaignId).isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(executionService.runAllSocialPosts(getPostsForCampaign(campaignId)));
    }

    /**
     * Create a post for the active campaign on one platform and run it at once.
     *
     * @throws NoActiveCampaignException when no campaign is active
     */
    public AdPost simulatePost(SocialPlatform platform) {
        Campaign campaign = requireActiveCampaign();
        log.info("Simulating {} post for campaign {}", platform, campaign.getId());

        List<AdPost> created = schedulingService.createImmediatePosts(campaign, List.of(platform));
        return executionService.runSocialPost(created.get(0));
    }

    /**
     * Create and run one post per platform for the active campaign.
     *
     * @throws NoActiveCampaignException when no campaign is active
     */
    public List<AdPost> runAllAds() {
        Campaign campaign = requireActiveCampaign();
        log.info("Running ads on all platforms for campaign {}", campaign.getId());

        List<AdPost> created = schedulingService.createImmediatePosts(campaign, Arrays.asList(SocialPlatform.values()));
        return executionService.runAllSocialPosts(created);
    }

    public String previewContent(PreviewContentRequest request) {
        return contentGenerator.generatePostContent(
                request.getMessage(), request.getPlatform(), request.getCampaignName(), request.getFormUrl());
    }

    private Campaign requireActiveCampaign() {
        return campaignService.getActiveCampaign()
                .orElseThrow(NoActiveCampaignException::new);
    }
}
