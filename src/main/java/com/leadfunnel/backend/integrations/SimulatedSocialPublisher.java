package com.leadfunnel.backend.integrations;

import com.leadfunnel.backend.models.campaign.AdPost;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Random;

/**
 * Stand-in for real platform APIs: nothing leaves the process, engagement is
 * drawn from the injected random source.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SimulatedSocialPublisher implements SocialPublisher {

    static final int MIN_IMPRESSIONS = 200;
    static final int IMPRESSION_SPREAD = 1000;
    static final int MIN_CLICKS = 50;
    static final int CLICK_SPREAD = 200;
    static final int MIN_LEADS = 5;
    static final int LEAD_SPREAD = 50;

    private final Random engagementRandom;

    @Override
    public EngagementMetrics publish(AdPost post) {
        if (post.getPlatform() == null) {
            throw new IllegalArgumentException("Ad post " + post.getId() + " has no recognised platform");
        }
        log.info("Posting to {}: {}", post.getPlatform().getDisplayName(), post.getPostContent());

        return EngagementMetrics.builder()
                .impressions(MIN_IMPRESSIONS + engagementRandom.nextInt(IMPRESSION_SPREAD))
                .clicks(MIN_CLICKS + engagementRandom.nextInt(CLICK_SPREAD))
                .leadsCaptured(MIN_LEADS + engagementRandom.nextInt(LEAD_SPREAD))
                .build();
    }
}
