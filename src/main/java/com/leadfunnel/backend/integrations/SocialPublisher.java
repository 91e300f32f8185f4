package com.leadfunnel.backend.integrations;

import com.leadfunnel.backend.models.campaign.AdPost;

/**
 * Delivers a post to its social platform and reports the engagement it drew.
 */
public interface SocialPublisher {

    /**
     * Publish the post's content on the post's platform.
     * @param post post carrying platform and generated content
     * @return engagement observed for the post
     */
    EngagementMetrics publish(AdPost post);
}
