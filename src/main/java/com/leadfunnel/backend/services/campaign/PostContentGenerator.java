package com.leadfunnel.backend.services.campaign;

import com.leadfunnel.backend.enums.SocialPlatform;
import com.leadfunnel.backend.models.campaign.Campaign;
import org.springframework.stereotype.Component;

/**
 * Turns a campaign message template into platform-specific post text.
 * Pure: same input, same output.
 */
@Component
public class PostContentGenerator {

    static final int TWITTER_LIMIT = 240;
    static final int TWITTER_TRUNCATED_LENGTH = 237;
    static final String ELLIPSIS = "...";

    static final String FACEBOOK_TAGS = "#StudentOpportunity #CareerGrowth";
    static final String INSTAGRAM_TAGS = "#StudentOpportunity #CareerGrowth #StudentJobs #InternshipOpportunity";
    static final String TWITTER_TAGS = "#StudentJobs";
    static final String CALL_TO_ACTION = "Apply now: ";

    public String generatePostContent(Campaign campaign, SocialPlatform platform) {
        String formUrl = campaign.hasFormUrl() ? campaign.getFormUrl() : null;
        return generatePostContent(campaign.getMessageTemplate(), platform, campaign.getName(), formUrl);
    }

    /**
     * @param template     base message
     * @param platform     target platform
     * @param campaignName used as heading on chat platforms, may be null
     * @param formUrl      lead form link appended as call to action, may be null
     */
    public String generatePostContent(String template, SocialPlatform platform, String campaignName, String formUrl) {
        String content = template != null ? template : "";

        switch (platform) {
            case FACEBOOK -> content = content + "\n\n" + FACEBOOK_TAGS;
            case INSTAGRAM -> content = content + "\n\n.\n.\n.\n" + INSTAGRAM_TAGS;
            case TWITTER -> content = truncateForTwitter(content) + "\n\n" + TWITTER_TAGS;
            case WHATSAPP -> content = "*" + nullToEmpty(campaignName) + "*\n\n" + content;
            case TELEGRAM -> content = "<b>" + nullToEmpty(campaignName) + "</b>\n\n" + content;
        }

        if (formUrl != null && !formUrl.isBlank()) {
            content = content + "\n\n" + CALL_TO_ACTION + formUrl;
        }

        return content;
    }

    // only the base template is cut, never the hashtag suffix
    private String truncateForTwitter(String content) {
        if (content.length() > TWITTER_LIMIT) {
            return content.substring(0, TWITTER_TRUNCATED_LENGTH) + ELLIPSIS;
        }
        return content;
    }

    private String nullToEmpty(String value) {
        return value != null ? value : "";
    }
}
