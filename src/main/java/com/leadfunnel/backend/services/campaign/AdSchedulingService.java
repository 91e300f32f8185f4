package com.leadfunnel.backend.services.campaign;

import com.leadfunnel.backend.config.AdSchedulerProperties;
import com.leadfunnel.backend.enums.AdPostStatus;
import com.leadfunnel.backend.enums.CampaignStatus;
import com.leadfunnel.backend.enums.SocialPlatform;
import com.leadfunnel.backend.models.campaign.AdPost;
import com.leadfunnel.backend.models.campaign.Campaign;
import com.leadfunnel.backend.repositories.campaign.AdPostRepository;
import com.leadfunnel.backend.repositories.campaign.CampaignRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Decides, for every active campaign and platform, whether a post has to be
 * scheduled for the coming lookahead window, and creates it.
 *
 * Passes (and manual post creation) are serialised inside this instance so the
 * "already scheduled?" check and the insert act as one step. Posts saved earlier
 * in a pass stay saved when a later campaign or platform fails.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AdSchedulingService {

    private final CampaignRepository campaignRepository;
    private final AdPostRepository adPostRepository;
    private final PostContentGenerator contentGenerator;
    private final AdSchedulerProperties properties;
    private final Clock clock;

    private final ReentrantLock schedulingLock = new ReentrantLock();

    /**
     * Schedule one post per active campaign and platform that has nothing
     * planned in the lookahead window.
     *
     * @return the posts created by this pass
     */
    public List<AdPost> checkAndSchedulePosts() {
        schedulingLock.lock();
        try {
            List<Campaign> activeCampaigns = campaignRepository.findByStatus(CampaignStatus.ACTIVE);
            log.info("Checking ad schedule for {} active campaigns", activeCampaigns.size());

            List<AdPost> created = new ArrayList<>();
            for (Campaign campaign : activeCampaigns) {
                created.addAll(scheduleCampaign(campaign));
            }

            log.info("Scheduling pass created {} posts", created.size());
            return created;
        } finally {
            schedulingLock.unlock();
        }
    }

    /**
     * Create posts stamped with the current time for the given platforms,
     * bypassing the lookahead check. Used by the manual "run now" operations.
     */
    public List<AdPost> createImmediatePosts(Campaign campaign, Collection<SocialPlatform> platforms) {
        schedulingLock.lock();
        try {
            OffsetDateTime now = OffsetDateTime.now(clock);
            List<AdPost> created = new ArrayList<>();
            for (SocialPlatform platform : platforms) {
                created.add(createPost(campaign, platform, now));
            }
            return created;
        } finally {
            schedulingLock.unlock();
        }
    }

    /**
     * Post time for a newly scheduled post: the opening hour today if we are
     * before it, the opening hour tomorrow if we are past closing, otherwise the
     * top of the next hour.
     */
    ZonedDateTime computePostTime(ZonedDateTime now) {
        LocalTime opening = LocalTime.of(properties.getOpeningHour(), 0);

        if (now.getHour() < properties.getOpeningHour()) {
            return now.with(opening);
        }
        if (now.getHour() >= properties.getClosingHour()) {
            return now.plusDays(1).with(opening);
        }
        return now.truncatedTo(ChronoUnit.HOURS).plusHours(1);
    }

    private List<AdPost> scheduleCampaign(Campaign campaign) {
        List<AdPost> existingPosts = adPostRepository.findByCampaignIdOrderByCreatedAtDesc(campaign.getId());
        List<AdPost> created = new ArrayList<>();

        for (SocialPlatform platform : SocialPlatform.values()) {
            ZonedDateTime now = ZonedDateTime.now(clock);
            OffsetDateTime windowStart = now.toOffsetDateTime();
            OffsetDateTime windowEnd = windowStart.plusHours(properties.getLookaheadHours());

            boolean covered = existingPosts.stream()
                    .anyMatch(post -> post.isScheduledBetween(platform, windowStart, windowEnd));

            if (covered) {
                log.debug("Campaign {} already has a {} post before {}", campaign.getId(), platform, windowEnd);
                continue;
            }

            AdPost post = createPost(campaign, platform, computePostTime(now).toOffsetDateTime());
            created.add(post);
        }

        return created;
    }

    private AdPost createPost(Campaign campaign, SocialPlatform platform, OffsetDateTime postTime) {
        AdPost post = AdPost.builder()
                .campaignId(campaign.getId())
                .platform(platform)
                .postContent(contentGenerator.generatePostContent(campaign, platform))
                .postTime(postTime)
                .status(AdPostStatus.SCHEDULED)
                .location(properties.getLocation())
                .impressions(0)
                .clicks(0)
                .leadsCaptured(0)
                .build();

        AdPost saved = adPostRepository.save(post);
        log.info("Scheduled {} post {} for campaign {} at {}",
                platform, saved.getId(), campaign.getId(), postTime);
        return saved;
    }
}
