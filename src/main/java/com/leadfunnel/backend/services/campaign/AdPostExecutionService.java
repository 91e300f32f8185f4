package com.leadfunnel.backend.services.campaign;

import com.leadfunnel.backend.enums.AdPostStatus;
import com.leadfunnel.backend.enums.SocialPlatform;
import com.leadfunnel.backend.integrations.EngagementMetrics;
import com.leadfunnel.backend.integrations.SocialPublisher;
import com.leadfunnel.backend.models.campaign.AdPost;
import com.leadfunnel.backend.repositories.campaign.AdPostRepository;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.persistence.EntityNotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.List;

/**
 * Moves scheduled posts to their terminal state. Delivery or persistence
 * errors on the way to "posted" are not propagated: the post is recorded as
 * failed and returned.
 *
 * Every write is guarded by the stored status, so a post that another run has
 * already moved out of "scheduled" keeps its outcome and is returned as stored.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AdPostExecutionService {

    private final AdPostRepository adPostRepository;
    private final SocialPublisher socialPublisher;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    /**
     * Publish a single post and record its engagement.
     *
     * @param post post fetched by the caller
     * @return the stored post after the transition
     * @throws EntityNotFoundException if the post no longer exists
     */
    public AdPost runSocialPost(AdPost post) {
        if (!post.isScheduled()) {
            log.warn("Ad post {} is already {}, leaving it unchanged", post.getId(), post.getStatus());
            return post;
        }

        int updated;
        try {
            EngagementMetrics metrics = socialPublisher.publish(post);
            updated = adPostRepository.updateOutcome(
                    post.getId(),
                    AdPostStatus.SCHEDULED,
                    AdPostStatus.POSTED,
                    metrics.getImpressions(),
                    metrics.getClicks(),
                    metrics.getLeadsCaptured(),
                    OffsetDateTime.now(clock));
        } catch (RuntimeException e) {
            log.error("Error posting to {} for ad post {}: {}", post.getPlatform(), post.getId(), e.getMessage(), e);
            return markFailed(post);
        }

        if (updated == 0) {
            return alreadyTransitioned(post.getId());
        }

        recordExecution(post.getPlatform(), AdPostStatus.POSTED);
        return reload(post.getId());
    }

    /**
     * Run every scheduled post in order. Posts in any other state are returned
     * as they are, so the result has the same length and order as the input.
     */
    public List<AdPost> runAllSocialPosts(List<AdPost> posts) {
        return posts.stream()
                .map(post -> post.isScheduled() ? runSocialPost(post) : post)
                .toList();
    }

    private AdPost markFailed(AdPost post) {
        int updated = adPostRepository.updateStatus(
                post.getId(), AdPostStatus.SCHEDULED, AdPostStatus.FAILED, OffsetDateTime.now(clock));
        if (updated == 0) {
            return alreadyTransitioned(post.getId());
        }

        recordExecution(post.getPlatform(), AdPostStatus.FAILED);
        return reload(post.getId());
    }

    /**
     * The guarded update touched nothing: either the post is gone or a
     * concurrent run already finished it.
     */
    private AdPost alreadyTransitioned(Long postId) {
        AdPost stored = reload(postId);
        if (!stored.getStatus().isTerminal()) {
            throw new IllegalStateException("Ad post " + postId + " could not be updated from status " + stored.getStatus());
        }
        log.warn("Ad post {} was already {} by another run, keeping that outcome", postId, stored.getStatus());
        return stored;
    }

    private AdPost reload(Long postId) {
        return adPostRepository.findById(postId)
                .orElseThrow(() -> new EntityNotFoundException("Ad post not found: " + postId));
    }

    private void recordExecution(SocialPlatform platform, AdPostStatus status) {
        Counter.builder("ad.posts.executed")
                .description("Number of ad posts run through the publisher")
                .tag("platform", platform != null ? platform.getValue() : "unknown")
                .tag("status", status.getValue())
                .register(meterRegistry)
                .increment();
    }
}
