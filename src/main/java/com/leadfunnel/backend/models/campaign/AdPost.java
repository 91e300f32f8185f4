package com.leadfunnel.backend.models.campaign;

import com.leadfunnel.backend.converters.SocialPlatformConverter;
import com.leadfunnel.backend.enums.AdPostStatus;
import com.leadfunnel.backend.enums.SocialPlatform;
import jakarta.persistence.*;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.OffsetDateTime;

/**
 * A single social post for one campaign on one platform. Created as
 * {@link AdPostStatus#SCHEDULED} with zero metrics and moved exactly once to
 * {@link AdPostStatus#POSTED} or {@link AdPostStatus#FAILED}.
 */
@Entity
@Table(name = "ad_posts", indexes = {
        @Index(name = "idx_ad_posts_campaign_platform_time", columnList = "campaign_id, platform, post_time")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AdPost {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @NotNull
    @Column(name = "campaign_id", nullable = false)
    private Long campaignId;

    @NotNull
    @Convert(converter = SocialPlatformConverter.class)
    @Column(nullable = false, length = 20)
    private SocialPlatform platform;

    @Column(name = "post_content", nullable = false, columnDefinition = "TEXT")
    private String postContent;

    @NotNull
    @Column(name = "post_time", nullable = false)
    private OffsetDateTime postTime;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    @Builder.Default
    private AdPostStatus status = AdPostStatus.SCHEDULED;

    @Column(length = 100)
    private String location;

    @Min(0)
    @Column(nullable = false)
    @Builder.Default
    private Integer impressions = 0;

    @Min(0)
    @Column(nullable = false)
    @Builder.Default
    private Integer clicks = 0;

    @Min(0)
    @Column(name = "leads_captured", nullable = false)
    @Builder.Default
    private Integer leadsCaptured = 0;

    @CreationTimestamp
    @Column(name = "created_at", updatable = false)
    private OffsetDateTime createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at")
    private OffsetDateTime updatedAt;

    public boolean isScheduled() {
        return status != null && status.isScheduled();
    }

    /**
     * True when this post is for the given platform and its post time lies
     * strictly between {@code from} and {@code to}.
     */
    public boolean isScheduledBetween(SocialPlatform targetPlatform, OffsetDateTime from, OffsetDateTime to) {
        return platform == targetPlatform
                && postTime != null
                && postTime.isAfter(from)
                && postTime.isBefore(to);
    }
}
