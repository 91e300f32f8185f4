package com.leadfunnel.backend.repositories.campaign;

import com.leadfunnel.backend.enums.AdPostStatus;
import com.leadfunnel.backend.models.campaign.AdPost;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.OffsetDateTime;
import java.util.List;

@Repository
public interface AdPostRepository extends JpaRepository<AdPost, Long> {

    List<AdPost> findByCampaignIdOrderByCreatedAtDesc(Long campaignId);

    List<AdPost> findAllByOrderByCreatedAtDesc();

    /**
     * Record the outcome of an execution, only while the post is still in the
     * expected status. Returns the number of rows touched: 0 when the post no
     * longer exists or has already left the expected status.
     */
    @Transactional
    @Modifying(clearAutomatically = true)
    @Query("UPDATE AdPost p SET p.status = :status, p.impressions = :impressions, p.clicks = :clicks, " +
            "p.leadsCaptured = :leadsCaptured, p.updatedAt = :updatedAt " +
            "WHERE p.id = :id AND p.status = :expected")
    int updateOutcome(@Param("id") Long id,
                      @Param("expected") AdPostStatus expected,
                      @Param("status") AdPostStatus status,
                      @Param("impressions") int impressions,
                      @Param("clicks") int clicks,
                      @Param("leadsCaptured") int leadsCaptured,
                      @Param("updatedAt") OffsetDateTime updatedAt);

    /**
     * Change only the status, leaving metrics as they are. Same guard as
     * {@link #updateOutcome}.
     */
    @Transactional
    @Modifying(clearAutomatically = true)
    @Query("UPDATE AdPost p SET p.status = :status, p.updatedAt = :updatedAt " +
            "WHERE p.id = :id AND p.status = :expected")
    int updateStatus(@Param("id") Long id,
                     @Param("expected") AdPostStatus expected,
                     @Param("status") AdPostStatus status,
                     @Param("updatedAt") OffsetDateTime updatedAt);

    @Transactional
    @Modifying
    @Query("DELETE FROM AdPost p WHERE p.campaignId = :campaignId")
    void deleteAllByCampaignId(@Param("campaignId") Long campaignId);
}
