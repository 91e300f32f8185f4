package com.leadfunnel.backend.repositories.campaign;

import com.leadfunnel.backend.enums.CampaignStatus;
import com.leadfunnel.backend.models.campaign.Campaign;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface CampaignRepository extends JpaRepository<Campaign, Long> {

    List<Campaign> findByStatus(CampaignStatus status);

    long countByStatus(CampaignStatus status);

    Optional<Campaign> findFirstByStatusOrderByIdAsc(CampaignStatus status);

    Page<Campaign> findByStatus(CampaignStatus status, Pageable pageable);

    Page<Campaign> findByNameContainingIgnoreCase(String name, Pageable pageable);

    Page<Campaign> findByNameContainingIgnoreCaseAndStatus(String name, CampaignStatus status, Pageable pageable);
}
