package com.leadfunnel.backend.services.campaign;

import com.leadfunnel.backend.dto.campaign.CreateCampaignRequest;
import com.leadfunnel.backend.dto.campaign.UpdateCampaignRequest;
import com.leadfunnel.backend.enums.CampaignStatus;
import com.leadfunnel.backend.models.campaign.Campaign;
import com.leadfunnel.backend.repositories.campaign.AdPostRepository;
import com.leadfunnel.backend.repositories.campaign.CampaignRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;

@Service
@Transactional
@RequiredArgsConstructor
@Slf4j
public class CampaignService {

    private final CampaignRepository campaignRepository;
    private final AdPostRepository adPostRepository;

    public Campaign createCampaign(CreateCampaignRequest request) {
        Campaign campaign = Campaign.builder()
                .name(request.getName())
                .description(request.getDescription())
                .messageTemplate(request.getMessageTemplate())
                .formUrl(request.getFormUrl())
                .status(request.getStatus() != null ? request.getStatus() : CampaignStatus.DRAFT)
                .startDate(request.getStartDate())
                .endDate(request.getEndDate())
                .build();

        validateDates(campaign);
        Campaign saved = campaignRepository.save(campaign);
        log.info("Created campaign {} '{}' with status {}", saved.getId(), saved.getName(), saved.getStatus());
        return saved;
    }

    @Transactional(readOnly = true)
    public Optional<Campaign> getCampaign(Long campaignId) {
        return campaignRepository.findById(campaignId);
    }

    @Transactional(readOnly = true)
    public Page<Campaign> listCampaigns(String search, CampaignStatus status, Pageable pageable) {
        boolean hasSearch = search != null && !search.isBlank();

        if (hasSearch && status != null) {
            return campaignRepository.findByNameContainingIgnoreCaseAndStatus(search.trim(), status, pageable);
        }
        if (hasSearch) {
            return campaignRepository.findByNameContainingIgnoreCase(search.trim(), pageable);
        }
        if (status != null) {
            return campaignRepository.findByStatus(status, pageable);
        }
        return campaignRepository.findAll(pageable);
    }

    /**
     * Convenience view for screens that show a single campaign: the oldest
     * active one. Several campaigns may be active at once; the scheduler
     * covers all of them.
     */
    @Transactional(readOnly = true)
    public Optional<Campaign> getActiveCampaign() {
        return campaignRepository.findFirstByStatusOrderByIdAsc(CampaignStatus.ACTIVE);
    }

    public Optional<Campaign> updateCampaign(Long campaignId, UpdateCampaignRequest request) {
        return campaignRepository.findById(campaignId).map(campaign -> {
            if (request.getName() != null) {
                campaign.setName(request.getName());
            }
            if (request.getDescription() != null) {
                campaign.setDescription(request.getDescription());
            }
            if (request.getMessageTemplate() != null) {
                campaign.setMessageTemplate(request.getMessageTemplate());
            }
            if (request.getFormUrl() != null) {
                campaign.setFormUrl(request.getFormUrl());
            }
            if (request.getStatus() != null) {
                log.info("Campaign {} status {} -> {}", campaignId, campaign.getStatus(), request.getStatus());
                campaign.setStatus(request.getStatus());
            }
            if (request.getStartDate() != null) {
                campaign.setStartDate(request.getStartDate());
            }
            if (request.getEndDate() != null) {
                campaign.setEndDate(request.getEndDate());
            }

            validateDates(campaign);
            return campaignRepository.save(campaign);
        });
    }

    /**
     * Delete a campaign together with its ad posts.
     *
     * @return false when the campaign does not exist
     */
    public boolean deleteCampaign(Long campaignId) {
        if (!campaignRepository.existsById(campaignId)) {
            return false;
        }

        adPostRepository.deleteAllByCampaignId(campaignId);
        campaignRepository.deleteById(campaignId);
        log.info("Deleted campaign {} and its ad posts", campaignId);
        return true;
    }

    private void validateDates(Campaign campaign) {
        if (campaign.getStartDate() != null && campaign.getEndDate() != null
                && campaign.getEndDate().isBefore(campaign.getStartDate())) {
            throw new IllegalArgumentException("Campaign end date must not be before its start date");
        }
    }
}
