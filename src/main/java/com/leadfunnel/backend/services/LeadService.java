package com.leadfunnel.backend.services;

import com.leadfunnel.backend.dto.CreateLeadRequest;
import com.leadfunnel.backend.dto.LeadDto;
import com.leadfunnel.backend.dto.LeadFilter;
import com.leadfunnel.backend.dto.LeadScoreDto;
import com.leadfunnel.backend.dto.UpdateLeadRequest;
import com.leadfunnel.backend.enums.LeadSource;
import com.leadfunnel.backend.enums.LeadStatus;
import com.leadfunnel.backend.models.Lead;
import com.leadfunnel.backend.repositories.LeadRepository;
import com.leadfunnel.backend.repositories.LeadSpecifications;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.List;
import java.util.Optional;

@Service
@Transactional
@RequiredArgsConstructor
@Slf4j
public class LeadService {

    private final LeadRepository leadRepository;
    private final LeadScoringService scoringService;
    private final Clock clock;

    public LeadDto createLead(CreateLeadRequest request) {
        Lead lead = Lead.builder()
                .name(request.getName())
                .email(request.getEmail())
                .phone(request.getPhone())
                .age(request.getAge())
                .education(request.getEducation())
                .college(request.getCollege())
                .state(request.getState())
                .city(request.getCity())
                .source(request.getSource() != null ? request.getSource() : LeadSource.OTHER)
                .status(LeadStatus.NEW)
                .build();

        Lead saved = leadRepository.save(lead);
        LeadScoreDto score = scoringService.scoreLead(saved);
        saved.setScore(score.getScore());
        saved = leadRepository.save(saved);

        log.info("Captured lead {} from {} scored {} ({})",
                saved.getId(), saved.getSource(), score.getScore(), score.getLabel());
        return LeadDto.from(saved, score, false);
    }

    @Transactional(readOnly = true)
    public Optional<LeadDto> getLead(Long leadId) {
        return leadRepository.findById(leadId)
                .map(lead -> LeadDto.from(lead, scoringService.scoreLead(lead), true));
    }

    /**
     * Admin lead list: filtered, paged and sorted, each lead scored.
     */
    @Transactional(readOnly = true)
    public Page<LeadDto> listLeads(LeadFilter filter, Pageable pageable) {
        filter.validate();
        return leadRepository.findAll(LeadSpecifications.fromFilter(filter, clock.getZone()), pageable)
                .map(lead -> LeadDto.from(lead, scoringService.scoreLead(lead), false));
    }

    @Transactional(readOnly = true)
    public List<LeadDto> getRecentLeads(int limit) {
        return leadRepository.findAllByOrderByCreatedAtDesc(PageRequest.of(0, Math.max(limit, 1))).stream()
                .map(lead -> LeadDto.from(lead, scoringService.scoreLead(lead), false))
                .toList();
    }

    public Optional<LeadDto> updateLead(Long leadId, UpdateLeadRequest request) {
        return leadRepository.findById(leadId).map(lead -> {
            if (request.getName() != null) lead.setName(request.getName());
            if (request.getEmail() != null) lead.setEmail(request.getEmail());
            if (request.getPhone() != null) lead.setPhone(request.getPhone());
            if (request.getAge() != null) lead.setAge(request.getAge());
            if (request.getEducation() != null) lead.setEducation(request.getEducation());
            if (request.getCollege() != null) lead.setCollege(request.getCollege());
            if (request.getState() != null) lead.setState(request.getState());
            if (request.getCity() != null) lead.setCity(request.getCity());
            if (request.getSource() != null) lead.setSource(request.getSource());
            if (request.getStatus() != null) lead.setStatus(request.getStatus());

            LeadScoreDto score = scoringService.scoreLead(lead);
            lead.setScore(score.getScore());
            Lead saved = leadRepository.save(lead);
            return LeadDto.from(saved, score, false);
        });
    }

    public boolean deleteLead(Long leadId) {
        if (!leadRepository.existsById(leadId)) {
            return false;
        }
        leadRepository.deleteById(leadId);
        log.info("Deleted lead {}", leadId);
        return true;
    }
}
