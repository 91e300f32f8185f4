package com.leadfunnel.backend.services;

import com.leadfunnel.backend.dto.DashboardStatsDto;
import com.leadfunnel.backend.dto.LeadSourceStatDto;
import com.leadfunnel.backend.enums.CampaignStatus;
import com.leadfunnel.backend.enums.LeadSource;
import com.leadfunnel.backend.enums.LeadStatus;
import com.leadfunnel.backend.repositories.FormRepository;
import com.leadfunnel.backend.repositories.LeadRepository;
import com.leadfunnel.backend.repositories.campaign.CampaignRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.util.Comparator;
import java.util.List;

/**
 * Admin dashboard figures. "Today" and "yesterday" are calendar days in the clock's zone.
 */
@Service
@Transactional(readOnly = true)
@RequiredArgsConstructor
@Slf4j
public class DashboardService {

    private final LeadRepository leadRepository;
    private final FormRepository formRepository;
    private final CampaignRepository campaignRepository;
    private final Clock clock;

    public DashboardStatsDto getStats() {
        LocalDate today = LocalDate.now(clock);
        OffsetDateTime startOfToday = today.atStartOfDay(clock.getZone()).toOffsetDateTime();
        OffsetDateTime startOfYesterday = today.minusDays(1).atStartOfDay(clock.getZone()).toOffsetDateTime();

        long totalLeads = leadRepository.count();
        long qualifiedLeads = leadRepository.countByStatus(LeadStatus.QUALIFIED);

        return DashboardStatsDto.builder()
                .totalLeads(totalLeads)
                .newLeadsToday(leadRepository.countByCreatedAtGreaterThanEqual(startOfToday))
                .newLeadsYesterday(leadRepository.countByCreatedAtGreaterThanEqualAndCreatedAtLessThan(
                        startOfYesterday, startOfToday))
                .qualifiedLeads(qualifiedLeads)
                .conversionRate(totalLeads > 0 ? round2(qualifiedLeads * 100.0 / totalLeads) : 0.0)
                .activeForms(formRepository.countByActiveTrue())
                .activeCampaigns(campaignRepository.countByStatus(CampaignStatus.ACTIVE))
                .build();
    }

    /**
     * Lead counts per source, largest first. Sources without leads are omitted.
     */
    public List<LeadSourceStatDto> getLeadSources() {
        List<Object[]> rows = leadRepository.countGroupedBySource();
        long total = rows.stream().mapToLong(row -> ((Number) row[1]).longValue()).sum();

        return rows.stream()
                .filter(row -> row[0] != null)
                .map(row -> {
                    long count = ((Number) row[1]).longValue();
                    return LeadSourceStatDto.builder()
                            .source((LeadSource) row[0])
                            .count(count)
                            .percentage(total > 0 ? (int) Math.round(count * 100.0 / total) : 0)
                            .build();
                })
                .sorted(Comparator.comparingLong(LeadSourceStatDto::getCount).reversed())
                .toList();
    }

    private static double round2(double value) {
        return Math.round(value * 100.0) / 100.0;
    }
}
