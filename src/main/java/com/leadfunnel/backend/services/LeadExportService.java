package com.leadfunnel.backend.services;

import com.leadfunnel.backend.dto.LeadFilter;
import com.leadfunnel.backend.dto.LeadScoreDto;
import com.leadfunnel.backend.models.Lead;
import com.leadfunnel.backend.repositories.LeadRepository;
import com.leadfunnel.backend.repositories.LeadSpecifications;
import com.opencsv.CSVWriter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.time.Clock;
import java.util.List;

/**
 * CSV export of the admin lead list, newest first, capped at {@link #MAX_EXPORT_ROWS}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LeadExportService {

    static final int MAX_EXPORT_ROWS = 1000;

    static final String[] HEADER = {
            "ID", "Name", "Email", "Phone", "Age", "Education", "College", "State", "City",
            "Source", "Status", "Score", "Quality", "Created At"
    };

    private final LeadRepository leadRepository;
    private final LeadScoringService scoringService;
    private final Clock clock;

    @Transactional(readOnly = true)
    public String exportLeadsCsv(LeadFilter filter) {
        filter.validate();
        List<Lead> leads = leadRepository.findAll(
                LeadSpecifications.fromFilter(filter, clock.getZone()),
                PageRequest.of(0, MAX_EXPORT_ROWS, Sort.by("createdAt").descending())).getContent();

        StringWriter out = new StringWriter();
        try (CSVWriter writer = new CSVWriter(out)) {
            writer.writeNext(HEADER);
            for (Lead lead : leads) {
                writer.writeNext(toRow(lead, scoringService.scoreLead(lead)));
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write lead export", e);
        }

        log.info("Exported {} leads", leads.size());
        return out.toString();
    }

    private String[] toRow(Lead lead, LeadScoreDto score) {
        return new String[] {
                String.valueOf(lead.getId()),
                nullToEmpty(lead.getName()),
                nullToEmpty(lead.getEmail()),
                nullToEmpty(lead.getPhone()),
                nullToEmpty(lead.getAge()),
                nullToEmpty(lead.getEducation()),
                nullToEmpty(lead.getCollege()),
                nullToEmpty(lead.getState()),
                nullToEmpty(lead.getCity()),
                lead.getSource() != null ? lead.getSource().getValue() : "",
                lead.getStatus() != null ? lead.getStatus().getValue() : "",
                String.valueOf(score.getScore()),
                score.getLabel(),
                lead.getCreatedAt() != null ? lead.getCreatedAt().toString() : ""
        };
    }

    private static String nullToEmpty(String value) {
        return value != null ? value : "";
    }
}
