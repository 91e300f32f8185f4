package com.leadfunnel.backend.controllers;

import com.leadfunnel.backend.dto.CreateLeadRequest;
import com.leadfunnel.backend.dto.LeadDto;
import com.leadfunnel.backend.dto.LeadFilter;
import com.leadfunnel.backend.dto.PagedResponse;
import com.leadfunnel.backend.dto.UpdateLeadRequest;
import com.leadfunnel.backend.enums.LeadSource;
import com.leadfunnel.backend.enums.LeadStatus;
import com.leadfunnel.backend.services.LeadExportService;
import com.leadfunnel.backend.services.LeadService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDate;
import java.util.List;
import java.util.Set;

@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class LeadController {

    private static final Set<String> SORTABLE_FIELDS =
            Set.of("createdAt", "name", "email", "source", "status", "state", "score");

    private final LeadService leadService;
    private final LeadExportService leadExportService;

    // Public form submission
    @PostMapping("/leads")
    public ResponseEntity<LeadDto> createLead(@Valid @RequestBody CreateLeadRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(leadService.createLead(request));
    }

    @GetMapping("/leads/{leadId}")
    public ResponseEntity<LeadDto> getLead(@PathVariable Long leadId) {
        return leadService.getLead(leadId)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @GetMapping("/admin/dashboard/recent-leads")
    public ResponseEntity<List<LeadDto>> getRecentLeads(@RequestParam(defaultValue = "5") int limit) {
        return ResponseEntity.ok(leadService.getRecentLeads(limit));
    }

    @GetMapping("/admin/leads")
    public ResponseEntity<PagedResponse<LeadDto>> getLeads(
            @RequestParam(required = false) String search,
            @RequestParam(required = false) String source,
            @RequestParam(required = false) String status,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate fromDate,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate toDate,
            @RequestParam(defaultValue = "1") int page,
            @RequestParam(defaultValue = "10") int perPage,
            @RequestParam(defaultValue = "createdAt") String sortBy,
            @RequestParam(defaultValue = "desc") String sortOrder) {

        if (!SORTABLE_FIELDS.contains(sortBy)) {
            throw new IllegalArgumentException("Cannot sort leads by " + sortBy);
        }
        Sort sort = "asc".equalsIgnoreCase(sortOrder) ? Sort.by(sortBy).ascending() : Sort.by(sortBy).descending();
        Pageable pageable = PageRequest.of(Math.max(page, 1) - 1, Math.max(perPage, 1), sort);

        return ResponseEntity.ok(PagedResponse.from(
                leadService.listLeads(toFilter(search, source, status, fromDate, toDate), pageable)));
    }

    @GetMapping("/admin/leads/export")
    public ResponseEntity<String> exportLeads(
            @RequestParam(required = false) String search,
            @RequestParam(required = false) String source,
            @RequestParam(required = false) String status,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate fromDate,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate toDate) {

        String csv = leadExportService.exportLeadsCsv(toFilter(search, source, status, fromDate, toDate));

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.parseMediaType("text/csv"));
        headers.setContentDispositionFormData("attachment", "leads.csv");
        return ResponseEntity.ok().headers(headers).body(csv);
    }

    @PatchMapping("/admin/leads/{leadId}")
    public ResponseEntity<LeadDto> updateLead(
            @PathVariable Long leadId,
            @Valid @RequestBody UpdateLeadRequest request) {
        return leadService.updateLead(leadId, request)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @DeleteMapping("/admin/leads/{leadId}")
    public ResponseEntity<Void> deleteLead(@PathVariable Long leadId) {
        if (!leadService.deleteLead(leadId)) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.noContent().build();
    }

    private LeadFilter toFilter(String search, String source, String status, LocalDate fromDate, LocalDate toDate) {
        return LeadFilter.builder()
                .search(search)
                .source(source != null && !source.isBlank() ? LeadSource.fromValue(source) : null)
                .status(status != null && !status.isBlank() ? LeadStatus.fromValue(status) : null)
                .fromDate(fromDate)
                .toDate(toDate)
                .build();
    }
}
