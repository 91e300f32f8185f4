package com.leadfunnel.backend.controllers;

import com.leadfunnel.backend.dto.DashboardStatsDto;
import com.leadfunnel.backend.dto.LeadSourceStatDto;
import com.leadfunnel.backend.services.DashboardService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/admin/dashboard")
@RequiredArgsConstructor
public class DashboardController {

    private final DashboardService dashboardService;

    @GetMapping("/stats")
    public ResponseEntity<DashboardStatsDto> getStats() {
        return ResponseEntity.ok(dashboardService.getStats());
    }

    @GetMapping("/lead-sources")
    public ResponseEntity<List<LeadSourceStatDto>> getLeadSources() {
        return ResponseEntity.ok(dashboardService.getLeadSources());
    }
}
