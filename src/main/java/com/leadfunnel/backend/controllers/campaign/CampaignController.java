package com.leadfunnel.backend.controllers.campaign;

import com.leadfunnel.backend.dto.PagedResponse;
import com.leadfunnel.backend.dto.campaign.CampaignPerformanceDto;
import com.leadfunnel.backend.dto.campaign.CreateCampaignRequest;
import com.leadfunnel.backend.dto.campaign.UpdateCampaignRequest;
import com.leadfunnel.backend.enums.CampaignStatus;
import com.leadfunnel.backend.models.campaign.AdPost;
import com.leadfunnel.backend.models.campaign.Campaign;
import com.leadfunnel.backend.services.campaign.AdPostService;
import com.leadfunnel.backend.services.campaign.CampaignPerformanceService;
import com.leadfunnel.backend.services.campaign.CampaignService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Set;

@RestController
@RequestMapping("/api/admin/campaigns")
@RequiredArgsConstructor
public class CampaignController {

    private static final Set<String> SORTABLE_FIELDS = Set.of("createdAt", "name", "startDate", "endDate", "status");

    private final CampaignService campaignService;
    private final CampaignPerformanceService performanceService;
    private final AdPostService adPostService;

    @GetMapping
    public ResponseEntity<PagedResponse<Campaign>> getCampaigns(
            @RequestParam(required = false) String search,
            @RequestParam(required = false) String status,
            @RequestParam(defaultValue = "1") int page,
            @RequestParam(defaultValue = "10") int perPage,
            @RequestParam(defaultValue = "createdAt") String sortBy,
            @RequestParam(defaultValue = "desc") String sortOrder) {

        if (!SORTABLE_FIELDS.contains(sortBy)) {
            throw new IllegalArgumentException("Cannot sort campaigns by " + sortBy);
        }

        Sort sort = "asc".equalsIgnoreCase(sortOrder) ? Sort.by(sortBy).ascending() : Sort.by(sortBy).descending();
        Pageable pageable = PageRequest.of(Math.max(page, 1) - 1, Math.max(perPage, 1), sort);

        CampaignStatus statusFilter = status != null && !status.isBlank() ? CampaignStatus.fromValue(status) : null;

        return ResponseEntity.ok(PagedResponse.from(campaignService.listCampaigns(search, statusFilter, pageable)));
    }

    @GetMapping("/active")
    public ResponseEntity<Campaign> getActiveCampaign() {
        return campaignService.getActiveCampaign()
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @GetMapping("/{campaignId}")
    public ResponseEntity<Campaign> getCampaign(@PathVariable Long campaignId) {
        return campaignService.getCampaign(campaignId)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @PostMapping
    public ResponseEntity<Campaign> createCampaign(@Valid @RequestBody CreateCampaignRequest request) {
        Campaign campaign = campaignService.createCampaign(request);
        return ResponseEntity.status(HttpStatus.CREATED).body(campaign);
    }

    @PatchMapping("/{campaignId}")
    public ResponseEntity<Campaign> updateCampaign(
            @PathVariable Long campaignId,
            @Valid @RequestBody UpdateCampaignRequest request) {
        return campaignService.updateCampaign(campaignId, request)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @DeleteMapping("/{campaignId}")
    public ResponseEntity<Void> deleteCampaign(@PathVariable Long campaignId) {
        if (!campaignService.deleteCampaign(campaignId)) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/{campaignId}/performance")
    public ResponseEntity<CampaignPerformanceDto> getCampaignPerformance(@PathVariable Long campaignId) {
        return performanceService.getCampaignPerformance(campaignId)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @GetMapping("/{campaignId}/ad-posts")
    public ResponseEntity<List<AdPost>> getCampaignPosts(@PathVariable Long campaignId) {
        return ResponseEntity.ok(adPostService.getPostsForCampaign(campaignId));
    }

    @PostMapping("/{campaignId}/ad-posts/run")
    public ResponseEntity<List<AdPost>> runCampaignPosts(@PathVariable Long campaignId) {
        return adPostService.runCampaignPosts(campaignId)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }
}
