package com.leadfunnel.backend.controllers.campaign;

import com.leadfunnel.backend.dto.campaign.PreviewContentRequest;
import com.leadfunnel.backend.dto.campaign.SimulatePostRequest;
import com.leadfunnel.backend.models.campaign.AdPost;
import com.leadfunnel.backend.services.campaign.AdPostService;
import com.leadfunnel.backend.services.campaign.AdSchedulingService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/admin")
@RequiredArgsConstructor
@Slf4j
public class AdPostController {

    private final AdPostService adPostService;
    private final AdSchedulingService schedulingService;

    @GetMapping("/ad-posts")
    public ResponseEntity<List<AdPost>> getAllPosts() {
        return ResponseEntity.ok(adPostService.getAllPosts());
    }

    @GetMapping("/ad-posts/{postId}")
    public ResponseEntity<AdPost> getPost(@PathVariable Long postId) {
        return adPostService.getPost(postId)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @PostMapping("/ad-posts/{postId}/run")
    public ResponseEntity<AdPost> runPost(@PathVariable Long postId) {
        return adPostService.runPost(postId)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @PostMapping("/simulate-ad-post")
    public ResponseEntity<AdPost> simulatePost(@Valid @RequestBody SimulatePostRequest request) {
        AdPost post = adPostService.simulatePost(request.getPlatform());
        return ResponseEntity.status(HttpStatus.CREATED).body(post);
    }

    @PostMapping("/run-all-ads")
    public ResponseEntity<List<AdPost>> runAllAds() {
        List<AdPost> posts = adPostService.runAllAds();
        return ResponseEntity.status(HttpStatus.CREATED).body(posts);
    }

    @PostMapping("/schedule-posts")
    public ResponseEntity<List<AdPost>> schedulePosts() {
        log.info("Manual scheduling pass requested");
        return ResponseEntity.ok(schedulingService.checkAndSchedulePosts());
    }

    @PostMapping("/preview-ad-content")
    public ResponseEntity<Map<String, String>> previewContent(@Valid @RequestBody PreviewContentRequest request) {
        return ResponseEntity.ok(Map.of("content", adPostService.previewContent(request)));
    }
}
