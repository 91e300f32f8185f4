package com.leadfunnel.backend.controllers.campaign;

import com.leadfunnel.backend.config.JacksonConfig;
import com.leadfunnel.backend.dto.campaign.PreviewContentRequest;
import com.leadfunnel.backend.enums.AdPostStatus;
import com.leadfunnel.backend.enums.SocialPlatform;
import com.leadfunnel.backend.exceptions.GlobalExceptionHandler;
import com.leadfunnel.backend.exceptions.NoActiveCampaignException;
import com.leadfunnel.backend.models.campaign.AdPost;
import com.leadfunnel.backend.services.campaign.AdPostService;
import com.leadfunnel.backend.services.campaign.AdSchedulingService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.http.converter.json.MappingJackson2HttpMessageConverter;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.util.List;
import java.util.Optional;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@ExtendWith(MockitoExtension.class)
class AdPostControllerTest {

    @Mock
    private AdPostService adPostService;

    @Mock
    private AdSchedulingService schedulingService;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.standaloneSetup(new AdPostController(adPostService, schedulingService))
                .setControllerAdvice(new GlobalExceptionHandler())
                .setMessageConverters(new MappingJackson2HttpMessageConverter(new JacksonConfig().objectMapper()))
                .build();
    }

    @Test
    void simulatePost_ShouldReturnCreatedPostWithLowercaseValues() throws Exception {
        // Given
        AdPost posted = AdPost.builder()
                .id(11L)
                .campaignId(1L)
                .platform(SocialPlatform.INSTAGRAM)
                .status(AdPostStatus.POSTED)
                .impressions(640)
                .clicks(75)
                .leadsCaptured(9)
                .build();
        when(adPostService.simulatePost(SocialPlatform.INSTAGRAM)).thenReturn(posted);

        // When & Then
        mockMvc.perform(post("/api/admin/simulate-ad-post")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"platform\":\"instagram\"}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.platform").value("instagram"))
                .andExpect(jsonPath("$.status").value("posted"))
                .andExpect(jsonPath("$.impressions").value(640));
    }

    @Test
    void simulatePost_WithoutActiveCampaign_ShouldReturnBadRequest() throws Exception {
        when(adPostService.simulatePost(SocialPlatform.TWITTER))
                .thenThrow(new NoActiveCampaignException());

        mockMvc.perform(post("/api/admin/simulate-ad-post")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"platform\":\"twitter\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("NO_ACTIVE_CAMPAIGN"))
                .andExpect(jsonPath("$.message").value("No active campaign"));
    }

    @Test
    void runAllAds_WhenInternalStateErrorOccurs_ShouldReturnServerError() throws Exception {
        when(adPostService.runAllAds()).thenThrow(new IllegalStateException("Transaction already completed"));

        mockMvc.perform(post("/api/admin/run-all-ads"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.error").value("INTERNAL_ERROR"))
                .andExpect(jsonPath("$.message").value("An unexpected error occurred"));
    }

    @Test
    void simulatePost_WithUnknownPlatform_ShouldReturnBadRequest() throws Exception {
        mockMvc.perform(post("/api/admin/simulate-ad-post")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"platform\":\"myspace\"}"))
                .andExpect(status().isBadRequest());

        verifyNoInteractions(adPostService);
    }

    @Test
    void simulatePost_WithoutPlatform_ShouldFailValidation() throws Exception {
        mockMvc.perform(post("/api/admin/simulate-ad-post")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("VALIDATION_FAILED"));
    }

    @Test
    void previewContent_ShouldReturnGeneratedContent() throws Exception {
        // Given
        when(adPostService.previewContent(any(PreviewContentRequest.class)))
                .thenReturn("Hello\n\n#StudentJobs");

        // When & Then
        mockMvc.perform(post("/api/admin/preview-ad-content")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"message\":\"Hello\",\"platform\":\"twitter\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.content").value("Hello\n\n#StudentJobs"));

        verify(adPostService).previewContent(argThat(request ->
                request.getPlatform() == SocialPlatform.TWITTER && request.getMessage().equals("Hello")));
    }

    @Test
    void getPost_WhenMissing_ShouldReturnNotFound() throws Exception {
        when(adPostService.getPost(404L)).thenReturn(Optional.empty());

        mockMvc.perform(get("/api/admin/ad-posts/404"))
                .andExpect(status().isNotFound());
    }

    @Test
    void schedulePosts_ShouldRunSchedulingPass() throws Exception {
        when(schedulingService.checkAndSchedulePosts()).thenReturn(List.of());

        mockMvc.perform(post("/api/admin/schedule-posts"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$").isEmpty());

        verify(schedulingService).checkAndSchedulePosts();
    }
}
