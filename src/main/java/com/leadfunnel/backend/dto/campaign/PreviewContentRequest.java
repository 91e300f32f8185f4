package com.leadfunnel.backend.dto.campaign;

import com.leadfunnel.backend.enums.SocialPlatform;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

@Data
public class PreviewContentRequest {

    @NotBlank(message = "Message is required")
    private String message;

    @NotNull(message = "Platform is required")
    private SocialPlatform platform;

    private String campaignName;

    private String formUrl;
}
