package com.leadfunnel.backend.dto.campaign;

import com.leadfunnel.backend.enums.SocialPlatform;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

@Data
public class SimulatePostRequest {

    @NotNull(message = "Platform is required")
    private SocialPlatform platform;
}
