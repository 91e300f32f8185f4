package com.leadfunnel.backend.dto.campaign;

import com.leadfunnel.backend.enums.CampaignStatus;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.Data;

import java.time.LocalDate;

@Data
public class CreateCampaignRequest {

    @NotBlank(message = "Campaign name is required")
    @Size(max = 255)
    private String name;

    private String description;

    @NotBlank(message = "Message template is required")
    private String messageTemplate;

    @Size(max = 2048)
    private String formUrl;

    private CampaignStatus status;

    private LocalDate startDate;

    private LocalDate endDate;
}
