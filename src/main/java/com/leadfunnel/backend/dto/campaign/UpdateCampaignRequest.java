package com.leadfunnel.backend.dto.campaign;

import com.leadfunnel.backend.enums.CampaignStatus;
import jakarta.validation.constraints.Size;
import lombok.Data;

import java.time.LocalDate;

/**
 * Partial update: null fields are left unchanged.
 */
@Data
public class UpdateCampaignRequest {

    @Size(max = 255)
    private String name;

    private String description;

    private String messageTemplate;

    @Size(max = 2048)
    private String formUrl;

    private CampaignStatus status;

    private LocalDate startDate;

    private LocalDate endDate;
}
