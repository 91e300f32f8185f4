package com.leadfunnel.backend.dto;

import com.leadfunnel.backend.enums.LeadSource;
import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class LeadSourceStatDto {
    private LeadSource source;
    private long count;
    private int percentage; // rounded share of all leads
}
