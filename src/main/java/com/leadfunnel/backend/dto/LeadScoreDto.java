package com.leadfunnel.backend.dto;

import lombok.Builder;
import lombok.Data;

import java.util.Map;

@Data
@Builder
public class LeadScoreDto {
    private Integer score;
    private String label; // Hot, Warm or Cold
    private Map<String, Integer> breakdown;
}
