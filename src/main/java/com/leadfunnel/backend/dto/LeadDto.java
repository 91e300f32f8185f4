package com.leadfunnel.backend.dto;

import com.leadfunnel.backend.enums.LeadSource;
import com.leadfunnel.backend.enums.LeadStatus;
import com.leadfunnel.backend.models.Lead;
import lombok.Builder;
import lombok.Data;

import java.time.OffsetDateTime;
import java.util.Map;

@Data
@Builder
public class LeadDto {
    private Long id;
    private String name;
    private String email;
    private String phone;
    private String age;
    private String education;
    private String college;
    private String state;
    private String city;
    private LeadSource source;
    private LeadStatus status;
    private Integer score;
    private String scoreLabel;
    private Map<String, Integer> scoreBreakdown;
    private OffsetDateTime createdAt;
    private OffsetDateTime updatedAt;

    public static LeadDto from(Lead lead, LeadScoreDto score, boolean withBreakdown) {
        return LeadDto.builder()
                .id(lead.getId())
                .name(lead.getName())
                .email(lead.getEmail())
                .phone(lead.getPhone())
                .age(lead.getAge())
                .education(lead.getEducation())
                .college(lead.getCollege())
                .state(lead.getState())
                .city(lead.getCity())
                .source(lead.getSource())
                .status(lead.getStatus())
                .score(score.getScore())
                .scoreLabel(score.getLabel())
                .scoreBreakdown(withBreakdown ? score.getBreakdown() : null)
                .createdAt(lead.getCreatedAt())
                .updatedAt(lead.getUpdatedAt())
                .build();
    }
}
