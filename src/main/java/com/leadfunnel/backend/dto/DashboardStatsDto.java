package com.leadfunnel.backend.dto;

import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class DashboardStatsDto {
    private long totalLeads;
    private long newLeadsToday;
    private long newLeadsYesterday;
    private long qualifiedLeads;
    private double conversionRate; // qualified / total, percent
    private long activeForms;
    private long activeCampaigns;
}
