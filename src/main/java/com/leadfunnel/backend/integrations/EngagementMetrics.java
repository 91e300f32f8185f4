package com.leadfunnel.backend.integrations;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class EngagementMetrics {
    int impressions;
    int clicks;
    int leadsCaptured;
}
