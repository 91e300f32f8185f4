package com.leadfunnel.backend.services;

import com.leadfunnel.backend.dto.LeadScoreDto;
import com.leadfunnel.backend.models.Lead;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.time.temporal.ChronoUnit;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Lead quality score: five sub-scores of up to 20 points each (location,
 * recency, education, age, source), labelled Hot / Warm / Cold.
 */
@Service
@RequiredArgsConstructor
public class LeadScoringService {

    static final int HOT_THRESHOLD = 70;
    static final int WARM_THRESHOLD = 50;

    private static final List<String> TIER_1_STATES =
            List.of("maharashtra", "delhi", "karnataka", "tamil nadu", "telangana", "gujarat");
    private static final List<String> TIER_2_STATES =
            List.of("haryana", "uttar pradesh", "west bengal", "kerala", "rajasthan", "punjab");

    private final Clock clock;

    public LeadScoreDto scoreLead(Lead lead) {
        Map<String, Integer> breakdown = new LinkedHashMap<>();
        breakdown.put("location", locationScore(lead.getState()));
        breakdown.put("recency", recencyScore(lead.getCreatedAt()));
        breakdown.put("education", educationScore(lead.getEducation()));
        breakdown.put("age", ageScore(lead.getAge()));
        breakdown.put("source", lead.getSource() != null ? lead.getSource().getScore() : 0);

        int total = breakdown.values().stream().mapToInt(Integer::intValue).sum();

        return LeadScoreDto.builder()
                .score(total)
                .label(label(total))
                .breakdown(breakdown)
                .build();
    }

    static String label(int score) {
        if (score >= HOT_THRESHOLD) {
            return "Hot";
        }
        if (score >= WARM_THRESHOLD) {
            return "Warm";
        }
        return "Cold";
    }

    int locationScore(String state) {
        if (state == null || state.isBlank()) {
            return 0;
        }
        String normalized = state.trim().toLowerCase(Locale.ROOT);
        if (TIER_1_STATES.contains(normalized)) {
            return 20;
        }
        if (TIER_2_STATES.contains(normalized)) {
            return 10;
        }
        return 5;
    }

    int recencyScore(OffsetDateTime createdAt) {
        if (createdAt == null) {
            return 0;
        }
        long days = ChronoUnit.DAYS.between(createdAt, OffsetDateTime.now(clock));

        if (days <= 1) return 20;
        if (days <= 3) return 15;
        if (days <= 7) return 10;
        if (days <= 30) return 5;
        return 2;
    }

    int educationScore(String education) {
        if (education == null || education.isBlank()) {
            return 0;
        }
        String normalized = education.trim().toLowerCase(Locale.ROOT);

        if (containsAny(normalized, "post graduate", "pg", "masters", "mba")) {
            return 20;
        }
        if (containsAny(normalized, "graduate", "bachelors", "btech", "bba")) {
            return 15;
        }
        if (containsAny(normalized, "12th", "senior secondary", "higher secondary")) {
            return 10;
        }
        if (containsAny(normalized, "10th", "secondary")) {
            return 5;
        }
        return 2;
    }

    int ageScore(String age) {
        if (age == null) {
            return 0;
        }
        String digits = age.replaceAll("\\D", "");
        if (digits.isEmpty()) {
            return 0;
        }

        int years;
        try {
            years = Integer.parseInt(digits);
        } catch (NumberFormatException e) {
            // too many digits for an age: scored like any other age group
            return 2;
        }

        if (years >= 22 && years <= 30) return 20;
        if (years >= 18 && years <= 21) return 15;
        if (years >= 31 && years <= 40) return 10;
        if (years >= 41 && years <= 50) return 5;
        return 2;
    }

    private boolean containsAny(String value, String... fragments) {
        for (String fragment : fragments) {
            if (value.contains(fragment)) {
                return true;
            }
        }
        return false;
    }
}
