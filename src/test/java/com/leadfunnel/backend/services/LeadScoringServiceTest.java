package com.leadfunnel.backend.services;

import com.leadfunnel.backend.dto.LeadScoreDto;
import com.leadfunnel.backend.enums.LeadSource;
import com.leadfunnel.backend.models.Lead;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.*;

class LeadScoringServiceTest {

    private static final Instant NOW = Instant.parse("2026-10-19T06:00:00Z");

    private LeadScoringService scoringService;

    @BeforeEach
    void setUp() {
        scoringService = new LeadScoringService(Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void scoreLead_WithStrongProfile_ShouldBeHot() {
        // Given
        Lead lead = Lead.builder()
                .name("Asha")
                .state("Karnataka")
                .education("MBA")
                .age("24")
                .source(LeadSource.WEBSITE)
                .createdAt(OffsetDateTime.ofInstant(NOW, ZoneOffset.UTC).minusHours(3))
                .build();

        // When
        LeadScoreDto score = scoringService.scoreLead(lead);

        // Then
        assertThat(score.getScore()).isEqualTo(100);
        assertThat(score.getLabel()).isEqualTo("Hot");
        assertThat(score.getBreakdown()).containsExactly(
                entry("location", 20),
                entry("recency", 20),
                entry("education", 20),
                entry("age", 20),
                entry("source", 20));
    }

    @Test
    void scoreLead_WithEmptyProfile_ShouldBeCold() {
        // Given
        Lead lead = Lead.builder().name("Unknown").source(LeadSource.OTHER).build();

        // When
        LeadScoreDto score = scoringService.scoreLead(lead);

        // Then
        assertThat(score.getScore()).isEqualTo(5);
        assertThat(score.getLabel()).isEqualTo("Cold");
    }

    @ParameterizedTest
    @CsvSource({
            "Maharashtra, 20",
            "  tamil nadu , 20",
            "Kerala, 10",
            "Goa, 5"
    })
    void locationScore_ShouldFollowStateTiers(String state, int expected) {
        assertThat(scoringService.locationScore(state)).isEqualTo(expected);
    }

    @ParameterizedTest
    @CsvSource({
            "0, 20",
            "1, 20",
            "3, 15",
            "7, 10",
            "30, 5",
            "31, 2"
    })
    void recencyScore_ShouldDecayWithAge(long daysAgo, int expected) {
        OffsetDateTime createdAt = OffsetDateTime.ofInstant(NOW, ZoneOffset.UTC).minusDays(daysAgo);

        assertThat(scoringService.recencyScore(createdAt)).isEqualTo(expected);
    }

    @ParameterizedTest
    @CsvSource({
            "Post Graduate, 20",
            "B.Tech / BTech, 15",
            "Graduate, 15",
            "12th pass, 10",
            "10th, 5",
            "Diploma, 2"
    })
    void educationScore_ShouldRankQualifications(String education, int expected) {
        assertThat(scoringService.educationScore(education)).isEqualTo(expected);
    }

    @ParameterizedTest
    @CsvSource({
            "25, 20",
            "19 years, 15",
            "35, 10",
            "45, 5",
            "16, 2",
            "99999999999, 2",
            "unknown, 0"
    })
    void ageScore_ShouldPreferEarlyCareerAges(String age, int expected) {
        assertThat(scoringService.ageScore(age)).isEqualTo(expected);
    }

    @Test
    void label_ShouldUseThresholds() {
        assertThat(LeadScoringService.label(70)).isEqualTo("Hot");
        assertThat(LeadScoringService.label(69)).isEqualTo("Warm");
        assertThat(LeadScoringService.label(50)).isEqualTo("Warm");
        assertThat(LeadScoringService.label(49)).isEqualTo("Cold");
    }
}
