package dev.jobmatcher.scoring;

import dev.jobmatcher.config.ScoringConfig;
import dev.jobmatcher.model.CandidateProfile;
import dev.jobmatcher.model.Listing;
import dev.jobmatcher.scoring.HeuristicMatchScorer.Breakdown;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class HeuristicMatchScorerTest {

    private HeuristicMatchScorer scorer;

    @BeforeEach
    void setUp() {
        scorer = new HeuristicMatchScorer(new ScoringConfig());
    }

    private static Listing listing(String title, String description) {
        return Listing.builder().title(title).company("Acme").description(description).build();
    }

    @Test
    @DisplayName("Should weight only the profile dimensions that are present")
    void shouldWeightPresentDimensions() {
        CandidateProfile profile = CandidateProfile.builder()
                .technicalSkills(List.of("Java", "Spring Boot"))
                .workExperience(List.of("Senior Java Developer at Acme"))
                .build();

        Breakdown breakdown = scorer.calculate(
                listing("Senior Java Developer", "We use Spring Boot and Kafka"), profile);

        // skills 35/35, role 3 of 4 words -> 22.5/30, total 57.5/65
        assertThat(breakdown.score()).isEqualTo(88);
        assertThat(breakdown.matchedSkills()).containsExactly("Java", "Spring Boot");
        assertThat(breakdown.matchedExperience()).containsExactly("Senior Java Developer at Acme");
    }

    @Test
    void shouldCapAtMaximumScore() {
        CandidateProfile profile = CandidateProfile.builder()
                .technicalSkills(List.of("Java"))
                .workExperience(List.of("Java Developer"))
                .build();

        assertThat(scorer.calculate(listing("Java Developer", ""), profile).score()).isEqualTo(95);
    }

    @Test
    void shouldScoreZeroWithoutOverlap() {
        CandidateProfile profile = CandidateProfile.builder()
                .technicalSkills(List.of("Photoshop"))
                .industries(List.of("Healthcare"))
                .build();

        assertThat(scorer.calculate(listing("Backend Engineer", "Go and Postgres"), profile).score()).isZero();
    }

    @Test
    void shouldMatchSkillsWrittenWithoutPunctuation() {
        CandidateProfile profile = CandidateProfile.builder()
                .technicalSkills(List.of("Node.js"))
                .build();

        Breakdown breakdown = scorer.calculate(listing("Nodejs Engineer", ""), profile);

        assertThat(breakdown.matchedSkills()).containsExactly("Node.js");
    }

    @Test
    void shouldDeriveSecondaryScoresAndReasoning() {
        CandidateProfile profile = CandidateProfile.builder()
                .technicalSkills(List.of("Java"))
                .workExperience(List.of("Java Developer"))
                .build();

        StepVerifier.create(scorer.score(listing("Java Developer", ""), profile))
                .assertNext(result -> {
                    assertThat(result.matchPercentage()).isEqualTo(95);
                    assertThat(result.industryMatch()).isEqualTo(95);
                    assertThat(result.seniorityMatch()).isEqualTo(90);
                    assertThat(result.growthPotential()).isEqualTo("high");
                    assertThat(result.reasoning()).isEqualTo("Basic algorithm match: 95%");
                })
                .verifyComplete();
    }
}
