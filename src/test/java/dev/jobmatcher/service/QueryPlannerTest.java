package dev.jobmatcher.service;

import dev.jobmatcher.model.CandidateProfile;
import dev.jobmatcher.model.SeniorityLevel;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class QueryPlannerTest {

    private final QueryPlanner planner = new QueryPlanner();

    @Test
    void shouldOrderRoleResponsibilitySkillAndIndustryQueries() {
        CandidateProfile profile = CandidateProfile.builder()
                .workExperience(List.of("Senior Software Engineer at Acme"))
                .responsibilities(List.of("Led a team of 5", "Built APIs"))
                .technicalSkills(List.of("Python", "Docker"))
                .industries(List.of("FinTech"))
                .build();

        assertThat(planner.plan(profile)).containsExactly(
                "remote software engineer",
                "remote developer",
                "remote backend engineer",
                "remote engineer",
                "remote lead",
                "remote python developer",
                "remote devops engineer",
                "remote fintech");
    }

    @Test
    void shouldFallBackToSeniorityQueries() {
        CandidateProfile profile = CandidateProfile.builder()
                .technicalSkills(List.of("Rust"))
                .seniorityLevel(SeniorityLevel.SENIOR)
                .build();

        assertThat(planner.plan(profile))
                .containsExactly("remote senior", "remote lead", "remote principal");
    }

    @Test
    void shouldCapAtTwelveUniqueQueries() {
        List<String> experience = new ArrayList<>(List.of(
                "Software Engineer", "Data Scientist", "Product Manager", "UX Designer",
                "DevOps Engineer", "Sales Manager", "Business Analyst", "Technical Lead"));
        CandidateProfile profile = CandidateProfile.builder().workExperience(experience).build();

        List<String> queries = planner.plan(profile);

        assertThat(queries).hasSize(QueryPlanner.MAX_QUERIES).doesNotHaveDuplicates();
        assertThat(queries.get(0)).isEqualTo("remote software engineer");
    }

    @Test
    void shouldIgnoreBlankEntries() {
        CandidateProfile profile = CandidateProfile.builder()
                .workExperience(new ArrayList<>(Arrays.asList(null, " ", "Data Analyst")))
                .build();

        assertThat(planner.plan(profile)).startsWith("remote analyst");
    }
}
