package dev.jobmatcher.profile;

import dev.jobmatcher.model.CandidateProfile;
import dev.jobmatcher.model.SeniorityLevel;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class KeywordProfileExtractorTest {

    private final KeywordProfileExtractor extractor = new KeywordProfileExtractor();

    @Test
    @DisplayName("Should pick skills, roles and industries from the text")
    void shouldExtractVocabulary() {
        CandidateProfile profile = extractor.extract("""
                Data Analyst at a Healthcare startup. Built Tableau dashboards and automated SQL reports.
                Strong communication and stakeholder management. Bachelor in Statistics.
                """);

        assertThat(profile.getTechnicalSkills()).containsExactly("sql", "tableau");
        assertThat(profile.getWorkExperience()).containsExactly("data analyst");
        assertThat(profile.getIndustries()).containsExactly("healthcare");
        assertThat(profile.getResponsibilities()).contains("built", "automated");
        assertThat(profile.getSoftSkills()).contains("communication", "stakeholder management");
        assertThat(profile.getEducation()).contains("bachelor");
        assertThat(profile.getSeniorityLevel()).isEqualTo(SeniorityLevel.MID);
        assertThat(profile.hasSignal()).isTrue();
    }

    @Test
    @DisplayName("Should match whole terms only")
    void shouldMatchWholeTerms() {
        CandidateProfile profile = extractor.extract("Javascript, C++ and Node.js; going to Django meetups");

        assertThat(profile.getTechnicalSkills()).contains("javascript", "c++", "node.js", "django");
        assertThat(profile.getTechnicalSkills()).doesNotContain("java", "go");
    }

    @Test
    @DisplayName("Should return an empty profile for unrelated text")
    void shouldReturnEmptyProfile() {
        CandidateProfile profile = extractor.extract("Lorem ipsum dolor sit amet");

        assertThat(profile.hasSignal()).isFalse();
        assertThat(extractor.extract(null).getTechnicalSkills()).isEmpty();
    }

    @Nested
    @DisplayName("Seniority")
    class SeniorityTests {

        @Test
        void seniorTermsWin() {
            assertThat(KeywordProfileExtractor.seniorityOf("principal engineer and team lead")).isEqualTo(SeniorityLevel.SENIOR);
        }

        @Test
        void executiveTerms() {
            assertThat(KeywordProfileExtractor.seniorityOf("head of product")).isEqualTo(SeniorityLevel.EXECUTIVE);
        }

        @Test
        void entryTerms() {
            assertThat(KeywordProfileExtractor.seniorityOf("summer intern")).isEqualTo(SeniorityLevel.ENTRY);
        }

        @Test
        void leadTerms() {
            assertThat(KeywordProfileExtractor.seniorityOf("engineering manager")).isEqualTo(SeniorityLevel.LEAD);
        }

        @Test
        void defaultsToMid() {
            assertThat(KeywordProfileExtractor.seniorityOf("engineer")).isEqualTo(SeniorityLevel.MID);
        }
    }
}
