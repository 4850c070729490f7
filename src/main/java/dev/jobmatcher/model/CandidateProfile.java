package dev.jobmatcher.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Structured résumé extraction used for query planning and scoring.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class CandidateProfile {

    @Builder.Default
    private List<String> technicalSkills = new ArrayList<>();
    @Builder.Default
    private List<String> softSkills = new ArrayList<>();
    @Builder.Default
    private List<String> workExperience = new ArrayList<>();
    @Builder.Default
    private List<String> education = new ArrayList<>();
    @Builder.Default
    private List<String> qualifications = new ArrayList<>();
    @Builder.Default
    private List<String> industries = new ArrayList<>();
    @Builder.Default
    private List<String> responsibilities = new ArrayList<>();
    @Builder.Default
    private List<String> achievements = new ArrayList<>();
    @Builder.Default
    private SeniorityLevel seniorityLevel = SeniorityLevel.MID;

    /**
     * True when at least one of technical skills, work experience or
     * responsibilities carries a non-blank entry.
     */
    public boolean hasSignal() {
        return hasText(technicalSkills) || hasText(workExperience) || hasText(responsibilities);
    }

    private static boolean hasText(List<String> values) {
        return values != null && values.stream().anyMatch(v -> v != null && !v.isBlank());
    }
}
