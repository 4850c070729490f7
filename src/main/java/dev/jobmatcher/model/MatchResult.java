package dev.jobmatcher.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

/**
 * Output of a match scorer for one listing.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record MatchResult(
        Integer matchPercentage,
        Integer industryMatch,
        Integer seniorityMatch,
        String growthPotential,
        List<String> matchedTechnicalSkills,
        List<String> matchedSoftSkills,
        List<String> matchedExperience,
        List<String> missingRequirements,
        String reasoning) {

    public MatchResult {
        matchedTechnicalSkills = matchedTechnicalSkills != null ? List.copyOf(matchedTechnicalSkills) : List.of();
        matchedSoftSkills = matchedSoftSkills != null ? List.copyOf(matchedSoftSkills) : List.of();
        matchedExperience = matchedExperience != null ? List.copyOf(matchedExperience) : List.of();
        missingRequirements = missingRequirements != null ? List.copyOf(missingRequirements) : List.of();
    }
}
