package dev.jobmatcher.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;
import java.util.Locale;

/**
 * Normalized job listing shared by every provider.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Listing {
    private String title;
    private String company;
    private String location;
    private String link;
    private ProviderId source;
    private String description;
    private String salary; // human-formatted, never parsed back
    private String employmentType;
    private Instant datePosted;

    // Match fields, absent until scored
    private Integer matchPercentage;
    private Integer industryMatch;
    private Integer seniorityMatch;
    private String growthPotential;
    private List<String> matchedTechnicalSkills;
    private List<String> matchedSoftSkills;
    private List<String> matchedExperience;
    private List<String> missingRequirements;
    private String reasoning;

    /**
     * Dedup and save/un-save key: normalized title, company and source.
     */
    public String identityKey() {
        return identityKey(title, company, source);
    }

    public static String identityKey(String title, String company, ProviderId source) {
        return normalizeKeyPart(title) + "-" + normalizeKeyPart(company) + "-"
                + normalizeKeyPart(source != null ? source.getDisplayName() : null);
    }

    private static String normalizeKeyPart(String value) {
        if (value == null) {
            return "";
        }
        return value.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9]", "");
    }

    @JsonIgnore
    public boolean isScored() {
        return matchPercentage != null;
    }

    /**
     * Copy the scorer's output onto this listing.
     */
    public void applyMatch(MatchResult result) {
        this.matchPercentage = result.matchPercentage();
        this.industryMatch = result.industryMatch();
        this.seniorityMatch = result.seniorityMatch();
        this.growthPotential = result.growthPotential();
        this.matchedTechnicalSkills = result.matchedTechnicalSkills();
        this.matchedSoftSkills = result.matchedSoftSkills();
        this.matchedExperience = result.matchedExperience();
        this.missingRequirements = result.missingRequirements();
        this.reasoning = result.reasoning();
    }
}
