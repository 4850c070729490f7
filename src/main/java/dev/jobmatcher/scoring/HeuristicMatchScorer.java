package dev.jobmatcher.scoring;

import dev.jobmatcher.config.ScoringConfig;
import dev.jobmatcher.model.CandidateProfile;
import dev.jobmatcher.model.Listing;
import dev.jobmatcher.model.MatchResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/**
 * Keyword scorer: technical skills, role overlap, industry and responsibility keywords.
 * Only dimensions present in the profile count toward the maximum.
 * Default scorer, and the fallback of the language-model scorer.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class HeuristicMatchScorer implements MatchScorer {

    private final ScoringConfig scoringConfig;

    /**
     * Result of the keyword calculation before it is turned into a {@link MatchResult}.
     */
    public record Breakdown(
            int score,
            List<String> matchedSkills,
            List<String> matchedExperience) {
    }

    @Override
    public String getName() {
        return "heuristic";
    }

    @Override
    public Mono<MatchResult> score(Listing listing, CandidateProfile profile) {
        return Mono.fromCallable(() -> toResult(calculate(listing, profile), null));
    }

    /**
     * Build a full match result from a breakdown, optionally with a custom reasoning line.
     */
    public MatchResult toResult(Breakdown breakdown, String reasoning) {
        int basic = breakdown.score();
        String growth = basic >= 85 ? "high" : basic >= 75 ? "medium" : "low";
        return new MatchResult(
                basic,
                Math.min(basic + 5, 95),
                Math.min(basic, 90),
                growth,
                breakdown.matchedSkills(),
                List.of(),
                breakdown.matchedExperience(),
                List.of(),
                reasoning != null ? reasoning : "Basic algorithm match: " + basic + "%");
    }

    public Breakdown calculate(Listing listing, CandidateProfile profile) {
        if (listing == null || profile == null) {
            return new Breakdown(0, List.of(), List.of());
        }

        String title = lower(listing.getTitle());
        String jobText = title + " " + lower(listing.getDescription());

        double total = 0;
        double maxPossible = 0;
        List<String> matchedSkills = new ArrayList<>();
        List<String> matchedExperience = new ArrayList<>();

        // 1. Technical skills
        List<String> skills = nonNull(profile.getTechnicalSkills());
        if (!skills.isEmpty()) {
            for (String skill : skills) {
                if (skillMatches(jobText, lower(skill))) {
                    matchedSkills.add(skill);
                }
            }
            double techScore = Math.min(100.0 * matchedSkills.size() / skills.size(), 100);
            total += techScore * scoringConfig.getTechnicalSkillsWeight() / 100.0;
            maxPossible += scoringConfig.getTechnicalSkillsWeight();
        }

        // 2. Role overlap between experience entries and the title
        List<String> experience = nonNull(profile.getWorkExperience());
        if (!experience.isEmpty()) {
            double roleScore = 0;
            List<String> titleWords = words(title, 2);
            for (String entry : experience) {
                List<String> expWords = words(lower(entry), 2);
                long matching = expWords.stream()
                        .filter(word -> titleWords.stream().anyMatch(t -> t.contains(word) || word.contains(t)))
                        .count();
                if (matching > 0) {
                    matchedExperience.add(entry);
                    roleScore = Math.max(roleScore, 100.0 * matching / Math.max(expWords.size(), 1));
                }
            }
            total += roleScore * scoringConfig.getRoleWeight() / 100.0;
            maxPossible += scoringConfig.getRoleWeight();
        }

        // 3. Industry
        List<String> industries = nonNull(profile.getIndustries());
        if (!industries.isEmpty()) {
            boolean industryHit = industries.stream()
                    .map(HeuristicMatchScorer::lower)
                    .anyMatch(industry -> industry.length() > 2 && jobText.contains(industry));
            total += (industryHit ? 100 : 0) * scoringConfig.getIndustryWeight() / 100.0;
            maxPossible += scoringConfig.getIndustryWeight();
        }

        // 4. Responsibility keywords
        List<String> responsibilities = nonNull(profile.getResponsibilities());
        if (!responsibilities.isEmpty()) {
            long hits = responsibilities.stream()
                    .flatMap(r -> words(lower(r), 3).stream())
                    .filter(jobText::contains)
                    .count();
            double keywordScore = Math.min(100.0 * hits / Math.max(responsibilities.size() * 2, 1), 100);
            total += keywordScore * scoringConfig.getResponsibilitiesWeight() / 100.0;
            maxPossible += scoringConfig.getResponsibilitiesWeight();
        }

        int score = maxPossible > 0 ? (int) Math.round(total / maxPossible * 100) : 0;
        score = Math.max(0, Math.min(score, scoringConfig.getMaxScore()));
        log.debug("Heuristic match for '{}': {}%", listing.getTitle(), score);
        return new Breakdown(score, matchedSkills, matchedExperience);
    }

    private static boolean skillMatches(String jobText, String skill) {
        if (skill.length() <= 2) {
            return false;
        }
        String compact = skill.replaceAll("[^a-z0-9]", "");
        return jobText.contains(skill)
                || (!compact.isEmpty() && jobText.contains(compact))
                || (skill.contains(".") && jobText.contains(skill.replaceFirst("\\.", "")));
    }

    private static List<String> words(String text, int minLengthExclusive) {
        return Arrays.stream(text.split(" "))
                .filter(word -> word.length() > minLengthExclusive)
                .toList();
    }

    private static List<String> nonNull(List<String> values) {
        if (values == null) {
            return List.of();
        }
        return values.stream().filter(v -> v != null && !v.isBlank()).toList();
    }

    private static String lower(String value) {
        return value == null ? "" : value.toLowerCase(Locale.ROOT);
    }
}
