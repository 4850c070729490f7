package dev.jobmatcher.ai;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.jobmatcher.exception.ScoringException;
import dev.jobmatcher.model.CandidateProfile;
import dev.jobmatcher.model.Listing;
import dev.jobmatcher.model.MatchResult;
import dev.jobmatcher.scoring.HeuristicMatchScorer;
import dev.jobmatcher.scoring.HeuristicMatchScorer.Breakdown;
import dev.jobmatcher.scoring.MatchScorer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Primary;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Language-model scorer. Listings below the keyword prefilter keep their keyword score;
 * the rest are sent to the chat model. Any model failure falls back to the keyword score.
 */
@Slf4j
@Service
@Primary
@ConditionalOnProperty(name = "app.ai.provider", havingValue = "openai")
public class OpenAiMatchScorer implements MatchScorer {

    private static final String SYSTEM_PROMPT = """
            You are a job matching expert. Your primary responsibility is to identify missing requirements correctly.
            Only list things the JOB REQUIRES that the CANDIDATE DOES NOT HAVE.
            Do not list candidate skills the job does not mention, and ignore "nice to have" or "preferred" items.
            If nothing is missing, return ["None"] and set matchPercentage to 100.
            Be generous with scores (aim for 70+) but strict about missing requirements.
            """;

    private final OpenAiChatClient chatClient;
    private final HeuristicMatchScorer heuristicScorer;
    private final ObjectMapper objectMapper;
    private final int prefilterThreshold;

    public OpenAiMatchScorer(
            OpenAiChatClient chatClient,
            HeuristicMatchScorer heuristicScorer,
            ObjectMapper objectMapper,
            @Value("${app.ai.prefilter-threshold:70}") int prefilterThreshold) {
        this.chatClient = chatClient;
        this.heuristicScorer = heuristicScorer;
        this.objectMapper = objectMapper;
        this.prefilterThreshold = prefilterThreshold;

        if (!chatClient.isConfigured()) {
            log.warn("app.ai.provider=openai but no API key set - using keyword scores only");
        }
    }

    @Override
    public String getName() {
        return "openai";
    }

    @Override
    public Mono<MatchResult> score(Listing listing, CandidateProfile profile) {
        Breakdown basic = heuristicScorer.calculate(listing, profile);
        if (!chatClient.isConfigured() || basic.score() < prefilterThreshold) {
            return Mono.just(heuristicScorer.toResult(basic, null));
        }

        return chatClient.complete(SYSTEM_PROMPT, buildPrompt(listing, profile), 0.1, 600)
                .switchIfEmpty(Mono.error(() -> new ScoringException("Empty reply from language model")))
                .map(this::parseResult)
                .onErrorResume(e -> {
                    log.warn("AI match failed for '{}', using basic match {}%: {}",
                            listing.getTitle(), basic.score(), e.getMessage());
                    return Mono.just(heuristicScorer.toResult(basic,
                            "Basic algorithm match: " + basic.score() + "% (AI analysis unavailable)"));
                });
    }

    MatchResult parseResult(String content) {
        String json = OpenAiChatClient.extractJsonObject(content)
                .orElseThrow(() -> new ScoringException("No valid JSON found in AI response"));
        AiMatch parsed;
        try {
            parsed = objectMapper.readValue(json, AiMatch.class);
        } catch (JsonProcessingException e) {
            throw new ScoringException("Unreadable AI match JSON", e);
        }
        int percentage = clamp(parsed.matchPercentage() != null ? parsed.matchPercentage() : 0);
        return new MatchResult(
                percentage,
                clamp(parsed.industryMatch() != null ? parsed.industryMatch() : 0),
                clamp(parsed.seniorityMatch() != null ? parsed.seniorityMatch() : 0),
                parsed.growthPotential() != null ? parsed.growthPotential() : "medium",
                parsed.matchedTechnicalSkills(),
                parsed.matchedSoftSkills(),
                parsed.matchedExperience(),
                parsed.missingRequirements(),
                parsed.reasoning() != null ? parsed.reasoning() : "Comprehensive AI analysis completed");
    }

    private String buildPrompt(Listing listing, CandidateProfile profile) {
        String description = listing.getDescription() == null ? "No description available"
                : listing.getDescription().substring(0, Math.min(800, listing.getDescription().length()));
        return String.format("""
                Analyze how well this candidate matches this job posting.

                JOB POSTING: %s at %s
                Location: %s
                Description: %s

                CANDIDATE PROFILE:
                - Technical Skills: %s
                - Work Experience: %s
                - Industries: %s
                - Responsibilities: %s
                - Qualifications: %s
                - Education: %s
                - Seniority Level: %s

                Return JSON only:
                {"matchPercentage": 0-100, "matchedTechnicalSkills": [], "matchedSoftSkills": [],
                 "matchedExperience": [], "missingRequirements": [], "reasoning": "",
                 "industryMatch": 0-100, "seniorityMatch": 0-100, "growthPotential": "low|medium|high"}
                """,
                listing.getTitle(), listing.getCompany(), listing.getLocation(), description,
                join(profile.getTechnicalSkills(), 15), join(profile.getWorkExperience(), 8),
                join(profile.getIndustries(), 5), join(profile.getResponsibilities(), 8),
                join(profile.getQualifications(), 5), join(profile.getEducation(), 5),
                profile.getSeniorityLevel() != null ? profile.getSeniorityLevel().getValue() : "None");
    }

    private static String join(List<String> values, int limit) {
        if (values == null || values.isEmpty()) {
            return "None";
        }
        return String.join(", ", values.subList(0, Math.min(limit, values.size())));
    }

    private static int clamp(int value) {
        return Math.max(0, Math.min(value, 100));
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record AiMatch(
            Integer matchPercentage,
            List<String> matchedTechnicalSkills,
            List<String> matchedSoftSkills,
            List<String> matchedExperience,
            List<String> missingRequirements,
            String reasoning,
            Integer industryMatch,
            Integer seniorityMatch,
            String growthPotential) {
    }
}
