package dev.jobmatcher.ai;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.jobmatcher.model.CandidateProfile;
import dev.jobmatcher.model.SeniorityLevel;
import dev.jobmatcher.profile.KeywordProfileExtractor;
import dev.jobmatcher.profile.ProfileExtractionException;
import dev.jobmatcher.profile.ProfileExtractionException.Reason;
import dev.jobmatcher.profile.ProfileExtractor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.util.ArrayList;

/**
 * Résumé analysis through the chat model. Without an API key, or when the reply
 * is not readable JSON, the keyword extractor is used instead.
 */
@Slf4j
@Service
public class OpenAiProfileExtractor implements ProfileExtractor {

    static final int MIN_RESUME_LENGTH = 100;
    static final int MAX_RESUME_LENGTH = 8000;

    private static final String SYSTEM_PROMPT = """
            You are an expert resume analyzer extracting job-relevant information for job matching.
            Extract technical skills from any mention of tools, software, languages or platforms.
            Extract soft skills from achievements, leadership and collaboration.
            For work experience, include job titles and the roles actually performed.
            Identify industries, education, certifications, responsibilities, achievements and seniority.

            Return ONLY a valid JSON object:
            {
              "technicalSkills": [], "softSkills": [], "workExperience": [], "education": [],
              "qualifications": [], "industries": [], "responsibilities": [], "achievements": [],
              "seniorityLevel": "entry|mid|senior|lead|executive"
            }
            """;

    private final OpenAiChatClient chatClient;
    private final KeywordProfileExtractor keywordExtractor;
    private final ObjectMapper objectMapper;

    public OpenAiProfileExtractor(OpenAiChatClient chatClient, KeywordProfileExtractor keywordExtractor,
            ObjectMapper objectMapper) {
        this.chatClient = chatClient;
        this.keywordExtractor = keywordExtractor;
        this.objectMapper = objectMapper;
    }

    @Override
    public Mono<CandidateProfile> extract(String resumeText) {
        if (resumeText == null || resumeText.trim().length() < MIN_RESUME_LENGTH) {
            return Mono.error(new ProfileExtractionException(Reason.TOO_SHORT,
                    "Resume text is too short. Please provide at least " + MIN_RESUME_LENGTH + " characters."));
        }
        if (!chatClient.isConfigured()) {
            log.info("No language model configured - using keyword extraction");
            return Mono.fromCallable(() -> keywordExtractor.extract(resumeText));
        }

        String truncated = resumeText.length() > MAX_RESUME_LENGTH
                ? resumeText.substring(0, MAX_RESUME_LENGTH) + "..."
                : resumeText;
        String prompt = "Analyze this resume comprehensively and extract all relevant information "
                + "for job matching. Look beyond job titles to what this person actually does: " + truncated;

        return chatClient.complete(SYSTEM_PROMPT, prompt, 0.1, 1500)
                .onErrorMap(this::toExtractionFailure)
                .map(content -> parseOrFallback(content, resumeText))
                .switchIfEmpty(Mono.fromCallable(() -> keywordExtractor.extract(resumeText)));
    }

    private CandidateProfile parseOrFallback(String content, String resumeText) {
        String json = OpenAiChatClient.extractJsonObject(content).orElse(null);
        if (json != null) {
            try {
                CandidateProfile profile = objectMapper.readValue(json, CandidateProfile.class);
                return withoutNulls(profile);
            } catch (JsonProcessingException e) {
                log.warn("Profile JSON unreadable, using keyword extraction: {}", e.getOriginalMessage());
            }
        } else {
            log.warn("Profile reply carried no JSON object, using keyword extraction");
        }
        return keywordExtractor.extract(resumeText);
    }

    private Throwable toExtractionFailure(Throwable e) {
        if (OpenAiChatClient.isRateLimited(e)) {
            return new ProfileExtractionException(Reason.RATE_LIMITED,
                    "Resume analysis is rate limited. Please try again in a minute.", e);
        }
        log.error("Resume analysis failed: {}", e.getMessage());
        return new ProfileExtractionException(Reason.SERVICE_UNAVAILABLE,
                "Resume analysis service is temporarily unavailable.", e);
    }

    private static CandidateProfile withoutNulls(CandidateProfile profile) {
        if (profile.getTechnicalSkills() == null) profile.setTechnicalSkills(new ArrayList<>());
        if (profile.getSoftSkills() == null) profile.setSoftSkills(new ArrayList<>());
        if (profile.getWorkExperience() == null) profile.setWorkExperience(new ArrayList<>());
        if (profile.getEducation() == null) profile.setEducation(new ArrayList<>());
        if (profile.getQualifications() == null) profile.setQualifications(new ArrayList<>());
        if (profile.getIndustries() == null) profile.setIndustries(new ArrayList<>());
        if (profile.getResponsibilities() == null) profile.setResponsibilities(new ArrayList<>());
        if (profile.getAchievements() == null) profile.setAchievements(new ArrayList<>());
        if (profile.getSeniorityLevel() == null) profile.setSeniorityLevel(SeniorityLevel.MID);
        return profile;
    }
}
