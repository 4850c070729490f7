package dev.jobmatcher.profile;

import dev.jobmatcher.model.CandidateProfile;
import reactor.core.publisher.Mono;

/**
 * Turns raw résumé text into a structured candidate profile.
 */
public interface ProfileExtractor {

    /**
     * @param resumeText plain résumé text
     * @return Mono with the profile, or a {@link ProfileExtractionException}
     */
    Mono<CandidateProfile> extract(String resumeText);
}
