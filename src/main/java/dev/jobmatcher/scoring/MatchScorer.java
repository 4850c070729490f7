package dev.jobmatcher.scoring;

import dev.jobmatcher.model.CandidateProfile;
import dev.jobmatcher.model.Listing;
import dev.jobmatcher.model.MatchResult;
import reactor.core.publisher.Mono;

/**
 * Computes how well a listing matches a candidate profile.
 * Implementations may call external services; callers apply their own timeout.
 */
public interface MatchScorer {

    /**
     * Score a single listing.
     *
     * @param listing the normalized listing
     * @param profile the candidate profile
     * @return Mono with a 0-100 match and supporting breakdown, or an error
     *         ({@link dev.jobmatcher.exception.ScoringException}) when scoring fails
     */
    Mono<MatchResult> score(Listing listing, CandidateProfile profile);

    /**
     * Short name for logs.
     */
    String getName();
}
