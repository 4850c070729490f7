package dev.jobmatcher.model;

/**
 * Body of a search session start request.
 */
public record SearchRequest(CandidateProfile profile, SearchFilters filters) {
}
