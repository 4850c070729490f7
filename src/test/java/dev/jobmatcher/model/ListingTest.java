package dev.jobmatcher.model;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ListingTest {

    @Test
    void identityKeyShouldIgnoreCaseAndPunctuation() {
        String a = Listing.identityKey("Senior Java Engineer", "Acme, Inc.", ProviderId.ADZUNA);
        String b = Listing.identityKey("senior  java-engineer", "ACME Inc", ProviderId.ADZUNA);

        assertThat(a).isEqualTo(b).isEqualTo("seniorjavaengineer-acmeinc-adzuna");
    }

    @Test
    void identityKeyShouldDistinguishSourceAndCompany() {
        String adzuna = Listing.identityKey("Java Engineer", "Acme", ProviderId.ADZUNA);

        assertThat(adzuna).isNotEqualTo(Listing.identityKey("Java Engineer", "Acme", ProviderId.REED));
        assertThat(adzuna).isNotEqualTo(Listing.identityKey("Java Engineer", "Globex", ProviderId.ADZUNA));
    }

    @Test
    void shouldApplyMatchResult() {
        Listing listing = Listing.builder().title("Java Engineer").build();
        assertThat(listing.isScored()).isFalse();

        listing.applyMatch(new MatchResult(82, 87, 82, "medium", List.of("Java"), null, List.of(), null, "ok"));

        assertThat(listing.isScored()).isTrue();
        assertThat(listing.getMatchPercentage()).isEqualTo(82);
        assertThat(listing.getMatchedTechnicalSkills()).containsExactly("Java");
        assertThat(listing.getMatchedSoftSkills()).isEmpty();
    }
}
