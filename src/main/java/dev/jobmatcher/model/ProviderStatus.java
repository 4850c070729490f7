package dev.jobmatcher.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Per-provider state within one search session.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProviderStatus {
    private ProviderId provider;
    private ProviderState state;
    private int count;
    private Long elapsedMillis;
    private String message;
}
