package dev.jobmatcher.web;

import dev.jobmatcher.model.ProviderId;
import dev.jobmatcher.provider.JobProvider;
import dev.jobmatcher.service.SearchOrchestrator;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Comparator;
import java.util.List;

/**
 * Read-only view of which providers have credentials.
 */
@RestController
@RequestMapping("/api/providers")
@RequiredArgsConstructor
public class ProviderStatusController {

    private final SearchOrchestrator orchestrator;

    public record ProviderSummary(ProviderId provider, boolean configured, long timeoutSeconds) {
    }

    public record ProvidersStatus(int configuredCount, List<ProviderSummary> providers) {
    }

    @GetMapping("/status")
    public ProvidersStatus status() {
        List<ProviderSummary> providers = orchestrator.getProviders().stream()
                .sorted(Comparator.comparing(JobProvider::getId))
                .map(p -> new ProviderSummary(p.getId(), p.isConfigured(), p.getTimeout().toSeconds()))
                .toList();
        int configured = (int) providers.stream().filter(ProviderSummary::configured).count();
        return new ProvidersStatus(configured, providers);
    }
}
