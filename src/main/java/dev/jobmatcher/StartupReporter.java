package dev.jobmatcher;

import dev.jobmatcher.config.SearchConfig;
import dev.jobmatcher.provider.JobProvider;
import dev.jobmatcher.scoring.MatchScorer;
import dev.jobmatcher.service.SearchOrchestrator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Logs which providers and scorer the server will use.
 * Separated from the main Application class so slice tests can replace it.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class StartupReporter {

    private static final String SEPARATOR = "========================================";

    private final SearchOrchestrator orchestrator;
    private final MatchScorer matchScorer;
    private final SearchConfig searchConfig;

    /**
     * @return number of providers with credentials
     */
    public int report() {
        List<JobProvider> configured = orchestrator.configuredProviders();

        log.info(SEPARATOR);
        log.info("Job Matcher Ready");
        log.info(SEPARATOR);
        log.info("Providers configured: {}/{}", configured.size(), orchestrator.getProviders().size());
        orchestrator.getProviders().forEach(p ->
                log.info("  - {}: {}", p.getId(), p.isConfigured() ? "configured" : "missing credentials"));
        log.info("Match scorer: {}", matchScorer.getName());
        log.info("Global search deadline: {}s", searchConfig.getGlobalTimeout().toSeconds());

        if (configured.isEmpty()) {
            log.warn("No provider credentials found - searches will be rejected until one is configured");
        }
        return configured.size();
    }
}
