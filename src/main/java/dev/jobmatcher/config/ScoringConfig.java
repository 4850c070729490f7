package dev.jobmatcher.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Weights for the keyword heuristic scorer.
 * Loaded from application.yml under 'scoring' prefix.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "scoring")
public class ScoringConfig {

    private int technicalSkillsWeight = 35;
    private int roleWeight = 30;
    private int industryWeight = 20;
    private int responsibilitiesWeight = 15;
    private int maxScore = 95;
}
