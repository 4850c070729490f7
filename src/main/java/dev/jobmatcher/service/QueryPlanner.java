package dev.jobmatcher.service;

import dev.jobmatcher.model.CandidateProfile;
import dev.jobmatcher.model.SeniorityLevel;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Derives provider search queries from a candidate profile.
 * Order of precedence: work experience roles, responsibility verbs, technical skills,
 * industries, then seniority fallbacks when fewer than three queries were found.
 */
@Slf4j
@Component
public class QueryPlanner {

    static final int MAX_QUERIES = 12;
    private static final int MIN_QUERIES_BEFORE_FALLBACK = 3;

    private static final List<Map.Entry<String, List<String>>> ROLE_MAP = List.of(
            Map.entry("software engineer", List.of("remote software engineer", "remote developer", "remote backend engineer")),
            Map.entry("software developer", List.of("remote software developer", "remote developer", "remote engineer")),
            Map.entry("data scientist", List.of("remote data scientist", "remote data analyst", "remote analytics")),
            Map.entry("product manager", List.of("remote product manager", "remote pm", "remote product")),
            Map.entry("marketing manager", List.of("remote marketing manager", "remote marketing", "remote digital marketing")),
            Map.entry("project manager", List.of("remote project manager", "remote pm", "remote program manager")),
            Map.entry("business analyst", List.of("remote business analyst", "remote analyst", "remote ba")),
            Map.entry("ux designer", List.of("remote ux designer", "remote designer", "remote product designer")),
            Map.entry("sales manager", List.of("remote sales manager", "remote sales", "remote account manager")),
            Map.entry("customer success", List.of("remote customer success", "remote cs", "remote account management")),
            Map.entry("devops engineer", List.of("remote devops", "remote infrastructure", "remote cloud engineer")),
            Map.entry("frontend developer", List.of("remote frontend", "remote ui developer", "remote react developer")),
            Map.entry("backend developer", List.of("remote backend", "remote api developer", "remote server developer")),
            Map.entry("full stack", List.of("remote fullstack", "remote full-stack", "remote web developer")),
            Map.entry("head of product", List.of("remote head of product", "remote product director", "remote vp product")),
            Map.entry("technical lead", List.of("remote technical lead", "remote tech lead", "remote engineering lead")),
            Map.entry("ai engineer", List.of("remote ai engineer", "remote machine learning", "remote ml engineer"))
    );

    private static final List<String> GENERIC_ROLES = List.of(
            "manager", "engineer", "developer", "analyst", "designer",
            "consultant", "lead", "director", "head of");

    private static final List<Map.Entry<String, String>> RESPONSIBILITY_ROLES = List.of(
            Map.entry("developed", "remote developer"),
            Map.entry("managed", "remote manager"),
            Map.entry("designed", "remote designer"),
            Map.entry("analyzed", "remote analyst"),
            Map.entry("led", "remote lead"),
            Map.entry("coordinated", "remote coordinator"),
            Map.entry("implemented", "remote implementation specialist"),
            Map.entry("optimized", "remote optimization specialist"),
            Map.entry("architected", "remote architect"),
            Map.entry("built", "remote developer")
    );

    private static final Map<String, String> SKILL_ROLES = Map.ofEntries(
            Map.entry("javascript", "remote javascript developer"),
            Map.entry("python", "remote python developer"),
            Map.entry("react", "remote react developer"),
            Map.entry("node.js", "remote nodejs developer"),
            Map.entry("aws", "remote cloud engineer"),
            Map.entry("sql", "remote data analyst"),
            Map.entry("tableau", "remote data analyst"),
            Map.entry("salesforce", "remote salesforce admin"),
            Map.entry("figma", "remote ux designer"),
            Map.entry("photoshop", "remote graphic designer"),
            Map.entry("typescript", "remote typescript developer"),
            Map.entry("postgresql", "remote database developer"),
            Map.entry("mongodb", "remote database developer"),
            Map.entry("docker", "remote devops engineer"),
            Map.entry("kubernetes", "remote devops engineer")
    );

    private static final Map<SeniorityLevel, List<String>> SENIORITY_QUERIES = Map.of(
            SeniorityLevel.ENTRY, List.of("remote entry level", "remote junior", "remote associate"),
            SeniorityLevel.MID, List.of("remote specialist", "remote professional", "remote coordinator"),
            SeniorityLevel.SENIOR, List.of("remote senior", "remote lead", "remote principal"),
            SeniorityLevel.LEAD, List.of("remote manager", "remote lead", "remote director"),
            SeniorityLevel.EXECUTIVE, List.of("remote director", "remote vp", "remote executive")
    );

    /**
     * Plan up to {@value #MAX_QUERIES} unique queries, most specific first.
     */
    public List<String> plan(CandidateProfile profile) {
        List<String> queries = new ArrayList<>();

        for (String experience : firstN(profile.getWorkExperience(), 8)) {
            String lower = experience.toLowerCase(Locale.ROOT);
            for (Map.Entry<String, List<String>> role : ROLE_MAP) {
                if (lower.contains(role.getKey())) {
                    queries.addAll(role.getValue());
                }
            }
            for (String generic : GENERIC_ROLES) {
                if (lower.contains(generic)) {
                    queries.add("remote " + generic);
                }
            }
        }

        for (String responsibility : firstN(profile.getResponsibilities(), 5)) {
            String lower = responsibility.toLowerCase(Locale.ROOT);
            for (Map.Entry<String, String> verb : RESPONSIBILITY_ROLES) {
                if (lower.contains(verb.getKey())) {
                    queries.add(verb.getValue());
                }
            }
        }

        for (String skill : firstN(profile.getTechnicalSkills(), 5)) {
            String role = SKILL_ROLES.get(skill.trim().toLowerCase(Locale.ROOT));
            if (role != null) {
                queries.add(role);
            }
        }

        for (String industry : firstN(profile.getIndustries(), 3)) {
            queries.add("remote " + industry.trim().toLowerCase(Locale.ROOT));
        }

        if (queries.size() < MIN_QUERIES_BEFORE_FALLBACK) {
            SeniorityLevel level = profile.getSeniorityLevel() != null ? profile.getSeniorityLevel() : SeniorityLevel.MID;
            queries.addAll(SENIORITY_QUERIES.get(level));
        }

        Set<String> unique = new LinkedHashSet<>(queries);
        List<String> planned = unique.stream().limit(MAX_QUERIES).toList();
        log.info("Planned {} search queries: {}", planned.size(), planned);
        return planned;
    }

    private static List<String> firstN(List<String> values, int limit) {
        if (values == null) {
            return List.of();
        }
        return values.stream()
                .filter(v -> v != null && !v.isBlank())
                .limit(limit)
                .toList();
    }
}
