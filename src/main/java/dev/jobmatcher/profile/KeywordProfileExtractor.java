package dev.jobmatcher.profile;

import dev.jobmatcher.model.CandidateProfile;
import dev.jobmatcher.model.SeniorityLevel;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;

/**
 * Vocabulary-based profile extraction used when no language model is available
 * or its reply cannot be read.
 */
@Slf4j
@Component
public class KeywordProfileExtractor {

    private static final Map<String, Pattern> PATTERN_CACHE = new ConcurrentHashMap<>();

    private static final List<String> TECH_SKILLS = List.of(
            "javascript", "typescript", "python", "java", "c#", "c++", "php", "ruby", "go", "swift", "kotlin",
            "scala", "rust", "react", "angular", "vue", "node.js", "express", "django", "flask", "spring",
            "html", "css", "sql", "mysql", "postgresql", "mongodb", "redis", "elasticsearch",
            "aws", "azure", "gcp", "docker", "kubernetes", "jenkins", "git", "linux", "terraform", "ansible",
            "excel", "tableau", "power bi", "looker", "pandas", "numpy", "spark", "hadoop", "snowflake",
            "figma", "sketch", "photoshop", "illustrator", "hubspot", "salesforce", "jira", "confluence");

    private static final List<String> SOFT_SKILLS = List.of(
            "leadership", "communication", "teamwork", "collaboration", "problem solving",
            "project management", "time management", "stakeholder management", "customer service",
            "negotiation", "mentoring", "coaching", "adaptability", "attention to detail",
            "strategic planning", "decision making");

    private static final List<String> ROLES = List.of(
            "software engineer", "software developer", "web developer", "mobile developer",
            "full stack developer", "frontend developer", "backend developer", "data scientist",
            "data analyst", "data engineer", "machine learning engineer", "ai engineer", "devops engineer",
            "cloud engineer", "site reliability engineer", "product manager", "project manager",
            "program manager", "scrum master", "ux designer", "ui designer", "product designer",
            "graphic designer", "technical lead", "engineering manager", "business analyst",
            "financial analyst", "accountant", "operations manager", "consultant", "recruiter",
            "marketing manager", "sales manager", "account manager", "account executive",
            "customer success manager", "copywriter", "content writer", "technical writer");

    private static final List<String> INDUSTRIES = List.of(
            "technology", "software", "saas", "fintech", "healthtech", "edtech", "healthcare",
            "finance", "banking", "insurance", "e-commerce", "retail", "education", "media",
            "advertising", "manufacturing", "automotive", "energy", "real estate", "consulting", "legal");

    private static final List<String> RESPONSIBILITIES = List.of(
            "developed", "built", "created", "designed", "implemented", "deployed", "managed", "led",
            "supervised", "coordinated", "analyzed", "researched", "improved", "optimized", "automated",
            "collaborated", "trained", "mentored", "planned", "delivered", "launched", "maintained",
            "increased", "reduced", "architected");

    private static final List<String> EDUCATION = List.of(
            "bachelor", "master", "mba", "phd", "doctorate", "computer science", "engineering",
            "certification", "certified", "bootcamp", "pmp", "six sigma");

    private static final List<String> QUALIFICATIONS = List.of(
            "years of experience", "years experience", "expert", "specialist", "leadership experience",
            "management experience", "team lead", "technical lead");

    public CandidateProfile extract(String resumeText) {
        String text = resumeText == null ? "" : resumeText.toLowerCase(Locale.ROOT);

        CandidateProfile profile = CandidateProfile.builder()
                .technicalSkills(matching(text, TECH_SKILLS))
                .softSkills(matching(text, SOFT_SKILLS))
                .workExperience(matching(text, ROLES))
                .industries(matching(text, INDUSTRIES))
                .responsibilities(matching(text, RESPONSIBILITIES))
                .education(matching(text, EDUCATION))
                .qualifications(matching(text, QUALIFICATIONS))
                .seniorityLevel(seniorityOf(text))
                .build();

        log.info("Keyword extraction: {} skills, {} roles, {} responsibilities, seniority {}",
                profile.getTechnicalSkills().size(), profile.getWorkExperience().size(),
                profile.getResponsibilities().size(), profile.getSeniorityLevel().getValue());
        return profile;
    }

    static SeniorityLevel seniorityOf(String text) {
        if (containsAny(text, "senior", "principal", "architect")) {
            return SeniorityLevel.SENIOR;
        }
        if (containsAny(text, "director", "vp", "head of", "chief")) {
            return SeniorityLevel.EXECUTIVE;
        }
        if (containsAny(text, "junior", "entry level", "intern")) {
            return SeniorityLevel.ENTRY;
        }
        if (containsAny(text, "manager", "lead", "coordinator")) {
            return SeniorityLevel.LEAD;
        }
        return SeniorityLevel.MID;
    }

    private static boolean containsAny(String text, String... terms) {
        for (String term : terms) {
            if (containsTerm(text, term)) {
                return true;
            }
        }
        return false;
    }

    private static List<String> matching(String text, List<String> vocabulary) {
        return new ArrayList<>(vocabulary.stream().filter(term -> containsTerm(text, term)).toList());
    }

    /**
     * Whole-term match; terms like "c++" or "node.js" end in non-word characters.
     */
    private static boolean containsTerm(String text, String term) {
        String regex = "(?<![a-z0-9])" + Pattern.quote(term) + "(?![a-z0-9])";
        Pattern pattern = PATTERN_CACHE.computeIfAbsent(regex, Pattern::compile);
        return pattern.matcher(text).find();
    }
}
