package dev.jobmatcher.service;

import dev.jobmatcher.model.Listing;
import dev.jobmatcher.model.SearchFilters;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.Predicate;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Applies the advisory search filters to one provider batch.
 * A filter that would empty a non-empty batch is ignored for that batch.
 */
@Slf4j
@Service
public class FilterService {

    private static final Map<String, Integer> SALARY_THRESHOLDS = Map.of(
            "50k", 50_000,
            "75k", 75_000,
            "100k", 100_000,
            "125k", 125_000,
            "150k", 150_000
    );

    private static final double GBP_TO_USD = 1.3;
    private static final int HOURS_PER_YEAR = 40 * 52;

    private static final String AMOUNT = "(\\d+(?:\\.\\d+)?)(k)?";
    private static final Pattern RANGE = Pattern.compile(AMOUNT + "\\s*(?:-|–|to)\\s*" + AMOUNT);
    private static final Pattern BETWEEN = Pattern.compile("between\\s+" + AMOUNT + "\\s+and\\s+" + AMOUNT);
    private static final Pattern FROM = Pattern.compile("from\\s+" + AMOUNT);
    private static final Pattern UP_TO = Pattern.compile("up\\s+to\\s+" + AMOUNT);
    private static final Pattern SINGLE = Pattern.compile(AMOUNT);

    /**
     * Annualized USD salary bounds. Zero means unknown.
     */
    public record SalaryRange(long min, long max) {
        static final SalaryRange UNKNOWN = new SalaryRange(0, 0);

        boolean isKnown() {
            return min > 0 || max > 0;
        }
    }

    public List<Listing> apply(List<Listing> listings, SearchFilters filters) {
        if (filters == null || !filters.hasAny() || listings.isEmpty()) {
            return listings;
        }

        List<Listing> filtered = listings;
        filtered = applyStage(filtered, "salary", salaryFilter(filters.getSalary()));
        filtered = applyStage(filtered, "experience", experienceFilter(filters.getExperience()));
        filtered = applyStage(filtered, "timezone", timezoneFilter(filters.getTimezone()));

        if (filtered.isEmpty()) {
            log.info("Filters removed all {} listings, keeping the unfiltered batch", listings.size());
            return listings;
        }
        return filtered;
    }

    private List<Listing> applyStage(List<Listing> listings, String stage, Predicate<Listing> predicate) {
        if (predicate == null) {
            return listings;
        }
        List<Listing> kept = listings.stream().filter(predicate).toList();
        log.debug("{} filter: {} -> {} listings", stage, listings.size(), kept.size());
        return kept;
    }

    private Predicate<Listing> salaryFilter(String salary) {
        if (salary == null || salary.isBlank()) {
            return null;
        }
        Integer threshold = SALARY_THRESHOLDS.get(salary.trim().toLowerCase(Locale.ROOT));
        if (threshold == null) {
            return null;
        }
        return listing -> {
            SalaryRange range = extractSalary(listing.getSalary());
            if (!range.isKnown()) {
                return true;
            }
            long comparable = range.max() > 0 ? range.max() : range.min();
            return comparable >= threshold;
        };
    }

    private Predicate<Listing> experienceFilter(String experience) {
        if (experience == null || experience.isBlank()) {
            return null;
        }
        String level = experience.trim().toLowerCase(Locale.ROOT);
        if (level.equals("entry")) {
            return listing -> containsAny(lower(listing.getTitle()), "junior", "entry", "associate")
                    || containsAny(lower(listing.getDescription()), "entry level", "junior");
        }
        if (level.equals("mid")) {
            return listing -> !containsAny(lower(listing.getTitle()),
                    "senior", "lead", "principal", "junior", "entry", "director");
        }
        if (level.equals("senior")) {
            return listing -> containsAny(lower(listing.getTitle()), "senior", "lead", "principal")
                    || containsAny(lower(listing.getDescription()), "senior", "5+ years");
        }
        if (level.equals("lead")) {
            return listing -> containsAny(lower(listing.getTitle()),
                    "lead", "manager", "principal", "architect", "director", "head of");
        }
        return null;
    }

    private Predicate<Listing> timezoneFilter(String timezone) {
        if (timezone == null || timezone.isBlank()) {
            return null;
        }
        String region = timezone.trim().toLowerCase(Locale.ROOT);
        if (region.equals("us-only")) {
            return listing -> containsAny(lower(listing.getDescription()), "us", "united states", "est", "pst")
                    || lower(listing.getLocation()).contains("us");
        }
        if (region.equals("europe")) {
            return listing -> containsAny(lower(listing.getDescription()), "europe", "eu", "cet", "gmt");
        }
        if (region.equals("global")) {
            return listing -> containsAny(lower(listing.getDescription()),
                    "global", "worldwide", "international", "any timezone");
        }
        return null;
    }

    /**
     * Parse a human-formatted salary into annual USD bounds.
     * Amounts with a {@code k} suffix or below 1000 are thousands, hourly rates are annualized
     * and pounds are converted.
     */
    public static SalaryRange extractSalary(String salary) {
        if (salary == null || salary.isBlank() || salary.equalsIgnoreCase("Salary not specified")) {
            return SalaryRange.UNKNOWN;
        }
        String lower = salary.toLowerCase(Locale.ROOT);
        boolean pounds = lower.contains("£");
        boolean hourly = containsAny(lower, "/hour", "per hour", "/hr", "hourly");
        String clean = lower.replaceAll("[$£€,]", "");

        long min;
        long max;
        Matcher m;
        if ((m = RANGE.matcher(clean)).find() || (m = BETWEEN.matcher(clean)).find()) {
            min = amount(m.group(1), m.group(2), hourly);
            max = amount(m.group(3), m.group(4), hourly);
        } else if ((m = FROM.matcher(clean)).find()) {
            min = amount(m.group(1), m.group(2), hourly);
            max = min;
        } else if ((m = UP_TO.matcher(clean)).find()) {
            max = amount(m.group(1), m.group(2), hourly);
            min = max;
        } else if ((m = SINGLE.matcher(clean)).find()) {
            min = amount(m.group(1), m.group(2), hourly);
            max = min;
        } else {
            return SalaryRange.UNKNOWN;
        }

        if (hourly) {
            min *= HOURS_PER_YEAR;
            max *= HOURS_PER_YEAR;
        }
        if (pounds) {
            min = Math.round(min * GBP_TO_USD);
            max = Math.round(max * GBP_TO_USD);
        }
        return new SalaryRange(min, max);
    }

    private static long amount(String number, String thousandsSuffix, boolean hourly) {
        double value = Double.parseDouble(number);
        if (thousandsSuffix != null || (!hourly && value < 1000)) {
            value *= 1000;
        }
        return Math.round(value);
    }

    private static String lower(String value) {
        return value == null ? "" : value.toLowerCase(Locale.ROOT);
    }

    private static boolean containsAny(String text, String... needles) {
        for (String needle : needles) {
            if (text.contains(needle)) {
                return true;
            }
        }
        return false;
    }
}
