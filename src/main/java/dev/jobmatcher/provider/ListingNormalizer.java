package dev.jobmatcher.provider;

import dev.jobmatcher.model.Listing;
import dev.jobmatcher.model.ProviderId;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.Jsoup;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.function.Function;

/**
 * Normalization helpers shared by all provider adapters.
 */
@Slf4j
public final class ListingNormalizer {

    public static final String UNKNOWN_COMPANY = "Unknown Company";
    public static final String DEFAULT_LOCATION = "Remote";
    public static final String DEFAULT_EMPLOYMENT_TYPE = "Full-time";
    public static final String SALARY_NOT_SPECIFIED = "Salary not specified";

    private static final DateTimeFormatter DAY_MONTH_YEAR = DateTimeFormatter.ofPattern("dd/MM/yyyy");

    private static final List<Function<String, Instant>> DATE_PARSERS = List.of(
            value -> OffsetDateTime.parse(value).toInstant(),
            value -> LocalDateTime.parse(value).toInstant(ZoneOffset.UTC),
            value -> LocalDate.parse(value).atStartOfDay().toInstant(ZoneOffset.UTC),
            value -> LocalDate.parse(value, DAY_MONTH_YEAR).atStartOfDay().toInstant(ZoneOffset.UTC));

    private ListingNormalizer() {
    }

    /**
     * Map raw provider records, skipping those the mapper rejects (null) or fails on.
     */
    public static <T> List<Listing> mapEach(ProviderId provider, List<T> records, Function<T, Listing> mapper) {
        List<Listing> listings = new ArrayList<>();
        if (records == null) {
            return listings;
        }
        int skipped = 0;
        for (T record : records) {
            if (record == null) {
                skipped++;
                continue;
            }
            try {
                Listing listing = mapper.apply(record);
                if (listing != null) {
                    listings.add(listing);
                } else {
                    skipped++;
                }
            } catch (RuntimeException e) {
                skipped++;
                log.debug("{} - skipping malformed record: {}", provider, e.getMessage());
            }
        }
        if (skipped > 0) {
            log.debug("{} - skipped {} of {} records", provider, skipped, records.size());
        }
        return listings;
    }

    /**
     * Render a salary range in dollars.
     */
    public static String formatSalary(Object min, Object max) {
        return formatSalary(min, max, "$");
    }

    /**
     * Render a salary range: both bounds as "$min - $max", one bound as
     * "From $min" / "Up to $max", none as "Salary not specified".
     * Amounts of 1000 or more are abbreviated to "Nk".
     */
    public static String formatSalary(Object min, Object max, String symbol) {
        BigDecimal low = parseAmount(min);
        BigDecimal high = parseAmount(max);
        if (low != null && high != null) {
            return symbol + formatAmount(low) + " - " + symbol + formatAmount(high);
        } else if (low != null) {
            return "From " + symbol + formatAmount(low);
        } else if (high != null) {
            return "Up to " + symbol + formatAmount(high);
        }
        return SALARY_NOT_SPECIFIED;
    }

    /**
     * Symbol for an ISO currency code, dollars when unknown.
     */
    public static String currencySymbol(String currency) {
        if (currency == null) {
            return "$";
        }
        switch (currency.trim().toUpperCase(Locale.ROOT)) {
            case "GBP":
            case "£":
                return "£";
            case "EUR":
            case "€":
                return "€";
            default:
                return "$";
        }
    }

    static BigDecimal parseAmount(Object value) {
        if (value == null) {
            return null;
        }
        BigDecimal amount;
        if (value instanceof Number) {
            amount = new BigDecimal(value.toString());
        } else {
            String digits = value.toString().replaceAll("[^0-9.]", "");
            if (digits.isEmpty()) {
                return null;
            }
            try {
                amount = new BigDecimal(digits);
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return amount.signum() > 0 ? amount : null;
    }

    private static String formatAmount(BigDecimal amount) {
        if (amount.compareTo(BigDecimal.valueOf(1000)) >= 0) {
            long thousands = amount.divide(BigDecimal.valueOf(1000)).setScale(0, RoundingMode.HALF_UP).longValue();
            return thousands + "k";
        }
        return amount.setScale(2, RoundingMode.HALF_UP).stripTrailingZeros().toPlainString();
    }

    /**
     * Strip HTML tags from text.
     */
    public static String stripHtml(String html) {
        if (html == null || html.isBlank()) {
            return "";
        }
        return Jsoup.parse(html).text();
    }

    /**
     * Parse the date formats providers send. Unparseable or missing values fall back.
     */
    public static Instant parseDate(Object raw, Instant fallback) {
        if (raw == null) {
            return fallback;
        }
        if (raw instanceof Number) {
            long epoch = ((Number) raw).longValue();
            // seconds vs millis
            return epoch > 100_000_000_000L ? Instant.ofEpochMilli(epoch) : Instant.ofEpochSecond(epoch);
        }
        String value = raw.toString().trim();
        if (value.isEmpty()) {
            return fallback;
        }
        for (Function<String, Instant> parser : DATE_PARSERS) {
            try {
                return parser.apply(value);
            } catch (DateTimeParseException e) {
                log.trace("Date '{}' not in format: {}", value, e.getMessage());
            }
        }
        log.debug("Unparseable date '{}', using fallback", value);
        return fallback;
    }

    public static String orDefault(String value, String defaultValue) {
        return (value == null || value.isBlank()) ? defaultValue : value.trim();
    }

    public static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    /**
     * Providers that search by keyword get the query without its "remote " prefix.
     */
    public static String withoutRemotePrefix(String query) {
        if (query == null) {
            return "";
        }
        return query.replaceFirst("remote ", "").trim();
    }
}
