package dev.jobmatcher.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Advisory search filters. Values mirror the form options:
 * experience {@code entry|mid|senior|lead}, salary {@code 50k..150k},
 * timezone {@code us-only|europe|global}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class SearchFilters {
    private String experience;
    private String salary;
    private String timezone;

    public static SearchFilters none() {
        return new SearchFilters();
    }

    public boolean hasAny() {
        return notBlank(experience) || notBlank(salary) || notBlank(timezone);
    }

    private static boolean notBlank(String value) {
        return value != null && !value.isBlank();
    }
}
