package com.sgr.runtime.common.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Static hub-and-spoke routing rule. Matches when the input contains any keyword
 * (case-insensitive) or when {@code pattern} is found in it.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record RoutingRule(String spoke, List<String> keywords, String pattern) {

    public RoutingRule {
        keywords = keywords == null ? List.of() : keywords.stream().filter(Objects::nonNull).toList();
    }

    public boolean matches(String input) {
        if (input == null) {
            return false;
        }
        String lowered = input.toLowerCase(Locale.ROOT);
        for (String keyword : keywords) {
            if (keyword != null && !keyword.isBlank() && lowered.contains(keyword.toLowerCase(Locale.ROOT))) {
                return true;
            }
        }
        return pattern != null && !pattern.isBlank() && Pattern.compile(pattern).matcher(input).find();
    }
}
