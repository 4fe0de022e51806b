package com.phillippitts.structurecoach.service.framework;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Detects a framework by looking for marker tokens in the structure hint.
 *
 * <p>Rules are evaluated in their fixed priority order and the first match wins. A rule
 * matches when any of its {@code anyOf} markers occurs, or when all of its {@code allOf}
 * markers occur. Markers are matched case-insensitively on word boundaries, so "STAR"
 * matches "Use the STAR method" but not "Start with context".
 */
public final class MarkerFrameworkDetector implements FrameworkDetector {

    private final List<Rule> rules;

    public MarkerFrameworkDetector(List<Rule> rules) {
        this.rules = List.copyOf(Objects.requireNonNull(rules, "rules"));
    }

    @Override
    public Optional<String> detect(String structureHint) {
        if (structureHint == null || structureHint.isBlank()) {
            return Optional.empty();
        }
        for (Rule rule : rules) {
            if (rule.matches(structureHint)) {
                return Optional.of(rule.frameworkName());
            }
        }
        return Optional.empty();
    }

    public List<Rule> rules() {
        return rules;
    }

    /**
     * One detection rule.
     *
     * @param frameworkName framework selected when the rule matches
     * @param anyOf         markers of which a single occurrence is sufficient
     * @param allOf         markers that must all occur (ignored when empty)
     */
    public record Rule(String frameworkName, List<Pattern> anyOf, List<Pattern> allOf) {

        public Rule {
            Objects.requireNonNull(frameworkName, "frameworkName");
            anyOf = List.copyOf(anyOf);
            allOf = List.copyOf(allOf);
        }

        /**
         * Builds a rule from plain marker words. Hyphenated markers also match without the
         * hyphen, and a trailing "s" is optional.
         */
        public static Rule of(String frameworkName, List<String> anyOf, List<String> allOf) {
            return new Rule(frameworkName,
                    anyOf.stream().map(Rule::compile).toList(),
                    allOf.stream().map(Rule::compile).toList());
        }

        boolean matches(String text) {
            for (Pattern p : anyOf) {
                if (p.matcher(text).find()) {
                    return true;
                }
            }
            if (allOf.isEmpty()) {
                return false;
            }
            for (Pattern p : allOf) {
                if (!p.matcher(text).find()) {
                    return false;
                }
            }
            return true;
        }

        private static Pattern compile(String marker) {
            String body = Pattern.quote(marker).replace("-", "\\E-?\\Q");
            return Pattern.compile("(?<![\\p{Alnum}])" + body + "s?(?![\\p{Alnum}])",
                    Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
        }
    }
}
