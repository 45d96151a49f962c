package com.emtech.scan.service.matching;

import com.emtech.scan.config.ScanProperties.MatchingProperties;
import com.emtech.scan.model.MatchMode;
import com.emtech.scan.model.TermDefinition;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * The configured terms, compiled once and read-only for the lifetime of the application. Passed
 * explicitly to {@link TermMatcher} for every page.
 */
public final class TermCatalog {

    private final List<TermDefinition> definitions;
    private final List<CompiledTerm> compiled;
    private final double minConfidence;
    private final int contextChars;

    public TermCatalog(List<TermDefinition> definitions, double minConfidence, int defaultFuzzyDistance,
            int contextChars) {
        if (minConfidence < 0.0 || minConfidence > 1.0) {
            throw new IllegalArgumentException("Minimum confidence must be within [0, 1]");
        }
        if (defaultFuzzyDistance < 0) {
            throw new IllegalArgumentException("Default fuzzy distance must not be negative");
        }
        Set<TermDefinition> unique = new LinkedHashSet<>(definitions == null ? List.of() : definitions);
        this.definitions = List.copyOf(unique);
        this.minConfidence = minConfidence;
        this.contextChars = Math.max(0, contextChars);
        List<CompiledTerm> terms = new ArrayList<>(this.definitions.size());
        for (TermDefinition definition : this.definitions) {
            terms.add(CompiledTerm.compile(definition, minConfidence, defaultFuzzyDistance));
        }
        this.compiled = List.copyOf(terms);
    }

    public static TermCatalog of(List<TermDefinition> definitions, MatchingProperties properties) {
        return new TermCatalog(definitions, properties.minConfidence(), properties.defaultFuzzyDistance(),
                properties.contextChars());
    }

    public List<TermDefinition> definitions() {
        return definitions;
    }

    public double minConfidence() {
        return minConfidence;
    }

    public int contextChars() {
        return contextChars;
    }

    public int size() {
        return definitions.size();
    }

    public boolean isEmpty() {
        return definitions.isEmpty();
    }

    List<CompiledTerm> compiled() {
        return compiled;
    }

    record CompiledTerm(TermDefinition definition, String needle, int tokenCount, int maxDistance,
            Pattern pattern, double threshold) {

        static CompiledTerm compile(TermDefinition definition, double catalogMinimum, int defaultFuzzyDistance) {
            double threshold = definition.minConfidence() != null ? definition.minConfidence() : catalogMinimum;
            MatchMode mode = definition.mode();
            if (mode == MatchMode.REGEX) {
                try {
                    Pattern pattern = Pattern.compile(definition.term(),
                            Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
                    return new CompiledTerm(definition, definition.term(), 0, 0, pattern, threshold);
                } catch (PatternSyntaxException ex) {
                    throw new IllegalArgumentException("Invalid pattern for term '" + definition.term() + "': "
                            + ex.getDescription(), ex);
                }
            }
            String needle = NormalizedText.collapse(definition.term(), mode != MatchMode.EXACT);
            if (needle.isEmpty()) {
                throw new IllegalArgumentException("Term must contain visible characters");
            }
            int tokens = (int) Arrays.stream(needle.split(" ")).filter(token -> !token.isEmpty()).count();
            int distance = 0;
            if (mode == MatchMode.FUZZY) {
                if (definition.maxDistance() != null) {
                    distance = definition.maxDistance();
                } else {
                    // the shared default is capped so short terms do not match almost anything
                    distance = Math.min(defaultFuzzyDistance, needle.length() / 4);
                }
            }
            return new CompiledTerm(definition, needle, tokens, distance, null, threshold);
        }

        boolean wholeWord() {
            return Boolean.TRUE.equals(definition.wholeWord());
        }
    }
}
