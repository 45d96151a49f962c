package com.emtech.scan.service.matching;

import com.emtech.scan.model.CanonicalText;
import com.emtech.scan.model.Hit;
import com.emtech.scan.service.matching.TermCatalog.CompiledTerm;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.regex.Matcher;
import org.springframework.stereotype.Component;

/**
 * Finds configured terms in the canonical text of a page.
 *
 * <p>Exact and case-insensitive terms are substring matches on whitespace-collapsed text (exact
 * mode keeps case). Fuzzy terms are compared by edit distance against windows of as many tokens
 * as the term has. Patterns run against the collapsed, lowercased text. A hit's confidence is the
 * confidence of the merged spans it covers times the certainty of its mode. For each term,
 * overlapping hits collapse into the most confident one and hits under the threshold are only
 * counted.</p>
 *
 * <p>Stateless: the same text and catalog always produce the same outcome.</p>
 */
@Component
public class TermMatcher {

    private static final String ELLIPSIS = "...";

    public MatchOutcome match(String documentId, CanonicalText page, TermCatalog catalog) {
        if (page == null || page.isEmpty() || catalog.isEmpty()) {
            return MatchOutcome.none();
        }
        NormalizedText exact = NormalizedText.of(page.text(), false);
        NormalizedText folded = NormalizedText.of(page.text(), true);

        List<Hit> hits = new ArrayList<>();
        int suppressed = 0;
        for (CompiledTerm term : catalog.compiled()) {
            List<Hit> candidates = switch (term.definition().mode()) {
                case EXACT -> substringHits(documentId, page, exact, term, catalog);
                case CASE_INSENSITIVE -> substringHits(documentId, page, folded, term, catalog);
                case FUZZY -> fuzzyHits(documentId, page, folded, term, catalog);
                case REGEX -> patternHits(documentId, page, folded, term, catalog);
            };
            for (Hit hit : strongest(candidates)) {
                if (hit.confidence() >= term.threshold()) {
                    hits.add(hit);
                } else {
                    suppressed++;
                }
            }
        }
        return new MatchOutcome(hits, suppressed);
    }

    private List<Hit> substringHits(String documentId, CanonicalText page, NormalizedText text, CompiledTerm term,
            TermCatalog catalog) {
        List<Hit> hits = new ArrayList<>();
        String haystack = text.text();
        int from = haystack.indexOf(term.needle());
        while (from >= 0) {
            int to = from + term.needle().length();
            if (!term.wholeWord() || atWordBoundary(text, from, to)) {
                hits.add(hit(documentId, page, text, from, to, term, 1.0, catalog));
            }
            from = haystack.indexOf(term.needle(), from + 1);
        }
        return hits;
    }

    private List<Hit> fuzzyHits(String documentId, CanonicalText page, NormalizedText text, CompiledTerm term,
            TermCatalog catalog) {
        List<int[]> tokens = tokenBounds(text.text());
        List<Hit> hits = new ArrayList<>();
        int width = Math.max(1, term.tokenCount());
        for (int i = 0; i + width <= tokens.size(); i++) {
            int from = tokens.get(i)[0];
            int to = tokens.get(i + width - 1)[1];
            while (from < to && !text.isWordChar(from)) {
                from++;
            }
            while (to > from && !text.isWordChar(to - 1)) {
                to--;
            }
            if (from == to) {
                continue;
            }
            int distance = EditDistance.between(text.text().substring(from, to), term.needle());
            if (distance <= term.maxDistance()) {
                double certainty = 1.0 - (double) distance / (term.maxDistance() + 1);
                hits.add(hit(documentId, page, text, from, to, term, certainty, catalog));
            }
        }
        return hits;
    }

    private List<Hit> patternHits(String documentId, CanonicalText page, NormalizedText text, CompiledTerm term,
            TermCatalog catalog) {
        List<Hit> hits = new ArrayList<>();
        Matcher matcher = term.pattern().matcher(text.text());
        while (matcher.find()) {
            if (matcher.end() > matcher.start()) {
                hits.add(hit(documentId, page, text, matcher.start(), matcher.end(), term,
                        term.definition().certainty(), catalog));
            }
        }
        return hits;
    }

    private Hit hit(String documentId, CanonicalText page, NormalizedText text, int from, int to, CompiledTerm term,
            double certainty, TermCatalog catalog) {
        int start = text.sourceStart(from);
        int end = text.sourceEnd(to);
        double confidence = page.confidenceOver(start, end) * certainty;
        return new Hit(documentId, page.pageIndex(), term.definition().term(), term.definition().category(),
                term.definition().mode(), start, end, page.text().substring(start, end), confidence,
                context(page.text(), start, end, catalog.contextChars()));
    }

    /**
     * Keeps, among hits of one term that overlap each other, only the most confident one. Ties go
     * to the earlier hit.
     */
    static List<Hit> strongest(List<Hit> candidates) {
        if (candidates.size() < 2) {
            return candidates;
        }
        List<Hit> ordered = new ArrayList<>(candidates);
        ordered.sort(Comparator.comparingDouble(Hit::confidence).reversed().thenComparingInt(Hit::start));
        List<Hit> kept = new ArrayList<>();
        for (Hit candidate : ordered) {
            if (kept.stream().noneMatch(candidate::overlaps)) {
                kept.add(candidate);
            }
        }
        kept.sort(Comparator.comparingInt(Hit::start));
        return kept;
    }

    static String context(String text, int start, int end, int radius) {
        int from = Math.max(0, start - radius);
        int to = Math.min(text.length(), end + radius);
        StringBuilder context = new StringBuilder();
        if (from > 0) {
            context.append(ELLIPSIS);
        }
        context.append(text, from, to);
        if (to < text.length()) {
            context.append(ELLIPSIS);
        }
        return context.toString();
    }

    private static boolean atWordBoundary(NormalizedText text, int from, int to) {
        return !text.isWordChar(from - 1) && !text.isWordChar(to);
    }

    private static List<int[]> tokenBounds(String text) {
        List<int[]> bounds = new ArrayList<>();
        int start = -1;
        for (int i = 0; i <= text.length(); i++) {
            boolean space = i == text.length() || text.charAt(i) == ' ';
            if (space && start >= 0) {
                bounds.add(new int[] {start, i});
                start = -1;
            } else if (!space && start < 0) {
                start = i;
            }
        }
        return bounds;
    }
}
