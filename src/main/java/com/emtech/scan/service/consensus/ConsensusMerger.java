package com.emtech.scan.service.consensus;

import com.emtech.scan.config.ScanProperties;
import com.emtech.scan.config.ScanProperties.ConsensusProperties;
import com.emtech.scan.exception.EmptyMergeInputException;
import com.emtech.scan.model.CanonicalText;
import com.emtech.scan.model.MergedSpan;
import com.emtech.scan.model.OcrResult;
import com.emtech.scan.model.OcrToken;
import com.emtech.scan.model.Provenance;
import com.emtech.scan.service.consensus.TokenAligner.Column;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Reconciles the two engine outputs of a page into one canonical text.
 *
 * <p>Tokens are aligned by edit distance. Tokens both engines agree on are kept with full
 * confidence. On a disagreement the token with the higher reported confidence wins; when either
 * engine does not report confidence the primary engine wins. Tokens only one engine produced are
 * kept at a reduced confidence. The merge is deterministic and does not depend on argument
 * order: results are always arranged primary engine first.</p>
 */
@Component
public class ConsensusMerger {

    private static final Logger log = LoggerFactory.getLogger(ConsensusMerger.class);

    private final ConsensusProperties properties;
    private final String primaryEngineId;

    @Autowired
    public ConsensusMerger(ScanProperties properties) {
        this(properties.consensus(), properties.ocr().primaryEngine());
    }

    public ConsensusMerger(ConsensusProperties properties, String primaryEngineId) {
        this.properties = properties;
        this.primaryEngineId = primaryEngineId;
    }

    public CanonicalText merge(OcrResult a, OcrResult b) {
        int pageIndex = a != null ? a.pageIndex() : b != null ? b.pageIndex() : -1;
        return merge(pageIndex, a, b);
    }

    /**
     * Merges the results of the two engines for one page. A {@code null} result stands for an
     * engine that was unavailable for the page.
     *
     * @throws EmptyMergeInputException when neither engine produced a single token
     */
    public CanonicalText merge(int pageIndex, OcrResult a, OcrResult b) {
        boolean aEmpty = a == null || a.isEmpty();
        boolean bEmpty = b == null || b.isEmpty();
        if (aEmpty && bEmpty) {
            throw new EmptyMergeInputException(pageIndex);
        }
        if (a == null || b == null) {
            return single(pageIndex, a != null ? a : b);
        }
        if (a.engineId().equals(b.engineId())) {
            throw new IllegalArgumentException("Both results come from engine " + a.engineId());
        }
        OcrResult primary = a;
        OcrResult secondary = b;
        if (isPrimary(b, a)) {
            primary = b;
            secondary = a;
        }
        return consensus(pageIndex, primary, secondary);
    }

    private boolean isPrimary(OcrResult candidate, OcrResult other) {
        if (candidate.engineId().equals(primaryEngineId)) {
            return true;
        }
        if (other.engineId().equals(primaryEngineId)) {
            return false;
        }
        return candidate.engineId().compareTo(other.engineId()) < 0;
    }

    private CanonicalText consensus(int pageIndex, OcrResult primary, OcrResult secondary) {
        List<Column> columns = TokenAligner.align(primary.tokens(), secondary.tokens());
        SpanBuilder builder = new SpanBuilder();
        int agreements = 0;
        int disagreements = 0;
        for (Column column : columns) {
            if (column.isAgreement()) {
                agreements++;
                builder.append(column.first().text(), Provenance.AGREED,
                        Set.of(primary.engineId(), secondary.engineId()), properties.agreementConfidence());
            } else if (column.isPaired()) {
                disagreements++;
                OcrToken first = column.first();
                OcrToken second = column.second();
                if (first.hasConfidence() && second.hasConfidence()) {
                    boolean secondWins = second.confidence() > first.confidence();
                    builder.append(secondWins ? second.text() : first.text(), Provenance.CONFIDENCE_PREFERRED,
                            Set.of(secondWins ? secondary.engineId() : primary.engineId()),
                            properties.disagreementConfidence());
                } else {
                    builder.append(first.text(), Provenance.PRIMARY_PREFERRED, Set.of(primary.engineId()),
                            properties.disagreementConfidence());
                }
            } else if (column.first() != null) {
                builder.append(column.first().text(), Provenance.EXCLUSIVE, Set.of(primary.engineId()),
                        properties.exclusiveConfidence());
            } else {
                builder.append(column.second().text(), Provenance.EXCLUSIVE, Set.of(secondary.engineId()),
                        properties.exclusiveConfidence());
            }
        }
        int paired = agreements + disagreements;
        double mergeConfidence = paired == 0 ? 0.0 : (double) agreements / paired;
        log.debug("Page {} merged: {} aligned pairs, {} agreed, {} disagreed, {} engine-exclusive",
                pageIndex, paired, agreements, disagreements, columns.size() - paired);
        return new CanonicalText(pageIndex, builder.text(), builder.spans(), mergeConfidence);
    }

    private CanonicalText single(int pageIndex, OcrResult result) {
        SpanBuilder builder = new SpanBuilder();
        for (OcrToken token : result.tokens()) {
            double confidence = token.hasConfidence() ? token.confidence() : properties.singleEngineConfidence();
            builder.append(token.text(), Provenance.SINGLE_ENGINE, Set.of(result.engineId()), confidence);
        }
        log.debug("Page {} merged from {} alone ({} tokens)", pageIndex, result.engineId(), result.tokens().size());
        return new CanonicalText(pageIndex, builder.text(), builder.spans(), 0.0);
    }

    private static final class SpanBuilder {

        private final StringBuilder text = new StringBuilder();
        private final List<MergedSpan> spans = new ArrayList<>();

        void append(String token, Provenance provenance, Set<String> engines, double confidence) {
            if (text.length() > 0) {
                text.append(' ');
            }
            int start = text.length();
            text.append(token);
            spans.add(new MergedSpan(start, text.length(), token, provenance, engines, confidence));
        }

        String text() {
            return text.toString();
        }

        List<MergedSpan> spans() {
            return spans;
        }
    }
}
