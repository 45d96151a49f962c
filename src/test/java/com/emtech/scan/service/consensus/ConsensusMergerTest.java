package com.emtech.scan.service.consensus;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.emtech.scan.config.ScanProperties.ConsensusProperties;
import com.emtech.scan.exception.EmptyMergeInputException;
import com.emtech.scan.model.CanonicalText;
import com.emtech.scan.model.MergedSpan;
import com.emtech.scan.model.OcrResult;
import com.emtech.scan.model.OcrToken;
import com.emtech.scan.model.Provenance;
import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ConsensusMergerTest {

    private ConsensusMerger merger;

    @BeforeEach
    void setUp() {
        merger = new ConsensusMerger(ConsensusProperties.defaults(), "tesseract");
    }

    private static OcrResult withConfidence(String engine, Object... textAndConfidence) {
        OcrToken[] tokens = new OcrToken[textAndConfidence.length / 2];
        for (int i = 0; i < tokens.length; i++) {
            tokens[i] = new OcrToken((String) textAndConfidence[2 * i], null, (Double) textAndConfidence[2 * i + 1]);
        }
        return new OcrResult(engine, 0, "", Arrays.asList(tokens));
    }

    @Test
    void agreeingEnginesYieldFullConfidence() {
        OcrResult tesseract = OcrResult.fromText("tesseract", 0, "Quantum computing is here");
        OcrResult gocr = OcrResult.fromText("gocr", 0, "quantum computing is here");

        CanonicalText text = merger.merge(tesseract, gocr);

        assertThat(text.text()).isEqualTo("Quantum computing is here");
        assertThat(text.mergeConfidence()).isEqualTo(1.0);
        assertThat(text.spans()).extracting(MergedSpan::provenance).containsOnly(Provenance.AGREED);
        assertThat(text.spans().get(0).engines()).containsExactlyInAnyOrder("tesseract", "gocr");
    }

    @Test
    void mergeDoesNotDependOnArgumentOrder() {
        OcrResult tesseract = OcrResult.fromText("tesseract", 0, "edge AI accelerators ship");
        OcrResult gocr = OcrResult.fromText("gocr", 0, "edge A1 acce1erators ship today");

        assertThat(merger.merge(tesseract, gocr)).isEqualTo(merger.merge(gocr, tesseract));
    }

    @Test
    void higherReportedConfidenceWinsADisagreement() {
        OcrResult tesseract = withConfidence("tesseract", "advances", 0.9, "in", 0.9, "A1", 0.41);
        OcrResult cuneiform = withConfidence("cuneiform", "advances", 0.8, "in", 0.8, "AI", 0.88);

        CanonicalText text = merger.merge(tesseract, cuneiform);

        assertThat(text.text()).isEqualTo("advances in AI");
        MergedSpan disputed = text.spans().get(2);
        assertThat(disputed.provenance()).isEqualTo(Provenance.CONFIDENCE_PREFERRED);
        assertThat(disputed.engines()).containsExactly("cuneiform");
        assertThat(disputed.confidence()).isEqualTo(0.6);
        assertThat(text.mergeConfidence()).isEqualTo(2.0 / 3.0);
    }

    @Test
    void primaryEngineBreaksTiesWhenConfidenceIsMissingAndDoesSoEveryTime() {
        OcrResult tesseract = withConfidence("tesseract", "advances", 0.9, "in", 0.9, "AI", 0.30);
        OcrResult gocr = OcrResult.fromText("gocr", 0, "advances in A1");

        CanonicalText first = merger.merge(gocr, tesseract);
        for (int run = 0; run < 20; run++) {
            assertThat(merger.merge(gocr, tesseract)).isEqualTo(first);
        }
        assertThat(first.text()).isEqualTo("advances in AI");
        assertThat(first.spans().get(2).provenance()).isEqualTo(Provenance.PRIMARY_PREFERRED);

        ConsensusMerger gocrFirst = new ConsensusMerger(ConsensusProperties.defaults(), "gocr");
        assertThat(gocrFirst.merge(tesseract, gocr).text()).isEqualTo("advances in A1");
    }

    @Test
    void engineExclusiveTokensAreKeptWithLowConfidence() {
        OcrResult tesseract = OcrResult.fromText("tesseract", 0, "quantum computing now");
        OcrResult gocr = OcrResult.fromText("gocr", 0, "new quantum computing");

        CanonicalText text = merger.merge(tesseract, gocr);

        assertThat(text.text()).isEqualTo("new quantum computing now");
        assertThat(text.spans()).extracting(MergedSpan::provenance).containsExactly(
                Provenance.EXCLUSIVE, Provenance.AGREED, Provenance.AGREED, Provenance.EXCLUSIVE);
        assertThat(text.spans().get(0).engines()).containsExactly("gocr");
        assertThat(text.spans().get(3).confidence()).isEqualTo(0.35);
        assertThat(text.mergeConfidence()).isEqualTo(1.0);
    }

    @Test
    void trailingExclusiveTokenDoesNotLowerMergeConfidence() {
        OcrResult tesseract = OcrResult.fromText("tesseract", 0, "quantum computing");
        OcrResult gocr = OcrResult.fromText("gocr", 0, "quantum computing today");

        CanonicalText text = merger.merge(tesseract, gocr);

        assertThat(text.text()).isEqualTo("quantum computing today");
        assertThat(text.spans().get(2).provenance()).isEqualTo(Provenance.EXCLUSIVE);
        assertThat(text.mergeConfidence()).isEqualTo(1.0);
    }

    @Test
    void onlyExclusiveTokensGiveZeroMergeConfidence() {
        CanonicalText text = merger.merge(OcrResult.empty("tesseract", 0), OcrResult.fromText("gocr", 0, "lidar"));

        assertThat(text.mergeConfidence()).isZero();
    }

    @Test
    void spanOffsetsPointIntoTheMergedText() {
        CanonicalText text = merger.merge(
                OcrResult.fromText("tesseract", 0, "solid state batteries"),
                OcrResult.fromText("gocr", 0, "so1id state batteries"));

        for (MergedSpan span : text.spans()) {
            assertThat(text.text().substring(span.start(), span.end())).isEqualTo(span.text());
        }
    }

    @Test
    void singleAvailableEngineIsUsedAlone() {
        OcrResult gocr = OcrResult.fromText("gocr", 4, "neuromorphic chips");

        CanonicalText text = merger.merge(4, null, gocr);

        assertThat(text.pageIndex()).isEqualTo(4);
        assertThat(text.text()).isEqualTo("neuromorphic chips");
        assertThat(text.mergeConfidence()).isZero();
        assertThat(text.spans()).extracting(MergedSpan::provenance).containsOnly(Provenance.SINGLE_ENGINE);
        assertThat(text.spans()).extracting(MergedSpan::confidence).containsOnly(0.6);
    }

    @Test
    void oneEmptyResultLeavesTheOtherAsExclusiveText() {
        CanonicalText text = merger.merge(OcrResult.empty("tesseract", 0), OcrResult.fromText("gocr", 0, "5G"));

        assertThat(text.text()).isEqualTo("5G");
        assertThat(text.spans()).extracting(MergedSpan::provenance).containsExactly(Provenance.EXCLUSIVE);
    }

    @Test
    void bothEmptyIsAnEmptyMergeInput() {
        assertThatThrownBy(() -> merger.merge(OcrResult.empty("tesseract", 1), OcrResult.empty("gocr", 1)))
                .isInstanceOf(EmptyMergeInputException.class);
        assertThatThrownBy(() -> merger.merge(1, null, OcrResult.empty("gocr", 1)))
                .isInstanceOf(EmptyMergeInputException.class);
    }

    @Test
    void alignerPrefersSubstitutionOverGap() {
        List<TokenAligner.Column> columns = TokenAligner.align(
                List.of(OcrToken.of("a"), OcrToken.of("b")),
                List.of(OcrToken.of("a"), OcrToken.of("c")));

        assertThat(columns).hasSize(2);
        assertThat(columns.get(1).isPaired()).isTrue();
        assertThat(columns.get(1).isAgreement()).isFalse();
    }
}
