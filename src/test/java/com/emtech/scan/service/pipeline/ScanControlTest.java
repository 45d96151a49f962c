package com.emtech.scan.service.pipeline;

import static org.assertj.core.api.Assertions.assertThat;

import com.emtech.scan.model.DocumentStage;
import org.junit.jupiter.api.Test;

class ScanControlTest {

    @Test
    void cancellationStampedWithANegativeClockIsStillVisible() {
        ScanControl control = new ScanControl();
        assertThat(control.isCancelled()).isFalse();

        control.cancel(-5_000_000_000L);

        assertThat(control.isCancelled()).isTrue();
        assertThat(control.cancelledAtNanos()).isEqualTo(-5_000_000_000L);
    }

    @Test
    void cancellationAtTheMarkerValueIsStillVisible() {
        ScanControl control = new ScanControl();

        control.cancel(Long.MIN_VALUE);

        assertThat(control.isCancelled()).isTrue();
    }

    @Test
    void firstCancellationStampWins() {
        ScanControl control = new ScanControl();

        control.cancel(10L);
        control.cancel(20L);

        assertThat(control.cancelledAtNanos()).isEqualTo(10L);
    }

    @Test
    void stageOnlyMovesForwardAndStopsAtTerminalStages() {
        ScanControl control = new ScanControl();

        assertThat(control.advance(DocumentStage.AGGREGATED)).isTrue();
        assertThat(control.advance(DocumentStage.RASTERIZING)).isFalse();
        assertThat(control.advance(DocumentStage.REPORTED)).isTrue();
        assertThat(control.advance(DocumentStage.FAILED)).isFalse();
        assertThat(control.stage()).isEqualTo(DocumentStage.REPORTED);
    }
}
