package org.nowstart.backtester.datahandler;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.nowstart.backtester.support.Fixtures.FIFTEEN_MINUTES;
import static org.nowstart.backtester.support.Fixtures.START;
import static org.nowstart.backtester.support.Fixtures.candle;

import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.nowstart.backtester.data.exception.BacktestException;
import org.nowstart.backtester.data.exception.ErrorCode;

class DataRangeTest {

    @Test
    void of_countsSlotsForExclusiveAndInclusiveEnd() {
        DataRange exclusive = DataRange.of(START, START.plus(Duration.ofHours(1)), FIFTEEN_MINUTES, false);
        DataRange inclusive = DataRange.of(START, START.plus(Duration.ofHours(1)), FIFTEEN_MINUTES, true);

        assertThat(exclusive.slotCount()).isEqualTo(4);
        assertThat(inclusive.slotCount()).isEqualTo(5);
    }

    @Test
    void of_alignsStartDownToIntervalBoundary() {
        DataRange range = DataRange.of(START.plusSeconds(400), START.plus(Duration.ofHours(1)), FIFTEEN_MINUTES, false);

        assertThat(range.getStart()).isEqualTo(START);
        assertThat(range.slotCount()).isEqualTo(4);
    }

    @Test
    void of_throwsWhenStartNotBeforeEnd() {
        assertThatThrownBy(() -> DataRange.of(START, START, FIFTEEN_MINUTES, false))
                .isInstanceOf(BacktestException.class)
                .extracting("code")
                .isEqualTo(ErrorCode.START_END_UNSET);
    }

    @Test
    void of_throwsWhenIntervalMissing() {
        assertThatThrownBy(() -> DataRange.of(START, START.plusSeconds(60), Duration.ZERO, false))
                .isInstanceOf(BacktestException.class)
                .extracting("code")
                .isEqualTo(ErrorCode.INTERVAL_UNSET);
    }

    @Test
    void markHasData_flagsSlotsAndReportsGaps() {
        DataRange range = DataRange.of(START, START.plus(Duration.ofHours(1)), FIFTEEN_MINUTES, false);

        range.markHasData(List.of(
                candle(START, 1),
                candle(START.plus(Duration.ofMinutes(30)), 1),
                candle(START.plus(Duration.ofMinutes(7)), 1)
        ));

        assertThat(range.hasDataAtTime(START)).isTrue();
        assertThat(range.hasDataAtTime(START.plus(FIFTEEN_MINUTES))).isFalse();
        assertThat(range.hasDataAtTime(START.plus(Duration.ofMinutes(7)))).isFalse();
        assertThat(range.missingSlots()).containsExactly(
                START.plus(FIFTEEN_MINUTES),
                START.plus(Duration.ofMinutes(45))
        );
        assertThat(range.isFullyRetrieved()).isFalse();
    }

    @Test
    void hasDataAtTime_isFalseOutsideRange() {
        DataRange range = DataRange.of(START, START.plus(Duration.ofHours(1)), FIFTEEN_MINUTES, false);
        range.markHasData(List.of(candle(START.plus(Duration.ofHours(1)), 1)));

        assertThat(range.hasDataAtTime(START.plus(Duration.ofHours(1)))).isFalse();
        assertThat(range.hasDataAtTime(START.minus(FIFTEEN_MINUTES))).isFalse();
    }
}
