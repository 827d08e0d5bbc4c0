package org.nowstart.backtester.engine;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Duration;
import org.junit.jupiter.api.Test;

class StopSignalTest {

    @Test
    void await_timesOutWhileRunningAndReturnsOnceTriggered() {
        StopSignal stopSignal = new StopSignal();

        assertThat(stopSignal.await(Duration.ofMillis(5))).isFalse();
        stopSignal.trigger();
        stopSignal.trigger();

        assertThat(stopSignal.isStopped()).isTrue();
        assertThat(stopSignal.await(Duration.ofSeconds(5))).isTrue();
    }

    @Test
    void await_treatsInterruptAsStop() {
        StopSignal stopSignal = new StopSignal();
        Thread.currentThread().interrupt();
        try {
            assertThat(stopSignal.await(Duration.ofSeconds(5))).isTrue();
            assertThat(Thread.currentThread().isInterrupted()).isTrue();
        } finally {
            Thread.interrupted();
        }
    }
}
