package com.phillippitts.edgekeeper.util;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class ProcessTimeoutsTest {

    @Test
    void loopJoinTimeoutAddsGrace() {
        assertThat(ProcessTimeouts.loopJoinTimeout(Duration.ofSeconds(30))).isEqualTo(Duration.ofSeconds(32));
    }

    @Test
    void forcefulShutdownIsShorterThanGraceful() {
        assertThat(ProcessTimeouts.FORCEFUL_SHUTDOWN_TIMEOUT).isLessThan(ProcessTimeouts.GRACEFUL_SHUTDOWN_TIMEOUT);
    }
}
