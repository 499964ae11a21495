package com.phillippitts.edgekeeper.service.supervisor;

import com.phillippitts.edgekeeper.service.supervisor.ProcessSignaller.Signal;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;

import java.io.IOException;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class KillCommandSignallerTest {

    @Test
    void buildsArgvWithoutShell() {
        assertThat(KillCommandSignaller.command(1234, Signal.STOP)).containsExactly("kill", "-STOP", "1234");
        assertThat(KillCommandSignaller.command(1234, Signal.CONT)).containsExactly("kill", "-CONT", "1234");
    }

    @Test
    @EnabledOnOs({OS.LINUX, OS.MAC})
    void stopsAndContinuesRealProcess() throws Exception {
        Process sleeper = new ProcessBuilder("sleep", "30").start();
        try {
            KillCommandSignaller signaller = new KillCommandSignaller();

            signaller.send(sleeper.pid(), Signal.STOP);
            signaller.send(sleeper.pid(), Signal.CONT);

            assertThat(sleeper.isAlive()).isTrue();
        } finally {
            sleeper.destroyForcibly();
            sleeper.waitFor(2, TimeUnit.SECONDS);
        }
    }

    @Test
    @EnabledOnOs({OS.LINUX, OS.MAC})
    void unknownPidFails() {
        KillCommandSignaller signaller = new KillCommandSignaller();

        assertThatThrownBy(() -> signaller.send(999_999_999L, Signal.STOP))
                .isInstanceOf(IOException.class)
                .hasMessageContaining("999999999");
    }
}
