package com.phillippitts.edgekeeper.service.supervisor;

import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;

class OutputDrainerTest {

    @Test
    void drainsStreamToTheEndOnDaemonThread() throws Exception {
        String output = ("x".repeat(2_000) + "\n").repeat(1_000);
        CountingStream stream = new CountingStream(output.getBytes(StandardCharsets.UTF_8));

        Thread drainer = OutputDrainer.start(stream, "noisy", "stdout");
        drainer.join(5_000);

        assertThat(drainer.isDaemon()).isTrue();
        assertThat(drainer.getName()).isEqualTo("worker-noisy-stdout");
        assertThat(drainer.isAlive()).isFalse();
        assertThat(stream.exhausted).isTrue();
    }

    private static final class CountingStream extends InputStream {
        private final ByteArrayInputStream delegate;
        volatile boolean exhausted;

        CountingStream(byte[] data) {
            this.delegate = new ByteArrayInputStream(data);
        }

        @Override
        public int read() {
            int b = delegate.read();
            exhausted |= b < 0;
            return b;
        }

        @Override
        public int read(byte[] buf, int off, int len) {
            int n = delegate.read(buf, off, len);
            exhausted |= n < 0;
            return n;
        }
    }
}
