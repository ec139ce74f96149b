package com.dayloop.timeline.provider;

import com.dayloop.timeline.exception.ProcessingTimeoutException;
import com.dayloop.timeline.exception.ProviderException;
import com.dayloop.timeline.exception.RemoteProcessingFailedException;
import com.dayloop.timeline.provider.FileStatePoller.RemoteFileState;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FileStatePollerTest {

    @Test
    void testReturnsOnceActive() {
        AtomicInteger polls = new AtomicInteger();
        try (FileStatePoller poller = new FileStatePoller(Duration.ofMillis(5), Duration.ofSeconds(5))) {
            assertThatCode(() -> poller.awaitActive("files/a",
                    () -> polls.incrementAndGet() < 3 ? RemoteFileState.PROCESSING : RemoteFileState.ACTIVE))
                    .doesNotThrowAnyException();
        }
        assertThat(polls.get()).isEqualTo(3);
    }

    @Test
    void testTimeoutIsDistinctFromRemoteFailure() {
        try (FileStatePoller poller = new FileStatePoller(Duration.ofMillis(5), Duration.ofMillis(100))) {
            assertThatThrownBy(() -> poller.awaitActive("files/slow", () -> RemoteFileState.PROCESSING))
                    .isInstanceOf(ProcessingTimeoutException.class)
                    .hasMessageContaining("timed out")
                    .hasMessageContaining("files/slow");

            assertThatThrownBy(() -> poller.awaitActive("files/bad", () -> RemoteFileState.FAILED))
                    .isInstanceOf(RemoteProcessingFailedException.class)
                    .isNotInstanceOf(ProcessingTimeoutException.class);
        }
    }

    @Test
    void testHungStateCheckIsBoundedByTimeout() {
        try (FileStatePoller poller = new FileStatePoller(Duration.ofMillis(10), Duration.ofMillis(100))) {
            long started = System.nanoTime();
            assertThatThrownBy(() -> poller.awaitActive("files/hung", () -> {
                try {
                    Thread.sleep(10_000);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                return RemoteFileState.PROCESSING;
            })).isInstanceOf(ProcessingTimeoutException.class);
            assertThat(Duration.ofNanos(System.nanoTime() - started)).isLessThan(Duration.ofSeconds(5));
        }
    }

    @Test
    void testStateCheckErrorPropagates() {
        try (FileStatePoller poller = new FileStatePoller(Duration.ofMillis(5), Duration.ofSeconds(5))) {
            assertThatThrownBy(() -> poller.awaitActive("files/x", () -> {
                throw new ProviderException("HTTP 500 from status endpoint", 500, null);
            })).isInstanceOf(ProviderException.class).hasMessageContaining("HTTP 500");
        }
    }
}
