package com.dayloop.timeline.provider;

import com.dayloop.timeline.exception.ProcessingTimeoutException;
import com.dayloop.timeline.exception.ProviderException;
import com.dayloop.timeline.exception.RemoteProcessingFailedException;
import com.dayloop.timeline.util.Durations;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * Waits for an uploaded file to finish remote processing. Polls on a scheduled task at a
 * fixed delay; the task is cancelled as soon as the file is ready, failed, or the deadline
 * passes.
 */
@Slf4j
public class FileStatePoller implements AutoCloseable {

    public enum RemoteFileState {
        PROCESSING,
        ACTIVE,
        FAILED
    }

    private final ScheduledExecutorService scheduler;
    private final Duration interval;
    private final Duration timeout;

    public FileStatePoller(Duration interval, Duration timeout) {
        this.interval = interval;
        this.timeout = timeout;
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "file-state-poller");
            t.setDaemon(true);
            return t;
        });
    }

    public void awaitActive(String fileName, Supplier<RemoteFileState> checkState) {
        CompletableFuture<Void> ready = new CompletableFuture<>();
        long deadline = System.nanoTime() + timeout.toNanos();

        ScheduledFuture<?> task = scheduler.scheduleWithFixedDelay(() -> {
            if (ready.isDone()) {
                return;
            }
            try {
                RemoteFileState state = checkState.get();
                log.debug("File {} state: {}", fileName, state);
                if (state == RemoteFileState.ACTIVE) {
                    ready.complete(null);
                } else if (state == RemoteFileState.FAILED) {
                    ready.completeExceptionally(new RemoteProcessingFailedException("Remote processing failed for " + fileName));
                } else if (System.nanoTime() - deadline >= 0) {
                    ready.completeExceptionally(timeoutError(fileName));
                }
            } catch (RuntimeException e) {
                ready.completeExceptionally(e);
            }
        }, 0, Math.max(1, interval.toMillis()), TimeUnit.MILLISECONDS);

        try {
            // Hard bound in case a state check itself hangs
            ready.get(timeout.toMillis() + interval.toMillis() * 2, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            throw timeoutError(fileName);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof ProviderException) {
                throw (ProviderException) cause;
            }
            throw new ProviderException("Polling " + fileName + " failed: " + cause.getMessage(), cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ProviderException("Interrupted while waiting for " + fileName, e);
        } finally {
            task.cancel(true);
        }
    }

    @Override
    public void close() {
        scheduler.shutdownNow();
    }

    private ProcessingTimeoutException timeoutError(String fileName) {
        return new ProcessingTimeoutException("File processing timed out after " + Durations.humanize(timeout)
                + " waiting for " + fileName);
    }
}
