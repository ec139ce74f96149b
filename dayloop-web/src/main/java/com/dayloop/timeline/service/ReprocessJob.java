package com.dayloop.timeline.service;

import com.dayloop.timeline.dto.ReprocessJobStatus;
import com.dayloop.timeline.dto.ReprocessSummary;
import lombok.Getter;

import java.util.List;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * A reprocessing request running in the background, with its progress messages.
 */
@Getter
public class ReprocessJob {

    private final String id = UUID.randomUUID().toString();
    private final String target;
    private final List<String> progress = new CopyOnWriteArrayList<>();
    private volatile boolean done;
    private volatile String error;
    private volatile ReprocessSummary summary;

    public ReprocessJob(String target) {
        this.target = target;
    }

    public void addProgress(String message) {
        progress.add(message);
    }

    public void finish(ReprocessSummary summary) {
        this.summary = summary;
        this.done = true;
    }

    public void fail(String error) {
        this.error = error;
        this.done = true;
    }

    public ReprocessJobStatus toStatus() {
        return new ReprocessJobStatus(id, target, done, error, List.copyOf(progress), summary);
    }
}
