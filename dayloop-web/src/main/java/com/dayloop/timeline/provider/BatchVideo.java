package com.dayloop.timeline.provider;

import java.nio.file.Path;

public record BatchVideo(Long batchId, Path file, long durationSeconds, long batchStartTs) {
}
