package com.dayloop.timeline.dto;

import com.dayloop.timeline.util.Durations;

import java.time.Duration;
import java.util.List;

public record ReprocessSummary(int totalBatches, int processed, Duration totalTime, List<BatchTiming> timings) {

    public record BatchTiming(long batchId, String status, Duration elapsed) {
    }

    public static ReprocessSummary empty() {
        return new ReprocessSummary(0, 0, Duration.ZERO, List.of());
    }

    public Duration averageTime() {
        if (timings.isEmpty()) {
            return Duration.ZERO;
        }
        return timings.stream().map(BatchTiming::elapsed).reduce(Duration.ZERO, Duration::plus)
                .dividedBy(timings.size());
    }

    public String render() {
        StringBuilder sb = new StringBuilder();
        sb.append("Reprocessing complete\n");
        sb.append("Total batches: ").append(totalBatches).append('\n');
        sb.append("Successfully processed: ").append(processed).append('\n');
        sb.append("Total time: ").append(Durations.humanize(totalTime)).append('\n');
        if (!timings.isEmpty()) {
            sb.append("Batch timings:\n");
            for (int i = 0; i < timings.size(); i++) {
                BatchTiming t = timings.get(i);
                sb.append("  Batch ").append(i + 1).append(" (#").append(t.batchId()).append(", ")
                        .append(t.status()).append("): ").append(Durations.humanize(t.elapsed())).append('\n');
            }
            sb.append("Average per batch: ").append(Durations.humanize(averageTime()));
        }
        return sb.toString().trim();
    }
}
