package com.dayloop.timeline.dto;

import java.util.List;

public record ReprocessJobStatus(String jobId, String target, boolean done, String error,
                                 List<String> progress, ReprocessSummary summary) {
}
