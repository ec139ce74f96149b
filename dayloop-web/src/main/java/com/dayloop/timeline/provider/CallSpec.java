package com.dayloop.timeline.provider;

import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;

public record CallSpec(Long batchId, String callGroupId, int attempt, String operation,
                       HttpMethod method, String url, HttpHeaders headers, Object body) {
}
