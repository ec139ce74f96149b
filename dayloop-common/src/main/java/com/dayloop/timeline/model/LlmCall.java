package com.dayloop.timeline.model;

import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * One provider HTTP attempt. Written once and never updated.
 */
@Entity
@Data
@NoArgsConstructor
@Table(name = "llm_requests", indexes = @Index(name = "idx_llm_requests_batch", columnList = "batch_id"))
public class LlmCall {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "batch_id")
    private Long batchId;

    @Column(name = "call_group_id")
    private String callGroupId;

    private int attempt;

    private String provider;

    private String model;

    private String operation;

    @Enumerated(EnumType.STRING)
    private CallStatus status;

    @Column(name = "latency_ms")
    private Long latencyMs;

    @Column(name = "http_status")
    private Integer httpStatus;

    @Column(name = "request_method")
    private String requestMethod;

    @Column(name = "request_url", columnDefinition = "TEXT")
    private String requestUrl;

    @Column(name = "request_headers", columnDefinition = "TEXT")
    private String requestHeaders;

    @Column(name = "request_payload", columnDefinition = "TEXT")
    private String requestPayload;

    @Column(name = "response_headers", columnDefinition = "TEXT")
    private String responseHeaders;

    @Column(name = "response_payload", columnDefinition = "TEXT")
    private String responsePayload;

    @Column(name = "error_domain")
    private String errorDomain;

    @Column(name = "error_code")
    private Integer errorCode;

    @Column(name = "error_message", columnDefinition = "TEXT")
    private String errorMessage;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @PrePersist
    void onCreate() {
        if (createdAt == null) {
            createdAt = Instant.now();
        }
    }

    public enum CallStatus {
        SUCCESS,
        FAILURE
    }
}
