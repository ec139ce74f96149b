package com.dayloop.timeline.model;

import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Entity
@Data
@NoArgsConstructor
@Table(name = "observations", indexes = {
        @Index(name = "idx_observations_batch", columnList = "batch_id"),
        @Index(name = "idx_observations_start_ts", columnList = "start_ts")
})
public class Observation {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "batch_id", nullable = false)
    private Long batchId;

    @Column(name = "start_ts", nullable = false)
    private long startTs;

    @Column(name = "end_ts", nullable = false)
    private long endTs;

    @Column(columnDefinition = "TEXT", nullable = false)
    private String observation;

    @Column(columnDefinition = "TEXT")
    private String metadata;

    @Column(name = "llm_model")
    private String llmModel;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    public Observation(Long batchId, long startTs, long endTs, String observation, String llmModel) {
        this.batchId = batchId;
        this.startTs = startTs;
        this.endTs = endTs;
        this.observation = observation;
        this.llmModel = llmModel;
    }

    @PrePersist
    void onCreate() {
        if (createdAt == null) {
            createdAt = Instant.now();
        }
    }
}
