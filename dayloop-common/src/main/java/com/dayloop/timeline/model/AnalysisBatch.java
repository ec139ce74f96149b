package com.dayloop.timeline.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import jakarta.persistence.*;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.time.Instant;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;

@Entity
@Data
@NoArgsConstructor
@Table(name = "analysis_batches")
public class AnalysisBatch {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "batch_start_ts", nullable = false)
    private long batchStartTs;

    @Column(name = "batch_end_ts", nullable = false)
    private long batchEndTs;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private BatchStatus status = BatchStatus.PENDING;

    @Column(columnDefinition = "TEXT")
    private String reason;

    @Column(name = "llm_metadata", columnDefinition = "TEXT")
    private String llmMetadata;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    // Join rows go with the batch; a joined chunk cannot be deleted (FK restrict).
    @ManyToMany(fetch = FetchType.LAZY)
    @JoinTable(name = "batch_chunks",
            joinColumns = @JoinColumn(name = "batch_id"),
            inverseJoinColumns = @JoinColumn(name = "chunk_id"))
    @OrderBy("startTs ASC")
    @JsonIgnore
    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    private Set<RecordingChunk> chunks = new LinkedHashSet<>();

    @PrePersist
    void onCreate() {
        if (createdAt == null) {
            createdAt = Instant.now();
        }
    }

    public enum BatchStatus {
        PENDING,
        PROCESSING,
        COMPLETED,
        FAILED,
        FAILED_EMPTY,
        SKIPPED_SHORT;

        private static final Set<BatchStatus> TERMINAL = EnumSet.of(COMPLETED, FAILED, FAILED_EMPTY, SKIPPED_SHORT);

        public boolean isTerminal() {
            return TERMINAL.contains(this);
        }

        public String label() {
            return name().toLowerCase(Locale.ROOT);
        }
    }
}
