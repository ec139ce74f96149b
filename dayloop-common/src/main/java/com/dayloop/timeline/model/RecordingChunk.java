package com.dayloop.timeline.model;

import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;

@Entity
@Data
@NoArgsConstructor
@Table(name = "chunks", indexes = @Index(name = "idx_chunks_start_ts", columnList = "start_ts"))
public class RecordingChunk {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "start_ts", nullable = false)
    private long startTs; // unix seconds

    @Column(name = "end_ts", nullable = false)
    private long endTs;

    @Column(name = "file_path", nullable = false)
    private String filePath;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private ChunkStatus status = ChunkStatus.RECORDING;

    private boolean uploaded;

    public RecordingChunk(long startTs, long endTs, String filePath, ChunkStatus status) {
        this.startTs = startTs;
        this.endTs = endTs;
        this.filePath = filePath;
        this.status = status;
    }

    public long getDurationSeconds() {
        return Math.max(0, endTs - startTs);
    }

    public enum ChunkStatus {
        RECORDING,
        COMPLETED,
        FAILED
    }
}
