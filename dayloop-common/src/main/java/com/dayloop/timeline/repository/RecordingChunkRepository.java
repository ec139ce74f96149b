package com.dayloop.timeline.repository;

import com.dayloop.timeline.model.RecordingChunk;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;

@Repository
public interface RecordingChunkRepository extends JpaRepository<RecordingChunk, Long> {

    @Query("SELECT c FROM RecordingChunk c WHERE c.startTs >= :cutoff AND c.status = :status " +
           "AND NOT EXISTS (SELECT 1 FROM AnalysisBatch b JOIN b.chunks bc WHERE bc.id = c.id) " +
           "ORDER BY c.startTs ASC")
    List<RecordingChunk> findUnbatchedSince(@Param("cutoff") long cutoff,
                                            @Param("status") RecordingChunk.ChunkStatus status);

    // Oldest first, never a chunk that any batch references
    @Query("SELECT c FROM RecordingChunk c WHERE c.status IN :statuses " +
           "AND NOT EXISTS (SELECT 1 FROM AnalysisBatch b JOIN b.chunks bc WHERE bc.id = c.id) " +
           "ORDER BY c.startTs ASC")
    List<RecordingChunk> findEvictionCandidates(@Param("statuses") Collection<RecordingChunk.ChunkStatus> statuses,
                                                Pageable pageable);

    @Query("SELECT c FROM AnalysisBatch b JOIN b.chunks c WHERE b.id = :batchId ORDER BY c.startTs ASC")
    List<RecordingChunk> findByBatchId(@Param("batchId") Long batchId);

    @Query("SELECT c FROM RecordingChunk c WHERE c.status = :status AND c.endTs > :from AND c.startTs < :to " +
           "ORDER BY c.startTs ASC")
    List<RecordingChunk> findOverlapping(@Param("from") long from,
                                         @Param("to") long to,
                                         @Param("status") RecordingChunk.ChunkStatus status);

    @Query("SELECT CASE WHEN COUNT(b) > 0 THEN true ELSE false END FROM AnalysisBatch b JOIN b.chunks c WHERE c.id = :chunkId")
    boolean isReferencedByBatch(@Param("chunkId") Long chunkId);
}
