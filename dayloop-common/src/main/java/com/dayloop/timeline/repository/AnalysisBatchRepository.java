package com.dayloop.timeline.repository;

import com.dayloop.timeline.model.AnalysisBatch;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

@Repository
public interface AnalysisBatchRepository extends JpaRepository<AnalysisBatch, Long> {

    List<AnalysisBatch> findAllByOrderByBatchStartTsDesc();

    List<AnalysisBatch> findByStatusOrderByBatchStartTsDesc(AnalysisBatch.BatchStatus status);

    List<AnalysisBatch> findByStatus(AnalysisBatch.BatchStatus status);

    List<AnalysisBatch> findByBatchStartTsGreaterThanEqualAndBatchEndTsLessThanEqualOrderByBatchStartTsAsc(long from, long to);

    List<AnalysisBatch> findByIdInOrderByBatchStartTsAsc(Collection<Long> ids);

    @Query("SELECT b.status FROM AnalysisBatch b WHERE b.id = :id")
    Optional<AnalysisBatch.BatchStatus> findStatusById(@Param("id") Long id);

    @Modifying(clearAutomatically = true)
    @Query("UPDATE AnalysisBatch b SET b.status = :status, b.reason = :reason WHERE b.id = :id")
    int updateStatus(@Param("id") Long id,
                     @Param("status") AnalysisBatch.BatchStatus status,
                     @Param("reason") String reason);

    @Modifying(clearAutomatically = true)
    @Query("UPDATE AnalysisBatch b SET b.status = :status, b.reason = NULL, b.llmMetadata = NULL WHERE b.id IN :ids")
    int resetStatus(@Param("ids") Collection<Long> ids, @Param("status") AnalysisBatch.BatchStatus status);
}
