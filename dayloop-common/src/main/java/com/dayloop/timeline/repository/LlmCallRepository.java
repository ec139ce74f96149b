package com.dayloop.timeline.repository;

import com.dayloop.timeline.model.LlmCall;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface LlmCallRepository extends JpaRepository<LlmCall, Long> {
    List<LlmCall> findByBatchIdOrderByCreatedAtAsc(Long batchId);
}
