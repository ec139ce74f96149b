package com.dayloop.timeline.repository;

import com.dayloop.timeline.model.Observation;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;

@Repository
public interface ObservationRepository extends JpaRepository<Observation, Long> {

    @Query("SELECT o FROM Observation o WHERE o.endTs >= :from AND o.startTs <= :to ORDER BY o.startTs ASC")
    List<Observation> findInRange(@Param("from") long from, @Param("to") long to);

    long countByBatchIdIn(Collection<Long> batchIds);

    @Modifying
    @Query("DELETE FROM Observation o WHERE o.batchId IN :batchIds")
    int deleteByBatchIds(@Param("batchIds") Collection<Long> batchIds);
}
