package com.dayloop.timeline.repository;

import com.dayloop.timeline.model.TimelineCard;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;

@Repository
public interface TimelineCardRepository extends JpaRepository<TimelineCard, Long> {

    List<TimelineCard> findByDayOrderByStartTsAsc(String day);

    @Query("SELECT c FROM TimelineCard c WHERE c.startTs < :to AND c.endTs > :from ORDER BY c.startTs ASC")
    List<TimelineCard> findOverlapping(@Param("from") long from, @Param("to") long to);

    @Query("SELECT c FROM TimelineCard c WHERE (c.startTs >= :dayStart AND c.startTs < :dayEnd) OR c.batchId IN :batchIds")
    List<TimelineCard> findForReprocessing(@Param("dayStart") long dayStart,
                                           @Param("dayEnd") long dayEnd,
                                           @Param("batchIds") Collection<Long> batchIds);

    List<TimelineCard> findByStartTsGreaterThanEqualAndStartTsLessThan(long dayStart, long dayEnd);

    List<TimelineCard> findByBatchId(Long batchId);

    @Modifying(clearAutomatically = true)
    @Query("UPDATE TimelineCard c SET c.videoSummaryUrl = :url WHERE c.id = :id")
    int updateVideoSummaryUrl(@Param("id") Long id, @Param("url") String url);

    @Modifying(clearAutomatically = true)
    @Query("UPDATE TimelineCard c SET c.videoSummaryUrl = NULL WHERE c.videoSummaryUrl IN :urls")
    int clearVideoSummaryUrls(@Param("urls") Collection<String> urls);
}
