package com.mobifone.updatecenter.repository;

import com.mobifone.updatecenter.entity.ActivityLogEntry;
import com.mobifone.updatecenter.entity.enumeration.ActivityType;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.List;

@Repository
public interface ActivityLogRepository extends JpaRepository<ActivityLogEntry, String> {

    @Query("select coalesce(max(a.sequence), 0L) from ActivityLogEntry a where a.batchRequestId = :batchId")
    long findMaxSequence(@Param("batchId") String batchId);

    // feed: newest first, optional lower time bound and type filter
    @Query("""
    select a from ActivityLogEntry a
    where a.batchRequestId = :batchId
      and ( :since is null or a.timestamp > :since )
      and ( :type  is null or a.activityType = :type )
    order by a.sequence desc
    """)
    List<ActivityLogEntry> findFeed(@Param("batchId") String batchId,
                                    @Param("since") LocalDateTime since,
                                    @Param("type") ActivityType type,
                                    Pageable pageable);

    List<ActivityLogEntry> findByBatchRequestIdOrderBySequenceAsc(String batchRequestId);
}
