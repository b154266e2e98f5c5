package com.mobifone.updatecenter.repository;

import com.mobifone.updatecenter.entity.BatchRequest;
import com.mobifone.updatecenter.entity.enumeration.BatchState;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;


@Repository
public interface BatchRequestRepository extends JpaRepository<BatchRequest, String> {

    // history: everything except drafts, optional state filter, newest first
    @Query("""
    select b from BatchRequest b
    where b.state <> :excluded
      and ( :state is null or b.state = :state )
    order by b.createdDate desc
    """)
    Page<BatchRequest> searchHistory(@Param("excluded") BatchState excluded,
                                     @Param("state") BatchState state,
                                     Pageable pageable);
}
