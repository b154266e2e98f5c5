package com.mobifone.updatecenter.repository;

import com.mobifone.updatecenter.entity.BatchItem;
import com.mobifone.updatecenter.entity.enumeration.ItemState;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

// install order, ties broken by creation order
@Repository
public interface BatchItemRepository extends JpaRepository<BatchItem, String> {
    List<BatchItem> findByBatchRequestIdOrderByInstallOrderAscCreatedAtAsc(String batchRequestId);

    List<BatchItem> findByBatchRequestIdAndStateOrderByInstallOrderAscCreatedAtAsc(String batchRequestId, ItemState state);
}
