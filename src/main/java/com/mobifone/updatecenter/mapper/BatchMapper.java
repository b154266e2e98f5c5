package com.mobifone.updatecenter.mapper;

import com.mobifone.updatecenter.dto.response.ActivityEntryResponse;
import com.mobifone.updatecenter.dto.response.BatchItemResponse;
import com.mobifone.updatecenter.dto.response.BatchRequestResponse;
import com.mobifone.updatecenter.entity.ActivityLogEntry;
import com.mobifone.updatecenter.entity.BatchItem;
import com.mobifone.updatecenter.entity.BatchRequest;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;

import java.util.List;

@Mapper(componentModel = "spring")
public interface BatchMapper {
    BatchRequestResponse toBatchRequestResponse(BatchRequest entity);

    BatchItemResponse toBatchItemResponse(BatchItem entity);

    List<BatchItemResponse> toBatchItemResponses(List<BatchItem> entities);

    @Mapping(target = "relativeTime", ignore = true)
    ActivityEntryResponse toActivityEntryResponse(ActivityLogEntry entity);

    List<ActivityEntryResponse> toActivityEntryResponses(List<ActivityLogEntry> entities);
}
