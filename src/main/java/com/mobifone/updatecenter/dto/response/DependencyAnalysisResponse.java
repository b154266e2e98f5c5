package com.mobifone.updatecenter.dto.response;

import lombok.*;
import lombok.experimental.FieldDefaults;

import java.util.List;
import java.util.Map;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@FieldDefaults(level = AccessLevel.PRIVATE)
public class DependencyAnalysisResponse {
    List<String> order;                       // every candidate exactly once
    List<String> warnings;                    // prerequisites outside the candidate set
    List<String> conflicts;                   // circular dependencies
    Map<String, List<String>> dependencyMap;  // full dependency list per candidate
}
