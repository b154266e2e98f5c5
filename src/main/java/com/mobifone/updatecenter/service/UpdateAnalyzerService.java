package com.mobifone.updatecenter.service;

import com.mobifone.updatecenter.client.PackageInventoryClient;
import com.mobifone.updatecenter.configuration.AnalyzerProperties;
import com.mobifone.updatecenter.dto.response.DependencyAnalysisResponse;
import com.mobifone.updatecenter.dto.response.PackageCandidate;
import com.mobifone.updatecenter.dto.response.UpdateSummaryResponse;
import com.mobifone.updatecenter.entity.enumeration.RiskLevel;
import com.mobifone.updatecenter.entity.enumeration.UpdateLevel;
import com.mobifone.updatecenter.exception.AppException;
import com.mobifone.updatecenter.exception.ErrorCode;
import com.mobifone.updatecenter.utils.VersionComparator;
import lombok.AccessLevel;
import lombok.RequiredArgsConstructor;
import lombok.experimental.FieldDefaults;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.*;

@Service
@RequiredArgsConstructor
@Slf4j
@FieldDefaults(level = AccessLevel.PRIVATE, makeFinal = true)
public class UpdateAnalyzerService {

    PackageInventoryClient inventory;
    AnalyzerProperties properties;

    public Optional<UpdateLevel> getUpdateLevel(String fromVersion, String toVersion) {
        return VersionComparator.classify(fromVersion, toVersion);
    }

    public RiskLevel assessRisk(String packageId, UpdateLevel level) {
        int score = riskScore(level,
                inventory.dependenciesOf(packageId).size(),
                inventory.hasCustomizations(packageId));
        return properties.band(score);
    }

    public RiskLevel assessRisk(PackageCandidate candidate, UpdateLevel level) {
        return properties.band(riskScore(candidate, level));
    }

    public int riskScore(PackageCandidate candidate, UpdateLevel level) {
        int deps = candidate.getDependencies() == null ? 0 : candidate.getDependencies().size();
        return riskScore(level, deps, candidate.isHasCustomizations());
    }

    private int riskScore(UpdateLevel level, int dependencyCount, boolean customized) {
        int score = properties.weightOf(level);
        score += dependencyCount * properties.getPerDependencyWeight();
        if (customized) {
            score += properties.getCustomizationWeight();
        }
        return score;
    }

    /**
     * Orders the candidates so that every package comes after its in-set prerequisites.
     * <p>
     * Cycles do not abort the walk: each back edge is reported in {@code conflicts} and the
     * result is still a total order of the (de-duplicated) candidate set. Prerequisites outside
     * the set are reported as warnings only.
     */
    public DependencyAnalysisResponse analyzeDependencies(List<String> candidateIds) {
        List<String> ids = normalize(candidateIds);
        if (ids.isEmpty()) {
            throw new AppException(ErrorCode.EMPTY_CANDIDATE_SET);
        }

        Map<String, List<String>> dependencyMap = new LinkedHashMap<>();
        for (String id : ids) {
            List<String> deps = inventory.dependenciesOf(id);
            dependencyMap.put(id, deps == null ? List.of() : List.copyOf(deps));
        }

        Set<String> inSet = new HashSet<>(ids);
        TopologicalWalk walk = new TopologicalWalk(inSet, dependencyMap);
        for (String id : ids) {
            walk.visit(id);
        }

        List<String> warnings = new ArrayList<>();
        for (String id : ids) {
            for (String dep : dependencyMap.get(id)) {
                if (!inSet.contains(dep)) {
                    warnings.add(inventory.displayName(id) + " depends on " + inventory.displayName(dep)
                            + " which is not in this batch. Ensure it is already up to date.");
                }
            }
        }

        if (!walk.conflicts.isEmpty()) {
            log.warn("Dependency cycles among {} candidate(s): {}", ids.size(), walk.conflicts);
        }
        return DependencyAnalysisResponse.builder()
                .order(walk.order)
                .warnings(warnings)
                .conflicts(new ArrayList<>(walk.conflicts))
                .dependencyMap(dependencyMap)
                .build();
    }

    public UpdateSummaryResponse getUpdateSummary() {
        Map<UpdateLevel, Integer> byLevel = new EnumMap<>(UpdateLevel.class);
        Map<RiskLevel, Integer> riskBreakdown = new EnumMap<>(RiskLevel.class);
        for (RiskLevel r : RiskLevel.values()) riskBreakdown.put(r, 0);
        Map<String, Integer> byVendor = new TreeMap<>();
        List<UpdateSummaryResponse.AvailableUpdate> rows = new ArrayList<>();

        for (PackageCandidate p : inventory.listAvailableUpdates()) {
            Optional<UpdateLevel> level = getUpdateLevel(p.getInstalledVersion(), p.getAvailableVersion());
            if (level.isEmpty()) continue;

            int score = riskScore(p, level.get());
            RiskLevel risk = properties.band(score);
            String vendor = Optional.ofNullable(p.getVendor()).filter(v -> !v.isBlank()).orElse("Unknown");

            byLevel.merge(level.get(), 1, Integer::sum);
            riskBreakdown.merge(risk, 1, Integer::sum);
            byVendor.merge(vendor, 1, Integer::sum);
            rows.add(UpdateSummaryResponse.AvailableUpdate.builder()
                    .packageId(p.getPackageId())
                    .name(p.getName())
                    .vendor(vendor)
                    .installedVersion(p.getInstalledVersion())
                    .availableVersion(p.getAvailableVersion())
                    .updateLevel(level.get())
                    .riskLevel(risk)
                    .riskScore(score)
                    .build());
        }

        rows.sort(Comparator.comparingInt(UpdateSummaryResponse.AvailableUpdate::getRiskScore).reversed());
        return UpdateSummaryResponse.builder()
                .total(rows.size())
                .major(byLevel.getOrDefault(UpdateLevel.MAJOR, 0))
                .minor(byLevel.getOrDefault(UpdateLevel.MINOR, 0))
                .patch(byLevel.getOrDefault(UpdateLevel.PATCH, 0))
                .byVendor(byVendor)
                .riskBreakdown(riskBreakdown)
                .updates(rows)
                .build();
    }

    private static List<String> normalize(List<String> candidateIds) {
        if (candidateIds == null) return List.of();
        LinkedHashSet<String> unique = new LinkedHashSet<>();
        for (String id : candidateIds) {
            if (id != null && !id.isBlank()) unique.add(id.trim());
        }
        return new ArrayList<>(unique);
    }

    // three-color DFS, post-order emit
    private static final class TopologicalWalk {
        final Set<String> inSet;
        final Map<String, List<String>> deps;
        final Set<String> visiting = new HashSet<>();
        final Set<String> visited = new HashSet<>();
        final List<String> order = new ArrayList<>();
        final Set<String> conflicts = new LinkedHashSet<>();

        TopologicalWalk(Set<String> inSet, Map<String, List<String>> deps) {
            this.inSet = inSet;
            this.deps = deps;
        }

        void visit(String id) {
            if (visiting.contains(id)) {
                conflicts.add("Circular dependency detected involving " + id);
                return;
            }
            if (visited.contains(id)) return;

            visiting.add(id);
            for (String dep : deps.getOrDefault(id, List.of())) {
                if (inSet.contains(dep)) {
                    visit(dep);
                }
            }
            visiting.remove(id);
            visited.add(id);
            order.add(id);
        }
    }
}
