package com.example.backup.domain.model;

import lombok.Getter;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * RPO/RTO 스냅샷 (불변, 전체 단위로 교체)
 */
@Getter
public class ComplianceSnapshot {

    private final Instant computedAt;
    private final Map<String, StoreCompliance> stores;

    public ComplianceSnapshot(Instant computedAt, Map<String, StoreCompliance> stores) {
        this.computedAt = computedAt;
        this.stores = Collections.unmodifiableMap(new LinkedHashMap<>(stores));
    }

    public static ComplianceSnapshot empty(Instant at) {
        return new ComplianceSnapshot(at, Map.of());
    }

    public List<StoreCompliance> forTier(StorageTier tier) {
        return stores.values().stream()
                .filter(s -> s.getTier() == tier)
                .collect(Collectors.toList());
    }

    public ComplianceLevel getOverallLevel() {
        ComplianceLevel level = ComplianceLevel.OK;
        for (StoreCompliance store : stores.values()) {
            level = level.worst(store.getLevel());
        }
        return level;
    }
}
