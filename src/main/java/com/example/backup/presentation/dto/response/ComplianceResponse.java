package com.example.backup.presentation.dto.response;

import com.example.backup.domain.model.ComplianceSnapshot;
import com.example.backup.domain.model.StoreCompliance;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.stream.Collectors;

/**
 * RPO/RTO 보고 (시간 값은 초 단위, 측정 불가 시 null)
 */
@Data
@Builder
@AllArgsConstructor
@NoArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ComplianceResponse {

    private Instant computedAt;
    private String overallLevel;
    private List<StoreEntry> stores;

    @Data
    @Builder
    @AllArgsConstructor
    @NoArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class StoreEntry {
        private String store;
        private String tier;
        private String level;
        private Long rpoSeconds;
        private Long rpoTargetSeconds;
        private String rpoLevel;
        private Long rtoSeconds;
        private Long rtoTargetSeconds;
        private String rtoLevel;
        private Instant newestSegmentAt;
        private Instant newestPassedBackupAt;
    }

    public static ComplianceResponse from(ComplianceSnapshot snapshot) {
        return ComplianceResponse.builder()
                .computedAt(snapshot.getComputedAt())
                .overallLevel(snapshot.getOverallLevel().name())
                .stores(snapshot.getStores().values().stream()
                        .map(ComplianceResponse::entry)
                        .collect(Collectors.toList()))
                .build();
    }

    private static StoreEntry entry(StoreCompliance store) {
        return StoreEntry.builder()
                .store(store.getStoreName())
                .tier(store.getTier().name())
                .level(store.getLevel().name())
                .rpoSeconds(seconds(store.getRpo()))
                .rpoTargetSeconds(seconds(store.getRpoTarget()))
                .rpoLevel(store.getRpoLevel().name())
                .rtoSeconds(seconds(store.getRto()))
                .rtoTargetSeconds(seconds(store.getRtoTarget()))
                .rtoLevel(store.getRtoLevel().name())
                .newestSegmentAt(store.getNewestSegmentAt())
                .newestPassedBackupAt(store.getNewestPassedBackupAt())
                .build();
    }

    private static Long seconds(Duration duration) {
        return duration == null ? null : duration.getSeconds();
    }
}
