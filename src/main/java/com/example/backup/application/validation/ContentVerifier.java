package com.example.backup.application.validation;

import com.example.backup.config.BackupProperties;
import com.example.backup.infrastructure.store.StoreInstance;
import com.example.backup.infrastructure.store.StoreRegistry;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * 복원된 인스턴스의 내용 검증
 *
 * - 기대 레코드 수와 정확히 일치해야 함 (실패)
 * - 중요 컬렉션은 존재하고 비어있지 않아야 함 (실패)
 * - 라이브 스토어와의 수 차이가 허용 오차를 넘으면 경고만 기록 (라이브는 백업 이후 변했을 수 있음)
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ContentVerifier {

    private final BackupProperties properties;
    private final StoreRegistry storeRegistry;

    @Getter
    public static class Outcome {
        private final List<String> problems = new ArrayList<>();
        private final List<String> warnings = new ArrayList<>();

        public boolean isClean() {
            return problems.isEmpty();
        }
    }

    /**
     * @param expectedCounts null 이면 수 일치 검사 생략
     */
    public Outcome verify(String storeName, StoreInstance restored, Map<String, Long> expectedCounts,
                          boolean compareLive) {
        Outcome outcome = new Outcome();
        Map<String, Long> restoredCounts = restored.collectionCounts();

        if (expectedCounts != null) {
            Set<String> names = new TreeSet<>(expectedCounts.keySet());
            names.addAll(restoredCounts.keySet());
            for (String name : names) {
                long expected = expectedCounts.getOrDefault(name, 0L);
                long actual = restoredCounts.getOrDefault(name, 0L);
                if (expected != actual) {
                    outcome.problems.add(String.format("collection %s restored %d records, expected %d",
                            name, actual, expected));
                }
            }
        }

        for (String critical : properties.storeConfig(storeName).getCriticalCollections()) {
            Long count = restoredCounts.get(critical);
            if (count == null) {
                outcome.problems.add("critical collection " + critical + " is missing");
            } else if (count == 0) {
                outcome.problems.add("critical collection " + critical + " is empty");
            }
        }

        if (compareLive && properties.getValidation().isLiveComparisonEnabled()
                && storeRegistry.storeNames().contains(storeName)) {
            compareWithLive(storeName, restoredCounts, outcome);
        }
        return outcome;
    }

    private void compareWithLive(String storeName, Map<String, Long> restoredCounts, Outcome outcome) {
        Map<String, Long> liveCounts = storeRegistry.get(storeName).collectionCounts();
        for (Map.Entry<String, Long> entry : restoredCounts.entrySet()) {
            Long live = liveCounts.get(entry.getKey());
            if (live == null) {
                continue;
            }
            long restored = entry.getValue();
            double deviation = Math.abs(live - restored) * 100.0 / Math.max(restored, 1L);
            double tolerance = properties.toleranceFor(storeName, entry.getKey());
            if (deviation > tolerance) {
                String warning = String.format("collection %s differs from live by %.1f%% (restored %d, live %d, tolerance %.1f%%)",
                        entry.getKey(), deviation, restored, live, tolerance);
                outcome.warnings.add(warning);
                log.warn("⚠️ {}: {}", storeName, warning);
            }
        }
    }
}
