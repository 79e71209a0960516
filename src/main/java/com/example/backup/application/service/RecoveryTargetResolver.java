package com.example.backup.application.service;

import com.example.backup.config.BackupProperties;
import com.example.backup.domain.entity.BackupArtifact;
import com.example.backup.domain.entity.LogSegment;
import com.example.backup.domain.exception.PolicyViolationException;
import com.example.backup.domain.model.RecoveryPlan;
import com.example.backup.domain.model.RecoveryTarget;
import com.example.backup.infrastructure.persistence.BackupCatalog;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 복구 목표 해석
 *
 * 목표를 정확히 하나의 FULL 베이스 (+ 선택적 PASSED 증분 체인)와
 * 재생할 세그먼트 구간 (replayFrom+1 .. targetSequence)으로 결정한다.
 * 베이스 선택은 (marker, 완료 시각, ID) 내림차순 tie-break 로 결정적이다.
 *
 * 세그먼트 목록은 카탈로그에 있는 그대로 반환하며, 누락 구간은 재생 단계에서 Gap 으로 처리된다.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class RecoveryTargetResolver {

    private final BackupCatalog catalog;
    private final BackupProperties properties;

    public RecoveryPlan resolve(String storeName, RecoveryTarget target) {
        List<BackupArtifact> bases = catalog.eligibleFullBases(storeName, properties.getRestore().isAllowUntested());
        Optional<LogSegment> newestArchived = catalog.newestArchivedSegment(storeName);
        long newestSequence = newestArchived.map(LogSegment::getSequenceId).orElse(0L);

        BackupArtifact base;
        long targetSequence;
        switch (target.getKind()) {
            case SEQUENCE: {
                long requested = target.getSequenceId();
                base = bases.stream()
                        .filter(a -> a.getConsistencyMarker() <= requested)
                        .findFirst()
                        .orElseThrow(() -> PolicyViolationException.noSuitableBackup(storeName, target.describe()));
                if (requested > base.getConsistencyMarker() && requested > newestSequence) {
                    throw new PolicyViolationException(PolicyViolationException.TARGET_UNREACHABLE,
                            String.format("Sequence %d is beyond the newest archived segment %d of %s",
                                    requested, newestSequence, storeName),
                            Map.of("store", storeName, "target", target.describe(), "newestArchived", newestSequence));
                }
                targetSequence = requested;
                break;
            }
            case TIMESTAMP: {
                base = bases.stream()
                        .filter(a -> !a.getStartedAt().isAfter(target.getTimestamp()))
                        .findFirst()
                        .orElseThrow(() -> PolicyViolationException.noSuitableBackup(storeName, target.describe()));
                long lastBefore = catalog.lastSegmentAtOrBefore(storeName, target.getTimestamp())
                        .map(LogSegment::getSequenceId)
                        .orElse(0L);
                // 베이스는 startedAt 이전에 생성된 변경만 포함하므로 marker 까지는 항상 목표 이내
                targetSequence = Math.max(lastBefore, base.getConsistencyMarker());
                break;
            }
            default: {
                base = bases.stream()
                        .findFirst()
                        .orElseThrow(() -> PolicyViolationException.noSuitableBackup(storeName, target.describe()));
                targetSequence = Math.max(newestSequence, base.getConsistencyMarker());
            }
        }

        RecoveryPlan.RecoveryPlanBuilder plan = RecoveryPlan.builder()
                .storeName(storeName)
                .target(target)
                .baseArtifact(base)
                .targetSequence(targetSequence);

        long replayFrom = base.getConsistencyMarker();
        if (properties.getRestore().isUseIncrementals()) {
            BackupArtifact cursor = base;
            List<BackupArtifact> incrementals = catalog.passedIncrementals(storeName);
            Optional<BackupArtifact> next;
            while ((next = nextIncremental(incrementals, cursor, targetSequence)).isPresent()) {
                cursor = next.get();
                plan.incremental(cursor);
            }
            replayFrom = cursor.getConsistencyMarker();
        }

        plan.segments(catalog.archivedSegments(storeName, replayFrom + 1, targetSequence));
        RecoveryPlan resolved = plan.build();

        log.info("Recovery target resolved: store={}, target={}, base={} (marker {}), incrementals={}, replay {}..{}",
                storeName, target.describe(), base.getArtifactId(), base.getConsistencyMarker(),
                resolved.getIncrementals().size(), resolved.getReplayFrom() + 1, targetSequence);
        return resolved;
    }

    /**
     * cursor 를 부모로 하는 PASSED 증분 중 목표를 넘지 않는 가장 진행된 것
     */
    private Optional<BackupArtifact> nextIncremental(List<BackupArtifact> incrementals, BackupArtifact cursor,
                                                     long targetSequence) {
        return incrementals.stream()
                .filter(i -> cursor.getArtifactId().equals(i.getParentArtifactId()))
                .filter(i -> i.getConsistencyMarker() <= targetSequence)
                .min(BackupCatalog.NEWEST_FIRST);
    }
}
