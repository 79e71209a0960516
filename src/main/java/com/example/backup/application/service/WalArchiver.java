package com.example.backup.application.service;

import com.example.backup.config.BackupProperties;
import com.example.backup.domain.entity.LogSegment;
import com.example.backup.domain.event.BackupEvent;
import com.example.backup.domain.exception.BackupException;
import com.example.backup.domain.exception.CorruptionException;
import com.example.backup.domain.exception.PolicyViolationException;
import com.example.backup.domain.exception.TransientIoException;
import com.example.backup.domain.model.ArchiveResult;
import com.example.backup.domain.model.ContinuityReport;
import com.example.backup.domain.model.SegmentStatus;
import com.example.backup.domain.model.SequenceGap;
import com.example.backup.infrastructure.codec.SegmentPayloadCodec;
import com.example.backup.infrastructure.messaging.NotificationDispatcher;
import com.example.backup.infrastructure.monitoring.BackupMetricsService;
import com.example.backup.infrastructure.persistence.BackupCatalog;
import com.example.backup.infrastructure.store.ProducedSegment;
import com.example.backup.infrastructure.store.StoreRegistry;
import com.example.backup.infrastructure.transport.ArchiveTransport;
import com.example.backup.infrastructure.transport.ArtifactNaming;
import com.example.backup.infrastructure.util.Checksums;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * WAL 아카이버
 *
 * - 스토어가 생성한 세그먼트를 아카이브에 정확히 한 번 기록 (멱등)
 * - 전송 실패는 재시도 후 gap risk 로 승격, 재전송 대기열에 보관
 * - 기존 객체와 체크섬이 다르면 덮어쓰지 않고 Corruption 으로 처리
 * - 연속성 검사로 아카이브된 시퀀스의 누락 구간(gap)을 별도 알림으로 보고
 *
 * 다른 작업과 락을 공유하지 않는다 (append-only).
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class WalArchiver {

    public static final String SEGMENT_CHECKSUM_MISMATCH = "SEGMENT_CHECKSUM_MISMATCH";

    private final ArchiveTransport archiveTransport;
    private final BackupCatalog catalog;
    private final SegmentPayloadCodec segmentCodec;
    private final StoreRegistry storeRegistry;
    private final NotificationDispatcher notificationDispatcher;
    private final BackupMetricsService metricsService;
    private final BackupProperties properties;
    private final Clock clock;

    // 아카이브에 실패한 세그먼트 페이로드 (재전송 대기)
    private final Map<String, PendingSegment> pendingSegments = new ConcurrentHashMap<>();

    @PostConstruct
    public void registerWithStores() {
        storeRegistry.addSegmentListener(this::onSegmentProduced);
        log.info("WAL archiver attached to stores: {}", storeRegistry.storeNames());
    }

    /**
     * 스토어 archive hook. 실패는 카탈로그/알림으로 기록되며 스토어 쓰기를 막지 않는다.
     */
    void onSegmentProduced(ProducedSegment segment) {
        try {
            archive(segment);
        } catch (BackupException e) {
            log.warn("Segment {}:{} not archived ({}), left for continuity tracking",
                    segment.getStoreName(), segment.getSequenceId(), e.getKind());
        }
    }

    public ArchiveResult archive(ProducedSegment segment) {
        return archive(segment.getStoreName(), segment.getSequenceId(), segment.getProducedAt(),
                segmentCodec.encode(segment));
    }

    /**
     * 외부 소스 스토어가 전달한 세그먼트 수신 (페이로드를 디코딩해 식별자 일치 확인)
     */
    public ArchiveResult ingest(String storeName, long sequenceId, byte[] payload) {
        storeRegistry.get(storeName);
        ProducedSegment decoded = segmentCodec.decode(payload);
        if (!storeName.equals(decoded.getStoreName()) || decoded.getSequenceId() != sequenceId) {
            throw new PolicyViolationException(PolicyViolationException.INVALID_REQUEST,
                    String.format("Payload belongs to %s:%d, not %s:%d",
                            decoded.getStoreName(), decoded.getSequenceId(), storeName, sequenceId),
                    Map.of("store", storeName, "sequenceId", sequenceId));
        }
        return archive(storeName, sequenceId, decoded.getProducedAt(), payload);
    }

    /**
     * 세그먼트 아카이브 (멱등)
     *
     * @return ARCHIVED 또는 동일 체크섬 객체가 이미 있으면 ALREADY_ARCHIVED
     * @throws CorruptionException  기존 객체와 체크섬 불일치 (덮어쓰지 않음)
     * @throws TransientIoException 재시도 후에도 전송 실패 (gap risk)
     */
    public ArchiveResult archive(String storeName, long sequenceId, Instant producedAt, byte[] payload) {
        String location = ArtifactNaming.segmentLocation(storeName, sequenceId);
        String checksum = Checksums.sha256(payload);
        String segmentId = LogSegment.idOf(storeName, sequenceId);

        try {
            Optional<String> existingChecksum = existingChecksum(location);
            if (existingChecksum.isPresent()) {
                if (!existingChecksum.get().equals(checksum)) {
                    throw corruption(storeName, sequenceId, location, existingChecksum.get(), checksum);
                }
                LogSegment recorded = recordArchived(storeName, sequenceId, producedAt, location, checksum, payload.length);
                pendingSegments.remove(segmentId);
                metricsService.recordSegmentArchived(storeName, true);
                log.debug("Segment already archived: {} ({})", segmentId, location);
                return toResult(recorded, ArchiveResult.Outcome.ALREADY_ARCHIVED);
            }

            archiveTransport.put(location, payload);
            archiveTransport.put(ArtifactNaming.sidecarOf(location), ArtifactNaming.sidecarContent(checksum, location));

            LogSegment recorded = recordArchived(storeName, sequenceId, producedAt, location, checksum, payload.length);
            pendingSegments.remove(segmentId);
            metricsService.recordSegmentArchived(storeName, false);
            log.debug("Segment archived: {} -> {} ({} bytes)", segmentId, location, payload.length);
            return toResult(recorded, ArchiveResult.Outcome.ARCHIVED);

        } catch (TransientIoException e) {
            recordFailure(storeName, sequenceId, producedAt, e);
            pendingSegments.put(segmentId, new PendingSegment(storeName, sequenceId, producedAt, payload));
            notificationDispatcher.dispatch(new BackupEvent(BackupEvent.WAL_GAP_RISK, BackupEvent.Severity.WARNING,
                    storeName, "Segment " + sequenceId + " could not be archived after retries",
                    Map.of("sequenceId", sequenceId, "error", String.valueOf(e.getMessage()))));
            throw e;
        } catch (BackupException e) {
            metricsService.recordArchiveFailure(storeName, e.getKind().name());
            throw e;
        }
    }

    /**
     * 재전송 대기 세그먼트 재시도
     *
     * @return 이번 호출에서 아카이브된 개수
     */
    public int retryPending() {
        int archived = 0;
        for (PendingSegment pending : new ArrayList<>(pendingSegments.values())) {
            try {
                archive(pending.storeName, pending.sequenceId, pending.producedAt, pending.payload);
                archived++;
            } catch (TransientIoException e) {
                log.warn("Segment {}:{} still not archivable: {}", pending.storeName, pending.sequenceId, e.getMessage());
            } catch (BackupException e) {
                pendingSegments.remove(LogSegment.idOf(pending.storeName, pending.sequenceId));
                log.error("Segment {}:{} dropped from retry queue: {}", pending.storeName, pending.sequenceId, e.toString());
            }
        }
        return archived;
    }

    public int pendingCount() {
        return pendingSegments.size();
    }

    /**
     * 연속성 검사: 가장 오래된 ~ 최신 아카이브 시퀀스 사이의 누락 구간 보고
     * 누락 구간마다 WAL_GAP 알림 발송
     */
    public ContinuityReport scanContinuity(String storeName) {
        storeRegistry.get(storeName);
        List<Long> sequenceIds = catalog.archivedSequenceIds(storeName);

        if (properties.getWal().isVerifyObjects() && !sequenceIds.isEmpty()) {
            Set<Long> present = new HashSet<>();
            for (String location : archiveTransport.list(ArtifactNaming.segmentPrefix(storeName))) {
                long sequence = ArtifactNaming.sequenceOf(location);
                if (sequence >= 0) {
                    present.add(sequence);
                }
            }
            List<Long> verified = new ArrayList<>();
            for (Long id : sequenceIds) {
                if (present.contains(id)) {
                    verified.add(id);
                } else {
                    log.warn("Catalogued segment missing from archive: {}:{}", storeName, id);
                }
            }
            sequenceIds = verified;
        }

        ContinuityReport.ContinuityReportBuilder report = ContinuityReport.builder()
                .storeName(storeName)
                .archivedCount(sequenceIds.size())
                .scannedAt(clock.instant());

        long missing = 0;
        if (!sequenceIds.isEmpty()) {
            report.oldestSequence(sequenceIds.get(0))
                    .newestSequence(sequenceIds.get(sequenceIds.size() - 1));
            long previous = sequenceIds.get(0);
            for (int i = 1; i < sequenceIds.size(); i++) {
                long current = sequenceIds.get(i);
                if (current > previous + 1) {
                    SequenceGap gap = new SequenceGap(previous + 1, current - 1);
                    report.gap(gap);
                    missing += gap.size();
                }
                previous = current;
            }
        }

        ContinuityReport result = report.build();
        metricsService.recordGapCount(storeName, missing);
        for (SequenceGap gap : result.getGaps()) {
            Map<String, Object> payload = new HashMap<>();
            payload.put("missingFrom", gap.getFromSequence());
            payload.put("missingTo", gap.getToSequence());
            payload.put("missingCount", gap.size());
            notificationDispatcher.dispatch(new BackupEvent(BackupEvent.WAL_GAP, BackupEvent.Severity.CRITICAL,
                    storeName, String.format("Archived log has a gap: %d..%d", gap.getFromSequence(), gap.getToSequence()),
                    payload));
            metricsService.recordAlert(BackupEvent.WAL_GAP, BackupEvent.Severity.CRITICAL.name());
        }
        if (!result.isContinuous()) {
            log.warn("WAL continuity broken for {}: gaps={}", storeName, result.getGaps());
        }
        return result;
    }

    private Optional<String> existingChecksum(String location) {
        if (!archiveTransport.exists(location)) {
            return Optional.empty();
        }
        String sidecar = ArtifactNaming.sidecarOf(location);
        if (archiveTransport.exists(sidecar)) {
            return Optional.of(ArtifactNaming.parseSidecar(archiveTransport.get(sidecar)));
        }
        // 사이드카 기록 전에 중단된 경우: 객체에서 직접 계산
        return Optional.of(Checksums.sha256(archiveTransport.get(location)));
    }

    private CorruptionException corruption(String storeName, long sequenceId, String location,
                                           String existing, String incoming) {
        Map<String, Object> context = new HashMap<>();
        context.put("store", storeName);
        context.put("sequenceId", sequenceId);
        context.put("location", location);
        context.put("archivedChecksum", existing);
        context.put("incomingChecksum", incoming);

        log.error("🚨 Segment checksum mismatch, manual intervention required: {}:{} at {}", storeName, sequenceId, location);
        notificationDispatcher.dispatch(new BackupEvent(BackupEvent.WAL_CORRUPTION, BackupEvent.Severity.CRITICAL,
                storeName, "Archived segment " + sequenceId + " differs from the re-delivered segment", context));
        metricsService.recordAlert(BackupEvent.WAL_CORRUPTION, BackupEvent.Severity.CRITICAL.name());
        return new CorruptionException(SEGMENT_CHECKSUM_MISMATCH,
                "Archived segment " + storeName + ":" + sequenceId + " has a different checksum; not overwritten",
                context);
    }

    private LogSegment recordArchived(String storeName, long sequenceId, Instant producedAt,
                                      String location, String checksum, long sizeBytes) {
        LogSegment segment = catalog.findSegment(storeName, sequenceId)
                .orElseGet(() -> LogSegment.builder()
                        .segmentId(LogSegment.idOf(storeName, sequenceId))
                        .storeName(storeName)
                        .sequenceId(sequenceId)
                        .producedAt(producedAt)
                        .build());
        if (segment.isArchived()) {
            return segment;
        }
        segment.setStatus(SegmentStatus.ARCHIVED);
        segment.setArchivedAt(clock.instant());
        segment.setLocation(location);
        segment.setChecksum(checksum);
        segment.setSizeBytes(sizeBytes);
        segment.setAttempts(segment.getAttempts() + 1);
        segment.setLastError(null);
        return catalog.saveSegment(segment);
    }

    private void recordFailure(String storeName, long sequenceId, Instant producedAt, BackupException e) {
        LogSegment segment = catalog.findSegment(storeName, sequenceId)
                .orElseGet(() -> LogSegment.builder()
                        .segmentId(LogSegment.idOf(storeName, sequenceId))
                        .storeName(storeName)
                        .sequenceId(sequenceId)
                        .producedAt(producedAt)
                        .status(SegmentStatus.FAILED)
                        .build());
        if (!segment.isArchived()) {
            segment.setStatus(SegmentStatus.FAILED);
        }
        segment.setAttempts(segment.getAttempts() + properties.getTransport().getMaxAttempts());
        segment.setLastError(truncate(e.getMessage()));
        catalog.saveSegment(segment);
        metricsService.recordArchiveFailure(storeName, e.getKind().name());
        log.error("Segment archive failed after retries: {}:{} - {}", storeName, sequenceId, e.getMessage());
    }

    private ArchiveResult toResult(LogSegment segment, ArchiveResult.Outcome outcome) {
        return ArchiveResult.builder()
                .storeName(segment.getStoreName())
                .sequenceId(segment.getSequenceId())
                .outcome(outcome)
                .location(segment.getLocation())
                .checksum(segment.getChecksum())
                .archivedAt(segment.getArchivedAt())
                .build();
    }

    private static String truncate(String message) {
        if (message == null) {
            return null;
        }
        return message.length() > 1000 ? message.substring(0, 1000) : message;
    }

    private static final class PendingSegment {
        private final String storeName;
        private final long sequenceId;
        private final Instant producedAt;
        private final byte[] payload;

        private PendingSegment(String storeName, long sequenceId, Instant producedAt, byte[] payload) {
            this.storeName = storeName;
            this.sequenceId = sequenceId;
            this.producedAt = producedAt;
            this.payload = payload;
        }
    }
}
