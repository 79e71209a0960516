package com.example.backup.application.service;

import com.example.backup.config.BackupProperties;
import com.example.backup.domain.entity.BackupArtifact;
import com.example.backup.domain.entity.LogSegment;
import com.example.backup.domain.entity.RestoreRun;
import com.example.backup.domain.event.BackupEvent;
import com.example.backup.domain.model.ArtifactType;
import com.example.backup.domain.model.ComplianceLevel;
import com.example.backup.domain.model.ComplianceSnapshot;
import com.example.backup.domain.model.RestoreState;
import com.example.backup.domain.model.SegmentStatus;
import com.example.backup.domain.model.StorageTier;
import com.example.backup.domain.model.StoreCompliance;
import com.example.backup.domain.model.TrustState;
import com.example.backup.infrastructure.messaging.NotificationDispatcher;
import com.example.backup.infrastructure.monitoring.BackupMetricsService;
import com.example.backup.infrastructure.persistence.BackupCatalog;
import com.example.backup.infrastructure.lock.LocalStoreLockService;
import com.example.backup.infrastructure.store.InMemoryStoreInstanceFactory;
import com.example.backup.infrastructure.store.StoreRegistry;
import com.example.backup.infrastructure.transport.ArchiveTransport;
import com.example.backup.infrastructure.transport.StorageUsage;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class ComplianceMonitorTest {

    private static final Instant NOW = Instant.parse("2024-06-01T12:00:00Z");

    private BackupCatalog catalog;
    private NotificationDispatcher dispatcher;
    private ComplianceMonitor monitor;

    @BeforeEach
    void setUp() {
        catalog = mock(BackupCatalog.class);
        dispatcher = mock(NotificationDispatcher.class);
        ArchiveTransport transport = mock(ArchiveTransport.class);
        when(transport.usage()).thenReturn(new StorageUsage(1024, 4096, 3));

        BackupProperties properties = new BackupProperties();
        BackupProperties.Store primary = new BackupProperties.Store();
        primary.setTier(StorageTier.IMPORTANT); // RPO 15m, RTO 1h
        properties.getStores().put("primary", primary);

        Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
        StoreRegistry registry = new StoreRegistry(new InMemoryStoreInstanceFactory(clock), properties, new LocalStoreLockService());
        monitor = new ComplianceMonitor(catalog, registry, transport, dispatcher,
                mock(BackupMetricsService.class), properties, clock);

        // 100MB 전체 백업 -> 50MB/s 외삽 2초 x 1.5
        when(catalog.newestPassedFull("primary")).thenReturn(Optional.of(passedFull(NOW.minus(Duration.ofHours(2)))));
    }

    @Test
    @DisplayName("RPO 목표 15분에 마지막 세그먼트가 20분 전이면 정상이 아니다 (WARNING)")
    void rpoBeyondTargetIsNotOk() {
        archivedSegmentAgo(Duration.ofMinutes(20));

        StoreCompliance store = monitor.compute().getStores().get("primary");

        assertEquals(Duration.ofMinutes(20), store.getRpo());
        assertEquals(Duration.ofMinutes(15), store.getRpoTarget());
        assertEquals(ComplianceLevel.WARNING, store.getRpoLevel());
        assertNotEquals(ComplianceLevel.OK, store.getLevel());
    }

    @Test
    @DisplayName("목표의 1.5배 이상 지나면 CRITICAL")
    void rpoFarBeyondTargetIsCritical() {
        archivedSegmentAgo(Duration.ofMinutes(25));

        assertEquals(ComplianceLevel.CRITICAL, monitor.compute().getStores().get("primary").getRpoLevel());
    }

    @Test
    @DisplayName("세그먼트와 백업이 모두 없으면 RPO 측정 불가로 CRITICAL")
    void noDataIsCritical() {
        StoreCompliance store = monitor.compute().getStores().get("primary");

        assertNull(store.getRpo());
        assertEquals(ComplianceLevel.CRITICAL, store.getRpoLevel());
    }

    @Test
    @DisplayName("세그먼트와 PASSED 백업 중 더 최근 것을 RPO 기준으로 삼는다")
    void freshestOfSegmentAndBackupWins() {
        archivedSegmentAgo(Duration.ofMinutes(40));
        when(catalog.newestPassedArtifact("primary")).thenReturn(Optional.of(passedFull(NOW.minus(Duration.ofMinutes(5)))));

        StoreCompliance store = monitor.compute().getStores().get("primary");

        assertEquals(Duration.ofMinutes(5), store.getRpo());
        assertEquals(ComplianceLevel.OK, store.getRpoLevel());
    }

    @Test
    @DisplayName("RTO = 마지막 승격 복구 시간 x 안전 계수")
    void rtoUsesMeasuredRestoreTimesSafetyFactor() {
        archivedSegmentAgo(Duration.ofMinutes(1));
        RestoreRun run = RestoreRun.builder()
                .runId("RST-1")
                .storeName("primary")
                .state(RestoreState.PROMOTED)
                .startedAt(NOW.minus(Duration.ofMinutes(50)))
                .finishedAt(NOW.minus(Duration.ofMinutes(10)))
                .durationMs(Duration.ofMinutes(40).toMillis())
                .build();
        when(catalog.lastPromotedRun("primary")).thenReturn(Optional.of(run));

        StoreCompliance store = monitor.compute().getStores().get("primary");

        assertEquals(Duration.ofMinutes(40), store.getLastMeasuredRestore());
        assertEquals(Duration.ofMinutes(60), store.getRto());
        assertEquals(ComplianceLevel.WARNING, store.getRtoLevel());
    }

    @Test
    @DisplayName("복구 가능한 백업도 측정값도 없으면 RTO CRITICAL")
    void noRestorableBackupIsRtoCritical() {
        when(catalog.newestPassedFull("primary")).thenReturn(Optional.empty());
        archivedSegmentAgo(Duration.ofMinutes(1));

        StoreCompliance store = monitor.compute().getStores().get("primary");

        assertNull(store.getRto());
        assertEquals(ComplianceLevel.CRITICAL, store.getRtoLevel());
    }

    @Test
    @DisplayName("위반 중에는 매 틱 알림, 목표 이내로 돌아오면 RESOLVED")
    void breachAlertsRepeatAndResolve() {
        archivedSegmentAgo(Duration.ofMinutes(20));
        monitor.tick();
        monitor.tick();

        archivedSegmentAgo(Duration.ofMinutes(2));
        ComplianceSnapshot recovered = monitor.tick();
        monitor.tick();

        ArgumentCaptor<BackupEvent> events = ArgumentCaptor.forClass(BackupEvent.class);
        verify(dispatcher, atLeastOnce()).dispatch(events.capture());
        List<BackupEvent.Severity> rpoAlerts = events.getAllValues().stream()
                .filter(e -> BackupEvent.RPO_BREACH.equals(e.getEventType()))
                .map(BackupEvent::getSeverity)
                .collect(Collectors.toList());
        assertEquals(List.of(BackupEvent.Severity.WARNING, BackupEvent.Severity.WARNING, BackupEvent.Severity.RESOLVED),
                rpoAlerts);
        assertEquals(ComplianceLevel.OK, recovered.getOverallLevel());
        assertSame(recovered.getStores().get("primary").getRpoLevel(), monitor.current().getStores().get("primary").getRpoLevel());
    }

    @Test
    @DisplayName("tier 필터 보고서는 해당 tier 스토어만 담고 알림을 보내지 않는다")
    void reportFiltersByTier() {
        archivedSegmentAgo(Duration.ofMinutes(30));

        ComplianceSnapshot important = monitor.report(StorageTier.IMPORTANT);
        ComplianceSnapshot critical = monitor.report(StorageTier.CRITICAL);

        assertEquals(1, important.getStores().size());
        assertTrue(critical.getStores().isEmpty());
        assertEquals(ComplianceLevel.OK, critical.getOverallLevel());
        verify(dispatcher, never()).dispatch(any());
    }

    private void archivedSegmentAgo(Duration age) {
        Instant producedAt = NOW.minus(age);
        LogSegment segment = LogSegment.builder()
                .segmentId("primary:42")
                .storeName("primary")
                .sequenceId(42L)
                .producedAt(producedAt)
                .archivedAt(producedAt)
                .status(SegmentStatus.ARCHIVED)
                .build();
        when(catalog.freshestArchivedSegment("primary")).thenReturn(Optional.of(segment));
    }

    private static BackupArtifact passedFull(Instant startedAt) {
        return BackupArtifact.builder()
                .artifactId("primary_full_x")
                .storeName("primary")
                .artifactType(ArtifactType.FULL)
                .startedAt(startedAt)
                .completedAt(startedAt.plusSeconds(5))
                .sizeBytes(100L * 1024 * 1024)
                .checksum("c")
                .consistencyMarker(10L)
                .baseMarker(0L)
                .trustState(TrustState.PASSED)
                .location("backups/primary/primary_full_x.backup.gz")
                .build();
    }
}
