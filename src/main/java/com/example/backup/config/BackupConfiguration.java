package com.example.backup.config;

import com.example.backup.domain.model.StorageTier;
import com.example.backup.infrastructure.codec.BackupContainerCodec;
import com.example.backup.infrastructure.codec.SegmentPayloadCodec;
import com.example.backup.infrastructure.lock.LocalStoreLockService;
import com.example.backup.infrastructure.lock.RedisStoreLockService;
import com.example.backup.infrastructure.lock.StoreLockService;
import com.example.backup.infrastructure.messaging.KafkaNotificationDispatcher;
import com.example.backup.infrastructure.messaging.LoggingNotificationDispatcher;
import com.example.backup.infrastructure.messaging.NotificationDispatcher;
import com.example.backup.infrastructure.monitoring.BackupMetricsService;
import com.example.backup.infrastructure.monitoring.PrometheusBackupMetricsService;
import com.example.backup.infrastructure.store.InMemoryStoreInstanceFactory;
import com.example.backup.infrastructure.store.StoreInstanceFactory;
import com.example.backup.infrastructure.store.StoreRegistry;
import com.example.backup.infrastructure.transport.ArchiveTransport;
import com.example.backup.infrastructure.transport.FileSystemArchiveTransport;
import com.example.backup.infrastructure.transport.ResilientArchiveTransport;
import com.example.backup.infrastructure.transport.S3ArchiveTransport;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.timelimiter.TimeLimiter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import software.amazon.awssdk.services.s3.S3Client;

import java.nio.file.Paths;
import java.time.Clock;

/**
 * 백업/아카이브/복구 엔진 구성
 *
 * 구성 요소:
 * - ArchiveTransport: filesystem | s3 + Resilience4j 데코레이터
 * - StoreLockService: local | redis
 * - NotificationDispatcher: logging | kafka
 * - BackupMetricsService: Prometheus (Micrometer)
 * - StoreRegistry: 보호 대상 스토어 + 일회용 인스턴스
 */
@Configuration
@RequiredArgsConstructor
@Slf4j
public class BackupConfiguration {

    private final BackupProperties backupProperties;

    @Bean
    @ConditionalOnMissingBean(Clock.class)
    public Clock clock() {
        return Clock.systemUTC();
    }

    // ========================================
    // 스토어 / 코덱
    // ========================================

    @Bean
    @ConditionalOnMissingBean(StoreInstanceFactory.class)
    public StoreInstanceFactory storeInstanceFactory(Clock clock) {
        return new InMemoryStoreInstanceFactory(clock);
    }

    @Bean
    public StoreRegistry storeRegistry(StoreInstanceFactory storeInstanceFactory, StoreLockService storeLockService) {
        return new StoreRegistry(storeInstanceFactory, backupProperties, storeLockService);
    }

    @Bean
    public BackupContainerCodec backupContainerCodec(ObjectMapper objectMapper) {
        return new BackupContainerCodec(objectMapper);
    }

    @Bean
    public SegmentPayloadCodec segmentPayloadCodec(ObjectMapper objectMapper) {
        return new SegmentPayloadCodec(objectMapper);
    }

    // ========================================
    // 아카이브 전송
    // ========================================

    @Bean
    @ConditionalOnMissingBean(ArchiveTransport.class)
    public ArchiveTransport archiveTransport(ObjectProvider<S3Client> s3Client,
                                             Retry archiveRetry,
                                             CircuitBreaker archiveCircuitBreaker,
                                             TimeLimiter archiveTimeLimiter,
                                             @Qualifier("transportExecutor") ThreadPoolTaskExecutor transportExecutor) {
        BackupProperties.Transport transport = backupProperties.getTransport();
        ArchiveTransport backend;
        if ("s3".equalsIgnoreCase(transport.getType())) {
            backend = new S3ArchiveTransport(s3Client.getObject(), transport.getBucket());
        } else {
            backend = new FileSystemArchiveTransport(Paths.get(transport.getRootDirectory()));
        }
        log.info("Initializing Archive Transport: {}", backend.describe());

        return new ResilientArchiveTransport(backend, archiveRetry, archiveCircuitBreaker,
                archiveTimeLimiter, transportExecutor.getThreadPoolExecutor());
    }

    // ========================================
    // 락
    // ========================================

    @Bean
    @ConditionalOnProperty(name = "backup.lock.type", havingValue = "redis")
    public StoreLockService redisStoreLockService(StringRedisTemplate stringRedisTemplate) {
        log.info("Initializing Store Lock Service (Redis)");
        BackupProperties.Lock lock = backupProperties.getLock();
        return new RedisStoreLockService(stringRedisTemplate, lock.getKeyPrefix(), lock.getLeaseTime());
    }

    @Bean
    @ConditionalOnMissingBean(StoreLockService.class)
    public StoreLockService localStoreLockService() {
        log.info("Initializing Store Lock Service (in-process)");
        return new LocalStoreLockService();
    }

    // ========================================
    // 알림 / 메트릭
    // ========================================

    @Bean
    @ConditionalOnProperty(name = "backup.notification.type", havingValue = "kafka")
    public NotificationDispatcher kafkaNotificationDispatcher(KafkaTemplate<String, String> kafkaTemplate,
                                                              ObjectMapper objectMapper) {
        log.info("Initializing Notification Dispatcher (Kafka topic={})", backupProperties.getNotification().getTopic());
        return new KafkaNotificationDispatcher(kafkaTemplate, objectMapper, backupProperties.getNotification().getTopic());
    }

    @Bean
    @ConditionalOnMissingBean(NotificationDispatcher.class)
    public NotificationDispatcher loggingNotificationDispatcher() {
        log.info("Initializing Notification Dispatcher (log only)");
        return new LoggingNotificationDispatcher();
    }

    @Bean
    @ConditionalOnMissingBean(BackupMetricsService.class)
    public BackupMetricsService backupMetricsService(MeterRegistry meterRegistry) {
        return new PrometheusBackupMetricsService(meterRegistry);
    }

    // ========================================
    // 설정 정보 로깅 (시작 시)
    // ========================================

    @Bean
    public BackupConfigurationLogger backupConfigurationLogger() {
        return new BackupConfigurationLogger(backupProperties);
    }

    /**
     * 백업 엔진 설정 정보 로거
     */
    static class BackupConfigurationLogger {

        BackupConfigurationLogger(BackupProperties props) {
            logConfiguration(props);
        }

        private void logConfiguration(BackupProperties props) {
            log.info("========================================");
            log.info("Backup & PITR Configuration");
            log.info("========================================");
            log.info("Stores:");
            log.info("  - Default: {}", props.getDefaultStore());
            props.getStores().forEach((name, store) ->
                    log.info("  - {}: tier={}, critical={}", name, store.getTier(), store.getCriticalCollections()));

            log.info("Tiers:");
            for (StorageTier tier : StorageTier.values()) {
                BackupProperties.TierTarget target = props.tierTarget(tier);
                log.info("  - {}: rpo={}, rto={}", tier, target.getRpo(), target.getRto());
            }

            log.info("Transport:");
            log.info("  - Type: {}", props.getTransport().getType());
            log.info("  - Call Timeout: {}", props.getTransport().getCallTimeout());
            log.info("  - Max Attempts: {} (backoff {} x{})", props.getTransport().getMaxAttempts(),
                    props.getTransport().getInitialBackoff(), props.getTransport().getBackoffMultiplier());

            log.info("Validation:");
            log.info("  - Minimum Size: {} bytes", props.getValidation().getMinimumSizeBytes());
            log.info("  - Count Tolerance: {}%", props.getValidation().getCountTolerancePercent());

            log.info("Restore:");
            log.info("  - Allow Untested: {}", props.getRestore().isAllowUntested());
            log.info("  - Use Incrementals: {}", props.getRestore().isUseIncrementals());

            log.info("Compliance:");
            log.info("  - RTO Safety Factor: {}", props.getCompliance().getRtoSafetyFactor());
            log.info("  - Critical Multiplier: {}", props.getCompliance().getCriticalMultiplier());

            log.info("Retention:");
            log.info("  - Full: {}, Incremental: {}, Safety: {}", props.getRetention().getFull(),
                    props.getRetention().getIncremental(), props.getRetention().getSafety());

            log.info("Lock: {}, Notification: {}", props.getLock().getType(), props.getNotification().getType());
            log.info("Scheduling: enabled={}, poolSize={}", props.getScheduling().isEnabled(),
                    props.getScheduling().getPoolSize());
            log.info("========================================");
        }
    }
}
