package com.example.backup.config;

import com.example.backup.domain.model.StorageTier;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 백업/아카이브/복구 엔진 설정
 * 모든 컴포넌트는 생성 시 이 객체를 주입받아 사용 (환경 변수 직접 조회 금지)
 */
@Data
@Component
@Validated
@ConfigurationProperties(prefix = "backup")
public class BackupProperties {

    @NotBlank
    private String defaultStore = "primary";

    @Valid
    private Map<String, Store> stores = new LinkedHashMap<>();

    @Valid
    private Map<StorageTier, TierTarget> tiers = defaultTiers();

    @Valid
    private Transport transport = new Transport();
    @Valid
    private Wal wal = new Wal();
    @Valid
    private Validation validation = new Validation();
    @Valid
    private Restore restore = new Restore();
    @Valid
    private Compliance compliance = new Compliance();
    @Valid
    private Retention retention = new Retention();
    @Valid
    private Lock lock = new Lock();
    @Valid
    private Notification notification = new Notification();
    @Valid
    private Scheduling scheduling = new Scheduling();
    @Valid
    private Cli cli = new Cli();

    @Data
    public static class Store {
        @NotNull
        private StorageTier tier = StorageTier.STANDARD;
        // 검증 5단계에서 반드시 존재하고 비어있지 않아야 하는 컬렉션
        private List<String> criticalCollections = new ArrayList<>();
        // 컬렉션별 허용 오차(%) - 미설정 시 validation.count-tolerance-percent 사용
        private Map<String, Double> countTolerancePercent = new LinkedHashMap<>();
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class TierTarget {
        @NotNull
        private Duration rpo;
        @NotNull
        private Duration rto;
    }

    @Data
    public static class Transport {
        @NotBlank
        private String type = "filesystem"; // filesystem | s3
        private String rootDirectory = "./archive";
        private String bucket;
        private String region = "us-east-1";
        private String endpoint; // S3 호환 스토리지 엔드포인트
        @NotNull
        private Duration callTimeout = Duration.ofSeconds(30);
        @Min(1)
        private int maxAttempts = 5;
        @NotNull
        private Duration initialBackoff = Duration.ofMillis(500);
        @DecimalMin("1.0")
        private double backoffMultiplier = 2.0;
    }

    @Data
    public static class Wal {
        // 연속성 검사 시 카탈로그뿐 아니라 아카이브 객체 존재도 확인
        private boolean verifyObjects = false;
    }

    @Data
    public static class Validation {
        @Min(1)
        private long minimumSizeBytes = 64;
        @DecimalMin("0.0")
        private double countTolerancePercent = 10.0;
        private boolean liveComparisonEnabled = true;
    }

    @Data
    public static class Restore {
        // 미검증(UNTESTED) 백업을 복구 베이스로 허용할지 여부
        private boolean allowUntested = false;
        // PASSED 증분 백업으로 재생 구간 단축
        private boolean useIncrementals = false;
    }

    @Data
    public static class Compliance {
        @DecimalMin("1.0")
        private double rtoSafetyFactor = 1.5;
        @DecimalMin("0.1")
        private double warningMultiplier = 1.0;
        @DecimalMin("0.1")
        private double criticalMultiplier = 1.5;
        // 측정된 복구 시간이 없을 때 아티팩트 크기로 외삽하는 처리량
        @Min(1)
        private long assumedRestoreBytesPerSecond = 50L * 1024 * 1024;
    }

    @Data
    public static class Retention {
        @NotNull
        private Duration full = Duration.ofDays(30);
        @NotNull
        private Duration incremental = Duration.ofDays(7);
        @NotNull
        private Duration safety = Duration.ofDays(3);
        @NotNull
        private Duration validationReports = Duration.ofDays(90);
    }

    @Data
    public static class Lock {
        @NotBlank
        private String type = "local"; // local | redis
        private String keyPrefix = "backup:lock:";
        @NotNull
        private Duration leaseTime = Duration.ofHours(6);
    }

    @Data
    public static class Notification {
        @NotBlank
        private String type = "logging"; // logging | kafka
        private String topic = "backup-events";
    }

    @Data
    public static class Scheduling {
        private boolean enabled = true;
        @Min(1)
        private int poolSize = 5;
        private String fullBackupCron = "0 0 1 * * *";
        private long incrementalBackupIntervalMs = 3_600_000;
        private long continuityScanIntervalMs = 60_000;
        private long validationIntervalMs = 300_000;
        private long complianceTickMs = 60_000;
        private String retentionCron = "0 30 3 * * *";
    }

    @Data
    public static class Cli {
        private String endpoint = "http://localhost:8080";
    }

    public Store storeConfig(String storeName) {
        Store store = stores.get(storeName);
        return store != null ? store : new Store();
    }

    public TierTarget tierTarget(StorageTier tier) {
        TierTarget target = tiers.get(tier);
        if (target == null) {
            target = defaultTiers().get(tier);
        }
        return target;
    }

    public double toleranceFor(String storeName, String collection) {
        Double perCollection = storeConfig(storeName).getCountTolerancePercent().get(collection);
        return perCollection != null ? perCollection : validation.getCountTolerancePercent();
    }

    private static Map<StorageTier, TierTarget> defaultTiers() {
        Map<StorageTier, TierTarget> tiers = new EnumMap<>(StorageTier.class);
        tiers.put(StorageTier.CRITICAL, new TierTarget(Duration.ofMinutes(5), Duration.ofMinutes(15)));
        tiers.put(StorageTier.IMPORTANT, new TierTarget(Duration.ofMinutes(15), Duration.ofHours(1)));
        tiers.put(StorageTier.STANDARD, new TierTarget(Duration.ofHours(1), Duration.ofHours(4)));
        tiers.put(StorageTier.LOW, new TierTarget(Duration.ofHours(24), Duration.ofHours(24)));
        return tiers;
    }
}
