package com.example.backup.config;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.annotation.SchedulingConfigurer;
import org.springframework.scheduling.config.ScheduledTaskRegistrar;

import java.util.concurrent.Executors;

/**
 * 주기 작업 스케줄러 (backup.scheduling.enabled=false 이면 비활성화)
 */
@Configuration
@EnableScheduling
@RequiredArgsConstructor
@Slf4j
@ConditionalOnProperty(name = "backup.scheduling.enabled", havingValue = "true", matchIfMissing = true)
public class BackupSchedulingConfig implements SchedulingConfigurer {

    private final BackupProperties properties;

    @Override
    public void configureTasks(ScheduledTaskRegistrar taskRegistrar) {
        int poolSize = properties.getScheduling().getPoolSize();
        taskRegistrar.setScheduler(Executors.newScheduledThreadPool(poolSize, r -> {
            Thread t = new Thread(r);
            t.setName("Backup-Scheduler-" + t.getId());
            t.setDaemon(false);
            return t;
        }));
        log.info("Backup scheduler configured: poolSize={}", poolSize);
    }
}
