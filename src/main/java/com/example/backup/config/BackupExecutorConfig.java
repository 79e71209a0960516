package com.example.backup.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.RejectedExecutionHandler;
import java.util.concurrent.ThreadPoolExecutor;

@Configuration
@Slf4j
public class BackupExecutorConfig {

    @Value("${thread-pool.transport.core-pool-size:4}")
    private int corePoolSize;

    @Value("${thread-pool.transport.max-pool-size:8}")
    private int maxPoolSize;

    @Value("${thread-pool.transport.queue-capacity:100}")
    private int queueCapacity;

    @Value("${thread-pool.transport.thread-name-prefix:Archive-IO-}")
    private String threadNamePrefix;

    /**
     * 아카이브 전송 호출 전용 스레드 풀 (TimeLimiter 가 호출 단위 타임아웃을 적용하는 대상)
     */
    @Bean("transportExecutor")
    public ThreadPoolTaskExecutor transportExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();

        executor.setCorePoolSize(corePoolSize);
        executor.setMaxPoolSize(maxPoolSize);
        executor.setQueueCapacity(queueCapacity);
        executor.setThreadNamePrefix(threadNamePrefix);

        // 종료 시 진행 중인 전송 완료 대기
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);

        executor.setRejectedExecutionHandler(new TransportRejectedExecutionHandler());
        executor.initialize();

        log.info("Transport Executor initialized: corePoolSize={}, maxPoolSize={}, queueCapacity={}",
                corePoolSize, maxPoolSize, queueCapacity);

        return executor;
    }

    /**
     * 포화 시 거부 (호출자에서 TransientIO 로 변환되어 백오프 재시도)
     */
    private static class TransportRejectedExecutionHandler implements RejectedExecutionHandler {
        @Override
        public void rejectedExecution(Runnable r, ThreadPoolExecutor executor) {
            log.warn("Transport call rejected: activeCount={}, queueSize={}",
                    executor.getActiveCount(), executor.getQueue().size());
            throw new RejectedExecutionException("Transport executor saturated");
        }
    }
}
