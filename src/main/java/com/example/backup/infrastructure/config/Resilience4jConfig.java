package com.example.backup.infrastructure.config;

import com.example.backup.config.BackupProperties;
import com.example.backup.domain.exception.TransientIoException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.retry.RetryRegistry;
import io.github.resilience4j.timelimiter.TimeLimiter;
import io.github.resilience4j.timelimiter.TimeLimiterConfig;
import io.github.resilience4j.timelimiter.TimeLimiterRegistry;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Resilience4j 설정
 * - 아카이브 전송 계층에 재시도, 서킷 브레이커, 호출별 타임아웃 적용
 */
@Configuration
public class Resilience4jConfig {

    public static final String ARCHIVE_TRANSPORT = "archiveTransport";

    /**
     * CircuitBreaker 레지스트리 설정
     * TransientIO 만 실패로 집계 (손상/정책 오류는 백엔드 장애가 아님)
     */
    @Bean
    public CircuitBreakerRegistry circuitBreakerRegistry() {
        CircuitBreakerConfig circuitBreakerConfig = CircuitBreakerConfig.custom()
                .failureRateThreshold(50)                      // 50% 실패율에서 서킷 오픈
                .waitDurationInOpenState(Duration.ofSeconds(30)) // 열린 상태에서 30초 대기
                .permittedNumberOfCallsInHalfOpenState(5)      // 반열림 상태에서 5번의 호출 허용
                .slidingWindowType(CircuitBreakerConfig.SlidingWindowType.COUNT_BASED)
                .slidingWindowSize(20)
                .minimumNumberOfCalls(10)
                .recordException(e -> e instanceof TransientIoException)
                .automaticTransitionFromOpenToHalfOpenEnabled(true)
                .build();

        return CircuitBreakerRegistry.of(circuitBreakerConfig);
    }

    @Bean
    public CircuitBreaker archiveCircuitBreaker(CircuitBreakerRegistry circuitBreakerRegistry) {
        return circuitBreakerRegistry.circuitBreaker(ARCHIVE_TRANSPORT);
    }

    /**
     * 지수 백오프 재시도 (TransientIO 만 재시도)
     */
    @Bean
    public RetryRegistry retryRegistry(BackupProperties properties) {
        BackupProperties.Transport transport = properties.getTransport();
        RetryConfig retryConfig = RetryConfig.custom()
                .maxAttempts(transport.getMaxAttempts())
                .intervalFunction(IntervalFunction.ofExponentialBackoff(
                        transport.getInitialBackoff(), transport.getBackoffMultiplier()))
                .retryOnException(e -> e instanceof TransientIoException)
                .failAfterMaxAttempts(false)
                .build();

        return RetryRegistry.of(retryConfig);
    }

    @Bean
    public Retry archiveRetry(RetryRegistry retryRegistry) {
        return retryRegistry.retry(ARCHIVE_TRANSPORT);
    }

    /**
     * 호출 단위 타임아웃 (작업 전체 타임아웃 아님)
     */
    @Bean
    public TimeLimiterRegistry timeLimiterRegistry(BackupProperties properties) {
        TimeLimiterConfig timeLimiterConfig = TimeLimiterConfig.custom()
                .timeoutDuration(properties.getTransport().getCallTimeout())
                .cancelRunningFuture(true)
                .build();

        return TimeLimiterRegistry.of(timeLimiterConfig);
    }

    @Bean
    public TimeLimiter archiveTimeLimiter(TimeLimiterRegistry timeLimiterRegistry) {
        return timeLimiterRegistry.timeLimiter(ARCHIVE_TRANSPORT);
    }
}
