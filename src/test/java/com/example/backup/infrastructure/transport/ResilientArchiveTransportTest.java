package com.example.backup.infrastructure.transport;

import com.example.backup.domain.exception.CorruptionException;
import com.example.backup.domain.exception.TransientIoException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.timelimiter.TimeLimiter;
import io.github.resilience4j.timelimiter.TimeLimiterConfig;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class ResilientArchiveTransportTest {

    private ArchiveTransport backend;
    private ExecutorService executor;
    private ResilientArchiveTransport transport;

    @BeforeEach
    void setUp() {
        backend = mock(ArchiveTransport.class);
        executor = Executors.newFixedThreadPool(2);
        Retry retry = Retry.of("test", RetryConfig.custom()
                .maxAttempts(3)
                .intervalFunction(IntervalFunction.ofExponentialBackoff(Duration.ofMillis(5), 2.0))
                .retryOnException(e -> e instanceof TransientIoException)
                .failAfterMaxAttempts(false)
                .build());
        TimeLimiter timeLimiter = TimeLimiter.of(TimeLimiterConfig.custom()
                .timeoutDuration(Duration.ofMillis(300))
                .cancelRunningFuture(true)
                .build());
        transport = new ResilientArchiveTransport(backend, retry, CircuitBreaker.ofDefaults("test"),
                timeLimiter, executor);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    @DisplayName("일시적 I/O 오류는 재시도 후 성공")
    void transientFailuresAreRetried() {
        when(backend.get("k"))
                .thenThrow(new TransientIoException("flaky", new IOException("flaky")))
                .thenThrow(new TransientIoException("flaky", new IOException("flaky")))
                .thenReturn(new byte[]{42});

        assertArrayEquals(new byte[]{42}, transport.get("k"));
        verify(backend, times(3)).get("k");
    }

    @Test
    @DisplayName("재시도 횟수를 넘기면 TransientIoException 전파")
    void exhaustedRetriesPropagate() {
        when(backend.get("k")).thenThrow(new TransientIoException("down", new IOException("down")));

        assertThrows(TransientIoException.class, () -> transport.get("k"));
        verify(backend, times(3)).get("k");
    }

    @Test
    @DisplayName("손상 오류는 재시도하지 않는다")
    void corruptionIsNotRetried() {
        when(backend.get("k")).thenThrow(new ArchiveObjectNotFoundException("k"));

        assertThrows(CorruptionException.class, () -> transport.get("k"));
        verify(backend, times(1)).get("k");
    }

    @Test
    @DisplayName("호출별 타임아웃은 TransientIoException 으로 변환")
    void slowCallTimesOut() {
        when(backend.get("slow")).thenAnswer(invocation -> {
            Thread.sleep(2_000);
            return new byte[0];
        });

        assertThrows(TransientIoException.class, () -> transport.get("slow"));
    }
}
