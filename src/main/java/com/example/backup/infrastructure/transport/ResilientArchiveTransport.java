package com.example.backup.infrastructure.transport;

import com.example.backup.domain.exception.BackupException;
import com.example.backup.domain.exception.OperationCancelledException;
import com.example.backup.domain.exception.TransientIoException;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.timelimiter.TimeLimiter;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * 재시도/서킷 브레이커/호출별 타임아웃을 적용한 전송 계층 데코레이터
 *
 * - TimeLimiter: 호출 단위 타임아웃 (작업 전체가 아님)
 * - CircuitBreaker: 백엔드 장애 시 빠른 실패
 * - Retry: TransientIoException 만 지수 백오프로 재시도, 그 외는 즉시 전파
 * - 호출 스레드 인터럽트는 OperationCancelledException 으로 변환 (취소 지점)
 */
@Slf4j
public class ResilientArchiveTransport implements ArchiveTransport {

    private final ArchiveTransport delegate;
    private final Retry retry;
    private final CircuitBreaker circuitBreaker;
    private final TimeLimiter timeLimiter;
    private final ExecutorService executor;

    public ResilientArchiveTransport(ArchiveTransport delegate, Retry retry, CircuitBreaker circuitBreaker,
                                     TimeLimiter timeLimiter, ExecutorService executor) {
        this.delegate = delegate;
        this.retry = retry;
        this.circuitBreaker = circuitBreaker;
        this.timeLimiter = timeLimiter;
        this.executor = executor;

        retry.getEventPublisher().onRetry(event ->
                log.warn("Archive call retry #{} after {}: {}", event.getNumberOfRetryAttempts(),
                        event.getWaitInterval(), event.getLastThrowable() == null ? "-" : event.getLastThrowable().getMessage()));
        circuitBreaker.getEventPublisher().onStateTransition(event ->
                log.warn("Archive circuit breaker: {}", event.getStateTransition()));
    }

    @Override
    public void put(String location, byte[] content) {
        call("put", location, () -> {
            delegate.put(location, content);
            return Boolean.TRUE;
        });
    }

    @Override
    public byte[] get(String location) {
        return call("get", location, () -> delegate.get(location));
    }

    @Override
    public Optional<ArchiveObject> stat(String location) {
        return call("stat", location, () -> delegate.stat(location));
    }

    @Override
    public void delete(String location) {
        call("delete", location, () -> {
            delegate.delete(location);
            return Boolean.TRUE;
        });
    }

    @Override
    public List<String> list(String prefix) {
        return call("list", prefix, () -> delegate.list(prefix));
    }

    @Override
    public StorageUsage usage() {
        return call("usage", "*", delegate::usage);
    }

    @Override
    public String describe() {
        return delegate.describe();
    }

    private <T> T call(String operation, String location, Supplier<T> action) {
        if (Thread.currentThread().isInterrupted()) {
            throw cancelled(operation, location);
        }
        Supplier<T> timed = () -> callWithTimeout(operation, location, action);
        Supplier<T> guarded = CircuitBreaker.decorateSupplier(circuitBreaker, timed);
        Supplier<T> retried = Retry.decorateSupplier(retry, guarded);
        try {
            return retried.get();
        } catch (CallNotPermittedException e) {
            throw new TransientIoException("Archive backend circuit is open; " + operation + " rejected",
                    Map.of("location", location, "operation", operation), e);
        }
    }

    private <T> T callWithTimeout(String operation, String location, Supplier<T> action) {
        try {
            return timeLimiter.executeFutureSupplier(() -> executor.submit(action::get));
        } catch (BackupException e) {
            throw e;
        } catch (TimeoutException e) {
            throw new TransientIoException("Archive " + operation + " timed out for " + location,
                    Map.of("location", location, "operation", operation), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw cancelled(operation, location);
        } catch (Exception e) {
            throw new TransientIoException("Archive " + operation + " failed for " + location,
                    Map.of("location", location, "operation", operation), e);
        }
    }

    private OperationCancelledException cancelled(String operation, String location) {
        return new OperationCancelledException("Archive " + operation + " cancelled for " + location,
                Map.of("location", location, "operation", operation));
    }
}
