package com.adtech.common.retry;

import com.adtech.common.error.SyncException;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.function.Predicate;

/**
 * 단계 내부 재시도 (Resilience4j Retry)
 * <p>
 * {@link SyncException#isRetriable()} 가 true 인 실패(연결 끊김, 타임아웃)만 재시도하며,
 * 그 외 예외와 재시도를 모두 소진한 마지막 실패는 그대로 호출자에게 전파됩니다.
 */
public class RetryPolicy {

    private static final Logger LOG = LoggerFactory.getLogger(RetryPolicy.class);

    static final long MAX_BACKOFF_MS = 60_000L;

    static final Predicate<Throwable> RETRIABLE =
            e -> e instanceof SyncException && ((SyncException) e).isRetriable();

    @FunctionalInterface
    public interface Attempt<T> {
        T run() throws SyncException;
    }

    private final RetryConfig config;

    public RetryPolicy(RetryConfig config) {
        this.config = config;
    }

    /**
     * 지수 backoff (initial, initial*2, ... 최대 60초)
     */
    public static RetryPolicy exponential(int maxAttempts, long initialBackoffMs) {
        return new RetryPolicy(config(maxAttempts, exponentialInterval(initialBackoffMs)));
    }

    /**
     * 고정 간격 (서비스 기동 대기 등)
     */
    public static RetryPolicy fixed(int maxAttempts, Duration interval) {
        return new RetryPolicy(config(maxAttempts, IntervalFunction.of(interval)));
    }

    /**
     * 대기 없이 즉시 재시도
     */
    public static RetryPolicy immediate(int maxAttempts) {
        return new RetryPolicy(config(maxAttempts, attempt -> 0L));
    }

    static IntervalFunction exponentialInterval(long initialBackoffMs) {
        if (initialBackoffMs < 1) {
            return attempt -> 0L;
        }
        return IntervalFunction.ofExponentialBackoff(initialBackoffMs, 2.0, MAX_BACKOFF_MS);
    }

    private static RetryConfig config(int maxAttempts, IntervalFunction interval) {
        return RetryConfig.custom()
                .maxAttempts(maxAttempts)
                .intervalFunction(interval)
                .retryOnException(RETRIABLE)
                .build();
    }

    /**
     * @param description 로그에 남길 작업 이름 (예: "Extract campaign")
     * @throws SyncException 재시도 대상이 아니거나 재시도를 모두 소진한 마지막 실패
     */
    public <T> T execute(String description, Attempt<T> attempt) throws SyncException {
        Retry retry = Retry.of(description, config);
        retry.getEventPublisher()
                .onRetry(event -> LOG.warn("⚠️  {} 실패 ({}/{}), {}ms 후 재시도: {}",
                        event.getName(),
                        event.getNumberOfRetryAttempts(),
                        config.getMaxAttempts(),
                        event.getWaitInterval().toMillis(),
                        event.getLastThrowable().getMessage()))
                .onError(event -> {
                    if (event.getNumberOfRetryAttempts() > 0) {
                        LOG.error("❌ {} 재시도 {}회 후 실패", event.getName(), event.getNumberOfRetryAttempts());
                    }
                });

        try {
            return Retry.decorateCheckedSupplier(retry, attempt::run).get();
        } catch (SyncException | RuntimeException | Error e) {
            throw e;
        } catch (Throwable t) {
            throw new IllegalStateException("Unexpected failure in " + description, t);
        }
    }

    public int getMaxAttempts() {
        return config.getMaxAttempts();
    }
}
