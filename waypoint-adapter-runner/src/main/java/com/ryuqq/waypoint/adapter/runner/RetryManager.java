package com.ryuqq.waypoint.adapter.runner;

import com.ryuqq.waypoint.core.exception.CircuitOpenException;
import com.ryuqq.waypoint.core.exception.RetryExhaustedException;
import com.ryuqq.waypoint.core.exception.WaypointException;
import com.ryuqq.waypoint.core.retry.ErrorCategory;
import com.ryuqq.waypoint.core.retry.ErrorClassifier;
import com.ryuqq.waypoint.core.retry.RetryAttempt;
import com.ryuqq.waypoint.core.retry.RetryPolicy;
import com.ryuqq.waypoint.core.retry.RetryResult;
import com.ryuqq.waypoint.core.spi.Operation;
import com.ryuqq.waypoint.core.spi.Sleeper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 재시도 루프 실행기.
 *
 * <p><strong>처리 흐름:</strong></p>
 * <pre>
 * attempt = 0
 * loop:
 *   operation.execute()
 *     성공 → 결과 반환
 *     실패 → 분류 (ErrorClassifier)
 *       CircuitOpenException, 재시도 불가 분류 → 중단
 *       attempt + 1 == maxAttempts → 중단
 *       그 외 → sleep(backoff(attempt)), attempt++
 * </pre>
 *
 * <p>매 실행마다 {@link ResilienceMetrics#recordRetry}를 한 번 호출하고,
 * {@code (workflowId, executionId, stepName)} 단위의 {@link RetryContext}를 남깁니다.</p>
 *
 * @author Waypoint Team
 * @since 1.0.0
 */
public final class RetryManager {

    private static final Logger log = LoggerFactory.getLogger(RetryManager.class);

    private record ContextKey(String workflowId, String executionId, String stepName) {
    }

    private final BackoffCalculator backoffCalculator;
    private final Sleeper sleeper;
    private final Clock clock;
    private final ResilienceMetrics metrics;
    private final ConcurrentHashMap<ContextKey, RetryContext> contexts = new ConcurrentHashMap<>();

    /**
     * 기본 구성으로 생성 (실제 sleep, 시스템 시계, 독립 메트릭).
     */
    public RetryManager() {
        this(new BackoffCalculator(), Sleeper.system(), Clock.systemUTC(), new ResilienceMetrics());
    }

    /**
     * 생성자.
     *
     * @param backoffCalculator 백오프 계산기
     * @param sleeper 대기 수단
     * @param clock 시각 공급자
     * @param metrics 공유 메트릭
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public RetryManager(BackoffCalculator backoffCalculator, Sleeper sleeper, Clock clock, ResilienceMetrics metrics) {
        if (backoffCalculator == null) {
            throw new IllegalArgumentException("backoffCalculator cannot be null");
        }
        if (sleeper == null) {
            throw new IllegalArgumentException("sleeper cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        if (metrics == null) {
            throw new IllegalArgumentException("metrics cannot be null");
        }
        this.backoffCalculator = backoffCalculator;
        this.sleeper = sleeper;
        this.clock = clock;
        this.metrics = metrics;
    }

    /**
     * 재시도하며 실행하고 결과를 반환합니다.
     *
     * @param stepName step 또는 Operation 이름
     * @param operation 실행할 Operation
     * @param policy 재시도 정책
     * @param <T> 결과 타입
     * @return Operation 결과
     * @throws RetryExhaustedException 재시도 소진 또는 재시도 불가 실패 (원래 예외를 cause로 가짐)
     */
    public <T> T executeWithRetry(String stepName, Operation<T> operation, RetryPolicy policy) {
        return executeWithRetry("", "", stepName, operation, policy);
    }

    public <T> T executeWithRetry(String workflowId, String executionId, String stepName,
                                  Operation<T> operation, RetryPolicy policy) {
        RetryResult<T> result = execute(workflowId, executionId, stepName, operation, policy);
        if (result.success()) {
            return result.result();
        }
        throw new RetryExhaustedException(stepName, result.attempts(), result.lastError());
    }

    /**
     * 재시도하며 실행하고 성공/실패를 값으로 반환합니다.
     *
     * @param workflowId 워크플로우 ID (이력 키)
     * @param executionId 실행 ID (이력 키)
     * @param stepName step 또는 Operation 이름
     * @param operation 실행할 Operation
     * @param policy 재시도 정책
     * @param <T> 결과 타입
     * @return 시도 결과
     * @throws WaypointException 백오프 대기 중 인터럽트된 경우
     */
    public <T> RetryResult<T> execute(String workflowId, String executionId, String stepName,
                                      Operation<T> operation, RetryPolicy policy) {
        if (stepName == null) {
            throw new IllegalArgumentException("stepName cannot be null");
        }
        if (operation == null) {
            throw new IllegalArgumentException("operation cannot be null");
        }
        if (policy == null) {
            throw new IllegalArgumentException("policy cannot be null");
        }

        RetryContext context = new RetryContext(workflowId, executionId, stepName);
        contexts.put(new ContextKey(workflowId, executionId, stepName), context);

        List<Duration> delays = new ArrayList<>();
        Duration totalDelay = Duration.ZERO;
        int attempt = 0;
        while (true) {
            Instant startedAt = clock.instant();
            try {
                T value = operation.execute();
                context.add(new RetryAttempt(attempt, startedAt, elapsedSince(startedAt), true, null, null, Duration.ZERO));
                if (attempt > 0) {
                    log.info("'{}' succeeded after {} attempt(s)", stepName, attempt + 1);
                }
                metrics.recordRetry(attempt + 1, delays, true, null);
                return RetryResult.succeeded(value, attempt + 1, totalDelay);
            } catch (Exception e) {
                ErrorCategory category = ErrorClassifier.classify(e);
                boolean last = attempt + 1 >= policy.maxAttempts();
                boolean retryable = !(e instanceof CircuitOpenException) && policy.isRetryable(e);

                if (last || !retryable) {
                    context.add(new RetryAttempt(attempt, startedAt, elapsedSince(startedAt), false, category,
                        e.getMessage(), Duration.ZERO));
                    if (!retryable) {
                        log.warn("Will not retry '{}' after attempt {}: {} - {}", stepName, attempt + 1, category, e.toString());
                    } else {
                        log.error("Max attempts ({}) exceeded for '{}': {}", policy.maxAttempts(), stepName, e.toString());
                    }
                    // Circuit OPEN 거부는 Operation 실패 분류에 넣지 않음
                    metrics.recordRetry(attempt + 1, delays, false, e instanceof CircuitOpenException ? null : category);
                    return RetryResult.failed(e, attempt + 1, totalDelay);
                }

                Duration delay = backoffCalculator.calculate(policy, attempt);
                context.add(new RetryAttempt(attempt, startedAt, elapsedSince(startedAt), false, category,
                    e.getMessage(), delay));
                log.warn("Attempt {}/{} failed for '{}': {} - {}, retrying in {}ms",
                    attempt + 1, policy.maxAttempts(), stepName, category, e.toString(), delay.toMillis());

                sleep(stepName, delay, attempt + 1, delays, category);
                delays.add(delay);
                totalDelay = totalDelay.plus(delay);
                attempt++;
            }
        }
    }

    private void sleep(String stepName, Duration delay, int attempts, List<Duration> delays, ErrorCategory category) {
        try {
            sleeper.sleep(delay);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            metrics.recordRetry(attempts, delays, false, category);
            throw new WaypointException("Retry of '" + stepName + "' interrupted", e);
        }
    }

    private Duration elapsedSince(Instant startedAt) {
        Duration elapsed = Duration.between(startedAt, clock.instant());
        return elapsed.isNegative() ? Duration.ZERO : elapsed;
    }

    /**
     * 시도 이력 조회.
     *
     * @param workflowId 워크플로우 ID
     * @param executionId 실행 ID
     * @param stepName step 이름
     * @return 가장 최근 실행의 이력
     */
    public Optional<RetryContext> getRetryContext(String workflowId, String executionId, String stepName) {
        return Optional.ofNullable(contexts.get(new ContextKey(workflowId, executionId, stepName)));
    }

    /**
     * 한 실행의 시도 이력 삭제.
     *
     * @param workflowId 워크플로우 ID
     * @param executionId 실행 ID
     * @return 삭제된 이력 수
     */
    public int clearContexts(String workflowId, String executionId) {
        int before = contexts.size();
        contexts.keySet().removeIf(key ->
            Objects.equals(key.workflowId(), workflowId) && Objects.equals(key.executionId(), executionId));
        return before - contexts.size();
    }

    public int contextCount() {
        return contexts.size();
    }

    public ResilienceMetrics getMetrics() {
        return metrics;
    }
}
