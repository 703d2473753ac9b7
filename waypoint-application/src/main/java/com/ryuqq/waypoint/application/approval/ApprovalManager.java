package com.ryuqq.waypoint.application.approval;

import com.ryuqq.waypoint.core.approval.ApprovalConfig;
import com.ryuqq.waypoint.core.approval.ApprovalFilter;
import com.ryuqq.waypoint.core.approval.ApprovalRequest;
import com.ryuqq.waypoint.core.approval.ApprovalStats;
import com.ryuqq.waypoint.core.approval.ApprovalStatus;
import com.ryuqq.waypoint.core.exception.ApprovalAlreadyDecidedException;
import com.ryuqq.waypoint.core.exception.ApprovalNotFoundException;
import com.ryuqq.waypoint.core.exception.ApprovalReasonRequiredException;
import com.ryuqq.waypoint.core.exception.ApprovalTimeoutException;
import com.ryuqq.waypoint.core.exception.UnauthorizedApproverException;
import com.ryuqq.waypoint.core.exception.WaypointException;
import com.ryuqq.waypoint.core.spi.ApprovalStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;

/**
 * 사람의 승인 결정을 관리합니다.
 *
 * <p><strong>책임:</strong></p>
 * <ul>
 *   <li>승인 요청 생성, 승인, 거절, 취소</li>
 *   <li>결정 대기 ({@link #waitForDecision(String, Duration)})</li>
 *   <li>만료 처리: 조회 시점의 lazy 만료와 {@link #expireOverdue()} 주기 처리</li>
 *   <li>대기 목록, 결정 목록, 통계 조회</li>
 * </ul>
 *
 * <p><strong>동시성:</strong> 같은 요청에 대한 결정은 {@link ApprovalStore#update}로 직렬화되므로
 * 동시에 승인과 거절이 들어와도 정확히 하나만 반영되고 나머지는
 * {@link ApprovalAlreadyDecidedException}을 받습니다. 실패한 호출은 저장된 요청을 변경하지 않습니다.</p>
 *
 * <p><strong>대기 시간 초과:</strong> {@link #waitForDecision}의 시간 초과는 요청을 변경하지 않습니다.
 * 요청 상태는 {@code expiresAt} 만료로만 바뀝니다.</p>
 *
 * @author Waypoint Team
 * @since 1.0.0
 */
public class ApprovalManager {

    private static final Logger log = LoggerFactory.getLogger(ApprovalManager.class);

    /** 대기 중 만료 여부를 다시 확인하는 최대 간격. */
    private static final long MAX_WAIT_SLICE_NANOS = TimeUnit.MILLISECONDS.toNanos(250);

    private static final Comparator<ApprovalRequest> PENDING_ORDER = Comparator
        .comparingInt((ApprovalRequest request) -> request.getPriority().rank()).reversed()
        .thenComparing(ApprovalRequest::getCreatedAt)
        .thenComparing(ApprovalRequest::getId);

    private static final Comparator<ApprovalRequest> DECIDED_ORDER = Comparator
        .<ApprovalRequest, Instant>comparing(ApprovalRequest::getDecidedAt, Comparator.nullsLast(Comparator.reverseOrder()))
        .thenComparing(ApprovalRequest::getId);

    private final ApprovalStore store;
    private final Clock clock;
    private final ApprovalConfig defaultConfig;
    private final Supplier<String> idGenerator;
    private final Map<String, CompletableFuture<ApprovalRequest>> signals = new ConcurrentHashMap<>();
    private final List<ApprovalEventListener> listeners = new CopyOnWriteArrayList<>();

    public ApprovalManager(ApprovalStore store, Clock clock) {
        this(store, clock, ApprovalConfig.requiredByDefault(), ApprovalManager::newId);
    }

    /**
     * @param store 요청 저장소
     * @param clock 시각 공급자 (만료 판정 기준)
     * @param defaultConfig config 없이 생성된 요청에 적용할 설정
     * @param idGenerator 요청 ID 생성기
     */
    public ApprovalManager(
        ApprovalStore store,
        Clock clock,
        ApprovalConfig defaultConfig,
        Supplier<String> idGenerator
    ) {
        if (store == null) {
            throw new IllegalArgumentException("store cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        if (defaultConfig == null) {
            throw new IllegalArgumentException("defaultConfig cannot be null");
        }
        if (idGenerator == null) {
            throw new IllegalArgumentException("idGenerator cannot be null");
        }
        this.store = store;
        this.clock = clock;
        this.defaultConfig = defaultConfig;
        this.idGenerator = idGenerator;
    }

    private static String newId() {
        return "approval_" + UUID.randomUUID().toString().replace("-", "");
    }

    public void addListener(ApprovalEventListener listener) {
        if (listener == null) {
            throw new IllegalArgumentException("listener cannot be null");
        }
        listeners.add(listener);
    }

    public void removeListener(ApprovalEventListener listener) {
        listeners.remove(listener);
    }

    // ========== 생성 ==========

    /**
     * PENDING 승인 요청 생성.
     *
     * @param workflowId 워크플로우 ID
     * @param executionId 실행 ID
     * @param stepId step ID
     * @param stepName step 이름
     * @param agentName 작업 주체 이름 (nullable)
     * @param context 승인자에게 보여줄 데이터 (nullable)
     * @param config 승인 설정 (null이면 기본 설정)
     * @return 생성된 요청 ({@code expiresAt = now + config.timeout})
     */
    public ApprovalRequest createRequest(
        String workflowId,
        String executionId,
        String stepId,
        String stepName,
        String agentName,
        Map<String, Object> context,
        ApprovalConfig config
    ) {
        ApprovalConfig effective = config == null ? defaultConfig : config;
        ApprovalRequest request = ApprovalRequest.create(
            idGenerator.get(), workflowId, executionId, stepId, stepName, agentName, context,
            effective, clock.instant()
        );
        signals.put(request.getId(), new CompletableFuture<>());
        store.save(request);

        log.info("Approval requested: id={}, workflow={}, execution={}, step={}, priority={}, expiresAt={}",
            request.getId(), workflowId, executionId, stepId, request.getPriority(), request.getExpiresAt());
        notifyListeners(request, true);
        return request;
    }

    // ========== 결정 ==========

    public ApprovalRequest approve(String approvalId, String approver) {
        return approve(approvalId, approver, null);
    }

    /**
     * 승인.
     *
     * @param approvalId 요청 ID
     * @param approver 승인자
     * @param reason 사유 (nullable, reasonRequired이면 필수)
     * @return APPROVED 요청
     * @throws ApprovalNotFoundException 요청이 없는 경우
     * @throws ApprovalAlreadyDecidedException PENDING이 아닌 경우 (만료 포함)
     * @throws UnauthorizedApproverException 승인자 목록에 없는 경우
     * @throws ApprovalReasonRequiredException 사유가 필요한데 없는 경우
     */
    public ApprovalRequest approve(String approvalId, String approver, String reason) {
        return decide(approvalId, approver, reason, true);
    }

    public ApprovalRequest reject(String approvalId, String approver) {
        return reject(approvalId, approver, null);
    }

    /**
     * 거절. 예외 조건은 {@link #approve(String, String, String)}와 같습니다.
     *
     * @param approvalId 요청 ID
     * @param approver 거절자
     * @param reason 사유
     * @return REJECTED 요청
     */
    public ApprovalRequest reject(String approvalId, String approver, String reason) {
        return decide(approvalId, approver, reason, false);
    }

    private ApprovalRequest decide(String approvalId, String approver, String reason, boolean approved) {
        if (approver == null || approver.isBlank()) {
            throw new IllegalArgumentException("approver cannot be null or blank");
        }
        expireIfOverdue(approvalId);

        Instant now = clock.instant();
        ApprovalRequest decided = store.update(approvalId, current -> {
            if (!current.isPending()) {
                throw new ApprovalAlreadyDecidedException(approvalId, current.getStatus());
            }
            if (!current.getConfig().canDecide(approver)) {
                throw new UnauthorizedApproverException(approvalId, approver);
            }
            if (current.getConfig().reasonRequired() && (reason == null || reason.isBlank())) {
                throw new ApprovalReasonRequiredException(approvalId);
            }
            return approved
                ? current.approve(approver, reason, now)
                : current.reject(approver, reason, now);
        });

        log.info("Approval {}: id={}, by={}", decided.getStatus(), approvalId, approver);
        resolve(decided);
        return decided;
    }

    /**
     * 요청 취소.
     *
     * @param approvalId 요청 ID
     * @return CANCELLED 요청
     * @throws ApprovalNotFoundException 요청이 없는 경우
     * @throws ApprovalAlreadyDecidedException PENDING이 아닌 경우
     */
    public ApprovalRequest cancel(String approvalId) {
        expireIfOverdue(approvalId);
        Instant now = clock.instant();
        ApprovalRequest cancelled = store.update(approvalId, current -> current.cancel(now));
        log.info("Approval cancelled: id={}", approvalId);
        resolve(cancelled);
        return cancelled;
    }

    // ========== 대기 ==========

    /**
     * 결정 대기.
     *
     * <p>요청의 {@code expiresAt}이 먼저 도래하면 만료 처리 후 false를 반환합니다.</p>
     *
     * @param approvalId 요청 ID
     * @param timeout 최대 대기 시간
     * @return APPROVED이면 true, REJECTED/EXPIRED/CANCELLED이면 false
     * @throws ApprovalNotFoundException 요청이 없는 경우
     * @throws ApprovalTimeoutException 대기 시간 안에 결정되지 않은 경우 (요청은 PENDING 유지)
     * @throws WaypointException 대기 중 인터럽트된 경우 (인터럽트 플래그는 복원됨)
     */
    public boolean waitForDecision(String approvalId, Duration timeout) {
        if (timeout == null || timeout.isNegative()) {
            throw new IllegalArgumentException("timeout cannot be null or negative (current: " + timeout + ")");
        }
        long deadline = System.nanoTime() + timeout.toNanos();

        while (true) {
            CompletableFuture<ApprovalRequest> signal = signalFor(approvalId);
            ApprovalRequest current = expireIfOverdue(approvalId);
            if (current.getStatus().isTerminal()) {
                return current.getStatus() == ApprovalStatus.APPROVED;
            }

            long remaining = deadline - System.nanoTime();
            if (remaining <= 0) {
                throw new ApprovalTimeoutException(approvalId, timeout);
            }
            long untilExpiry = Math.max(1, Duration.between(clock.instant(), current.getExpiresAt()).toNanos());
            long slice = Math.min(remaining, Math.min(untilExpiry, MAX_WAIT_SLICE_NANOS));

            try {
                ApprovalRequest resolved = signal.get(slice, TimeUnit.NANOSECONDS);
                return resolved.getStatus() == ApprovalStatus.APPROVED;
            } catch (TimeoutException e) {
                log.trace("Still waiting for approval {}", approvalId);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new WaypointException("Interrupted while waiting for approval " + approvalId, e);
            } catch (ExecutionException e) {
                throw new IllegalStateException("Approval signal failed for " + approvalId, e.getCause());
            }
        }
    }

    private CompletableFuture<ApprovalRequest> signalFor(String approvalId) {
        return signals.computeIfAbsent(approvalId, id -> new CompletableFuture<>());
    }

    // ========== 조회 ==========

    /**
     * 요청 조회. 만료 시각이 지난 PENDING 요청은 이 시점에 만료 처리됩니다.
     *
     * @param approvalId 요청 ID
     * @return 요청 (없으면 empty)
     */
    public Optional<ApprovalRequest> getRequest(String approvalId) {
        if (store.findById(approvalId).isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(expireIfOverdue(approvalId));
    }

    public List<ApprovalRequest> listPending() {
        return listPending(ApprovalFilter.all());
    }

    /**
     * 대기 중인 요청 목록.
     *
     * @param filter 조회 조건 (status 조건은 무시)
     * @return CRITICAL &gt; HIGH &gt; MEDIUM &gt; LOW, 같은 우선순위는 오래된 순
     */
    public List<ApprovalRequest> listPending(ApprovalFilter filter) {
        expireOverdue();
        ApprovalFilter pendingOnly = (filter == null ? ApprovalFilter.all() : filter)
            .withStatus(ApprovalStatus.PENDING);
        return store.findAll(pendingOnly).stream()
            .sorted(PENDING_ORDER)
            .toList();
    }

    public List<ApprovalRequest> listDecided() {
        return listDecided(ApprovalFilter.all());
    }

    /**
     * 종료된 요청 목록.
     *
     * @param filter 조회 조건 (status가 PENDING이면 빈 목록)
     * @return 최근 종료 순
     */
    public List<ApprovalRequest> listDecided(ApprovalFilter filter) {
        expireOverdue();
        ApprovalFilter effective = filter == null ? ApprovalFilter.all() : filter;
        return store.findAll(effective).stream()
            .filter(request -> request.getStatus().isTerminal())
            .sorted(DECIDED_ORDER)
            .toList();
    }

    /**
     * 요청 통계.
     *
     * @return 상태별 건수와 평균 결정 소요 시간
     */
    public ApprovalStats getStats() {
        expireOverdue();
        int pending = 0;
        int approved = 0;
        int rejected = 0;
        int expired = 0;
        int cancelled = 0;
        long decisionNanos = 0;
        int decisions = 0;

        for (ApprovalRequest request : store.findAll(ApprovalFilter.all())) {
            switch (request.getStatus()) {
                case PENDING -> pending++;
                case APPROVED -> approved++;
                case REJECTED -> rejected++;
                case EXPIRED -> expired++;
                case CANCELLED -> cancelled++;
            }
            if (request.getStatus().isDecided() && request.getDecidedAt() != null) {
                decisionNanos += Duration.between(request.getCreatedAt(), request.getDecidedAt()).toNanos();
                decisions++;
            }
        }
        Duration average = decisions == 0 ? Duration.ZERO : Duration.ofNanos(decisionNanos / decisions);
        return new ApprovalStats(pending, approved, rejected, expired, cancelled, average);
    }

    // ========== 만료 ==========

    /**
     * 만료 시각이 지난 PENDING 요청을 모두 만료 처리합니다.
     *
     * @return 이번 호출로 만료 처리된 요청 수
     */
    public int expireOverdue() {
        Instant now = clock.instant();
        int expired = 0;
        for (ApprovalRequest request : store.findAll(ApprovalFilter.all().withStatus(ApprovalStatus.PENDING))) {
            if (request.isOverdue(now) && expire(request.getId(), now) != null) {
                expired++;
            }
        }
        return expired;
    }

    private ApprovalRequest expireIfOverdue(String approvalId) {
        ApprovalRequest current = store.findById(approvalId)
            .orElseThrow(() -> new ApprovalNotFoundException(approvalId));
        Instant now = clock.instant();
        if (!current.isOverdue(now)) {
            return current;
        }
        ApprovalRequest expired = expire(approvalId, now);
        return expired != null ? expired : store.findById(approvalId).orElse(current);
    }

    /**
     * @return 이번 호출이 만료시켰으면 만료된 요청, 다른 호출이 먼저 종료시켰으면 null
     */
    private ApprovalRequest expire(String approvalId, Instant now) {
        AtomicBoolean changed = new AtomicBoolean(false);
        ApprovalRequest result = store.update(approvalId, current -> {
            if (!current.isOverdue(now)) {
                return current;
            }
            changed.set(true);
            return current.expire(now);
        });
        if (!changed.get()) {
            return null;
        }
        log.info("Approval expired: id={}, status={}", approvalId, result.getStatus());
        resolve(result);
        return result;
    }

    private void resolve(ApprovalRequest request) {
        signalFor(request.getId()).complete(request);
        notifyListeners(request, false);
    }

    private void notifyListeners(ApprovalRequest request, boolean created) {
        for (ApprovalEventListener listener : listeners) {
            try {
                if (created) {
                    listener.onCreated(request);
                } else {
                    listener.onResolved(request);
                }
            } catch (RuntimeException e) {
                log.warn("Approval listener failed for {}: {}", request.getId(), e.getMessage(), e);
            }
        }
    }
}
