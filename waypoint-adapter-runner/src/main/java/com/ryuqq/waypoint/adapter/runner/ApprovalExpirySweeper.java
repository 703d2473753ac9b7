package com.ryuqq.waypoint.adapter.runner;

import com.ryuqq.waypoint.application.approval.ApprovalManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * 만료된 승인 요청 정리 컴포넌트.
 *
 * <p>PENDING 요청은 조회될 때 지연 만료되지만, 아무도 조회하지 않는 요청은
 * 이 컴포넌트가 주기적으로 EXPIRED(또는 autoReject 설정 시 REJECTED)로 바꿉니다.</p>
 *
 * <p><strong>멱등성:</strong></p>
 * <ul>
 *   <li>이미 종료된 요청은 건드리지 않습니다</li>
 *   <li>여러 인스턴스가 같은 저장소를 스캔해도 요청마다 한 번만 만료됩니다</li>
 * </ul>
 *
 * @author Waypoint Team
 * @since 1.0.0
 */
public final class ApprovalExpirySweeper {

    private static final Logger log = LoggerFactory.getLogger(ApprovalExpirySweeper.class);

    private final ApprovalManager approvalManager;
    private final ApprovalSweeperConfig config;
    private ScheduledExecutorService scheduler;
    private ScheduledFuture<?> task;

    /**
     * 생성자.
     *
     * @param approvalManager 승인 관리자
     * @param config 설정
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public ApprovalExpirySweeper(ApprovalManager approvalManager, ApprovalSweeperConfig config) {
        if (approvalManager == null) {
            throw new IllegalArgumentException("approvalManager cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.approvalManager = approvalManager;
        this.config = config;
    }

    /**
     * 만료된 요청 스캔.
     *
     * <p>실패해도 예외를 던지지 않습니다. 다음 주기에 다시 시도합니다.</p>
     *
     * @return 이번 스캔에서 만료 처리된 요청 수
     */
    public int scan() {
        log.debug("Approval expiry scan started");
        try {
            int expired = approvalManager.expireOverdue();
            if (expired > 0) {
                log.info("Approval expiry scan completed: {} expired", expired);
            }
            return expired;
        } catch (RuntimeException e) {
            log.error("Approval expiry scan failed", e);
            return 0;
        }
    }

    /**
     * 주기 스캔 시작. 이미 시작되었으면 아무 것도 하지 않습니다.
     */
    public synchronized void start() {
        if (scheduler != null) {
            return;
        }
        scheduler = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "waypoint-approval-sweeper");
            thread.setDaemon(true);
            return thread;
        });
        long intervalMs = config.interval().toMillis();
        task = scheduler.scheduleWithFixedDelay(this::scan, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
        log.info("Approval expiry sweeper started (interval={}ms)", intervalMs);
    }

    public synchronized boolean isRunning() {
        return task != null && !task.isCancelled();
    }

    /**
     * 주기 스캔 종료.
     *
     * @throws InterruptedException 종료 대기 중 인터럽트 발생 시
     */
    public synchronized void shutdown() throws InterruptedException {
        if (scheduler == null) {
            return;
        }
        task.cancel(false);
        scheduler.shutdown();
        if (!scheduler.awaitTermination(10, TimeUnit.SECONDS)) {
            scheduler.shutdownNow();
        }
        scheduler = null;
        task = null;
        log.info("Approval expiry sweeper stopped");
    }
}
