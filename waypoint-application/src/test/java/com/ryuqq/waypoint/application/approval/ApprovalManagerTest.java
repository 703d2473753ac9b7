package com.ryuqq.waypoint.application.approval;

import com.ryuqq.waypoint.core.approval.ApprovalConfig;
import com.ryuqq.waypoint.core.approval.ApprovalFilter;
import com.ryuqq.waypoint.core.approval.ApprovalPriority;
import com.ryuqq.waypoint.core.approval.ApprovalRequest;
import com.ryuqq.waypoint.core.approval.ApprovalStats;
import com.ryuqq.waypoint.core.approval.ApprovalStatus;
import com.ryuqq.waypoint.core.exception.ApprovalAlreadyDecidedException;
import com.ryuqq.waypoint.core.exception.ApprovalNotFoundException;
import com.ryuqq.waypoint.core.exception.ApprovalReasonRequiredException;
import com.ryuqq.waypoint.core.exception.ApprovalTimeoutException;
import com.ryuqq.waypoint.core.exception.UnauthorizedApproverException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * ApprovalManager 유닛 테스트.
 *
 * @author Waypoint Team
 * @since 1.0.0
 */
@DisplayName("ApprovalManager 테스트")
class ApprovalManagerTest {

    private static final Instant START = Instant.parse("2026-01-01T00:00:00Z");

    private SettableClock clock;
    private FakeApprovalStore store;
    private ApprovalManager manager;

    @BeforeEach
    void setUp() {
        clock = new SettableClock(START);
        store = new FakeApprovalStore();
        manager = new ApprovalManager(store, clock);
    }

    private ApprovalRequest create(ApprovalConfig config) {
        return manager.createRequest("wf-1", "exec-1", "s1", "Deploy", "deployer", Map.of("env", "prod"), config);
    }

    @Nested
    @DisplayName("요청 생성")
    class Create {

        @Test
        @DisplayName("기본 설정: approval_ 접두사, 3600초 만료, MEDIUM 우선순위")
        void 기본_설정으로_생성() {
            // when
            ApprovalRequest request = create(null);

            // then
            assertThat(request.getId()).startsWith("approval_");
            assertThat(request.getStatus()).isEqualTo(ApprovalStatus.PENDING);
            assertThat(request.getExpiresAt()).isEqualTo(START.plusSeconds(3600));
            assertThat(request.getPriority()).isEqualTo(ApprovalPriority.MEDIUM);
            assertThat(manager.getRequest(request.getId())).contains(request);
        }

        @Test
        @DisplayName("없는 요청 조회는 empty, 결정은 ApprovalNotFoundException")
        void 없는_요청() {
            assertThat(manager.getRequest("approval_missing")).isEmpty();
            assertThatThrownBy(() -> manager.approve("approval_missing", "admin"))
                .isInstanceOf(ApprovalNotFoundException.class);
            assertThatThrownBy(() -> manager.waitForDecision("approval_missing", Duration.ofMillis(10)))
                .isInstanceOf(ApprovalNotFoundException.class);
        }
    }

    @Nested
    @DisplayName("결정")
    class Decide {

        @Test
        @DisplayName("두 번째 결정은 ApprovalAlreadyDecidedException 이고 첫 결정은 유지된다")
        void 두번째_결정_거부() {
            // given
            ApprovalRequest request = create(null);
            manager.approve(request.getId(), "alice", "ok");

            // when & then
            assertThatThrownBy(() -> manager.reject(request.getId(), "bob", "no"))
                .isInstanceOf(ApprovalAlreadyDecidedException.class);
            assertThatThrownBy(() -> manager.approve(request.getId(), "alice"))
                .isInstanceOf(ApprovalAlreadyDecidedException.class);

            ApprovalRequest stored = manager.getRequest(request.getId()).orElseThrow();
            assertThat(stored.getStatus()).isEqualTo(ApprovalStatus.APPROVED);
            assertThat(stored.getDecidedBy()).isEqualTo("alice");
            assertThat(stored.getDecisionReason()).isEqualTo("ok");
        }

        @Test
        @DisplayName("승인자 목록에 없는 사용자는 UnauthorizedApproverException, 목록의 사용자는 승인 가능")
        void 승인자_권한() {
            // given
            ApprovalRequest request = create(ApprovalConfig.requiredByDefault().withApprovers(Set.of("admin@x")));

            // when & then
            assertThatThrownBy(() -> manager.approve(request.getId(), "other@x"))
                .isInstanceOf(UnauthorizedApproverException.class)
                .satisfies(e -> assertThat(((UnauthorizedApproverException) e).getApprover()).isEqualTo("other@x"));
            assertThat(manager.getRequest(request.getId()).orElseThrow().getStatus())
                .isEqualTo(ApprovalStatus.PENDING);

            ApprovalRequest approved = manager.approve(request.getId(), "admin@x");
            assertThat(approved.getStatus()).isEqualTo(ApprovalStatus.APPROVED);
        }

        @Test
        @DisplayName("사유가 필수이면 사유 없는 결정은 거부된다")
        void 사유_필수() {
            // given
            ApprovalRequest request = create(ApprovalConfig.requiredByDefault().withReasonRequired(true));

            // when & then
            assertThatThrownBy(() -> manager.reject(request.getId(), "admin", " "))
                .isInstanceOf(ApprovalReasonRequiredException.class);
            assertThat(manager.reject(request.getId(), "admin", "risky").getStatus())
                .isEqualTo(ApprovalStatus.REJECTED);
        }

        @Test
        @DisplayName("동시에 승인과 거절이 들어오면 정확히 하나만 반영된다")
        void 동시_결정_하나만_성공() throws Exception {
            // given
            ApprovalRequest request = create(null);
            int threads = 16;
            ExecutorService executor = Executors.newFixedThreadPool(threads);
            CountDownLatch ready = new CountDownLatch(1);
            AtomicInteger winners = new AtomicInteger();
            AtomicInteger losers = new AtomicInteger();
            List<Future<?>> futures = new ArrayList<>();

            // when
            for (int i = 0; i < threads; i++) {
                boolean approve = i % 2 == 0;
                String approver = "user-" + i;
                futures.add(executor.submit(() -> {
                    ready.await();
                    try {
                        if (approve) {
                            manager.approve(request.getId(), approver);
                        } else {
                            manager.reject(request.getId(), approver);
                        }
                        winners.incrementAndGet();
                    } catch (ApprovalAlreadyDecidedException e) {
                        losers.incrementAndGet();
                    }
                    return null;
                }));
            }
            ready.countDown();
            for (Future<?> future : futures) {
                future.get(5, TimeUnit.SECONDS);
            }
            executor.shutdown();

            // then
            assertThat(winners.get()).isEqualTo(1);
            assertThat(losers.get()).isEqualTo(threads - 1);
        }

        @Test
        @DisplayName("cancel 은 PENDING 요청만 CANCELLED 로 만든다")
        void 취소() {
            // given
            ApprovalRequest request = create(null);

            // when
            ApprovalRequest cancelled = manager.cancel(request.getId());

            // then
            assertThat(cancelled.getStatus()).isEqualTo(ApprovalStatus.CANCELLED);
            assertThatThrownBy(() -> manager.cancel(request.getId()))
                .isInstanceOf(ApprovalAlreadyDecidedException.class);
        }
    }

    @Nested
    @DisplayName("결정 대기")
    class Wait {

        @Test
        @DisplayName("다른 스레드의 승인은 true, 거절은 false 를 반환한다")
        void 승인_거절_대기() throws Exception {
            // given
            ApprovalRequest approved = create(null);
            ApprovalRequest rejected = create(null);

            // when
            CompletableFuture<Boolean> approvedWait = CompletableFuture.supplyAsync(
                () -> manager.waitForDecision(approved.getId(), Duration.ofSeconds(5)));
            CompletableFuture<Boolean> rejectedWait = CompletableFuture.supplyAsync(
                () -> manager.waitForDecision(rejected.getId(), Duration.ofSeconds(5)));
            manager.approve(approved.getId(), "admin");
            manager.reject(rejected.getId(), "admin");

            // then
            assertThat(approvedWait.get(5, TimeUnit.SECONDS)).isTrue();
            assertThat(rejectedWait.get(5, TimeUnit.SECONDS)).isFalse();
        }

        @Test
        @DisplayName("이미 취소된 요청은 즉시 false")
        void 취소된_요청_대기() {
            // given
            ApprovalRequest request = create(null);
            manager.cancel(request.getId());

            // when & then
            assertThat(manager.waitForDecision(request.getId(), Duration.ZERO)).isFalse();
        }

        @Test
        @DisplayName("대기 시간 초과는 ApprovalTimeoutException 이고 요청은 PENDING 으로 남는다")
        void 대기_시간_초과() {
            // given
            ApprovalRequest request = create(null);

            // when & then
            assertThatThrownBy(() -> manager.waitForDecision(request.getId(), Duration.ofMillis(50)))
                .isInstanceOf(ApprovalTimeoutException.class);
            assertThat(manager.getRequest(request.getId()).orElseThrow().getStatus())
                .isEqualTo(ApprovalStatus.PENDING);
        }

        @Test
        @DisplayName("대기 중 만료 시각이 지나면 EXPIRED 로 처리되고 false 를 반환한다")
        void 대기_중_만료() throws Exception {
            // given
            ApprovalRequest request = create(ApprovalConfig.requiredByDefault().withTimeout(Duration.ofMinutes(1)));
            CompletableFuture<Boolean> waiting = CompletableFuture.supplyAsync(
                () -> manager.waitForDecision(request.getId(), Duration.ofSeconds(5)));

            // when
            clock.advance(Duration.ofMinutes(2));

            // then
            assertThat(waiting.get(5, TimeUnit.SECONDS)).isFalse();
            assertThat(manager.getRequest(request.getId()).orElseThrow().getStatus())
                .isEqualTo(ApprovalStatus.EXPIRED);
        }
    }

    @Nested
    @DisplayName("만료")
    class Expiry {

        @Test
        @DisplayName("만료 시각이 지난 요청은 다음 조회 시 EXPIRED 가 되고 결정할 수 없다")
        void lazy_만료() {
            // given
            ApprovalRequest request = create(ApprovalConfig.requiredByDefault().withTimeout(Duration.ofSeconds(30)));
            clock.advance(Duration.ofSeconds(31));

            // when & then
            assertThatThrownBy(() -> manager.approve(request.getId(), "admin"))
                .isInstanceOf(ApprovalAlreadyDecidedException.class)
                .satisfies(e -> assertThat(((ApprovalAlreadyDecidedException) e).getStatus())
                    .isEqualTo(ApprovalStatus.EXPIRED));
        }

        @Test
        @DisplayName("autoRejectOnTimeout 이면 만료는 system 거절이다")
        void 자동_거절() {
            // given
            ApprovalRequest request = create(ApprovalConfig.requiredByDefault()
                .withTimeout(Duration.ofSeconds(30))
                .withAutoRejectOnTimeout(true));
            clock.advance(Duration.ofSeconds(30));

            // when
            int expired = manager.expireOverdue();

            // then
            ApprovalRequest stored = manager.getRequest(request.getId()).orElseThrow();
            assertThat(expired).isEqualTo(1);
            assertThat(stored.getStatus()).isEqualTo(ApprovalStatus.REJECTED);
            assertThat(stored.getDecidedBy()).isEqualTo(ApprovalRequest.SYSTEM_APPROVER);
        }

        @Test
        @DisplayName("expireOverdue 는 만료 대상만 처리하고 반복 호출에 영향이 없다")
        void expireOverdue_멱등() {
            // given
            create(ApprovalConfig.requiredByDefault().withTimeout(Duration.ofSeconds(10)));
            create(ApprovalConfig.requiredByDefault().withTimeout(Duration.ofHours(1)));
            clock.advance(Duration.ofSeconds(11));

            // when & then
            assertThat(manager.expireOverdue()).isEqualTo(1);
            assertThat(manager.expireOverdue()).isZero();
            assertThat(manager.listPending()).hasSize(1);
        }
    }

    @Nested
    @DisplayName("조회와 통계")
    class Queries {

        @Test
        @DisplayName("대기 목록은 CRITICAL 부터, 같은 우선순위는 오래된 순으로 정렬된다")
        void 대기_목록_정렬() {
            // given
            ApprovalRequest low = create(ApprovalConfig.requiredByDefault().withPriority(ApprovalPriority.LOW));
            clock.advance(Duration.ofSeconds(1));
            ApprovalRequest criticalOld = create(ApprovalConfig.requiredByDefault().withPriority(ApprovalPriority.CRITICAL));
            clock.advance(Duration.ofSeconds(1));
            ApprovalRequest high = create(ApprovalConfig.requiredByDefault().withPriority(ApprovalPriority.HIGH));
            clock.advance(Duration.ofSeconds(1));
            ApprovalRequest criticalNew = create(ApprovalConfig.requiredByDefault().withPriority(ApprovalPriority.CRITICAL));

            // when
            List<ApprovalRequest> pending = manager.listPending();

            // then
            assertThat(pending).extracting(ApprovalRequest::getId)
                .containsExactly(criticalOld.getId(), criticalNew.getId(), high.getId(), low.getId());
            assertThat(manager.listPending(ApprovalFilter.all().withPriority(ApprovalPriority.CRITICAL)))
                .hasSize(2);
        }

        @Test
        @DisplayName("워크플로우 ID 필터")
        void 워크플로우_필터() {
            // given
            create(null);
            manager.createRequest("wf-2", "exec-9", "s1", "Deploy", null, null, null);

            // when & then
            assertThat(manager.listPending(ApprovalFilter.all().withWorkflowId("wf-2")))
                .singleElement()
                .satisfies(request -> assertThat(request.getExecutionId()).isEqualTo("exec-9"));
        }

        @Test
        @DisplayName("결정 목록은 종료된 요청만, 상태 필터를 적용한다")
        void 결정_목록() {
            // given
            ApprovalRequest a = create(null);
            ApprovalRequest b = create(null);
            create(null);
            manager.approve(a.getId(), "admin");
            manager.reject(b.getId(), "admin");

            // when & then
            assertThat(manager.listDecided()).hasSize(2);
            assertThat(manager.listDecided(ApprovalFilter.all().withStatus(ApprovalStatus.REJECTED)))
                .extracting(ApprovalRequest::getId)
                .containsExactly(b.getId());
            assertThat(manager.listDecided(ApprovalFilter.all().withStatus(ApprovalStatus.PENDING))).isEmpty();
        }

        @Test
        @DisplayName("통계는 상태별 건수와 평균 결정 시간을 제공한다")
        void 통계() {
            // given
            ApprovalRequest a = create(null);
            ApprovalRequest b = create(null);
            ApprovalRequest c = create(null);
            create(null);
            clock.advance(Duration.ofSeconds(10));
            manager.approve(a.getId(), "admin");
            clock.advance(Duration.ofSeconds(10));
            manager.reject(b.getId(), "admin");
            manager.cancel(c.getId());

            // when
            ApprovalStats stats = manager.getStats();

            // then
            assertThat(stats.pendingCount()).isEqualTo(1);
            assertThat(stats.approvedCount()).isEqualTo(1);
            assertThat(stats.rejectedCount()).isEqualTo(1);
            assertThat(stats.cancelledCount()).isEqualTo(1);
            assertThat(stats.decidedCount()).isEqualTo(3);
            assertThat(stats.totalCount()).isEqualTo(4);
            assertThat(stats.averageDecisionTime()).isEqualTo(Duration.ofSeconds(15));
        }
    }

    @Test
    @DisplayName("리스너는 생성과 종료를 통지받고, 리스너 예외는 처리에 영향이 없다")
    void 리스너_통지() {
        // given
        List<String> events = new ArrayList<>();
        manager.addListener(new ApprovalEventListener() {
            @Override
            public void onCreated(ApprovalRequest request) {
                events.add("created");
            }

            @Override
            public void onResolved(ApprovalRequest request) {
                events.add("resolved:" + request.getStatus());
            }
        });
        manager.addListener(new ApprovalEventListener() {
            @Override
            public void onCreated(ApprovalRequest request) {
                throw new IllegalStateException("listener failure");
            }
        });

        // when
        ApprovalRequest request = create(null);
        manager.approve(request.getId(), "admin");

        // then
        assertThat(events).containsExactly("created", "resolved:APPROVED");
    }
}
