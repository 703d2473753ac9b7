package com.ryuqq.waypoint.adapter.runner;

import com.ryuqq.waypoint.application.approval.ApprovalManager;
import com.ryuqq.waypoint.application.execution.ExecutionContext;
import com.ryuqq.waypoint.application.execution.ExecutionEventListener;
import com.ryuqq.waypoint.application.resilience.ResilienceOrchestrator;
import com.ryuqq.waypoint.application.resilience.ResilienceResult;
import com.ryuqq.waypoint.application.workflow.WorkflowDriver;
import com.ryuqq.waypoint.core.approval.ApprovalRequest;
import com.ryuqq.waypoint.core.exception.ApprovalAlreadyDecidedException;
import com.ryuqq.waypoint.core.exception.ApprovalTimeoutException;
import com.ryuqq.waypoint.core.exception.StepFailedException;
import com.ryuqq.waypoint.core.exception.WaypointException;
import com.ryuqq.waypoint.core.exception.WorkflowNotFoundException;
import com.ryuqq.waypoint.core.spi.Fallback;
import com.ryuqq.waypoint.core.spi.StepExecutor;
import com.ryuqq.waypoint.core.spi.WorkflowDefinitionSource;
import com.ryuqq.waypoint.core.statemachine.ExecutionStatus;
import com.ryuqq.waypoint.core.statemachine.StepStatus;
import com.ryuqq.waypoint.core.workflow.FailurePolicy;
import com.ryuqq.waypoint.core.workflow.StepDefinition;
import com.ryuqq.waypoint.core.workflow.WorkflowDefinition;
import com.ryuqq.waypoint.core.workflow.WorkflowGraph;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;

/**
 * {@link WorkflowDriver} 구현체.
 *
 * <p><strong>처리 흐름:</strong></p>
 * <pre>
 * submit(workflowId, inputs)
 *   ↓
 * 1. 정의 조회 + WorkflowGraph.validate()
 * 2. ExecutionContext 생성, start() → RUNNING
 * 3. 조정 스레드에서 drive():
 *    - 의존 step이 모두 성공한 step을 step 풀에 제출 (독립 step은 병렬)
 *    - step 완료마다 결과 기록, 실패 시 FailurePolicy 적용
 *      FAIL_FAST            → 실행 FAILED, 진행 중 step 결과는 무시
 *      CONTINUE_INDEPENDENT → 하위 step SKIPPED, 나머지 계속, 마지막에 FAILED
 *    - 모두 성공 → COMPLETED (outputs = step 결과)
 * </pre>
 *
 * <p><strong>step 실행:</strong></p>
 * <pre>
 * 승인 게이트가 있으면:
 *   createRequest → awaitApproval → waitForDecision → resumeFromApproval
 *   거절/만료/취소/대기 초과 → Operation 호출 없이 step 실패
 * 입력 해석 (StepInputResolver)
 * resilience.execute(stepExecutor.execute(step, inputs), step.id, fallbackFor(step))
 * </pre>
 *
 * <p><strong>동시성 제어:</strong></p>
 * <ul>
 *   <li>실행당 승인 게이트는 한 번에 하나 (ExecutionContext의 대기 중 승인은 하나뿐)</li>
 *   <li>ExecutionContext 상태 확인과 전이를 묶을 때는 컨텍스트 객체로 동기화</li>
 *   <li>취소는 협조적: 진행 중인 Operation은 중단되지 않고 결과만 버려짐</li>
 *   <li>실행이 취소, 실패, 시간 초과로 끝나면 대기 중인 승인 요청도 취소되어 step 스레드가 풀려남</li>
 * </ul>
 *
 * <p>생명주기 이벤트는 {@link ExecutionEventListener}로 전달됩니다.</p>
 *
 * <p>실행 중 발생한 모든 예외는 컨텍스트에 기록되며 호출자에게 전파되지 않습니다.</p>
 *
 * @author Waypoint Team
 * @since 1.0.0
 */
public final class WorkflowRunner implements WorkflowDriver {

    private static final Logger log = LoggerFactory.getLogger(WorkflowRunner.class);

    private final WorkflowDefinitionSource definitions;
    private final StepExecutor stepExecutor;
    private final ResilienceOrchestrator resilience;
    private final ApprovalManager approvalManager;
    private final WorkflowRunnerConfig config;
    private final Clock clock;
    private final ExecutorService stepPool;
    private final ExecutorService coordinatorPool;
    private final ConcurrentHashMap<String, Run> active = new ConcurrentHashMap<>();
    private final List<ExecutionEventListener> listeners = new CopyOnWriteArrayList<>();

    /**
     * 실행 1건의 런타임 상태.
     */
    private static final class Run {
        private final WorkflowDefinition definition;
        private final ExecutionContext context;
        private final ReentrantLock approvalGate = new ReentrantLock();

        private Run(WorkflowDefinition definition, ExecutionContext context) {
            this.definition = definition;
            this.context = context;
        }
    }

    /**
     * step 1건의 결과.
     */
    private record StepOutcome(String stepId, boolean succeeded, Throwable error) {

        static StepOutcome success(String stepId) {
            return new StepOutcome(stepId, true, null);
        }

        static StepOutcome failure(String stepId, Throwable error) {
            return new StepOutcome(stepId, false, error);
        }
    }

    /**
     * 생성자.
     *
     * @param definitions 워크플로우 정의 저장소
     * @param stepExecutor step 실행자
     * @param resilience 보호 실행기
     * @param approvalManager 승인 관리자
     * @param config 설정
     * @param clock 시각 공급자
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public WorkflowRunner(
        WorkflowDefinitionSource definitions,
        StepExecutor stepExecutor,
        ResilienceOrchestrator resilience,
        ApprovalManager approvalManager,
        WorkflowRunnerConfig config,
        Clock clock
    ) {
        if (definitions == null) {
            throw new IllegalArgumentException("definitions cannot be null");
        }
        if (stepExecutor == null) {
            throw new IllegalArgumentException("stepExecutor cannot be null");
        }
        if (resilience == null) {
            throw new IllegalArgumentException("resilience cannot be null");
        }
        if (approvalManager == null) {
            throw new IllegalArgumentException("approvalManager cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.definitions = definitions;
        this.stepExecutor = stepExecutor;
        this.resilience = resilience;
        this.approvalManager = approvalManager;
        this.config = config;
        this.clock = clock;
        this.stepPool = Executors.newFixedThreadPool(config.maxParallelSteps(), daemonThreads("waypoint-step-"));
        this.coordinatorPool = Executors.newCachedThreadPool(daemonThreads("waypoint-execution-"));
    }

    // ========== WorkflowDriver ==========

    @Override
    public ExecutionContext submit(String workflowId, Map<String, Object> inputs) {
        if (workflowId == null) {
            throw new IllegalArgumentException("workflowId cannot be null");
        }
        WorkflowDefinition definition = definitions.findById(workflowId)
            .orElseThrow(() -> new WorkflowNotFoundException(workflowId));
        WorkflowGraph.validate(definition);

        ExecutionContext context = ExecutionContext.create(definition.id(), inputs, clock);
        Run run = new Run(definition, context);
        context.start();
        active.put(context.getExecutionId(), run);
        log.info("Execution started: workflow={}, execution={}, steps={}",
            workflowId, context.getExecutionId(), definition.steps().size());

        notifyListeners(listener -> listener.onExecutionStarted(context));

        coordinatorPool.execute(() -> drive(run));
        return context;
    }

    @Override
    public ExecutionContext execute(String workflowId, Map<String, Object> inputs) {
        ExecutionContext context = submit(workflowId, inputs);
        context.termination().join();
        return context;
    }

    @Override
    public boolean cancel(String executionId) {
        Run run = active.get(executionId);
        if (run == null) {
            return false;
        }
        ExecutionContext context = run.context;
        String pendingApprovalId;
        boolean cancelled;
        synchronized (context) {
            pendingApprovalId = context.getPendingApprovalId();
            cancelled = context.cancel();
        }
        if (!cancelled) {
            return false;
        }
        log.info("Execution cancelled: execution={}", executionId);
        if (pendingApprovalId != null) {
            cancelApprovalQuietly(pendingApprovalId);
        }
        return true;
    }

    @Override
    public Optional<ExecutionContext> getExecution(String executionId) {
        Run run = active.get(executionId);
        return run == null ? Optional.empty() : Optional.of(run.context);
    }

    @Override
    public List<ExecutionContext> getActiveExecutions() {
        List<ExecutionContext> result = new ArrayList<>();
        active.values().forEach(run -> result.add(run.context));
        return result;
    }

    /**
     * 생명주기 리스너 등록.
     *
     * @param listener 리스너
     * @throws IllegalArgumentException listener가 null인 경우
     */
    public void addListener(ExecutionEventListener listener) {
        if (listener == null) {
            throw new IllegalArgumentException("listener cannot be null");
        }
        listeners.add(listener);
    }

    public void removeListener(ExecutionEventListener listener) {
        listeners.remove(listener);
    }

    /**
     * Runner 종료 (리소스 정리).
     *
     * @throws InterruptedException shutdown 대기 중 인터럽트 발생 시
     */
    public void shutdown() throws InterruptedException {
        coordinatorPool.shutdown();
        stepPool.shutdown();
        if (!coordinatorPool.awaitTermination(30, TimeUnit.SECONDS)) {
            coordinatorPool.shutdownNow();
        }
        if (!stepPool.awaitTermination(30, TimeUnit.SECONDS)) {
            stepPool.shutdownNow();
        }
    }

    // ========== 조정 ==========

    private void drive(Run run) {
        ExecutionContext context = run.context;
        String executionId = context.getExecutionId();
        try {
            runSteps(run);
            finish(run);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            failExecution(run, null, new WaypointException("Execution '" + executionId + "' interrupted", e));
        } catch (RuntimeException e) {
            log.error("Execution {} failed unexpectedly", executionId, e);
            failExecution(run, context.getCurrentStep(), e);
        } finally {
            active.remove(executionId);
            log.info("Execution finished: execution={}, status={}, duration={}",
                executionId, context.getStatus(), context.getDuration().orElse(null));
            notifyListeners(listener -> listener.onExecutionFinished(context));
        }
    }

    private void runSteps(Run run) throws InterruptedException {
        ExecutionContext context = run.context;
        WorkflowDefinition definition = run.definition;
        CompletionService<StepOutcome> completion = new ExecutorCompletionService<>(stepPool);

        Map<String, StepDefinition> waiting = new LinkedHashMap<>();
        for (String stepId : WorkflowGraph.topologicalOrder(definition)) {
            definition.findStep(stepId).ifPresent(step -> waiting.put(stepId, step));
        }
        Set<String> succeeded = new HashSet<>();
        int inFlight = 0;
        long deadline = config.hasExecutionTimeout()
            ? System.nanoTime() + config.executionTimeout().toNanos()
            : Long.MAX_VALUE;

        while (!context.isTerminal()) {
            // 1. 준비된 step 제출
            for (StepDefinition step : readySteps(waiting, succeeded)) {
                waiting.remove(step.id());
                completion.submit(() -> runStep(run, step));
                inFlight++;
            }
            if (inFlight == 0) {
                return;
            }

            // 2. 완료 대기
            Future<StepOutcome> next = awaitNext(completion, deadline);
            if (next == null) {
                timeOut(run);
                return;
            }
            inFlight--;
            StepOutcome outcome = outcomeOf(next);

            // 3. 결과 반영
            if (outcome.succeeded()) {
                succeeded.add(outcome.stepId());
                continue;
            }
            if (context.isTerminal()) {
                return;
            }
            notifyListeners(listener -> listener.onStepFailed(context, outcome.stepId(), outcome.error()));
            if (definition.failurePolicy() == FailurePolicy.FAIL_FAST) {
                log.error("Step {} failed, failing execution {}", outcome.stepId(), context.getExecutionId());
                context.markStep(outcome.stepId(), StepStatus.FAILED);
                failExecution(run, outcome.stepId(), outcome.error());
                return;
            }
            context.recordStepFailure(outcome.stepId(), outcome.error());
            for (String downstream : WorkflowGraph.downstreamOf(definition, outcome.stepId())) {
                if (waiting.remove(downstream) != null) {
                    context.markStep(downstream, StepStatus.SKIPPED);
                    log.info("Step {} skipped: depends on failed step {}", downstream, outcome.stepId());
                    notifyListeners(listener -> listener.onStepSkipped(context, downstream));
                }
            }
        }
    }

    private List<StepDefinition> readySteps(Map<String, StepDefinition> waiting, Set<String> succeeded) {
        List<StepDefinition> ready = new ArrayList<>();
        for (StepDefinition step : waiting.values()) {
            if (succeeded.containsAll(step.dependsOn())) {
                ready.add(step);
            }
        }
        return ready;
    }

    private Future<StepOutcome> awaitNext(CompletionService<StepOutcome> completion, long deadline)
        throws InterruptedException {
        if (deadline == Long.MAX_VALUE) {
            return completion.take();
        }
        long remaining = deadline - System.nanoTime();
        return remaining <= 0 ? completion.poll() : completion.poll(remaining, TimeUnit.NANOSECONDS);
    }

    private StepOutcome outcomeOf(Future<StepOutcome> future) throws InterruptedException {
        try {
            return future.get();
        } catch (ExecutionException e) {
            throw new IllegalStateException("Step task failed unexpectedly", e.getCause());
        }
    }

    private void timeOut(Run run) {
        ExecutionContext context = run.context;
        log.error("Execution {} timed out after {}", context.getExecutionId(), config.executionTimeout());
        failExecution(run, context.getCurrentStep(), new WaypointException(
            "Execution '" + context.getExecutionId() + "' timed out after " + config.executionTimeout().toMillis() + "ms"));
    }

    private void finish(Run run) {
        ExecutionContext context = run.context;
        synchronized (context) {
            if (context.isTerminal()) {
                return;
            }
            Set<String> failed = new LinkedHashSet<>();
            context.getStepStatuses().forEach((stepId, status) -> {
                if (status == StepStatus.FAILED) {
                    failed.add(stepId);
                }
            });
            if (failed.isEmpty()) {
                context.complete(context.getStepResults());
                return;
            }
            String first = failed.iterator().next();
            context.fail(first, new StepFailedException(first, failed.size() + " step(s) failed: " + failed));
        }
    }

    // ========== step ==========

    private StepOutcome runStep(Run run, StepDefinition step) {
        ExecutionContext context = run.context;
        try {
            if (step.requiresApproval()) {
                Optional<Throwable> denial = passApprovalGate(run, step);
                if (denial.isPresent()) {
                    log.warn("Step {} not executed: {}", step.id(), denial.get().getMessage());
                    return StepOutcome.failure(step.id(), denial.get());
                }
            }

            Map<String, Object> inputs =
                StepInputResolver.resolve(step, context.getInputs(), context.getStepResults());
            if (!context.markStep(step.id(), StepStatus.RUNNING)) {
                return StepOutcome.failure(step.id(), new StepFailedException(step.id(), "execution already ended"));
            }
            log.info("Step started: execution={}, step={}", context.getExecutionId(), step.id());
            notifyListeners(listener -> listener.onStepStarted(context, step.id()));

            Fallback<Object> fallback = stepExecutor.fallbackFor(step).orElse(null);
            ResilienceResult<Object> result = resilience.execute(
                () -> stepExecutor.execute(step, inputs), step.id(), fallback);

            if (context.recordStepResult(step.id(), result.result())) {
                notifyListeners(listener -> listener.onStepSucceeded(context, step.id(), result.result()));
            }
            log.info("Step succeeded: execution={}, step={}, attempts={}, fallback={}",
                context.getExecutionId(), step.id(), result.attempts(), result.usedFallback());
            return StepOutcome.success(step.id());
        } catch (RuntimeException e) {
            log.error("Step failed: execution={}, step={}", context.getExecutionId(), step.id(), e);
            return StepOutcome.failure(step.id(), e);
        }
    }

    /**
     * 승인 게이트 통과 시도.
     *
     * @return 통과하지 못한 이유 (통과하면 empty)
     */
    private Optional<Throwable> passApprovalGate(Run run, StepDefinition step) {
        ExecutionContext context = run.context;
        run.approvalGate.lock();
        try {
            Map<String, Object> preview =
                StepInputResolver.resolve(step, context.getInputs(), context.getStepResults());
            ApprovalRequest request = approvalManager.createRequest(
                context.getWorkflowId(), context.getExecutionId(), step.id(), step.name(),
                step.agentName(), preview, step.approval());

            synchronized (context) {
                if (context.isTerminal()) {
                    cancelApprovalQuietly(request.getId());
                    return Optional.of(new StepFailedException(step.id(), "execution already ended"));
                }
                context.awaitApproval(step.id(), request.getId());
            }

            boolean approved;
            try {
                approved = approvalManager.waitForDecision(request.getId(), waitTimeFor(request));
            } catch (ApprovalTimeoutException e) {
                cancelApprovalQuietly(request.getId());
                resumeIfAwaiting(context);
                return Optional.of(new StepFailedException(step.id(), "approval wait timed out", e));
            }
            resumeIfAwaiting(context);

            if (approved) {
                return Optional.empty();
            }
            ApprovalRequest decided = approvalManager.getRequest(request.getId()).orElse(request);
            String reason = decided.getDecisionReason() == null ? "" : " (" + decided.getDecisionReason() + ")";
            return Optional.of(new StepFailedException(step.id(),
                "approval " + decided.getStatus() + reason));
        } finally {
            run.approvalGate.unlock();
        }
    }

    private Duration waitTimeFor(ApprovalRequest request) {
        Duration untilExpiry = Duration.between(clock.instant(), request.getExpiresAt());
        if (untilExpiry.isNegative()) {
            untilExpiry = Duration.ZERO;
        }
        return untilExpiry.plus(config.approvalWaitGrace());
    }

    private void resumeIfAwaiting(ExecutionContext context) {
        synchronized (context) {
            if (context.getStatus() == ExecutionStatus.AWAITING_APPROVAL) {
                context.resumeFromApproval();
            }
        }
    }

    private void cancelApprovalQuietly(String approvalId) {
        try {
            approvalManager.cancel(approvalId);
        } catch (ApprovalAlreadyDecidedException e) {
            log.debug("Approval {} already {}, not cancelled", approvalId, e.getStatus());
        }
    }

    /**
     * 실행 실패 처리. 대기 중인 승인 요청은 취소되어 승인 게이트의 step 스레드가 풀려납니다.
     */
    private void failExecution(Run run, String stepId, Throwable cause) {
        ExecutionContext context = run.context;
        String pendingApprovalId;
        synchronized (context) {
            if (context.isTerminal()) {
                return;
            }
            pendingApprovalId = context.getPendingApprovalId();
            context.fail(stepId, cause);
        }
        if (pendingApprovalId != null) {
            cancelApprovalQuietly(pendingApprovalId);
        }
    }

    private void notifyListeners(Consumer<ExecutionEventListener> event) {
        for (ExecutionEventListener listener : listeners) {
            try {
                event.accept(listener);
            } catch (RuntimeException e) {
                log.warn("Execution listener failed: {}", e.getMessage(), e);
            }
        }
    }

    private static ThreadFactory daemonThreads(String prefix) {
        AtomicInteger sequence = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + sequence.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
