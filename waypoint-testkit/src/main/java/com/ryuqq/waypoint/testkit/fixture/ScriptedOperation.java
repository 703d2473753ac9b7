package com.ryuqq.waypoint.testkit.fixture;

import com.ryuqq.waypoint.core.spi.Operation;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 호출 순서대로 정해진 결과를 내는 {@link Operation}.
 *
 * <p>마지막 단계는 스크립트가 끝난 뒤에도 반복됩니다.</p>
 *
 * <pre>{@code
 * ScriptedOperation<String> op = ScriptedOperation.<String>script()
 *     .thenThrow(new IOException("connection reset"))
 *     .thenThrow(new IOException("connection reset"))
 *     .thenReturn("ok");
 *
 * orchestrator.execute(op, "fetch");
 * assertEquals(3, op.invocations());
 * }</pre>
 *
 * @param <T> 결과 타입
 * @author Waypoint Team
 * @since 1.0.0
 */
public final class ScriptedOperation<T> implements Operation<T> {

    private final List<Operation<T>> steps = new ArrayList<>();
    private final AtomicInteger invocations = new AtomicInteger();

    private ScriptedOperation() {
    }

    public static <T> ScriptedOperation<T> script() {
        return new ScriptedOperation<>();
    }

    public static <T> ScriptedOperation<T> returning(T value) {
        return ScriptedOperation.<T>script().thenReturn(value);
    }

    public static <T> ScriptedOperation<T> failing(Exception error) {
        return ScriptedOperation.<T>script().thenThrow(error);
    }

    public synchronized ScriptedOperation<T> thenReturn(T value) {
        steps.add(() -> value);
        return this;
    }

    public synchronized ScriptedOperation<T> thenThrow(Exception error) {
        if (error == null) {
            throw new IllegalArgumentException("error cannot be null");
        }
        steps.add(() -> {
            throw error;
        });
        return this;
    }

    /**
     * 실패를 n번 반복하도록 추가.
     *
     * @param times 반복 횟수
     * @param error 던질 예외
     * @return this
     */
    public synchronized ScriptedOperation<T> thenThrowTimes(int times, Exception error) {
        for (int i = 0; i < times; i++) {
            thenThrow(error);
        }
        return this;
    }

    public synchronized ScriptedOperation<T> thenRun(Operation<T> step) {
        if (step == null) {
            throw new IllegalArgumentException("step cannot be null");
        }
        steps.add(step);
        return this;
    }

    @Override
    public T execute() throws Exception {
        int index = invocations.getAndIncrement();
        Operation<T> step;
        synchronized (this) {
            if (steps.isEmpty()) {
                throw new IllegalStateException("ScriptedOperation has no steps");
            }
            step = steps.get(Math.min(index, steps.size() - 1));
        }
        return step.execute();
    }

    public int invocations() {
        return invocations.get();
    }
}
