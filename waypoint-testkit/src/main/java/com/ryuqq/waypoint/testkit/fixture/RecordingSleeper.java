package com.ryuqq.waypoint.testkit.fixture;

import com.ryuqq.waypoint.core.spi.Sleeper;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * 실제로 잠들지 않고 요청된 지연만 기록하는 {@link Sleeper}.
 *
 * <p>{@link MutableClock}을 함께 주면 요청된 만큼 시각을 앞으로 옮깁니다.</p>
 *
 * @author Waypoint Team
 * @since 1.0.0
 */
public final class RecordingSleeper implements Sleeper {

    private final MutableClock clock;
    private final List<Duration> sleeps = new CopyOnWriteArrayList<>();

    public RecordingSleeper() {
        this(null);
    }

    public RecordingSleeper(MutableClock clock) {
        this.clock = clock;
    }

    @Override
    public void sleep(Duration duration) throws InterruptedException {
        if (Thread.currentThread().isInterrupted()) {
            throw new InterruptedException("interrupted before sleep");
        }
        sleeps.add(duration);
        if (clock != null) {
            clock.advance(duration);
        }
    }

    public List<Duration> getSleeps() {
        return List.copyOf(sleeps);
    }

    public int count() {
        return sleeps.size();
    }

    public Duration total() {
        return sleeps.stream().reduce(Duration.ZERO, Duration::plus);
    }

    public void clear() {
        sleeps.clear();
    }
}
