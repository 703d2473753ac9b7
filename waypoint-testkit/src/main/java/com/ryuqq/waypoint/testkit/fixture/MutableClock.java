package com.ryuqq.waypoint.testkit.fixture;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;

/**
 * 테스트에서 시각을 직접 조작하는 {@link Clock}.
 *
 * <p>만료, recoveryTimeout, 실행 시간 측정처럼 시각에 의존하는 동작을
 * 실제로 기다리지 않고 검증할 때 사용합니다. 여러 스레드에서 읽어도 안전합니다.</p>
 *
 * <pre>{@code
 * MutableClock clock = MutableClock.startingAt(Instant.parse("2026-01-01T00:00:00Z"));
 * CircuitBreaker breaker = new InMemoryCircuitBreaker("op", config, clock);
 * clock.advance(Duration.ofSeconds(61));
 * }</pre>
 *
 * @author Waypoint Team
 * @since 1.0.0
 */
public final class MutableClock extends Clock {

    public static final Instant DEFAULT_START = Instant.parse("2026-01-01T00:00:00Z");

    private final ZoneId zone;
    private volatile Instant now;

    private MutableClock(Instant start, ZoneId zone) {
        this.now = start;
        this.zone = zone;
    }

    public static MutableClock startingAt(Instant start) {
        if (start == null) {
            throw new IllegalArgumentException("start cannot be null");
        }
        return new MutableClock(start, ZoneOffset.UTC);
    }

    public static MutableClock create() {
        return startingAt(DEFAULT_START);
    }

    /**
     * 시각을 앞으로 옮깁니다.
     *
     * @param duration 이동량 (음수 불가)
     * @return 이동 후 시각
     */
    public synchronized Instant advance(Duration duration) {
        if (duration == null || duration.isNegative()) {
            throw new IllegalArgumentException("duration cannot be null or negative (current: " + duration + ")");
        }
        now = now.plus(duration);
        return now;
    }

    public void set(Instant instant) {
        if (instant == null) {
            throw new IllegalArgumentException("instant cannot be null");
        }
        now = instant;
    }

    @Override
    public ZoneId getZone() {
        return zone;
    }

    @Override
    public Clock withZone(ZoneId zone) {
        return new MutableClock(now, zone);
    }

    @Override
    public Instant instant() {
        return now;
    }
}
