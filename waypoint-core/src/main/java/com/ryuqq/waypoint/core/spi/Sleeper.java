package com.ryuqq.waypoint.core.spi;

import java.time.Duration;

/**
 * 재시도 backoff 대기 SPI.
 *
 * <p>테스트에서는 실제로 잠들지 않고 요청된 지연만 기록하는 구현으로 교체합니다.</p>
 *
 * @author Waypoint Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface Sleeper {

    /**
     * 주어진 시간 동안 현재 스레드를 대기시킵니다.
     *
     * @param duration 대기 시간 (0 이하이면 즉시 반환)
     * @throws InterruptedException 대기 중 인터럽트된 경우
     */
    void sleep(Duration duration) throws InterruptedException;

    /**
     * {@link Thread#sleep(long)} 기반 기본 구현.
     *
     * @return system Sleeper
     */
    static Sleeper system() {
        return duration -> {
            if (duration != null && !duration.isNegative() && !duration.isZero()) {
                Thread.sleep(duration.toMillis());
            }
        };
    }
}
