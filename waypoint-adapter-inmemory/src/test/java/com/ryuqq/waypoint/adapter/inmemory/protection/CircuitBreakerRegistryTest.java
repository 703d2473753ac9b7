package com.ryuqq.waypoint.adapter.inmemory.protection;

import com.ryuqq.waypoint.core.protection.CircuitBreaker;
import com.ryuqq.waypoint.core.protection.CircuitBreakerConfig;
import com.ryuqq.waypoint.core.protection.CircuitBreakerSnapshot;
import com.ryuqq.waypoint.core.protection.CircuitBreakerState;
import com.ryuqq.waypoint.core.protection.BulkheadConfig;
import com.ryuqq.waypoint.testkit.fixture.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * CircuitBreakerRegistry, BulkheadRegistry 테스트.
 *
 * @author Waypoint Team
 * @since 1.0.0
 */
@DisplayName("Protection 레지스트리 테스트")
class CircuitBreakerRegistryTest {

    private MutableClock clock;
    private CircuitBreakerRegistry registry;

    @BeforeEach
    void setUp() {
        clock = MutableClock.create();
        registry = new CircuitBreakerRegistry(new CircuitBreakerConfig(1, Duration.ofSeconds(10), 1), clock);
    }

    @Nested
    @DisplayName("CircuitBreakerRegistry")
    class CircuitBreakers {

        @Test
        @DisplayName("같은 이름은 같은 breaker 인스턴스")
        void 같은_이름_같은_인스턴스() {
            // when
            CircuitBreaker first = registry.get("billing");
            CircuitBreaker second = registry.get("billing");

            // then
            assertThat(first).isSameAs(second);
            assertThat(registry.get("search")).isNotSameAs(first);
        }

        @Test
        @DisplayName("find는 생성하지 않음")
        void find는_생성하지_않음() {
            assertThat(registry.find("billing")).isEmpty();
            assertThat(registry.snapshots()).isEmpty();
        }

        @Test
        @DisplayName("snapshots는 이름순")
        void snapshots_이름순() {
            // given
            registry.get("zeta");
            registry.get("alpha");
            registry.get("mid");

            // when
            Map<String, CircuitBreakerSnapshot> snapshots = registry.snapshots();

            // then
            assertThat(List.copyOf(snapshots.keySet())).containsExactly("alpha", "mid", "zeta");
        }

        @Test
        @DisplayName("reset(name)은 해당 breaker만, resetAll은 전부 CLOSED")
        void reset() {
            // given
            registry.get("a").recordFailure(new RuntimeException("boom"));
            registry.get("b").recordFailure(new RuntimeException("boom"));

            // when
            registry.reset("a");

            // then
            assertThat(registry.get("a").getState()).isEqualTo(CircuitBreakerState.CLOSED);
            assertThat(registry.get("b").getState()).isEqualTo(CircuitBreakerState.OPEN);

            registry.resetAll();
            assertThat(registry.get("b").getState()).isEqualTo(CircuitBreakerState.CLOSED);
        }

        @Test
        @DisplayName("registry가 준 clock으로 복구 시각 판단")
        void clock_공유() {
            // given
            CircuitBreaker breaker = registry.get("billing");
            breaker.recordFailure(new RuntimeException("boom"));

            // when
            clock.advance(Duration.ofSeconds(10));

            // then
            assertThat(breaker.getState()).isEqualTo(CircuitBreakerState.HALF_OPEN);
        }

        @Test
        @DisplayName("null 이름은 거부")
        void null_이름() {
            assertThatThrownBy(() -> registry.get(null)).isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Nested
    @DisplayName("BulkheadRegistry")
    class Bulkheads {

        @Test
        @DisplayName("이름별 독립 허용량과 거부 합계")
        void 이름별_독립() {
            // given
            BulkheadRegistry bulkheads = new BulkheadRegistry(new BulkheadConfig(1));

            // when
            boolean a1 = bulkheads.get("a").tryAcquire();
            boolean a2 = bulkheads.get("a").tryAcquire();
            boolean b1 = bulkheads.get("b").tryAcquire();

            // then
            assertThat(a1).isTrue();
            assertThat(a2).isFalse();
            assertThat(b1).isTrue();
            assertThat(bulkheads.totalRejected()).isEqualTo(1);
        }
    }
}
