/**
 * 결정적인 테스트를 위한 시간과 Operation 픽스처.
 *
 * <ul>
 *   <li>{@link com.ryuqq.waypoint.testkit.fixture.MutableClock} - 테스트가 직접 움직이는 시계</li>
 *   <li>{@link com.ryuqq.waypoint.testkit.fixture.RecordingSleeper} - 대기 대신 지연을 기록</li>
 *   <li>{@link com.ryuqq.waypoint.testkit.fixture.ScriptedOperation} - 호출 순서별 결과 스크립트</li>
 * </ul>
 *
 * @author Waypoint Team
 * @since 1.0.0
 */
package com.ryuqq.waypoint.testkit.fixture;
