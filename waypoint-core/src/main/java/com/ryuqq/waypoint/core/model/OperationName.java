package com.ryuqq.waypoint.core.model;

/**
 * 보호 대상 Operation의 이름.
 *
 * <p>Circuit Breaker, Bulkhead, 메트릭은 모두 이 이름을 키로 사용합니다.
 * 워크플로우 실행 시에는 step id가 그대로 Operation 이름이 됩니다.</p>
 *
 * <p><strong>유효성 검증:</strong></p>
 * <ul>
 *   <li>null 또는 빈 문자열 불가</li>
 *   <li>길이: 1~255자</li>
 *   <li>패턴: 영숫자, 하이픈(-), 언더스코어(_), 점(.), 콜론(:)만 허용</li>
 * </ul>
 *
 * @author Waypoint Team
 * @since 1.0.0
 */
public final class OperationName {

    private static final int MAX_LENGTH = 255;

    private final String value;

    private OperationName(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("OperationName cannot be null or blank");
        }
        if (value.length() > MAX_LENGTH) {
            throw new IllegalArgumentException(
                "OperationName length cannot exceed " + MAX_LENGTH + " characters (current: " + value.length() + ")"
            );
        }
        if (!value.matches("^[a-zA-Z0-9\\-_.:]+$")) {
            throw new IllegalArgumentException(
                "OperationName contains invalid characters: " + value
            );
        }
        this.value = value;
    }

    /**
     * OperationName 생성.
     *
     * @param value 이름
     * @return OperationName 인스턴스
     * @throws IllegalArgumentException 유효하지 않은 값인 경우
     */
    public static OperationName of(String value) {
        return new OperationName(value);
    }

    public String getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        OperationName that = (OperationName) o;
        return value.equals(that.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return "OperationName{" + value + '}';
    }
}
