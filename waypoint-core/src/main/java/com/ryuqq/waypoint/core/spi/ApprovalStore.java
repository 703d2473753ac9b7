package com.ryuqq.waypoint.core.spi;

import com.ryuqq.waypoint.core.approval.ApprovalFilter;
import com.ryuqq.waypoint.core.approval.ApprovalRequest;
import com.ryuqq.waypoint.core.exception.ApprovalNotFoundException;

import java.util.List;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * 승인 요청 저장소 SPI.
 *
 * <p><strong>구현 요구사항:</strong></p>
 * <ul>
 *   <li>Thread-safe: 모든 메서드는 여러 스레드에서 동시에 호출될 수 있음</li>
 *   <li>Linearizable: 같은 요청에 대한 {@link #update(String, UnaryOperator)}는
 *       직렬화되어 정확히 하나의 결정만 반영되어야 함</li>
 *   <li>전이 함수가 예외를 던지면 저장된 값은 변경되지 않아야 함</li>
 * </ul>
 *
 * @author Waypoint Team
 * @since 1.0.0
 */
public interface ApprovalStore {

    /**
     * 새 요청 저장.
     *
     * @param request 저장할 요청
     * @throws IllegalArgumentException request가 null인 경우
     * @throws IllegalStateException 같은 ID가 이미 있는 경우
     */
    void save(ApprovalRequest request);

    /**
     * ID로 요청 조회.
     *
     * @param approvalId 요청 ID
     * @return 요청 (없으면 empty)
     */
    Optional<ApprovalRequest> findById(String approvalId);

    /**
     * 요청을 원자적으로 변경.
     *
     * <p>전이 함수는 요청별 lock 안에서 현재 값을 받아 새 값을 반환합니다.
     * 전이 함수의 예외는 그대로 전파되며 저장된 값은 유지됩니다.</p>
     *
     * @param approvalId 요청 ID
     * @param transition 전이 함수
     * @return 변경된 요청
     * @throws ApprovalNotFoundException 요청이 없는 경우
     */
    ApprovalRequest update(String approvalId, UnaryOperator<ApprovalRequest> transition);

    /**
     * 조건에 맞는 요청 조회 (순서 보장 없음).
     *
     * @param filter 조회 조건
     * @return 요청 목록
     */
    List<ApprovalRequest> findAll(ApprovalFilter filter);

    /**
     * 모든 요청 삭제.
     */
    void clear();
}
