package com.ryuqq.waypoint.adapter.inmemory.approval;

import com.ryuqq.waypoint.core.approval.ApprovalFilter;
import com.ryuqq.waypoint.core.approval.ApprovalRequest;
import com.ryuqq.waypoint.core.exception.ApprovalNotFoundException;
import com.ryuqq.waypoint.core.spi.ApprovalStore;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.UnaryOperator;
import java.util.stream.Collectors;

/**
 * In-memory implementation of {@link ApprovalStore} SPI.
 *
 * <p>Requests are kept in a {@link ConcurrentHashMap} keyed by approval id. Decisions are
 * linearizable because {@link #update(String, UnaryOperator)} runs the transition inside
 * {@link ConcurrentHashMap#compute}, which holds the bin lock for that key.</p>
 *
 * <p><strong>Data Structures:</strong></p>
 * <ul>
 *   <li><strong>requests:</strong> ConcurrentHashMap&lt;String, ApprovalRequest&gt; - immutable request snapshots (O(1) access)</li>
 * </ul>
 *
 * <p><strong>Limitations:</strong></p>
 * <ul>
 *   <li>Data lost on process restart</li>
 *   <li>{@link #findAll(ApprovalFilter)} is a full scan</li>
 * </ul>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * ApprovalStore store = new InMemoryApprovalStore();
 * ApprovalManager manager = new ApprovalManager(store, Clock.systemUTC());
 * </pre>
 *
 * @author Waypoint Team
 * @since 1.0.0
 */
public class InMemoryApprovalStore implements ApprovalStore {

    private final ConcurrentHashMap<String, ApprovalRequest> requests = new ConcurrentHashMap<>();

    @Override
    public void save(ApprovalRequest request) {
        if (request == null) {
            throw new IllegalArgumentException("request cannot be null");
        }
        ApprovalRequest existing = requests.putIfAbsent(request.getId(), request);
        if (existing != null) {
            throw new IllegalStateException("Approval request already exists: " + request.getId());
        }
    }

    @Override
    public Optional<ApprovalRequest> findById(String approvalId) {
        if (approvalId == null) {
            throw new IllegalArgumentException("approvalId cannot be null");
        }
        return Optional.ofNullable(requests.get(approvalId));
    }

    /**
     * {@inheritDoc}
     *
     * <p><strong>Implementation Notes:</strong></p>
     * <ul>
     *   <li>The transition runs while the key is locked, so concurrent updates of one request are serialized</li>
     *   <li>If the transition throws, the mapping is left unchanged and the exception propagates</li>
     *   <li>The transition must not touch this store</li>
     * </ul>
     */
    @Override
    public ApprovalRequest update(String approvalId, UnaryOperator<ApprovalRequest> transition) {
        if (approvalId == null) {
            throw new IllegalArgumentException("approvalId cannot be null");
        }
        if (transition == null) {
            throw new IllegalArgumentException("transition cannot be null");
        }
        ApprovalRequest updated = requests.computeIfPresent(approvalId, (id, current) -> {
            ApprovalRequest next = transition.apply(current);
            if (next == null) {
                throw new IllegalStateException("transition returned null for approval: " + id);
            }
            return next;
        });
        if (updated == null) {
            throw new ApprovalNotFoundException(approvalId);
        }
        return updated;
    }

    @Override
    public List<ApprovalRequest> findAll(ApprovalFilter filter) {
        ApprovalFilter effective = filter == null ? ApprovalFilter.all() : filter;
        return requests.values().stream()
            .filter(effective::matches)
            .collect(Collectors.toList());
    }

    @Override
    public void clear() {
        requests.clear();
    }

    /**
     * 저장된 요청 수.
     *
     * @return 요청 수
     */
    public int size() {
        return requests.size();
    }
}
