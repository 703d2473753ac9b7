package com.ryuqq.waypoint.testkit.contract;

import com.ryuqq.waypoint.core.approval.ApprovalConfig;
import com.ryuqq.waypoint.core.approval.ApprovalFilter;
import com.ryuqq.waypoint.core.approval.ApprovalPriority;
import com.ryuqq.waypoint.core.approval.ApprovalRequest;
import com.ryuqq.waypoint.core.approval.ApprovalStatus;
import com.ryuqq.waypoint.core.exception.ApprovalAlreadyDecidedException;
import com.ryuqq.waypoint.core.exception.ApprovalNotFoundException;
import com.ryuqq.waypoint.core.spi.ApprovalStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Contract Test for {@link ApprovalStore} implementations.
 *
 * <p><strong>Test Scenarios:</strong></p>
 * <ul>
 *   <li>save/findById round trip, duplicate ids rejected</li>
 *   <li>update of an unknown id throws {@link ApprovalNotFoundException}</li>
 *   <li>a throwing transition leaves the stored value unchanged</li>
 *   <li>concurrent decisions on one request: exactly one wins</li>
 *   <li>findAll honours every filter field</li>
 * </ul>
 *
 * @author Waypoint Team
 * @since 1.0.0
 */
public abstract class ApprovalStoreContract extends AbstractContractTest {

    protected ApprovalStore store;

    protected abstract ApprovalStore createStore();

    @BeforeEach
    void createStoreUnderTest() {
        store = createStore();
    }

    @AfterEach
    void clearStore() {
        if (store != null) {
            store.clear();
        }
    }

    /**
     * Creates a PENDING request stamped with the contract clock.
     */
    protected ApprovalRequest pendingRequest(String id, String workflowId, String executionId, ApprovalPriority priority) {
        return ApprovalRequest.create(id, workflowId, executionId, "deploy", "Deploy", "deployer",
            Map.of("env", "prod"), ApprovalConfig.requiredByDefault().withPriority(priority), clock.instant());
    }

    protected ApprovalRequest pendingRequest(String id) {
        return pendingRequest(id, "release", "exec-1", ApprovalPriority.MEDIUM);
    }

    @Test
    void testSaveAndFind_ReturnsStoredRequest() {
        // Given
        ApprovalRequest request = pendingRequest("apr-1");

        // When
        store.save(request);

        // Then
        ApprovalRequest found = store.findById("apr-1").orElseThrow();
        assertEquals("apr-1", found.getId());
        assertEquals(ApprovalStatus.PENDING, found.getStatus());
        assertEquals("prod", found.getContext().get("env"));
    }

    @Test
    void testFindUnknown_ReturnsEmpty() {
        assertTrue(store.findById("missing").isEmpty());
    }

    @Test
    void testSaveDuplicateId_Throws() {
        // Given
        store.save(pendingRequest("apr-1"));

        // When / Then
        assertThrows(IllegalStateException.class, () -> store.save(pendingRequest("apr-1")));
    }

    @Test
    void testUpdate_AppliesTransition() {
        // Given
        store.save(pendingRequest("apr-1"));

        // When
        ApprovalRequest approved = store.update("apr-1", current -> current.approve("alice", "ok", clock.instant()));

        // Then
        assertEquals(ApprovalStatus.APPROVED, approved.getStatus());
        assertEquals(ApprovalStatus.APPROVED, store.findById("apr-1").orElseThrow().getStatus());
        assertEquals("alice", store.findById("apr-1").orElseThrow().getDecidedBy());
    }

    @Test
    void testUpdateUnknown_ThrowsNotFound() {
        assertThrows(ApprovalNotFoundException.class,
            () -> store.update("missing", current -> current.cancel(clock.instant())));
    }

    @Test
    void testThrowingTransition_LeavesValueUnchanged() {
        // Given
        store.save(pendingRequest("apr-1"));
        store.update("apr-1", current -> current.reject("bob", "no", clock.instant()));

        // When
        assertThrows(ApprovalAlreadyDecidedException.class,
            () -> store.update("apr-1", current -> current.approve("alice", null, clock.instant())));

        // Then
        ApprovalRequest stored = store.findById("apr-1").orElseThrow();
        assertEquals(ApprovalStatus.REJECTED, stored.getStatus());
        assertEquals("bob", stored.getDecidedBy());
    }

    @Test
    void testConcurrentDecisions_ExactlyOneWins() throws Exception {
        // Given
        store.save(pendingRequest("apr-1"));
        int threads = 8;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<Boolean>> results = new ArrayList<>();

        try {
            // When
            for (int i = 0; i < threads; i++) {
                String approver = "approver-" + i;
                results.add(executor.submit(() -> {
                    start.await();
                    try {
                        store.update("apr-1", current -> current.approve(approver, null, clock.instant()));
                        return true;
                    } catch (ApprovalAlreadyDecidedException e) {
                        return false;
                    }
                }));
            }
            start.countDown();

            int winners = 0;
            for (Future<Boolean> result : results) {
                if (result.get(5, TimeUnit.SECONDS)) {
                    winners++;
                }
            }

            // Then
            assertEquals(1, winners, "exactly one decision may be applied");
            assertEquals(ApprovalStatus.APPROVED, store.findById("apr-1").orElseThrow().getStatus());
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    void testFindAll_FiltersByEveryField() {
        // Given
        store.save(pendingRequest("apr-1", "release", "exec-1", ApprovalPriority.HIGH));
        store.save(pendingRequest("apr-2", "release", "exec-2", ApprovalPriority.LOW));
        store.save(pendingRequest("apr-3", "onboarding", "exec-3", ApprovalPriority.HIGH));
        store.update("apr-2", current -> current.cancel(clock.instant()));

        // When / Then
        assertEquals(3, store.findAll(ApprovalFilter.all()).size());
        assertEquals(2, store.findAll(ApprovalFilter.all().withWorkflowId("release")).size());
        assertEquals(1, store.findAll(ApprovalFilter.all().withExecutionId("exec-3")).size());
        assertEquals(2, store.findAll(ApprovalFilter.all().withPriority(ApprovalPriority.HIGH)).size());
        assertEquals(1, store.findAll(ApprovalFilter.all().withStatus(ApprovalStatus.CANCELLED)).size());
        assertEquals(1, store.findAll(ApprovalFilter.all()
            .withWorkflowId("release")
            .withStatus(ApprovalStatus.PENDING)).size());
    }

    @Test
    void testClear_RemovesEverything() {
        // Given
        store.save(pendingRequest("apr-1"));
        store.save(pendingRequest("apr-2"));

        // When
        store.clear();

        // Then
        assertTrue(store.findAll(ApprovalFilter.all()).isEmpty());
    }
}
