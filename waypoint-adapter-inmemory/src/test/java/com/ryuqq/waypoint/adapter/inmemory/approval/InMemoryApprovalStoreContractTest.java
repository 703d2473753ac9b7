package com.ryuqq.waypoint.adapter.inmemory.approval;

import com.ryuqq.waypoint.core.spi.ApprovalStore;
import com.ryuqq.waypoint.testkit.contract.ApprovalStoreContract;

/**
 * Contract Tests for {@link InMemoryApprovalStore}.
 *
 * @author Waypoint Team
 * @since 1.0.0
 */
class InMemoryApprovalStoreContractTest extends ApprovalStoreContract {

    @Override
    protected ApprovalStore createStore() {
        return new InMemoryApprovalStore();
    }
}
