package com.ryuqq.relay.adapter.inmemory.persistence;

import com.ryuqq.relay.core.spi.SagaPersistence;
import com.ryuqq.relay.testkit.contract.AbstractSagaPersistenceContractTest;

/**
 * Runs the persistence contract against {@link InMemorySagaPersistence}.
 *
 * @author Relay Team
 * @since 1.0.0
 */
class InMemorySagaPersistenceContractTest extends AbstractSagaPersistenceContractTest {

    @Override
    protected SagaPersistence createPersistence() {
        return new InMemorySagaPersistence();
    }
}
