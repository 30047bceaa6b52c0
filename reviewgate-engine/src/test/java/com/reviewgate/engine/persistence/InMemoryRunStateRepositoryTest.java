package com.reviewgate.engine.persistence;

import com.reviewgate.core.repository.RunStateRepository;

import java.time.Clock;

class InMemoryRunStateRepositoryTest extends RunStateRepositoryContract {

    @Override
    protected RunStateRepository createStore(Clock clock) {
        return new InMemoryRunStateRepository(clock);
    }
}
