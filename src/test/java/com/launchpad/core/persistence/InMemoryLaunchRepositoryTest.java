package com.launchpad.core.persistence;

import java.time.Clock;

class InMemoryLaunchRepositoryTest extends LaunchRepositoryContractTest {

    @Override
    protected LaunchRepository createRepository(Clock clock) {
        return new InMemoryLaunchRepository(clock);
    }
}
