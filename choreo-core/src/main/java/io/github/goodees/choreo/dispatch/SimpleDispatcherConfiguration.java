package io.github.goodees.choreo.dispatch;

/*-
 * #%L
 * choreo
 * %%
 * Copyright (C) 2017 Patrik Duditš
 * %%
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 * 
 *      http://www.apache.org/licenses/LICENSE-2.0
 * 
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 * #L%
 */

import io.github.goodees.choreo.idempotency.IdempotencyGuard;

import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ScheduledExecutorService;

/**
 * Dispatcher configuration with dependencies passed to constructor, as alternative to defining own implementation.
 */
public class SimpleDispatcherConfiguration implements DispatcherConfiguration {
    private final String name;
    private final ExecutorService executorService;
    private final ScheduledExecutorService schedulerService;
    private final IdempotencyGuard idempotencyGuard;

    /**
     * Create dispatcher configuration.
     * @param name The name of the dispatcher
     * @param executorService executor service to use
     * @param schedulerService scheduler service to use
     * @param idempotencyGuard guard for keyed commands
     */
    public SimpleDispatcherConfiguration(String name, ExecutorService executorService,
                                         ScheduledExecutorService schedulerService,
                                         IdempotencyGuard idempotencyGuard) {
        this.name = Objects.requireNonNull(name, "Name must be specified");
        this.executorService = Objects.requireNonNull(executorService, "Executor service must be specified");
        this.schedulerService = Objects.requireNonNull(schedulerService, "Scheduled executor must be specified");
        this.idempotencyGuard = Objects.requireNonNull(idempotencyGuard, "Idempotency guard must be specified");
    }

    @Override
    public String dispatcherName() {
        return name;
    }

    @Override
    public ExecutorService executorService() {
        return executorService;
    }

    @Override
    public ScheduledExecutorService schedulerService() {
        return schedulerService;
    }

    @Override
    public IdempotencyGuard idempotencyGuard() {
        return idempotencyGuard;
    }
}
