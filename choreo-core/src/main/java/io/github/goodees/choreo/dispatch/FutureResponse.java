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

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Future;

/**
 * Read-only wrapper to CompletableFuture, used as return value from CommandDispatcher. Cancelling it interrupts the
 * execution of the command.
 */
final class FutureResponse<T> extends CompletableFuture<T> {
    private volatile Future<?> execution;

    void executingAs(Future<?> execution) {
        this.execution = execution;
        if (isDone()) {
            interrupt();
        }
    }

    @Override
    public boolean complete(T value) {
        throw new UnsupportedOperationException("Modifying response from client is not allowed");
    }

    @Override
    public boolean completeExceptionally(Throwable ex) {
        throw new UnsupportedOperationException("Modifying response from client is not allowed");
    }

    boolean doComplete(T value) {
        return super.complete(value);
    }

    boolean doCompleteExceptionally(Throwable t) {
        return super.completeExceptionally(t);
    }

    /**
     * Complete with failure and interrupt the execution if still running.
     * @param t cause
     * @return true if this call completed the response
     */
    boolean abort(Throwable t) {
        if (super.completeExceptionally(t)) {
            interrupt();
            return true;
        }
        return false;
    }

    @Override
    public boolean cancel(boolean mayInterruptIfRunning) {
        boolean cancelled = super.cancel(mayInterruptIfRunning);
        if (cancelled) {
            interrupt();
        }
        return cancelled;
    }

    private void interrupt() {
        Future<?> running = execution;
        if (running != null) {
            running.cancel(true);
        }
    }

    @Override
    public void obtrudeValue(T value) {
        throw new UnsupportedOperationException("Modifying response from client is not allowed");
    }

    @Override
    public void obtrudeException(Throwable ex) {
        throw new UnsupportedOperationException("Modifying response from client is not allowed");
    }
}
