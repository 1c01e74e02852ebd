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

import io.github.goodees.choreo.Command;
import io.github.goodees.choreo.CommandRejectedException;
import io.github.goodees.choreo.Correlation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Executes every inbound command as an independent unit of work on the configured thread pool.
 *
 * <p>Commands carrying an idempotency key are executed through the {@link io.github.goodees.choreo.idempotency.IdempotencyGuard},
 * so a retried command returns the result of the first execution. Only this outermost execution is guarded, the
 * reactions it triggers are not.</p>
 *
 * <p>The returned future can be cancelled, and commands can be given a timeout. Either interrupts the execution:
 * waiting for a concurrent execution with the same key is abandoned, and events not yet saved are never saved.</p>
 */
public class CommandDispatcher {

    private final DispatcherConfiguration conf;
    private final Logger logger;

    public CommandDispatcher(DispatcherConfiguration conf) {
        this.conf = conf;
        this.logger = LoggerFactory.getLogger(getClass().getName() + "." + conf.dispatcherName());
    }

    /**
     * Schedule a command in a new correlation.
     * @param command command to execute
     * @param handler handler of the command
     * @param <C> type of command
     * @param <RS> type of response
     * @return the promise for the response
     */
    public <C extends Command<RS>, RS> CompletableFuture<RS> execute(C command, CommandHandler<C, RS> handler) {
        return execute(command, handler, Correlation.newRequest());
    }

    /**
     * Schedule a command within given correlation.
     * @param command command to execute
     * @param handler handler of the command
     * @param correlation correlation of the request
     * @param <C> type of command
     * @param <RS> type of response
     * @return the promise for the response
     */
    public <C extends Command<RS>, RS> CompletableFuture<RS> execute(C command, CommandHandler<C, RS> handler,
            Correlation correlation) {
        return submit(new Invocation<>(command, handler, correlation));
    }

    /**
     * Schedule a command with timeout. If invocation doesn't finish until timeout, the result completes exceptionally
     * with {@code TimeoutException} and the execution is interrupted.
     * @param command command to execute
     * @param handler handler of the command
     * @param correlation correlation of the request
     * @param timeout timeout for completion
     * @param unit timeout unit
     * @param <C> type of command
     * @param <RS> type of response
     * @return the promise for the response
     */
    public <C extends Command<RS>, RS> CompletableFuture<RS> executeWithTimeout(C command,
            CommandHandler<C, RS> handler, Correlation correlation, long timeout, TimeUnit unit) {
        Invocation<C, RS> inv = new Invocation<>(command, handler, correlation);
        ScheduledFuture<?> timer = conf.schedulerService().schedule(inv::timeout, timeout, unit);
        inv.result.whenComplete((r, t) -> timer.cancel(false));
        return submit(inv);
    }

    private <C extends Command<RS>, RS> CompletableFuture<RS> submit(Invocation<C, RS> inv) {
        inv.result.executingAs(conf.executorService().submit(inv));
        return inv.result;
    }

    public static Throwable unwrapCompletionException(Throwable ex) {
        while (ex != null && ex.getCause() != null && ex instanceof CompletionException) {
            ex = ex.getCause();
        }
        return ex;
    }

    /**
     * Single execution of a command, and the response given to the client.
     */
    class Invocation<C extends Command<RS>, RS> implements Runnable {
        private final C command;
        private final CommandHandler<C, RS> handler;
        private final Correlation correlation;
        private final FutureResponse<RS> result = new FutureResponse<>();
        private final Instant submission = Instant.now();
        private volatile Instant executionStart;

        Invocation(C command, CommandHandler<C, RS> handler, Correlation correlation) {
            this.command = command;
            this.handler = handler;
            this.correlation = correlation;
        }

        @Override
        public void run() {
            if (result.isDone()) {
                logger.info("Invocation attempted to run after it was cancelled: {}", this);
                return;
            }
            executionStart = Instant.now();
            try {
                RS response = conf.idempotencyGuard().execute(command.idempotencyKey().orElse(null),
                        () -> handler.handle(command, correlation));
                result.doComplete(response);
            } catch (CommandRejectedException e) {
                logger.debug("Command rejected by rule {}: {}", e.getRule(), this);
                result.doCompleteExceptionally(e);
            } catch (InterruptedException e) {
                logger.info("Invocation interrupted: {}", this);
                result.doCompleteExceptionally(e);
            } catch (Exception e) {
                if (result.doCompleteExceptionally(unwrapCompletionException(e))) {
                    logger.warn("Invocation failed: {}", this, e);
                } else {
                    logger.info("Invocation failed after completion: {}", this, e);
                }
            }
        }

        void timeout() {
            if (result.abort(new TimeoutException("Command " + command + " did not complete in time"))) {
                logger.info("Invocation timed out: {}", this);
            }
        }

        @Override
        public String toString() {
            return "Invocation[command=" + command + ", correlation=" + correlation.getCorrelationId()
                    + ", submissionTime=" + submission + ", executionStart=" + executionStart + "]";
        }
    }
}
