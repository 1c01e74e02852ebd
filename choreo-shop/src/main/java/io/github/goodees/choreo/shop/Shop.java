package io.github.goodees.choreo.shop;

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
import io.github.goodees.choreo.Correlation;
import io.github.goodees.choreo.SessionFactory;
import io.github.goodees.choreo.dispatch.CommandDispatcher;
import io.github.goodees.choreo.dispatch.CommandHandler;
import io.github.goodees.choreo.dispatch.SimpleDispatcherConfiguration;
import io.github.goodees.choreo.idempotency.IdempotencyGuard;
import io.github.goodees.choreo.publish.Publisher;
import io.github.goodees.choreo.shop.inventory.InitializeStock;
import io.github.goodees.choreo.shop.inventory.InventoryModule;
import io.github.goodees.choreo.shop.inventory.RestockProduct;
import io.github.goodees.choreo.shop.inventory.StockReadModel;
import io.github.goodees.choreo.shop.orders.OrderReadModel;
import io.github.goodees.choreo.shop.orders.OrdersModule;
import io.github.goodees.choreo.shop.orders.PlaceOrder;
import io.github.goodees.choreo.shop.orders.PlaceOrderResult;
import io.github.goodees.choreo.shop.orders.ShipOrder;
import io.github.goodees.choreo.store.EventLog;
import io.github.goodees.choreo.store.inmemory.InMemoryEventLog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * The shop application: orders and inventory choreographed over a shared event log.
 *
 * <p>Every command runs as its own unit of work on the worker pool, and the returned future completes once the
 * command and all reactions it triggered have finished. Read models are registered before reactors, so they observe
 * each event before the reactions to it.</p>
 *
 * <p>The shop owns its thread pools, {@link #close()} shuts them down.</p>
 */
public class Shop implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(Shop.class);

    private final EventLog eventLog;
    private final IdempotencyGuard idempotencyGuard;
    private final ExecutorService workers;
    private final ScheduledExecutorService scheduler;
    private final CommandDispatcher dispatcher;
    private final InventoryModule inventory;
    private final OrdersModule orders;
    private final Duration commandTimeout;

    private Shop(Builder builder) {
        this.eventLog = builder.eventLog != null ? builder.eventLog : new InMemoryEventLog();
        this.idempotencyGuard = new IdempotencyGuard(builder.idempotencyExpiry);
        this.workers = Executors.newFixedThreadPool(builder.workerThreads);
        this.scheduler = Executors.newSingleThreadScheduledExecutor();
        this.commandTimeout = builder.commandTimeout;

        SessionFactory sessions = new SessionFactory(eventLog);
        Publisher publisher = new Publisher();
        this.inventory = new InventoryModule(sessions, publisher);
        this.orders = new OrdersModule(sessions, publisher);
        inventory.registerProjections();
        orders.registerProjections();
        inventory.registerReactors();
        orders.registerReactors();

        this.dispatcher = new CommandDispatcher(
                new SimpleDispatcherConfiguration(builder.name, workers, scheduler, idempotencyGuard));
        logger.info("Shop {} started with {} workers", builder.name, builder.workerThreads);
    }

    public static Builder builder() {
        return new Builder();
    }

    public CompletableFuture<PlaceOrderResult> placeOrder(PlaceOrder command) {
        return dispatch(command, orders.getPlaceOrderHandler());
    }

    public CompletableFuture<PlaceOrderResult> placeOrder(String productId, int quantity) {
        return placeOrder(new PlaceOrder(productId, quantity));
    }

    public CompletableFuture<Void> shipOrder(ShipOrder command) {
        return dispatch(command, orders.getShipOrderHandler());
    }

    public CompletableFuture<Void> shipOrder(String orderId) {
        return shipOrder(new ShipOrder(orderId));
    }

    public CompletableFuture<Void> initializeStock(InitializeStock command) {
        return dispatch(command, inventory.getInitializeStockHandler());
    }

    public CompletableFuture<Void> initializeStock(String productId, String productName, int initialQuantity) {
        return initializeStock(new InitializeStock(productId, productName, initialQuantity));
    }

    public CompletableFuture<Void> restock(RestockProduct command) {
        return dispatch(command, inventory.getRestockProductHandler());
    }

    public CompletableFuture<Void> restock(String productId, int quantity) {
        return restock(new RestockProduct(productId, quantity));
    }

    private <C extends Command<RS>, RS> CompletableFuture<RS> dispatch(C command, CommandHandler<C, RS> handler) {
        if (commandTimeout == null) {
            return dispatcher.execute(command, handler);
        } else {
            return dispatcher.executeWithTimeout(command, handler, Correlation.newRequest(),
                    commandTimeout.toMillis(), TimeUnit.MILLISECONDS);
        }
    }

    public StockReadModel getStockReadModel() {
        return inventory.getStockReadModel();
    }

    public OrderReadModel getOrderReadModel() {
        return orders.getOrderReadModel();
    }

    public EventLog getEventLog() {
        return eventLog;
    }

    public IdempotencyGuard getIdempotencyGuard() {
        return idempotencyGuard;
    }

    @Override
    public void close() {
        scheduler.shutdownNow();
        workers.shutdown();
        try {
            if (!workers.awaitTermination(10, TimeUnit.SECONDS)) {
                logger.warn("Commands still running after 10 seconds, interrupting them");
                workers.shutdownNow();
            }
        } catch (InterruptedException e) {
            workers.shutdownNow();
            Thread.currentThread().interrupt();
        }
        idempotencyGuard.invalidateAll();
        logger.info("Shop stopped");
    }

    public static class Builder {
        private String name = "shop";
        private EventLog eventLog;
        private Duration idempotencyExpiry = IdempotencyGuard.DEFAULT_EXPIRY;
        private int workerThreads = 4;
        private Duration commandTimeout;

        private Builder() {
        }

        public Builder name(String name) {
            this.name = Objects.requireNonNull(name, "name");
            return this;
        }

        /**
         * Event log to use, an in-memory log is created when none is given.
         */
        public Builder eventLog(EventLog eventLog) {
            this.eventLog = eventLog;
            return this;
        }

        public Builder idempotencyExpiry(Duration expiry) {
            this.idempotencyExpiry = Objects.requireNonNull(expiry, "expiry");
            return this;
        }

        public Builder workerThreads(int threads) {
            if (threads < 1) {
                throw new IllegalArgumentException("At least one worker thread is needed");
            }
            this.workerThreads = threads;
            return this;
        }

        /**
         * Timeout applied to every command. Without it commands run until they finish.
         */
        public Builder commandTimeout(Duration timeout) {
            this.commandTimeout = timeout;
            return this;
        }

        public Shop build() {
            return new Shop(this);
        }
    }
}
