package io.github.goodees.choreo.shop.inventory;

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

import io.github.goodees.choreo.SessionFactory;
import io.github.goodees.choreo.publish.Publisher;

/**
 * Inventory context: command handlers, the stock read model and the reactions to order events.
 */
public class InventoryModule {
    private final SessionFactory sessions;
    private final Publisher publisher;
    private final StockReadModel stockReadModel = new StockReadModel();
    private final InitializeStockHandler initializeStockHandler;
    private final RestockProductHandler restockProductHandler;

    public InventoryModule(SessionFactory sessions, Publisher publisher) {
        this.sessions = sessions;
        this.publisher = publisher;
        this.initializeStockHandler = new InitializeStockHandler(sessions, publisher);
        this.restockProductHandler = new RestockProductHandler(sessions, publisher);
    }

    public InventoryModule registerProjections() {
        publisher.register(stockReadModel);
        return this;
    }

    public InventoryModule registerReactors() {
        publisher.register(new ReserveStockOnOrderPlaced(sessions, publisher));
        publisher.register(new DeductStockOnOrderShipped(sessions, publisher));
        return this;
    }

    public StockReadModel getStockReadModel() {
        return stockReadModel;
    }

    public InitializeStockHandler getInitializeStockHandler() {
        return initializeStockHandler;
    }

    public RestockProductHandler getRestockProductHandler() {
        return restockProductHandler;
    }
}
