package io.github.goodees.choreo.shop.orders;

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
 * Orders context: command handlers, the order read model and the reaction to stock reservations.
 */
public class OrdersModule {
    private final SessionFactory sessions;
    private final Publisher publisher;
    private final OrderReadModel orderReadModel = new OrderReadModel();
    private final PlaceOrderHandler placeOrderHandler;
    private final ShipOrderHandler shipOrderHandler;

    public OrdersModule(SessionFactory sessions, Publisher publisher) {
        this.sessions = sessions;
        this.publisher = publisher;
        this.placeOrderHandler = new PlaceOrderHandler(sessions, publisher);
        this.shipOrderHandler = new ShipOrderHandler(sessions, publisher);
    }

    public OrdersModule registerProjections() {
        publisher.register(orderReadModel);
        return this;
    }

    public OrdersModule registerReactors() {
        publisher.register(new MarkOrderReservedOnStockReserved(sessions, publisher));
        return this;
    }

    public OrderReadModel getOrderReadModel() {
        return orderReadModel;
    }

    public PlaceOrderHandler getPlaceOrderHandler() {
        return placeOrderHandler;
    }

    public ShipOrderHandler getShipOrderHandler() {
        return shipOrderHandler;
    }
}
