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

import io.github.goodees.choreo.Correlation;
import io.github.goodees.choreo.Session;
import io.github.goodees.choreo.SessionFactory;
import io.github.goodees.choreo.dispatch.CommandHandler;
import io.github.goodees.choreo.publish.Publisher;
import io.github.goodees.choreo.store.EventStoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.UUID;

/**
 * Creates an order under a fresh id and publishes its placement, which starts the reservation choreography.
 */
public class PlaceOrderHandler implements CommandHandler<PlaceOrder, PlaceOrderResult> {
    private static final Logger logger = LoggerFactory.getLogger(PlaceOrderHandler.class);
    private final SessionFactory sessions;
    private final Publisher publisher;

    public PlaceOrderHandler(SessionFactory sessions, Publisher publisher) {
        this.sessions = sessions;
        this.publisher = publisher;
    }

    @Override
    public PlaceOrderResult handle(PlaceOrder command, Correlation correlation) throws EventStoreException {
        String orderId = UUID.randomUUID().toString();
        try (Session session = sessions.open(correlation)) {
            Order order = session.loadOrCreate(Order.streamId(orderId), Order::new);
            order.place(command.getProductId(), command.getQuantity());
            publisher.publish(session.save(order));
        }
        logger.info("Placed order {} of {} x {}", orderId, command.getQuantity(), command.getProductId());
        return new PlaceOrderResult(orderId);
    }
}
