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
import io.github.goodees.choreo.publish.ChoreographyReactor;
import io.github.goodees.choreo.publish.Publisher;
import io.github.goodees.choreo.shop.inventory.event.StockReservedEvent;
import io.github.goodees.choreo.shop.orders.event.OrderPlacedEvent;

import java.util.Collections;

/**
 * Reserves stock for a newly placed order. Orders of products inventory does not track are left pending.
 */
public class ReserveStockOnOrderPlaced extends ChoreographyReactor<OrderPlacedEvent, ProductStock> {

    public ReserveStockOnOrderPlaced(SessionFactory sessions, Publisher publisher) {
        super(OrderPlacedEvent.class, Collections.singleton(StockReservedEvent.class), ProductStock::new, sessions,
                publisher);
    }

    @Override
    protected String targetStreamId(OrderPlacedEvent event) {
        return ProductStock.streamId(event.getProductId());
    }

    @Override
    protected void invoke(ProductStock stock, OrderPlacedEvent event) {
        logger.info("Reserving {} of {} for order {}", event.getQuantity(), event.getProductId(),
                event.getOrderId());
        stock.reserve(event.getQuantity(), event.getOrderId());
    }
}
