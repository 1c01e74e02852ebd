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
import io.github.goodees.choreo.shop.inventory.event.StockDeductedEvent;
import io.github.goodees.choreo.shop.orders.event.OrderShippedEvent;

import java.util.Collections;

/**
 * Removes reserved quantity from stock when its order ships.
 */
public class DeductStockOnOrderShipped extends ChoreographyReactor<OrderShippedEvent, ProductStock> {

    public DeductStockOnOrderShipped(SessionFactory sessions, Publisher publisher) {
        super(OrderShippedEvent.class, Collections.singleton(StockDeductedEvent.class), ProductStock::new, sessions,
                publisher);
    }

    @Override
    protected String targetStreamId(OrderShippedEvent event) {
        return ProductStock.streamId(event.getProductId());
    }

    @Override
    protected void invoke(ProductStock stock, OrderShippedEvent event) {
        logger.info("Deducting {} of {} for shipped order {}", event.getQuantity(), event.getProductId(),
                event.getOrderId());
        stock.deduct(event.getQuantity(), event.getOrderId());
    }
}
