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
import io.github.goodees.choreo.publish.ChoreographyReactor;
import io.github.goodees.choreo.publish.Publisher;
import io.github.goodees.choreo.shop.inventory.event.StockReservedEvent;
import io.github.goodees.choreo.shop.orders.event.OrderStockReservedEvent;

import java.util.Collections;

/**
 * Confirms the order once inventory reserved its stock.
 */
public class MarkOrderReservedOnStockReserved extends ChoreographyReactor<StockReservedEvent, Order> {

    public MarkOrderReservedOnStockReserved(SessionFactory sessions, Publisher publisher) {
        super(StockReservedEvent.class, Collections.singleton(OrderStockReservedEvent.class), Order::new, sessions,
                publisher);
    }

    @Override
    protected String targetStreamId(StockReservedEvent event) {
        return Order.streamId(event.getOrderId());
    }

    @Override
    protected void invoke(Order order, StockReservedEvent event) {
        order.markReserved();
    }
}
