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

import io.github.goodees.choreo.Event;
import io.github.goodees.choreo.matching.TypeSwitch;
import io.github.goodees.choreo.projection.SequencedProjection;
import io.github.goodees.choreo.shop.orders.event.OrderEvent;
import io.github.goodees.choreo.shop.orders.event.OrderPlacedEvent;
import io.github.goodees.choreo.shop.orders.event.OrderShippedEvent;
import io.github.goodees.choreo.shop.orders.event.OrderStockReservedEvent;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Orders and their status, projected from the order streams in version order.
 */
public class OrderReadModel extends SequencedProjection {
    private final ConcurrentMap<String, OrderView> orders = new ConcurrentHashMap<>();

    private final TypeSwitch changes = TypeSwitch.builder()
            .on(OrderPlacedEvent.class, e -> orders.put(e.getOrderId(), new OrderView(e.getOrderId(),
                    e.getProductId(), e.getQuantity(), OrderStatus.PENDING, e.getTimestamp(), null,
                    e.streamVersion())))
            .on(OrderStockReservedEvent.class, e -> orders.computeIfPresent(e.getOrderId(),
                    (id, view) -> view.withStatus(OrderStatus.PLACED, e.streamVersion())))
            .on(OrderShippedEvent.class, e -> orders.computeIfPresent(e.getOrderId(),
                    (id, view) -> view.shipped(e.getTimestamp(), e.streamVersion())))
            .build();

    @Override
    protected boolean tracks(Event event) {
        return event instanceof OrderEvent;
    }

    @Override
    protected void project(Event event) {
        changes.executeMatching(event);
    }

    public Optional<OrderView> get(String orderId) {
        return Optional.ofNullable(orders.get(orderId));
    }

    public List<OrderView> all() {
        List<OrderView> result = new ArrayList<>(orders.values());
        result.sort(Comparator.comparing(OrderView::getOrderId));
        return result;
    }
}
