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

import io.github.goodees.choreo.Aggregate;
import io.github.goodees.choreo.Event;
import io.github.goodees.choreo.matching.TypeSwitch;
import io.github.goodees.choreo.shop.orders.event.OrderPlacedEvent;
import io.github.goodees.choreo.shop.orders.event.OrderShippedEvent;
import io.github.goodees.choreo.shop.orders.event.OrderStockReservedEvent;

import java.time.Instant;

/**
 * Customer order of single product.
 *
 * <p>An order is {@link OrderStatus#PENDING} after it is placed, becomes {@link OrderStatus#PLACED} once inventory
 * reserved its stock, and {@link OrderStatus#SHIPPED} when shipped. Status is null until the order is placed.</p>
 */
public class Order extends Aggregate {
    public static final String STREAM_PREFIX = "order-";

    private OrderStatus status;
    private String productId;
    private int quantity;
    private Instant placedAt;
    private Instant shippedAt;

    private final TypeSwitch apply = TypeSwitch.builder()
            .on(OrderPlacedEvent.class, e -> {
                status = OrderStatus.PENDING;
                productId = e.getProductId();
                quantity = e.getQuantity();
                placedAt = e.getTimestamp();
            })
            .on(OrderStockReservedEvent.class, e -> status = OrderStatus.PLACED)
            .on(OrderShippedEvent.class, e -> {
                status = OrderStatus.SHIPPED;
                shippedAt = e.getTimestamp();
            })
            .build();

    public Order(String streamId) {
        super(streamId);
    }

    public static String streamId(String orderId) {
        return STREAM_PREFIX + orderId;
    }

    public String getOrderId() {
        return getStreamId().substring(STREAM_PREFIX.length());
    }

    public void place(String productId, int quantity) {
        checkPrecondition(status == null, "order-already-placed", "Order already exists");
        checkArgument(productId != null && !productId.isEmpty(), "product-required", "Product must be specified");
        checkArgument(quantity > 0, "quantity-positive", "Quantity must be positive: " + quantity);
        emit(OrderPlacedEvent.builder(this)
                .orderId(getOrderId())
                .productId(productId)
                .quantity(quantity)
                .build());
    }

    public void markReserved() {
        checkPrecondition(status == OrderStatus.PENDING, "order-not-pending",
                "Order " + getOrderId() + " cannot be marked reserved in status " + status);
        emit(OrderStockReservedEvent.builder(this)
                .orderId(getOrderId())
                .build());
    }

    public void ship() {
        checkPrecondition(status == OrderStatus.PLACED, "order-not-placed",
                "Order " + getOrderId() + " cannot ship in status " + status);
        emit(OrderShippedEvent.builder(this)
                .orderId(getOrderId())
                .productId(productId)
                .quantity(quantity)
                .build());
    }

    @Override
    protected void updateState(Event event) {
        apply.executeMatching(event);
    }

    public OrderStatus getStatus() {
        return status;
    }

    public String getProductId() {
        return productId;
    }

    public int getQuantity() {
        return quantity;
    }

    public Instant getPlacedAt() {
        return placedAt;
    }

    public Instant getShippedAt() {
        return shippedAt;
    }
}
