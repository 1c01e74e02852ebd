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

import java.time.Instant;
import java.util.Optional;

/**
 * Queryable snapshot of an order.
 */
public final class OrderView {
    private final String orderId;
    private final String productId;
    private final int quantity;
    private final OrderStatus status;
    private final Instant placedAt;
    private final Instant shippedAt;
    private final long version;

    OrderView(String orderId, String productId, int quantity, OrderStatus status, Instant placedAt,
            Instant shippedAt, long version) {
        this.orderId = orderId;
        this.productId = productId;
        this.quantity = quantity;
        this.status = status;
        this.placedAt = placedAt;
        this.shippedAt = shippedAt;
        this.version = version;
    }

    OrderView withStatus(OrderStatus status, long version) {
        return new OrderView(orderId, productId, quantity, status, placedAt, shippedAt, version);
    }

    OrderView shipped(Instant shippedAt, long version) {
        return new OrderView(orderId, productId, quantity, OrderStatus.SHIPPED, placedAt, shippedAt, version);
    }

    public String getOrderId() {
        return orderId;
    }

    public String getProductId() {
        return productId;
    }

    public int getQuantity() {
        return quantity;
    }

    public OrderStatus getStatus() {
        return status;
    }

    public Instant getPlacedAt() {
        return placedAt;
    }

    public Optional<Instant> getShippedAt() {
        return Optional.ofNullable(shippedAt);
    }

    public long getVersion() {
        return version;
    }

    @Override
    public String toString() {
        return "OrderView[" + orderId + " " + status + ", " + quantity + " x " + productId + ", v" + version + "]";
    }
}
