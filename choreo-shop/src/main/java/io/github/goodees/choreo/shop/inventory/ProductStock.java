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

import io.github.goodees.choreo.Aggregate;
import io.github.goodees.choreo.Event;
import io.github.goodees.choreo.matching.TypeSwitch;
import io.github.goodees.choreo.shop.inventory.event.StockDeductedEvent;
import io.github.goodees.choreo.shop.inventory.event.StockInitializedEvent;
import io.github.goodees.choreo.shop.inventory.event.StockReservedEvent;
import io.github.goodees.choreo.shop.inventory.event.StockRestockedEvent;

/**
 * Stock of single product. Quantity on hand is split into reserved and available part, reservations are made for
 * orders and deducted when orders ship.
 *
 * <p>Invariants: {@code 0 <= reserved <= onHand}, {@code available = onHand - reserved}.</p>
 */
public class ProductStock extends Aggregate {
    public static final String STREAM_PREFIX = "stock-";

    private boolean initialized;
    private String productId;
    private String productName;
    private int onHand;
    private int reserved;

    private final TypeSwitch apply = TypeSwitch.builder()
            .on(StockInitializedEvent.class, e -> {
                initialized = true;
                productId = e.getProductId();
                productName = e.getProductName();
                onHand = e.getInitialQuantity();
            })
            .on(StockReservedEvent.class, e -> reserved += e.getQuantity())
            .on(StockDeductedEvent.class, e -> {
                onHand -= e.getQuantity();
                reserved -= e.getQuantity();
            })
            .on(StockRestockedEvent.class, e -> onHand += e.getQuantity())
            .build();

    public ProductStock(String streamId) {
        super(streamId);
    }

    public static String streamId(String productId) {
        return STREAM_PREFIX + productId;
    }

    private String productIdFromStream() {
        return getStreamId().substring(STREAM_PREFIX.length());
    }

    public void initialize(String productName, int initialQuantity) {
        checkPrecondition(!initialized, "stock-already-initialized", "Stock already initialized");
        checkArgument(productName != null && !productName.isEmpty(), "product-name-required",
                "Product name must be specified");
        checkArgument(initialQuantity >= 0, "initial-quantity-not-negative",
                "Initial quantity cannot be negative: " + initialQuantity);
        emit(StockInitializedEvent.builder(this)
                .productId(productIdFromStream())
                .productName(productName)
                .initialQuantity(initialQuantity)
                .build());
    }

    public void reserve(int quantity, String orderId) {
        checkPrecondition(initialized, "stock-not-initialized", "Stock not initialized");
        checkArgument(quantity > 0, "quantity-positive", "Quantity must be positive: " + quantity);
        checkPrecondition(getAvailable() >= quantity, "insufficient-stock",
                "Insufficient stock. Available: " + getAvailable() + ", Requested: " + quantity);
        emit(StockReservedEvent.builder(this)
                .productId(productId)
                .orderId(orderId)
                .quantity(quantity)
                .build());
    }

    public void deduct(int quantity, String orderId) {
        checkPrecondition(initialized, "stock-not-initialized", "Stock not initialized");
        checkArgument(quantity > 0, "quantity-positive", "Quantity must be positive: " + quantity);
        checkPrecondition(quantity <= reserved, "deduct-exceeds-reserved",
                "Cannot deduct more than reserved. Reserved: " + reserved + ", Requested: " + quantity);
        emit(StockDeductedEvent.builder(this)
                .productId(productId)
                .orderId(orderId)
                .quantity(quantity)
                .build());
    }

    public void restock(int quantity) {
        checkPrecondition(initialized, "stock-not-initialized", "Stock not initialized");
        checkArgument(quantity > 0, "quantity-positive", "Quantity must be positive: " + quantity);
        emit(StockRestockedEvent.builder(this)
                .productId(productId)
                .quantity(quantity)
                .build());
    }

    @Override
    protected void updateState(Event event) {
        apply.executeMatching(event);
    }

    public boolean isInitialized() {
        return initialized;
    }

    public String getProductId() {
        return productId;
    }

    public String getProductName() {
        return productName;
    }

    public int getOnHand() {
        return onHand;
    }

    public int getReserved() {
        return reserved;
    }

    public int getAvailable() {
        return onHand - reserved;
    }
}
