package io.github.goodees.choreo.shop;

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

import io.github.goodees.choreo.immutables.ImmutableEvent;
import io.github.goodees.choreo.shop.inventory.event.StockDeductedEvent;
import io.github.goodees.choreo.shop.inventory.event.StockInitializedEvent;
import io.github.goodees.choreo.shop.inventory.event.StockReservedEvent;
import io.github.goodees.choreo.shop.inventory.event.StockRestockedEvent;
import io.github.goodees.choreo.shop.orders.event.OrderPlacedEvent;
import io.github.goodees.choreo.shop.orders.event.OrderShippedEvent;
import io.github.goodees.choreo.shop.orders.event.OrderStockReservedEvent;
import io.github.goodees.choreo.store.JacksonEventSerialization;

/**
 * Event types of both shop contexts.
 */
public final class ShopEvents {
    private ShopEvents() {
    }

    /**
     * @return JSON serialization aware of every shop event
     */
    public static JacksonEventSerialization<ImmutableEvent> serialization() {
        return new JacksonEventSerialization<>(ImmutableEvent.class)
                .register(StockInitializedEvent.class)
                .register(StockReservedEvent.class)
                .register(StockDeductedEvent.class)
                .register(StockRestockedEvent.class)
                .register(OrderPlacedEvent.class)
                .register(OrderStockReservedEvent.class)
                .register(OrderShippedEvent.class);
    }
}
