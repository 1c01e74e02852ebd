package io.github.goodees.choreo.shop.inventory.event;

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

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import io.github.goodees.choreo.Aggregate;
import org.immutables.value.Value;

import static io.github.goodees.choreo.immutables.ImmutableEvent.builderForAggregate;

/**
 * Quantity was set aside for an order. It is no longer available, but still on hand.
 */
@Value.Immutable
@JsonSerialize(as = ImmutableStockReservedEvent.class)
@JsonDeserialize(as = ImmutableStockReservedEvent.class)
public interface StockReservedEvent extends InventoryEvent {
    String getOrderId();

    int getQuantity();

    static Builder builder(Aggregate source) {
        return builderForAggregate(source, new Builder()::from);
    }

    class Builder extends ImmutableStockReservedEvent.Builder {
    }
}
