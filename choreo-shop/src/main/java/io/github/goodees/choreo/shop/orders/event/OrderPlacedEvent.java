package io.github.goodees.choreo.shop.orders.event;

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
 * Customer placed an order. The order waits for stock reservation.
 */
@Value.Immutable
@JsonSerialize(as = ImmutableOrderPlacedEvent.class)
@JsonDeserialize(as = ImmutableOrderPlacedEvent.class)
public interface OrderPlacedEvent extends OrderEvent {
    String getProductId();

    int getQuantity();

    static Builder builder(Aggregate source) {
        return builderForAggregate(source, new Builder()::from);
    }

    class Builder extends ImmutableOrderPlacedEvent.Builder {
    }
}
