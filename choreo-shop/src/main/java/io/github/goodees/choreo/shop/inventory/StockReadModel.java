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

import io.github.goodees.choreo.Event;
import io.github.goodees.choreo.matching.TypeSwitch;
import io.github.goodees.choreo.projection.SequencedProjection;
import io.github.goodees.choreo.shop.inventory.event.InventoryEvent;
import io.github.goodees.choreo.shop.inventory.event.StockDeductedEvent;
import io.github.goodees.choreo.shop.inventory.event.StockInitializedEvent;
import io.github.goodees.choreo.shop.inventory.event.StockReservedEvent;
import io.github.goodees.choreo.shop.inventory.event.StockRestockedEvent;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Current stock levels per product, projected from the stock streams in version order.
 */
public class StockReadModel extends SequencedProjection {
    private final ConcurrentMap<String, StockView> stocks = new ConcurrentHashMap<>();

    private final TypeSwitch changes = TypeSwitch.builder()
            .on(StockInitializedEvent.class, e -> stocks.put(e.getProductId(), new StockView(e.getProductId(),
                    e.getProductName(), e.getInitialQuantity(), 0, e.streamVersion())))
            .on(StockReservedEvent.class, e -> adjust(e, 0, e.getQuantity()))
            .on(StockDeductedEvent.class, e -> adjust(e, -e.getQuantity(), -e.getQuantity()))
            .on(StockRestockedEvent.class, e -> adjust(e, e.getQuantity(), 0))
            .build();

    @Override
    protected boolean tracks(Event event) {
        return event instanceof InventoryEvent;
    }

    @Override
    protected void project(Event event) {
        changes.executeMatching(event);
    }

    private void adjust(InventoryEvent e, int onHandDelta, int reservedDelta) {
        stocks.computeIfPresent(e.getProductId(),
                (id, view) -> view.adjust(onHandDelta, reservedDelta, e.streamVersion()));
    }

    public Optional<StockView> get(String productId) {
        return Optional.ofNullable(stocks.get(productId));
    }

    public List<StockView> all() {
        List<StockView> result = new ArrayList<>(stocks.values());
        result.sort(Comparator.comparing(StockView::getProductId));
        return result;
    }
}
