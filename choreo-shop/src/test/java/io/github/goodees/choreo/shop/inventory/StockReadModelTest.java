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
import org.junit.Before;
import org.junit.Test;

import java.util.List;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;

public class StockReadModelTest {
    private StockReadModel readModel;
    private List<Event> events;

    @Before
    public void setUp() {
        readModel = new StockReadModel();
        ProductStock stock = new ProductStock(ProductStock.streamId("widget"));
        stock.initialize("Widget", 100);
        stock.reserve(10, "order-a");
        stock.reserve(20, "order-b");
        stock.deduct(10, "order-a");
        stock.restock(5);
        events = stock.getUncommittedEvents();
    }

    private StockView widget() {
        return readModel.get("widget").get();
    }

    @Test
    public void view_follows_stock_events() {
        events.forEach(readModel::apply);

        assertEquals("Widget", widget().getProductName());
        assertEquals(95, widget().getOnHand());
        assertEquals(20, widget().getReserved());
        assertEquals(75, widget().getAvailable());
        assertEquals(5, widget().getVersion());
    }

    @Test
    public void redelivered_events_are_ignored() {
        readModel.apply(events.get(0));
        readModel.apply(events.get(1));
        readModel.apply(events.get(1));
        readModel.apply(events.get(0));

        assertEquals(100, widget().getOnHand());
        assertEquals(10, widget().getReserved());
        assertEquals(2, widget().getVersion());
    }

    @Test
    public void reservations_delivered_out_of_order_are_both_counted() {
        readModel.apply(events.get(0));
        readModel.apply(events.get(2));
        assertEquals(0, widget().getReserved());
        assertEquals(1, readModel.pendingCount());

        readModel.apply(events.get(1));
        assertEquals(30, widget().getReserved());
        assertEquals(70, widget().getAvailable());
        assertEquals(3, widget().getVersion());
        assertEquals(0, readModel.pendingCount());
    }

    @Test
    public void changes_before_initialization_wait_for_it() {
        readModel.apply(events.get(1));
        assertFalse(readModel.get("widget").isPresent());

        readModel.apply(events.get(0));
        assertEquals(10, widget().getReserved());
        assertEquals(90, widget().getAvailable());
    }

    @Test
    public void any_delivery_order_gives_the_same_view() {
        for (int i = events.size() - 1; i >= 0; i--) {
            readModel.apply(events.get(i));
        }
        events.forEach(readModel::apply);

        assertEquals(95, widget().getOnHand());
        assertEquals(20, widget().getReserved());
        assertEquals(5, readModel.projectedVersion(ProductStock.streamId("widget")));
    }

    @Test
    public void unknown_product_has_no_view() {
        assertFalse(readModel.get("gadget").isPresent());
        assertEquals(0, readModel.all().size());
    }
}
