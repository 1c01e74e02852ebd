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

import io.github.goodees.choreo.Event;
import io.github.goodees.choreo.immutables.ImmutableEvent;
import io.github.goodees.choreo.shop.inventory.ProductStock;
import io.github.goodees.choreo.shop.orders.Order;
import io.github.goodees.choreo.shop.orders.OrderStatus;
import io.github.goodees.choreo.shop.orders.event.OrderPlacedEvent;
import io.github.goodees.choreo.shop.orders.event.OrderShippedEvent;
import io.github.goodees.choreo.store.inmemory.InMemoryEventLogWithSerialization;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import java.util.List;

import static io.github.goodees.choreo.shop.ShopTest.await;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.instanceOf;
import static org.hamcrest.Matchers.not;
import static org.junit.Assert.assertEquals;

public class ShopSerializationTest {
    private InMemoryEventLogWithSerialization<ImmutableEvent> log;
    private Shop shop;

    @Before
    public void setUp() {
        log = new InMemoryEventLogWithSerialization<>(ShopEvents.serialization());
        shop = Shop.builder().eventLog(log).build();
    }

    @After
    public void tearDown() {
        shop.close();
    }

    @Test
    public void choreography_runs_on_serialized_events() throws Exception {
        await(shop.initializeStock("widget", "Widget", 100));
        String orderId = await(shop.placeOrder("widget", 25)).getOrderId();
        await(shop.shipOrder(orderId));

        assertEquals(OrderStatus.SHIPPED, shop.getOrderReadModel().get(orderId).get().getStatus());
        assertEquals(75, shop.getStockReadModel().get("widget").get().getOnHand());

        List<Event> orderEvents = log.fetch(Order.streamId(orderId));
        assertThat(orderEvents, hasSize(3));
        assertThat(orderEvents.get(0), instanceOf(OrderPlacedEvent.class));
        OrderShippedEvent shipped = (OrderShippedEvent) orderEvents.get(2);
        assertEquals("widget", shipped.getProductId());
        assertEquals(25, shipped.getQuantity());
        assertEquals(orderEvents.get(0).correlationId(), shipped.correlationId());
    }

    @Test
    public void payload_carries_event_data_but_not_type() throws Exception {
        await(shop.initializeStock("widget", "Widget", 100));

        List<String> payloads = log.payloads(ProductStock.streamId("widget"));
        assertThat(payloads, hasSize(1));
        assertThat(payloads.get(0), containsString("\"productName\":\"Widget\""));
        assertThat(payloads.get(0), containsString("\"initialQuantity\":100"));
        assertThat(payloads.get(0), containsString("\"streamVersion\":1"));
        assertThat(payloads.get(0), not(containsString("\"type\"")));
    }
}
