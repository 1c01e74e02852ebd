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

import io.github.goodees.choreo.Correlation;
import io.github.goodees.choreo.Session;
import io.github.goodees.choreo.SessionFactory;
import io.github.goodees.choreo.dispatch.CommandHandler;
import io.github.goodees.choreo.publish.Publisher;
import io.github.goodees.choreo.store.EventStoreException;

public class InitializeStockHandler implements CommandHandler<InitializeStock, Void> {
    private final SessionFactory sessions;
    private final Publisher publisher;

    public InitializeStockHandler(SessionFactory sessions, Publisher publisher) {
        this.sessions = sessions;
        this.publisher = publisher;
    }

    @Override
    public Void handle(InitializeStock command, Correlation correlation) throws EventStoreException {
        try (Session session = sessions.open(correlation)) {
            ProductStock stock = session.loadOrCreate(ProductStock.streamId(command.getProductId()),
                    ProductStock::new);
            stock.initialize(command.getProductName(), command.getInitialQuantity());
            publisher.publish(session.save(stock));
        }
        return null;
    }
}
