package io.github.goodees.choreo.store.inmemory;

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
import io.github.goodees.choreo.store.EventStoreException;
import io.github.goodees.choreo.store.Serialization;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * In-memory event log that passes every appended event through serialization, the way a persistent log would.
 * Readers get deserialized copies, and the payloads are available for inspection.
 * @param <E> base type of supported events
 */
public class InMemoryEventLogWithSerialization<E extends Event> extends InMemoryEventLog {
    private final Serialization<E> serialization;
    private final ConcurrentMap<String, List<String>> payloads = new ConcurrentHashMap<>();

    public InMemoryEventLogWithSerialization(Serialization<E> serialization) {
        this.serialization = serialization;
    }

    @Override
    protected Event toStored(Event event) throws EventStoreException {
        E serializable = serialization.toSerializable(event);
        if (serializable == null) {
            throw EventStoreException.unsupported(event, null);
        }
        try {
            int payloadVersion = serialization.payloadVersion(serializable);
            String payload = serialization.serialize(serializable);
            E copy = serialization.deserialize(payloadVersion, payload, event.getType());
            payloads.computeIfAbsent(event.streamId(), (s) -> Collections.synchronizedList(new ArrayList<>()))
                    .add(payload);
            return copy;
        } catch (RuntimeException e) {
            throw EventStoreException.unsupported(event, e);
        }
    }

    /**
     * Serialized payloads of a stream. Payloads of batches that failed to append may be included.
     * @param streamId stream id
     * @return payloads in order of serialization
     */
    public List<String> payloads(String streamId) {
        List<String> streamPayloads = payloads.get(streamId);
        if (streamPayloads == null) {
            return Collections.emptyList();
        }
        synchronized (streamPayloads) {
            return new ArrayList<>(streamPayloads);
        }
    }
}
