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
import io.github.goodees.choreo.store.EventLog;
import io.github.goodees.choreo.store.EventStoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.BiFunction;
import java.util.function.Consumer;

import static java.util.stream.Collectors.toList;

/**
 * Event log keeping streams in memory. Appends to single stream are serialized, appends to different streams proceed
 * independently.
 */
public class InMemoryEventLog implements EventLog {
    private static final Logger logger = LoggerFactory.getLogger(InMemoryEventLog.class);
    private final ConcurrentMap<String, List<Event>> storage = new ConcurrentHashMap<>();

    private List<Event> streamLog(String streamId) {
        return storage.computeIfAbsent(streamId, (i) -> new ArrayList<>());
    }

    // readers of unknown streams must not create them
    private List<Event> existingStreamLog(String streamId) {
        return storage.getOrDefault(streamId, Collections.emptyList());
    }

    private static long lastVersionOf(List<Event> streamLog) {
        return streamLog.isEmpty() ? 0 : streamLog.get(streamLog.size() - 1).streamVersion();
    }

    /**
     * @return number of streams kept
     */
    public int streamCount() {
        return storage.size();
    }

    @Override
    public long currentVersion(String streamId) {
        List<Event> streamLog = existingStreamLog(streamId);
        synchronized (streamLog) {
            return lastVersionOf(streamLog);
        }
    }

    @Override
    public void append(String streamId, long expectedVersion, List<? extends Event> events)
            throws EventStoreException {
        long version = expectedVersion;
        for (Event event : events) {
            if (!streamId.equals(event.streamId())) {
                throw EventStoreException.multipleStreams(streamId, event);
            }
            if (event.streamVersion() != ++version) {
                throw EventStoreException.nonMonotonic(streamId, version, event);
            }
        }
        List<Event> stored = new ArrayList<>(events.size());
        for (Event event : events) {
            stored.add(toStored(event));
        }
        List<Event> streamLog = streamLog(streamId);
        synchronized (streamLog) {
            long actual = lastVersionOf(streamLog);
            if (actual != expectedVersion) {
                throw EventStoreException.optimisticLock(streamId, expectedVersion, actual);
            }
            streamLog.addAll(stored);
        }
        logger.debug("Appended {} events to {}, now at version {}", stored.size(), streamId, version);
    }

    /**
     * Convert event into the form it is kept in. Subclasses may copy events to decouple readers from writers.
     * @param event appended event
     * @return event to keep in storage
     * @throws EventStoreException when event cannot be stored
     */
    protected Event toStored(Event event) throws EventStoreException {
        return event;
    }

    @Override
    public StoredEvents<Event> readEvents(String streamId, long afterVersion) {
        List<Event> events = existingStreamLog(streamId);
        List<Event> filteredEvents;
        synchronized (events) {
            filteredEvents = events.stream().filter(e -> e.streamVersion() > afterVersion).collect(toList());
        }
        return new StoredEvents<Event>() {
            boolean stop = false;

            @Override
            public void foreach(Consumer<? super Event> consumer) {
                for (Event event : filteredEvents) {
                    if (stop) {
                        break;
                    }
                    consumer.accept(event);
                }
            }

            @Override
            public <R> R reduce(R initial, BiFunction<R, ? super Event, R> reducer) {
                R result = initial;
                for (Event event : filteredEvents) {
                    if (stop) {
                        break;
                    }
                    result = reducer.apply(result, event);
                }
                return result;
            }

            @Override
            public void stop() {
                stop = true;
            }

            @Override
            public void close() {
            }
        };
    }
}
