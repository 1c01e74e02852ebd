package io.github.goodees.choreo;

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

import io.github.goodees.choreo.store.ConcurrencyConflictException;
import io.github.goodees.choreo.store.EventLog;
import io.github.goodees.choreo.store.EventStoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.function.Function;

/**
 * Unit of work over the event log. A session loads aggregates by replaying their streams, and saves the events
 * they emitted, guarded by the version observed at load time.
 *
 * <p>A session is meant for single request and single thread. Aggregates loaded through it are stamped with
 * the session's {@link Correlation}, so their events carry it.</p>
 *
 * <p>Closing the session discards whatever was not saved.</p>
 */
public class Session implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(Session.class);
    private final EventLog eventLog;
    private final Correlation correlation;
    private final List<Aggregate> tracked = new ArrayList<>();
    private boolean closed;

    Session(EventLog eventLog, Correlation correlation) {
        this.eventLog = eventLog;
        this.correlation = correlation;
    }

    public Correlation getCorrelation() {
        return correlation;
    }

    /**
     * Load an aggregate, or create a fresh one when its stream has no events yet.
     * @param streamId stream of the aggregate
     * @param factory constructor of the aggregate type, accepting stream id
     * @param <A> aggregate type
     * @return aggregate at the latest version of its stream, version 0 when it is new
     */
    public <A extends Aggregate> A loadOrCreate(String streamId, Function<String, A> factory) {
        checkOpen();
        A aggregate = factory.apply(streamId);
        if (!streamId.equals(aggregate.getStreamId())) {
            throw new IllegalArgumentException("Factory created aggregate for stream " + aggregate.getStreamId()
                    + " when asked for " + streamId);
        }
        try (EventLog.StoredEvents<? extends Event> events = eventLog.readEvents(streamId, 0)) {
            events.foreach(aggregate::replay);
        }
        aggregate.bind(correlation);
        tracked.add(aggregate);
        logger.debug("Loaded {} with correlation {}", aggregate, correlation);
        return aggregate;
    }

    /**
     * Load an existing aggregate.
     * @param streamId stream of the aggregate
     * @param factory constructor of the aggregate type, accepting stream id
     * @param <A> aggregate type
     * @return the aggregate, or empty if its stream has no events
     */
    public <A extends Aggregate> Optional<A> load(String streamId, Function<String, A> factory) {
        A aggregate = loadOrCreate(streamId, factory);
        if (aggregate.getVersion() == 0) {
            tracked.remove(aggregate);
            return Optional.empty();
        }
        return Optional.of(aggregate);
    }

    /**
     * Append pending events of the aggregate to the log. Either all events are appended and the aggregate advances to
     * the new version, or none is and the aggregate keeps its pending events.
     * @param aggregate aggregate loaded by this session
     * @return events that were committed, in order, for publication
     * @throws ConcurrencyConflictException when the stream was modified since the aggregate was loaded
     * @throws EventStoreException when the log rejects the events
     * @throws CancellationException when the calling thread was interrupted before the append
     */
    public List<Event> save(Aggregate aggregate) throws EventStoreException {
        checkOpen();
        List<Event> pending = new ArrayList<>(aggregate.getUncommittedEvents());
        if (pending.isEmpty()) {
            return Collections.emptyList();
        }
        if (Thread.currentThread().isInterrupted()) {
            throw new CancellationException("Save of " + aggregate + " cancelled");
        }
        eventLog.append(aggregate.getStreamId(), aggregate.getVersion(), pending);
        aggregate.markCommitted();
        logger.debug("Saved {} events of {}", pending.size(), aggregate);
        return Collections.unmodifiableList(pending);
    }

    private void checkOpen() {
        if (closed) {
            throw new IllegalStateException("Session is closed");
        }
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        for (Aggregate aggregate : tracked) {
            if (!aggregate.getUncommittedEvents().isEmpty()) {
                logger.debug("Discarding {} unsaved events of {}", aggregate.getUncommittedEvents().size(),
                        aggregate);
            }
        }
        tracked.clear();
    }
}
