package io.github.goodees.choreo.projection;

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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Projection that sees the events of every stream exactly once and in version order.
 *
 * <p>An event is projected only when it directly follows the last projected version of its stream. An event that
 * arrives ahead of its predecessors is held until the gap before it fills, and an event at or below the last
 * projected version is a redelivery and is ignored.</p>
 *
 * <p>Streams are expected to be seen from their first event. Events held behind a gap that never fills stay
 * pending, {@link #pendingCount()} reports them.</p>
 */
public abstract class SequencedProjection implements Projection {
    protected final Logger logger = LoggerFactory.getLogger(getClass());
    // guarded by this
    private final Map<String, StreamPosition> positions = new HashMap<>();

    @Override
    public final synchronized void apply(Event event) {
        if (!tracks(event)) {
            return;
        }
        StreamPosition position = positions.computeIfAbsent(event.streamId(), (s) -> new StreamPosition());
        long version = event.streamVersion();
        if (version <= position.projected || position.held.containsKey(version)) {
            logger.debug("Ignoring redelivered {}", event.eventId());
            return;
        }
        if (version > position.projected + 1) {
            logger.debug("Holding {} until version {} of {} arrives", event.eventId(), position.projected + 1,
                    event.streamId());
            position.held.put(version, event);
            return;
        }
        project(event);
        position.projected = version;
        Event next;
        while ((next = position.held.get(position.projected + 1)) != null) {
            project(next);
            position.held.remove(next.streamVersion());
            position.projected = next.streamVersion();
        }
    }

    /**
     * Decide whether the event belongs to a stream this projection follows. Every event of a followed stream must be
     * accepted, otherwise the stream never advances past the rejected version.
     * @param event delivered event
     * @return true if the event should be sequenced and projected
     */
    protected abstract boolean tracks(Event event);

    /**
     * Incorporate the event. Called with events of a stream in version order, each exactly once.
     * @param event next event of its stream
     */
    protected abstract void project(Event event);

    /**
     * @param streamId stream id
     * @return last version of the stream projected so far, 0 for unseen streams
     */
    public synchronized long projectedVersion(String streamId) {
        StreamPosition position = positions.get(streamId);
        return position == null ? 0 : position.projected;
    }

    /**
     * @return number of events held back, waiting for their predecessors
     */
    public synchronized int pendingCount() {
        int count = 0;
        for (StreamPosition position : positions.values()) {
            count += position.held.size();
        }
        return count;
    }

    private static final class StreamPosition {
        long projected;
        final SortedMap<Long, Event> held = new TreeMap<>();
    }
}
