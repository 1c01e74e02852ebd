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

import java.time.Instant;
import java.util.Optional;

/**
 * Immutable fact about the business domain that became true.
 *
 * <p>Every aggregate class defines its own set of events. Events carry the position in their stream, so that the log
 * can perform optimistic concurrency checks, and the correlation of the request that caused them, so that a chain of
 * reactions across bounded contexts can be traced back to a single inbound command.</p>
 *
 * <p>The serialization format is not prescribed, but events may define annotations to support specific serialization
 * kinds, e. g. Jackson annotations. Support for events based on <a href="http://immutables.github.io">Immutables</a>
 * is in package {@link io.github.goodees.choreo.immutables}.</p>
 */
public interface Event {
    /**
     * The type of event. For every aggregate class this must uniquely identify the event to be created.
     * @return textual description of the type of event, uses class name by default, stripped from suffix Event, or
     *         prefix Immutable
     */
    default String getType() {
        return EventType.defaultTypeName(getClass());
    }

    /**
     * The id of the stream this event belongs to.
     * @return the stream id
     * @see Aggregate#getStreamId()
     */
    String streamId();

    /**
     * The version of the stream after this event is applied. Versions within a stream start at 1 and are consecutive.
     * @return the version of the stream
     */
    long streamVersion();

    /**
     * The time when an event occurred.
     * @return the instant of event creation
     */
    Instant getTimestamp();

    /**
     * Identifier shared by all events caused, directly or transitively, by single inbound request.
     * @return correlation id
     */
    String correlationId();

    /**
     * The id of the event that caused this one, empty for events caused directly by a command.
     * @return causing event id
     */
    Optional<String> causationId();

    /**
     * Identity of this event. Derived from its position in the stream, so it survives replays and serialization.
     * @return unique event id
     */
    default String eventId() {
        return streamId() + "@" + streamVersion();
    }
}
