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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Consistency boundary whose state is derived solely from its ordered stream of events.
 *
 * <p>An aggregate is identified by the id of its stream. Its state can <strong>only</strong> change as result of
 * applying an event in method {@link #updateState(Event)}. Command methods of subclasses check their rules against
 * current state, and when satisfied, {@linkplain #emit(Event) emit} events. Emitted events are applied immediately,
 * so that further commands within the same unit of work observe them, and are buffered until the
 * {@link Session} saves them.</p>
 *
 * <p>A command that violates a rule must throw before emitting anything, so that a rejected command never leaves
 * partial state behind. Helpers {@link #checkArgument(boolean, String, String)} and
 * {@link #checkPrecondition(boolean, String, String)} serve this purpose.</p>
 *
 * <p>Aggregate instances are not thread safe. Each is owned by single session.</p>
 */
public abstract class Aggregate {
    protected final Logger logger = LoggerFactory.getLogger(getClass());
    private final String streamId;
    private long version;
    private final List<Event> uncommittedEvents = new ArrayList<>();
    private final List<Event> readOnlyUncommittedView = Collections.unmodifiableList(uncommittedEvents);
    private Correlation correlation = Correlation.newRequest();

    /**
     * Constructor for subclasses.
     * @param streamId the id of the stream of this aggregate
     */
    protected Aggregate(String streamId) {
        this.streamId = Objects.requireNonNull(streamId, "streamId");
    }

    /**
     * Return aggregate's stream id.
     * @return aggregate's stream id
     */
    public final String getStreamId() {
        return streamId;
    }

    /**
     * Version of the last committed event the aggregate has applied. 0 for a stream without events.
     * @return committed version
     */
    public final long getVersion() {
        return version;
    }

    /**
     * Events emitted since the aggregate was loaded or last saved.
     * @return read-only view of pending events
     */
    public final List<Event> getUncommittedEvents() {
        return readOnlyUncommittedView;
    }

    /**
     * Update the state as result of application of an event. This method must be very robust - it may not throw
     * an exception, consult the clock or any other external state, since it is invoked for historical events during
     * replay as well. Events it does not recognize should be ignored.
     * @param event event to apply
     */
    protected abstract void updateState(Event event);

    /**
     * Apply new event and buffer it for saving.
     * @param event the event to emit, created from header of this aggregate
     * @throws IllegalArgumentException when the event does not belong to this stream or does not carry next version
     */
    protected final void emit(Event event) {
        if (!streamId.equals(event.streamId())) {
            throw new IllegalArgumentException("Event " + event + " does not belong to stream " + streamId);
        }
        long expected = nextEventVersion();
        if (event.streamVersion() != expected) {
            throw new IllegalArgumentException("Event " + event + " has version " + event.streamVersion()
                    + ", expected " + expected);
        }
        updateState(event);
        uncommittedEvents.add(event);
    }

    /**
     * Offer next version for an event.
     * @return the version next emitted event should have
     */
    protected final long nextEventVersion() {
        return version + uncommittedEvents.size() + 1;
    }

    /**
     * Correlation new events will be stamped with.
     * @return current correlation
     */
    protected final Correlation getCorrelation() {
        return correlation;
    }

    /**
     * Reject the command as malformed when condition does not hold.
     * @param condition condition that must hold
     * @param rule name of the rule
     * @param message description of the problem
     * @throws ValidationException when condition is false
     */
    protected static void checkArgument(boolean condition, String rule, String message) {
        if (!condition) {
            throw new ValidationException(rule, message);
        }
    }

    /**
     * Reject the command as illegal in current state when condition does not hold.
     * @param condition condition that must hold
     * @param rule name of the rule
     * @param message description of the problem
     * @throws PreconditionException when condition is false
     */
    protected static void checkPrecondition(boolean condition, String rule, String message) {
        if (!condition) {
            throw new PreconditionException(rule, message);
        }
    }

    /**
     * Called by session when stored event is read from the log.
     * @param event past event from the log
     */
    final void replay(Event event) {
        updateState(event);
        version = event.streamVersion();
    }

    /**
     * Called by session after pending events were appended to the log.
     */
    final void markCommitted() {
        if (!uncommittedEvents.isEmpty()) {
            version = uncommittedEvents.get(uncommittedEvents.size() - 1).streamVersion();
            uncommittedEvents.clear();
        }
    }

    final void bind(Correlation correlation) {
        this.correlation = Objects.requireNonNull(correlation);
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + streamId + "@" + version + ", pending="
                + uncommittedEvents.size() + "]";
    }
}
