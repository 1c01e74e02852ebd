package io.github.goodees.choreo.publish;

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

import io.github.goodees.choreo.Aggregate;
import io.github.goodees.choreo.Correlation;
import io.github.goodees.choreo.Event;
import io.github.goodees.choreo.Session;
import io.github.goodees.choreo.SessionFactory;
import io.github.goodees.choreo.store.EventStoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;

/**
 * Reactor that turns an event of one bounded context into a command on an aggregate of another one.
 *
 * <p>For every trigger event it opens a session correlated to the event, loads the target aggregate, invokes the
 * command, saves, and publishes the resulting events. When the target does not exist, the event is skipped with a
 * warning. Subclasses may override {@link #onTargetMissing(Event, String)} to route such events elsewhere.</p>
 *
 * <p>The reactor declares the event types its command emits. The publisher uses the declaration to refuse cyclic
 * registrations, and the reactor verifies before saving that the command kept to it and did not emit the trigger
 * type.</p>
 *
 * @param <E> trigger event type
 * @param <A> target aggregate type
 */
public abstract class ChoreographyReactor<E extends Event, A extends Aggregate> implements Reactor<E> {
    protected final Logger logger = LoggerFactory.getLogger(getClass());
    private final Class<E> eventType;
    private final Set<Class<? extends Event>> emittedEventTypes;
    private final Function<String, A> aggregateFactory;
    private final SessionFactory sessions;
    private final Publisher publisher;

    protected ChoreographyReactor(Class<E> eventType, Set<Class<? extends Event>> emittedEventTypes,
            Function<String, A> aggregateFactory, SessionFactory sessions, Publisher publisher) {
        this.eventType = Objects.requireNonNull(eventType);
        this.emittedEventTypes = Collections.unmodifiableSet(new LinkedHashSet<>(emittedEventTypes));
        this.aggregateFactory = Objects.requireNonNull(aggregateFactory);
        this.sessions = Objects.requireNonNull(sessions);
        this.publisher = Objects.requireNonNull(publisher);
    }

    /**
     * Stream id of the aggregate the event should be routed to.
     * @param event trigger event
     * @return target stream id
     */
    protected abstract String targetStreamId(E event);

    /**
     * Invoke command on loaded target.
     * @param target the target aggregate
     * @param event trigger event
     */
    protected abstract void invoke(A target, E event);

    /**
     * Called when target stream has no events.
     * @param event trigger event
     * @param streamId the missing stream
     */
    protected void onTargetMissing(E event, String streamId) {
        logger.warn("{} skips {} with correlation {}: target {} does not exist", getName(), event.eventId(),
                event.correlationId(), streamId);
    }

    @Override
    public final void react(E event) throws EventStoreException {
        String streamId = targetStreamId(event);
        List<Event> committed;
        try (Session session = sessions.open(Correlation.causedBy(event))) {
            Optional<A> target = session.load(streamId, aggregateFactory);
            if (!target.isPresent()) {
                onTargetMissing(event, streamId);
                return;
            }
            A aggregate = target.get();
            invoke(aggregate, event);
            verifyEmitted(aggregate);
            committed = session.save(aggregate);
        }
        logger.info("{} reacted to {} with {} events", getName(), event.eventId(), committed.size());
        publisher.publish(committed);
    }

    private void verifyEmitted(A aggregate) {
        for (Event emitted : aggregate.getUncommittedEvents()) {
            if (eventType.isInstance(emitted)) {
                throw new IllegalStateException(getName() + " emitted its own trigger type " + emitted.getType());
            }
            if (emittedEventTypes.stream().noneMatch(t -> t.isInstance(emitted))) {
                throw new IllegalStateException(getName() + " emitted undeclared event type " + emitted.getType());
            }
        }
    }

    public Class<E> getEventType() {
        return eventType;
    }

    public Set<Class<? extends Event>> getEmittedEventTypes() {
        return emittedEventTypes;
    }

    public String getName() {
        return getClass().getSimpleName();
    }

    @Override
    public String toString() {
        return getName() + "[" + eventType.getSimpleName() + " -> " + emittedEventTypes + "]";
    }
}
