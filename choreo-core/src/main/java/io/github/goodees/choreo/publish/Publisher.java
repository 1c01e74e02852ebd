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

import io.github.goodees.choreo.Event;
import io.github.goodees.choreo.projection.Projection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Delivers committed events to registered reactors and projections.
 *
 * <p>Delivery is synchronous on the publishing thread and sequential, in order of registration. A failing reactor is
 * logged and delivery continues with the next one. A reactor that publishes its own events, as
 * {@link ChoreographyReactor} does, has them delivered before the publisher moves on.</p>
 *
 * <p>Choreography reactors declare which event types they emit. Registration of a reactor that would close a cycle
 * of reactions is refused, so a chain of reactions always terminates.</p>
 *
 * <p>Registration is expected to happen at startup, before events are published.</p>
 */
public class Publisher {
    private static final Logger logger = LoggerFactory.getLogger(Publisher.class);
    private final List<Registration<?>> registrations = new CopyOnWriteArrayList<>();
    private final List<ReactionEdge> reactionGraph = new ArrayList<>();
    private final ConcurrentMap<Class<?>, List<Registration<?>>> resolved = new ConcurrentHashMap<>();

    /**
     * Register a reactor for events of given type, including its subtypes.
     * @param eventType class or interface of events to receive
     * @param reactor the reactor
     * @param <E> event type
     * @return this publisher
     * @throws IllegalArgumentException when given a choreography reactor, which must be registered through
     *         {@link #register(ChoreographyReactor)}
     */
    public <E extends Event> Publisher register(Class<E> eventType, Reactor<? super E> reactor) {
        if (reactor instanceof ChoreographyReactor) {
            throw new IllegalArgumentException(((ChoreographyReactor<?, ?>) reactor).getName()
                    + " reacts with its own events and is registered with register(ChoreographyReactor)");
        }
        return register(eventType, reactor, reactor.getClass().getSimpleName());
    }

    /**
     * Register a choreography reactor under its trigger type.
     * @param reactor the reactor
     * @param <E> trigger event type
     * @return this publisher
     * @throws IllegalStateException when the reactor would close a cycle of reactions
     */
    public synchronized <E extends Event> Publisher register(ChoreographyReactor<E, ?> reactor) {
        ReactionEdge edge = new ReactionEdge(reactor.getEventType(), reactor.getEmittedEventTypes(),
                reactor.getName());
        ensureAcyclic(edge);
        reactionGraph.add(edge);
        return register(reactor.getEventType(), reactor, reactor.getName());
    }

    /**
     * Subscribe a projection to all events.
     * @param projection the read model
     * @return this publisher
     */
    public Publisher register(Projection projection) {
        return register(Event.class, projection::apply, projection.getClass().getSimpleName());
    }

    private synchronized <E extends Event> Publisher register(Class<E> eventType, Reactor<? super E> reactor,
            String name) {
        registrations.add(new Registration<>(eventType, reactor, name));
        resolved.clear();
        logger.debug("Registered {} for {}", name, eventType.getSimpleName());
        return this;
    }

    private void ensureAcyclic(ReactionEdge added) {
        List<ReactionEdge> graph = new ArrayList<>(reactionGraph);
        graph.add(added);
        Set<ReactionEdge> visited = Collections.newSetFromMap(new IdentityHashMap<>());
        Deque<ReactionEdge> pending = new ArrayDeque<>();
        pending.add(added);
        while (!pending.isEmpty()) {
            ReactionEdge edge = pending.poll();
            for (Class<? extends Event> emitted : edge.emitted) {
                for (ReactionEdge next : graph) {
                    if (overlap(next.trigger, emitted)) {
                        if (next == added) {
                            throw new IllegalStateException("Registering " + added.name + " would create a cycle: "
                                    + edge.name + " emits " + emitted.getSimpleName() + " that triggers "
                                    + added.name);
                        }
                        if (visited.add(next)) {
                            pending.add(next);
                        }
                    }
                }
            }
        }
    }

    // a declared supertype may be emitted as any of its subtypes
    private static boolean overlap(Class<?> trigger, Class<?> emitted) {
        return trigger.isAssignableFrom(emitted) || emitted.isAssignableFrom(trigger);
    }

    /**
     * Deliver events in order.
     * @param events committed events
     */
    public void publish(List<? extends Event> events) {
        for (Event event : events) {
            publish(event);
        }
    }

    /**
     * Deliver single event to every reactor registered for its type.
     * @param event committed event
     */
    public void publish(Event event) {
        List<Registration<?>> targets = resolved.computeIfAbsent(event.getClass(), this::resolve);
        logger.debug("Publishing {} with correlation {} to {} reactors", event.eventId(), event.correlationId(),
                targets.size());
        for (Registration<?> target : targets) {
            try {
                target.deliver(event);
            } catch (Exception e) {
                if (e instanceof InterruptedException) {
                    Thread.currentThread().interrupt();
                }
                logger.error("Reactor {} failed to process {} {} with correlation {}", target.name, event.getType(),
                        event.eventId(), event.correlationId(), e);
            }
        }
    }

    private List<Registration<?>> resolve(Class<?> eventClass) {
        List<Registration<?>> result = new ArrayList<>();
        for (Registration<?> registration : registrations) {
            if (registration.eventType.isAssignableFrom(eventClass)) {
                result.add(registration);
            }
        }
        return Collections.unmodifiableList(result);
    }

    private static class Registration<E extends Event> {
        private final Class<E> eventType;
        private final Reactor<? super E> reactor;
        private final String name;

        Registration(Class<E> eventType, Reactor<? super E> reactor, String name) {
            this.eventType = eventType;
            this.reactor = reactor;
            this.name = name;
        }

        void deliver(Event event) throws Exception {
            reactor.react(eventType.cast(event));
        }
    }

    private static class ReactionEdge {
        private final Class<? extends Event> trigger;
        private final Set<Class<? extends Event>> emitted;
        private final String name;

        ReactionEdge(Class<? extends Event> trigger, Set<Class<? extends Event>> emitted, String name) {
            this.trigger = trigger;
            this.emitted = emitted;
            this.name = name;
        }
    }
}
