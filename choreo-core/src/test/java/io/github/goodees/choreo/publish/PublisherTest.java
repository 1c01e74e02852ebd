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

import ch.qos.logback.classic.Level;
import io.github.goodees.choreo.Correlation;
import io.github.goodees.choreo.Counter;
import io.github.goodees.choreo.Event;
import io.github.goodees.choreo.EventHeader;
import io.github.goodees.choreo.LogCapture;
import io.github.goodees.choreo.SessionFactory;
import io.github.goodees.choreo.store.inmemory.InMemoryEventLog;
import org.junit.Rule;
import org.junit.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.hasSize;
import static org.junit.Assert.fail;

public class PublisherTest {
    private final Publisher publisher = new Publisher();
    private final SessionFactory sessions = new SessionFactory(new InMemoryEventLog());
    private final List<String> calls = Collections.synchronizedList(new ArrayList<>());

    @Rule
    public LogCapture errors = new LogCapture(Publisher.class, Level.ERROR);

    @SafeVarargs
    static Set<Class<? extends Event>> emits(Class<? extends Event>... types) {
        return new LinkedHashSet<>(Arrays.asList(types));
    }

    private static Event incremented(String stream) {
        return new Counter.Incremented(stream, 1, 1);
    }

    @Test
    public void reactors_are_invoked_in_registration_order() {
        publisher.register(Counter.Incremented.class, e -> calls.add("first"))
                .register(Event.class, e -> calls.add("any"))
                .register(Counter.Incremented.class, e -> calls.add("second"))
                .register(Counter.Opened.class, e -> calls.add("opened"));

        publisher.publish(incremented("s"));

        assertThat(calls, contains("first", "any", "second"));
        assertThat(errors.messages(Level.ERROR), empty());
    }

    @Test
    public void failing_reactor_does_not_stop_delivery() {
        publisher.register(Counter.Incremented.class, e -> calls.add("before"))
                .register(Counter.Incremented.class, e -> {
                    throw new IllegalStateException("reactor broke");
                })
                .register(Counter.Incremented.class, e -> calls.add("after"));

        publisher.publish(Arrays.asList(incremented("s"), incremented("t")));

        assertThat(calls, contains("before", "after", "before", "after"));
        assertThat(errors.messages(Level.ERROR), hasSize(2));
        assertThat(errors.messages(Level.ERROR).get(0), containsString("s@1"));
    }

    @Test
    public void projections_receive_every_event() {
        publisher.register(e -> calls.add(e.getType()));

        publisher.publish(Arrays.asList(incremented("s"), new EventHeader("s", 2, Correlation.newRequest())));

        assertThat(calls, contains("Incremented", "EventHeader"));
    }

    @Test
    public void registrations_after_publish_are_honored() {
        publisher.register(Counter.Incremented.class, e -> calls.add("early"));
        publisher.publish(incremented("s"));
        publisher.register(Counter.Incremented.class, e -> calls.add("late"));
        publisher.publish(incremented("s"));

        assertThat(calls, contains("early", "early", "late"));
    }

    @Test
    public void reactor_emitting_its_trigger_is_refused() {
        try {
            publisher.register(new Relay<>(Counter.Incremented.class, emits(Counter.Incremented.class)));
            fail("Self triggering reactor should be refused");
        } catch (IllegalStateException e) {
            assertThat(e.getMessage(), containsString("cycle"));
        }
    }

    @Test
    public void cycle_through_several_reactors_is_refused() {
        publisher.register(new Relay<>(Counter.Opened.class, emits(Counter.Incremented.class)));
        publisher.register(new Relay<>(Counter.Incremented.class, emits(Counter.Decremented.class)));
        try {
            publisher.register(new Relay<>(Counter.Decremented.class, emits(Counter.Opened.class)));
            fail("Cycle should be refused");
        } catch (IllegalStateException e) {
            assertThat(e.getMessage(), containsString("cycle"));
        }
        publisher.publish(new Counter.Incremented("missing", 1, 1));
        assertThat(errors.messages(Level.ERROR), empty());
    }

    @Test
    public void reactor_triggered_by_supertype_of_its_output_is_refused() {
        try {
            publisher.register(new Relay<>(Event.class, emits(Counter.Decremented.class)));
            fail("Reactor receiving its own output should be refused");
        } catch (IllegalStateException e) {
            assertThat(e.getMessage(), containsString("cycle"));
        }
    }

    @Test
    public void cycle_through_broadly_declared_emission_is_refused() {
        publisher.register(new Relay<>(Counter.Opened.class, emits(Adjusted.class)));
        try {
            publisher.register(new Relay<>(Reset.class, emits(Counter.Opened.class)));
            fail("Reset is among the Adjusted events the first reactor may emit, cycle should be refused");
        } catch (IllegalStateException e) {
            assertThat(e.getMessage(), containsString("cycle"));
        }
    }

    @Test
    public void reactor_emitting_supertype_of_its_trigger_is_refused() {
        try {
            publisher.register(new Relay<>(Counter.Opened.class, emits(EventHeader.class)));
            fail("Reactor that may emit its own trigger should be refused");
        } catch (IllegalStateException e) {
            assertThat(e.getMessage(), containsString("cycle"));
        }
    }

    @Test
    public void choreography_reactor_cannot_bypass_cycle_check() {
        publisher.register(new Relay<>(Counter.Opened.class, emits(Counter.Incremented.class)));
        Relay<Counter.Incremented> closing = new Relay<>(Counter.Incremented.class, emits(Counter.Opened.class));
        try {
            publisher.register(Counter.Incremented.class, closing);
            fail("Choreography reactor should only be accepted with cycle check");
        } catch (IllegalArgumentException e) {
            assertThat(e.getMessage(), containsString("register(ChoreographyReactor)"));
        }
        publisher.publish(incremented("counter-1"));
        assertThat(calls, empty());
    }

    static class Adjusted extends EventHeader {
        Adjusted(String streamId, long version) {
            super(streamId, version, Correlation.newRequest());
        }
    }

    static class Reset extends Adjusted {
        Reset(String streamId, long version) {
            super(streamId, version);
        }
    }

    /**
     * Reactor that never finds its target, used for graph checks only.
     */
    private class Relay<E extends Event> extends ChoreographyReactor<E, Counter> {
        Relay(Class<E> trigger, Set<Class<? extends Event>> emits) {
            super(trigger, emits, Counter::new, sessions, publisher);
        }

        @Override
        protected String targetStreamId(E event) {
            return "missing-target";
        }

        @Override
        protected void invoke(Counter target, E event) {
            calls.add("relay");
        }
    }
}
