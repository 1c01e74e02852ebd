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

import io.github.goodees.choreo.store.EventLog;
import io.github.goodees.choreo.store.inmemory.InMemoryEventLog;
import org.junit.Before;
import org.junit.Test;

import java.util.Arrays;
import java.util.List;

import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.instanceOf;
import static org.hamcrest.Matchers.is;
import static org.junit.Assert.assertEquals;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.Assert.fail;

public class AggregateTest {
    private EventLog log;
    private SessionFactory sessions;

    @Before
    public void setUp() {
        log = new InMemoryEventLog();
        sessions = new SessionFactory(log);
    }

    @Test
    public void emitted_events_are_applied_immediately_and_buffered() {
        Counter counter = new Counter("counter-1");
        counter.open(5);
        counter.increment(3);

        assertEquals(8, counter.getValue());
        assertEquals(0, counter.getVersion());
        assertThat(counter.getUncommittedEvents(), hasSize(2));
        assertEquals(1, counter.getUncommittedEvents().get(0).streamVersion());
        assertEquals(2, counter.getUncommittedEvents().get(1).streamVersion());
    }

    @Test
    public void rejected_command_leaves_no_trace() {
        Counter counter = new Counter("counter-1");
        counter.open(5);
        try {
            counter.decrement(6);
            fail("Decrement below zero should be rejected");
        } catch (PreconditionException e) {
            assertEquals("counter-not-negative", e.getRule());
        }
        assertEquals(5, counter.getValue());
        assertThat(counter.getUncommittedEvents(), hasSize(1));
    }

    @Test
    public void malformed_command_is_rejected_as_validation_error() {
        Counter counter = new Counter("counter-1");
        counter.open(5);
        try {
            counter.increment(0);
            fail("Non-positive amount should be rejected");
        } catch (ValidationException e) {
            assertEquals("amount-positive", e.getRule());
        }
        assertThat(counter.getUncommittedEvents(), hasSize(1));
    }

    @Test
    public void command_illegal_in_initial_state_is_rejected() {
        Counter counter = new Counter("counter-1");
        try {
            counter.increment(1);
            fail("Increment of unopened counter should be rejected");
        } catch (PreconditionException e) {
            assertEquals("counter-not-opened", e.getRule());
        }
        assertThat(counter.getUncommittedEvents(), empty());
    }

    @Test(expected = IllegalArgumentException.class)
    public void event_of_other_stream_cannot_be_emitted() {
        Counter counter = new Counter("counter-1");
        counter.emitUnchecked(new Counter.Incremented("counter-2", 1, 1));
    }

    @Test
    public void event_out_of_sequence_cannot_be_emitted() {
        Counter counter = new Counter("counter-1");
        try {
            counter.emitUnchecked(new Counter.Incremented("counter-1", 2, 1));
            fail("Version gap should be refused");
        } catch (IllegalArgumentException e) {
            assertThat(counter.getUncommittedEvents(), empty());
        }
    }

    @Test
    public void replay_is_deterministic() throws Exception {
        try (Session session = sessions.open()) {
            Counter counter = session.loadOrCreate("counter-1", Counter::new);
            counter.open(10);
            counter.increment(5);
            counter.decrement(7);
            counter.incrementInSteps(1, 2);
            session.save(counter);
        }
        Counter first;
        Counter second;
        try (Session session = sessions.open()) {
            first = session.loadOrCreate("counter-1", Counter::new);
        }
        try (Session session = sessions.open()) {
            second = session.loadOrCreate("counter-1", Counter::new);
        }
        assertEquals(11, first.getValue());
        assertEquals(first.getValue(), second.getValue());
        assertEquals(5, first.getVersion());
        assertEquals(first.getVersion(), second.getVersion());
    }

    @Test
    public void unknown_events_are_ignored_during_replay() throws Exception {
        List<Event> foreign = Arrays.asList(
                new EventHeader("counter-1", 1, Correlation.newRequest()),
                new Counter.Incremented("counter-1", 2, 4));
        log.append("counter-1", 0, foreign);
        try (Session session = sessions.open()) {
            Counter counter = session.loadOrCreate("counter-1", Counter::new);
            assertEquals(2, counter.getVersion());
            assertEquals(4, counter.getValue());
        }
    }

    @Test
    public void events_carry_header_of_emitting_aggregate() {
        Counter counter = new Counter("counter-1");
        counter.open(1);
        Event event = counter.getUncommittedEvents().get(0);
        assertThat(event, instanceOf(Counter.Opened.class));
        assertEquals("counter-1", event.streamId());
        assertEquals("counter-1@1", event.eventId());
        assertEquals("Opened", event.getType());
        assertThat(event.causationId().isPresent(), is(false));
    }

    @Test
    public void event_type_strips_prefix_and_suffix() {
        assertEquals("StockReserved", EventType.defaultTypeName("ImmutableStockReservedEvent"));
        assertEquals("StockReserved", EventType.defaultTypeName("StockReservedEvent"));
        assertEquals("Opened", EventType.defaultTypeName(Counter.Opened.class));
        assertEquals("", EventType.fromSimpleClassnameStripping("Event", "Immutable", "Event"));
    }
}
