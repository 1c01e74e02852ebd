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
import io.github.goodees.choreo.LogCapture;
import io.github.goodees.choreo.Session;
import io.github.goodees.choreo.SessionFactory;
import io.github.goodees.choreo.store.EventStoreException;
import io.github.goodees.choreo.store.inmemory.InMemoryEventLog;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import static io.github.goodees.choreo.publish.PublisherTest.emits;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.hasSize;
import static org.junit.Assert.assertEquals;

public class ChoreographyReactorTest {
    private final InMemoryEventLog log = new InMemoryEventLog();
    private final SessionFactory sessions = new SessionFactory(log);
    private final Publisher publisher = new Publisher();
    private final List<Event> delivered = Collections.synchronizedList(new ArrayList<>());

    @Rule
    public LogCapture errors = new LogCapture(Publisher.class, Level.ERROR);

    @Rule
    public LogCapture warnings = new LogCapture(MirrorOpening.class, Level.WARN);

    @Before
    public void setUp() {
        publisher.register(e -> delivered.add(e));
    }

    private List<Event> open(String streamId, int initial, Correlation correlation) throws EventStoreException {
        try (Session session = sessions.open(correlation)) {
            Counter counter = session.loadOrCreate(streamId, Counter::new);
            counter.open(initial);
            return session.save(counter);
        }
    }

    @Test
    public void reaction_is_saved_and_published_with_causation() throws EventStoreException {
        publisher.register(new MirrorOpening(sessions, publisher));
        open("mirror-a", 0, Correlation.newRequest());
        delivered.clear();

        Correlation request = Correlation.of("request-1");
        publisher.publish(open("source-a", 7, request));

        assertThat(delivered, hasSize(2));
        Event trigger = delivered.get(0);
        Event reaction = delivered.get(1);
        assertEquals("mirror-a", reaction.streamId());
        assertEquals("request-1", reaction.correlationId());
        assertEquals(Optional.of(trigger.eventId()), reaction.causationId());
        try (Session session = sessions.open()) {
            assertEquals(7, session.load("mirror-a", Counter::new).get().getValue());
        }
        assertThat(errors.messages(Level.ERROR), empty());
    }

    @Test
    public void missing_target_is_skipped_with_warning() throws EventStoreException {
        publisher.register(new MirrorOpening(sessions, publisher));

        publisher.publish(open("source-b", 3, Correlation.newRequest()));

        assertThat(delivered, hasSize(1));
        assertEquals(0, log.currentVersion("mirror-b"));
        assertThat(warnings.messages(Level.WARN), hasSize(1));
        assertThat(warnings.messages(Level.WARN).get(0), containsString("mirror-b"));
        assertThat(errors.messages(Level.ERROR), empty());
    }

    @Test
    public void rejected_reaction_is_logged_and_not_saved() throws EventStoreException {
        publisher.register(new MirrorOpening(sessions, publisher));
        open("mirror-c", 0, Correlation.newRequest());

        // zero is not a valid increment
        publisher.publish(open("source-c", 0, Correlation.newRequest()));

        assertEquals(1, log.currentVersion("mirror-c"));
        assertThat(errors.messages(Level.ERROR), hasSize(1));
    }

    @Test
    public void undeclared_emission_is_not_saved() throws EventStoreException {
        publisher.register(new MisdeclaredMirror(sessions, publisher));
        open("mirror-d", 0, Correlation.newRequest());

        publisher.publish(open("source-d", 2, Correlation.newRequest()));

        assertEquals(1, log.currentVersion("mirror-d"));
        assertThat(errors.messages(Level.ERROR), hasSize(1));
    }

    @Test
    public void reactions_follow_registration_order() throws EventStoreException {
        List<String> order = Collections.synchronizedList(new ArrayList<>());
        publisher.register(Counter.Opened.class, e -> order.add("before"));
        publisher.register(new MirrorOpening(sessions, publisher));
        publisher.register(Counter.Opened.class, e -> order.add("after"));
        publisher.register(Counter.Incremented.class, e -> order.add("mirrored"));
        open("mirror-e", 0, Correlation.newRequest());
        order.clear();

        publisher.publish(open("source-e", 1, Correlation.newRequest()));

        assertThat(order, contains("before", "mirrored", "after"));
    }

    /**
     * Increments counter mirror-X by initial value of opened counter source-X.
     */
    static class MirrorOpening extends ChoreographyReactor<Counter.Opened, Counter> {
        MirrorOpening(SessionFactory sessions, Publisher publisher) {
            this(emits(Counter.Incremented.class), sessions, publisher);
        }

        MirrorOpening(Set<Class<? extends Event>> emits, SessionFactory sessions, Publisher publisher) {
            super(Counter.Opened.class, emits, Counter::new, sessions, publisher);
        }

        @Override
        protected String targetStreamId(Counter.Opened event) {
            return event.streamId().replace("source-", "mirror-");
        }

        @Override
        protected void invoke(Counter target, Counter.Opened event) {
            target.increment(event.getInitial());
        }
    }

    static class MisdeclaredMirror extends MirrorOpening {
        MisdeclaredMirror(SessionFactory sessions, Publisher publisher) {
            super(emits(Counter.Decremented.class), sessions, publisher);
        }
    }
}
