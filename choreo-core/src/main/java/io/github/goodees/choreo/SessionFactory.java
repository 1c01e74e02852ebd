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

import java.util.Objects;

/**
 * Opens {@link Session sessions} over single event log.
 */
public class SessionFactory {
    private final EventLog eventLog;

    public SessionFactory(EventLog eventLog) {
        this.eventLog = Objects.requireNonNull(eventLog);
    }

    /**
     * Open a session for a new inbound request.
     * @return new session
     */
    public Session open() {
        return open(Correlation.newRequest());
    }

    /**
     * Open a session within existing correlation, e. g. for a reaction to an event.
     * @param correlation correlation to stamp emitted events with
     * @return new session
     */
    public Session open(Correlation correlation) {
        return new Session(eventLog, Objects.requireNonNull(correlation));
    }

    public EventLog getEventLog() {
        return eventLog;
    }
}
