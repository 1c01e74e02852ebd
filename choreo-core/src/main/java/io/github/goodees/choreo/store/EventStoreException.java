package io.github.goodees.choreo.store;

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

/**
 * Failure of interaction with the event log.
 */
public class EventStoreException extends Exception {
    private final Fault fault;

    public enum Fault {
        OPTIMISTIC_LOCK, TX_ERROR, PROGRAMMATIC_ERROR
    }

    protected EventStoreException(Fault type, String message, Throwable cause) {
        super(message, cause);
        this.fault = type;
    }

    public Fault getFault() {
        return fault;
    }

    public static ConcurrencyConflictException optimisticLock(String streamId, long expectedVersion, long actualVersion) {
        return new ConcurrencyConflictException(streamId, expectedVersion, actualVersion);
    }

    public static EventStoreException multipleStreams(String expected, Event violating) {
        return new EventStoreException(Fault.PROGRAMMATIC_ERROR, "Appended events span multiple streams: " + expected
                + " and " + violating.streamId(), null);
    }

    public static EventStoreException nonMonotonic(String streamId, long expectedVersion, Event violating) {
        return new EventStoreException(Fault.PROGRAMMATIC_ERROR, "Event for stream " + streamId
                + " does not follow sequence. Expected: " + expectedVersion + " actual: "
                + violating.streamVersion(), null);
    }

    public static EventStoreException unsupported(Event event, Throwable cause) {
        return new EventStoreException(Fault.PROGRAMMATIC_ERROR, "Unsupported event type: " + event, cause);
    }
}
