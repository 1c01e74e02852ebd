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

import java.util.ArrayList;
import java.util.List;
import java.util.function.BiFunction;
import java.util.function.Consumer;

/**
 * Append-only store of event streams. The log is the source of truth, all aggregate state is derived from it.
 *
 * <p>Appends are guarded by expected version: the batch is only appended when the last version in the stream matches
 * the version the writer observed. The whole batch is appended, or nothing is.</p>
 */
public interface EventLog {
    /**
     * Read all events of a stream that happened after specified version.
     * @param streamId the id of a stream
     * @param afterVersion events that happened after this version. 0 stands for uninitialized, will therefore return
     *                     entire history
     * @return accessor for the events in order they appeared in history
     */
    StoredEvents<? extends Event> readEvents(String streamId, long afterVersion);

    /**
     * Append events to a stream.
     * @param streamId the stream to append to
     * @param expectedVersion the version of the stream the writer has observed, 0 for a new stream
     * @param events events to append, all of this stream, with versions consecutively following expectedVersion
     * @throws ConcurrencyConflictException when the stream has moved past expected version
     * @throws EventStoreException when events are malformed, or store failed
     */
    void append(String streamId, long expectedVersion, List<? extends Event> events) throws EventStoreException;

    /**
     * Version of the last event in the stream.
     * @param streamId the id of a stream
     * @return last version, 0 if stream has no events
     */
    long currentVersion(String streamId);

    /**
     * Materialize entire history of a stream.
     * @param streamId stream id
     * @return list of all events of the stream
     */
    default List<Event> fetch(String streamId) {
        try (StoredEvents<? extends Event> events = readEvents(streamId, 0)) {
            List<Event> result = new ArrayList<>();
            events.foreach(result::add);
            return result;
        }
    }

    /**
     * Accessor that enables single iteration over found events.
     * The underlying idea is, that the events needs not to be materialized at once, rather it could for example wrap a
     * database cursor. This also means that only one of methods foreach and reduce may be called on single instance,
     * and only once.
     */
    interface StoredEvents<E extends Event> extends AutoCloseable {
        /**
         * Iterate over all found events. Consumer may call {@link #stop()} to stop the iteration.
         * @param consumer consumer that will receive the events
         */
        void foreach(Consumer<? super E> consumer);

        /**
         * Perform a reduction over all found events. Reducer may call {@link #stop()} to stop the process.
         * @param initial Initial value for reduction
         * @param reducer the reducer function
         * @param <R> type of result
         * @return result of reduction.
         */
        <R> R reduce(R initial, BiFunction<R, ? super E, R> reducer);

        /**
         * Can be called from within the lambda functions to stop the iteration after current step.
         */
        void stop();

        // will not throw exception
        @Override
        void close();
    }
}
