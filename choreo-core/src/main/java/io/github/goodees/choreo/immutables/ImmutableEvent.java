package io.github.goodees.choreo.immutables;

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

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import io.github.goodees.choreo.Aggregate;
import io.github.goodees.choreo.Event;
import io.github.goodees.choreo.EventHeader;
import io.github.goodees.choreo.EventType;

import java.util.function.Function;

/**
 * Base interface for aggregate events using <a href="http://immutables.github.io">Immutables library</a>.
 * When an aggregate wants to use this approach for event serialization, it shall define its base interface of
 * events, that extends ImmutableEvent.
 * <p>The package events reside in must have annotation {@link ImmutablesSupport} in their {@code package-info.java},
 * and every event should be annotated with {@code @JsonSerialize(as = ImmutableXxxEvent.class)} and
 * {@code @JsonDeserialize(as = ImmutableXxxEvent.class)}. The type of event is kept outside of the payload, see
 * {@link io.github.goodees.choreo.store.JacksonEventSerialization}.
 */
// allow for future changes in an event
@JsonIgnoreProperties(ignoreUnknown = true)
// Put key values at the front
@JsonPropertyOrder({ "streamId", "streamVersion", "timestamp", "correlationId", "causationId" })
@JsonInclude(JsonInclude.Include.NON_ABSENT)
public interface ImmutableEvent extends Event {

    @Override
    @JsonIgnore
    default String getType() {
        return EventType.fromClassStripping(getClass(), "Immutable", "Event");
    }

    /**
     * Seed a builder with header of next event of the aggregate.
     * @param aggregate emitting aggregate
     * @param buildFromEvent builder's {@code from} method
     * @param <T> builder type
     * @return initialized builder
     */
    static <T> T builderForAggregate(Aggregate aggregate, Function<Event, T> buildFromEvent) {
        return buildFromEvent.apply(new EventHeader(aggregate));
    }
}
