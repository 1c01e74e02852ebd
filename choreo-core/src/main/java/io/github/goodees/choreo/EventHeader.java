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

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Event metadata. Can be used as base class for events, or as a source for builders of immutable events.
 * When created from an aggregate, it carries the next version of its stream and the correlation the aggregate is
 * currently bound to.
 */
public class EventHeader implements Event {
    private final String streamId;
    private final long streamVersion;
    private final Instant timestamp;
    private final String correlationId;
    private final String causationId;

    public EventHeader(Aggregate source) {
        this(source.getStreamId(), source.nextEventVersion(), Instant.now(), source.getCorrelation());
    }

    public EventHeader(String streamId, long streamVersion, Correlation correlation) {
        this(streamId, streamVersion, Instant.now(), correlation);
    }

    public EventHeader(String streamId, long streamVersion, Instant timestamp, Correlation correlation) {
        this.streamId = Objects.requireNonNull(streamId, "streamId");
        this.streamVersion = streamVersion;
        this.timestamp = Objects.requireNonNull(timestamp, "timestamp");
        this.correlationId = correlation.getCorrelationId();
        this.causationId = correlation.getCausationId().orElse(null);
    }

    @Override
    public String streamId() {
        return streamId;
    }

    @Override
    public long streamVersion() {
        return streamVersion;
    }

    @Override
    public Instant getTimestamp() {
        return timestamp;
    }

    @Override
    public String correlationId() {
        return correlationId;
    }

    @Override
    public Optional<String> causationId() {
        return Optional.ofNullable(causationId);
    }

    @Override
    public String toString() {
        return getType() + "[stream=" + streamId + ", version=" + streamVersion + ", correlation=" + correlationId
                + "]";
    }
}
