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

import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * Tracing context of a unit of work. Every event emitted within the unit of work is stamped with it.
 *
 * <p>A request arriving from outside starts a new correlation. A reaction to an event continues the correlation of
 * that event and records it as its cause, so that the full chain of events resulting from single command can be
 * reconstructed.</p>
 */
public final class Correlation {
    private final String correlationId;
    private final String causationId;

    private Correlation(String correlationId, String causationId) {
        this.correlationId = Objects.requireNonNull(correlationId, "correlationId");
        this.causationId = causationId;
    }

    /**
     * Start a new chain.
     * @return correlation with a fresh random id and no cause
     */
    public static Correlation newRequest() {
        return new Correlation(UUID.randomUUID().toString(), null);
    }

    /**
     * Continue a chain that was started elsewhere, e. g. with id received in request headers.
     * @param correlationId correlation id, when null or empty, new chain is started
     * @return correlation with given id and no cause
     */
    public static Correlation of(String correlationId) {
        if (correlationId == null || correlationId.trim().isEmpty()) {
            return newRequest();
        }
        return new Correlation(correlationId, null);
    }

    /**
     * Correlation for work performed in reaction to an event.
     * @param cause the triggering event
     * @return correlation sharing the id of the cause, with cause's event id as causation
     */
    public static Correlation causedBy(Event cause) {
        return new Correlation(cause.correlationId(), cause.eventId());
    }

    public String getCorrelationId() {
        return correlationId;
    }

    public Optional<String> getCausationId() {
        return Optional.ofNullable(causationId);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Correlation)) {
            return false;
        }
        Correlation that = (Correlation) o;
        return correlationId.equals(that.correlationId) && Objects.equals(causationId, that.causationId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(correlationId, causationId);
    }

    @Override
    public String toString() {
        return "Correlation[" + correlationId + (causationId != null ? ", causedBy=" + causationId : "") + "]";
    }
}
