package io.github.goodees.choreo.projection;

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
 * Read model fed with committed events.
 *
 * <p>Delivery is at least once and in no guaranteed order. Events are delivered on the thread that committed them,
 * so even events of a single stream may arrive out of version order when committed concurrently. Implementations
 * must tolerate both, {@link SequencedProjection} does so per stream. Events of unrelated types are to be
 * ignored.</p>
 */
@FunctionalInterface
public interface Projection {

    /**
     * Incorporate committed event into the read model.
     * @param event committed event
     */
    void apply(Event event);
}
