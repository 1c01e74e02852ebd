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

import io.github.goodees.choreo.Event;

/**
 * Consumer of committed events of a specific type.
 * @param <E> type of events the reactor handles
 * @see Publisher#register(Class, Reactor)
 */
@FunctionalInterface
public interface Reactor<E extends Event> {

    /**
     * React to an event. Exceptions are logged by the publisher and do not prevent delivery to other reactors.
     * @param event committed event
     * @throws Exception when the reaction fails
     */
    void react(E event) throws Exception;
}
