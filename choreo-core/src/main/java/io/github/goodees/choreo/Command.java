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

import java.util.Optional;

/**
 * An inbound request for a change of state.
 * @param <RS> type of the result the command produces
 */
public interface Command<RS> {

    /**
     * Client supplied key that makes retries of the same command safe. Commands with the same key executed within
     * the retention window return the result of the first execution without being executed again.
     * @return idempotency key, empty if the command should always be executed
     */
    default Optional<String> idempotencyKey() {
        return Optional.empty();
    }
}
