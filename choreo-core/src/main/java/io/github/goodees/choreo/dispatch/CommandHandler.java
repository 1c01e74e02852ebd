package io.github.goodees.choreo.dispatch;

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

import io.github.goodees.choreo.Command;
import io.github.goodees.choreo.Correlation;

/**
 * Application logic of single command type. A typical handler opens a session with given correlation, loads the
 * aggregate, invokes the command, saves and publishes the committed events.
 * @param <C> command type
 * @param <RS> result type
 */
@FunctionalInterface
public interface CommandHandler<C extends Command<RS>, RS> {
    RS handle(C command, Correlation correlation) throws Exception;
}
