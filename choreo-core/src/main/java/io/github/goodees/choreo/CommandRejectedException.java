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

/**
 * A command was refused by an aggregate before any event was emitted. The state of the aggregate is unchanged.
 * Transports should map these to client errors.
 */
public abstract class CommandRejectedException extends RuntimeException {
    private final String rule;

    protected CommandRejectedException(String rule, String message) {
        super(message);
        this.rule = rule;
    }

    /**
     * Machine readable name of the violated rule, e. g. {@code insufficient-stock}.
     * @return rule name
     */
    public String getRule() {
        return rule;
    }
}
