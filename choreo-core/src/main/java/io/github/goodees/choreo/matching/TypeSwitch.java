package io.github.goodees.choreo.matching;

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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.Predicate;

/**
 * Dispatch on runtime type of an object, typically an event. Branches are evaluated in order of declaration and
 * first matching one wins. Instances are immutable and can be shared across threads, as long as callbacks are.
 *
 * <pre>{@code
 * TypeSwitch apply = TypeSwitch.builder()
 *         .on(StockReservedEvent.class, e -> reserved += e.quantity())
 *         .on(StockDeductedEvent.class, e -> reserved -= e.quantity())
 *         .build();
 * }</pre>
 */
public class TypeSwitch {

    private final List<SwitchBranch<?>> branches;

    private TypeSwitch(Builder b) {
        List<SwitchBranch<?>> all = new ArrayList<>(b.branches);
        if (b.fallback != null) {
            all.add(b.fallback);
        }
        this.branches = Collections.unmodifiableList(all);
    }

    /**
     * Execute first matching callback.
     * @param message message to match against
     * @return true if a branch matched
     */
    public boolean executeMatching(Object message) {
        for (SwitchBranch<?> branch : branches) {
            if (branch.match(message)) {
                return true;
            }
        }
        return false;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {

        private final List<SwitchBranch<?>> branches = new ArrayList<>();
        private SwitchBranch<Object> fallback;

        public <T> Builder on(Class<T> clazz, Consumer<T> callback) {
            return on(clazz, null, callback);
        }

        public <T> Builder on(Class<T> clazz, Predicate<T> predicate, Consumer<T> callback) {
            this.branches.add(new SwitchBranch<>(clazz, predicate, callback));
            return this;
        }

        public Builder otherwise(Consumer<Object> fallback) {
            this.fallback = new SwitchBranch<>(Object.class, null, fallback);
            return this;
        }

        public TypeSwitch build() {
            return new TypeSwitch(this);
        }
    }

    private static class SwitchBranch<T> {

        private final Class<T> caseClass;
        private final Predicate<T> check;
        private final Consumer<T> callback;

        SwitchBranch(Class<T> caseClass, Predicate<T> check, Consumer<T> callback) {
            this.caseClass = Objects.requireNonNull(caseClass, "Case class cannot be null");
            this.check = check;
            this.callback = Objects.requireNonNull(callback, "Callback cannot be null");
        }

        boolean match(Object obj) {
            if (caseClass.isInstance(obj)) {
                T inst = caseClass.cast(obj);
                if (check == null || check.test(inst)) {
                    callback.accept(inst);
                    return true;
                }
            }
            return false;
        }
    }
}
