package io.github.goodees.choreo.idempotency;

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

/**
 * Result of successful execution stored under an idempotency key.
 */
public final class IdempotencyRecord {
    private final String key;
    private final Object result;
    private final Instant recordedAt;

    IdempotencyRecord(String key, Object result, Instant recordedAt) {
        this.key = Objects.requireNonNull(key);
        this.result = result;
        this.recordedAt = recordedAt;
    }

    public String getKey() {
        return key;
    }

    /**
     * @return the cached result, may be null
     */
    public Object getResult() {
        return result;
    }

    public Instant getRecordedAt() {
        return recordedAt;
    }

    @Override
    public String toString() {
        return "IdempotencyRecord[" + key + " at " + recordedAt + "]";
    }
}
