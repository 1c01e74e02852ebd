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

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Executes an action at most once per key within a retention window, and returns the first result to every later
 * caller with the same key.
 *
 * <p>Concurrent callers with the same key are serialized by a per-key lock, and the cache is checked again once the
 * lock is obtained, so exactly one of them executes the action. Callers with different keys do not block each other.
 * Only successful results are retained. A failed action leaves no record, so a retry executes again.</p>
 *
 * <p>Per-key locks are reference counted and removed when the last caller holding or waiting on them leaves, so the
 * number of locks is bounded by the number of keys in flight.</p>
 *
 * <p>Results are kept by key only. A second command with the same key and different content gets the result of
 * the first one.</p>
 */
public class IdempotencyGuard {
    public static final Duration DEFAULT_EXPIRY = Duration.ofHours(24);

    private static final Logger logger = LoggerFactory.getLogger(IdempotencyGuard.class);
    private final Cache<String, IdempotencyRecord> records;
    private final ConcurrentMap<String, KeyLock> locks = new ConcurrentHashMap<>();

    public IdempotencyGuard() {
        this(DEFAULT_EXPIRY);
    }

    public IdempotencyGuard(Duration expiry) {
        this(expiry, Ticker.systemTicker());
    }

    /**
     * Create guard with custom time source.
     * @param expiry how long results are retained after they were recorded
     * @param ticker time source for expiry
     */
    public IdempotencyGuard(Duration expiry, Ticker ticker) {
        if (expiry.isNegative() || expiry.isZero()) {
            throw new IllegalArgumentException("Expiry must be positive, got " + expiry);
        }
        this.records = Caffeine.newBuilder()
                .expireAfterWrite(expiry)
                .ticker(ticker)
                .executor(Runnable::run)
                .build();
    }

    /**
     * Execute action once for given key. Waiting for concurrent execution with the same key can be interrupted.
     * @param key idempotency key, null or empty to execute without any guarding or caching
     * @param action the action
     * @param <T> type of result
     * @return result of the action, or result of its first successful execution with the same key
     * @throws InterruptedException when interrupted while waiting for concurrent execution
     * @throws Exception whatever the action throws
     */
    public <T> T execute(String key, IdempotentAction<T> action) throws Exception {
        return execute(key, action, -1, TimeUnit.MILLISECONDS);
    }

    /**
     * Execute action once for given key, waiting at most given time for concurrent execution with the same key.
     * @param key idempotency key, null or empty to execute without any guarding or caching
     * @param action the action
     * @param timeout maximum wait for the key's lock, negative to wait indefinitely
     * @param unit unit of timeout
     * @param <T> type of result
     * @return result of the action, or result of its first successful execution with the same key
     * @throws TimeoutException when the lock could not be obtained in time
     * @throws InterruptedException when interrupted while waiting for concurrent execution
     * @throws Exception whatever the action throws
     */
    public <T> T execute(String key, IdempotentAction<T> action, long timeout, TimeUnit unit) throws Exception {
        if (key == null || key.isEmpty()) {
            return action.execute();
        }
        IdempotencyRecord cached = lookup(key);
        if (cached != null) {
            return resultOf(cached);
        }
        KeyLock keyLock = acquire(key);
        try {
            if (timeout < 0) {
                keyLock.lock.lockInterruptibly();
            } else if (!keyLock.lock.tryLock(timeout, unit)) {
                throw new TimeoutException("Timed out waiting for concurrent execution with idempotency key " + key);
            }
            try {
                cached = lookup(key);
                if (cached != null) {
                    return resultOf(cached);
                }
                logger.debug("Executing action for idempotency key {}", key);
                T result = action.execute();
                records.put(key, new IdempotencyRecord(key, result, Instant.now()));
                return result;
            } finally {
                keyLock.lock.unlock();
            }
        } finally {
            release(key, keyLock);
        }
    }

    private IdempotencyRecord lookup(String key) {
        IdempotencyRecord record = records.getIfPresent(key);
        if (record != null) {
            logger.info("Returning result recorded at {} for idempotency key {}", record.getRecordedAt(), key);
        }
        return record;
    }

    @SuppressWarnings("unchecked")
    private static <T> T resultOf(IdempotencyRecord record) {
        return (T) record.getResult();
    }

    private KeyLock acquire(String key) {
        return locks.compute(key, (k, existing) -> {
            KeyLock keyLock = existing == null ? new KeyLock() : existing;
            keyLock.users++;
            return keyLock;
        });
    }

    private void release(String key, KeyLock keyLock) {
        locks.computeIfPresent(key, (k, existing) -> {
            if (existing != keyLock) {
                logger.error("Lock for idempotency key {} was replaced while in use", key);
                return existing;
            }
            return --existing.users == 0 ? null : existing;
        });
    }

    /**
     * Retained record for a key.
     * @param key idempotency key
     * @return the record if present and not expired
     */
    public Optional<IdempotencyRecord> getRecord(String key) {
        return Optional.ofNullable(records.getIfPresent(key));
    }

    /**
     * Number of retained records, after evicting expired ones.
     * @return retained records count
     */
    public long recordCount() {
        records.cleanUp();
        return records.estimatedSize();
    }

    /**
     * Number of per-key locks currently held or waited on.
     * @return lock count
     */
    public int activeLockCount() {
        return locks.size();
    }

    /**
     * Forget all retained results.
     */
    public void invalidateAll() {
        records.invalidateAll();
    }

    private static final class KeyLock {
        final ReentrantLock lock = new ReentrantLock();
        // guarded by ConcurrentHashMap.compute on the owning entry
        int users;
    }
}
