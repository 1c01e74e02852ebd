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

import com.github.benmanes.caffeine.cache.Ticker;
import org.junit.After;
import org.junit.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.instanceOf;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class IdempotencyGuardTest {
    private final FakeTicker ticker = new FakeTicker();
    private final IdempotencyGuard guard = new IdempotencyGuard(Duration.ofHours(24), ticker);
    private final ExecutorService pool = Executors.newFixedThreadPool(16);

    @After
    public void tearDown() {
        pool.shutdownNow();
    }

    @Test
    public void concurrent_callers_with_same_key_execute_once() throws Exception {
        int callers = 16;
        AtomicInteger executions = new AtomicInteger();
        CountDownLatch start = new CountDownLatch(1);
        List<Future<String>> results = new ArrayList<>();
        for (int i = 0; i < callers; i++) {
            int caller = i;
            results.add(pool.submit(() -> {
                start.await();
                return guard.execute("key-1", () -> {
                    executions.incrementAndGet();
                    Thread.sleep(50);
                    return "result-of-" + caller;
                });
            }));
        }
        start.countDown();
        String first = results.get(0).get(5, TimeUnit.SECONDS);
        for (Future<String> result : results) {
            assertEquals(first, result.get(5, TimeUnit.SECONDS));
        }
        assertEquals(1, executions.get());
        assertEquals(0, guard.activeLockCount());
        assertEquals(1, guard.recordCount());
    }

    @Test
    public void different_keys_do_not_block_each_other() throws Exception {
        CountDownLatch release = new CountDownLatch(1);
        CountDownLatch blocking = new CountDownLatch(1);
        Future<String> slow = pool.submit(() -> guard.execute("key-a", () -> {
            blocking.countDown();
            release.await();
            return "a";
        }));
        assertTrue(blocking.await(5, TimeUnit.SECONDS));

        Future<String> fast = pool.submit(() -> guard.execute("key-b", () -> "b"));
        assertEquals("b", fast.get(5, TimeUnit.SECONDS));
        assertFalse(slow.isDone());

        release.countDown();
        assertEquals("a", slow.get(5, TimeUnit.SECONDS));
    }

    @Test
    public void missing_key_always_executes() throws Exception {
        AtomicInteger executions = new AtomicInteger();
        guard.execute(null, executions::incrementAndGet);
        guard.execute("", executions::incrementAndGet);
        guard.execute(null, executions::incrementAndGet);

        assertEquals(3, executions.get());
        assertEquals(0, guard.recordCount());
    }

    @Test
    public void failures_are_not_cached() throws Exception {
        try {
            guard.execute("key-1", () -> {
                throw new IllegalStateException("first attempt fails");
            });
            fail("Failure should propagate");
        } catch (IllegalStateException e) {
            assertEquals("first attempt fails", e.getMessage());
        }
        assertFalse(guard.getRecord("key-1").isPresent());
        assertEquals("second", guard.execute("key-1", () -> "second"));
        assertEquals("second", guard.execute("key-1", () -> "third"));
        assertEquals(0, guard.activeLockCount());
    }

    @Test
    public void null_results_are_cached() throws Exception {
        AtomicInteger executions = new AtomicInteger();
        assertNull(guard.execute("key-1", () -> {
            executions.incrementAndGet();
            return null;
        }));
        assertNull(guard.execute("key-1", () -> {
            executions.incrementAndGet();
            return "ignored";
        }));
        assertEquals(1, executions.get());
    }

    @Test
    public void records_expire() throws Exception {
        AtomicInteger executions = new AtomicInteger();
        guard.execute("key-1", executions::incrementAndGet);
        ticker.advance(Duration.ofHours(23));
        guard.execute("key-1", executions::incrementAndGet);
        assertEquals(1, executions.get());

        ticker.advance(Duration.ofHours(2));
        assertEquals(Integer.valueOf(2), guard.execute("key-1", executions::incrementAndGet));
        ticker.advance(Duration.ofHours(25));
        assertEquals(0, guard.recordCount());
    }

    @Test
    public void waiting_for_key_can_be_interrupted() throws Exception {
        CountDownLatch release = new CountDownLatch(1);
        CountDownLatch holding = new CountDownLatch(1);
        Future<String> holder = pool.submit(() -> guard.execute("key-1", () -> {
            holding.countDown();
            release.await();
            return "held";
        }));
        assertTrue(holding.await(5, TimeUnit.SECONDS));

        AtomicReference<Throwable> waiterFailure = new AtomicReference<>();
        Thread waiter = new Thread(() -> {
            try {
                guard.execute("key-1", () -> "waiter");
            } catch (Throwable t) {
                waiterFailure.set(t);
            }
        });
        waiter.start();
        waiter.interrupt();
        waiter.join(5000);

        assertThat(waiterFailure.get(), instanceOf(InterruptedException.class));
        assertFalse(holder.isDone());
        release.countDown();
        assertEquals("held", holder.get(5, TimeUnit.SECONDS));
        assertEquals(0, guard.activeLockCount());
    }

    @Test
    public void waiting_for_key_can_time_out() throws Exception {
        CountDownLatch release = new CountDownLatch(1);
        CountDownLatch holding = new CountDownLatch(1);
        Future<String> holder = pool.submit(() -> guard.execute("key-1", () -> {
            holding.countDown();
            release.await();
            return "held";
        }));
        assertTrue(holding.await(5, TimeUnit.SECONDS));
        try {
            guard.execute("key-1", () -> "waiter", 50, TimeUnit.MILLISECONDS);
            fail("Wait should time out");
        } catch (TimeoutException e) {
            assertEquals(1, guard.activeLockCount());
        }
        release.countDown();
        holder.get(5, TimeUnit.SECONDS);
        assertEquals(0, guard.activeLockCount());
    }

    @Test
    public void locks_do_not_accumulate() throws Exception {
        List<Future<Integer>> results = new ArrayList<>();
        for (int i = 0; i < 200; i++) {
            int key = i;
            results.add(pool.submit(() -> guard.execute("key-" + key, () -> key)));
        }
        int sum = 0;
        for (Future<Integer> result : results) {
            sum += result.get(5, TimeUnit.SECONDS);
        }
        assertEquals(199 * 200 / 2, sum);
        assertEquals(0, guard.activeLockCount());
        assertEquals(200, guard.recordCount());
    }

    static class FakeTicker implements Ticker {
        private final AtomicLong nanos = new AtomicLong();

        @Override
        public long read() {
            return nanos.get();
        }

        void advance(Duration duration) {
            nanos.addAndGet(duration.toNanos());
        }
    }
}
