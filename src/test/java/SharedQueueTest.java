import com.ordoAetheris.pipeline.queue.ClosedQueueException;
import com.ordoAetheris.pipeline.queue.SharedQueue;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.List;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

public class SharedQueueTest {

    @Nested
    class ExceptionsTests {
        @Test
        public void put_null_IAE() {
            SharedQueue<Integer> queue = new SharedQueue<>();

            assertThrows(IllegalArgumentException.class, () -> queue.put(null));
        }

        @Test
        public void put_after_close_ClosedQueueException() {
            SharedQueue<Integer> queue = new SharedQueue<>();
            queue.close();

            ClosedQueueException e = assertThrows(ClosedQueueException.class, () -> queue.put(1));
            assertInstanceOf(IllegalStateException.class, e);
            assertEquals(0, queue.size(), "rejected item must not be queued");
        }
    }

    @Nested
    class FunctionalTests {
        @Test
        void take_on_empty_closed_returns_null() throws Exception {
            SharedQueue<Integer> q = new SharedQueue<>();
            q.close();

            assertNull(q.take());
            assertNull(q.take(), "EOF is sticky");
        }

        @Test
        void close_is_idempotent() throws Exception {
            SharedQueue<Integer> q = new SharedQueue<>();
            q.put(7);

            q.close();
            q.close();

            assertTrue(q.isClosed());
            assertEquals(7, q.take());
            assertNull(q.take());
        }

        @Test
        void fifo_order_for_a_single_consumer() throws Exception {
            SharedQueue<Integer> q = new SharedQueue<>();
            for (int i = 0; i < 100; i++) q.put(i);
            q.close();

            for (int i = 0; i < 100; i++) assertEquals(i, q.take());
            assertNull(q.take());
        }

        @Test
        void closeDoesNotDropAlreadyEnqueuedItems() throws Exception {
            // shutdown while work is still queued: consumers must drain it first, then see EOF
            SharedQueue<Integer> q = new SharedQueue<>();
            int n = 10_000;
            for (int i = 0; i < n; i++) q.put(i);

            q.close();

            int consumed = 0;
            while (true) {
                Integer x = q.take();
                if (x == null) break;
                consumed++;
            }
            assertEquals(n, consumed, "close must not drop already enqueued items");
            assertEquals(0, q.size());
        }
    }

    @Nested
    class BlockingTests {
        @Test
        public void closeUnblocksTake_returnNullOnEmpty() throws Exception {
            SharedQueue<Integer> queue = new SharedQueue<>();

            CountDownLatch waiterLatch = new CountDownLatch(1);
            ExecutorService executor = Executors.newSingleThreadExecutor();

            Future<Integer> f = executor.submit(() -> {
                waiterLatch.countDown();
                return queue.take();
            });

            waiterLatch.await();
            Thread.sleep(20);
            queue.close();

            Integer res = TestThreads.getOrDump(f, 1, executor, "closeUnblocksTake");
            executor.shutdownNow();

            assertNull(res, "expected EOF null after close on empty queue");
        }

        @Test
        void put_wakes_a_blocked_consumer() throws Exception {
            SharedQueue<Integer> q = new SharedQueue<>();
            ExecutorService pool = Executors.newSingleThreadExecutor();
            Future<Integer> f = pool.submit(q::take);

            Thread.sleep(20);
            assertFalse(f.isDone(), "take() must block on an empty open queue");
            q.put(42);

            assertEquals(42, TestThreads.getOrDump(f, 1, pool, "putWakesConsumer"));
            pool.shutdownNow();
        }

        @Test
        void close_wakes_every_blocked_consumer() throws Exception {
            // put() signals one waiter, close() must reach all of them
            int consumers = 8;
            SharedQueue<Integer> q = new SharedQueue<>();
            List<Thread> threads = new ArrayList<>();
            AtomicInteger eofs = new AtomicInteger();

            for (int i = 0; i < consumers; i++) {
                Thread t = new Thread(() -> TestThreads.call(() -> {
                    if (q.take() == null) eofs.incrementAndGet();
                }), "waiter-" + i);
                threads.add(t);
                t.start();
            }
            for (Thread t : threads) TestThreads.awaitWaiting(t);

            q.close();
            q.close();

            for (Thread t : threads) TestThreads.joinOrDump(t, 2, "closeWakesAll:" + t.getName());
            assertEquals(consumers, eofs.get());
        }

        @Test
        void blocked_consumers_take_items_then_eof() throws Exception {
            int consumers = 4;
            SharedQueue<Integer> q = new SharedQueue<>();
            ExecutorService pool = Executors.newFixedThreadPool(consumers);
            List<Future<Integer>> counts = new ArrayList<>();
            for (int i = 0; i < consumers; i++) {
                counts.add(pool.submit(() -> {
                    int got = 0;
                    while (q.take() != null) got++;
                    return got;
                }));
            }

            Thread.sleep(20);
            q.put(1);
            q.put(2);
            q.put(3);
            q.close();

            int total = 0;
            for (Future<Integer> c : counts) total += TestThreads.getOrDump(c, 2, pool, "takeThenEof");
            pool.shutdownNow();
            assertEquals(3, total);
        }

        @Test
        void interrupted_take_throws() throws Exception {
            SharedQueue<Integer> q = new SharedQueue<>();
            ExecutorService pool = Executors.newSingleThreadExecutor();
            Future<Integer> f = pool.submit(q::take);

            Thread.sleep(20);
            pool.shutdownNow();

            ExecutionException e = assertThrows(ExecutionException.class, () -> f.get(1, TimeUnit.SECONDS));
            assertInstanceOf(InterruptedException.class, e.getCause());
        }
    }

    @Nested
    class NonFunctionalTests {
        @Test
        void spsc_strict_noLoss_noDuplicates() throws Exception {
            // lost item = a result slot never written, duplicate = a slot computed twice
            int n = 50_000;
            SharedQueue<Integer> q = new SharedQueue<>();

            BitSet seen = new BitSet(n);
            AtomicInteger consumed = new AtomicInteger();

            CountDownLatch start = new CountDownLatch(1);
            ExecutorService pool = Executors.newFixedThreadPool(2);

            Future<?> prod = pool.submit(() -> { TestThreads.await(start); TestThreads.call(() -> {
                for (int i = 0; i < n; i++) q.put(i);
                q.close();
            });});

            Future<?> cons = pool.submit(() -> { TestThreads.await(start); TestThreads.call(() -> {
                while (true) {
                    Integer x = q.take();
                    if (x == null) break;

                    synchronized (seen) {
                        if (seen.get(x)) fail("duplicate item: " + x);
                        seen.set(x);
                    }
                    consumed.incrementAndGet();
                }
            });});

            start.countDown();

            TestThreads.getOrDump(prod, 3, pool, "spsc_strict:producer");
            TestThreads.getOrDump(cons, 3, pool, "spsc_strict:consumer");

            pool.shutdownNow();

            assertEquals(n, consumed.get(), "lost items suspected");
            synchronized (seen) {
                assertEquals(n, seen.cardinality(), "not all items were observed");
            }
        }

        @Test
        void spmc_eightConsumers_noLoss_noDuplicates() throws Exception {
            int n = 50_000;
            int consumers = 8;
            SharedQueue<Integer> q = new SharedQueue<>();

            BitSet seen = new BitSet(n);
            AtomicInteger consumed = new AtomicInteger();
            AtomicInteger eofs = new AtomicInteger();

            CountDownLatch start = new CountDownLatch(1);
            ExecutorService pool = Executors.newFixedThreadPool(consumers + 1);

            List<Future<?>> cons = new ArrayList<>();
            for (int c = 0; c < consumers; c++) {
                cons.add(pool.submit(() -> { TestThreads.await(start); TestThreads.call(() -> {
                    while (true) {
                        Integer x = q.take();
                        if (x == null) {
                            eofs.incrementAndGet();
                            break;
                        }
                        synchronized (seen) {
                            if (seen.get(x)) fail("duplicate item: " + x);
                            seen.set(x);
                        }
                        consumed.incrementAndGet();
                    }
                });}));
            }

            Future<?> prod = pool.submit(() -> { TestThreads.await(start); TestThreads.call(() -> {
                for (int i = 0; i < n; i++) q.put(i);
                q.close();
            });});

            start.countDown();

            TestThreads.getOrDump(prod, 5, pool, "spmc:producer");
            for (int c = 0; c < consumers; c++) TestThreads.getOrDump(cons.get(c), 5, pool, "spmc:consumer-" + c);
            pool.shutdownNow();

            assertEquals(n, consumed.get(), "lost items suspected");
            assertEquals(consumers, eofs.get(), "every consumer must observe EOF exactly once");
            synchronized (seen) {
                assertEquals(n, seen.cardinality());
            }
        }

        @Test
        void spmc_withJitter_manyRuns_raceHunting() throws Exception {
            // random preemption points to shake out lost wakeups, if-instead-of-while and close() races
            int runs = 50;
            int n = 5_000;
            int consumers = 4;

            for (int r = 0; r < runs; r++) {
                SharedQueue<Integer> q = new SharedQueue<>();
                BitSet seen = new BitSet(n);
                AtomicInteger consumed = new AtomicInteger();

                CountDownLatch start = new CountDownLatch(1);
                ExecutorService pool = Executors.newFixedThreadPool(consumers + 1);

                Future<?> prod = pool.submit(() -> { TestThreads.await(start); TestThreads.call(() -> {
                    ThreadLocalRandom rnd = ThreadLocalRandom.current();
                    for (int i = 0; i < n; i++) {
                        TestThreads.jitter(rnd);
                        q.put(i);
                    }
                    q.close();
                });});

                int finalR = r;
                List<Future<?>> cons = new ArrayList<>();
                for (int c = 0; c < consumers; c++) {
                    cons.add(pool.submit(() -> { TestThreads.await(start); TestThreads.call(() -> {
                        ThreadLocalRandom rnd = ThreadLocalRandom.current();
                        while (true) {
                            TestThreads.jitter(rnd);
                            Integer x = q.take();
                            if (x == null) break;
                            synchronized (seen) {
                                if (seen.get(x)) fail("duplicate: " + x + " run=" + finalR);
                                seen.set(x);
                            }
                            consumed.incrementAndGet();
                        }
                    });}));
                }

                start.countDown();

                try {
                    TestThreads.getOrDump(prod, 5, pool, "run=" + r + ":producer");
                    for (Future<?> c : cons) TestThreads.getOrDump(c, 5, pool, "run=" + r + ":consumer");
                } catch (AssertionError e) {
                    throw new AssertionError("Failed on run=" + r + " consumed=" + consumed.get(), e);
                } finally {
                    pool.shutdownNow();
                }

                assertEquals(n, consumed.get(), "run=" + r);
                synchronized (seen) {
                    assertEquals(n, seen.cardinality(), "run=" + r);
                }
            }
        }
    }
}
