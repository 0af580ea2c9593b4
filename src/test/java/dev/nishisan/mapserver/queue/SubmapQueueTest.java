/*
 *  Copyright (C) 2020-2025 Lucas Nishimura <lucas.nishimura at gmail.com>
 *
 *  This program is free software: you can redistribute it and/or modify
 *  it under the terms of the GNU General Public License as published by
 *  the Free Software Foundation, either version 3 of the License, or
 *  (at your option) any later version.
 *
 *  This program is distributed in the hope that it will be useful,
 *  but WITHOUT ANY WARRANTY; without even the implied warranty of
 *  MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 *  GNU General Public License for more details.
 *
 *  You should have received a copy of the GNU General Public License
 *  along with this program.  If not, see <https://www.gnu.org/licenses/>
 */

package dev.nishisan.mapserver.queue;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class SubmapQueueTest {

    private static SubmapJob job(long sequence) {
        return SubmapJob.of(sequence, "robot-" + (sequence % 3), Path.of("/maps/submap-" + sequence));
    }

    @Test
    void shouldHandOutJobsInArrivalOrder() throws InterruptedException {
        SubmapQueue queue = SubmapQueue.unbounded();
        for (long i = 1; i <= 5; i++) {
            assertTrue(queue.offer(job(i)));
        }

        for (long i = 1; i <= 5; i++) {
            assertEquals(i, queue.take().orElseThrow().sequence());
        }
        assertEquals(0, queue.size());
        assertEquals(5, queue.acceptedCount());
    }

    @Test
    void shouldRejectWhenFull() throws InterruptedException {
        SubmapQueue queue = new SubmapQueue(2);

        assertTrue(queue.offer(job(1)));
        assertTrue(queue.offer(job(2)));
        assertFalse(queue.offer(job(3)));
        assertEquals(1, queue.rejectedCount());
        assertEquals(2, queue.size());

        assertEquals(1, queue.take().orElseThrow().sequence());
        assertTrue(queue.offer(job(4)));
        assertEquals(2, queue.take().orElseThrow().sequence());
        assertEquals(4, queue.take().orElseThrow().sequence());
    }

    @Test
    void nonPositiveCapacityIsUnbounded() {
        SubmapQueue queue = new SubmapQueue(0);
        for (long i = 0; i < 10_000; i++) {
            assertTrue(queue.offer(job(i)));
        }
        assertEquals(10_000, queue.size());
        assertEquals(0, queue.capacity());
    }

    @Test
    void pollShouldTimeOutWhenEmpty() throws InterruptedException {
        SubmapQueue queue = SubmapQueue.unbounded();
        long start = System.nanoTime();

        Optional<SubmapJob> polled = queue.poll(50, TimeUnit.MILLISECONDS);

        assertTrue(polled.isEmpty());
        assertTrue(System.nanoTime() - start >= TimeUnit.MILLISECONDS.toNanos(40));
        assertFalse(queue.isShutdown());
    }

    @Test
    void shutdownShouldWakeBlockedConsumer() throws Exception {
        SubmapQueue queue = SubmapQueue.unbounded();
        AtomicReference<Optional<SubmapJob>> result = new AtomicReference<>();
        CountDownLatch done = new CountDownLatch(1);
        Thread consumer = new Thread(() -> {
            try {
                result.set(queue.take());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            } finally {
                done.countDown();
            }
        });
        consumer.start();

        Thread.sleep(100);
        queue.shutdown();

        assertTrue(done.await(5, TimeUnit.SECONDS));
        assertNotNull(result.get());
        assertTrue(result.get().isEmpty());
    }

    @Test
    void shutdownShouldReturnPendingJobsAndStopIntake() throws InterruptedException {
        SubmapQueue queue = SubmapQueue.unbounded();
        queue.offer(job(1));
        queue.offer(job(2));

        List<SubmapJob> discarded = queue.shutdown();

        assertEquals(List.of(1L, 2L), discarded.stream().map(SubmapJob::sequence).toList());
        assertTrue(queue.isShutdown());
        assertFalse(queue.offer(job(3)));
        assertTrue(queue.take().isEmpty());
        assertTrue(queue.poll(10, TimeUnit.MILLISECONDS).isEmpty());
        assertTrue(queue.shutdown().isEmpty(), "second shutdown has nothing left to discard");
    }

    @Test
    void concurrentProducersShouldNeverLoseAcceptedJobs() throws Exception {
        SubmapQueue queue = SubmapQueue.unbounded();
        int producers = 8;
        int perProducer = 500;
        ExecutorService pool = Executors.newFixedThreadPool(producers);
        CountDownLatch go = new CountDownLatch(1);
        for (int p = 0; p < producers; p++) {
            int base = p * perProducer;
            pool.submit(() -> {
                go.await();
                for (int i = 0; i < perProducer; i++) {
                    queue.offer(job(base + i));
                }
                return null;
            });
        }
        go.countDown();
        pool.shutdown();
        assertTrue(pool.awaitTermination(10, TimeUnit.SECONDS));

        List<Long> seen = new ArrayList<>();
        Optional<SubmapJob> next;
        while ((next = queue.poll(0, TimeUnit.MILLISECONDS)).isPresent()) {
            seen.add(next.get().sequence());
        }
        assertEquals(producers * perProducer, seen.size());
        assertEquals(producers * perProducer, seen.stream().distinct().count());
    }
}
