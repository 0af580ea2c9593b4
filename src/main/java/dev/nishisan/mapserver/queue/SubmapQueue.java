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

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * FIFO of submap jobs waiting for the map server worker.
 * <p>
 * Any number of threads may {@link #offer(SubmapJob) offer}; a single consumer
 * takes jobs in arrival order. The queue never blocks producers: when a capacity
 * is configured and reached, the offer is rejected and the caller is told so.
 * Once {@link #shutdown()} is raised, waiting consumers wake up with an empty
 * result and no further job is handed out or accepted.
 */
public final class SubmapQueue {

    private final ArrayDeque<SubmapJob> pending = new ArrayDeque<>();
    private final ReentrantLock lock = new ReentrantLock();
    private final Condition notEmpty = lock.newCondition();
    private final int capacity;

    private boolean shutdown;
    private long acceptedCount;
    private long rejectedCount;

    /**
     * @param capacity maximum number of pending jobs, {@code <= 0} for an unbounded queue
     */
    public SubmapQueue(int capacity) {
        this.capacity = capacity;
    }

    public static SubmapQueue unbounded() {
        return new SubmapQueue(0);
    }

    /**
     * Appends a job at the tail. Never blocks.
     *
     * @param job the validated job
     * @return {@code true} if the job was accepted, {@code false} if the queue is
     *         full or shut down
     */
    public boolean offer(SubmapJob job) {
        Objects.requireNonNull(job, "job");
        lock.lock();
        try {
            if (shutdown || (capacity > 0 && pending.size() >= capacity)) {
                rejectedCount++;
                return false;
            }
            pending.addLast(job);
            acceptedCount++;
            notEmpty.signal();
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Removes the head job, waiting until one is available.
     *
     * @return the next job, or {@code empty} once the queue has been shut down
     * @throws InterruptedException if the waiting thread is interrupted
     */
    public Optional<SubmapJob> take() throws InterruptedException {
        lock.lockInterruptibly();
        try {
            while (pending.isEmpty() && !shutdown) {
                notEmpty.await();
            }
            if (shutdown) {
                return Optional.empty();
            }
            return Optional.of(pending.pollFirst());
        } finally {
            lock.unlock();
        }
    }

    /**
     * Removes the head job, waiting at most the given time.
     *
     * @return the next job, or {@code empty} on timeout or after shutdown
     * @throws InterruptedException if the waiting thread is interrupted
     */
    public Optional<SubmapJob> poll(long timeout, TimeUnit unit) throws InterruptedException {
        long nanos = unit.toNanos(timeout);
        lock.lockInterruptibly();
        try {
            while (pending.isEmpty() && !shutdown) {
                if (nanos <= 0L) {
                    return Optional.empty();
                }
                nanos = notEmpty.awaitNanos(nanos);
            }
            if (shutdown) {
                return Optional.empty();
            }
            return Optional.of(pending.pollFirst());
        } finally {
            lock.unlock();
        }
    }

    /**
     * Stops intake and wakes every waiting consumer. Idempotent.
     *
     * @return the jobs that were still pending, in arrival order
     */
    public List<SubmapJob> shutdown() {
        lock.lock();
        try {
            if (shutdown) {
                return List.of();
            }
            shutdown = true;
            List<SubmapJob> discarded = new ArrayList<>(pending);
            pending.clear();
            notEmpty.signalAll();
            return discarded;
        } finally {
            lock.unlock();
        }
    }

    public boolean isShutdown() {
        lock.lock();
        try {
            return shutdown;
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return pending.size();
        } finally {
            lock.unlock();
        }
    }

    public int capacity() {
        return capacity;
    }

    public long acceptedCount() {
        lock.lock();
        try {
            return acceptedCount;
        } finally {
            lock.unlock();
        }
    }

    public long rejectedCount() {
        lock.lock();
        try {
            return rejectedCount;
        } finally {
            lock.unlock();
        }
    }
}
