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

package dev.nishisan.mapserver.stats;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-process counters for the map server: hit counters with a rate, current
 * values, and rolling averages over the last {@value #AVERAGE_WINDOW} samples.
 * All methods are safe to call from any thread.
 */
public class MapServerStats {

    private static final Logger logger = LoggerFactory.getLogger(MapServerStats.class);
    static final int AVERAGE_WINDOW = 10;

    private final ConcurrentMap<String, HitCounter> counters = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, AtomicLong> values = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, RollingAverage> averages = new ConcurrentHashMap<>();

    /**
     * Increments a hit counter, creating it on first use.
     *
     * @param counter the counter name
     */
    public void notifyHitCounter(String counter) {
        counters.computeIfAbsent(counter, HitCounter::new).increment();
    }

    /**
     * Records the latest value of a gauge.
     *
     * @param name  the value name
     * @param value the value
     */
    public void notifyCurrentValue(String name, long value) {
        values.computeIfAbsent(name, k -> new AtomicLong()).set(value);
    }

    /**
     * Adds a sample to a rolling average, creating it on first use.
     *
     * @param name  the average name
     * @param value the sample
     */
    public void notifyAverageCounter(String name, long value) {
        averages.computeIfAbsent(name, k -> new RollingAverage(AVERAGE_WINDOW)).add(value);
    }

    /**
     * Returns the value of a hit counter, or {@code 0} if it was never hit.
     */
    public long getCounterValue(String counter) {
        HitCounter hitCounter = counters.get(counter);
        return hitCounter != null ? hitCounter.value() : 0L;
    }

    /**
     * Returns the rate (hits per second) computed at the last {@link #calcStats(boolean)},
     * or {@code -1} if the counter does not exist.
     */
    public double getCounterRate(String counter) {
        HitCounter hitCounter = counters.get(counter);
        if (hitCounter == null) {
            logger.warn("Counter:[{}] Not Found", counter);
            return -1D;
        }
        return hitCounter.rate();
    }

    /**
     * Returns the latest value of a gauge, or {@code -1} if it was never set.
     */
    public long getCurrentValue(String name) {
        AtomicLong value = values.get(name);
        return value != null ? value.get() : -1L;
    }

    /**
     * Returns the rolling average, or {@code -1} if no sample was recorded.
     */
    public double getAverage(String name) {
        RollingAverage average = averages.get(name);
        if (average == null) {
            return -1D;
        }
        return average.average();
    }

    /**
     * Recomputes counter rates and optionally logs every metric at debug level.
     *
     * @param print whether to log the computed values
     */
    public void calcStats(boolean print) {
        if (counters.isEmpty() && values.isEmpty() && averages.isEmpty()) {
            if (print) {
                logger.debug("Empty Stats");
            }
            return;
        }
        new TreeMap<>(counters).forEach((k, v) -> {
            double rate = v.calc();
            if (print) {
                logger.debug(String.format("  Stats:   [%-40s]:=[%10.3f]/s Current Value:(%11d)", k, rate, v.value()));
            }
        });
        if (print) {
            new TreeMap<>(values).forEach((k, v) ->
                    logger.debug(String.format("  Value:   [%-40s]:=[%10d]", k, v.get())));
            new TreeMap<>(averages).forEach((k, v) ->
                    logger.debug(String.format("  Average: [%-40s]:=[%10.3f]", k, v.average())));
        }
    }

    /**
     * Returns a sorted copy of every counter value, gauge and average, keyed by name.
     */
    public Map<String, Number> snapshot() {
        Map<String, Number> out = new TreeMap<>();
        counters.forEach((k, v) -> out.put(k, v.value()));
        values.forEach((k, v) -> out.put(k, v.get()));
        averages.forEach((k, v) -> out.put(k, v.average()));
        return out;
    }

    private static final class HitCounter {
        private final String name;
        private final AtomicLong currentValue = new AtomicLong();
        private long lastValue;
        private long lastCalc = System.currentTimeMillis();
        private volatile double currentRate;

        private HitCounter(String name) {
            this.name = name;
        }

        void increment() {
            currentValue.incrementAndGet();
        }

        long value() {
            return currentValue.get();
        }

        double rate() {
            return currentRate;
        }

        synchronized double calc() {
            long now = System.currentTimeMillis();
            long deltaT = Math.max(1L, now - lastCalc);
            long value = currentValue.get();
            currentRate = (value - lastValue) / (deltaT / 1000.0);
            lastValue = value;
            lastCalc = now;
            return currentRate;
        }

        @Override
        public String toString() {
            return name + "=" + currentValue.get();
        }
    }

    private static final class RollingAverage {
        private final ArrayDeque<Long> samples;
        private final int capacity;

        private RollingAverage(int capacity) {
            this.capacity = capacity;
            this.samples = new ArrayDeque<>(capacity);
        }

        synchronized void add(long value) {
            if (samples.size() == capacity) {
                samples.removeFirst();
            }
            samples.addLast(value);
        }

        synchronized double average() {
            return samples.stream().mapToDouble(Long::doubleValue).average().orElse(0.0);
        }
    }
}
