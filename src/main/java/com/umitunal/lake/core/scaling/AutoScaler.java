/*
 * Copyright (c) 2023-2025 Umit Unal
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.umitunal.lake.core.scaling;

import com.umitunal.lake.config.ScalingPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Control loop that sizes the query worker pool from observed load.
 *
 * <p>Each cycle samples system and query metrics into a bounded history, evaluates the mean of the
 * last {@code evaluationWindow} samples and, outside the respective cooldown, scales the worker count
 * by the configured factor within [minWorkers, maxWorkers]. Scaling up needs any threshold to be
 * crossed; scaling down needs every indicator to be low. The cycle finishes with memory management:
 * listeners are asked to evict above the high-water mark and receive a fresh cache budget.</p>
 */
public class AutoScaler {
    private static final Logger logger = LoggerFactory.getLogger(AutoScaler.class);

    private static final int LATENCY_SAMPLE_LIMIT = 1000;

    private final ScalingPolicy policy;
    private final SystemMetricsProvider metricsProvider;
    private final Clock clock;

    private final Deque<MetricsSnapshot> history = new ArrayDeque<>();
    private final Map<String, Long> activeQueries = new ConcurrentHashMap<>();
    private final Set<String> queue = new LinkedHashSet<>();
    private final Deque<Long> completedLatencies = new ArrayDeque<>();
    private final List<ScalingListener> listeners = new CopyOnWriteArrayList<>();
    private final List<MemoryPressureListener> memoryListeners = new CopyOnWriteArrayList<>();
    private final AtomicBoolean scalingInProgress = new AtomicBoolean();

    private volatile int currentWorkers;
    private volatile Long lastScaleUp;
    private volatile Long lastScaleDown;
    private volatile long cacheBudgetBytes;

    /**
     * @param initialWorkers starting worker count, clamped to the policy bounds
     */
    public AutoScaler(ScalingPolicy policy, int initialWorkers, SystemMetricsProvider metricsProvider, Clock clock) {
        this.policy = policy;
        this.metricsProvider = metricsProvider;
        this.clock = clock;
        this.currentWorkers = clamp(initialWorkers);
        logger.info("AutoScaler initialized with " + currentWorkers + " workers");
    }

    public void addListener(ScalingListener listener) {
        listeners.add(listener);
    }

    public void addMemoryPressureListener(MemoryPressureListener listener) {
        memoryListeners.add(listener);
    }

    public void registerQueryStart(String queryId) {
        activeQueries.put(queryId, clock.millis());
    }

    public void registerQueryComplete(String queryId) {
        Long startedAt = activeQueries.remove(queryId);
        if (startedAt == null) {
            return;
        }
        synchronized (completedLatencies) {
            completedLatencies.addLast(Math.max(0, clock.millis() - startedAt));
            while (completedLatencies.size() > LATENCY_SAMPLE_LIMIT) {
                completedLatencies.removeFirst();
            }
        }
    }

    public void enqueue(String queryId) {
        synchronized (queue) {
            queue.add(queryId);
        }
    }

    public void dequeue(String queryId) {
        synchronized (queue) {
            queue.remove(queryId);
        }
    }

    /**
     * Runs one control cycle: sample, evaluate, manage memory.
     */
    public ScalingAction runCycle() {
        collectMetrics();
        ScalingAction action = evaluate();
        manageMemory();
        return action;
    }

    /**
     * Samples current metrics into the history.
     */
    public MetricsSnapshot collectMetrics() {
        double latency;
        synchronized (completedLatencies) {
            latency = completedLatencies.stream().mapToLong(Long::longValue).average().orElse(0.0);
            completedLatencies.clear();
        }
        int queued;
        synchronized (queue) {
            queued = queue.size();
        }
        MetricsSnapshot snapshot = new MetricsSnapshot(clock.millis(), metricsProvider.cpuPercent(),
            metricsProvider.memoryPercent(), activeQueries.size(), queued, latency, metricsProvider.ioWait());
        record(snapshot);
        logger.debug("Metrics collected: CPU=" + snapshot.cpuPercent() + "%, Memory=" + snapshot.memoryPercent()
            + "%, Queries=" + snapshot.activeQueries() + ", Queue=" + snapshot.queueLength());
        return snapshot;
    }

    /**
     * Adds a sample to the bounded history.
     */
    public void record(MetricsSnapshot snapshot) {
        synchronized (history) {
            history.addLast(snapshot);
            while (history.size() > policy.historySize()) {
                history.removeFirst();
            }
        }
    }

    /**
     * Decides and applies a scaling step from the recent samples.
     *
     * @return the action taken, {@link ScalingAction#NONE} when nothing changed
     */
    public ScalingAction evaluate() {
        List<MetricsSnapshot> recent = recentWindow();
        if (recent.size() < policy.evaluationWindow()) {
            return ScalingAction.NONE;
        }
        if (!scalingInProgress.compareAndSet(false, true)) {
            return ScalingAction.NONE;
        }
        try {
            double cpu = recent.stream().mapToDouble(MetricsSnapshot::cpuPercent).average().orElse(0);
            double memory = recent.stream().mapToDouble(MetricsSnapshot::memoryPercent).average().orElse(0);
            double queries = recent.stream().mapToInt(MetricsSnapshot::activeQueries).average().orElse(0);
            double queued = recent.stream().mapToInt(MetricsSnapshot::queueLength).average().orElse(0);
            double latency = recent.stream().mapToDouble(MetricsSnapshot::avgQueryLatencyMillis).average().orElse(0);

            boolean scaleUp = cpu > policy.cpuScaleUpPercent()
                || memory > policy.memoryScaleUpPercent()
                || queries > policy.maxConcurrentQueries() * 0.8
                || queued > policy.queueThreshold()
                || latency > policy.latencyThresholdMillis();

            boolean scaleDown = cpu < policy.cpuScaleDownPercent()
                && memory < policy.memoryScaleDownPercent()
                && queries < policy.maxConcurrentQueries() * 0.3
                && queued == 0
                && latency < policy.latencyThresholdMillis() * 0.5;

            long now = clock.millis();
            if (scaleUp) {
                if (cooledDown(lastScaleUp, policy.scaleUpCooldownSeconds(), now)) {
                    return scaleUp(now);
                }
                logger.debug("Scale up suppressed by cooldown");
            } else if (scaleDown) {
                if (cooledDown(lastScaleDown, policy.scaleDownCooldownSeconds(), now)) {
                    return scaleDown(now);
                }
                logger.debug("Scale down suppressed by cooldown");
            }
            return ScalingAction.NONE;
        } finally {
            scalingInProgress.set(false);
        }
    }

    private List<MetricsSnapshot> recentWindow() {
        synchronized (history) {
            List<MetricsSnapshot> all = new ArrayList<>(history);
            return all.subList(Math.max(0, all.size() - policy.evaluationWindow()), all.size());
        }
    }

    private static boolean cooledDown(Long last, long cooldownSeconds, long now) {
        return last == null || now - last > cooldownSeconds * 1000;
    }

    private ScalingAction scaleUp(long now) {
        int previous = currentWorkers;
        if (previous >= policy.maxWorkers()) {
            logger.warn("Already at maximum worker capacity");
            return ScalingAction.NONE;
        }
        int next = clamp(Math.max(previous + 1, (int) (previous * policy.scaleUpFactor())));
        logger.info("Scaling up from " + previous + " to " + next + " workers");
        currentWorkers = next;
        lastScaleUp = now;
        notifyListeners(previous, next, ScalingAction.SCALE_UP);
        return ScalingAction.SCALE_UP;
    }

    private ScalingAction scaleDown(long now) {
        int previous = currentWorkers;
        if (previous <= policy.minWorkers()) {
            logger.debug("Already at minimum worker capacity");
            return ScalingAction.NONE;
        }
        int next = clamp(Math.min(previous - 1, (int) (previous * policy.scaleDownFactor())));
        logger.info("Scaling down from " + previous + " to " + next + " workers");
        currentWorkers = next;
        lastScaleDown = now;
        notifyListeners(previous, next, ScalingAction.SCALE_DOWN);
        return ScalingAction.SCALE_DOWN;
    }

    private void notifyListeners(int previous, int next, ScalingAction action) {
        for (ScalingListener listener : listeners) {
            try {
                listener.onWorkersChanged(previous, next, action);
            } catch (RuntimeException e) {
                logger.error("Scaling listener failed", e);
            }
        }
    }

    /**
     * Asks listeners to evict above the high-water mark and pushes the current cache budget.
     */
    public void manageMemory() {
        double memory = metricsProvider.memoryPercent();
        if (memory > policy.memoryHighWaterPercent()) {
            logger.info("Memory usage " + memory + "% above high-water mark, asking caches to evict");
            for (MemoryPressureListener listener : memoryListeners) {
                try {
                    listener.onMemoryPressure(memory);
                } catch (RuntimeException e) {
                    logger.error("Memory pressure listener failed", e);
                }
            }
        }
        long budget = (long) (metricsProvider.availableMemoryBytes() * policy.cacheBudgetFraction());
        cacheBudgetBytes = budget;
        for (MemoryPressureListener listener : memoryListeners) {
            try {
                listener.onCacheBudget(budget);
            } catch (RuntimeException e) {
                logger.error("Memory pressure listener failed", e);
            }
        }
        logger.debug("Target cache memory: " + budget / (1024 * 1024) + " MB");
    }

    private int clamp(int workers) {
        return Math.max(policy.minWorkers(), Math.min(policy.maxWorkers(), workers));
    }

    public int currentWorkers() {
        return currentWorkers;
    }

    public List<MetricsSnapshot> history() {
        synchronized (history) {
            return new ArrayList<>(history);
        }
    }

    public ScalingStatus status() {
        MetricsSnapshot recent;
        int historySize;
        synchronized (history) {
            recent = history.peekLast();
            historySize = history.size();
        }
        int queued;
        synchronized (queue) {
            queued = queue.size();
        }
        return new ScalingStatus(currentWorkers, scalingInProgress.get(), activeQueries.size(), queued, recent,
            lastScaleUp, lastScaleDown, cacheBudgetBytes, historySize);
    }
}
