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

package com.umitunal.lake.core.backgroundservice;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Base class for the engine's background loops.
 * Provides scheduling on a single daemon thread and uniform error logging.
 */
public abstract class AbstractBackgroundService implements BackgroundService {

    protected final Logger logger;
    protected final ScheduledExecutorService executorService;
    protected final String serviceName;

    private volatile ScheduledFuture<?> schedule;

    /**
     * @param serviceName used for logging and thread naming
     */
    protected AbstractBackgroundService(String serviceName) {
        this.serviceName = serviceName;
        this.logger = LoggerFactory.getLogger(this.getClass());
        this.executorService = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread thread = new Thread(r, "LakeEngine-" + serviceName);
            thread.setDaemon(true);
            return thread;
        });
    }

    /**
     * Schedules the task at a fixed rate.
     *
     * @param initialDelay delay before the first execution
     * @param period time between executions
     * @param timeUnit unit of both arguments
     */
    protected void scheduleTask(long initialDelay, long period, TimeUnit timeUnit) {
        schedule = executorService.scheduleAtFixedRate(this::executeTask, initialDelay, period, timeUnit);
        logger.info(serviceName + " service scheduled to run every " + period + " "
            + timeUnit.toString().toLowerCase());
    }

    /**
     * Stops future periodic runs while leaving the executor usable for {@link #triggerAsync()}.
     */
    protected void cancelSchedule() {
        ScheduledFuture<?> current = schedule;
        if (current != null) {
            current.cancel(false);
            logger.warn(serviceName + " service schedule cancelled");
        }
    }

    /**
     * Queues one execution on the service thread without waiting for it.
     */
    public void triggerAsync() {
        try {
            executorService.execute(this::executeTask);
        } catch (RejectedExecutionException e) {
            logger.debug(serviceName + " service is shut down, trigger ignored");
        }
    }

    private void executeTask() {
        try {
            executeNow();
        } catch (Exception e) {
            logger.error("Error during " + serviceName + " execution", e);
        }
    }

    @Override
    public void executeNow() {
        try {
            logger.debug(serviceName + " service executing");
            doExecute();
            logger.debug(serviceName + " service completed");
        } catch (Exception e) {
            logger.error("Error during " + serviceName + " execution", e);
        }
    }

    /**
     * The task itself.
     *
     * @throws Exception any failure, logged by the caller
     */
    protected abstract void doExecute() throws Exception;

    @Override
    public void shutdown() {
        logger.info(serviceName + " service shutting down");
        executorService.shutdown();

        try {
            if (!executorService.awaitTermination(5, TimeUnit.SECONDS)) {
                logger.warn(serviceName + " service did not terminate in time, forcing shutdown");
                executorService.shutdownNow();
            }
        } catch (InterruptedException e) {
            logger.warn(serviceName + " service shutdown interrupted, forcing shutdown");
            executorService.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    @Override
    public boolean awaitTermination(long timeout, TimeUnit unit) throws InterruptedException {
        return executorService.awaitTermination(timeout, unit);
    }

    @Override
    public void shutdownNow() {
        logger.info(serviceName + " service shutting down now");
        executorService.shutdownNow();
    }
}
