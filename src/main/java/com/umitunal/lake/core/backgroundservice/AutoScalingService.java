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

import com.umitunal.lake.config.ScalingPolicy;
import com.umitunal.lake.core.scaling.AutoScaler;
import com.umitunal.lake.core.scaling.ScalingAction;

import java.util.concurrent.TimeUnit;

/**
 * Background service that runs one auto-scaler cycle every {@code monitorIntervalSeconds}.
 */
public class AutoScalingService extends AbstractBackgroundService {

    private final AutoScaler autoScaler;
    private final ScalingPolicy policy;

    public AutoScalingService(AutoScaler autoScaler, ScalingPolicy policy) {
        super("AutoScaling");
        this.autoScaler = autoScaler;
        this.policy = policy;
    }

    @Override
    public void start() {
        scheduleTask(policy.monitorIntervalSeconds(), policy.monitorIntervalSeconds(), TimeUnit.SECONDS);
    }

    @Override
    protected void doExecute() {
        ScalingAction action = autoScaler.runCycle();
        if (action != ScalingAction.NONE) {
            logger.info("Auto-scaling cycle applied " + action + ", workers now " + autoScaler.currentWorkers());
        }
    }
}
