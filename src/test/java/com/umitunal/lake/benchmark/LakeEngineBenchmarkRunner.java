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

package com.umitunal.lake.benchmark;

import org.openjdk.jmh.results.format.ResultFormatType;
import org.openjdk.jmh.runner.Runner;
import org.openjdk.jmh.runner.RunnerException;
import org.openjdk.jmh.runner.options.Options;
import org.openjdk.jmh.runner.options.OptionsBuilder;
import org.openjdk.jmh.runner.options.TimeValue;

import java.util.concurrent.TimeUnit;

/**
 * Runner class for LakeEngine benchmarks.
 *
 * Runs the full benchmark by default, or a quick single-iteration pass with {@code quick}
 * as the first argument.
 */
public class LakeEngineBenchmarkRunner {

    public static void main(String[] args) throws RunnerException {
        if (args.length > 0 && args[0].equals("quick")) {
            runBenchmarks(1, 1, 1, "lake-engine-quick-benchmark-results.txt");
        } else {
            runBenchmarks(3, 5, 1, "lake-engine-benchmark-results.txt");
        }
    }

    /**
     * Run the benchmarks with custom options.
     *
     * @param warmupIterations Number of warmup iterations
     * @param measurementIterations Number of measurement iterations
     * @param forks Number of JVM forks
     * @param resultFile File to save results to
     * @throws RunnerException If an error occurs during benchmark execution
     */
    public static void runBenchmarks(int warmupIterations, int measurementIterations,
                                     int forks, String resultFile) throws RunnerException {
        Options options = new OptionsBuilder()
            .include(LakeEngineBenchmark.class.getSimpleName())
            .warmupIterations(warmupIterations)
            .warmupTime(TimeValue.seconds(1))
            .measurementIterations(measurementIterations)
            .measurementTime(TimeValue.seconds(1))
            .forks(forks)
            .jvmArgs("-Xms2G", "-Xmx2G")
            .shouldDoGC(true)
            .shouldFailOnError(true)
            .resultFormat(ResultFormatType.TEXT)
            .result(resultFile)
            .timeUnit(TimeUnit.MICROSECONDS)
            .build();

        new Runner(options).run();

        System.out.println("Benchmark completed. Results saved to " + resultFile);
    }
}
