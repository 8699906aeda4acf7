/*
 * Copyright 2020 Amazon.com, Inc. or its affiliates. All Rights Reserved.
 *
 * Licensed under the Apache License, Version 2.0 (the "License").
 * You may not use this file except in compliance with the License.
 * A copy of the License is located at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * or in the "license" file accompanying this file. This file is distributed
 * on an "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either
 * express or implied. See the License for the specific language governing
 * permissions and limitations under the License.
 */

package org.urbanair.scanstat;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import org.openjdk.jmh.annotations.Benchmark;
import org.openjdk.jmh.annotations.Fork;
import org.openjdk.jmh.annotations.Level;
import org.openjdk.jmh.annotations.Measurement;
import org.openjdk.jmh.annotations.Param;
import org.openjdk.jmh.annotations.Scope;
import org.openjdk.jmh.annotations.Setup;
import org.openjdk.jmh.annotations.State;
import org.openjdk.jmh.annotations.Warmup;
import org.openjdk.jmh.infra.Blackhole;
import org.urbanair.scanstat.config.RegionCounterMethod;
import org.urbanair.scanstat.preprocessor.Preprocessor;
import org.urbanair.scanstat.returntypes.AggregatedCell;
import org.urbanair.scanstat.returntypes.Reading;
import org.urbanair.scanstat.scan.ScanEngine;
import org.urbanair.scanstat.testutils.SyntheticScootData;

@Warmup(iterations = 2)
@Measurement(iterations = 5)
@Fork(value = 1)
@State(Scope.Benchmark)
public class ScanEngineBenchmark {
    public static final int FORECAST_HOURS = 24;
    public static final int TRAIN_HOURS = 7 * 24;
    public static final Instant FORECAST_START = Instant.parse("2020-03-08T00:00:00Z");
    public static final Instant FORECAST_END = FORECAST_START.plus(Duration.ofHours(FORECAST_HOURS));

    @State(Scope.Thread)
    public static class BenchmarkState {
        @Param({ "4", "8", "16" })
        int gridResolution;

        @Param({ "NAIVE", "PREFIX_SUM" })
        RegionCounterMethod regionCounter;

        @Param({ "false", "true" })
        boolean parallelExecutionEnabled;

        List<AggregatedCell> cells;
        ScanEngine engine;

        @Setup(Level.Trial)
        public void setUpData() {
            Random rng = new Random(0);
            cells = new ArrayList<>();
            for (int h = 0; h < FORECAST_HOURS; h++) {
                Instant start = FORECAST_START.plus(Duration.ofHours(h));
                for (int row = 1; row <= gridResolution; row++) {
                    for (int col = 1; col <= gridResolution; col++) {
                        double baseline = 100 + 400 * rng.nextDouble();
                        cells.add(AggregatedCell.builder().row(row).col(col).measurementStartUtc(start)
                                .measurementEndUtc(start.plus(Duration.ofHours(1)))
                                .actual(Math.round(baseline * (0.8 + 0.4 * rng.nextDouble()))).baseline(baseline)
                                .baselineUpper(1.1 * baseline).baselineLower(0.9 * baseline).build());
                    }
                }
            }
            engine = ScanEngine.builder().regionCounter(regionCounter)
                    .parallelExecutionEnabled(parallelExecutionEnabled).build();
        }
    }

    @State(Scope.Thread)
    public static class PipelineState {
        @Param({ "4", "8" })
        int gridResolution;

        List<Reading> readings;
        ScanWindow window;
        ScanPipeline pipeline;

        @Setup(Level.Trial)
        public void setUpData() {
            Instant start = FORECAST_START.minus(Duration.ofHours(TRAIN_HOURS));
            readings = new SyntheticScootData().generateReadings(gridResolution, 2, start,
                    TRAIN_HOURS + FORECAST_HOURS, 0);
            window = ScanWindow.builder().upto(FORECAST_END).forecastHours(FORECAST_HOURS).trainHours(TRAIN_HOURS)
                    .build();
            pipeline = ScanPipeline.builder().gridResolution(gridResolution)
                    .preprocessor(Preprocessor.builder().repeats(0).build()).build();
        }
    }

    @Benchmark
    public void scan(BenchmarkState state, Blackhole blackhole) {
        blackhole.consume(state.engine.scan(state.cells, state.gridResolution, FORECAST_START, FORECAST_END));
    }

    @Benchmark
    public void pipeline(PipelineState state, Blackhole blackhole) {
        blackhole.consume(state.pipeline.run(state.readings, state.window));
    }
}
