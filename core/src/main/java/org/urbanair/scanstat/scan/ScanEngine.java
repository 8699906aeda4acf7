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

package org.urbanair.scanstat.scan;

import static org.urbanair.scanstat.CommonUtils.COUNT_SCALE;
import static org.urbanair.scanstat.CommonUtils.checkArgument;
import static org.urbanair.scanstat.CommonUtils.checkNotNull;
import static org.urbanair.scanstat.CommonUtils.descendingHourlyMarks;
import static org.urbanair.scanstat.CommonUtils.extentsPerAxis;
import static org.urbanair.scanstat.CommonUtils.halfMax;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.atomic.AtomicBoolean;

import lombok.AccessLevel;
import lombok.Getter;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.urbanair.scanstat.config.RegionCounterMethod;
import org.urbanair.scanstat.executor.AbstractScanExecutor;
import org.urbanair.scanstat.executor.ParallelScanExecutor;
import org.urbanair.scanstat.executor.SequentialScanExecutor;
import org.urbanair.scanstat.grid.IRegionCounter;
import org.urbanair.scanstat.grid.NaiveRegionCounter;
import org.urbanair.scanstat.grid.PrefixSumRegionCounter;
import org.urbanair.scanstat.grid.RegionCounts;
import org.urbanair.scanstat.returntypes.AggregatedCell;
import org.urbanair.scanstat.returntypes.SearchRegion;

/**
 * Exhaustive expectation-based scan over all rectangular space-time regions of
 * a square grid. Every region ends at the end of the scanned window and starts
 * on one of its hours; spatially it spans at most half the grid, rounded up,
 * along each axis.
 */
@Getter
public class ScanEngine {

    private static final Logger log = LoggerFactory.getLogger(ScanEngine.class);

    public static final boolean DEFAULT_PARALLEL_EXECUTION_ENABLED = false;
    public static final RegionCounterMethod DEFAULT_REGION_COUNTER_METHOD = RegionCounterMethod.PREFIX_SUM;

    private final boolean parallelExecutionEnabled;
    private final int threadPoolSize;
    private final RegionCounterMethod regionCounterMethod;
    @Getter(AccessLevel.NONE)
    private final AbstractScanExecutor executor;
    @Getter(AccessLevel.NONE)
    private final AtomicBoolean cancelRequested = new AtomicBoolean(false);

    protected ScanEngine(Builder<?> builder) {
        builder.threadPoolSize.ifPresent(n -> checkArgument((n > 0) || ((n == 0) && !builder.parallelExecutionEnabled),
                "threadPoolSize must be greater/equal than 0. To disable thread pool, set parallel execution to 'false'."));
        checkNotNull(builder.regionCounterMethod, "regionCounterMethod must not be null");
        parallelExecutionEnabled = builder.parallelExecutionEnabled;
        regionCounterMethod = builder.regionCounterMethod;

        if (parallelExecutionEnabled) {
            threadPoolSize = builder.threadPoolSize
                    .orElse(Math.max(1, Runtime.getRuntime().availableProcessors() - 1));
            executor = new ParallelScanExecutor(threadPoolSize);
        } else {
            threadPoolSize = 0;
            executor = new SequentialScanExecutor();
        }
    }

    /**
     * Scores every space-time region of the grid.
     *
     * @param cells          aggregated counts; cells outside the grid or the
     *                       window are ignored
     * @param gridResolution number of cells along each spatial axis
     * @param forecastStart  start of the scanned window, on the hour
     * @param forecastEnd    end of the scanned window, the end of every region
     * @return every region, ordered by descending {@code ebp}; ties keep the
     *         order of enumeration
     * @throws CancellationException if {@link #cancel()} was called during the
     *                               scan
     */
    public List<SearchRegion> scan(List<AggregatedCell> cells, int gridResolution, Instant forecastStart,
            Instant forecastEnd) {
        checkNotNull(cells, "cells must not be null");
        checkArgument(gridResolution > 0, "gridResolution must be greater than 0");
        checkArgument(forecastStart.isBefore(forecastEnd), "forecastStart must be before forecastEnd");

        long begin = System.nanoTime();
        try {
            IRegionCounter counter = newRegionCounter(regionCounterMethod, cells, gridResolution, forecastStart,
                    forecastEnd);
            RegionCounts totals = counter.totals().scaled(1.0 / COUNT_SCALE);
            List<Instant> marks = descendingHourlyMarks(forecastStart, forecastEnd);
            int regionsPerWindow = extentsPerAxis(gridResolution) * extentsPerAxis(gridResolution);
            log.info("Scanning {} regions in each of {} time windows on a {}x{} grid", regionsPerWindow,
                    marks.size(), gridResolution, gridResolution);

            List<SearchRegion> regions = executor.scanWindows(marks,
                    tMin -> scanWindow(counter, totals, tMin, forecastEnd));
            regions.sort(Comparator.comparingDouble(SearchRegion::getEbp).reversed());

            log.info("Scanned {} regions in {} ms", regions.size(),
                    Duration.ofNanos(System.nanoTime() - begin).toMillis());
            return regions;
        } finally {
            cancelRequested.set(false);
        }
    }

    /**
     * Requests the running scan to stop. The request is checked before each time
     * window is scanned; a request made while no scan runs applies to the next
     * one.
     */
    public void cancel() {
        cancelRequested.set(true);
    }

    List<SearchRegion> scanWindow(IRegionCounter counter, RegionCounts totals, Instant tMin, Instant tMax) {
        if (cancelRequested.get()) {
            throw new CancellationException("scan cancelled before window starting " + tMin);
        }
        log.debug("Scanning regions starting at {}", tMin);
        int resolution = counter.getGridResolution();
        int half = halfMax(resolution);
        List<SearchRegion> regions = new ArrayList<>();
        for (int colMin = 0; colMin <= resolution; colMin++) {
            for (int colMax = colMin + 1; colMax <= Math.min(colMin + half, resolution); colMax++) {
                for (int rowMin = 0; rowMin <= resolution; rowMin++) {
                    for (int rowMax = rowMin + 1; rowMax <= Math.min(rowMin + half, resolution); rowMax++) {
                        RegionCounts counts = counter.count(rowMin, rowMax, colMin, colMax, tMin)
                                .scaled(1.0 / COUNT_SCALE);
                        regions.add(score(rowMin, rowMax, colMin, colMax, tMin, tMax, counts, totals));
                    }
                }
            }
        }
        return regions;
    }

    static SearchRegion score(int rowMin, int rowMax, int colMin, int colMax, Instant tMin, Instant tMax,
            RegionCounts in, RegionCounts totals) {
        double a = in.getActual();
        double aTotal = totals.getActual();
        return SearchRegion.builder().rowMin(rowMin).rowMax(rowMax).colMin(colMin).colMax(colMax)
                .measurementStartUtc(tMin).measurementEndUtc(tMax).baseline(in.getBaseline())
                .baselineUpper(in.getBaselineUpper()).baselineLower(in.getBaselineLower()).actual(a)
                .ebp(ScanMetrics.ebp(in.getBaseline(), a))
                .ebpUpper(ScanMetrics.ebp(in.getBaselineLower(), a))
                .ebpLower(ScanMetrics.ebp(in.getBaselineUpper(), a))
                .kulldorff(ScanMetrics.kulldorff(in.getBaseline(), totals.getBaseline(), a, aTotal))
                .kulldorffUpper(ScanMetrics.kulldorff(in.getBaselineLower(), totals.getBaselineLower(), a, aTotal))
                .kulldorffLower(ScanMetrics.kulldorff(in.getBaselineUpper(), totals.getBaselineUpper(), a, aTotal))
                .ebpAsym(ScanMetrics.ebpAsymmetric(in.getBaseline(), a))
                .ebpAsymUpper(ScanMetrics.ebpAsymmetric(in.getBaselineLower(), a))
                .ebpAsymLower(ScanMetrics.ebpAsymmetric(in.getBaselineUpper(), a)).build();
    }

    public static IRegionCounter newRegionCounter(RegionCounterMethod method, List<AggregatedCell> cells,
            int gridResolution, Instant windowStart, Instant windowEnd) {
        switch (method) {
        case NAIVE:
            return new NaiveRegionCounter(cells, gridResolution, windowStart, windowEnd);
        case PREFIX_SUM:
            return new PrefixSumRegionCounter(cells, gridResolution, windowStart, windowEnd);
        default:
            throw new IllegalStateException("unknown region counter method " + method);
        }
    }

    /**
     * @return a new ScanEngine builder.
     */
    public static Builder builder() {
        return new Builder();
    }

    public static class Builder<T extends Builder<T>> {

        protected boolean parallelExecutionEnabled = DEFAULT_PARALLEL_EXECUTION_ENABLED;
        protected Optional<Integer> threadPoolSize = Optional.empty();
        protected RegionCounterMethod regionCounterMethod = DEFAULT_REGION_COUNTER_METHOD;

        public T parallelExecutionEnabled(boolean parallelExecutionEnabled) {
            this.parallelExecutionEnabled = parallelExecutionEnabled;
            return (T) this;
        }

        public T threadPoolSize(int threadPoolSize) {
            this.threadPoolSize = Optional.of(threadPoolSize);
            return (T) this;
        }

        public T regionCounter(RegionCounterMethod regionCounterMethod) {
            this.regionCounterMethod = regionCounterMethod;
            return (T) this;
        }

        public ScanEngine build() {
            return new ScanEngine(this);
        }
    }
}
