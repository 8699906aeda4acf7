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

package org.urbanair.scanstat.grid;

import static org.urbanair.scanstat.CommonUtils.checkArgument;
import static org.urbanair.scanstat.CommonUtils.hoursBetween;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import lombok.Getter;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.urbanair.scanstat.returntypes.AggregatedCell;

/**
 * Shared bookkeeping of the region counters: the scanned domain and the cells
 * that fall inside it.
 */
public abstract class AbstractRegionCounter implements IRegionCounter {

    private static final Logger log = LoggerFactory.getLogger(AbstractRegionCounter.class);

    /**
     * Counts are summed as multiples of {@code 2^-COUNT_FRACTION_BITS}. Integer
     * sums do not depend on the order of addition, so every counter returns the
     * same sums, and a region without data sums to exactly 0.
     */
    public static final int COUNT_FRACTION_BITS = 20;

    private static final double TO_FIXED = Math.scalb(1.0, COUNT_FRACTION_BITS);
    private static final double FROM_FIXED = Math.scalb(1.0, -COUNT_FRACTION_BITS);

    @Getter
    protected final int gridResolution;
    protected final Instant windowStart;
    protected final Instant windowEnd;
    protected final int hours;

    protected AbstractRegionCounter(int gridResolution, Instant windowStart, Instant windowEnd) {
        checkArgument(gridResolution > 0, "gridResolution must be greater than 0");
        checkArgument(windowStart.isBefore(windowEnd), "windowStart must be before windowEnd");
        this.gridResolution = gridResolution;
        this.windowStart = windowStart;
        this.windowEnd = windowEnd;
        this.hours = hoursBetween(windowStart, windowEnd);
    }

    /**
     * @return the hour index of a start time within the window, or -1 if it is
     *         outside the window or not on the hour
     */
    protected int hourIndex(Instant start) {
        if (start.isBefore(windowStart) || !start.isBefore(windowEnd)) {
            return -1;
        }
        int index = hoursBetween(windowStart, start);
        return windowStart.plusSeconds(3600L * index).equals(start) ? index : -1;
    }

    /**
     * @return the index of the first hour that starts at or after {@code tMin},
     *         {@code hours} if there is none
     */
    protected int firstHourFrom(Instant tMin) {
        if (!tMin.isAfter(windowStart)) {
            return 0;
        }
        if (!tMin.isBefore(windowEnd)) {
            return hours;
        }
        long seconds = Duration.between(windowStart, tMin).getSeconds();
        return (int) ((seconds + 3599) / 3600);
    }

    protected void checkBounds(int rowMin, int rowMax, int colMin, int colMax) {
        checkArgument(0 <= rowMin && rowMin <= rowMax && rowMax <= gridResolution, "invalid row bounds");
        checkArgument(0 <= colMin && colMin <= colMax && colMax <= gridResolution, "invalid column bounds");
    }

    /**
     * @return the count rounded to the nearest multiple of
     *         {@code 2^-COUNT_FRACTION_BITS}, as an integer
     */
    protected static long toFixed(double count) {
        checkArgument(Double.isFinite(count) && Math.abs(count) * TO_FIXED < Long.MAX_VALUE,
                "counts must be finite and within range");
        return Math.round(count * TO_FIXED);
    }

    protected static RegionCounts fromFixed(long actual, long baseline, long baselineUpper, long baselineLower) {
        return new RegionCounts(actual * FROM_FIXED, baseline * FROM_FIXED, baselineUpper * FROM_FIXED,
                baselineLower * FROM_FIXED);
    }

    protected boolean inGrid(AggregatedCell cell) {
        return cell.getRow() >= 1 && cell.getRow() <= gridResolution && cell.getCol() >= 1
                && cell.getCol() <= gridResolution;
    }

    /**
     * @return the cells inside the grid and the window; the others are logged
     *         and ignored
     */
    protected List<AggregatedCell> inDomain(List<AggregatedCell> cells) {
        List<AggregatedCell> kept = new ArrayList<>(cells.size());
        int ignored = 0;
        for (AggregatedCell cell : cells) {
            if (inGrid(cell) && hourIndex(cell.getMeasurementStartUtc()) >= 0) {
                kept.add(cell);
            } else {
                ignored++;
            }
        }
        if (ignored > 0) {
            log.warn("Ignoring {} aggregated cells outside the {}x{} grid or the window [{}, {})", ignored,
                    gridResolution, gridResolution, windowStart, windowEnd);
        }
        return kept;
    }

    @Override
    public RegionCounts totals() {
        return count(0, gridResolution, 0, gridResolution, windowStart);
    }
}
