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

import java.time.Instant;
import java.util.List;

import org.urbanair.scanstat.returntypes.AggregatedCell;

/**
 * Sums every region by a pass over all cells. Slow, used as the reference for
 * {@link PrefixSumRegionCounter}.
 */
public class NaiveRegionCounter extends AbstractRegionCounter {

    private final List<AggregatedCell> cells;

    public NaiveRegionCounter(List<AggregatedCell> cells, int gridResolution, Instant windowStart,
            Instant windowEnd) {
        super(gridResolution, windowStart, windowEnd);
        this.cells = inDomain(cells);
    }

    @Override
    public RegionCounts count(int rowMin, int rowMax, int colMin, int colMax, Instant tMin) {
        checkBounds(rowMin, rowMax, colMin, colMax);
        long actual = 0;
        long baseline = 0;
        long upper = 0;
        long lower = 0;
        for (AggregatedCell cell : cells) {
            if (rowMin < cell.getRow() && cell.getRow() <= rowMax && colMin < cell.getCol()
                    && cell.getCol() <= colMax && !cell.getMeasurementStartUtc().isBefore(tMin)) {
                actual = Math.addExact(actual, toFixed(cell.getActual()));
                baseline = Math.addExact(baseline, toFixed(cell.getBaseline()));
                upper = Math.addExact(upper, toFixed(cell.getBaselineUpper()));
                lower = Math.addExact(lower, toFixed(cell.getBaselineLower()));
            }
        }
        return fromFixed(actual, baseline, upper, lower);
    }
}
