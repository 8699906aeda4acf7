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
 * Answers region sums in constant time from cumulative sums over time (from the
 * end of the window backwards) and over both spatial axes. The sums are kept in
 * fixed point, so inclusion-exclusion is exact and every answer equals the one
 * of {@link NaiveRegionCounter}.
 */
public class PrefixSumRegionCounter extends AbstractRegionCounter {

    private static final int ACTUAL = 0;
    private static final int BASELINE = 1;
    private static final int UPPER = 2;
    private static final int LOWER = 3;

    // [quantity][hour][row][col], hour suffix sums and 2-d prefix sums over
    // rows 1..row and columns 1..col
    private final long[][][][] sums;

    public PrefixSumRegionCounter(List<AggregatedCell> cells, int gridResolution, Instant windowStart,
            Instant windowEnd) {
        super(gridResolution, windowStart, windowEnd);
        int size = gridResolution + 1;
        sums = new long[4][hours + 1][size][size];

        for (AggregatedCell cell : inDomain(cells)) {
            int t = hourIndex(cell.getMeasurementStartUtc());
            add(ACTUAL, t, cell, cell.getActual());
            add(BASELINE, t, cell, cell.getBaseline());
            add(UPPER, t, cell, cell.getBaselineUpper());
            add(LOWER, t, cell, cell.getBaselineLower());
        }

        for (long[][][] quantity : sums) {
            for (int t = hours - 1; t >= 0; t--) {
                for (int r = 1; r < size; r++) {
                    for (int c = 1; c < size; c++) {
                        quantity[t][r][c] = Math.addExact(quantity[t][r][c], quantity[t + 1][r][c]);
                    }
                }
            }
            for (int t = 0; t < hours; t++) {
                for (int r = 1; r < size; r++) {
                    for (int c = 1; c < size; c++) {
                        quantity[t][r][c] += quantity[t][r - 1][c] + quantity[t][r][c - 1]
                                - quantity[t][r - 1][c - 1];
                    }
                }
            }
        }
    }

    private void add(int quantity, int t, AggregatedCell cell, double count) {
        long[] row = sums[quantity][t][cell.getRow()];
        row[cell.getCol()] = Math.addExact(row[cell.getCol()], toFixed(count));
    }

    @Override
    public RegionCounts count(int rowMin, int rowMax, int colMin, int colMax, Instant tMin) {
        checkBounds(rowMin, rowMax, colMin, colMax);
        int t = firstHourFrom(tMin);
        if (t == hours) {
            return RegionCounts.ZERO;
        }
        return fromFixed(box(sums[ACTUAL][t], rowMin, rowMax, colMin, colMax),
                box(sums[BASELINE][t], rowMin, rowMax, colMin, colMax),
                box(sums[UPPER][t], rowMin, rowMax, colMin, colMax),
                box(sums[LOWER][t], rowMin, rowMax, colMin, colMax));
    }

    private static long box(long[][] prefix, int rowMin, int rowMax, int colMin, int colMax) {
        return prefix[rowMax][colMax] - prefix[rowMin][colMax] - prefix[rowMax][colMin] + prefix[rowMin][colMin];
    }
}
