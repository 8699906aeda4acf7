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

import static org.urbanair.scanstat.CommonUtils.checkNotNull;
import static org.urbanair.scanstat.CommonUtils.checkRequired;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.urbanair.scanstat.returntypes.AggregatedCell;
import org.urbanair.scanstat.returntypes.ForecastRow;

/**
 * Sums the actual and expected counts of all detectors mapped to the same grid
 * cell, hour by hour.
 */
public class GridAggregator {

    private static final Logger log = LoggerFactory.getLogger(GridAggregator.class);

    private GridAggregator() {
    }

    /**
     * @param rows forecast rows of any number of detectors
     * @return one cell per {@code (row, col, start, end)}, ordered by row, column
     *         and start time
     * @throws org.urbanair.scanstat.errors.InputShapeException if a row lacks its
     *                                                          cell or its time
     */
    public static List<AggregatedCell> aggregateToGrid(List<ForecastRow> rows) {
        checkNotNull(rows, "rows must not be null");
        Map<CellKey, double[]> sums = new LinkedHashMap<>();
        for (ForecastRow row : rows) {
            CellKey key = new CellKey(checkRequired(row.getRow(), "ForecastRow", "row"),
                    checkRequired(row.getCol(), "ForecastRow", "col"),
                    checkRequired(row.getMeasurementStartUtc(), "ForecastRow", "measurementStartUtc"),
                    checkRequired(row.getMeasurementEndUtc(), "ForecastRow", "measurementEndUtc"));
            double[] sum = sums.computeIfAbsent(key, k -> new double[4]);
            sum[0] += row.getActual();
            sum[1] += row.getBaseline();
            sum[2] += row.getBaselineUpper();
            sum[3] += row.getBaselineLower();
        }

        List<AggregatedCell> cells = new ArrayList<>(sums.size());
        sums.forEach((key, sum) -> cells.add(AggregatedCell.builder().row(key.row).col(key.col)
                .measurementStartUtc(key.start).measurementEndUtc(key.end).actual(sum[0]).baseline(sum[1])
                .baselineUpper(sum[2]).baselineLower(sum[3]).build()));
        cells.sort(Comparator.comparingInt(AggregatedCell::getRow).thenComparingInt(AggregatedCell::getCol)
                .thenComparing(AggregatedCell::getMeasurementStartUtc));
        log.info("Aggregated {} forecast rows into {} cell hours", rows.size(), cells.size());
        return cells;
    }

    private static class CellKey {
        private final int row;
        private final int col;
        private final Instant start;
        private final Instant end;

        CellKey(int row, int col, Instant start, Instant end) {
            this.row = row;
            this.col = col;
            this.start = start;
            this.end = end;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) {
                return true;
            }
            if (!(o instanceof CellKey)) {
                return false;
            }
            CellKey other = (CellKey) o;
            return row == other.row && col == other.col && start.equals(other.start) && end.equals(other.end);
        }

        @Override
        public int hashCode() {
            return Objects.hash(row, col, start, end);
        }
    }
}
