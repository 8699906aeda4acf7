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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.urbanair.scanstat.TestUtils.hour;

import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.urbanair.scanstat.errors.InputShapeException;
import org.urbanair.scanstat.returntypes.AggregatedCell;
import org.urbanair.scanstat.returntypes.ForecastRow;

public class GridAggregatorTest {

    private static ForecastRow row(String detectorId, Integer row, Integer col, int h, double actual,
            double baseline) {
        return ForecastRow.builder().detectorId(detectorId).row(row).col(col).measurementStartUtc(hour(h))
                .measurementEndUtc(hour(h + 1)).actual(actual).baseline(baseline).baselineUpper(baseline + 2)
                .baselineLower(baseline - 2).standardDeviation(1).build();
    }

    @Test
    public void testDetectorsInTheSameCellAreSummed() {
        List<ForecastRow> rows = new ArrayList<>();
        rows.add(row("b", 2, 1, 0, 5, 4));
        rows.add(row("a", 1, 1, 1, 7, 6));
        rows.add(row("a", 1, 1, 0, 3, 2));
        rows.add(row("c", 1, 1, 0, 10, 11));

        List<AggregatedCell> cells = GridAggregator.aggregateToGrid(rows);

        assertEquals(3, cells.size());
        AggregatedCell first = cells.get(0);
        assertEquals(1, first.getRow());
        assertEquals(1, first.getCol());
        assertEquals(hour(0), first.getMeasurementStartUtc());
        assertEquals(13.0, first.getActual());
        assertEquals(13.0, first.getBaseline());
        assertEquals(17.0, first.getBaselineUpper());
        assertEquals(9.0, first.getBaselineLower());

        assertEquals(hour(1), cells.get(1).getMeasurementStartUtc());
        assertEquals(7.0, cells.get(1).getActual());
        assertEquals(2, cells.get(2).getRow());
        assertEquals(5.0, cells.get(2).getActual());
    }

    @Test
    public void testTotalsArePreserved() {
        List<ForecastRow> rows = new ArrayList<>();
        for (int i = 0; i < 20; i++) {
            rows.add(row("d" + i, 1 + i % 3, 1 + i % 2, i % 4, i, 2 * i));
        }
        List<AggregatedCell> cells = GridAggregator.aggregateToGrid(rows);

        assertEquals(rows.stream().mapToDouble(ForecastRow::getActual).sum(),
                cells.stream().mapToDouble(AggregatedCell::getActual).sum(), 1e-9);
        assertEquals(rows.stream().mapToDouble(ForecastRow::getBaseline).sum(),
                cells.stream().mapToDouble(AggregatedCell::getBaseline).sum(), 1e-9);
    }

    @Test
    public void testMissingCell() {
        InputShapeException e = assertThrows(InputShapeException.class,
                () -> GridAggregator.aggregateToGrid(List.of(row("a", null, 1, 0, 1, 1))));
        assertEquals("row", e.getFieldName());
        assertEquals("ForecastRow", e.getRecordType());
    }
}
