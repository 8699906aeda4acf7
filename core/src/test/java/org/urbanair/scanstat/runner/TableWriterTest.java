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

package org.urbanair.scanstat.runner;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.urbanair.scanstat.TestUtils.hour;

import java.io.IOException;
import java.io.StringWriter;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.urbanair.scanstat.returntypes.CellScore;
import org.urbanair.scanstat.returntypes.SearchRegion;

public class TableWriterTest {

    @Test
    public void testWriteRegions() throws IOException {
        SearchRegion region = SearchRegion.builder().rowMin(0).rowMax(1).colMin(2).colMax(3)
                .measurementStartUtc(hour(1)).measurementEndUtc(hour(2)).baseline(1.5).baselineUpper(2)
                .baselineLower(1).actual(3).ebp(4).ebpLower(5).ebpUpper(6).kulldorff(7).kulldorffLower(8)
                .kulldorffUpper(9).ebpAsym(10).ebpAsymLower(11).ebpAsymUpper(12).build();
        StringWriter out = new StringWriter();

        new TableWriter(',').writeRegions(List.of(region), out);

        String[] lines = out.toString().split("\n");
        assertEquals(2, lines.length);
        assertEquals(String.join(",", TableWriter.REGION_COLUMNS), lines[0]);
        assertEquals("0,1,2,3,2020-03-02T01:00:00Z,2020-03-02T02:00:00Z,1.5,2.0,1.0,3.0,4.0,5.0,6.0,7.0,8.0,9.0,"
                + "10.0,11.0,12.0", lines[1]);
    }

    @Test
    public void testWriteCells() throws IOException {
        CellScore score = CellScore.builder().row(2).col(1).measurementStartUtc(hour(0)).measurementEndUtc(hour(3))
                .ebpMean(1.25).ebpStandardDeviation(Double.NaN).build();
        StringWriter out = new StringWriter();

        new TableWriter('\t').writeCells(List.of(score, score), out);

        String[] lines = out.toString().split("\n");
        assertEquals(3, lines.length);
        assertEquals(String.join("\t", TableWriter.CELL_COLUMNS), lines[0]);
        assertEquals("2\t1\t2020-03-02T00:00:00Z\t2020-03-02T03:00:00Z\t1.25\t0.0\t0.0\t0.0\t0.0\t0.0\t0.0\t0.0\t0.0\tNaN",
                lines[1]);
    }

    @Test
    public void testEmptyTableHasHeader() throws IOException {
        StringWriter out = new StringWriter();
        new TableWriter(',').writeRegions(List.of(), out);
        assertEquals(String.join(",", TableWriter.REGION_COLUMNS) + "\n", out.toString());
    }
}
