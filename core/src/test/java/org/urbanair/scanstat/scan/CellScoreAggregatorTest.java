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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.urbanair.scanstat.TestUtils.EPSILON;
import static org.urbanair.scanstat.TestUtils.hour;
import static org.urbanair.scanstat.TestUtils.randomCells;

import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.urbanair.scanstat.returntypes.CellScore;
import org.urbanair.scanstat.returntypes.SearchRegion;

public class CellScoreAggregatorTest {

    private static SearchRegion region(int rowMin, int rowMax, int colMin, int colMax, int h, double ebp) {
        return SearchRegion.builder().rowMin(rowMin).rowMax(rowMax).colMin(colMin).colMax(colMax)
                .measurementStartUtc(hour(h)).measurementEndUtc(hour(2)).ebp(ebp).ebpLower(ebp - 1)
                .ebpUpper(ebp + 1).kulldorff(2 * ebp).ebpAsym(ebp - 1).build();
    }

    @Test
    public void testAverageOverContainingRegions() {
        List<SearchRegion> regions = new ArrayList<>();
        regions.add(region(0, 1, 0, 1, 1, 3));
        regions.add(region(0, 2, 0, 1, 1, 5));
        regions.add(region(1, 2, 1, 2, 0, 7));

        List<CellScore> scores = CellScoreAggregator.averageToCells(regions, 2, hour(0), hour(2));

        assertEquals(3, scores.size());
        CellScore first = scores.get(0);
        assertEquals(hour(1), first.getMeasurementStartUtc());
        assertEquals(hour(2), first.getMeasurementEndUtc());
        assertEquals(1, first.getRow());
        assertEquals(1, first.getCol());
        assertEquals(4.0, first.getEbpMean(), EPSILON);
        assertEquals(3.0, first.getEbpLowerMean(), EPSILON);
        assertEquals(5.0, first.getEbpUpperMean(), EPSILON);
        assertEquals(8.0, first.getKulldorffMean(), EPSILON);
        assertEquals(3.0, first.getEbpAsymMean(), EPSILON);
        assertEquals(Math.sqrt(2), first.getEbpStandardDeviation(), EPSILON);

        CellScore second = scores.get(1);
        assertEquals(hour(1), second.getMeasurementStartUtc());
        assertEquals(2, second.getRow());
        assertEquals(1, second.getCol());
        assertEquals(5.0, second.getEbpMean(), EPSILON);
        assertTrue(Double.isNaN(second.getEbpStandardDeviation()));

        CellScore third = scores.get(2);
        assertEquals(hour(0), third.getMeasurementStartUtc());
        assertEquals(2, third.getRow());
        assertEquals(2, third.getCol());
        assertEquals(7.0, third.getEbpMean(), EPSILON);
    }

    @Test
    public void testFullScanCoversEveryCell() {
        int gridResolution = 3;
        List<SearchRegion> regions = ScanEngine.builder().build().scan(randomCells(gridResolution, 4, 1),
                gridResolution, hour(0), hour(4));

        List<CellScore> scores = CellScoreAggregator.averageToCells(regions, gridResolution, hour(0), hour(4));

        assertEquals(4 * gridResolution * gridResolution, scores.size());
        assertEquals(hour(3), scores.get(0).getMeasurementStartUtc());
        assertEquals(hour(0), scores.get(scores.size() - 1).getMeasurementStartUtc());
        for (CellScore score : scores) {
            assertTrue(score.getEbpMean() >= 1.0 - EPSILON);
            assertTrue(score.getEbpUpperMean() >= score.getEbpLowerMean() - EPSILON);
        }
    }

    @Test
    public void testNoRegions() {
        assertTrue(CellScoreAggregator.averageToCells(new ArrayList<>(), 2, hour(0), hour(2)).isEmpty());
        assertThrows(IllegalArgumentException.class,
                () -> CellScoreAggregator.averageToCells(new ArrayList<>(), 0, hour(0), hour(2)));
    }
}
