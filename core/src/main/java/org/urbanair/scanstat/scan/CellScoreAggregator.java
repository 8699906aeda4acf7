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

import static org.urbanair.scanstat.CommonUtils.checkArgument;
import static org.urbanair.scanstat.CommonUtils.descendingHourlyMarks;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.ToDoubleFunction;

import org.urbanair.scanstat.returntypes.CellScore;
import org.urbanair.scanstat.returntypes.SearchRegion;
import org.urbanair.scanstat.statistics.SeriesStatistics;

/**
 * Projects region scores back onto grid cells for rendering: each cell gets the
 * mean score of the regions that contain it, per region start time.
 */
public class CellScoreAggregator {

    private CellScoreAggregator() {
    }

    /**
     * @param regions        the output of a scan
     * @param gridResolution number of cells along each spatial axis
     * @param forecastStart  start of the scanned window
     * @param forecastEnd    end of the scanned window
     * @return one score per start time and cell, latest start time first, then
     *         by row and column; cells contained in no region are left out
     */
    public static List<CellScore> averageToCells(List<SearchRegion> regions, int gridResolution,
            Instant forecastStart, Instant forecastEnd) {
        checkArgument(gridResolution > 0, "gridResolution must be greater than 0");
        Map<Instant, List<SearchRegion>> byStart = new HashMap<>();
        for (SearchRegion region : regions) {
            byStart.computeIfAbsent(region.getMeasurementStartUtc(), k -> new ArrayList<>()).add(region);
        }

        List<CellScore> scores = new ArrayList<>();
        for (Instant tMin : descendingHourlyMarks(forecastStart, forecastEnd)) {
            List<SearchRegion> window = byStart.getOrDefault(tMin, Collections.emptyList());
            for (int row = 1; row <= gridResolution; row++) {
                for (int col = 1; col <= gridResolution; col++) {
                    List<SearchRegion> containing = new ArrayList<>();
                    for (SearchRegion region : window) {
                        if (region.contains(row, col)) {
                            containing.add(region);
                        }
                    }
                    if (!containing.isEmpty()) {
                        scores.add(average(row, col, tMin, forecastEnd, containing));
                    }
                }
            }
        }
        return scores;
    }

    static CellScore average(int row, int col, Instant tMin, Instant tMax, List<SearchRegion> containing) {
        double[] ebp = containing.stream().mapToDouble(SearchRegion::getEbp).toArray();
        return CellScore.builder().row(row).col(col).measurementStartUtc(tMin).measurementEndUtc(tMax)
                .ebpMean(mean(containing, SearchRegion::getEbp))
                .ebpLowerMean(mean(containing, SearchRegion::getEbpLower))
                .ebpUpperMean(mean(containing, SearchRegion::getEbpUpper))
                .kulldorffMean(mean(containing, SearchRegion::getKulldorff))
                .kulldorffLowerMean(mean(containing, SearchRegion::getKulldorffLower))
                .kulldorffUpperMean(mean(containing, SearchRegion::getKulldorffUpper))
                .ebpAsymMean(mean(containing, SearchRegion::getEbpAsym))
                .ebpAsymLowerMean(mean(containing, SearchRegion::getEbpAsymLower))
                .ebpAsymUpperMean(mean(containing, SearchRegion::getEbpAsymUpper))
                .ebpStandardDeviation(SeriesStatistics.sampleStandardDeviation(ebp)).build();
    }

    private static double mean(List<SearchRegion> regions, ToDoubleFunction<SearchRegion> score) {
        return regions.stream().mapToDouble(score).average().orElse(Double.NaN);
    }
}
