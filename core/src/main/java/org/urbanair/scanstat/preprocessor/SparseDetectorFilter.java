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

package org.urbanair.scanstat.preprocessor;

import static org.urbanair.scanstat.interpolation.LinearInterpolator.countMissing;
import static org.urbanair.scanstat.interpolation.LinearInterpolator.longestMissingRun;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import lombok.Getter;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Places every detector on the complete hourly timeline and drops those with
 * too much missing data.
 */
@Getter
public class SparseDetectorFilter {

    private static final Logger log = LoggerFactory.getLogger(SparseDetectorFilter.class);

    private final double percentageMissing;
    private final int consecutiveMissingThreshold;

    public SparseDetectorFilter(double percentageMissing, int consecutiveMissingThreshold) {
        this.percentageMissing = percentageMissing;
        this.consecutiveMissingThreshold = consecutiveMissingThreshold;
    }

    /**
     * @param counts a detector's counts on the complete timeline
     * @return true if the detector has too much missing data to be kept
     */
    public boolean isSparse(double[] counts) {
        int missing = countMissing(counts);
        return missing == counts.length || missing > counts.length * 0.01 * percentageMissing
                || longestMissingRun(counts) > consecutiveMissingThreshold;
    }

    /**
     * @param series   detectors keyed on the end times of their own readings
     * @param timeline the hourly end times every detector should cover
     * @return the detectors with sufficient data, reindexed onto the timeline
     */
    List<DetectorSeries> dropSparse(List<DetectorSeries> series, List<Instant> timeline) {
        log.info("Dropping detectors with more than {}% missing data or more than {} consecutive missing hours",
                percentageMissing, consecutiveMissingThreshold);
        List<DetectorSeries> kept = new ArrayList<>();
        for (DetectorSeries detector : series) {
            double[] counts = reindex(detector, timeline);
            if (isSparse(counts)) {
                log.debug("Detector {} is missing {} of {} hours", detector.getDetectorId(), countMissing(counts),
                        counts.length);
            } else {
                kept.add(detector.reindexed(timeline, counts));
            }
        }
        return kept;
    }

    static double[] reindex(DetectorSeries detector, List<Instant> timeline) {
        Map<Instant, Double> byEnd = new HashMap<>();
        List<Instant> ends = detector.getEnds();
        double[] counts = detector.getCounts();
        for (int i = 0; i < ends.size(); i++) {
            byEnd.putIfAbsent(ends.get(i), counts[i]);
        }
        double[] result = new double[timeline.size()];
        for (int i = 0; i < result.length; i++) {
            result[i] = byEnd.getOrDefault(timeline.get(i), Double.NaN);
        }
        return result;
    }
}
