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

import java.util.ArrayList;
import java.util.List;

import lombok.Getter;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.urbanair.scanstat.config.ThresholdMethod;
import org.urbanair.scanstat.statistics.SeriesStatistics;

/**
 * Replaces counts above an anomaly threshold by missing values and drops the
 * detectors that had too many of them.
 */
@Getter
public class AnomalyRemover {

    private static final Logger log = LoggerFactory.getLogger(AnomalyRemover.class);

    private final double numberOfSigma;
    private final int repeats;
    private final ThresholdMethod thresholdMethod;
    private final int rollingHours;
    private final int maxAnomaliesPerDay;

    public AnomalyRemover(double numberOfSigma, int repeats, ThresholdMethod thresholdMethod, int rollingHours,
            int maxAnomaliesPerDay) {
        this.numberOfSigma = numberOfSigma;
        this.repeats = repeats;
        this.thresholdMethod = thresholdMethod;
        this.rollingHours = rollingHours;
        this.maxAnomaliesPerDay = maxAnomaliesPerDay;
    }

    /**
     * Computes the thresholds of a series and removes the values strictly above
     * them, {@code repeats} times.
     *
     * @param counts the counts of one detector, possibly with missing values
     * @return the cleaned counts
     */
    public double[] clean(double[] counts) {
        double[] result = counts.clone();
        for (int rep = 0; rep < repeats; rep++) {
            double[] thresholds = thresholdMethod == ThresholdMethod.GLOBAL
                    ? SeriesStatistics.rollingThresholds(result, 0, numberOfSigma)
                    : SeriesStatistics.rollingThresholds(result, rollingHours, numberOfSigma);
            for (int i = 0; i < result.length; i++) {
                if (result[i] > thresholds[i]) {
                    result[i] = Double.NaN;
                }
            }
        }
        return result;
    }

    /**
     * @param series  detectors with their raw counts
     * @param numDays whole days covered by the readings
     * @return the detectors with at most {@code maxAnomaliesPerDay * numDays}
     *         anomalies, cleaned
     */
    List<DetectorSeries> removeAnomalies(List<DetectorSeries> series, long numDays) {
        long maxAnomalies = maxAnomaliesPerDay * numDays;
        if (thresholdMethod == ThresholdMethod.GLOBAL) {
            log.info("Using the global median to remove outliers");
        } else {
            log.info("Using the {}-hour rolling median to remove outliers", rollingHours);
        }
        log.info("Using {} iterations to remove points outside of {} sigma from the median", repeats, numberOfSigma);

        List<DetectorSeries> kept = new ArrayList<>();
        for (DetectorSeries detector : series) {
            double[] before = detector.getCounts();
            double[] after = clean(before);
            int flagged = 0;
            for (int i = 0; i < after.length; i++) {
                if (Double.isNaN(after[i]) && !Double.isNaN(before[i])) {
                    flagged++;
                }
            }
            if (flagged > maxAnomalies) {
                log.debug("Detector {} has {} anomalies, more than {}", detector.getDetectorId(), flagged,
                        maxAnomalies);
            } else {
                kept.add(detector.withCounts(after, detector.getAnomalies() + flagged));
            }
        }
        return kept;
    }
}
