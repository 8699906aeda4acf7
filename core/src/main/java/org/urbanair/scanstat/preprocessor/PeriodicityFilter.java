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
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import lombok.Getter;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.urbanair.scanstat.statistics.LombScargle;
import org.urbanair.scanstat.statistics.SeriesStatistics;

/**
 * Drops the detectors whose counts show the weakest daily periodicity, measured
 * by the false alarm probability of the Lomb-Scargle peak between 15 and 30
 * hours.
 */
@Getter
public class PeriodicityFilter {

    private static final Logger log = LoggerFactory.getLogger(PeriodicityFilter.class);

    private final double fapPercentileThreshold;

    public PeriodicityFilter(double fapPercentileThreshold) {
        this.fapPercentileThreshold = fapPercentileThreshold;
    }

    /**
     * @param counts hourly counts without missing values
     * @return the false alarm probability of the strongest period
     */
    public double falseAlarmProbability(double[] counts) {
        double[] times = new double[counts.length];
        for (int i = 0; i < times.length; i++) {
            times[i] = i;
        }
        return new LombScargle(times, counts).falseAlarmProbability();
    }

    List<DetectorSeries> dropAperiodic(List<DetectorSeries> series) {
        Map<DetectorSeries, Double> probabilities = new LinkedHashMap<>();
        for (DetectorSeries detector : series) {
            probabilities.put(detector, falseAlarmProbability(detector.getCounts()));
        }
        double[] all = probabilities.values().stream().mapToDouble(Double::doubleValue).toArray();
        double cutoff = SeriesStatistics.percentile(all, fapPercentileThreshold);
        log.info("Dropping detectors with a false alarm probability above {} (percentile {})", cutoff,
                fapPercentileThreshold);

        List<DetectorSeries> kept = new ArrayList<>();
        probabilities.forEach((detector, fap) -> {
            if (fap > cutoff) {
                log.debug("Detector {} is aperiodic, false alarm probability {}", detector.getDetectorId(), fap);
            } else {
                kept.add(detector);
            }
        });
        return kept;
    }
}
