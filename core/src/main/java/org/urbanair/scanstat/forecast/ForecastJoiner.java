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

package org.urbanair.scanstat.forecast;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.urbanair.scanstat.errors.InputShapeException;
import org.urbanair.scanstat.returntypes.ForecastPoint;
import org.urbanair.scanstat.returntypes.ForecastRow;
import org.urbanair.scanstat.returntypes.ProcessedReading;
import org.urbanair.scanstat.returntypes.ProcessedSeries;

/**
 * Joins forecast points with the actual count of the same detector and hour.
 */
public class ForecastJoiner {

    private ForecastJoiner() {
    }

    /**
     * @param forecasts forecast points of any number of detectors
     * @param series    the processed series the actual counts are taken from
     * @return one row per forecast point, in the order of the forecast
     * @throws InputShapeException if a forecast hour has no actual count
     */
    public static List<ForecastRow> join(List<ForecastPoint> forecasts, List<ProcessedSeries> series) {
        Map<String, ProcessedSeries> byDetector = new HashMap<>();
        Map<String, Map<Instant, Double>> actuals = new HashMap<>();
        for (ProcessedSeries detector : series) {
            byDetector.putIfAbsent(detector.getDetectorId(), detector);
            Map<Instant, Double> counts = actuals.computeIfAbsent(detector.getDetectorId(), k -> new HashMap<>());
            for (ProcessedReading reading : detector.getReadings()) {
                counts.putIfAbsent(reading.getMeasurementStartUtc(), reading.getNVehiclesInInterval());
            }
        }

        List<ForecastRow> rows = new ArrayList<>(forecasts.size());
        for (ForecastPoint point : forecasts) {
            ProcessedSeries detector = byDetector.get(point.getDetectorId());
            Double actual = detector == null ? null
                    : actuals.get(point.getDetectorId()).get(point.getMeasurementStartUtc());
            if (actual == null || Double.isNaN(actual)) {
                throw new InputShapeException("ForecastRow", "actual", String.format(
                        "no actual count for detector %s at %s", point.getDetectorId(), point.getMeasurementStartUtc()));
            }
            rows.add(ForecastRow.builder().detectorId(point.getDetectorId()).lon(detector.getLon())
                    .lat(detector.getLat()).location(detector.getLocation()).row(detector.getRow())
                    .col(detector.getCol()).measurementStartUtc(point.getMeasurementStartUtc())
                    .measurementEndUtc(point.getMeasurementEndUtc()).actual(actual).baseline(point.getBaseline())
                    .baselineUpper(point.getBaselineUpper()).baselineLower(point.getBaselineLower())
                    .standardDeviation(point.getStandardDeviation()).build());
        }
        return rows;
    }
}
