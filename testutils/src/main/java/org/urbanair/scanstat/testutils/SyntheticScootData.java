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

package org.urbanair.scanstat.testutils;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Random;
import java.util.stream.Collectors;

import org.urbanair.scanstat.returntypes.Reading;

/**
 * Generates hourly vehicle counts that look like SCOOT loop detector data: a
 * daily cycle with a morning and an evening peak, scaled per detector, plus
 * Gaussian noise. Counts are rounded and never negative.
 */
public class SyntheticScootData {

    private static final Duration ONE_HOUR = Duration.ofHours(1);

    private final double baseLevel;
    private final double peakLevel;
    private final double noiseSigma;

    public SyntheticScootData(double baseLevel, double peakLevel, double noiseSigma) {
        this.baseLevel = baseLevel;
        this.peakLevel = peakLevel;
        this.noiseSigma = noiseSigma;
    }

    public SyntheticScootData() {
        this(60.0, 400.0, 10.0);
    }

    /**
     * @param hourOfDay an hour in {@code [0, 24)}
     * @return the expected count of an unscaled detector at that hour
     */
    public double dailyProfile(double hourOfDay) {
        double morning = Math.exp(-0.5 * Math.pow((hourOfDay - 8) / 1.5, 2));
        double evening = Math.exp(-0.5 * Math.pow((hourOfDay - 17.5) / 2.0, 2));
        double daytime = Math.max(0, Math.sin(Math.PI * (hourOfDay - 6) / 16));
        return baseLevel + peakLevel * (0.6 * morning + 0.7 * evening + 0.5 * daytime);
    }

    /**
     * Readings of {@code detectorsPerCell} detectors in every cell of a grid.
     * Detector ids are {@code "N<row>-<col>-<k>"}.
     *
     * @param gridResolution   number of cells along each axis
     * @param detectorsPerCell detectors mapped to each cell
     * @param start            start of the first reading, on the hour
     * @param hours            number of hourly readings per detector
     * @param seed             seed of the noise and of the detector scales
     * @return the readings, detector by detector
     */
    public List<Reading> generateReadings(int gridResolution, int detectorsPerCell, Instant start, int hours,
            long seed) {
        Random rng = new Random(seed);
        List<Reading> readings = new ArrayList<>();
        for (int row = 1; row <= gridResolution; row++) {
            for (int col = 1; col <= gridResolution; col++) {
                for (int k = 0; k < detectorsPerCell; k++) {
                    double scale = 0.5 + rng.nextDouble();
                    String detectorId = String.format("N%d-%d-%d", row, col, k);
                    for (int h = 0; h < hours; h++) {
                        Instant t = start.plus(ONE_HOUR.multipliedBy(h));
                        double count = scale * dailyProfile(hourOfDay(t)) + noiseSigma * rng.nextGaussian();
                        readings.add(reading(detectorId, row, col, gridResolution, t, count));
                    }
                }
            }
        }
        return readings;
    }

    /**
     * Readings of a detector without any daily cycle.
     */
    public List<Reading> generateAperiodic(String detectorId, int row, int col, int gridResolution, Instant start,
            int hours, long seed) {
        Random rng = new Random(seed);
        double level = baseLevel + peakLevel / 2;
        List<Reading> readings = new ArrayList<>();
        for (int h = 0; h < hours; h++) {
            Instant t = start.plus(ONE_HOUR.multipliedBy(h));
            readings.add(reading(detectorId, row, col, gridResolution, t, level + 4 * noiseSigma * rng.nextGaussian()));
        }
        return readings;
    }

    /**
     * Multiplies the counts of every detector in a cell between two times.
     *
     * @param readings readings to copy
     * @param row      the row of the cell
     * @param col      the column of the cell
     * @param from     inclusive start of the spike
     * @param to       exclusive end of the spike
     * @param factor   the multiplier
     * @return a copy of the readings with the spike applied
     */
    public static List<Reading> withSpike(List<Reading> readings, int row, int col, Instant from, Instant to,
            double factor) {
        return readings.stream().map(r -> {
            boolean inCell = r.getRow() == row && r.getCol() == col;
            boolean inTime = !r.getMeasurementStartUtc().isBefore(from) && r.getMeasurementStartUtc().isBefore(to);
            return inCell && inTime
                    ? r.toBuilder().nVehiclesInInterval(Math.round(r.getNVehiclesInInterval() * factor)).build()
                    : r;
        }).collect(Collectors.toList());
    }

    /**
     * Removes the readings of one detector between two times.
     */
    public static List<Reading> withGap(List<Reading> readings, String detectorId, Instant from, Instant to) {
        return readings.stream()
                .filter(r -> !(r.getDetectorId().equals(detectorId) && !r.getMeasurementStartUtc().isBefore(from)
                        && r.getMeasurementStartUtc().isBefore(to)))
                .collect(Collectors.toList());
    }

    private static double hourOfDay(Instant t) {
        return (t.getEpochSecond() % 86400) / 3600.0;
    }

    private static Reading reading(String detectorId, int row, int col, int gridResolution, Instant start,
            double count) {
        // detectors spread over a box around central London
        double lon = -0.25 + 0.3 * (col - 0.5) / gridResolution;
        double lat = 51.40 + 0.2 * (row - 0.5) / gridResolution;
        return Reading.builder().detectorId(detectorId).pointId("P" + detectorId.substring(1)).lon(lon).lat(lat)
                .location(String.format(Locale.ROOT, "POINT (%.6f %.6f)", lon, lat)).measurementStartUtc(start)
                .measurementEndUtc(start.plus(ONE_HOUR)).nVehiclesInInterval(Math.max(0, Math.round(count)))
                .row(row).col(col).build();
    }
}
