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

import static org.urbanair.scanstat.CommonUtils.ONE_HOUR;
import static org.urbanair.scanstat.CommonUtils.checkNotNull;
import static org.urbanair.scanstat.CommonUtils.checkParameter;
import static org.urbanair.scanstat.CommonUtils.checkRequired;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

import lombok.Getter;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.urbanair.scanstat.config.ThresholdMethod;
import org.urbanair.scanstat.errors.AllDetectorsDroppedException;
import org.urbanair.scanstat.interpolation.LinearInterpolator;
import org.urbanair.scanstat.returntypes.ProcessedReading;
import org.urbanair.scanstat.returntypes.ProcessedSeries;
import org.urbanair.scanstat.returntypes.Reading;

/**
 * Cleans raw detector readings before forecasting: removes anomalous counts,
 * drops detectors with too much missing data, fills the remaining gaps by
 * linear interpolation and optionally drops detectors without a daily period.
 */
@Getter
public class Preprocessor {

    private static final Logger log = LoggerFactory.getLogger(Preprocessor.class);

    public static final String STAGE_ANOMALY_REMOVAL = "anomaly removal";
    public static final String STAGE_MISSING_DATA = "missing data";
    public static final String STAGE_PERIODICITY = "periodicity";

    public static final double DEFAULT_PERCENTAGE_MISSING = 20;
    public static final int DEFAULT_MAX_ANOMALIES_PER_DAY = 1;
    public static final double DEFAULT_NUMBER_OF_SIGMA = 3;
    public static final int DEFAULT_REPEATS = 1;
    public static final ThresholdMethod DEFAULT_THRESHOLD_METHOD = ThresholdMethod.ROLLING;
    public static final int DEFAULT_ROLLING_HOURS = 24;
    public static final int DEFAULT_CONSECUTIVE_MISSING_THRESHOLD = 24;
    public static final boolean DEFAULT_DROP_APERIODIC = false;
    public static final double DEFAULT_FAP_PERCENTILE_THRESHOLD = 95;

    private final double percentageMissing;
    private final int maxAnomaliesPerDay;
    private final double numberOfSigma;
    private final int repeats;
    private final ThresholdMethod thresholdMethod;
    private final int rollingHours;
    private final int consecutiveMissingThreshold;
    private final boolean dropAperiodic;
    private final double fapPercentileThreshold;

    private final AnomalyRemover anomalyRemover;
    private final SparseDetectorFilter sparseDetectorFilter;
    private final PeriodicityFilter periodicityFilter;
    private final LinearInterpolator interpolator;

    protected Preprocessor(Builder<?> builder) {
        checkParameter(builder.percentageMissing >= 0, "percentageMissing", builder.percentageMissing,
                "percentageMissing must be non-negative");
        checkParameter(builder.maxAnomaliesPerDay >= 0, "maxAnomaliesPerDay", builder.maxAnomaliesPerDay,
                "maxAnomaliesPerDay must be non-negative");
        checkParameter(builder.numberOfSigma >= 0, "numberOfSigma", builder.numberOfSigma,
                "numberOfSigma must be non-negative");
        checkParameter(builder.repeats >= 0, "repeats", builder.repeats, "repeats must be non-negative");
        checkNotNull(builder.thresholdMethod, "thresholdMethod must not be null");
        checkParameter(builder.rollingHours >= 0 || builder.thresholdMethod == ThresholdMethod.GLOBAL,
                "rollingHours", builder.rollingHours, "rollingHours must be non-negative");
        checkParameter(builder.consecutiveMissingThreshold >= 0, "consecutiveMissingThreshold",
                builder.consecutiveMissingThreshold, "consecutiveMissingThreshold must be non-negative");
        checkParameter(builder.fapPercentileThreshold >= 0 && builder.fapPercentileThreshold <= 100,
                "fapPercentileThreshold", builder.fapPercentileThreshold, "fapPercentileThreshold must be in [0, 100]");

        percentageMissing = builder.percentageMissing;
        maxAnomaliesPerDay = builder.maxAnomaliesPerDay;
        numberOfSigma = builder.numberOfSigma;
        repeats = builder.repeats;
        thresholdMethod = builder.thresholdMethod;
        rollingHours = builder.rollingHours;
        consecutiveMissingThreshold = builder.consecutiveMissingThreshold;
        dropAperiodic = builder.dropAperiodic;
        fapPercentileThreshold = builder.fapPercentileThreshold;

        anomalyRemover = new AnomalyRemover(numberOfSigma, repeats, thresholdMethod, rollingHours,
                maxAnomaliesPerDay);
        sparseDetectorFilter = new SparseDetectorFilter(percentageMissing, consecutiveMissingThreshold);
        periodicityFilter = new PeriodicityFilter(fapPercentileThreshold);
        interpolator = new LinearInterpolator();
    }

    /**
     * Runs all preprocessing stages over the readings of a batch.
     *
     * @param readings raw readings of any number of detectors, in any order
     * @return one gap free series per surviving detector, ordered by detector id
     * @throws AllDetectorsDroppedException if a stage drops every detector
     * @throws org.urbanair.scanstat.errors.InputShapeException if a reading
     *                                                          lacks a required
     *                                                          field
     */
    public List<ProcessedSeries> preprocess(List<Reading> readings) {
        checkNotNull(readings, "readings must not be null");
        readings.forEach(Preprocessor::validate);
        if (readings.isEmpty()) {
            log.warn("No readings to preprocess");
            return new ArrayList<>();
        }

        Instant start = readings.stream().map(Reading::getMeasurementStartUtc).min(Comparator.naturalOrder()).get();
        Instant end = readings.stream().map(Reading::getMeasurementEndUtc).max(Comparator.naturalOrder()).get();
        long numDays = Duration.between(start, end).toDays();
        List<Instant> timeline = hourlyTimeline(start, end);

        List<DetectorSeries> series = groupByDetector(readings);
        Set<String> original = detectorIds(series);

        series = anomalyRemover.removeAnomalies(series, numDays);
        checkNotEmpty(series, original, STAGE_ANOMALY_REMOVAL);

        series = sparseDetectorFilter.dropSparse(series, timeline);
        checkNotEmpty(series, original, STAGE_MISSING_DATA);

        List<DetectorSeries> filled = new ArrayList<>();
        for (DetectorSeries detector : series) {
            filled.add(detector.withCounts(interpolator.interpolate(detector.getCounts()), detector.getAnomalies()));
        }
        series = filled;

        if (dropAperiodic) {
            series = periodicityFilter.dropAperiodic(series);
            checkNotEmpty(series, original, STAGE_PERIODICITY);
        }

        Set<String> dropped = new TreeSet<>(original);
        dropped.removeAll(detectorIds(series));
        log.info("{} of {} detectors dropped: {}", dropped.size(), original.size(), dropped);

        return series.stream().map(Preprocessor::toProcessedSeries)
                .sorted(Comparator.comparing(ProcessedSeries::getDetectorId)).collect(Collectors.toList());
    }

    /**
     * @param reading a raw reading
     * @throws org.urbanair.scanstat.errors.InputShapeException if a field the
     *                                                          preprocessing
     *                                                          needs is absent
     */
    public static void validate(Reading reading) {
        checkNotNull(reading, "reading must not be null");
        checkRequired(reading.getDetectorId(), "Reading", "detectorId");
        checkRequired(reading.getLocation(), "Reading", "location");
        checkRequired(reading.getMeasurementStartUtc(), "Reading", "measurementStartUtc");
        checkRequired(reading.getMeasurementEndUtc(), "Reading", "measurementEndUtc");
        checkRequired(reading.getRow(), "Reading", "row");
        checkRequired(reading.getCol(), "Reading", "col");
    }

    /**
     * @return the hourly end times from {@code start + 1h} to {@code end}
     */
    static List<Instant> hourlyTimeline(Instant start, Instant end) {
        List<Instant> timeline = new ArrayList<>();
        for (Instant t = start.plus(ONE_HOUR); !t.isAfter(end); t = t.plus(ONE_HOUR)) {
            timeline.add(t);
        }
        return timeline;
    }

    /**
     * Groups readings per detector, ordered by end time. Of several readings with
     * the same detector and end time only the first is kept; negative counts are
     * treated as missing.
     */
    static List<DetectorSeries> groupByDetector(List<Reading> readings) {
        Map<String, Map<Instant, Reading>> grouped = new LinkedHashMap<>();
        for (Reading reading : readings) {
            grouped.computeIfAbsent(reading.getDetectorId(), k -> new LinkedHashMap<>())
                    .putIfAbsent(reading.getMeasurementEndUtc(), reading);
        }

        List<DetectorSeries> series = new ArrayList<>();
        grouped.forEach((detectorId, byEnd) -> {
            Reading first = byEnd.values().iterator().next();
            List<Instant> ends = new ArrayList<>(byEnd.keySet());
            ends.sort(Comparator.naturalOrder());
            double[] counts = new double[ends.size()];
            for (int i = 0; i < counts.length; i++) {
                double count = byEnd.get(ends.get(i)).getNVehiclesInInterval();
                if (count < 0) {
                    log.warn("Negative count {} of detector {} at {} treated as missing", count, detectorId,
                            ends.get(i));
                    count = Double.NaN;
                }
                counts[i] = count;
            }
            series.add(new DetectorSeries(first, ends, counts, 0));
        });
        return series;
    }

    static ProcessedSeries toProcessedSeries(DetectorSeries detector) {
        Reading first = detector.getFirst();
        ProcessedSeries.ProcessedSeriesBuilder builder = ProcessedSeries.builder().detectorId(detector.getDetectorId())
                .pointId(first.getPointId()).lon(first.getLon()).lat(first.getLat()).location(first.getLocation())
                .row(first.getRow()).col(first.getCol());
        List<Instant> ends = detector.getEnds();
        double[] counts = detector.getCounts();
        for (int i = 0; i < counts.length; i++) {
            builder.reading(ProcessedReading.builder().measurementStartUtc(ends.get(i).minus(ONE_HOUR))
                    .measurementEndUtc(ends.get(i)).nVehiclesInInterval(counts[i]).build());
        }
        return builder.build();
    }

    private static Set<String> detectorIds(List<DetectorSeries> series) {
        return series.stream().map(DetectorSeries::getDetectorId).collect(Collectors.toCollection(TreeSet::new));
    }

    private static void checkNotEmpty(List<DetectorSeries> series, Set<String> original, String stage) {
        if (series.isEmpty()) {
            log.error("All {} detectors dropped during {}", original.size(), stage);
            throw new AllDetectorsDroppedException(stage, original);
        }
    }

    /**
     * @return a new Preprocessor builder.
     */
    public static Builder builder() {
        return new Builder();
    }

    public static class Builder<T extends Builder<T>> {

        protected double percentageMissing = DEFAULT_PERCENTAGE_MISSING;
        protected int maxAnomaliesPerDay = DEFAULT_MAX_ANOMALIES_PER_DAY;
        protected double numberOfSigma = DEFAULT_NUMBER_OF_SIGMA;
        protected int repeats = DEFAULT_REPEATS;
        protected ThresholdMethod thresholdMethod = DEFAULT_THRESHOLD_METHOD;
        protected int rollingHours = DEFAULT_ROLLING_HOURS;
        protected int consecutiveMissingThreshold = DEFAULT_CONSECUTIVE_MISSING_THRESHOLD;
        protected boolean dropAperiodic = DEFAULT_DROP_APERIODIC;
        protected double fapPercentileThreshold = DEFAULT_FAP_PERCENTILE_THRESHOLD;

        public T percentageMissing(double percentageMissing) {
            this.percentageMissing = percentageMissing;
            return (T) this;
        }

        public T maxAnomaliesPerDay(int maxAnomaliesPerDay) {
            this.maxAnomaliesPerDay = maxAnomaliesPerDay;
            return (T) this;
        }

        public T numberOfSigma(double numberOfSigma) {
            this.numberOfSigma = numberOfSigma;
            return (T) this;
        }

        public T repeats(int repeats) {
            this.repeats = repeats;
            return (T) this;
        }

        public T globalThreshold(boolean globalThreshold) {
            this.thresholdMethod = globalThreshold ? ThresholdMethod.GLOBAL : ThresholdMethod.ROLLING;
            return (T) this;
        }

        public T thresholdMethod(ThresholdMethod thresholdMethod) {
            this.thresholdMethod = thresholdMethod;
            return (T) this;
        }

        public T rollingHours(int rollingHours) {
            this.rollingHours = rollingHours;
            return (T) this;
        }

        public T consecutiveMissingThreshold(int consecutiveMissingThreshold) {
            this.consecutiveMissingThreshold = consecutiveMissingThreshold;
            return (T) this;
        }

        public T dropAperiodic(boolean dropAperiodic) {
            this.dropAperiodic = dropAperiodic;
            return (T) this;
        }

        public T fapPercentileThreshold(double fapPercentileThreshold) {
            this.fapPercentileThreshold = fapPercentileThreshold;
            return (T) this;
        }

        public Preprocessor build() {
            return new Preprocessor(this);
        }
    }
}
