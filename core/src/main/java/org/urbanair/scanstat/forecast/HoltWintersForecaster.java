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

import static org.urbanair.scanstat.CommonUtils.ONE_HOUR;
import static org.urbanair.scanstat.CommonUtils.checkArgument;
import static org.urbanair.scanstat.CommonUtils.checkNotNull;
import static org.urbanair.scanstat.CommonUtils.checkParameter;
import static org.urbanair.scanstat.CommonUtils.hoursBetween;
import static org.urbanair.scanstat.forecast.HoltWintersState.SEASON_LENGTH;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

import lombok.Getter;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.urbanair.scanstat.config.GapMethod;
import org.urbanair.scanstat.returntypes.ForecastPoint;
import org.urbanair.scanstat.returntypes.ProcessedReading;
import org.urbanair.scanstat.returntypes.ProcessedSeries;

/**
 * Forecasts each detector independently with a triple exponential smoothing
 * model, trained on the readings that end at or before the forecast start.
 */
@Getter
public class HoltWintersForecaster implements IForecaster {

    private static final Logger log = LoggerFactory.getLogger(HoltWintersForecaster.class);

    public static final double DEFAULT_ALPHA = 0.03869791;
    public static final double DEFAULT_BETA = 0.0128993;
    public static final double DEFAULT_GAMMA = 0.29348953;
    public static final GapMethod DEFAULT_GAP_METHOD = GapMethod.STITCH;

    private final double alpha;
    private final double beta;
    private final double gamma;
    private final GapMethod gapMethod;

    protected HoltWintersForecaster(Builder<?> builder) {
        checkParameter(builder.alpha >= 0 && builder.alpha <= 1, "alpha", builder.alpha, "alpha must be in [0, 1]");
        checkParameter(builder.beta >= 0 && builder.beta <= 1, "beta", builder.beta, "beta must be in [0, 1]");
        checkParameter(builder.gamma >= 0 && builder.gamma <= 1, "gamma", builder.gamma, "gamma must be in [0, 1]");
        checkNotNull(builder.gapMethod, "gapMethod must not be null");
        alpha = builder.alpha;
        beta = builder.beta;
        gamma = builder.gamma;
        gapMethod = builder.gapMethod;
    }

    @Override
    public List<ForecastPoint> forecast(List<ProcessedSeries> series, Instant forecastStart, Instant forecastEnd) {
        checkNotNull(series, "series must not be null");
        checkArgument(forecastStart.isBefore(forecastEnd), "forecastStart must be before forecastEnd");
        int forecastHours = hoursBetween(forecastStart, forecastEnd);
        log.info("Forecasting {} hours from {} to {} for {} detectors", forecastHours, forecastStart, forecastEnd,
                series.size());

        List<ForecastPoint> points = new ArrayList<>();
        for (ProcessedSeries detector : series) {
            List<ProcessedReading> training = detector.getReadings().stream()
                    .filter(r -> !r.getMeasurementEndUtc().isAfter(forecastStart)).collect(Collectors.toList());
            if (training.isEmpty()) {
                log.warn("Detector {} has no readings before {}, skipping", detector.getDetectorId(), forecastStart);
                continue;
            }
            points.addAll(forecastDetector(detector.getDetectorId(), training, forecastStart, forecastHours));
        }
        return points;
    }

    List<ForecastPoint> forecastDetector(String detectorId, List<ProcessedReading> training, Instant forecastStart,
            int forecastHours) {
        HoltWintersState state = HoltWintersState.initial(alpha, beta, gamma);
        int step = 0;
        for (ProcessedReading reading : training) {
            state = state.update(reading.getNVehiclesInInterval(), step % SEASON_LENGTH);
            step++;
        }

        Instant lastEnd = training.get(training.size() - 1).getMeasurementEndUtc();
        int gap = Math.max(0, hoursBetween(lastEnd, forecastStart));
        int gapSteps = gapMethod == GapMethod.STITCH ? gap % SEASON_LENGTH : gap;
        if (gap > 0) {
            log.debug("Detector {} ends {} hours before the forecast, advancing {} hours", detectorId, gap, gapSteps);
        }
        for (int i = 0; i < gapSteps; i++) {
            int hour = step % SEASON_LENGTH;
            state = state.update(state.predict(hour), hour);
            step++;
        }

        List<ForecastPoint> points = new ArrayList<>(forecastHours);
        for (int j = 0; j < forecastHours; j++) {
            int hour = step % SEASON_LENGTH;
            double base = state.predict(hour);
            Instant start = forecastStart.plus(ONE_HOUR.multipliedBy(j));
            points.add(ForecastPoint.builder().detectorId(detectorId).measurementStartUtc(start)
                    .measurementEndUtc(start.plus(ONE_HOUR)).baseline(base).baselineUpper(base).baselineLower(base)
                    .standardDeviation(0.0).build());
            state = state.update(base, hour);
            step++;
        }
        return points;
    }

    /**
     * @return a new HoltWintersForecaster builder.
     */
    public static Builder builder() {
        return new Builder();
    }

    public static class Builder<T extends Builder<T>> {

        protected double alpha = DEFAULT_ALPHA;
        protected double beta = DEFAULT_BETA;
        protected double gamma = DEFAULT_GAMMA;
        protected GapMethod gapMethod = DEFAULT_GAP_METHOD;

        public T alpha(double alpha) {
            this.alpha = alpha;
            return (T) this;
        }

        public T beta(double beta) {
            this.beta = beta;
            return (T) this;
        }

        public T gamma(double gamma) {
            this.gamma = gamma;
            return (T) this;
        }

        public T gapMethod(GapMethod gapMethod) {
            this.gapMethod = gapMethod;
            return (T) this;
        }

        public HoltWintersForecaster build() {
            return new HoltWintersForecaster(this);
        }
    }
}
