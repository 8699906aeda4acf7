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

import static org.urbanair.scanstat.CommonUtils.checkArgument;

import java.util.Arrays;

import lombok.Getter;

/**
 * Level, trend and hour-of-day seasonal factors of a multiplicative
 * Holt-Winters model with a 24 hour season. Instances are immutable;
 * {@link #update(double, int)} returns the state after one more observation.
 */
@Getter
public class HoltWintersState {

    public static final int SEASON_LENGTH = 24;

    private final double alpha;
    private final double beta;
    private final double gamma;
    private final double smooth;
    private final double trend;
    private final double[] hourOfDay;

    HoltWintersState(double alpha, double beta, double gamma, double smooth, double trend, double[] hourOfDay) {
        checkArgument(hourOfDay.length == SEASON_LENGTH, "hourOfDay must have one factor per hour");
        this.alpha = alpha;
        this.beta = beta;
        this.gamma = gamma;
        this.smooth = smooth;
        this.trend = trend;
        this.hourOfDay = hourOfDay;
    }

    /**
     * @return the state before any observation: unit level, unit trend and unit
     *         seasonal factors
     */
    public static HoltWintersState initial(double alpha, double beta, double gamma) {
        double[] ones = new double[SEASON_LENGTH];
        Arrays.fill(ones, 1.0);
        return new HoltWintersState(alpha, beta, gamma, 1.0, 1.0, ones);
    }

    /**
     * @param count the observed count
     * @param hour  the position of the observation within the season
     * @return the state after the observation
     */
    public HoltWintersState update(double count, int hour) {
        double smoothNew = alpha * (count / hourOfDay[hour]) + (1 - alpha) * (smooth + trend);
        double trendNew = beta * (smoothNew - smooth) + (1 - beta) * trend;
        double[] hodNew = Arrays.copyOf(hourOfDay, SEASON_LENGTH);
        hodNew[hour] = gamma * (count / smoothNew) + (1 - gamma) * hourOfDay[hour];
        return new HoltWintersState(alpha, beta, gamma, smoothNew, trendNew, hodNew);
    }

    /**
     * @param hour a position within the season
     * @return the one step ahead prediction for that hour
     */
    public double predict(int hour) {
        return (smooth + trend) * hourOfDay[hour];
    }

    public double[] getHourOfDay() {
        return Arrays.copyOf(hourOfDay, SEASON_LENGTH);
    }
}
