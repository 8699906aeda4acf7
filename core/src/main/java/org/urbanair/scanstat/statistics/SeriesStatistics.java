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

package org.urbanair.scanstat.statistics;

import static org.urbanair.scanstat.CommonUtils.checkArgument;

import java.util.Arrays;

import org.apache.commons.math3.stat.descriptive.moment.StandardDeviation;
import org.apache.commons.math3.stat.descriptive.rank.Percentile;
import org.apache.commons.math3.stat.descriptive.rank.Percentile.EstimationType;

/**
 * Order statistics and spread of count series. Missing values ({@code NaN})
 * are skipped, so a statistic of a series with no observed value is
 * {@code NaN}.
 */
public class SeriesStatistics {

    private SeriesStatistics() {
    }

    /**
     * @param values a series, possibly with missing values
     * @return the observed values only
     */
    public static double[] observed(double[] values) {
        return Arrays.stream(values).filter(v -> !Double.isNaN(v)).toArray();
    }

    public static double median(double[] values) {
        return percentile(values, 50.0);
    }

    /**
     * Linear interpolation between closest ranks, the estimator most statistics
     * packages use by default.
     *
     * @param values     a series, possibly with missing values
     * @param percentile the percentile in {@code [0, 100]}
     * @return the percentile of the observed values
     */
    public static double percentile(double[] values, double percentile) {
        checkArgument(percentile >= 0 && percentile <= 100, "percentile must be in [0, 100]");
        double[] observed = observed(values);
        if (observed.length == 0) {
            return Double.NaN;
        }
        return new Percentile().withEstimationType(EstimationType.R_7).evaluate(observed, percentile);
    }

    /**
     * @param values a series, possibly with missing values
     * @return the bias corrected standard deviation of the observed values, NaN
     *         when fewer than two values are observed
     */
    public static double sampleStandardDeviation(double[] values) {
        double[] observed = observed(values);
        if (observed.length < 2) {
            return Double.NaN;
        }
        return new StandardDeviation(true).evaluate(observed);
    }

    /**
     * Population variance, used for the spread of the sampling times.
     */
    public static double populationVariance(double[] values) {
        double mean = Arrays.stream(values).average().orElse(Double.NaN);
        return Arrays.stream(values).map(v -> (v - mean) * (v - mean)).average().orElse(Double.NaN);
    }

    /**
     * The anomaly threshold {@code median + numberOfSigma * std} of the observed
     * values.
     */
    public static double threshold(double[] values, double numberOfSigma) {
        return median(values) + numberOfSigma * sampleStandardDeviation(values);
    }

    /**
     * Computes one anomaly threshold per position over a trailing window of
     * {@code windowLength} values that ends at (and includes) the position. A
     * position whose window is incomplete, or holds a missing value, gets the
     * threshold of the whole series. A window length of 0 gives the global
     * threshold everywhere.
     *
     * @param values        a series, possibly with missing values
     * @param windowLength  number of values in the trailing window
     * @param numberOfSigma number of standard deviations above the median
     * @return the threshold for each position of the series
     */
    public static double[] rollingThresholds(double[] values, int windowLength, double numberOfSigma) {
        checkArgument(windowLength >= 0, "windowLength must be non-negative");
        double global = threshold(values, numberOfSigma);
        double[] thresholds = new double[values.length];
        Arrays.fill(thresholds, global);
        if (windowLength == 0) {
            return thresholds;
        }

        int lastMissing = -1;
        for (int i = 0; i < values.length; i++) {
            if (Double.isNaN(values[i])) {
                lastMissing = i;
            }
            int from = i - windowLength + 1;
            if (from >= 0 && lastMissing < from) {
                double[] window = Arrays.copyOfRange(values, from, i + 1);
                double local = threshold(window, numberOfSigma);
                if (!Double.isNaN(local)) {
                    thresholds[i] = local;
                }
            }
        }
        return thresholds;
    }
}
