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

import lombok.Getter;

import org.apache.commons.math3.special.Gamma;

/**
 * The classic Lomb-Scargle periodogram of an unevenly or evenly sampled series,
 * with the data centred and the power in the standard normalisation, so that
 * every power lies in {@code [0, 1]}. The false alarm probability of the peak
 * follows the Baluev (2008) upper bound.
 */
public class LombScargle {

    /**
     * Shortest period searched, in hours.
     */
    public static final double DEFAULT_MINIMUM_PERIOD = 15.0;

    /**
     * Longest period searched, in hours.
     */
    public static final double DEFAULT_MAXIMUM_PERIOD = 30.0;

    /**
     * Frequency samples per peak width {@code 1 / baseline}.
     */
    public static final int DEFAULT_SAMPLES_PER_PEAK = 5;

    private final double[] times;
    private final double[] values;
    @Getter
    private final double minimumFrequency;
    @Getter
    private final double maximumFrequency;
    private final int samplesPerPeak;

    public LombScargle(double[] times, double[] values) {
        this(times, values, DEFAULT_MINIMUM_PERIOD, DEFAULT_MAXIMUM_PERIOD, DEFAULT_SAMPLES_PER_PEAK);
    }

    public LombScargle(double[] times, double[] values, double minimumPeriod, double maximumPeriod,
            int samplesPerPeak) {
        checkArgument(times.length == values.length, "times and values must have the same length");
        checkArgument(minimumPeriod > 0 && maximumPeriod > minimumPeriod,
                "periods must satisfy 0 < minimumPeriod < maximumPeriod");
        checkArgument(samplesPerPeak > 0, "samplesPerPeak must be greater than 0");
        this.times = times;
        this.values = values;
        this.minimumFrequency = 1.0 / maximumPeriod;
        this.maximumFrequency = 1.0 / minimumPeriod;
        this.samplesPerPeak = samplesPerPeak;
    }

    /**
     * @return the frequency grid, evenly spaced from the minimum to the maximum
     *         frequency
     */
    public double[] frequencies() {
        double baseline = times.length > 1 ? times[times.length - 1] - times[0] : 1.0;
        double step = 1.0 / (samplesPerPeak * Math.max(baseline, 1.0));
        int count = (int) Math.ceil((maximumFrequency - minimumFrequency) / step) + 1;
        double[] frequencies = new double[count];
        for (int i = 0; i < count; i++) {
            frequencies[i] = Math.min(minimumFrequency + i * step, maximumFrequency);
        }
        return frequencies;
    }

    /**
     * @param frequency a frequency in cycles per hour
     * @return the normalised power at the frequency, 0 for a constant series
     */
    public double power(double frequency) {
        int n = values.length;
        double mean = 0.0;
        for (double v : values) {
            mean += v;
        }
        mean /= n;

        double yy = 0.0;
        for (double v : values) {
            yy += (v - mean) * (v - mean);
        }
        if (yy == 0.0) {
            return 0.0;
        }

        double omega = 2 * Math.PI * frequency;
        double s2 = 0.0;
        double c2 = 0.0;
        for (double t : times) {
            s2 += Math.sin(2 * omega * t);
            c2 += Math.cos(2 * omega * t);
        }
        double tau = Math.atan2(s2, c2) / (2 * omega);

        double yc = 0.0;
        double ys = 0.0;
        double cc = 0.0;
        double ss = 0.0;
        for (int i = 0; i < n; i++) {
            double y = values[i] - mean;
            double c = Math.cos(omega * (times[i] - tau));
            double s = Math.sin(omega * (times[i] - tau));
            yc += y * c;
            ys += y * s;
            cc += c * c;
            ss += s * s;
        }

        double p = 0.0;
        if (cc > 0) {
            p += yc * yc / cc;
        }
        if (ss > 0) {
            p += ys * ys / ss;
        }
        return Math.min(1.0, p / yy);
    }

    /**
     * @return the highest power over the frequency grid
     */
    public double peakPower() {
        double peak = 0.0;
        for (double frequency : frequencies()) {
            peak = Math.max(peak, power(frequency));
        }
        return peak;
    }

    /**
     * The probability that noise alone yields a peak at least as high as the
     * observed one. A constant series has probability 1.
     *
     * @return the false alarm probability of the peak power
     */
    public double falseAlarmProbability() {
        return falseAlarmProbability(peakPower());
    }

    /**
     * @param z a normalised power
     * @return the Baluev false alarm probability of the power
     */
    public double falseAlarmProbability(double z) {
        int n = times.length;
        if (n < 4 || z <= 0.0) {
            return 1.0;
        }
        if (z >= 1.0) {
            return 0.0;
        }
        double nh = n - 1;
        double nk = n - 3;
        double fapSingle = Math.pow(1 - z, 0.5 * nk);
        double w = maximumFrequency * Math.sqrt(4 * Math.PI * SeriesStatistics.populationVariance(times));
        double tau = gammaFactor(nh) * w * Math.pow(1 - z, 0.5 * (nk - 1)) * Math.sqrt(0.5 * nh * z);
        double fap = 1 - (1 - fapSingle) * Math.exp(-tau);
        return Math.max(0.0, Math.min(1.0, fap));
    }

    static double gammaFactor(double n) {
        return Math.sqrt(2.0 / n) * Math.exp(Gamma.logGamma(0.5 * n) - Gamma.logGamma(0.5 * (n - 1)));
    }
}
