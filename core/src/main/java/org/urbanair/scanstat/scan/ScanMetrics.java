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

package org.urbanair.scanstat.scan;

import static java.lang.Math.exp;
import static java.lang.Math.pow;

import org.urbanair.scanstat.errors.NegativeCountException;

/**
 * Likelihood ratio statistics of a space-time region under a Poisson model.
 * Baselines {@code b} are expected counts and {@code a} are observed counts.
 */
public class ScanMetrics {

    private ScanMetrics() {
    }

    /**
     * Expectation-based Poisson score. Equal to 1 when the region shows no
     * excess, greater than 1 otherwise.
     *
     * @param baseline expected count of the region
     * @param actual   observed count of the region
     * @return the likelihood ratio {@code (a/b)^a e^(b-a)}, or 1
     */
    public static double ebp(double baseline, double actual) {
        checkNonNegative(baseline, actual);
        if (baseline == 0 || actual <= baseline) {
            return 1.0;
        }
        return pow(actual / baseline, actual) * exp(baseline - actual);
    }

    /**
     * Signed variant of {@link #ebp}: positive for an excess, negative for a
     * deficit, 0 without expected count.
     */
    public static double ebpAsymmetric(double baseline, double actual) {
        checkNonNegative(baseline, actual);
        if (baseline == 0) {
            return 0.0;
        }
        double ratio = pow(actual / baseline, actual) * exp(baseline - actual);
        return actual >= baseline ? ratio - 1 : 1 - ratio;
    }

    /**
     * Kulldorff's scan statistic, comparing the rate inside the region with the
     * rate outside of it.
     *
     * @param baselineIn    expected count inside the region
     * @param baselineTotal expected count of the whole domain
     * @param actualIn      observed count inside the region
     * @param actualTotal   observed count of the whole domain
     * @return the likelihood ratio, 1 if the inside rate does not exceed the
     *         outside rate or either expected count is 0
     */
    public static double kulldorff(double baselineIn, double baselineTotal, double actualIn, double actualTotal) {
        checkNonNegative(baselineIn, baselineTotal, actualIn, actualTotal);
        double baselineOut = baselineTotal - baselineIn;
        double actualOut = actualTotal - actualIn;
        if (baselineIn == 0 || baselineOut == 0) {
            return 1.0;
        }
        double rateIn = actualIn / baselineIn;
        double rateOut = actualOut / baselineOut;
        if (rateIn > rateOut) {
            return pow(rateIn, actualIn) * pow(rateOut, actualOut) * pow(actualTotal / baselineTotal, -actualTotal);
        }
        return 1.0;
    }

    private static void checkNonNegative(double... counts) {
        for (double count : counts) {
            if (count < 0) {
                throw new NegativeCountException(String.format("counts must be non-negative, got %s", count));
            }
        }
    }
}
