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

package org.urbanair.scanstat.interpolation;

import java.util.Arrays;

/**
 * Fills missing values ({@code NaN}) of an evenly spaced series. Interior gaps
 * are interpolated linearly between the neighbouring observations; leading and
 * trailing gaps take the nearest observation.
 */
public class LinearInterpolator {

    /**
     * @param values an evenly spaced series with missing values
     * @return a new series without missing values, or an unchanged copy if no
     *         value is observed at all
     */
    public double[] interpolate(double[] values) {
        double[] result = Arrays.copyOf(values, values.length);
        int previous = -1;
        for (int i = 0; i < result.length; i++) {
            if (Double.isNaN(result[i])) {
                continue;
            }
            if (previous == -1) {
                Arrays.fill(result, 0, i, result[i]);
            } else if (i - previous > 1) {
                double slope = (result[i] - result[previous]) / (i - previous);
                for (int j = previous + 1; j < i; j++) {
                    result[j] = result[previous] + slope * (j - previous);
                }
            }
            previous = i;
        }
        if (previous != -1) {
            Arrays.fill(result, previous + 1, result.length, result[previous]);
        }
        return result;
    }

    /**
     * @param values a series
     * @return the number of missing values
     */
    public static int countMissing(double[] values) {
        return (int) Arrays.stream(values).filter(Double::isNaN).count();
    }

    /**
     * @param values a series
     * @return the length of the longest run of consecutive missing values
     */
    public static int longestMissingRun(double[] values) {
        int longest = 0;
        int current = 0;
        for (double value : values) {
            if (Double.isNaN(value)) {
                current++;
                longest = Math.max(longest, current);
            } else {
                current = 0;
            }
        }
        return longest;
    }
}
