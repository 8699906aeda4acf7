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

import static org.urbanair.scanstat.CommonUtils.checkState;

import java.util.List;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.urbanair.scanstat.returntypes.ForecastPoint;

/**
 * Makes the forecast of a run usable as a Poisson expectation.
 */
public class ForecastPostprocessor {

    private static final Logger log = LoggerFactory.getLogger(ForecastPostprocessor.class);

    private ForecastPostprocessor() {
    }

    /**
     * Clamps negative baselines to zero. The lower baseline is always clamped;
     * the baseline and the upper baseline are clamped only when at least one
     * baseline of the run is negative.
     *
     * @param points the forecast of a run
     * @return the clamped forecast, in the same order
     * @throws IllegalStateException if a baseline is NaN
     */
    public static List<ForecastPoint> clamp(List<ForecastPoint> points) {
        checkState(points.stream().noneMatch(p -> Double.isNaN(p.getBaseline())), "forecast contains NaN baselines");
        long negative = points.stream().filter(p -> p.getBaseline() < 0).count();
        if (negative > 0) {
            log.warn("Setting {} negative baseline values to zero", negative);
        }
        return points.stream().map(p -> {
            ForecastPoint.ForecastPointBuilder builder = p.toBuilder()
                    .baselineLower(Math.max(0.0, p.getBaselineLower()));
            if (negative > 0) {
                builder.baseline(Math.max(0.0, p.getBaseline())).baselineUpper(Math.max(0.0, p.getBaselineUpper()));
            }
            return builder.build();
        }).collect(Collectors.toList());
    }
}
