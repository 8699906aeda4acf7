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

package org.urbanair.scanstat.returntypes;

import java.time.Instant;

import lombok.Builder;
import lombok.Value;

/**
 * A scored space-time region. The region contains the grid cells with
 * {@code rowMin < row <= rowMax} and {@code colMin < col <= colMax}, and the
 * hours in {@code [measurementStartUtc, measurementEndUtc)}. Counts are scaled
 * down by {@link org.urbanair.scanstat.CommonUtils#COUNT_SCALE}.
 *
 * The upper score of each statistic is computed against the lower baseline,
 * and the lower score against the upper baseline.
 */
@Value
@Builder(toBuilder = true)
public class SearchRegion {

    int rowMin;

    int rowMax;

    int colMin;

    int colMax;

    Instant measurementStartUtc;

    Instant measurementEndUtc;

    double baseline;

    double baselineUpper;

    double baselineLower;

    double actual;

    double ebp;

    double ebpLower;

    double ebpUpper;

    double kulldorff;

    double kulldorffLower;

    double kulldorffUpper;

    double ebpAsym;

    double ebpAsymLower;

    double ebpAsymUpper;

    public boolean contains(int row, int col) {
        return rowMin < row && row <= rowMax && colMin < col && col <= colMax;
    }
}
