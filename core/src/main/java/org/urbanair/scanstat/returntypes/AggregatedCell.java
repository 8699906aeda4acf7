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
 * Actual and expected counts of one grid cell for one hour, summed over the
 * detectors mapped to the cell.
 */
@Value
@Builder(toBuilder = true)
public class AggregatedCell {

    int row;

    int col;

    Instant measurementStartUtc;

    Instant measurementEndUtc;

    double actual;

    double baseline;

    double baselineUpper;

    double baselineLower;
}
