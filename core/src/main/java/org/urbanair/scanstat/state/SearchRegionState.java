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

package org.urbanair.scanstat.state;

import java.io.Serializable;

import lombok.Data;

/**
 * A POJO holding a {@link org.urbanair.scanstat.returntypes.SearchRegion}.
 * Times are epoch seconds.
 */
@Data
public class SearchRegionState implements Serializable {
    private static final long serialVersionUID = 1L;

    private int rowMin;
    private int rowMax;
    private int colMin;
    private int colMax;
    private long measurementStartUtc;
    private long measurementEndUtc;
    private double baseline;
    private double baselineUpper;
    private double baselineLower;
    private double actual;
    private double ebp;
    private double ebpLower;
    private double ebpUpper;
    private double kulldorff;
    private double kulldorffLower;
    private double kulldorffUpper;
    private double ebpAsym;
    private double ebpAsymLower;
    private double ebpAsymUpper;
}
