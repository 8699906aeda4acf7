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
 * A POJO holding a {@link org.urbanair.scanstat.returntypes.CellScore}.
 */
@Data
public class CellScoreState implements Serializable {
    private static final long serialVersionUID = 1L;

    private int row;
    private int col;
    private long measurementStartUtc;
    private long measurementEndUtc;
    private double ebpMean;
    private double ebpLowerMean;
    private double ebpUpperMean;
    private double kulldorffMean;
    private double kulldorffLowerMean;
    private double kulldorffUpperMean;
    private double ebpAsymMean;
    private double ebpAsymLowerMean;
    private double ebpAsymUpperMean;
    private double ebpStandardDeviation;
}
