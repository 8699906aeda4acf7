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

package org.urbanair.scanstat.config;

/**
 * Options for the threshold above which a reading is treated as an anomaly.
 */
public enum ThresholdMethod {

    /**
     * median plus a multiple of the standard deviation over the whole series of a
     * detector
     */
    GLOBAL,
    /**
     * median plus a multiple of the standard deviation over a trailing window of
     * readings; positions without a complete window use the global threshold
     */
    ROLLING;
}
