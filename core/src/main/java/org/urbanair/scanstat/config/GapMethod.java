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
 * Options for bridging the hours between the end of the training data and the
 * start of the forecast.
 */
public enum GapMethod {

    /**
     * advance through the gap modulo one day, so the forecast starts at the
     * next equivalent hour of the day
     */
    STITCH,
    /**
     * advance through every hour of the gap
     */
    GAP;
}
