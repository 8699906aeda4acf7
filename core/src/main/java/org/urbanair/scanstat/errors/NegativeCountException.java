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

package org.urbanair.scanstat.errors;

/**
 * A negative count reached a scan statistic. Counts are never negative once
 * the forecasts have been clamped, so this signals a broken upstream invariant.
 */
public class NegativeCountException extends IllegalArgumentException {

    public NegativeCountException(String message) {
        super(message);
    }
}
