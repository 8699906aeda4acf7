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

package org.urbanair.scanstat.executor;

import java.time.Instant;
import java.util.List;
import java.util.function.Function;

/**
 * Runs the scan of every region start time and concatenates the results in the
 * order of the start times.
 */
public abstract class AbstractScanExecutor {

    /**
     * Apply the window scanner to each start time and flatten the per-window
     * results. The result holds the regions of {@code windows.get(0)} first, then
     * those of {@code windows.get(1)}, and so on, whatever the order in which the
     * windows were scanned.
     *
     * @param windows       the region start times
     * @param windowScanner a function scoring every region of one start time
     * @param <R>           the per-region result type
     * @return the concatenated results
     */
    public abstract <R> List<R> scanWindows(List<Instant> windows, Function<Instant, List<R>> windowScanner);

    /**
     * @return the number of threads used, 0 when scanning on the calling thread
     */
    public abstract int getThreadPoolSize();
}
