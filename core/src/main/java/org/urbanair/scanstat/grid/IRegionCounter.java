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

package org.urbanair.scanstat.grid;

import java.time.Instant;

/**
 * Answers count sums over the space-time regions of one scan. A region holds
 * the cells with {@code rowMin < row <= rowMax} and
 * {@code colMin < col <= colMax}, and the hours from {@code tMin} to the end of
 * the scanned window. Implementations are built once per scan and are read
 * only afterwards, so they may be queried from several threads.
 * <p>
 * All implementations sum in fixed point (see
 * {@link AbstractRegionCounter#COUNT_FRACTION_BITS}), so their sums are equal
 * bit for bit. A region without data sums to exactly 0, and with non-negative
 * counts no region sum exceeds {@link #totals()}.
 */
public interface IRegionCounter {

    /**
     * @param rowMin exclusive lower row bound
     * @param rowMax inclusive upper row bound
     * @param colMin exclusive lower column bound
     * @param colMax inclusive upper column bound
     * @param tMin   inclusive start of the region, on an hour of the window
     * @return the sums over the region, zero if it holds no data
     */
    RegionCounts count(int rowMin, int rowMax, int colMin, int colMax, Instant tMin);

    /**
     * @return the sums over the whole grid and window
     */
    RegionCounts totals();

    int getGridResolution();
}
