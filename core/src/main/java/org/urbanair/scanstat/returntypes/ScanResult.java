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

import java.util.List;
import java.util.Set;

import lombok.Builder;
import lombok.Value;

import org.urbanair.scanstat.ScanWindow;

/**
 * Everything a single run of the scan pipeline produces.
 */
@Value
@Builder
public class ScanResult {

    ScanWindow window;

    int gridResolution;

    /**
     * detectors present in the input readings
     */
    Set<String> detectorsIn;

    /**
     * detectors that survived preprocessing and were scanned
     */
    Set<String> detectorsOut;

    /**
     * every scanned region, most anomalous first
     */
    List<SearchRegion> regions;

    List<CellScore> cellScores;

    public SearchRegion getTopRegion() {
        return regions.isEmpty() ? null : regions.get(0);
    }
}
