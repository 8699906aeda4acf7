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

import java.time.Instant;

import org.urbanair.scanstat.returntypes.SearchRegion;

public class SearchRegionMapper implements IStateMapper<SearchRegion, SearchRegionState> {

    @Override
    public SearchRegionState toState(SearchRegion region) {
        SearchRegionState state = new SearchRegionState();
        state.setRowMin(region.getRowMin());
        state.setRowMax(region.getRowMax());
        state.setColMin(region.getColMin());
        state.setColMax(region.getColMax());
        state.setMeasurementStartUtc(region.getMeasurementStartUtc().getEpochSecond());
        state.setMeasurementEndUtc(region.getMeasurementEndUtc().getEpochSecond());
        state.setBaseline(region.getBaseline());
        state.setBaselineUpper(region.getBaselineUpper());
        state.setBaselineLower(region.getBaselineLower());
        state.setActual(region.getActual());
        state.setEbp(region.getEbp());
        state.setEbpLower(region.getEbpLower());
        state.setEbpUpper(region.getEbpUpper());
        state.setKulldorff(region.getKulldorff());
        state.setKulldorffLower(region.getKulldorffLower());
        state.setKulldorffUpper(region.getKulldorffUpper());
        state.setEbpAsym(region.getEbpAsym());
        state.setEbpAsymLower(region.getEbpAsymLower());
        state.setEbpAsymUpper(region.getEbpAsymUpper());
        return state;
    }

    @Override
    public SearchRegion toModel(SearchRegionState state) {
        return SearchRegion.builder().rowMin(state.getRowMin()).rowMax(state.getRowMax()).colMin(state.getColMin())
                .colMax(state.getColMax()).measurementStartUtc(Instant.ofEpochSecond(state.getMeasurementStartUtc()))
                .measurementEndUtc(Instant.ofEpochSecond(state.getMeasurementEndUtc())).baseline(state.getBaseline())
                .baselineUpper(state.getBaselineUpper()).baselineLower(state.getBaselineLower())
                .actual(state.getActual()).ebp(state.getEbp()).ebpLower(state.getEbpLower())
                .ebpUpper(state.getEbpUpper()).kulldorff(state.getKulldorff())
                .kulldorffLower(state.getKulldorffLower()).kulldorffUpper(state.getKulldorffUpper())
                .ebpAsym(state.getEbpAsym()).ebpAsymLower(state.getEbpAsymLower())
                .ebpAsymUpper(state.getEbpAsymUpper()).build();
    }
}
