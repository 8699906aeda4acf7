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

import static org.urbanair.scanstat.CommonUtils.checkArgument;
import static org.urbanair.scanstat.CommonUtils.checkNotNull;

import java.time.Instant;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.stream.Collectors;

import org.urbanair.scanstat.ScanWindow;
import org.urbanair.scanstat.returntypes.ScanResult;

/**
 * Converts a {@link ScanResult} to a {@link ScanResultState} and back.
 */
public class ScanResultMapper implements IStateMapper<ScanResult, ScanResultState> {

    public static final String VERSION_1_0 = "1.0";

    private final SearchRegionMapper regionMapper = new SearchRegionMapper();
    private final CellScoreMapper cellScoreMapper = new CellScoreMapper();

    @Override
    public ScanResultState toState(ScanResult result) {
        checkNotNull(result, "result must not be null");
        ScanResultState state = new ScanResultState();
        state.setVersion(VERSION_1_0);
        state.setUpto(result.getWindow().getForecastEnd().getEpochSecond());
        state.setForecastHours(result.getWindow().getForecastHours());
        state.setTrainHours(result.getWindow().getTrainHours());
        state.setGridResolution(result.getGridResolution());
        state.setDetectorsIn(result.getDetectorsIn().toArray(new String[0]));
        state.setDetectorsOut(result.getDetectorsOut().toArray(new String[0]));
        state.setRegions(result.getRegions().stream().map(regionMapper::toState).toArray(SearchRegionState[]::new));
        state.setCellScores(
                result.getCellScores().stream().map(cellScoreMapper::toState).toArray(CellScoreState[]::new));
        return state;
    }

    @Override
    public ScanResult toModel(ScanResultState state) {
        checkNotNull(state, "state must not be null");
        checkArgument(VERSION_1_0.equals(state.getVersion()), "unsupported state version " + state.getVersion());
        ScanWindow window = ScanWindow.builder().upto(Instant.ofEpochSecond(state.getUpto()))
                .forecastHours(state.getForecastHours()).trainHours(state.getTrainHours()).build();
        return ScanResult.builder().window(window).gridResolution(state.getGridResolution())
                .detectorsIn(new LinkedHashSet<>(Arrays.asList(state.getDetectorsIn())))
                .detectorsOut(new LinkedHashSet<>(Arrays.asList(state.getDetectorsOut())))
                .regions(Arrays.stream(state.getRegions()).map(regionMapper::toModel).collect(Collectors.toList()))
                .cellScores(Arrays.stream(state.getCellScores()).map(cellScoreMapper::toModel)
                        .collect(Collectors.toList()))
                .build();
    }
}
