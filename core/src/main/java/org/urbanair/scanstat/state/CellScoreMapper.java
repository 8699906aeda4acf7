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

import org.urbanair.scanstat.returntypes.CellScore;

public class CellScoreMapper implements IStateMapper<CellScore, CellScoreState> {

    @Override
    public CellScoreState toState(CellScore score) {
        CellScoreState state = new CellScoreState();
        state.setRow(score.getRow());
        state.setCol(score.getCol());
        state.setMeasurementStartUtc(score.getMeasurementStartUtc().getEpochSecond());
        state.setMeasurementEndUtc(score.getMeasurementEndUtc().getEpochSecond());
        state.setEbpMean(score.getEbpMean());
        state.setEbpLowerMean(score.getEbpLowerMean());
        state.setEbpUpperMean(score.getEbpUpperMean());
        state.setKulldorffMean(score.getKulldorffMean());
        state.setKulldorffLowerMean(score.getKulldorffLowerMean());
        state.setKulldorffUpperMean(score.getKulldorffUpperMean());
        state.setEbpAsymMean(score.getEbpAsymMean());
        state.setEbpAsymLowerMean(score.getEbpAsymLowerMean());
        state.setEbpAsymUpperMean(score.getEbpAsymUpperMean());
        state.setEbpStandardDeviation(score.getEbpStandardDeviation());
        return state;
    }

    @Override
    public CellScore toModel(CellScoreState state) {
        return CellScore.builder().row(state.getRow()).col(state.getCol())
                .measurementStartUtc(Instant.ofEpochSecond(state.getMeasurementStartUtc()))
                .measurementEndUtc(Instant.ofEpochSecond(state.getMeasurementEndUtc())).ebpMean(state.getEbpMean())
                .ebpLowerMean(state.getEbpLowerMean()).ebpUpperMean(state.getEbpUpperMean())
                .kulldorffMean(state.getKulldorffMean()).kulldorffLowerMean(state.getKulldorffLowerMean())
                .kulldorffUpperMean(state.getKulldorffUpperMean()).ebpAsymMean(state.getEbpAsymMean())
                .ebpAsymLowerMean(state.getEbpAsymLowerMean()).ebpAsymUpperMean(state.getEbpAsymUpperMean())
                .ebpStandardDeviation(state.getEbpStandardDeviation()).build();
    }
}
