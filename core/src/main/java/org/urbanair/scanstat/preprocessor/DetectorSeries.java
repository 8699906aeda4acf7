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

package org.urbanair.scanstat.preprocessor;

import java.time.Instant;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import lombok.Getter;

import org.urbanair.scanstat.returntypes.Reading;

/**
 * The counts of one detector while it moves through the preprocessing stages.
 * Before reindexing the counts follow the detector's own readings ordered by
 * end time; afterwards they follow the shared hourly timeline.
 */
@Getter
class DetectorSeries {

    private final String detectorId;

    /**
     * the reading that supplies the static columns
     */
    private final Reading first;

    private final List<Instant> ends;

    private final double[] counts;

    /**
     * number of readings flagged as anomalous so far
     */
    private final int anomalies;

    DetectorSeries(Reading first, List<Instant> ends, double[] counts, int anomalies) {
        this.detectorId = first.getDetectorId();
        this.first = first;
        this.ends = Collections.unmodifiableList(ends);
        this.counts = counts;
        this.anomalies = anomalies;
    }

    DetectorSeries withCounts(double[] newCounts, int newAnomalies) {
        return new DetectorSeries(first, ends, newCounts, newAnomalies);
    }

    DetectorSeries reindexed(List<Instant> timeline, double[] newCounts) {
        return new DetectorSeries(first, timeline, newCounts, anomalies);
    }

    double[] copyOfCounts() {
        return Arrays.copyOf(counts, counts.length);
    }

    int size() {
        return counts.length;
    }
}
