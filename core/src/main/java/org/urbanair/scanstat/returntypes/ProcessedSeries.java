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
import java.util.stream.Collectors;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * The cleaned, gap free hourly series of one detector.
 */
@Value
@Builder(toBuilder = true)
public class ProcessedSeries {

    String detectorId;

    String pointId;

    double lon;

    double lat;

    String location;

    int row;

    int col;

    @Singular
    List<ProcessedReading> readings;

    public int size() {
        return readings.size();
    }

    /**
     * @return the series as raw readings, so that a processed series can be fed
     *         through the preprocessor again
     */
    public List<Reading> toReadings() {
        return readings.stream()
                .map(r -> Reading.builder().detectorId(detectorId).pointId(pointId).lon(lon).lat(lat)
                        .location(location).measurementStartUtc(r.getMeasurementStartUtc())
                        .measurementEndUtc(r.getMeasurementEndUtc()).nVehiclesInInterval(r.getNVehiclesInInterval())
                        .row(row).col(col).build())
                .collect(Collectors.toList());
    }
}
