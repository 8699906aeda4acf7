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

package org.urbanair.scanstat.forecast;

import java.time.Instant;
import java.util.List;

import org.urbanair.scanstat.returntypes.ForecastPoint;
import org.urbanair.scanstat.returntypes.ProcessedSeries;

/**
 * Produces the expected hourly counts of each detector over a forecast period.
 */
public interface IForecaster {

    /**
     * @param series        gap free series of the detectors to forecast
     * @param forecastStart inclusive start of the forecast period
     * @param forecastEnd   exclusive end of the forecast period
     * @return one forecast point per detector and forecast hour
     */
    List<ForecastPoint> forecast(List<ProcessedSeries> series, Instant forecastStart, Instant forecastEnd);
}
