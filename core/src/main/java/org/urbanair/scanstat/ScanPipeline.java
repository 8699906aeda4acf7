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

package org.urbanair.scanstat;

import static org.urbanair.scanstat.CommonUtils.checkArgument;
import static org.urbanair.scanstat.CommonUtils.checkNotNull;

import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

import lombok.Getter;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.urbanair.scanstat.forecast.ForecastJoiner;
import org.urbanair.scanstat.forecast.ForecastPostprocessor;
import org.urbanair.scanstat.forecast.HoltWintersForecaster;
import org.urbanair.scanstat.forecast.IForecaster;
import org.urbanair.scanstat.grid.GridAggregator;
import org.urbanair.scanstat.preprocessor.Preprocessor;
import org.urbanair.scanstat.returntypes.AggregatedCell;
import org.urbanair.scanstat.returntypes.CellScore;
import org.urbanair.scanstat.returntypes.ForecastPoint;
import org.urbanair.scanstat.returntypes.ForecastRow;
import org.urbanair.scanstat.returntypes.ProcessedSeries;
import org.urbanair.scanstat.returntypes.Reading;
import org.urbanair.scanstat.returntypes.ScanResult;
import org.urbanair.scanstat.returntypes.SearchRegion;
import org.urbanair.scanstat.scan.CellScoreAggregator;
import org.urbanair.scanstat.scan.ScanEngine;

/**
 * Runs a complete batch: preprocess the readings of the window, forecast the
 * last hours, aggregate actual and expected counts to the grid, scan all
 * space-time regions and average the scores onto the cells.
 */
@Getter
public class ScanPipeline {

    private static final Logger log = LoggerFactory.getLogger(ScanPipeline.class);

    private final int gridResolution;
    private final Preprocessor preprocessor;
    private final IForecaster forecaster;
    private final ScanEngine scanEngine;

    protected ScanPipeline(Builder<?> builder) {
        checkArgument(builder.gridResolution > 0, "gridResolution must be greater than 0");
        gridResolution = builder.gridResolution;
        preprocessor = builder.preprocessor != null ? builder.preprocessor : Preprocessor.builder().build();
        forecaster = builder.forecaster != null ? builder.forecaster : HoltWintersForecaster.builder().build();
        scanEngine = builder.scanEngine != null ? builder.scanEngine : ScanEngine.builder().build();
    }

    /**
     * @param readings readings of any time span; those outside the window are
     *                 ignored
     * @param window   the training and forecast periods
     * @return the scored regions and cells
     * @throws org.urbanair.scanstat.errors.AllDetectorsDroppedException if
     *                                                                   preprocessing
     *                                                                   drops every
     *                                                                   detector
     */
    public ScanResult run(List<Reading> readings, ScanWindow window) {
        checkNotNull(readings, "readings must not be null");
        checkNotNull(window, "window must not be null");
        log.info("Scanning {} to {}, trained on data from {}", window.getForecastStart(), window.getForecastEnd(),
                window.getTrainStart());

        readings.forEach(Preprocessor::validate);
        List<Reading> inWindow = readings.stream().filter(r -> window.contains(r.getMeasurementStartUtc())
                && !r.getMeasurementEndUtc().isAfter(window.getForecastEnd())).collect(Collectors.toList());
        log.info("{} of {} readings fall in the window", inWindow.size(), readings.size());
        Set<String> detectorsIn = inWindow.stream().map(Reading::getDetectorId)
                .collect(Collectors.toCollection(TreeSet::new));

        List<ProcessedSeries> processed = preprocessor.preprocess(inWindow);
        List<ForecastPoint> forecast = ForecastPostprocessor
                .clamp(forecaster.forecast(processed, window.getForecastStart(), window.getForecastEnd()));
        List<ForecastRow> rows = ForecastJoiner.join(forecast, processed);
        List<AggregatedCell> cells = GridAggregator.aggregateToGrid(rows);

        List<SearchRegion> regions = scanEngine.scan(cells, gridResolution, window.getForecastStart(),
                window.getForecastEnd());
        List<CellScore> cellScores = CellScoreAggregator.averageToCells(regions, gridResolution,
                window.getForecastStart(), window.getForecastEnd());

        Set<String> detectorsOut = forecast.stream().map(ForecastPoint::getDetectorId)
                .collect(Collectors.toCollection(TreeSet::new));
        return ScanResult.builder().window(window).gridResolution(gridResolution).detectorsIn(detectorsIn)
                .detectorsOut(detectorsOut).regions(regions).cellScores(cellScores).build();
    }

    /**
     * Requests a running scan to stop; see {@link ScanEngine#cancel()}.
     */
    public void cancel() {
        scanEngine.cancel();
    }

    /**
     * @return a new ScanPipeline builder.
     */
    public static Builder builder() {
        return new Builder();
    }

    public static class Builder<T extends Builder<T>> {

        protected int gridResolution;
        protected Preprocessor preprocessor;
        protected IForecaster forecaster;
        protected ScanEngine scanEngine;

        public T gridResolution(int gridResolution) {
            this.gridResolution = gridResolution;
            return (T) this;
        }

        public T preprocessor(Preprocessor preprocessor) {
            this.preprocessor = preprocessor;
            return (T) this;
        }

        public T forecaster(IForecaster forecaster) {
            this.forecaster = forecaster;
            return (T) this;
        }

        public T scanEngine(ScanEngine scanEngine) {
            this.scanEngine = scanEngine;
            return (T) this;
        }

        public ScanPipeline build() {
            return new ScanPipeline(this);
        }
    }
}
