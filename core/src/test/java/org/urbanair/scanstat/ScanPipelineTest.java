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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.urbanair.scanstat.TestUtils.constantSeries;
import static org.urbanair.scanstat.TestUtils.dailySeries;
import static org.urbanair.scanstat.TestUtils.hour;
import static org.urbanair.scanstat.TestUtils.reading;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CancellationException;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.urbanair.scanstat.errors.AllDetectorsDroppedException;
import org.urbanair.scanstat.forecast.HoltWintersForecaster;
import org.urbanair.scanstat.forecast.IForecaster;
import org.urbanair.scanstat.preprocessor.Preprocessor;
import org.urbanair.scanstat.returntypes.ForecastPoint;
import org.urbanair.scanstat.returntypes.ProcessedReading;
import org.urbanair.scanstat.returntypes.ProcessedSeries;
import org.urbanair.scanstat.returntypes.Reading;
import org.urbanair.scanstat.returntypes.ScanResult;
import org.urbanair.scanstat.returntypes.SearchRegion;
import org.urbanair.scanstat.scan.ScanEngine;

public class ScanPipelineTest {

    private static final int TRAIN_HOURS = 48;
    private static final int FORECAST_HOURS = 6;
    private static final int SPIKE_HOUR = TRAIN_HOURS + 3;

    private ScanWindow window;
    private List<Reading> readings;

    @BeforeEach
    public void setUp() {
        window = ScanWindow.builder().upto(hour(TRAIN_HOURS + FORECAST_HOURS)).forecastHours(FORECAST_HOURS)
                .trainHours(TRAIN_HOURS).build();
        readings = new ArrayList<>();
        for (int row = 1; row <= 2; row++) {
            for (int col = 1; col <= 2; col++) {
                for (Reading reading : constantSeries("d" + row + col, row, col, TRAIN_HOURS + FORECAST_HOURS,
                        10)) {
                    boolean spike = row == 1 && col == 1 && reading.getMeasurementStartUtc().equals(hour(SPIKE_HOUR));
                    readings.add(spike ? reading.toBuilder().nVehiclesInInterval(100).build() : reading);
                }
            }
        }
    }

    private static ScanPipeline exactPipeline() {
        return ScanPipeline.builder().gridResolution(2).preprocessor(Preprocessor.builder().repeats(0).build())
                .forecaster(HoltWintersForecaster.builder().alpha(1).beta(1).gamma(0).build()).build();
    }

    @Test
    public void testDefaults() {
        ScanPipeline pipeline = ScanPipeline.builder().gridResolution(4).build();
        assertEquals(4, pipeline.getGridResolution());
        assertTrue(pipeline.getForecaster() instanceof HoltWintersForecaster);
        assertEquals(Preprocessor.DEFAULT_PERCENTAGE_MISSING, pipeline.getPreprocessor().getPercentageMissing());
        assertThrows(IllegalArgumentException.class, () -> ScanPipeline.builder().build());
    }

    @Test
    public void testSpikeIsTheTopRegion() {
        ScanResult result = exactPipeline().run(readings, window);

        SearchRegion top = result.getTopRegion();
        assertEquals(hour(SPIKE_HOUR), top.getMeasurementStartUtc());
        assertEquals(window.getForecastEnd(), top.getMeasurementEndUtc());
        assertEquals(0, top.getRowMin());
        assertEquals(1, top.getRowMax());
        assertEquals(0, top.getColMin());
        assertEquals(1, top.getColMax());

        assertEquals(FORECAST_HOURS * 4, result.getRegions().size());
        for (SearchRegion region : result.getRegions()) {
            boolean coversSpike = region.contains(1, 1)
                    && !region.getMeasurementStartUtc().isAfter(hour(SPIKE_HOUR));
            if (coversSpike) {
                assertTrue(region.getEbp() > 1.0, region.toString());
            } else {
                assertEquals(1.0, region.getEbp(), region.toString());
            }
        }

        Set<String> detectors = Set.of("d11", "d12", "d21", "d22");
        assertEquals(detectors, result.getDetectorsIn());
        assertEquals(detectors, result.getDetectorsOut());
        assertEquals(FORECAST_HOURS * 4, result.getCellScores().size());
        assertEquals(window, result.getWindow());
    }

    @Test
    public void testSingleCellSpikeIsTheTopCellHour() {
        int forecastHours = 24;
        Instant spikeStart = hour(TRAIN_HOURS + forecastHours - 1);
        ScanWindow dayWindow = ScanWindow.builder().upto(hour(TRAIN_HOURS + forecastHours))
                .forecastHours(forecastHours).trainHours(TRAIN_HOURS).build();
        List<Reading> twoDetectors = new ArrayList<>(constantSeries("a", 1, 1, TRAIN_HOURS + forecastHours, 10));
        for (Reading reading : constantSeries("b", 1, 1, TRAIN_HOURS + forecastHours, 10)) {
            boolean spike = reading.getMeasurementStartUtc().equals(spikeStart);
            twoDetectors.add(spike ? reading.toBuilder().nVehiclesInInterval(100).build() : reading);
        }

        ScanResult result = ScanPipeline.builder().gridResolution(1)
                .preprocessor(Preprocessor.builder().repeats(0).build())
                .forecaster(HoltWintersForecaster.builder().alpha(1).beta(1).gamma(0).build()).build()
                .run(twoDetectors, dayWindow);

        assertEquals(forecastHours, result.getRegions().size());
        SearchRegion top = result.getTopRegion();
        assertEquals(spikeStart, top.getMeasurementStartUtc());
        assertEquals(dayWindow.getForecastEnd(), top.getMeasurementEndUtc());
        assertEquals(0, top.getRowMin());
        assertEquals(1, top.getRowMax());
        assertEquals(0, top.getColMin());
        assertEquals(1, top.getColMax());
        assertEquals(110e-6, top.getActual(), 1e-12);
        assertEquals(20e-6, top.getBaseline(), 1e-12);
        assertTrue(top.getEbp() > 1.0);
        assertEquals(Set.of("a", "b"), result.getDetectorsOut());
    }

    @Test
    public void testReadingsOutsideTheWindowAreIgnored() {
        readings.add(reading("late", 2, 2, TRAIN_HOURS + FORECAST_HOURS, 5));
        readings.add(reading("early", 2, 2, -1, 5));

        ScanResult result = exactPipeline().run(readings, window);

        assertEquals(Set.of("d11", "d12", "d21", "d22"), result.getDetectorsIn());
    }

    @Test
    public void testForecastEqualToActualScoresOne() {
        IForecaster forecaster = mock(IForecaster.class);
        when(forecaster.forecast(anyList(), eq(window.getForecastStart()), eq(window.getForecastEnd())))
                .thenAnswer(invocation -> {
                    List<ProcessedSeries> series = invocation.getArgument(0);
                    List<ForecastPoint> points = new ArrayList<>();
                    for (ProcessedSeries detector : series) {
                        for (ProcessedReading reading : detector.getReadings()) {
                            if (window.getForecastStart().isAfter(reading.getMeasurementStartUtc())) {
                                continue;
                            }
                            double count = reading.getNVehiclesInInterval();
                            points.add(ForecastPoint.builder().detectorId(detector.getDetectorId())
                                    .measurementStartUtc(reading.getMeasurementStartUtc())
                                    .measurementEndUtc(reading.getMeasurementEndUtc()).baseline(count)
                                    .baselineUpper(count).baselineLower(count).build());
                        }
                    }
                    return points;
                });

        ScanPipeline pipeline = ScanPipeline.builder().gridResolution(2)
                .preprocessor(Preprocessor.builder().repeats(0).build()).forecaster(forecaster).build();
        ScanResult result = pipeline.run(readings, window);

        verify(forecaster, times(1)).forecast(anyList(), eq(window.getForecastStart()), eq(window.getForecastEnd()));
        assertTrue(result.getRegions().stream().allMatch(r -> r.getEbp() == 1.0));
        assertTrue(result.getCellScores().stream().allMatch(c -> c.getEbpMean() == 1.0));
    }

    @Test
    public void testAllDetectorsDropped() {
        ScanPipeline pipeline = ScanPipeline.builder().gridResolution(2)
                .preprocessor(Preprocessor.builder().maxAnomaliesPerDay(0).repeats(1).globalThreshold(true).build())
                .build();
        List<Reading> spiky = new ArrayList<>();
        for (Reading reading : constantSeries("a", 1, 1, TRAIN_HOURS + FORECAST_HOURS, 10)) {
            spiky.add(reading.getMeasurementStartUtc().equals(hour(10))
                    ? reading.toBuilder().nVehiclesInInterval(500).build()
                    : reading);
        }
        assertThrows(AllDetectorsDroppedException.class, () -> pipeline.run(spiky, window));
    }

    @Test
    public void testCancelledScan() {
        ScanPipeline pipeline = exactPipeline();
        pipeline.cancel();
        assertThrows(CancellationException.class, () -> pipeline.run(readings, window));
        assertEquals(FORECAST_HOURS * 4, pipeline.run(readings, window).getRegions().size());
    }

    @Tag("functional")
    @Test
    public void testThreeWeeksOnLargeGrid() {
        int gridResolution = 8;
        ScanWindow large = ScanWindow.builder().upto(hour(ScanWindow.DEFAULT_TRAIN_HOURS + 24)).build();
        List<Reading> many = new ArrayList<>();
        for (int row = 1; row <= gridResolution; row++) {
            for (int col = 1; col <= gridResolution; col++) {
                many.addAll(dailySeries("d" + row + "-" + col, row, col, ScanWindow.DEFAULT_TRAIN_HOURS + 24,
                        100 + row * col, 30));
            }
        }
        ScanPipeline pipeline = ScanPipeline.builder().gridResolution(gridResolution)
                .scanEngine(ScanEngine.builder().parallelExecutionEnabled(true).build()).build();

        ScanResult result = pipeline.run(many, large);

        assertEquals(gridResolution * gridResolution, result.getDetectorsOut().size());
        assertEquals(24 * 26 * 26, result.getRegions().size());
    }
}
