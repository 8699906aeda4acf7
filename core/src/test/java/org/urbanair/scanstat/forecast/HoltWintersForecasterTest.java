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

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.urbanair.scanstat.TestUtils.EPSILON;
import static org.urbanair.scanstat.TestUtils.hour;
import static org.urbanair.scanstat.TestUtils.processedSeries;
import static org.urbanair.scanstat.TestUtils.sinusoid;

import java.util.Arrays;
import java.util.List;
import java.util.function.Supplier;
import java.util.stream.Stream;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtensionContext;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.ArgumentsProvider;
import org.junit.jupiter.params.provider.ArgumentsSource;
import org.urbanair.scanstat.config.GapMethod;
import org.urbanair.scanstat.errors.InvalidParameterException;
import org.urbanair.scanstat.returntypes.ForecastPoint;
import org.urbanair.scanstat.returntypes.ProcessedReading;
import org.urbanair.scanstat.returntypes.ProcessedSeries;

public class HoltWintersForecasterTest {

    private static double[] constant(int hours, double count) {
        double[] counts = new double[hours];
        Arrays.fill(counts, count);
        return counts;
    }

    private static double[] baselines(List<ForecastPoint> points) {
        return points.stream().mapToDouble(ForecastPoint::getBaseline).toArray();
    }

    @Test
    public void testDefaults() {
        HoltWintersForecaster forecaster = HoltWintersForecaster.builder().build();
        assertEquals(HoltWintersForecaster.DEFAULT_ALPHA, forecaster.getAlpha());
        assertEquals(HoltWintersForecaster.DEFAULT_BETA, forecaster.getBeta());
        assertEquals(HoltWintersForecaster.DEFAULT_GAMMA, forecaster.getGamma());
        assertEquals(GapMethod.STITCH, forecaster.getGapMethod());
    }

    private static class InvalidBuilderProvider implements ArgumentsProvider {
        @Override
        public Stream<? extends Arguments> provideArguments(ExtensionContext context) {
            List<Supplier<HoltWintersForecaster>> builders = List.of(
                    () -> HoltWintersForecaster.builder().alpha(1.5).build(),
                    () -> HoltWintersForecaster.builder().alpha(-0.1).build(),
                    () -> HoltWintersForecaster.builder().beta(-0.1).build(),
                    () -> HoltWintersForecaster.builder().gamma(2).build());
            return builders.stream().map(Arguments::of);
        }
    }

    @ParameterizedTest
    @ArgumentsSource(InvalidBuilderProvider.class)
    public void testInvalidParameters(Supplier<HoltWintersForecaster> builder) {
        assertThrows(InvalidParameterException.class, builder::get);
    }

    @Test
    public void testNullGapMethod() {
        assertThrows(NullPointerException.class, () -> HoltWintersForecaster.builder().gapMethod(null).build());
    }

    @Test
    public void testConstantSeriesIsForecastExactly() {
        HoltWintersForecaster forecaster = HoltWintersForecaster.builder().alpha(1).beta(1).gamma(0).build();
        ProcessedSeries series = processedSeries("a", 1, 1, 0, constant(54, 10));

        List<ForecastPoint> points = forecaster.forecast(List.of(series), hour(48), hour(54));

        assertEquals(6, points.size());
        for (int j = 0; j < points.size(); j++) {
            ForecastPoint point = points.get(j);
            assertEquals("a", point.getDetectorId());
            assertEquals(hour(48 + j), point.getMeasurementStartUtc());
            assertEquals(hour(49 + j), point.getMeasurementEndUtc());
            assertEquals(10.0, point.getBaseline());
            assertEquals(point.getBaseline(), point.getBaselineUpper());
            assertEquals(point.getBaseline(), point.getBaselineLower());
            assertEquals(0.0, point.getStandardDeviation());
        }
    }

    @Test
    public void testReadingsInsideTheForecastAreNotTrainedOn() {
        HoltWintersForecaster forecaster = HoltWintersForecaster.builder().build();
        double[] counts = sinusoid(96, 100, 30);
        double[] spoiled = counts.clone();
        for (int h = 72; h < 96; h++) {
            spoiled[h] = 10_000;
        }

        List<ForecastPoint> clean = forecaster.forecast(List.of(processedSeries("a", 1, 1, 0, counts)), hour(72),
                hour(96));
        List<ForecastPoint> dirty = forecaster.forecast(List.of(processedSeries("a", 1, 1, 0, spoiled)), hour(72),
                hour(96));
        assertArrayEquals(baselines(clean), baselines(dirty));
    }

    @Test
    public void testDetectorWithoutTrainingIsSkipped() {
        HoltWintersForecaster forecaster = HoltWintersForecaster.builder().build();
        List<ProcessedSeries> series = List.of(processedSeries("early", 1, 1, 0, constant(30, 5)),
                processedSeries("late", 1, 2, 24, constant(6, 5)));

        List<ForecastPoint> points = forecaster.forecast(series, hour(24), hour(30));

        assertEquals(6, points.size());
        assertTrue(points.stream().allMatch(p -> p.getDetectorId().equals("early")));
    }

    @Test
    public void testStitchingSkipsWholeDays() {
        HoltWintersForecaster stitch = HoltWintersForecaster.builder().gapMethod(GapMethod.STITCH).build();
        HoltWintersForecaster gap = HoltWintersForecaster.builder().gapMethod(GapMethod.GAP).build();
        List<ProcessedReading> training = processedSeries("a", 1, 1, 0, sinusoid(72, 100, 30)).getReadings();

        double[] adjacent = baselines(stitch.forecastDetector("a", training, hour(72), 12));
        double[] dayLater = baselines(stitch.forecastDetector("a", training, hour(96), 12));
        double[] dayAndAnHourLater = baselines(stitch.forecastDetector("a", training, hour(97), 12));
        double[] oneHourGap = baselines(gap.forecastDetector("a", training, hour(73), 12));
        double[] fullGap = baselines(gap.forecastDetector("a", training, hour(96), 12));

        assertArrayEquals(adjacent, dayLater);
        assertArrayEquals(oneHourGap, dayAndAnHourLater);
        assertFalse(Arrays.equals(adjacent, fullGap));
    }

    @Test
    public void testForecastFollowsDailyPattern() {
        HoltWintersForecaster forecaster = HoltWintersForecaster.builder().build();
        List<ForecastPoint> points = forecaster.forecast(
                List.of(processedSeries("a", 1, 1, 0, sinusoid(21 * 24, 100, 30))), hour(20 * 24), hour(21 * 24));

        assertEquals(24, points.size());
        assertTrue(points.stream().allMatch(p -> p.getBaseline() > 0));
        assertTrue(points.get(6).getBaseline() > points.get(18).getBaseline() + EPSILON);
    }
}
