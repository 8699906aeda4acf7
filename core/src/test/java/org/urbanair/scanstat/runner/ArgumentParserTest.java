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

package org.urbanair.scanstat.runner;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.urbanair.scanstat.CommonUtils.checkArgument;

import java.time.Instant;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.urbanair.scanstat.ScanWindow;
import org.urbanair.scanstat.config.RegionCounterMethod;
import org.urbanair.scanstat.forecast.HoltWintersForecaster;
import org.urbanair.scanstat.preprocessor.Preprocessor;

public class ArgumentParserTest {

    private ArgumentParser parser;

    @BeforeEach
    public void setUp() {
        parser = new ArgumentParser("runner-class", "runner-description");
    }

    @Test
    public void testDefaults() {
        assertEquals(8, parser.getGridResolution());
        assertNull(parser.getUpto());
        assertEquals(ScanWindow.DEFAULT_FORECAST_HOURS, parser.getForecastHours());
        assertEquals(ScanWindow.DEFAULT_TRAIN_HOURS, parser.getTrainHours());
        assertEquals(',', parser.getDelimiter());
        assertEquals(ArgumentParser.OUTPUT_REGIONS, parser.getOutput());
        assertEquals(Preprocessor.DEFAULT_PERCENTAGE_MISSING, parser.getPercentageMissing());
        assertEquals(Preprocessor.DEFAULT_MAX_ANOMALIES_PER_DAY, parser.getMaxAnomaliesPerDay());
        assertEquals(Preprocessor.DEFAULT_NUMBER_OF_SIGMA, parser.getNumberOfSigma());
        assertEquals(Preprocessor.DEFAULT_REPEATS, parser.getRepeats());
        assertFalse(parser.getGlobalThreshold());
        assertEquals(Preprocessor.DEFAULT_ROLLING_HOURS, parser.getRollingHours());
        assertEquals(Preprocessor.DEFAULT_CONSECUTIVE_MISSING_THRESHOLD, parser.getConsecutiveMissingThreshold());
        assertFalse(parser.getDropAperiodic());
        assertEquals(Preprocessor.DEFAULT_FAP_PERCENTILE_THRESHOLD, parser.getFapPercentileThreshold());
        assertEquals(HoltWintersForecaster.DEFAULT_ALPHA, parser.getAlpha());
        assertEquals(HoltWintersForecaster.DEFAULT_BETA, parser.getBeta());
        assertEquals(HoltWintersForecaster.DEFAULT_GAMMA, parser.getGamma());
        assertFalse(parser.getParallelExecution());
        assertEquals(0, parser.getThreadPoolSize());
        assertEquals(RegionCounterMethod.PREFIX_SUM, parser.getRegionCounter());
    }

    @Test
    public void testParseShortFlags() {
        parser.parse("-r", "4", "-u", "2020-03-04T06:00:00Z", "-f", "6", "-t", "48", "-d", ";", "-o", "cells", "-p",
                "true");
        assertEquals(4, parser.getGridResolution());
        assertEquals(Instant.parse("2020-03-04T06:00:00Z"), parser.getUpto());
        assertEquals(6, parser.getForecastHours());
        assertEquals(48, parser.getTrainHours());
        assertEquals(';', parser.getDelimiter());
        assertEquals(ArgumentParser.OUTPUT_CELLS, parser.getOutput());
        assertTrue(parser.getParallelExecution());
    }

    @Test
    public void testParseLongFlags() {
        parser.parse("--grid-resolution", "16", "--percentage-missing", "12.5", "--max-anomalies-per-day", "3",
                "--n-sigma", "2.5", "--repeats", "2", "--global-threshold", "true", "--rolling-hours", "12",
                "--consecutive-missing", "6", "--drop-aperiodic", "true", "--fap-percentile-threshold", "90",
                "--alpha", "0.5", "--beta", "0.25",
                "--gamma", "0.75", "--parallel", "true", "--thread-pool-size", "3", "--region-counter", "naive");
        assertEquals(16, parser.getGridResolution());
        assertEquals(12.5, parser.getPercentageMissing());
        assertEquals(3, parser.getMaxAnomaliesPerDay());
        assertEquals(2.5, parser.getNumberOfSigma());
        assertEquals(2, parser.getRepeats());
        assertTrue(parser.getGlobalThreshold());
        assertEquals(12, parser.getRollingHours());
        assertEquals(6, parser.getConsecutiveMissingThreshold());
        assertTrue(parser.getDropAperiodic());
        assertEquals(90.0, parser.getFapPercentileThreshold());
        assertEquals(0.5, parser.getAlpha());
        assertEquals(0.25, parser.getBeta());
        assertEquals(0.75, parser.getGamma());
        assertTrue(parser.getParallelExecution());
        assertEquals(3, parser.getThreadPoolSize());
        assertEquals(RegionCounterMethod.NAIVE, parser.getRegionCounter());
    }

    @Test
    public void testArgumentValidation() {
        ArgumentParser.IntegerArgument argument = new ArgumentParser.IntegerArgument("-x", "--x", "an integer", 1,
                n -> checkArgument(n > 0, "x should be positive"));
        argument.parse("5");
        assertEquals(5, argument.getValue());
        assertEquals(1, argument.getDefaultValue());
        assertThrows(IllegalArgumentException.class, () -> argument.parse("0"));
        assertThrows(NumberFormatException.class, () -> argument.parse("five"));
        assertEquals("--x, -x: an integer (default: 1)", argument.getHelpMessage());
    }

    @Test
    public void testFapPercentileThresholdOutOfRange() {
        assertThrows(IllegalArgumentException.class, () -> parser.parse("--fap-percentile-threshold", "101"));
    }

    @Test
    public void testDuplicateFlags() {
        ArgumentParser.BooleanArgument argument = new ArgumentParser.BooleanArgument(null, "--grid-resolution",
                "duplicate", false);
        assertThrows(IllegalArgumentException.class, () -> parser.addArgument(argument));
    }
}
