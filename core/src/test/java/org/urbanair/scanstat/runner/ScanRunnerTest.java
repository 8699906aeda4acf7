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
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.urbanair.scanstat.TestUtils.constantSeries;
import static org.urbanair.scanstat.TestUtils.hour;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringReader;
import java.io.StringWriter;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.urbanair.scanstat.ScanWindow;
import org.urbanair.scanstat.returntypes.Reading;

public class ScanRunnerTest {

    private static final String[] EXACT_FORECAST = { "-r", "2", "-f", "6", "-t", "48", "--alpha", "1", "--beta",
            "1", "--gamma", "0", "--repeats", "0" };

    private String csv;

    @BeforeEach
    public void setUp() {
        StringBuilder builder = new StringBuilder("detector_id,point_id,lon,lat,location,measurement_start_utc,"
                + "measurement_end_utc,n_vehicles_in_interval,row,col\n");
        for (int row = 1; row <= 2; row++) {
            for (int col = 1; col <= 2; col++) {
                for (Reading r : constantSeries("d" + row + col, row, col, 54, 10)) {
                    boolean spike = row == 1 && col == 1 && r.getMeasurementStartUtc().equals(hour(51));
                    builder.append(String.join(",", r.getDetectorId(), r.getPointId(), String.valueOf(r.getLon()),
                            String.valueOf(r.getLat()), "\"" + r.getLocation() + "\"",
                            r.getMeasurementStartUtc().toString(), r.getMeasurementEndUtc().toString(),
                            spike ? "100" : "10", String.valueOf(r.getRow()), String.valueOf(r.getCol())));
                    builder.append('\n');
                }
            }
        }
        csv = builder.toString();
    }

    private String run(String... args) throws IOException {
        ScanRunner runner = new ScanRunner();
        runner.parse(args);
        StringWriter out = new StringWriter();
        runner.run(new BufferedReader(new StringReader(csv)), new PrintWriter(out));
        return out.toString();
    }

    @Test
    public void testRegions() throws IOException {
        String[] lines = run(EXACT_FORECAST).split("\n");

        assertEquals(1 + 6 * 4, lines.length);
        assertEquals(String.join(",", TableWriter.REGION_COLUMNS), lines[0]);
        assertTrue(lines[1].startsWith("0,1,0,1,2020-03-04T03:00:00Z,2020-03-04T06:00:00Z,"), lines[1]);
    }

    @Test
    public void testCells() throws IOException {
        String[] args = new String[EXACT_FORECAST.length + 2];
        System.arraycopy(EXACT_FORECAST, 0, args, 0, EXACT_FORECAST.length);
        args[EXACT_FORECAST.length] = "-o";
        args[EXACT_FORECAST.length + 1] = "cells";

        String[] lines = run(args).split("\n");

        assertEquals(1 + 6 * 4, lines.length);
        assertEquals(String.join(",", TableWriter.CELL_COLUMNS), lines[0]);
        assertTrue(lines[1].startsWith("1,1,2020-03-04T05:00:00Z,2020-03-04T06:00:00Z,"), lines[1]);
    }

    @Test
    public void testWindowDefaultsToLatestReading() {
        ScanRunner runner = new ScanRunner();
        runner.parse("-f", "6", "-t", "48");
        ScanWindow window = runner.buildWindow(constantSeries("a", 1, 1, 54, 10));

        assertEquals(hour(54), window.getForecastEnd());
        assertEquals(hour(48), window.getForecastStart());
        assertEquals(hour(0), window.getTrainStart());

        runner.parse("-u", hour(30).toString());
        assertEquals(hour(30), runner.buildWindow(constantSeries("a", 1, 1, 54, 10)).getForecastEnd());
    }

    @Test
    public void testPipelineFromArguments() {
        ScanRunner runner = new ScanRunner();
        runner.parse("-r", "3", "--parallel", "true", "--thread-pool-size", "2", "--repeats", "4",
                "--drop-aperiodic", "true", "--fap-percentile-threshold", "80");

        assertEquals(3, runner.buildPipeline().getGridResolution());
        assertEquals(2, runner.buildPipeline().getScanEngine().getThreadPoolSize());
        assertEquals(4, runner.buildPipeline().getPreprocessor().getRepeats());
        assertTrue(runner.buildPipeline().getPreprocessor().isDropAperiodic());
        assertEquals(80.0, runner.buildPipeline().getPreprocessor().getFapPercentileThreshold());
    }
}
