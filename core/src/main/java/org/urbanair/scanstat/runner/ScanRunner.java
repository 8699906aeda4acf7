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

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Comparator;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.urbanair.scanstat.ScanPipeline;
import org.urbanair.scanstat.ScanWindow;
import org.urbanair.scanstat.config.ThresholdMethod;
import org.urbanair.scanstat.forecast.HoltWintersForecaster;
import org.urbanair.scanstat.preprocessor.Preprocessor;
import org.urbanair.scanstat.returntypes.Reading;
import org.urbanair.scanstat.returntypes.ScanResult;
import org.urbanair.scanstat.scan.ScanEngine;

/**
 * A command-line application that reads detector readings from STDIN, runs the
 * scan pipeline and writes the scored regions, or the cell scores, to STDOUT.
 */
public class ScanRunner {

    private static final Logger log = LoggerFactory.getLogger(ScanRunner.class);

    protected final ArgumentParser argumentParser;

    public ScanRunner() {
        this(new ArgumentParser(ScanRunner.class.getName(),
                "Scan hourly detector counts for space-time regions with more traffic than forecast."));
    }

    public ScanRunner(ArgumentParser argumentParser) {
        this.argumentParser = argumentParser;
    }

    public static void main(String... args) throws IOException {
        ScanRunner runner = new ScanRunner();
        runner.parse(args);
        log.info("Reading from stdin");
        runner.run(new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8)),
                new PrintWriter(new OutputStreamWriter(System.out, StandardCharsets.UTF_8)));
        log.info("Done");
    }

    /**
     * Parse the given command-line arguments.
     *
     * @param arguments An array of command-line arguments.
     */
    public void parse(String... arguments) {
        argumentParser.parse(arguments);
    }

    /**
     * Read readings from an input stream, scan them, and write the requested table
     * to an output stream.
     *
     * @param in  An input stream where readings will be read.
     * @param out An output stream where the result table will be written.
     * @throws IOException if IO errors are encountered during reading or writing.
     */
    public void run(BufferedReader in, PrintWriter out) throws IOException {
        List<Reading> readings = new ReadingsCsvReader(argumentParser.getDelimiter()).read(in);
        log.info("Read {} readings", readings.size());

        ScanResult result = buildPipeline().run(readings, buildWindow(readings));

        TableWriter writer = new TableWriter(argumentParser.getDelimiter());
        if (ArgumentParser.OUTPUT_CELLS.equals(argumentParser.getOutput())) {
            writer.writeCells(result.getCellScores(), out);
        } else {
            writer.writeRegions(result.getRegions(), out);
        }
        out.flush();
    }

    protected ScanWindow buildWindow(List<Reading> readings) {
        Instant upto = argumentParser.getUpto();
        if (upto == null) {
            upto = readings.stream().map(Reading::getMeasurementEndUtc).filter(t -> t != null)
                    .max(Comparator.naturalOrder())
                    .orElseThrow(() -> new IllegalArgumentException("no readings to derive the window from"))
                    .truncatedTo(ChronoUnit.HOURS);
        }
        return ScanWindow.builder().upto(upto).forecastHours(argumentParser.getForecastHours())
                .trainHours(argumentParser.getTrainHours()).build();
    }

    protected ScanPipeline buildPipeline() {
        Preprocessor preprocessor = Preprocessor.builder().percentageMissing(argumentParser.getPercentageMissing())
                .maxAnomaliesPerDay(argumentParser.getMaxAnomaliesPerDay())
                .numberOfSigma(argumentParser.getNumberOfSigma()).repeats(argumentParser.getRepeats())
                .thresholdMethod(argumentParser.getGlobalThreshold() ? ThresholdMethod.GLOBAL : ThresholdMethod.ROLLING)
                .rollingHours(argumentParser.getRollingHours())
                .consecutiveMissingThreshold(argumentParser.getConsecutiveMissingThreshold())
                .dropAperiodic(argumentParser.getDropAperiodic())
                .fapPercentileThreshold(argumentParser.getFapPercentileThreshold()).build();
        HoltWintersForecaster forecaster = HoltWintersForecaster.builder().alpha(argumentParser.getAlpha())
                .beta(argumentParser.getBeta()).gamma(argumentParser.getGamma()).build();
        ScanEngine.Builder<?> engine = ScanEngine.builder()
                .parallelExecutionEnabled(argumentParser.getParallelExecution())
                .regionCounter(argumentParser.getRegionCounter());
        if (argumentParser.getParallelExecution() && argumentParser.getThreadPoolSize() > 0) {
            engine.threadPoolSize(argumentParser.getThreadPoolSize());
        }
        return ScanPipeline.builder().gridResolution(argumentParser.getGridResolution()).preprocessor(preprocessor)
                .forecaster(forecaster).scanEngine(engine.build()).build();
    }
}
