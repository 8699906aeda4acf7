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

import static org.urbanair.scanstat.CommonUtils.checkArgument;
import static org.urbanair.scanstat.CommonUtils.checkNotNull;

import java.time.Instant;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.function.Consumer;
import java.util.function.Function;

import org.urbanair.scanstat.ScanWindow;
import org.urbanair.scanstat.config.RegionCounterMethod;
import org.urbanair.scanstat.forecast.HoltWintersForecaster;
import org.urbanair.scanstat.preprocessor.Preprocessor;

/**
 * A utility class for parsing command-line arguments.
 */
public class ArgumentParser {

    public static final String ARCHIVE_NAME = "target/scanstat-core-1.0.0.jar";
    public static final String OUTPUT_REGIONS = "regions";
    public static final String OUTPUT_CELLS = "cells";

    private final String runnerClass;
    private final String runnerDescription;
    private final Map<String, Argument<?>> shortFlags;
    private final Map<String, Argument<?>> longFlags;
    private final IntegerArgument gridResolution;
    private final StringArgument upto;
    private final IntegerArgument forecastHours;
    private final IntegerArgument trainHours;
    private final StringArgument delimiter;
    private final StringArgument output;
    private final DoubleArgument percentageMissing;
    private final IntegerArgument maxAnomaliesPerDay;
    private final DoubleArgument numberOfSigma;
    private final IntegerArgument repeats;
    private final BooleanArgument globalThreshold;
    private final IntegerArgument rollingHours;
    private final IntegerArgument consecutiveMissingThreshold;
    private final BooleanArgument dropAperiodic;
    private final DoubleArgument fapPercentileThreshold;
    private final DoubleArgument alpha;
    private final DoubleArgument beta;
    private final DoubleArgument gamma;
    private final BooleanArgument parallelExecution;
    private final IntegerArgument threadPoolSize;
    private final StringArgument regionCounter;

    /**
     * Create a new ArgumentParser. The runner class and runner description will be
     * used in help text.
     *
     * @param runnerClass       The name of the runner class where this argument
     *                          parser is being invoked.
     * @param runnerDescription A description of the runner class where this
     *                          argument parser is being invoked.
     */
    public ArgumentParser(String runnerClass, String runnerDescription) {
        this.runnerClass = runnerClass;
        this.runnerDescription = runnerDescription;
        shortFlags = new HashMap<>();
        longFlags = new HashMap<>();

        gridResolution = new IntegerArgument("-r", "--grid-resolution", "Number of grid cells along each axis.", 8,
                n -> checkArgument(n > 0, "grid resolution should be greater than 0"));
        addArgument(gridResolution);

        upto = new StringArgument("-u", "--upto",
                "End of the forecast period as an ISO-8601 instant, or empty for the end of the latest reading.", "",
                s -> checkArgument(s.isEmpty() || parseInstant(s) != null, "upto should be an ISO-8601 instant"));
        addArgument(upto);

        forecastHours = new IntegerArgument("-f", "--forecast-hours", "Number of hours to forecast and scan.",
                ScanWindow.DEFAULT_FORECAST_HOURS,
                n -> checkArgument(n > 0, "forecast hours should be greater than 0"));
        addArgument(forecastHours);

        trainHours = new IntegerArgument("-t", "--train-hours", "Number of hours to train the forecaster on.",
                ScanWindow.DEFAULT_TRAIN_HOURS, n -> checkArgument(n > 0, "train hours should be greater than 0"));
        addArgument(trainHours);

        delimiter = new StringArgument("-d", "--delimiter", "The character used as a field delimiter.", ",",
                s -> checkArgument(s.length() == 1, "delimiter should be a single character"));
        addArgument(delimiter);

        output = new StringArgument("-o", "--output", "Table to write, 'regions' or 'cells'.", OUTPUT_REGIONS,
                s -> checkArgument(OUTPUT_REGIONS.equals(s) || OUTPUT_CELLS.equals(s),
                        "output should be 'regions' or 'cells'"));
        addArgument(output);

        percentageMissing = new DoubleArgument(null, "--percentage-missing",
                "Drop detectors with more missing hours than this percentage.",
                Preprocessor.DEFAULT_PERCENTAGE_MISSING,
                x -> checkArgument(x >= 0, "percentage missing should be non-negative"));
        addArgument(percentageMissing);

        maxAnomaliesPerDay = new IntegerArgument(null, "--max-anomalies-per-day",
                "Drop detectors with more anomalies per day than this.", Preprocessor.DEFAULT_MAX_ANOMALIES_PER_DAY,
                n -> checkArgument(n >= 0, "max anomalies per day should be non-negative"));
        addArgument(maxAnomaliesPerDay);

        numberOfSigma = new DoubleArgument(null, "--n-sigma",
                "Number of standard deviations above the median that marks an anomaly.",
                Preprocessor.DEFAULT_NUMBER_OF_SIGMA, x -> checkArgument(x >= 0, "n sigma should be non-negative"));
        addArgument(numberOfSigma);

        repeats = new IntegerArgument(null, "--repeats", "Number of anomaly removal passes.",
                Preprocessor.DEFAULT_REPEATS, n -> checkArgument(n >= 0, "repeats should be non-negative"));
        addArgument(repeats);

        globalThreshold = new BooleanArgument(null, "--global-threshold",
                "Set to 'true' to use the median of the whole series instead of a rolling median.", false);
        addArgument(globalThreshold);

        rollingHours = new IntegerArgument(null, "--rolling-hours", "Length of the rolling median window in hours.",
                Preprocessor.DEFAULT_ROLLING_HOURS,
                n -> checkArgument(n >= 0, "rolling hours should be non-negative"));
        addArgument(rollingHours);

        consecutiveMissingThreshold = new IntegerArgument(null, "--consecutive-missing",
                "Drop detectors with a longer run of missing hours than this.",
                Preprocessor.DEFAULT_CONSECUTIVE_MISSING_THRESHOLD,
                n -> checkArgument(n >= 0, "consecutive missing should be non-negative"));
        addArgument(consecutiveMissingThreshold);

        dropAperiodic = new BooleanArgument(null, "--drop-aperiodic",
                "Set to 'true' to drop detectors without a daily period.", Preprocessor.DEFAULT_DROP_APERIODIC);
        addArgument(dropAperiodic);

        fapPercentileThreshold = new DoubleArgument(null, "--fap-percentile-threshold",
                "With --drop-aperiodic, drop detectors whose false alarm probability is above this percentile.",
                Preprocessor.DEFAULT_FAP_PERCENTILE_THRESHOLD,
                x -> checkArgument(x >= 0 && x <= 100, "fap percentile threshold should be in [0, 100]"));
        addArgument(fapPercentileThreshold);

        alpha = new DoubleArgument(null, "--alpha", "Holt-Winters level smoothing.",
                HoltWintersForecaster.DEFAULT_ALPHA, x -> checkArgument(x >= 0 && x <= 1, "alpha should be in [0, 1]"));
        addArgument(alpha);

        beta = new DoubleArgument(null, "--beta", "Holt-Winters trend smoothing.", HoltWintersForecaster.DEFAULT_BETA,
                x -> checkArgument(x >= 0 && x <= 1, "beta should be in [0, 1]"));
        addArgument(beta);

        gamma = new DoubleArgument(null, "--gamma", "Holt-Winters seasonal smoothing.",
                HoltWintersForecaster.DEFAULT_GAMMA,
                x -> checkArgument(x >= 0 && x <= 1, "gamma should be in [0, 1]"));
        addArgument(gamma);

        parallelExecution = new BooleanArgument("-p", "--parallel",
                "Set to 'true' to scan the time windows in parallel.", false);
        addArgument(parallelExecution);

        threadPoolSize = new IntegerArgument(null, "--thread-pool-size",
                "Number of scan threads, or 0 for one less than the number of processors.", 0,
                n -> checkArgument(n >= 0, "thread pool size should be non-negative"));
        addArgument(threadPoolSize);

        regionCounter = new StringArgument(null, "--region-counter", "Region counter, 'prefix_sum' or 'naive'.",
                "prefix_sum", s -> RegionCounterMethod.valueOf(s.toUpperCase(Locale.ROOT)));
        addArgument(regionCounter);
    }

    /**
     * Add a new argument to this argument parser.
     *
     * @param argument An Argument instance for a command-line argument that should
     *                 be parsed.
     */
    protected void addArgument(Argument<?> argument) {
        checkNotNull(argument, "argument should not be null");

        checkArgument(argument.getShortFlag() == null || !shortFlags.containsKey(argument.getShortFlag()),
                String.format("An argument mapping already exists for %s", argument.getShortFlag()));

        checkArgument(!longFlags.containsKey(argument.getLongFlag()),
                String.format("An argument mapping already exists for %s", argument.getLongFlag()));

        if (argument.getShortFlag() != null) {
            shortFlags.put(argument.getShortFlag(), argument);
        }

        longFlags.put(argument.getLongFlag(), argument);
    }

    /**
     * Parse the given array of command-line arguments.
     *
     * @param arguments An array of command-line arguments.
     */
    public void parse(String... arguments) {
        int i = 0;
        while (i < arguments.length) {
            String flag = arguments[i];

            try {
                if (shortFlags.containsKey(flag)) {
                    shortFlags.get(flag).parse(arguments[++i]);
                } else if (longFlags.containsKey(flag)) {
                    longFlags.get(flag).parse(arguments[++i]);
                } else if ("-h".equals(flag) || "--help".equals(flag)) {
                    printUsage();
                    Runtime.getRuntime().exit(0);
                } else {
                    throw new IllegalArgumentException("Unknown argument: " + flag);
                }
            } catch (Exception e) {
                printUsageAndExit("%s: %s", e.getClass().getName(), e.getMessage());
            }

            i++;
        }
    }

    /**
     * Print a usage message to STDOUT.
     */
    public void printUsage() {
        System.out.println(String.format("Usage: java -cp %s %s [options] < readings.csv > output.csv", ARCHIVE_NAME,
                runnerClass));
        System.out.println();
        System.out.println(runnerDescription);
        System.out.println();
        System.out.println("Options:");

        longFlags.values().stream().map(Argument::getHelpMessage).sorted()
                .forEach(msg -> System.out.println("\t" + msg));

        System.out.println();
        System.out.println("\t--help, -h: Print this help message and exit.");
    }

    /**
     * Print an error message, the usage message, and exit the application.
     *
     * @param errorMessage  An error message to show the user.
     * @param formatObjects An array of format objects that will be interpolated
     *                      into the error message using {@link String#format}.
     */
    public void printUsageAndExit(String errorMessage, Object... formatObjects) {
        System.err.println("Error: " + String.format(errorMessage, formatObjects));
        printUsage();
        System.exit(1);
    }

    static Instant parseInstant(String value) {
        return Instant.parse(value);
    }

    public int getGridResolution() {
        return gridResolution.getValue();
    }

    /**
     * @return the user-specified end of the forecast period, or null to use the
     *         end of the latest reading
     */
    public Instant getUpto() {
        return upto.getValue().isEmpty() ? null : parseInstant(upto.getValue());
    }

    public int getForecastHours() {
        return forecastHours.getValue();
    }

    public int getTrainHours() {
        return trainHours.getValue();
    }

    public char getDelimiter() {
        return delimiter.getValue().charAt(0);
    }

    public String getOutput() {
        return output.getValue();
    }

    public double getPercentageMissing() {
        return percentageMissing.getValue();
    }

    public int getMaxAnomaliesPerDay() {
        return maxAnomaliesPerDay.getValue();
    }

    public double getNumberOfSigma() {
        return numberOfSigma.getValue();
    }

    public int getRepeats() {
        return repeats.getValue();
    }

    public boolean getGlobalThreshold() {
        return globalThreshold.getValue();
    }

    public int getRollingHours() {
        return rollingHours.getValue();
    }

    public int getConsecutiveMissingThreshold() {
        return consecutiveMissingThreshold.getValue();
    }

    public boolean getDropAperiodic() {
        return dropAperiodic.getValue();
    }

    public double getFapPercentileThreshold() {
        return fapPercentileThreshold.getValue();
    }

    public double getAlpha() {
        return alpha.getValue();
    }

    public double getBeta() {
        return beta.getValue();
    }

    public double getGamma() {
        return gamma.getValue();
    }

    public boolean getParallelExecution() {
        return parallelExecution.getValue();
    }

    public int getThreadPoolSize() {
        return threadPoolSize.getValue();
    }

    public RegionCounterMethod getRegionCounter() {
        return RegionCounterMethod.valueOf(regionCounter.getValue().toUpperCase(Locale.ROOT));
    }

    public static class Argument<T> {

        private final String shortFlag;
        private final String longFlag;
        private final String description;
        private final T defaultValue;
        private final Function<String, T> parseFunction;
        private final Consumer<T> validateFunction;
        private T value;

        public Argument(String shortFlag, String longFlag, String description, T defaultValue,
                Function<String, T> parseFunction, Consumer<T> validateFunction) {
            this.shortFlag = shortFlag;
            this.longFlag = longFlag;
            this.description = description;
            this.defaultValue = defaultValue;
            this.parseFunction = parseFunction;
            this.validateFunction = validateFunction;
            value = defaultValue;
        }

        public Argument(String shortFlag, String longFlag, String description, T defaultValue,
                Function<String, T> parseFunction) {
            this(shortFlag, longFlag, description, defaultValue, parseFunction, t -> {
            });
        }

        public String getShortFlag() {
            return shortFlag;
        }

        public String getLongFlag() {
            return longFlag;
        }

        public String getDescription() {
            return description;
        }

        public T getDefaultValue() {
            return defaultValue;
        }

        public String getHelpMessage() {
            if (shortFlag != null) {
                return String.format("%s, %s: %s (default: %s)", longFlag, shortFlag, description, defaultValue);
            } else {
                return String.format("%s: %s (default: %s)", longFlag, description, defaultValue);
            }
        }

        public void parse(String string) {
            value = parseFunction.apply(string);
            validateFunction.accept(value);
        }

        public T getValue() {
            return value;
        }
    }

    public static class StringArgument extends Argument<String> {
        public StringArgument(String shortFlag, String longFlag, String description, String defaultValue,
                Consumer<String> validateFunction) {
            super(shortFlag, longFlag, description, defaultValue, x -> x, validateFunction);
        }
    }

    public static class BooleanArgument extends Argument<Boolean> {
        public BooleanArgument(String shortFlag, String longFlag, String description, boolean defaultValue) {
            super(shortFlag, longFlag, description, defaultValue, Boolean::parseBoolean);
        }
    }

    public static class IntegerArgument extends Argument<Integer> {
        public IntegerArgument(String shortFlag, String longFlag, String description, int defaultValue,
                Consumer<Integer> validateFunction) {
            super(shortFlag, longFlag, description, defaultValue, Integer::parseInt, validateFunction);
        }
    }

    public static class DoubleArgument extends Argument<Double> {
        public DoubleArgument(String shortFlag, String longFlag, String description, double defaultValue,
                Consumer<Double> validateFunction) {
            super(shortFlag, longFlag, description, defaultValue, Double::parseDouble, validateFunction);
        }
    }
}
