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

import java.io.IOException;
import java.io.Reader;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.urbanair.scanstat.errors.InputShapeException;
import org.urbanair.scanstat.returntypes.Reading;

/**
 * Reads detector readings from delimited text with a header row. Columns may
 * appear in any order; extra columns are ignored.
 */
public class ReadingsCsvReader {

    public static final String DETECTOR_ID = "detector_id";
    public static final String POINT_ID = "point_id";
    public static final String LON = "lon";
    public static final String LAT = "lat";
    public static final String LOCATION = "location";
    public static final String MEASUREMENT_START_UTC = "measurement_start_utc";
    public static final String MEASUREMENT_END_UTC = "measurement_end_utc";
    public static final String N_VEHICLES_IN_INTERVAL = "n_vehicles_in_interval";
    public static final String ROW = "row";
    public static final String COL = "col";

    static final String[] REQUIRED_COLUMNS = { DETECTOR_ID, LOCATION, MEASUREMENT_START_UTC, MEASUREMENT_END_UTC,
            N_VEHICLES_IN_INTERVAL, ROW, COL };

    private final CSVFormat format;

    public ReadingsCsvReader(char delimiter) {
        format = CSVFormat.DEFAULT.builder().setDelimiter(delimiter).setHeader().setSkipHeaderRecord(true)
                .setIgnoreSurroundingSpaces(true).build();
    }

    /**
     * @param in delimited text, header row first
     * @return the readings in input order
     * @throws IOException         if the input cannot be read
     * @throws InputShapeException if a required column is absent from the header
     *                             or a value cannot be parsed
     */
    public List<Reading> read(Reader in) throws IOException {
        List<Reading> readings = new ArrayList<>();
        try (CSVParser parser = format.parse(in)) {
            Map<String, Integer> header = parser.getHeaderMap();
            for (String column : REQUIRED_COLUMNS) {
                if (header == null || !header.containsKey(column)) {
                    throw new InputShapeException("Reading", column,
                            String.format("input is missing required column '%s'", column));
                }
            }
            for (CSVRecord record : parser) {
                readings.add(toReading(record));
            }
        }
        return readings;
    }

    static Reading toReading(CSVRecord record) {
        return Reading.builder().detectorId(text(record, DETECTOR_ID)).pointId(text(record, POINT_ID))
                .lon(number(record, LON)).lat(number(record, LAT)).location(text(record, LOCATION))
                .measurementStartUtc(instant(record, MEASUREMENT_START_UTC))
                .measurementEndUtc(instant(record, MEASUREMENT_END_UTC))
                .nVehiclesInInterval(number(record, N_VEHICLES_IN_INTERVAL)).row(integer(record, ROW))
                .col(integer(record, COL)).build();
    }

    private static String text(CSVRecord record, String column) {
        if (!record.isMapped(column) || !record.isSet(column)) {
            return null;
        }
        String value = record.get(column);
        return value.isEmpty() ? null : value;
    }

    private static double number(CSVRecord record, String column) {
        String value = text(record, column);
        if (value == null) {
            return Double.NaN;
        }
        try {
            return Double.parseDouble(value);
        } catch (NumberFormatException e) {
            throw new InputShapeException("Reading", column, String.format("line %d: '%s' is not a number",
                    record.getRecordNumber(), value));
        }
    }

    private static Integer integer(CSVRecord record, String column) {
        String value = text(record, column);
        if (value == null) {
            return null;
        }
        try {
            return Integer.valueOf(value);
        } catch (NumberFormatException e) {
            throw new InputShapeException("Reading", column, String.format("line %d: '%s' is not an integer",
                    record.getRecordNumber(), value));
        }
    }

    private static Instant instant(CSVRecord record, String column) {
        String value = text(record, column);
        if (value == null) {
            return null;
        }
        try {
            return Instant.parse(value);
        } catch (DateTimeParseException e) {
            throw new InputShapeException("Reading", column, String.format("line %d: '%s' is not an ISO-8601 instant",
                    record.getRecordNumber(), value));
        }
    }
}
