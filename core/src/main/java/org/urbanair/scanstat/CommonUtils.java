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

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import org.urbanair.scanstat.errors.InputShapeException;
import org.urbanair.scanstat.errors.InvalidParameterException;

/** A collection of common utility functions. */
public class CommonUtils {

    /**
     * Counts are divided by this factor before they reach the scan statistics so
     * that the exponentials in the likelihood ratios stay well conditioned.
     */
    public static final double COUNT_SCALE = 1e6;

    public static final Duration ONE_HOUR = Duration.ofHours(1);

    private CommonUtils() {
    }

    /**
     * Throws an {@link IllegalArgumentException} with the specified message if the
     * specified input is false.
     *
     * @param condition A condition to test.
     * @param message   The error message to include in the
     *                  {@code IllegalArgumentException} if {@code condition} is
     *                  false.
     * @throws IllegalArgumentException if {@code condition} is false.
     */
    public static void checkArgument(boolean condition, String message) {
        if (!condition) {
            throw new IllegalArgumentException(message);
        }
    }

    /**
     * Throws an {@link IllegalStateException} with the specified message if the
     * specified input is false.
     *
     * @param condition A condition to test.
     * @param message   The error message to include in the
     *                  {@code IllegalStateException} if {@code condition} is
     *                  false.
     * @throws IllegalStateException if {@code condition} is false.
     */
    public static void checkState(boolean condition, String message) {
        if (!condition) {
            throw new IllegalStateException(message);
        }
    }

    /**
     * Throws an {@link InvalidParameterException} naming the parameter and the
     * rejected value if the specified input is false.
     *
     * @param condition A condition to test.
     * @param parameter The name of the parameter being validated.
     * @param value     The value supplied for the parameter.
     * @param message   A description of the accepted range.
     * @throws InvalidParameterException if {@code condition} is false.
     */
    public static void checkParameter(boolean condition, String parameter, Object value, String message) {
        if (!condition) {
            throw new InvalidParameterException(parameter, value, message);
        }
    }

    /**
     * Throws an {@link InputShapeException} if a required field of an input record
     * is absent.
     *
     * @param <T>        An arbitrary type.
     * @param field      The field value to test for nullity.
     * @param recordType The name of the record type that carries the field.
     * @param fieldName  The name of the field.
     * @return {@code field} if not null.
     * @throws InputShapeException if {@code field} is null.
     */
    public static <T> T checkRequired(T field, String recordType, String fieldName) {
        if (field == null) {
            throw new InputShapeException(recordType, fieldName);
        }
        return field;
    }

    /**
     * Throws a {@link NullPointerException} with the specified message if the
     * specified input is null.
     *
     * @param <T>     An arbitrary type.
     * @param object  An object reference to test for nullity.
     * @param message The error message to include in the
     *                {@code NullPointerException} if {@code object} is null.
     * @return {@code object} if not null.
     * @throws NullPointerException if the supplied object is null.
     */
    public static <T> T checkNotNull(T object, String message) {
        Objects.requireNonNull(object, message);
        return object;
    }

    /**
     * @param start inclusive start
     * @param end   exclusive end
     * @return the number of whole hours between the two instants
     */
    public static int hoursBetween(Instant start, Instant end) {
        return (int) Duration.between(start, end).toHours();
    }

    /**
     * The hourly marks used as the earliest time of a space-time region, from
     * {@code end - 1h} down to {@code start}, latest first.
     *
     * @param start the start of the scanned window
     * @param end   the end of the scanned window
     * @return the candidate region start times, latest first
     */
    public static List<Instant> descendingHourlyMarks(Instant start, Instant end) {
        List<Instant> marks = new ArrayList<>();
        Instant mark = end.minus(ONE_HOUR);
        while (!mark.isBefore(start)) {
            marks.add(mark);
            mark = mark.minus(ONE_HOUR);
        }
        return marks;
    }

    /**
     * Half of the grid resolution, rounded up. A search region spans at most this
     * many rows and columns.
     *
     * @param gridResolution number of cells along each spatial axis
     * @return the maximal extent of a region along one axis
     */
    public static int halfMax(int gridResolution) {
        return (gridResolution % 2 == 0) ? gridResolution / 2 : (gridResolution + 1) / 2;
    }

    /**
     * The number of intervals {@code (min, max]} enumerated along one axis of the
     * grid, that is the number of distinct spatial extents per axis.
     *
     * @param gridResolution number of cells along each spatial axis
     * @return the number of extents along one axis
     */
    public static int extentsPerAxis(int gridResolution) {
        int half = halfMax(gridResolution);
        int count = 0;
        for (int min = 0; min <= gridResolution; min++) {
            count += Math.max(0, Math.min(min + half, gridResolution) - min);
        }
        return count;
    }
}
