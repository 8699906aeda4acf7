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

import static org.urbanair.scanstat.CommonUtils.checkNotNull;
import static org.urbanair.scanstat.CommonUtils.checkParameter;

import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * The time frame of one scan. Readings in {@code [trainStart, forecastStart)}
 * train the forecaster and the hours {@code [forecastStart, forecastEnd)} are
 * forecast and scanned.
 */
@Getter
@EqualsAndHashCode
@ToString
public class ScanWindow {

    /**
     * Default number of hours that are forecast and scanned.
     */
    public static final int DEFAULT_FORECAST_HOURS = 24;

    /**
     * Default number of training hours, three weeks.
     */
    public static final int DEFAULT_TRAIN_HOURS = 504;

    private final Instant trainStart;
    private final Instant forecastStart;
    private final Instant forecastEnd;
    private final int trainHours;
    private final int forecastHours;

    protected ScanWindow(Builder builder) {
        checkNotNull(builder.upto, "upto must not be null");
        checkParameter(builder.forecastHours > 0, "forecastHours", builder.forecastHours,
                "forecastHours must be greater than 0");
        checkParameter(builder.trainHours > 0, "trainHours", builder.trainHours, "trainHours must be greater than 0");
        checkParameter(builder.upto.truncatedTo(ChronoUnit.HOURS).equals(builder.upto), "upto", builder.upto,
                "upto must fall on the hour");

        forecastEnd = builder.upto;
        forecastHours = builder.forecastHours;
        trainHours = builder.trainHours;
        forecastStart = forecastEnd.minus(Duration.ofHours(forecastHours));
        trainStart = forecastEnd.minus(Duration.ofHours((long) trainHours + forecastHours));
    }

    /**
     * @param instant a point in time
     * @return true if the instant lies inside the training period
     */
    public boolean isTraining(Instant instant) {
        return !instant.isBefore(trainStart) && instant.isBefore(forecastStart);
    }

    /**
     * @param instant a point in time
     * @return true if the instant lies anywhere inside the window
     */
    public boolean contains(Instant instant) {
        return !instant.isBefore(trainStart) && instant.isBefore(forecastEnd);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {

        private Instant upto;
        private int forecastHours = DEFAULT_FORECAST_HOURS;
        private int trainHours = DEFAULT_TRAIN_HOURS;

        /**
         * @param upto the exclusive end of the forecast period
         * @return this builder
         */
        public Builder upto(Instant upto) {
            this.upto = upto;
            return this;
        }

        public Builder forecastHours(int forecastHours) {
            this.forecastHours = forecastHours;
            return this;
        }

        public Builder trainHours(int trainHours) {
            this.trainHours = trainHours;
            return this;
        }

        public ScanWindow build() {
            return new ScanWindow(this);
        }
    }
}
