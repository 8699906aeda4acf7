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

package org.urbanair.scanstat.errors;

import java.util.Collections;
import java.util.Set;
import java.util.TreeSet;

import lombok.Getter;

/**
 * A filtering stage removed every detector. The run is aborted instead of
 * producing empty output.
 */
@Getter
public class AllDetectorsDroppedException extends IllegalStateException {

    private final String stage;

    private final Set<String> droppedDetectors;

    public AllDetectorsDroppedException(String stage, Set<String> droppedDetectors) {
        super(String.format("all %d detectors were dropped by %s: %s", droppedDetectors.size(), stage,
                new TreeSet<>(droppedDetectors)));
        this.stage = stage;
        this.droppedDetectors = Collections.unmodifiableSet(new TreeSet<>(droppedDetectors));
    }
}
