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

import lombok.Getter;

/**
 * A required field is absent from an input record. Raised before any
 * processing of the batch starts.
 */
@Getter
public class InputShapeException extends IllegalArgumentException {

    private final String recordType;

    private final String fieldName;

    public InputShapeException(String recordType, String fieldName) {
        this(recordType, fieldName, String.format("%s is missing required field '%s'", recordType, fieldName));
    }

    public InputShapeException(String recordType, String fieldName, String message) {
        super(message);
        this.recordType = recordType;
        this.fieldName = fieldName;
    }
}
