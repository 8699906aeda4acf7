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

package org.urbanair.scanstat.serialize;

import lombok.Getter;

import org.urbanair.scanstat.returntypes.ScanResult;
import org.urbanair.scanstat.state.ScanResultMapper;
import org.urbanair.scanstat.state.ScanResultState;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * {@link ScanResult} serialization. The {@link ScanResultMapper} converts a
 * result into a state object and <a href=
 * "https://github.com/FasterXML/jackson-databind">Jackson</a> writes the state
 * object as JSON. The object mapper is exposed so callers can customize the
 * output, for example by enabling indentation.
 */
@Getter
public class ScanResultSerDe {

    private final ScanResultMapper mapper;
    private final ObjectMapper objectMapper;

    public ScanResultSerDe() {
        this(new ScanResultMapper(), new ObjectMapper());
    }

    /**
     * @param mapper       converts a ScanResult to a state object and back
     * @param objectMapper writes and reads the {@link ScanResultState} JSON
     */
    public ScanResultSerDe(ScanResultMapper mapper, ObjectMapper objectMapper) {
        this.mapper = mapper;
        this.objectMapper = objectMapper;
    }

    /**
     * @param result the result of a scan
     * @return the result as a JSON string
     * @throws JsonProcessingException if the state cannot be written
     */
    public String toJson(ScanResult result) throws JsonProcessingException {
        return objectMapper.writeValueAsString(mapper.toState(result));
    }

    /**
     * @param json a string written by {@link #toJson(ScanResult)}
     * @return the scan result
     * @throws JsonProcessingException if the string is not a serialized result
     */
    public ScanResult fromJson(String json) throws JsonProcessingException {
        ScanResultState state = objectMapper.readValue(json, ScanResultState.class);
        return mapper.toModel(state);
    }
}
