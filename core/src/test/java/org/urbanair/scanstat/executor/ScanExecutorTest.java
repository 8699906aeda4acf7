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

package org.urbanair.scanstat.executor;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.urbanair.scanstat.TestUtils.hour;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Stream;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtensionContext;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.ArgumentsProvider;
import org.junit.jupiter.params.provider.ArgumentsSource;

public class ScanExecutorTest {

    private static class ExecutorProvider implements ArgumentsProvider {
        @Override
        public Stream<? extends Arguments> provideArguments(ExtensionContext context) {
            return Stream.of(Arguments.of(new SequentialScanExecutor()), Arguments.of(new ParallelScanExecutor(1)),
                    Arguments.of(new ParallelScanExecutor(4)));
        }
    }

    @ParameterizedTest
    @ArgumentsSource(ExecutorProvider.class)
    public void testResultsFollowWindowOrder(AbstractScanExecutor executor) {
        List<Instant> windows = new ArrayList<>();
        List<String> expected = new ArrayList<>();
        for (int h = 40; h >= 0; h--) {
            windows.add(hour(h));
            expected.add(h + "a");
            expected.add(h + "b");
        }

        Set<Instant> seen = ConcurrentHashMap.newKeySet();
        List<String> results = executor.scanWindows(windows, t -> {
            seen.add(t);
            int h = (int) Duration.between(hour(0), t).toHours();
            return List.of(h + "a", h + "b");
        });

        assertEquals(expected, results);
        assertEquals(windows.size(), seen.size());
    }

    @ParameterizedTest
    @ArgumentsSource(ExecutorProvider.class)
    public void testExceptionsPropagate(AbstractScanExecutor executor) {
        List<Instant> windows = List.of(hour(0), hour(1), hour(2));
        assertThrows(IllegalStateException.class, () -> executor.scanWindows(windows, t -> {
            throw new IllegalStateException("failed at " + t);
        }));
    }

    @Test
    public void testThreadPoolSize() {
        assertEquals(0, new SequentialScanExecutor().getThreadPoolSize());
        assertEquals(3, new ParallelScanExecutor(3).getThreadPoolSize());
        assertThrows(IllegalArgumentException.class, () -> new ParallelScanExecutor(0));
    }
}
