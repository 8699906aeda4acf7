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

import static org.urbanair.scanstat.CommonUtils.checkArgument;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ForkJoinPool;
import java.util.function.Function;
import java.util.stream.Collectors;

import lombok.Getter;

/**
 * Scans the windows in parallel on a private thread pool.
 */
public class ParallelScanExecutor extends AbstractScanExecutor {

    private ForkJoinPool forkJoinPool;
    @Getter
    private final int threadPoolSize;

    public ParallelScanExecutor(int threadPoolSize) {
        checkArgument(threadPoolSize > 0, "threadPoolSize must be greater than 0");
        this.threadPoolSize = threadPoolSize;
        forkJoinPool = new ForkJoinPool(threadPoolSize);
    }

    @Override
    public <R> List<R> scanWindows(List<Instant> windows, Function<Instant, List<R>> windowScanner) {
        return submitAndJoin(() -> windows.parallelStream().map(windowScanner).flatMap(List::stream)
                .collect(Collectors.toList()));
    }

    private <T> T submitAndJoin(Callable<T> callable) {
        if (forkJoinPool == null) {
            forkJoinPool = new ForkJoinPool(threadPoolSize);
        }
        return forkJoinPool.submit(callable).join();
    }
}
