/*
 * (c) Copyright 2025 Palantir Technologies Inc. All rights reserved.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */


package com.palantir.conduit.core;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Suppliers;
import com.google.common.util.concurrent.ListeningExecutorService;
import com.google.common.util.concurrent.ListeningScheduledExecutorService;
import com.google.common.util.concurrent.MoreExecutors;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/** Executors used by the pipelines and the standard policies. */
final class ConduitExecutors {

    private static final Duration DEFAULT_KEEP_ALIVE = Duration.ofSeconds(10);
    private static final String RETRY_SCHEDULER_NAME = "conduit-retry-scheduler";
    private static final String MULTIPART_THREAD_NAME = "conduit-multipart";

    /*
     * A single scheduler thread is shared by every asynchronous retry policy. Backoff tasks only resubmit the
     * request, so one thread keeps up with any realistic retry rate.
     */
    static final Supplier<ListeningScheduledExecutorService> sharedRetryScheduler =
            Suppliers.memoize(() -> MoreExecutors.listeningDecorator(newSharedSingleThreadScheduler(
                    new ThreadFactoryBuilder()
                            .setNameFormat(RETRY_SCHEDULER_NAME + "-%d")
                            .setDaemon(true)
                            .build())));

    /**
     * Create an executor which allows its thread to exit after a timeout has elapsed, which prevents thread
     * leakage when this library is loaded by a short-lived classloader.
     */
    static ScheduledExecutorService newSharedSingleThreadScheduler(ThreadFactory threadFactory) {
        return newSharedSingleThreadScheduler(threadFactory, DEFAULT_KEEP_ALIVE);
    }

    @VisibleForTesting
    @SuppressWarnings("DangerousThreadPoolExecutorUsage")
    static ScheduledExecutorService newSharedSingleThreadScheduler(
            ThreadFactory threadFactory, Duration keepAliveTime) {
        ScheduledThreadPoolExecutor executor = new ScheduledThreadPoolExecutor(1, threadFactory);
        // Core threads must be allowed to time out to allow garbage collection
        executor.allowCoreThreadTimeOut(true);
        executor.setKeepAliveTime(keepAliveTime.toNanos(), TimeUnit.NANOSECONDS);
        // cancelled backoffs are dropped immediately instead of waiting for their deadline
        executor.setRemoveOnCancelPolicy(true);
        return executor;
    }

    /** A pool for preparing the parts of one multipart request. The caller shuts it down once the parts are done. */
    static ListeningExecutorService newMultipartExecutor(int threads) {
        return MoreExecutors.listeningDecorator(Executors.newFixedThreadPool(
                threads,
                new ThreadFactoryBuilder()
                        .setNameFormat(MULTIPART_THREAD_NAME + "-%d")
                        .setDaemon(true)
                        .build()));
    }

    private ConduitExecutors() {}
}
