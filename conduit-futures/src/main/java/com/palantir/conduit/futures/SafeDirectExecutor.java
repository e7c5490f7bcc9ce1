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


package com.palantir.conduit.futures;

import com.palantir.logsafe.SafeArg;
import com.palantir.logsafe.logger.SafeLogger;
import com.palantir.logsafe.logger.SafeLoggerFactory;
import java.util.concurrent.Executor;

/**
 * A direct executor which never lets a listener's exception escape into the thread completing the future. Guava
 * already logs listener failures from its own executors, but a throwing listener on a direct executor would
 * otherwise be reported against whichever unrelated code happened to complete the future.
 */
enum SafeDirectExecutor implements Executor {
    INSTANCE;

    private static final SafeLogger log = SafeLoggerFactory.get(SafeDirectExecutor.class);

    @Override
    public void execute(Runnable command) {
        try {
            command.run();
        } catch (Throwable t) {
            log.error("Listener failed on the direct executor", SafeArg.of("listener", command.getClass()), t);
        }
    }

    @Override
    public String toString() {
        return "SafeDirectExecutor";
    }
}
