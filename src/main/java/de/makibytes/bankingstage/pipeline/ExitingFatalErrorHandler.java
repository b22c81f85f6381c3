/*
 * Copyright (c) 2026 MakiBytes.
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
 *
 * SPDX-License-Identifier: Apache-2.0
 */
package de.makibytes.bankingstage.pipeline;

import java.util.concurrent.atomic.AtomicBoolean;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ApplicationContext;
import org.springframework.stereotype.Component;

/**
 * Closes the application context and exits with status 1 so that the supervisor
 * restarts the process. The exit runs on its own thread because closing the
 * context stops the pipeline threads that report fatal errors.
 */
@Component
public class ExitingFatalErrorHandler implements FatalErrorHandler {

    private static final Logger logger = LoggerFactory.getLogger(ExitingFatalErrorHandler.class);

    private final ApplicationContext context;
    private final AtomicBoolean exiting = new AtomicBoolean();

    public ExitingFatalErrorHandler(ApplicationContext context) {
        this.context = context;
    }

    @Override
    public void onFatalError(String component, Throwable error) {
        logger.error("Fatal error in {}: {}", component, error.getMessage(), error);
        if (!exiting.compareAndSet(false, true)) {
            return;
        }
        Thread exitThread = new Thread(() -> System.exit(SpringApplication.exit(context, () -> 1)), "fatal-exit");
        exitThread.start();
    }
}
