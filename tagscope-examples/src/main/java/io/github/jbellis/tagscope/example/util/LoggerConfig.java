/*
 * Copyright DataStax, Inc.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package io.github.jbellis.tagscope.example.util;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import org.slf4j.ILoggerFactory;
import org.slf4j.LoggerFactory;

/**
 * Adjusts the logback configuration loaded from logback.xml at runtime.
 */
public class LoggerConfig {
    static final String PROJECT_LOGGER = "io.github.jbellis.tagscope";

    private LoggerConfig() {
    }

    /**
     * Raises or lowers the level of the project's loggers. Verbose mode logs each benchmark run
     * and every skipped input row.
     *
     * @param verbose true for DEBUG, false to keep the configured level
     */
    public static void configure(boolean verbose) {
        if (!verbose) {
            return;
        }
        ILoggerFactory factory = LoggerFactory.getILoggerFactory();
        // another SLF4J binding is in charge, leave it alone
        if (!(factory instanceof LoggerContext)) {
            return;
        }
        Logger projectLogger = ((LoggerContext) factory).getLogger(PROJECT_LOGGER);
        projectLogger.setLevel(Level.DEBUG);
    }

    /**
     * @return the effective level of the project's loggers, or null if logback is not bound
     */
    public static Level currentLevel() {
        ILoggerFactory factory = LoggerFactory.getILoggerFactory();
        if (!(factory instanceof LoggerContext)) {
            return null;
        }
        return ((LoggerContext) factory).getLogger(PROJECT_LOGGER).getEffectiveLevel();
    }
}
