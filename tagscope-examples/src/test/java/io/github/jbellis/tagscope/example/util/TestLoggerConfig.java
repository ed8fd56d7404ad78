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
import ch.qos.logback.classic.LoggerContext;
import org.junit.After;
import org.junit.Test;
import org.slf4j.LoggerFactory;

import static org.junit.Assert.assertEquals;

public class TestLoggerConfig {
    @After
    public void resetLevel() {
        var context = (LoggerContext) LoggerFactory.getILoggerFactory();
        context.getLogger(LoggerConfig.PROJECT_LOGGER).setLevel(null);
    }

    @Test
    public void quietKeepsConfiguredLevel() {
        Level before = LoggerConfig.currentLevel();
        LoggerConfig.configure(false);
        assertEquals(before, LoggerConfig.currentLevel());
    }

    @Test
    public void verboseRaisesProjectLevel() {
        LoggerConfig.configure(true);
        assertEquals(Level.DEBUG, LoggerConfig.currentLevel());
    }
}
