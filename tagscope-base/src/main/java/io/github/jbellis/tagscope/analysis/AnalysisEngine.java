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

package io.github.jbellis.tagscope.analysis;

import io.github.jbellis.tagscope.model.TagSelection;
import io.github.jbellis.tagscope.model.VideoRecord;

import java.util.List;

/**
 * A strategy that computes an analytical view over the records matching a tag selection.
 * Implementations are stateless: every call allocates its own working structures and
 * discards them on return, and records are only read.
 *
 * @param <R> the result type
 */
public interface AnalysisEngine<R> {
    /**
     * Short name used in logs and benchmark output.
     *
     * @return the engine name
     */
    String getName();

    /**
     * Computes the result. Output formatting is not part of this step.
     *
     * @param records the records to scan
     * @param selection the query strings to match against record tags
     * @return a freshly computed result
     */
    R analyze(List<VideoRecord> records, TagSelection selection);
}
