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

package io.github.jbellis.tagscope.exceptions;

/**
 * Thrown when a source row cannot be turned into a {@link io.github.jbellis.tagscope.model.VideoRecord}.
 */
public class MalformedRecordException extends RuntimeException {
    private final long rowNumber;

    /**
     * @param rowNumber the 1-based row number in its source
     * @param message what was wrong with the row
     */
    public MalformedRecordException(long rowNumber, String message) {
        super("row " + rowNumber + ": " + message);
        this.rowNumber = rowNumber;
    }

    /**
     * @param rowNumber the 1-based row number in its source
     * @param message what was wrong with the row
     * @param cause the underlying parse failure
     */
    public MalformedRecordException(long rowNumber, String message, Throwable cause) {
        super("row " + rowNumber + ": " + message, cause);
        this.rowNumber = rowNumber;
    }

    public long getRowNumber() {
        return rowNumber;
    }
}
