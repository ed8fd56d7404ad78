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

/**
 * Provides custom exception types used by TagScope ingestion.
 * <p>
 * The analysis engines themselves never throw for well-formed input. Exceptions in this
 * package describe problems with source data, and are expected to be caught by the reader
 * that raised them.
 *
 * <h2>Exception Types</h2>
 * <ul>
 *   <li>{@link io.github.jbellis.tagscope.exceptions.MalformedRecordException} - An unchecked
 *       exception raised for a source row that is too short or carries an unparsable or
 *       negative count. Readers catch it, count the row as skipped, and continue with the
 *       next row.</li>
 * </ul>
 *
 * @see io.github.jbellis.tagscope.exceptions.MalformedRecordException
 */
package io.github.jbellis.tagscope.exceptions;
