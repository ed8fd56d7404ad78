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
 * Tag-matching analysis over in-memory video records.
 *
 * <p>Two strategies compute equivalent views of the records whose tags match a
 * {@link io.github.jbellis.tagscope.model.TagSelection}:
 *
 * <ul>
 *   <li>{@link io.github.jbellis.tagscope.analysis.HeapRankingEngine} pushes every match into a
 *       max-heap keyed by like/view ratio and pops the top entries.
 *   <li>{@link io.github.jbellis.tagscope.analysis.HashAggregationEngine} groups matched ratios
 *       in a hash table keyed by query string and averages each group.
 * </ul>
 *
 * <p>Both use {@link io.github.jbellis.tagscope.analysis.TagMatcher}, so they always see the
 * same set of (tag, query) matches.
 *
 * <p><b>Usage Example:</b>
 * <pre>{@code
 * TagSelection selection = TagSelection.parse("music,gaming");
 * RankingResult top = HeapRankingEngine.rank(records, selection);
 * AggregationResult averages = HashAggregationEngine.aggregate(records, selection);
 * averages.average("music").ifPresent(avg -> ...);
 * }</pre>
 */
package io.github.jbellis.tagscope.analysis;
