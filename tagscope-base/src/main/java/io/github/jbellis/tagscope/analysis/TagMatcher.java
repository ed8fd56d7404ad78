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

/**
 * The match relation shared by every analysis engine: a tag matches a query when the query
 * occurs in the tag as a contiguous substring. Matching is case-sensitive and nothing is
 * normalized, so "music" matches "musical" but "Music" does not match "music".
 */
public final class TagMatcher {
    private TagMatcher() {
    }

    /**
     * @param tag the record tag
     * @param query the selected query string; the empty query matches every tag
     * @return true iff query is a substring of tag
     */
    public static boolean matches(String tag, String query) {
        return tag.contains(query);
    }
}
