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

package io.github.jbellis.tagscope.model;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

/**
 * The ordered list of tag substrings an operator wants to analyze. Duplicate entries are kept
 * and each one matches independently.
 * <p>
 * A selection is an immutable value owned by the caller and passed into every analysis call;
 * the engines hold no selection state between calls.
 */
public final class TagSelection implements Iterable<String> {
    private static final TagSelection EMPTY = new TagSelection(List.of());

    private final List<String> queries;

    private TagSelection(List<String> queries) {
        this.queries = queries;
    }

    /**
     * @param queries the query strings, in order; duplicates are preserved
     * @return a selection over a copy of the given queries
     */
    public static TagSelection of(List<String> queries) {
        return new TagSelection(List.copyOf(queries));
    }

    public static TagSelection of(String... queries) {
        return of(List.of(queries));
    }

    public static TagSelection empty() {
        return EMPTY;
    }

    /**
     * Parses operator input such as {@code "music,gaming"}. Items are split on commas, empty
     * items are dropped and no trimming is applied, so {@code "music, gaming"} selects
     * {@code "music"} and {@code " gaming"}.
     *
     * @param input the raw comma-separated input
     * @return the parsed selection, empty for null or blank input
     */
    public static TagSelection parse(String input) {
        if (input == null || input.isEmpty()) {
            return EMPTY;
        }
        List<String> parsed = new ArrayList<>();
        for (String item : input.split(",")) {
            if (!item.isEmpty()) {
                parsed.add(item);
            }
        }
        return new TagSelection(List.copyOf(parsed));
    }

    public List<String> queries() {
        return queries;
    }

    public int size() {
        return queries.size();
    }

    public boolean isEmpty() {
        return queries.isEmpty();
    }

    @Override
    public Iterator<String> iterator() {
        return queries.iterator();
    }

    @Override
    public boolean equals(Object o) {
        if (o == null || getClass() != o.getClass()) return false;
        return queries.equals(((TagSelection) o).queries);
    }

    @Override
    public int hashCode() {
        return queries.hashCode();
    }

    @Override
    public String toString() {
        return String.join(",", queries);
    }
}
