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

import io.github.jbellis.tagscope.util.RatioMath;

import java.util.List;
import java.util.Objects;

/**
 * One ingested video item. The like/view ratio is derived once, at construction, and is never
 * recomputed by the analysis engines.
 */
public final class VideoRecord {
    private final String title;
    private final List<String> tags;
    private final double views;
    private final double likes;
    private final double ratio;

    /**
     * Creates a new record.
     *
     * @param title the item title
     * @param tags the item tags, in source order
     * @param views the view count, finite and non-negative
     * @param likes the like count, finite and non-negative
     * @throws IllegalArgumentException if a count is negative, NaN or infinite, or if title or tags is null
     */
    public VideoRecord(String title, List<String> tags, double views, double likes) {
        if (title == null) {
            throw new IllegalArgumentException("title must not be null");
        }
        if (tags == null) {
            throw new IllegalArgumentException("tags must not be null");
        }
        if (!Double.isFinite(views) || views < 0) {
            throw new IllegalArgumentException("views must be finite and non-negative, got " + views);
        }
        if (!Double.isFinite(likes) || likes < 0) {
            throw new IllegalArgumentException("likes must be finite and non-negative, got " + likes);
        }
        this.title = title;
        this.tags = List.copyOf(tags);
        this.views = views;
        this.likes = likes;
        this.ratio = RatioMath.ratio(likes, views);
    }

    public String getTitle() {
        return title;
    }

    /**
     * @return the tags in source order; the list is unmodifiable
     */
    public List<String> getTags() {
        return tags;
    }

    public double getViews() {
        return views;
    }

    public double getLikes() {
        return likes;
    }

    /**
     * @return likes divided by views, or 0 when views is 0
     */
    public double getRatio() {
        return ratio;
    }

    @Override
    public boolean equals(Object o) {
        if (o == null || getClass() != o.getClass()) return false;
        VideoRecord that = (VideoRecord) o;
        return Double.compare(views, that.views) == 0
                && Double.compare(likes, that.likes) == 0
                && title.equals(that.title)
                && tags.equals(that.tags);
    }

    @Override
    public int hashCode() {
        return Objects.hash(title, tags, views, likes);
    }

    @Override
    public String toString() {
        return String.format("VideoRecord(%s, tags=%s, views=%s, likes=%s, ratio=%s)", title, tags, views, likes, ratio);
    }
}
