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

package io.warpkit.log.tags;

import java.util.List;
import java.util.Objects;

/**
 * Factory methods for {@link Tag}s and for joining several tags into one context string.
 *
 * <h2>Usage Examples</h2>
 * <pre>{@code
 * Tag app = Tags.makeDefault("[APP]");
 * Tag net = Tags.makeColored(AnsiColor.CYAN, "[NET]");
 *
 * String context = Tags.join(List.of(app, net));        // "[APP]\u001B[36m[NET]\u001B[0m"
 * String spaced  = Tags.join(List.of(app, net), " ");   // "[APP] \u001B[36m[NET]\u001B[0m"
 * }</pre>
 *
 * <p>{@link #join(List, String)} sizes its builder to the exact length of the result before
 * appending anything, so joining N tags allocates one backing array for the builder.</p>
 *
 * @see Tag
 * @see AnsiColor
 * @since 1.0.0
 */
public final class Tags {

    private static final Tag EMPTY = new Tag("");

    /**
     * Creates a tag holding the text verbatim.
     *
     * @param text the tag text
     * @return a new tag
     */
    public static Tag makeDefault(String text) {
        Objects.requireNonNull(text, "text");
        return text.isEmpty() ? EMPTY : new Tag(text);
    }

    /**
     * Creates a tag whose text is wrapped in the color start sequence and a trailing
     * {@link AnsiColor#RESET}, so the color never leaks into subsequent output.
     *
     * @param color the foreground color
     * @param text the tag text
     * @return a new color-wrapped tag
     */
    public static Tag makeColored(AnsiColor color, String text) {
        Objects.requireNonNull(color, "color");
        Objects.requireNonNull(text, "text");
        return new Tag(color.wrap(text));
    }

    /**
     * @return the shared empty tag
     */
    public static Tag empty() {
        return EMPTY;
    }

    /**
     * Joins tags without a delimiter.
     *
     * @param tags the tags, in display order
     * @return the concatenated tag texts, or an empty string for no tags
     */
    public static String join(List<Tag> tags) {
        return join(tags, "");
    }

    /**
     * Joins tags in order, placing the delimiter between consecutive tags and never after the
     * last one. An empty list yields an empty string and a single tag yields its text unchanged.
     *
     * @param tags the tags, in display order
     * @param delimiter the text placed between two tags
     * @return the joined context string
     */
    public static String join(List<Tag> tags, String delimiter) {
        Objects.requireNonNull(tags, "tags");
        String delim = Objects.requireNonNullElse(delimiter, "");
        if (tags.isEmpty()) {
            return "";
        }
        if (tags.size() == 1) {
            return tags.get(0).text();
        }

        StringBuilder joined = new StringBuilder(joinedLength(tags, delim));
        joined.append(tags.get(0).text());
        for (int i = 1; i < tags.size(); i++) {
            joined.append(delim).append(tags.get(i).text());
        }
        return joined.toString();
    }

    /**
     * Exact length of {@link #join(List, String)} for the given arguments.
     */
    static int joinedLength(List<Tag> tags, String delimiter) {
        if (tags.isEmpty()) {
            return 0;
        }
        int total = delimiter.length() * (tags.size() - 1);
        for (Tag tag : tags) {
            total += tag.length();
        }
        return total;
    }

    private Tags() {
        throw new UnsupportedOperationException("Utility class should not be instantiated");
    }
}
