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

import java.util.Objects;

/**
 * An immutable display label used as logging context, optionally wrapped in ANSI color
 * sequences. A tag has no identity beyond its text: two tags with the same text are equal.
 *
 * <p>Tags are meant to be built once, typically as {@code static final} constants, and read
 * many times. Use {@link Tags} to create them.</p>
 *
 * <pre>{@code
 * private static final Tag DB = Tags.makeColored(AnsiColor.MAGENTA, "[DB]");
 * private static final Sender log = new Sender(List.of(APP, DB));
 * }</pre>
 *
 * @see Tags
 * @since 1.0.0
 */
public final class Tag {

    private final String text;

    Tag(String text) {
        this.text = Objects.requireNonNull(text, "text");
    }

    /**
     * @return the full text of this tag, including any color sequences
     */
    public String text() {
        return text;
    }

    /**
     * @return the number of chars of {@link #text()}
     */
    public int length() {
        return text.length();
    }

    public boolean isEmpty() {
        return text.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Tag)) {
            return false;
        }
        return text.equals(((Tag) o).text);
    }

    @Override
    public int hashCode() {
        return text.hashCode();
    }

    @Override
    public String toString() {
        return text;
    }
}
