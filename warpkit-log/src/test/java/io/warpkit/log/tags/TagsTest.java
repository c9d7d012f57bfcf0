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

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class TagsTest {

    @Test
    void joinOfNothingIsEmpty() {
        assertEquals("", Tags.join(List.of()));
        assertEquals("", Tags.join(List.of(), " | "));
    }

    @Test
    void joinOfOneTagIsItsText() {
        assertEquals("[A]", Tags.join(List.of(Tags.makeDefault("[A]")), "-"));
    }

    @Test
    void delimiterGoesBetweenNeverAfter() {
        List<Tag> tags = List.of(Tags.makeDefault("[A]"), Tags.makeDefault("[B]"), Tags.makeDefault("[C]"));
        assertEquals("[A][B][C]", Tags.join(tags));
        assertEquals("[A] [B] [C]", Tags.join(tags, " "));
    }

    @Test
    void coloredTagAlwaysEndsWithReset() {
        Tag tag = Tags.makeColored(AnsiColor.BLUE, "[TIMER]");
        assertEquals("\u001B[34m[TIMER]\u001B[0m", tag.text());
        assertThat(Tags.makeColored(AnsiColor.RED, "").text()).endsWith(AnsiColor.RESET);
    }

    @Test
    void colorStartSequenceCarriesCode() {
        for (AnsiColor color : AnsiColor.values()) {
            assertEquals("\u001B[" + color.getCode() + "m", color.start());
        }
        assertEquals(39, AnsiColor.DEFAULT.getCode());
        assertEquals(97, AnsiColor.LIGHT_WHITE.getCode());
    }

    @Test
    void joinedLengthIsExact() {
        List<Tag> tags = List.of(
                Tags.makeColored(AnsiColor.GREEN, "[ok]"),
                Tags.makeDefault("plain"),
                Tags.makeColored(AnsiColor.LIGHT_MAGENTA, "[x]"));
        for (String delimiter : new String[]{"", " ", " :: "}) {
            assertEquals(Tags.join(tags, delimiter).length(), Tags.joinedLength(tags, delimiter));
        }
    }

    @Test
    void emptyDefaultTagIsShared() {
        assertSame(Tags.empty(), Tags.makeDefault(""));
        assertTrue(Tags.empty().isEmpty());
    }

    @Test
    void tagsCompareByText() {
        assertEquals(Tags.makeDefault("[A]"), Tags.makeDefault("[A]"));
        assertNotEquals(Tags.makeDefault("[A]"), Tags.makeColored(AnsiColor.WHITE, "[A]"));
    }
}
