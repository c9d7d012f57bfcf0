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

package io.warpkit.log;

import io.warpkit.log.sinks.MemoryLogSink;
import io.warpkit.log.tags.Tags;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class HierarchySenderTest {

    private final MemoryLogSink sink = new MemoryLogSink();

    @Test
    void depthIndentsBeforeContext() {
        HierarchySender sender = new HierarchySender(Tags.makeDefault("[STEP]"), sink);
        sender.msg(0, "load");
        sender.info(1, "parse %d", 3);
        sender.warn(2, "slow");

        assertThat(sink.lines()).containsExactly(
                "[STEP] : load",
                "  [STEP][INFO] : parse 3",
                "    [STEP][WARN] : slow");
    }

    @Test
    void plainMethodsStayAtDepthZero() {
        HierarchySender sender = new HierarchySender(Tags.makeDefault("[H]"), sink);
        sender.msg("flat");
        assertEquals(List.of("[H] : flat"), sink.lines());
    }

    @Test
    void customIndentAndDeepLevels() {
        HierarchySender sender = new HierarchySender(List.of(Tags.makeDefault("[H]")), sink, "\t");
        sender.msg(9, "deep");
        sender.msg(3, "less");

        assertEquals("\t".repeat(9) + "[H]", sender.prefixAt(9));
        assertThat(sink.lines()).containsExactly("\t".repeat(9) + "[H] : deep", "\t\t\t[H] : less");
    }

    @Test
    void builderOnSubclassBuildsHierarchySender() {
        HierarchySender sender = HierarchySender.builder()
                .tag(Tags.makeDefault("[H]"))
                .sink(sink)
                .indent("-")
                .build();

        assertEquals("-", sender.getIndent());
        sender.msg(2, "nested");
        assertEquals(List.of("--[H] : nested"), sink.lines());
        assertEquals(HierarchySender.DEFAULT_INDENT, HierarchySender.builder().sink(sink).build().getIndent());
    }

    @Test
    void negativeDepthIsRejected() {
        HierarchySender sender = new HierarchySender(Tags.makeDefault("[H]"), sink);
        assertThrows(IllegalArgumentException.class, () -> sender.msg(-1, "nope"));
        assertEquals(0, sink.size());
    }

    @Test
    void taggedAtDepth() {
        HierarchySender sender = new HierarchySender(Tags.makeDefault("[TIMER][SUB]"), sink);
        sender.tagged(1, Level.MESSAGE, Tags.makeDefault("[2.000 ms]"), "inner");
        assertEquals(List.of("  [TIMER][SUB][2.000 ms] : inner"), sink.lines());
    }
}
