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

package io.warpkit.log.sinks;

import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.Charset;
import java.nio.charset.CharsetEncoder;
import java.nio.charset.CoderResult;
import java.nio.charset.CodingErrorAction;
import java.util.Formatter;
import java.util.Locale;

/**
 * Per-thread working memory of a {@link ConsoleLogSink}: the line being composed, the
 * scratch buffer messages are formatted into, and the encoded bytes of the line.
 *
 * <p>All three are cleared, never reallocated, between lines. The byte buffer only grows, by
 * doubling, when a line does not fit. Instances are confined to their thread and need no
 * synchronization.</p>
 */
final class LineBuffers {

    static final int DEFAULT_LINE_CAPACITY = 256;
    static final int DEFAULT_SCRATCH_CAPACITY = 128;

    final StringBuilder line = new StringBuilder(DEFAULT_LINE_CAPACITY);
    final StringBuilder scratch = new StringBuilder(DEFAULT_SCRATCH_CAPACITY);
    final Formatter formatter = new Formatter(scratch, Locale.ROOT);

    /** Set while {@link #scratch} holds a message being formatted on this thread. */
    boolean formatting;

    private final CharsetEncoder encoder;
    private ByteBuffer bytes;

    LineBuffers(Charset charset) {
        this.encoder = charset.newEncoder()
                .onMalformedInput(CodingErrorAction.REPLACE)
                .onUnmappableCharacter(CodingErrorAction.REPLACE);
        this.bytes = ByteBuffer.allocate(DEFAULT_LINE_CAPACITY * 2);
    }

    /**
     * Encodes {@link #line} into the reusable byte buffer.
     *
     * @return the buffer, flipped so that position 0 to limit holds the encoded line
     */
    ByteBuffer encodeLine() {
        encoder.reset();
        bytes.clear();
        CharBuffer chars = CharBuffer.wrap(line);
        CoderResult result = encoder.encode(chars, bytes, true);
        while (result.isOverflow()) {
            grow();
            result = encoder.encode(chars, bytes, true);
        }
        result = encoder.flush(bytes);
        while (result.isOverflow()) {
            grow();
            result = encoder.flush(bytes);
        }
        bytes.flip();
        return bytes;
    }

    int byteCapacity() {
        return bytes.capacity();
    }

    private void grow() {
        ByteBuffer larger = ByteBuffer.allocate(bytes.capacity() * 2);
        bytes.flip();
        larger.put(bytes);
        bytes = larger;
    }
}
