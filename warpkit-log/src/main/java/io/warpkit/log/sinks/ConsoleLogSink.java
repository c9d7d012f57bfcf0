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

import io.warpkit.log.ColorMode;
import io.warpkit.log.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.PrintStream;
import java.nio.ByteBuffer;
import java.nio.charset.Charset;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;

/**
 * A sink writing to a standard and a diagnostic {@link PrintStream}, by default
 * {@code System.out} and {@code System.err}.
 *
 * <p>This sink provides:
 * <ul>
 *   <li>Level routing: MESSAGE, INFO and DEBUG to the standard stream; WARN and ERROR to the
 *       diagnostic stream</li>
 *   <li>Atomic lines: each line is written with a single {@code write(byte[], int, int)} call
 *       followed by {@code flush()}, under one lock shared by both streams</li>
 *   <li>Per-thread reusable buffers for formatting, composing and encoding, so the steady-state
 *       logging path does not allocate new buffers</li>
 *   <li>Optional color stripping through {@link ColorMode#PLAIN}</li>
 * </ul>
 *
 * <h2>Usage Examples</h2>
 *
 * <h3>Process-wide Console</h3>
 * <pre>{@code
 * Sender log = new Sender(Tags.makeColored(AnsiColor.BLUE, "[APP]"), ConsoleLogSink.system());
 * log.info("listening on port %d", port);
 * // [APP][INFO] : listening on port 8080
 * }</pre>
 *
 * <h3>Captured Output</h3>
 * <pre>{@code
 * ByteArrayOutputStream out = new ByteArrayOutputStream();
 * ByteArrayOutputStream err = new ByteArrayOutputStream();
 * LogSink sink = new ConsoleLogSink(new PrintStream(out), new PrintStream(err), ColorMode.PLAIN);
 * }</pre>
 *
 * <h2>Thread Safety</h2>
 * <p>Lines are composed and encoded in buffers owned by the calling thread, outside the lock.
 * The lock only covers the write and flush, so the critical section is one line long and two
 * lines written by different threads never interleave. Which thread writes first is
 * unspecified. Acquisition has no timeout.</p>
 *
 * <h2>Error Handling</h2>
 * <p>The sink never throws. Formatting failures become ERROR lines; stream failures, which
 * {@link PrintStream} only exposes through {@link PrintStream#checkError()}, are reported once
 * through Log4j.</p>
 *
 * @see LogSink
 * @see ColorMode
 * @since 1.0.0
 */
public class ConsoleLogSink implements LogSink {

    private static final Logger logger = LogManager.getLogger(ConsoleLogSink.class);

    private final PrintStream standard;
    private final PrintStream diagnostic;
    private final ColorMode colorMode;
    private final boolean ansi;
    private final ReentrantLock lock = new ReentrantLock();
    private final ThreadLocal<LineBuffers> buffers;
    private final AtomicBoolean streamErrorReported = new AtomicBoolean(false);

    /**
     * Creates a sink on {@code System.out} and {@code System.err} with the configured
     * color mode. Prefer {@link #system()} so that the whole process shares one lock.
     */
    public ConsoleLogSink() {
        this(System.out, System.err, ColorMode.configured());
    }

    /**
     * @param standard stream receiving MESSAGE, INFO and DEBUG lines
     * @param diagnostic stream receiving WARN and ERROR lines
     * @param colorMode whether color sequences are kept
     */
    public ConsoleLogSink(PrintStream standard, PrintStream diagnostic, ColorMode colorMode) {
        this(standard, diagnostic, colorMode, Charset.defaultCharset());
    }

    /**
     * @param standard stream receiving MESSAGE, INFO and DEBUG lines
     * @param diagnostic stream receiving WARN and ERROR lines
     * @param colorMode whether color sequences are kept
     * @param charset the encoding of both streams
     */
    public ConsoleLogSink(PrintStream standard, PrintStream diagnostic, ColorMode colorMode, Charset charset) {
        this.standard = Objects.requireNonNull(standard, "standard");
        this.diagnostic = Objects.requireNonNull(diagnostic, "diagnostic");
        this.colorMode = Objects.requireNonNull(colorMode, "colorMode").resolve();
        this.ansi = this.colorMode == ColorMode.ANSI;
        Charset encoding = Objects.requireNonNull(charset, "charset");
        this.buffers = ThreadLocal.withInitial(() -> new LineBuffers(encoding));
    }

    /**
     * Returns the process-wide console sink, created on first use with the configured color
     * mode. All senders that are not given a sink explicitly write here.
     *
     * @return the shared console sink
     */
    public static ConsoleLogSink system() {
        return SystemHolder.INSTANCE;
    }

    /**
     * @return the resolved color mode, ANSI or PLAIN
     */
    public ColorMode getColorMode() {
        return colorMode;
    }

    @Override
    public void write(Level level, CharSequence context, CharSequence message) {
        try {
            LineBuffers local = buffers.get();
            LineComposer.compose(local.line, level, context, message, ansi);
            ByteBuffer bytes = local.encodeLine();
            PrintStream target = level.isDiagnostic() ? diagnostic : standard;

            lock.lock();
            try {
                target.write(bytes.array(), 0, bytes.limit());
                target.flush();
            } finally {
                lock.unlock();
            }

            if (target.checkError() && streamErrorReported.compareAndSet(false, true)) {
                logger.error("console stream reported an error while writing a {} line; further errors are not reported",
                        level);
            }
        } catch (RuntimeException e) {
            logger.error("unable to write a {} line to the console", level, e);
        }
    }

    @Override
    public void writef(Level level, CharSequence context, String template, Object... args) {
        LineBuffers local = buffers.get();
        if (local.formatting) {
            // an argument logged while being formatted; the scratch buffer is in use
            LogSink.super.writef(level, context, template, args);
            return;
        }

        local.formatting = true;
        try {
            local.scratch.setLength(0);
            local.formatter.format(template, args);
        } catch (RuntimeException e) {
            logger.debug("format failure for template '{}'", template, e);
            write(Level.ERROR, context, LogSink.describeFormatFailure(level, template, e));
            return;
        } finally {
            local.formatting = false;
        }
        write(level, context, local.scratch);
    }

    private static final class SystemHolder {
        private static final ConsoleLogSink INSTANCE = new ConsoleLogSink();
    }
}
