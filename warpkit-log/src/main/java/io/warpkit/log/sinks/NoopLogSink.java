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

import io.warpkit.log.Level;

/**
 * A sink that discards every line. Formatting is skipped as well.
 *
 * @since 1.0.0
 */
public final class NoopLogSink implements LogSink {

    private static final NoopLogSink INSTANCE = new NoopLogSink();

    private NoopLogSink() {
    }

    public static NoopLogSink getInstance() {
        return INSTANCE;
    }

    @Override
    public void write(Level level, CharSequence context, CharSequence message) {
    }

    @Override
    public void writef(Level level, CharSequence context, String template, Object... args) {
    }
}
