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

/**
 * Destinations for the lines produced by {@link io.warpkit.log.Sender}s.
 *
 * <ul>
 *   <li>{@link ConsoleLogSink} - standard and diagnostic streams, one lock per sink,
 *       per-thread reusable buffers; {@link ConsoleLogSink#system()} is the process default</li>
 *   <li>{@link MemoryLogSink} - keeps {@link LogRecord}s in memory, for tests and embedding</li>
 *   <li>{@link NoopLogSink} - discards everything</li>
 * </ul>
 *
 * <p>Every sink renders the same line shape:</p>
 * <pre>{@code
 * <context><level label> : <message>
 * }</pre>
 * <p>where the separator is omitted when nothing precedes the message.</p>
 */
package io.warpkit.log.sinks;
