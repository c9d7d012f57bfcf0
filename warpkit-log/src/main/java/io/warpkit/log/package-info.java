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
 * Tag-based, leveled console logging.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * Sender log = new Sender(List.of(
 *     Tags.makeColored(AnsiColor.BLUE, "[APP]"),
 *     Tags.makeDefault("[db]")));
 *
 * log.info("connected to %s", url);  // [APP][db][INFO] : connected to jdbc:...
 * log.err("query failed");           // [APP][db][ERROR] : query failed   (stderr)
 * }</pre>
 *
 * <p>{@link io.warpkit.log.TimedSender} adds a cached wall-clock stamp and
 * {@link io.warpkit.log.HierarchySender} adds indentation by depth. Color output and the debug
 * switch are read through {@link io.warpkit.log.WarpkitSettings}.</p>
 */
package io.warpkit.log;
