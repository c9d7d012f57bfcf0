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

package io.warpkit.check;

import io.warpkit.log.HierarchySender;
import io.warpkit.log.sinks.ConsoleLogSink;
import io.warpkit.log.sinks.LogSink;
import io.warpkit.log.tags.AnsiColor;
import io.warpkit.log.tags.Tag;
import io.warpkit.log.tags.Tags;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.List;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * Runs collections of check suites and keeps the overall tally.
 *
 * <pre>{@code
 * try (Registry registry = new Registry("toolkit")) {
 *     registry.addCollection("units", List.of(
 *             () -> unitChecks(registry.suite("conversion")),
 *             () -> unitChecks(registry.suite("parsing"))));
 *     System.exit(registry.conclude());
 * }
 * }</pre>
 *
 * <p>A suite supplier that throws is logged as an error and counted as one failed check; the
 * remaining suites of the collection still run.</p>
 *
 * @since 1.0.0
 */
public class Registry implements AutoCloseable {

    private static final Logger logger = LogManager.getLogger(Registry.class);

    public static final Tag REGISTRY_TAG = Tags.makeColored(AnsiColor.BLUE, "[REGISTRY]");
    public static final Tag COLLECTION_TAG = Tags.makeColored(AnsiColor.BLUE, "[COLLECTION]");

    static final int COLLECTION_DEPTH = 1;
    static final int SUITE_DEPTH = 2;

    private final String name;
    private final LogSink sink;
    private final HierarchySender registrySender;
    private final HierarchySender collectionSender;
    private final CheckSummary summary = new CheckSummary();
    private boolean closed;

    public Registry(String name) {
        this(name, ConsoleLogSink.system());
    }

    public Registry(String name, LogSink sink) {
        this.name = Objects.requireNonNull(name, "name");
        this.sink = Objects.requireNonNull(sink, "sink");
        this.registrySender = new HierarchySender(REGISTRY_TAG, sink);
        this.collectionSender = new HierarchySender(COLLECTION_TAG, sink);
        registrySender.msg("%s {", name);
    }

    /**
     * Creates a suite writing to this registry's sink, indented under its collections.
     *
     * @param description the suite description
     * @return a new open suite
     */
    public Suite suite(String description) {
        return new Suite(description, sink, SUITE_DEPTH);
    }

    /**
     * Runs each suite in order and adds their combined summary to this registry.
     *
     * @param collectionName the collection name
     * @param suites suppliers that run one suite each and return its summary
     * @return this registry
     */
    public Registry addCollection(String collectionName, List<Supplier<CheckSummary>> suites) {
        Objects.requireNonNull(collectionName, "collectionName");
        Objects.requireNonNull(suites, "suites");
        collectionSender.msg(COLLECTION_DEPTH, collectionName);

        CheckSummary collection = new CheckSummary();
        for (int i = 0; i < suites.size(); i++) {
            try {
                CheckSummary result = suites.get(i).get();
                collection.merge(Objects.requireNonNull(result, "suite returned no summary"));
            } catch (RuntimeException e) {
                logger.error("suite {} of collection '{}' failed", i, collectionName, e);
                collectionSender.err(COLLECTION_DEPTH, "suite %d threw %s: %s",
                        i, e.getClass().getSimpleName(), String.valueOf(e.getMessage()));
                collection.add(false);
            }
        }

        collectionSender.msg(COLLECTION_DEPTH, "%s %s", collectionName, collection.summaryString());
        summary.merge(collection);
        return this;
    }

    /**
     * @return the process exit code for this run: 0 when no check failed, 1 otherwise
     */
    public int conclude() {
        return summary.failed() == 0 ? 0 : 1;
    }

    public CheckSummary summary() {
        return summary.copy();
    }

    public String getName() {
        return name;
    }

    /**
     * Logs the overall summary line. Later calls do nothing.
     */
    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        registrySender.msg("} %s", summary.summaryString());
    }
}
