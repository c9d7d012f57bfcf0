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

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.InputStream;
import java.time.Duration;
import java.util.Locale;
import java.util.Properties;

/**
 * Resolves warpkit configuration values. A key is looked up, in order, in:
 * <ol>
 *   <li>JVM system properties ({@code -Dwarpkit.log.color=plain})</li>
 *   <li>an optional {@value #USER_RESOURCE} on the classpath</li>
 *   <li>the {@value #BUILD_RESOURCE} written by the build</li>
 * </ol>
 * and falls back to the caller's default when none of them defines it. Malformed values are
 * reported through Log4j and replaced by the default rather than failing the caller.
 *
 * <p>The build resource is filtered by Maven: the {@code release} profile sets
 * {@code warpkit.debug=false}, which turns {@link #DEBUG_ENABLED} off for the whole process.</p>
 *
 * @since 1.0.0
 */
public final class WarpkitSettings {

    private static final Logger logger = LogManager.getLogger(WarpkitSettings.class);

    /** Color mode of the default console sink: {@code auto}, {@code ansi} or {@code plain}. */
    public static final String COLOR = "warpkit.log.color";
    /** Whether {@code dbg(...)} calls emit anything. */
    public static final String DEBUG = "warpkit.log.debug";
    /** Refresh interval, in milliseconds, of the cached timestamp of a {@link TimedSender}. */
    public static final String TIMESTAMP_REFRESH_MS = "warpkit.log.timestamp.refresh.ms";
    /** Default display unit of timers: {@code us}, {@code ms} or {@code s}. */
    public static final String TIMER_UNIT = "warpkit.timer.unit";
    /** Default number of benchmark samples. */
    public static final String BENCH_SAMPLES = "warpkit.bench.samples";

    static final String USER_RESOURCE = "warpkit.properties";
    static final String BUILD_RESOURCE = "warpkit-build.properties";

    private static final Properties fileProperties = loadFileProperties();

    /**
     * Debug logging switch, fixed when this class initializes. Being a {@code static final}
     * field, a disabled value lets the JIT drop {@code dbg(...)} bodies entirely.
     */
    public static final boolean DEBUG_ENABLED = getBoolean(DEBUG, true);

    private static Properties loadFileProperties() {
        Properties merged = new Properties();
        load(BUILD_RESOURCE, merged);
        load(USER_RESOURCE, merged);
        return merged;
    }

    private static void load(String resource, Properties into) {
        ClassLoader loader = WarpkitSettings.class.getClassLoader();
        try (InputStream in = loader.getResourceAsStream(resource)) {
            if (in == null) {
                logger.debug("no {} on the classpath", resource);
                return;
            }
            Properties loaded = new Properties();
            loaded.load(in);
            into.putAll(loaded);
            logger.debug("loaded {} settings from {}", loaded.size(), resource);
        } catch (IOException | IllegalArgumentException e) {
            logger.warn("unable to read {}, ignoring it: {}", resource, e.getMessage());
        }
    }

    /**
     * Returns the raw value of a key, or the fallback when no source defines it.
     *
     * @param key the settings key
     * @param fallback the value to use when the key is undefined
     * @return the trimmed value or the fallback
     */
    public static String getString(String key, String fallback) {
        String value = System.getProperty(key);
        if (value == null) {
            value = fileProperties.getProperty(key);
        }
        return value == null ? fallback : value.trim();
    }

    public static boolean getBoolean(String key, boolean fallback) {
        String value = getString(key, null);
        if (value == null) {
            return fallback;
        }
        switch (value.toLowerCase(Locale.ROOT)) {
            case "true":
            case "yes":
            case "on":
                return true;
            case "false":
            case "no":
            case "off":
                return false;
            default:
                logger.warn("invalid boolean '{}' for {}, using {}", value, key, fallback);
                return fallback;
        }
    }

    public static int getInt(String key, int fallback) {
        String value = getString(key, null);
        if (value == null) {
            return fallback;
        }
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            logger.warn("invalid integer '{}' for {}, using {}", value, key, fallback);
            return fallback;
        }
    }

    /**
     * Reads a non-negative millisecond value as a {@link Duration}.
     *
     * @param key the settings key
     * @param fallback the duration to use when the key is undefined or invalid
     * @return the configured duration
     */
    public static Duration getMillis(String key, Duration fallback) {
        String value = getString(key, null);
        if (value == null) {
            return fallback;
        }
        try {
            long millis = Long.parseLong(value);
            if (millis < 0) {
                logger.warn("negative duration '{}' for {}, using {}", value, key, fallback);
                return fallback;
            }
            return Duration.ofMillis(millis);
        } catch (NumberFormatException e) {
            logger.warn("invalid millisecond value '{}' for {}, using {}", value, key, fallback);
            return fallback;
        }
    }

    private WarpkitSettings() {
        throw new UnsupportedOperationException("Utility class should not be instantiated");
    }
}
