/*
 * MIT License
 *
 * Copyright (c) 2025 tinemuz
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in all
 * copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN THE
 * SOFTWARE.
 */
package com.github.tinemuz.solarhijri;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.Properties;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Immutable library settings.
 *
 * <p>The process-wide settings are read once from the classpath resource
 * <code>solarhijri.properties</code>; JVM system properties with the same keys
 * take precedence. A missing resource is fine and leaves the defaults in place.
 * Call {@link #preload()} at startup to surface configuration errors early.</p>
 *
 * <p>Settings never change after loading. Code that needs another observation
 * point or limit builds its own instance with the {@code with*} methods and
 * passes it explicitly.</p>
 */
public final class CalendarSettings {
    private static final Logger log = LoggerFactory.getLogger(CalendarSettings.class);

    static final String RESOURCE = "solarhijri.properties";
    static final String LATITUDE = "solarhijri.location.latitude";
    static final String LONGITUDE = "solarhijri.location.longitude";
    static final String ELEVATION = "solarhijri.location.elevation";
    static final String ZONE = "solarhijri.location.zone";
    static final String STRICT_FAST_RANGE = "solarhijri.fast.strict-range";
    static final String MAX_EQUINOX_STEPS = "solarhijri.equinox.max-steps";

    static final int DEFAULT_MAX_EQUINOX_STEPS = 400;

    private static final CalendarSettings DEFAULTS =
            new CalendarSettings(Location.IRAN, true, DEFAULT_MAX_EQUINOX_STEPS);

    private static volatile CalendarSettings loaded;

    private final Location defaultLocation;
    private final boolean strictFastRange;
    private final int maxEquinoxSteps;

    private CalendarSettings(Location defaultLocation, boolean strictFastRange, int maxEquinoxSteps) {
        if (defaultLocation == null)
            throw new IllegalArgumentException("default location must not be null");
        if (maxEquinoxSteps < 1)
            throw new IllegalArgumentException("max equinox steps must be positive: " + maxEquinoxSteps);
        this.defaultLocation = defaultLocation;
        this.strictFastRange = strictFastRange;
        this.maxEquinoxSteps = maxEquinoxSteps;
    }

    /** Built-in defaults: {@link Location#IRAN}, strict fast range, 400 refinement steps. */
    public static CalendarSettings defaults() {
        return DEFAULTS;
    }

    /**
     * Process-wide settings. Safe to call repeatedly; the first caller loads them.
     *
     * @throws IllegalStateException if the settings resource cannot be read or parsed
     */
    public static CalendarSettings get() {
        CalendarSettings s = loaded;
        if (s != null) return s;
        return ensureLoaded();
    }

    /** Load the settings now so that configuration errors show up at startup. */
    public static void preload() {
        CalendarSettings s = get();
        log.info("Solar Hijri calendar settings: location {}, strict fast range {}, max equinox steps {}",
                s.defaultLocation, s.strictFastRange, s.maxEquinoxSteps);
    }

    private static synchronized CalendarSettings ensureLoaded() {
        if (loaded == null) {
            loaded = load(RESOURCE, System.getProperties());
        }
        return loaded;
    }

    /**
     * Read settings from a classpath resource, overlaid with the given overrides.
     * Only keys starting with {@code solarhijri.} are taken from the overrides.
     */
    static CalendarSettings load(String resourceName, Properties overrides) {
        Properties props = new Properties();
        InputStream in = CalendarSettings.class.getClassLoader().getResourceAsStream(resourceName);
        if (in == null) {
            log.debug("Settings resource '{}' not found on classpath, using defaults", resourceName);
        } else {
            try (Reader reader = new InputStreamReader(in, StandardCharsets.UTF_8)) {
                props.load(reader);
            } catch (IOException e) {
                log.error("Failed to read settings resource '{}'", resourceName, e);
                throw new IllegalStateException("Failed to read settings resource '" + resourceName + "'", e);
            }
        }
        for (String key : overrides.stringPropertyNames()) {
            if (key.startsWith("solarhijri.")) props.setProperty(key, overrides.getProperty(key));
        }
        return fromProperties(props);
    }

    /**
     * Build settings from properties; absent keys keep their defaults.
     *
     * @throws IllegalStateException if a value cannot be parsed or is out of range
     */
    static CalendarSettings fromProperties(Properties props) {
        try {
            Location base = DEFAULTS.defaultLocation;
            Location location = new Location(
                    parseDouble(props, LATITUDE, base.latitude()),
                    parseDouble(props, LONGITUDE, base.longitude()),
                    parseDouble(props, ELEVATION, base.elevation()),
                    parseDouble(props, ZONE, base.zone()));
            boolean strict = parseBoolean(props, STRICT_FAST_RANGE, DEFAULTS.strictFastRange);
            int maxSteps = parseInt(props, MAX_EQUINOX_STEPS, DEFAULTS.maxEquinoxSteps);
            CalendarSettings settings = new CalendarSettings(location, strict, maxSteps);
            log.debug("Loaded calendar settings: location {}, strict fast range {}, max equinox steps {}",
                    location, strict, maxSteps);
            return settings;
        } catch (IllegalArgumentException e) {
            log.error("Invalid calendar settings", e);
            throw new IllegalStateException("Invalid calendar settings: " + e.getMessage(), e);
        }
    }

    private static double parseDouble(Properties props, String key, double fallback) {
        String value = props.getProperty(key);
        if (value == null || value.isBlank()) return fallback;
        try {
            return Double.parseDouble(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(key + " is not a number: '" + value + "'", e);
        }
    }

    private static int parseInt(Properties props, String key, int fallback) {
        String value = props.getProperty(key);
        if (value == null || value.isBlank()) return fallback;
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(key + " is not an integer: '" + value + "'", e);
        }
    }

    private static boolean parseBoolean(Properties props, String key, boolean fallback) {
        String value = props.getProperty(key);
        if (value == null || value.isBlank()) return fallback;
        String v = value.trim();
        if (v.equalsIgnoreCase("true")) return true;
        if (v.equalsIgnoreCase("false")) return false;
        throw new IllegalArgumentException(key + " is not a boolean: '" + value + "'");
    }

    public Location getDefaultLocation() {
        return defaultLocation;
    }

    /** Whether {@link FastPersianCalendar} rejects years outside its supported range. */
    public boolean isStrictFastRange() {
        return strictFastRange;
    }

    /** Cap on the day-by-day refinement of the equinox search. */
    public int getMaxEquinoxSteps() {
        return maxEquinoxSteps;
    }

    public CalendarSettings withDefaultLocation(Location location) {
        return new CalendarSettings(location, strictFastRange, maxEquinoxSteps);
    }

    public CalendarSettings withStrictFastRange(boolean strict) {
        return new CalendarSettings(defaultLocation, strict, maxEquinoxSteps);
    }

    public CalendarSettings withMaxEquinoxSteps(int maxSteps) {
        return new CalendarSettings(defaultLocation, strictFastRange, maxSteps);
    }
}
