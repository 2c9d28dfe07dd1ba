/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.fp.list;

import java.io.IOException;
import java.io.InputStream;
import java.util.Optional;
import java.util.Properties;
import java.util.function.Supplier;
import java.util.logging.Level;
import java.util.logging.Logger;
import static java.util.Objects.requireNonNull;

import com.google.common.base.MoreObjects;
import com.google.common.base.Suppliers;
import com.google.common.primitives.Ints;

/**
 * Library settings. A value is looked up in the JVM system properties first,
 * then in the {@value #RESOURCE} classpath resource, and finally falls back
 * to a built-in default.
 */
public final class ListConfig
{
    private static final Logger logger = Logger.getLogger(ListConfig.class.getName());

    static final String RESOURCE = "/cloudway-plist.properties";

    public static final String SHOW_LIMIT_KEY = "cloudway.plist.show.limit";
    public static final String SORT_STABLE_KEY = "cloudway.plist.sort.stable";

    static final int DEFAULT_SHOW_LIMIT = 100;
    static final boolean DEFAULT_SORT_STABLE = false;

    private static final Supplier<ListConfig> DEFAULT =
        Suppliers.memoize(() -> from(loadResource()));

    private final int showLimit;
    private final boolean sortStable;

    private ListConfig(int showLimit, boolean sortStable) {
        this.showLimit = showLimit;
        this.sortStable = sortStable;
    }

    /**
     * Returns the settings loaded when first requested. Later changes to
     * system properties are not observed.
     */
    public static ListConfig getDefault() {
        return DEFAULT.get();
    }

    /**
     * Resolve settings against the given properties, with system properties
     * taking precedence.
     */
    static ListConfig from(Properties props) {
        requireNonNull(props);
        int showLimit = getInt(props, SHOW_LIMIT_KEY, DEFAULT_SHOW_LIMIT);
        if (showLimit < 0) {
            logger.warning("Negative value for " + SHOW_LIMIT_KEY + ": " + showLimit +
                           ", using default " + DEFAULT_SHOW_LIMIT);
            showLimit = DEFAULT_SHOW_LIMIT;
        }
        boolean sortStable = getBoolean(props, SORT_STABLE_KEY, DEFAULT_SORT_STABLE);

        ListConfig config = new ListConfig(showLimit, sortStable);
        logger.fine(() -> "Loaded list configuration " + config);
        return config;
    }

    private static Properties loadResource() {
        Properties props = new Properties();
        try (InputStream in = ListConfig.class.getResourceAsStream(RESOURCE)) {
            if (in != null) {
                props.load(in);
            }
        } catch (IOException ex) {
            logger.log(Level.WARNING, "Failed to read " + RESOURCE + ", using defaults", ex);
        }
        return props;
    }

    private static Optional<String> get(Properties props, String name) {
        Optional<String> val = Optional.ofNullable(System.getProperty(name));
        return val.isPresent() ? val : Optional.ofNullable(props.getProperty(name));
    }

    private static int getInt(Properties props, String name, int deflt) {
        Optional<String> val = get(props, name).map(String::trim);
        if (!val.isPresent())
            return deflt;

        Integer n = Ints.tryParse(val.get());
        if (n == null) {
            logger.warning("Invalid integer for " + name + ": " + val.get() +
                           ", using default " + deflt);
            return deflt;
        }
        return n;
    }

    private static boolean getBoolean(Properties props, String name, boolean deflt) {
        Optional<String> val = get(props, name).map(String::trim);
        if (!val.isPresent())
            return deflt;

        if ("true".equalsIgnoreCase(val.get()))
            return true;
        if ("false".equalsIgnoreCase(val.get()))
            return false;
        logger.warning("Invalid boolean for " + name + ": " + val.get() +
                       ", using default " + deflt);
        return deflt;
    }

    /**
     * Returns the maximum number of elements rendered by {@link PList#toString()}.
     */
    public int showLimit() {
        return showLimit;
    }

    /**
     * Returns whether {@link PList#sorted(java.util.Comparator)} sorts stably when no flag is given.
     */
    public boolean sortStable() {
        return sortStable;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
            .add("showLimit", showLimit)
            .add("sortStable", sortStable)
            .toString();
    }
}
