/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.fp.list;

import java.util.Properties;

import org.junit.After;
import org.junit.Test;
import static org.hamcrest.CoreMatchers.*;
import static org.junit.Assert.*;

public class ListConfigTest
{
    @After
    public void clearSystemProperties() {
        System.clearProperty(ListConfig.SHOW_LIMIT_KEY);
        System.clearProperty(ListConfig.SORT_STABLE_KEY);
    }

    @Test
    public void defaultsWhenNothingConfigured() {
        ListConfig config = ListConfig.from(new Properties());
        assertEquals(ListConfig.DEFAULT_SHOW_LIMIT, config.showLimit());
        assertEquals(ListConfig.DEFAULT_SORT_STABLE, config.sortStable());
    }

    @Test
    public void readsProperties() {
        Properties props = new Properties();
        props.setProperty(ListConfig.SHOW_LIMIT_KEY, " 5 ");
        props.setProperty(ListConfig.SORT_STABLE_KEY, "TRUE");

        ListConfig config = ListConfig.from(props);
        assertEquals(5, config.showLimit());
        assertTrue(config.sortStable());
    }

    @Test
    public void systemPropertyTakesPrecedence() {
        Properties props = new Properties();
        props.setProperty(ListConfig.SHOW_LIMIT_KEY, "5");
        System.setProperty(ListConfig.SHOW_LIMIT_KEY, "7");

        assertEquals(7, ListConfig.from(props).showLimit());
    }

    @Test
    public void invalidValuesFallBackToDefaults() {
        Properties props = new Properties();
        props.setProperty(ListConfig.SHOW_LIMIT_KEY, "lots");
        props.setProperty(ListConfig.SORT_STABLE_KEY, "maybe");

        ListConfig config = ListConfig.from(props);
        assertEquals(ListConfig.DEFAULT_SHOW_LIMIT, config.showLimit());
        assertEquals(ListConfig.DEFAULT_SORT_STABLE, config.sortStable());

        props.setProperty(ListConfig.SHOW_LIMIT_KEY, "-3");
        assertEquals(ListConfig.DEFAULT_SHOW_LIMIT, ListConfig.from(props).showLimit());
    }

    @Test
    public void defaultConfigurationIsLoadedFromClasspath() {
        ListConfig config = ListConfig.getDefault();
        assertSame(config, ListConfig.getDefault());
        assertEquals(100, config.showLimit());
        assertThat(config.toString(), containsString("showLimit=100"));
    }
}
