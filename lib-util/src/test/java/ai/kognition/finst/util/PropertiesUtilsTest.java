/*
 * Copyright 2022 Jim Carroll
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

package ai.kognition.finst.util;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import java.util.Arrays;
import java.util.Properties;

import org.junit.Test;

public class PropertiesUtilsTest {

    private static Properties props() {
        final Properties props = new Properties();
        props.setProperty("finst.tracker.noise-center", "0.25");
        props.setProperty("finst.tracker.num-hats", "7");
        props.setProperty("finst.tracker.distance-buckets", "0, 10,20.5");
        props.setProperty("finst.other.noise-center", "99");
        props.setProperty("finst.tracker", "top");
        return props;
    }

    @Test
    public void sectionStripsThePrefix() {
        final Properties section = PropertiesUtils.getSection(props(), "finst.tracker", true);
        assertEquals(3, section.size());
        assertEquals("0.25", section.getProperty("noise-center"));
        assertNull(section.getProperty("finst.tracker"));
    }

    @Test
    public void sectionCanKeepThePrefix() {
        final Properties section = PropertiesUtils.getSection(props(), "finst.tracker", false);
        assertEquals(4, section.size());
        assertEquals("top", section.getProperty("finst.tracker"));
        assertEquals("7", section.getProperty("finst.tracker.num-hats"));
    }

    @Test
    public void typedGetters() {
        final Properties section = PropertiesUtils.getSection(props(), "finst.tracker", true);
        assertEquals(0.25, PropertiesUtils.getDouble(section, "noise-center", 0.0), 0.0);
        assertEquals(1.5, PropertiesUtils.getDouble(section, "missing", 1.5), 0.0);
        assertEquals(7, PropertiesUtils.getInt(section, "num-hats", 5));
        assertNull(PropertiesUtils.getOptionalDouble(section, "max-distance"));
        assertEquals(Arrays.asList(0.0, 10.0, 20.5), PropertiesUtils.getDoubleList(section, "distance-buckets"));
    }

    @Test(expected = IllegalArgumentException.class)
    public void badNumberNamesTheKey() {
        final Properties props = new Properties();
        props.setProperty("hat-k", "big");
        PropertiesUtils.getDouble(props, "hat-k", 1.0);
    }

    @Test
    public void missingResourceIsReported() {
        assertFalse(PropertiesUtils.loadResource(new Properties(), "does-not-exist.properties"));
    }

    @Test
    public void resourceLoads() {
        final Properties props = new Properties();
        assertTrue(PropertiesUtils.loadResource(props, "util-test.properties"));
        assertEquals("hello", props.getProperty("greeting"));
    }
}
