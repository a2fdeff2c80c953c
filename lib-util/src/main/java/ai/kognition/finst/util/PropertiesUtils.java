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

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Properties;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Helpers for reading typed, sectioned configuration out of a {@link Properties}.
 * <p>
 * Keys are grouped into sections by a dotted prefix. For example, given
 *
 * <pre>
 * <code>
 * finst.tracker.noise-center=0.2
 * finst.tracker.matcher=ONE_TO_ONE
 * </code>
 * </pre>
 *
 * {@code getSection(props, "finst.tracker", true)} returns a {@link Properties} with the keys
 * {@code noise-center} and {@code matcher}.
 */
public class PropertiesUtils {
    private static final Logger LOGGER = LoggerFactory.getLogger(PropertiesUtils.class);

    public static final char SECTION_DELIMITER = '.';

    /**
     * The entries of {@code props} whose keys fall under {@code section}, meaning keys of the form
     * {@code <section>.<rest>}.
     *
     * @param stripSection when true the keys in the result are just {@code <rest>}. When false they're left whole and
     *     an entry keyed by exactly {@code section} is included too.
     */
    public static Properties getSection(final Properties props, final String section, final boolean stripSection) {
        final String prefix = section + SECTION_DELIMITER;
        final Properties ret = new Properties();
        props.stringPropertyNames().stream()
            .filter(k -> k.startsWith(prefix) || (!stripSection && k.equals(section)))
            .forEach(k -> ret.setProperty(stripSection ? k.substring(prefix.length()) : k, props.getProperty(k)));
        return ret;
    }

    /**
     * Load the classpath resource {@code resourceName} into {@code p}.
     *
     * @return false if the resource doesn't exist or can't be read.
     */
    public static boolean loadResource(final Properties p, final String resourceName) {
        final ClassLoader loader = Thread.currentThread().getContextClassLoader() != null ? Thread.currentThread().getContextClassLoader()
            : PropertiesUtils.class.getClassLoader();
        try(InputStream is = loader.getResourceAsStream(resourceName)) {
            if(is == null) {
                LOGGER.warn("Couldn't find properties resource {} on the classpath", resourceName);
                return false;
            }
            p.load(is);
        } catch(final IOException ioe) {
            LOGGER.warn("Couldn't load properties from {}", resourceName, ioe);
            return false;
        }

        return true;
    }

    public static String getString(final Properties props, final String key, final String defaultValue) {
        final String val = props.getProperty(key);
        return val == null || val.trim().isEmpty() ? defaultValue : val.trim();
    }

    public static double getDouble(final Properties props, final String key, final double defaultValue) {
        final String val = getString(props, key, null);
        return val == null ? defaultValue : parseDouble(key, val);
    }

    /**
     * @return the value for {@code key} or {@code null} when it's not set. This is for options that are off
     *     unless explicitly configured.
     */
    public static Double getOptionalDouble(final Properties props, final String key) {
        final String val = getString(props, key, null);
        return val == null ? null : parseDouble(key, val);
    }

    public static int getInt(final Properties props, final String key, final int defaultValue) {
        final String val = getString(props, key, null);
        if(val == null)
            return defaultValue;
        try {
            return Integer.parseInt(val);
        } catch(final NumberFormatException nfe) {
            throw new IllegalArgumentException("The property \"" + key + "\" should be an integer but was \"" + val + "\"", nfe);
        }
    }

    /**
     * Parse a comma separated list of numbers.
     *
     * @return the list, or {@code null} when the key isn't set.
     */
    public static List<Double> getDoubleList(final Properties props, final String key) {
        final String val = getString(props, key, null);
        if(val == null)
            return null;
        final List<Double> ret = new ArrayList<>();
        for(final String cur: val.split(","))
            ret.add(parseDouble(key, cur.trim()));
        return ret;
    }

    private static double parseDouble(final String key, final String val) {
        try {
            return Double.parseDouble(val);
        } catch(final NumberFormatException nfe) {
            throw new IllegalArgumentException("The property \"" + key + "\" should be a number but was \"" + val + "\"", nfe);
        }
    }
}
