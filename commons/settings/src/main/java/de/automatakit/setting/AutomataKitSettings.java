/* Copyright (C) 2024 The AutomataKit Authors
 * This file is part of AutomataKit.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package de.automatakit.setting;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;
import java.util.Locale;
import java.util.Properties;

import com.google.common.base.Splitter;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Global, read-only configuration. Values are read once from the {@code automatakit.properties} resource (if present)
 * and overlaid with JVM system properties of the same name.
 */
public final class AutomataKitSettings {

    public static final String PROPERTIES_RESOURCE = "/automatakit.properties";

    private static final Logger LOGGER = LoggerFactory.getLogger(AutomataKitSettings.class);

    private static final AutomataKitSettings INSTANCE = new AutomataKitSettings(loadDefaults());

    private final Properties properties;

    AutomataKitSettings(Properties properties) {
        this.properties = properties;
    }

    public static AutomataKitSettings getInstance() {
        return INSTANCE;
    }

    private static Properties loadDefaults() {
        final Properties props = new Properties();
        try (InputStream is = AutomataKitSettings.class.getResourceAsStream(PROPERTIES_RESOURCE)) {
            if (is != null) {
                props.load(is);
            }
        } catch (IOException ex) {
            LOGGER.warn("Could not read {}, using built-in defaults", PROPERTIES_RESOURCE, ex);
        }
        return props;
    }

    /**
     * Looks up the raw value of a property. System properties override the properties file.
     *
     * @param property
     *         the property to look up
     *
     * @return the value, or {@code null} if the property is not set
     */
    public @Nullable String getProperty(AutomataKitProperty property) {
        final String key = property.getPropertyKey();
        final String sysValue = System.getProperty(key);
        if (sysValue != null) {
            return sysValue;
        }
        return properties.getProperty(key);
    }

    public String getProperty(AutomataKitProperty property, String defaultValue) {
        final String value = getProperty(property);
        return value == null ? defaultValue : value;
    }

    /**
     * Looks up an enum-valued property. Unknown values are logged and replaced by the default.
     *
     * @param property
     *         the property to look up
     * @param enumClazz
     *         the enum type
     * @param defaultValue
     *         the value to use if the property is unset or invalid
     * @param <E>
     *         enum type
     *
     * @return the configured value
     */
    public <E extends Enum<E>> E getEnumValue(AutomataKitProperty property, Class<E> enumClazz, E defaultValue) {
        final String value = getProperty(property);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Enum.valueOf(enumClazz, value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            LOGGER.warn("Invalid value '{}' for property {}, falling back to {}", value, property, defaultValue);
            return defaultValue;
        }
    }

    /**
     * Looks up a comma-separated list property. Empty entries are kept, so {@code ",eps"} yields the empty string and
     * {@code eps}.
     *
     * @param property
     *         the property to look up
     * @param defaultValue
     *         the list to use if the property is unset
     *
     * @return the trimmed entries of the list
     */
    public List<String> getList(AutomataKitProperty property, List<String> defaultValue) {
        final String value = getProperty(property);
        if (value == null) {
            return defaultValue;
        }
        return Splitter.on(',').trimResults().splitToList(value);
    }
}
