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

import java.util.Arrays;
import java.util.Collections;
import java.util.Locale;
import java.util.Properties;

import org.testng.Assert;
import org.testng.annotations.Test;

public class AutomataKitSettingsTest {

    private enum Mode {
        STRICT,
        LENIENT
    }

    @Test
    public void readsPropertiesResource() {
        final AutomataKitSettings settings = AutomataKitSettings.getInstance();

        Assert.assertEquals(settings.getProperty(AutomataKitProperty.PARSER_MODE), "lenient");
        Assert.assertEquals(settings.getEnumValue(AutomataKitProperty.PARSER_MODE, Mode.class, Mode.STRICT),
                            Mode.LENIENT);
        Assert.assertEquals(settings.getList(AutomataKitProperty.EPSILON_SYMBOLS, Collections.emptyList()),
                            Arrays.asList("eps", "lambda"));
    }

    @Test
    public void systemPropertyOverridesFile() {
        final String key = AutomataKitProperty.PARSER_MODE.getPropertyKey();
        System.setProperty(key, "strict");
        try {
            Assert.assertEquals(AutomataKitSettings.getInstance()
                                                   .getEnumValue(AutomataKitProperty.PARSER_MODE,
                                                                 Mode.class,
                                                                 Mode.LENIENT), Mode.STRICT);
        } finally {
            System.clearProperty(key);
        }
    }

    @Test
    public void fallsBackToDefaults() {
        final AutomataKitSettings empty = new AutomataKitSettings(new Properties());

        Assert.assertNull(empty.getProperty(AutomataKitProperty.EPSILON_SYMBOLS));
        Assert.assertEquals(empty.getProperty(AutomataKitProperty.EPSILON_SYMBOLS, "x"), "x");
        Assert.assertEquals(empty.getList(AutomataKitProperty.EPSILON_SYMBOLS, Collections.singletonList("ε")),
                            Collections.singletonList("ε"));
    }

    @Test
    public void invalidEnumValueFallsBack() {
        final Properties props = new Properties();
        props.setProperty(AutomataKitProperty.PARSER_MODE.getPropertyKey(), "sloppy");
        final AutomataKitSettings settings = new AutomataKitSettings(props);

        Assert.assertEquals(settings.getEnumValue(AutomataKitProperty.PARSER_MODE, Mode.class, Mode.STRICT),
                            Mode.STRICT);
    }

    @Test
    public void enumValueIgnoresDefaultLocale() {
        final Properties props = new Properties();
        props.setProperty(AutomataKitProperty.PARSER_MODE.getPropertyKey(), "lenient");
        final AutomataKitSettings settings = new AutomataKitSettings(props);

        final Locale previous = Locale.getDefault();
        Locale.setDefault(new Locale("tr", "TR"));
        try {
            Assert.assertEquals(settings.getEnumValue(AutomataKitProperty.PARSER_MODE, Mode.class, Mode.STRICT),
                                Mode.LENIENT);
        } finally {
            Locale.setDefault(previous);
        }
    }

    @Test
    public void listKeepsEmptyEntries() {
        final Properties props = new Properties();
        props.setProperty(AutomataKitProperty.EPSILON_SYMBOLS.getPropertyKey(), " , eps ,lambda");
        final AutomataKitSettings settings = new AutomataKitSettings(props);

        Assert.assertEquals(settings.getList(AutomataKitProperty.EPSILON_SYMBOLS, Collections.emptyList()),
                            Arrays.asList("", "eps", "lambda"));
    }
}
