/*
 * ParseResult.java
 * Copyright (C) 2025 Chris Burdess
 *
 * This file is part of almanac, a recurring-event timekeeping library.
 * For more information please visit https://www.nongnu.org/gumdrop/
 *
 * almanac is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Lesser General Public License as published by
 * the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * almanac is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU Lesser General Public License for more details.
 *
 * You should have received a copy of the GNU Lesser General Public License
 * along with almanac.  If not, see <http://www.gnu.org/licenses/>.
 */

package org.bluezoo.almanac.config;

import java.text.MessageFormat;
import java.util.Collection;
import java.util.ResourceBundle;

/**
 * Result of parsing a configuration file.
 * Provides access to the component registry and to the engine
 * configuration it declares.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class ParseResult {

    private static final ResourceBundle L10N = ResourceBundle.getBundle("org.bluezoo.almanac.config.L10N");

    private final ComponentRegistry registry;

    /**
     * @param registry the component registry containing all parsed components
     */
    public ParseResult(ComponentRegistry registry) {
        if (registry == null) {
            throw new IllegalArgumentException("registry");
        }
        this.registry = registry;
    }

    public ComponentRegistry getRegistry() {
        return registry;
    }

    /**
     * Returns the single engine configuration declared in the file.
     * A file without an {@code engine} element yields the defaults.
     *
     * @return the engine configuration
     * @throws ConfigurationException if more than one engine is declared
     */
    public EngineConfiguration getEngineConfiguration() {
        Collection<EngineConfiguration> engines = registry.getComponentsOfType(EngineConfiguration.class);
        if (engines.isEmpty()) {
            EngineConfiguration defaults = new EngineConfiguration();
            defaults.init();
            return defaults;
        }
        if (engines.size() > 1) {
            throw new ConfigurationException(MessageFormat.format(
                    L10N.getString("err.multiple_engines"), engines.size()));
        }
        return engines.iterator().next();
    }

    /**
     * Gets a specific component by ID.
     *
     * @param id the component ID
     * @param type the expected type
     * @return the component instance
     */
    public <T> T getComponent(String id, Class<T> type) {
        return registry.getComponent(id, type);
    }

    /**
     * Gets all components of a specific type.
     *
     * @param type the component type
     * @return collection of all matching components
     */
    public <T> Collection<T> getComponentsOfType(Class<T> type) {
        return registry.getComponentsOfType(type);
    }
}
