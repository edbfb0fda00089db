/*
 * ComponentDefinition.java
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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A component declared in configuration: its class and the property
 * values to inject once it has been instantiated.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class ComponentDefinition {

    private final String id;
    private final Class<?> componentClass;
    private final List<PropertyDefinition> properties = new ArrayList<PropertyDefinition>();
    private boolean singleton = true;

    /**
     * @param id the component identifier, null for inline components
     * @param componentClass the class to instantiate
     */
    public ComponentDefinition(String id, Class<?> componentClass) {
        if (componentClass == null) {
            throw new IllegalArgumentException("componentClass");
        }
        this.id = id;
        this.componentClass = componentClass;
    }

    public String getId() {
        return id;
    }

    public Class<?> getComponentClass() {
        return componentClass;
    }

    public List<PropertyDefinition> getProperties() {
        return Collections.unmodifiableList(properties);
    }

    /**
     * Returns whether one instance is shared by every reference.
     */
    public boolean isSingleton() {
        return singleton;
    }

    public void setSingleton(boolean singleton) {
        this.singleton = singleton;
    }

    public void addProperty(PropertyDefinition property) {
        properties.add(property);
    }

    @Override
    public String toString() {
        return "ComponentDefinition{id=" + id + ", class=" + componentClass.getName()
                + ", properties=" + properties.size() + "}";
    }
}
