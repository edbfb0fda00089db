/*
 * ComponentRegistry.java
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

import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.text.MessageFormat;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.ResourceBundle;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Small dependency injection container for almanac components.
 *
 * <p>Components are created lazily by id, wired through their setters
 * (hyphenated property names map to camel case, so {@code drift-tolerance}
 * is injected through {@code setDriftTolerance}) and then given the chance
 * to validate themselves through an optional no-argument {@code init}
 * method.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class ComponentRegistry {

    private static final Logger LOGGER = Logger.getLogger(ComponentRegistry.class.getName());
    private static final ResourceBundle L10N = ResourceBundle.getBundle("org.bluezoo.almanac.config.L10N");

    private final Map<String, ComponentDefinition> definitions = new LinkedHashMap<String, ComponentDefinition>();
    private final Map<String, Object> singletons = new ConcurrentHashMap<String, Object>();
    private final ThreadLocal<Set<ComponentDefinition>> constructing = new ThreadLocal<Set<ComponentDefinition>>() {
        @Override
        protected Set<ComponentDefinition> initialValue() {
            return new HashSet<ComponentDefinition>();
        }
    };

    /**
     * Register a component definition.
     *
     * @param id the unique component identifier
     * @param definition the component definition
     * @throws IllegalArgumentException if id is null or already registered
     */
    public void register(String id, ComponentDefinition definition) {
        if (id == null || id.isEmpty()) {
            throw new IllegalArgumentException(L10N.getString("err.empty_id"));
        }
        if (definitions.containsKey(id)) {
            throw new IllegalArgumentException(MessageFormat.format(
                    L10N.getString("err.duplicate_id"), id));
        }
        definitions.put(id, definition);

        if (LOGGER.isLoggable(Level.FINE)) {
            LOGGER.fine(MessageFormat.format(L10N.getString("log.registered"),
                    id, definition.getComponentClass().getName()));
        }
    }

    /**
     * Get or create a component instance by ID.
     *
     * @param id the component identifier
     * @param type the expected component type
     * @return the component instance
     * @throws IllegalArgumentException if no component registered with this id
     * @throws ConfigurationException if the component cannot be created
     * @throws ClassCastException if component is not of expected type
     */
    public <T> T getComponent(String id, Class<T> type) {
        ComponentDefinition def = definitions.get(id);
        if (def == null) {
            throw new IllegalArgumentException(MessageFormat.format(
                    L10N.getString("err.no_component"), id));
        }
        if (def.isSingleton()) {
            Object singleton = singletons.get(id);
            if (singleton == null) {
                singleton = createComponent(def);
                singletons.put(id, singleton);
            }
            return type.cast(singleton);
        }
        return type.cast(createComponent(def));
    }

    /**
     * Check if a component with the given ID is registered.
     *
     * @param id the component identifier
     * @return true if registered, false otherwise
     */
    public boolean hasComponent(String id) {
        return definitions.containsKey(id);
    }

    /**
     * Get all components of a given type, in declaration order.
     * This will instantiate all matching components.
     *
     * @param type the component type
     * @return collection of all matching components
     */
    public <T> Collection<T> getComponentsOfType(Class<T> type) {
        List<T> result = new ArrayList<T>();
        for (Map.Entry<String, ComponentDefinition> entry : definitions.entrySet()) {
            if (type.isAssignableFrom(entry.getValue().getComponentClass())) {
                result.add(getComponent(entry.getKey(), type));
            }
        }
        return result;
    }

    /**
     * Get all registered component IDs.
     *
     * @return set of all component IDs
     */
    public Set<String> getComponentIds() {
        return definitions.keySet();
    }

    private Object createComponent(ComponentDefinition def) {
        String label = def.getId() != null ? def.getId() : def.getComponentClass().getSimpleName();

        Set<ComponentDefinition> currentlyConstructing = constructing.get();
        if (!currentlyConstructing.add(def)) {
            throw new ConfigurationException(MessageFormat.format(
                    L10N.getString("err.circular"), label));
        }
        try {
            Object instance = def.getComponentClass().getDeclaredConstructor().newInstance();
            if (LOGGER.isLoggable(Level.FINE)) {
                LOGGER.fine(MessageFormat.format(L10N.getString("log.creating"), label));
            }
            for (PropertyDefinition prop : def.getProperties()) {
                injectProperty(instance, prop);
            }
            invokeLifecycleMethod(instance, "init");
            return instance;
        } catch (ConfigurationException e) {
            throw e;
        } catch (InvocationTargetException e) {
            throw new ConfigurationException(MessageFormat.format(
                    L10N.getString("err.create"), label, e.getCause().getMessage()), e.getCause());
        } catch (ReflectiveOperationException e) {
            throw new ConfigurationException(MessageFormat.format(
                    L10N.getString("err.create"), label, e.getMessage()), e);
        } finally {
            currentlyConstructing.remove(def);
        }
    }

    private void injectProperty(Object target, PropertyDefinition prop) throws ReflectiveOperationException {
        String propertyName = prop.getName();
        Object value = resolveValue(prop.getValue());

        String methodName = toCamelCase("set" + Character.toUpperCase(propertyName.charAt(0))
                + propertyName.substring(1));

        Method setter = findSetter(target.getClass(), methodName, value);
        if (setter == null) {
            throw new ConfigurationException(MessageFormat.format(
                    L10N.getString("err.no_setter"), propertyName, target.getClass().getName()));
        }
        setter.invoke(target, convertValue(value, setter.getParameterTypes()[0]));

        if (LOGGER.isLoggable(Level.FINEST)) {
            LOGGER.finest(MessageFormat.format(L10N.getString("log.injected"),
                    propertyName, target.getClass().getSimpleName()));
        }
    }

    static String toCamelCase(String name) {
        // "setDrift-tolerance" -> "setDriftTolerance"
        int hyphenIndex = name.indexOf('-');
        while (hyphenIndex != -1 && hyphenIndex < name.length() - 1) {
            name = name.substring(0, hyphenIndex)
                    + Character.toUpperCase(name.charAt(hyphenIndex + 1))
                    + name.substring(hyphenIndex + 2);
            hyphenIndex = name.indexOf('-');
        }
        return name;
    }

    private Method findSetter(Class<?> clazz, String methodName, Object value) {
        Method convertible = null;
        for (Method method : clazz.getMethods()) {
            if (method.getName().equals(methodName) && method.getParameterCount() == 1) {
                Class<?> paramType = method.getParameterTypes()[0];
                if (value == null) {
                    return method;
                }
                // Exact matches win over overloads that need a conversion
                if (paramType.isAssignableFrom(value.getClass())) {
                    return method;
                }
                if (convertible == null && canConvert(value, paramType)) {
                    convertible = method;
                }
            }
        }
        return convertible;
    }

    private Object resolveValue(Object value) {
        if (value instanceof ComponentReference) {
            return getComponent(((ComponentReference) value).getRefId(), Object.class);
        } else if (value instanceof ComponentDefinition) {
            // Inline anonymous component
            return createComponent((ComponentDefinition) value);
        } else if (value instanceof MapValue) {
            Map<Object, Object> result = new LinkedHashMap<Object, Object>();
            for (Map.Entry<Object, Object> entry : ((MapValue) value).getEntries().entrySet()) {
                result.put(entry.getKey(), resolveValue(entry.getValue()));
            }
            return result;
        }
        return value;
    }

    private Object convertValue(Object value, Class<?> targetType) {
        if (value == null || targetType.isAssignableFrom(value.getClass())) {
            return value;
        }
        if (value instanceof String) {
            String str = ((String) value).trim();
            if (targetType == int.class || targetType == Integer.class) {
                return Integer.parseInt(str);
            }
            if (targetType == long.class || targetType == Long.class) {
                return Long.parseLong(str);
            }
            if (targetType == boolean.class || targetType == Boolean.class) {
                return Boolean.parseBoolean(str);
            }
            if (targetType == java.io.File.class) {
                return new java.io.File(str);
            }
        }
        return value;
    }

    private boolean canConvert(Object value, Class<?> targetType) {
        if (value instanceof String) {
            return targetType == int.class || targetType == Integer.class
                    || targetType == long.class || targetType == Long.class
                    || targetType == boolean.class || targetType == Boolean.class
                    || targetType == java.io.File.class;
        }
        return false;
    }

    private void invokeLifecycleMethod(Object instance, String methodName) throws ReflectiveOperationException {
        Method method;
        try {
            method = instance.getClass().getMethod(methodName);
        } catch (NoSuchMethodException e) {
            // Lifecycle method not present
            return;
        }
        method.invoke(instance);
        if (LOGGER.isLoggable(Level.FINE)) {
            LOGGER.fine(MessageFormat.format(L10N.getString("log.lifecycle"),
                    methodName, instance.getClass().getSimpleName()));
        }
    }
}
