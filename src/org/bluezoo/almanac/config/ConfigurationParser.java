/*
 * ConfigurationParser.java
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

import org.xml.sax.Attributes;
import org.xml.sax.InputSource;
import org.xml.sax.Locator;
import org.xml.sax.SAXException;
import org.xml.sax.SAXParseException;
import org.xml.sax.helpers.DefaultHandler;

import javax.xml.parsers.ParserConfigurationException;
import javax.xml.parsers.SAXParser;
import javax.xml.parsers.SAXParserFactory;
import java.io.BufferedInputStream;
import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.text.MessageFormat;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.ResourceBundle;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * SAX-based parser for the almanacrc configuration file.
 *
 * <p>Example:
 * <pre>
 * &lt;almanac&gt;
 *   &lt;timezone-database id="tzdb"/&gt;
 *   &lt;engine id="engine" drift-tolerance="90s"&gt;
 *     &lt;property name="default-timezone"&gt;Europe/London&lt;/property&gt;
 *     &lt;property name="timezone-database" ref="#tzdb"/&gt;
 *   &lt;/engine&gt;
 * &lt;/almanac&gt;
 * </pre>
 *
 * <p>Configuration format features:
 * <ul>
 * <li>Component registration with id attributes</li>
 * <li>Simple properties as attributes or {@code property} elements</li>
 * <li>References using #id syntax</li>
 * <li>Map property values</li>
 * <li>Inline component definitions</li>
 * </ul>
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class ConfigurationParser extends DefaultHandler {

    private static final Logger LOGGER = Logger.getLogger(ConfigurationParser.class.getName());
    private static final ResourceBundle L10N = ResourceBundle.getBundle("org.bluezoo.almanac.config.L10N");

    /** Default class names for configuration element types. */
    private static final Map<String, String> DEFAULT_CLASS_NAMES;
    static {
        Map<String, String> map = new LinkedHashMap<String, String>();
        map.put("engine", "org.bluezoo.almanac.config.EngineConfiguration");
        map.put("timezone-database", "org.bluezoo.almanac.tz.SystemTimezoneDatabase");
        map.put("component", "java.lang.Object");
        DEFAULT_CLASS_NAMES = map;
    }

    private ComponentRegistry registry;
    private Locator locator;
    private int anonymousCount;
    private Deque<ParseContext> contextStack = new ArrayDeque<ParseContext>();

    // Current parsing state
    private ComponentDefinition currentComponent;
    private String currentPropertyName;
    private Object currentPropertyValue;
    private StringBuilder textContent = new StringBuilder();

    /**
     * Parse a configuration file and return the result.
     *
     * @param file the configuration file
     * @return the parse result containing the component registry
     * @throws SAXException if parsing fails
     * @throws IOException if file cannot be read
     */
    public ParseResult parse(File file) throws SAXException, IOException {
        InputStream in = new BufferedInputStream(new FileInputStream(file));
        try {
            return parse(in, file.toURI().toString());
        } finally {
            in.close();
        }
    }

    /**
     * Parse configuration from a stream and return the result.
     *
     * @param in the stream, left open
     * @param systemId the system id used in error locations, or null
     * @return the parse result containing the component registry
     * @throws SAXException if parsing fails
     * @throws IOException if the stream cannot be read
     */
    public ParseResult parse(InputStream in, String systemId) throws SAXException, IOException {
        registry = new ComponentRegistry();
        contextStack.clear();
        currentComponent = null;
        anonymousCount = 0;
        InputSource source = new InputSource(in);
        if (systemId != null) {
            source.setSystemId(systemId);
        }
        try {
            SAXParserFactory factory = SAXParserFactory.newInstance();
            factory.setNamespaceAware(true);
            SAXParser parser = factory.newSAXParser();
            parser.parse(source, this);
        } catch (ParserConfigurationException e) {
            throw new SAXException(L10N.getString("err.parser"), e);
        }
        if (LOGGER.isLoggable(Level.FINE)) {
            LOGGER.fine(MessageFormat.format(L10N.getString("log.parsed"),
                    systemId, registry.getComponentIds().size()));
        }
        return new ParseResult(registry);
    }

    @Override
    public void setDocumentLocator(Locator locator) {
        this.locator = locator;
    }

    @Override
    public void startElement(String uri, String localName, String qName,
                             Attributes atts) throws SAXException {
        String name = localName != null && !localName.isEmpty() ? localName : qName;
        textContent.setLength(0);

        ParseContext currentContext = contextStack.isEmpty() ? null : contextStack.peek();

        if ("almanac".equals(name)) {
            contextStack.push(new RootContext());
        } else if ("property".equals(name)) {
            startProperty(atts);
        } else if ("ref".equals(name)) {
            handleReference(atts);
        } else if ("map".equals(name)) {
            startMap();
        } else if ("entry".equals(name)) {
            startMapEntry(atts);
        } else if (currentContext instanceof PropertyContext) {
            // Inline component definition within a property
            startComponent(name, atts, false);
        } else if (isComponentElement(name)) {
            startComponent(name, atts, true);
        } else {
            LOGGER.warning(MessageFormat.format(L10N.getString("warn.unknown_element"),
                    name, lineNumber()));
        }
    }

    @Override
    public void characters(char[] ch, int start, int length) {
        textContent.append(ch, start, length);
    }

    @Override
    public void endElement(String uri, String localName, String qName)
            throws SAXException {
        String name = localName != null && !localName.isEmpty() ? localName : qName;
        ParseContext context = contextStack.isEmpty() ? null : contextStack.peek();

        if ("almanac".equals(name)) {
            contextStack.pop();
        } else if ("property".equals(name)) {
            endProperty();
        } else if ("map".equals(name)) {
            endMap();
        } else if (context instanceof ComponentContext
                && name.equals(((ComponentContext) context).element)) {
            endComponent();
        }

        textContent.setLength(0);
    }

    private boolean isComponentElement(String name) {
        return DEFAULT_CLASS_NAMES.containsKey(name);
    }

    private void startComponent(String type, Attributes atts, boolean named) throws SAXException {
        String id = named ? atts.getValue("id") : null;
        if (named && id == null) {
            id = type + "-" + (++anonymousCount);
        }
        String className = atts.getValue("class");

        // Map element name to default class if not specified
        if (className == null) {
            className = DEFAULT_CLASS_NAMES.get(type);
            if (className == null || "java.lang.Object".equals(className)) {
                throw new SAXParseException(MessageFormat.format(
                        L10N.getString("err.no_class"), type, lineNumber()), locator);
            }
        }

        try {
            Class<?> clazz = Class.forName(className);
            ComponentDefinition component = new ComponentDefinition(id, clazz);

            // Process simple attributes as properties
            for (int i = 0; i < atts.getLength(); i++) {
                String attrName = getAttributeName(atts, i);
                if (!"id".equals(attrName) && !"class".equals(attrName)) {
                    component.addProperty(new PropertyDefinition(attrName, atts.getValue(i)));
                }
            }

            contextStack.push(new ComponentContext(type, component));
            currentComponent = component;
        } catch (ClassNotFoundException e) {
            throw new SAXParseException(MessageFormat.format(
                    L10N.getString("err.class_not_found"), className, lineNumber()), locator, e);
        }
    }

    private void endComponent() {
        ComponentContext ctx = (ComponentContext) contextStack.pop();
        ComponentDefinition component = ctx.component;

        if (component.getId() != null) {
            registry.register(component.getId(), component);
        }

        // Inside a property context this is an inline component
        ParseContext parent = contextStack.isEmpty() ? null : contextStack.peek();
        if (parent instanceof PropertyContext) {
            currentPropertyValue = component;
            ((PropertyContext) parent).hasChild = true;
        }

        currentComponent = getParentComponent();
    }

    private ComponentDefinition getParentComponent() {
        for (ParseContext ctx : contextStack) {
            if (ctx instanceof ComponentContext) {
                return ((ComponentContext) ctx).component;
            }
        }
        return null;
    }

    private void startProperty(Attributes atts) throws SAXException {
        if (currentComponent == null) {
            throw new SAXParseException(MessageFormat.format(
                    L10N.getString("err.property_outside_component"), lineNumber()), locator);
        }
        currentPropertyName = atts.getValue("name");
        if (currentPropertyName == null || currentPropertyName.isEmpty()) {
            throw new SAXParseException(MessageFormat.format(
                    L10N.getString("err.property_name"), lineNumber()), locator);
        }
        String refAttr = atts.getValue("ref");

        if (refAttr != null) {
            currentPropertyValue = parseReference(refAttr);
        } else {
            // Value will come from text content or child elements
            currentPropertyValue = null;
        }

        contextStack.push(new PropertyContext(currentPropertyName, currentComponent));
    }

    private void endProperty() {
        PropertyContext ctx = (PropertyContext) contextStack.pop();

        // If no value set by child elements, use text content
        if (currentPropertyValue == null && !ctx.hasChild) {
            String text = textContent.toString().trim();
            if (!text.isEmpty()) {
                currentPropertyValue = text;
            }
        }

        if (currentPropertyValue != null) {
            ctx.owner.addProperty(new PropertyDefinition(ctx.name, currentPropertyValue));
        }

        currentPropertyName = null;
        currentPropertyValue = null;
    }

    private void handleReference(Attributes atts) {
        String refAttr = atts.getValue("ref");
        if (refAttr == null) {
            refAttr = atts.getValue("id");
        }
        ParseContext context = contextStack.peek();
        if (refAttr != null && context instanceof PropertyContext) {
            currentPropertyValue = parseReference(refAttr);
            ((PropertyContext) context).hasChild = true;
        }
    }

    private ComponentReference parseReference(String refAttr) {
        // Remove leading # if present
        String refId = refAttr.startsWith("#") ? refAttr.substring(1) : refAttr;
        return new ComponentReference(refId);
    }

    private void startMap() {
        contextStack.push(new MapContext(new MapValue()));
    }

    private void endMap() {
        MapContext ctx = (MapContext) contextStack.pop();

        ParseContext parent = contextStack.isEmpty() ? null : contextStack.peek();
        if (parent instanceof PropertyContext) {
            currentPropertyValue = ctx.value;
            ((PropertyContext) parent).hasChild = true;
        }
    }

    private void startMapEntry(Attributes atts) throws SAXException {
        ParseContext context = contextStack.peek();
        if (!(context instanceof MapContext)) {
            throw new SAXParseException(MessageFormat.format(
                    L10N.getString("err.entry_outside_map"), lineNumber()), locator);
        }
        String key = atts.getValue("key");
        String refAttr = atts.getValue("ref");
        String valueAttr = atts.getValue("value");
        MapContext mapContext = (MapContext) context;
        if (refAttr != null) {
            mapContext.value.put(key, parseReference(refAttr));
        } else {
            mapContext.value.put(key, valueAttr);
        }
    }

    private String lineNumber() {
        return locator != null ? Integer.toString(locator.getLineNumber()) : "?";
    }

    private String getAttributeName(Attributes atts, int index) {
        String name = atts.getLocalName(index);
        return name != null && !name.isEmpty() ? name : atts.getQName(index);
    }

    // Parse context classes for tracking parser state
    private static abstract class ParseContext {}

    private static class RootContext extends ParseContext {}

    private static class ComponentContext extends ParseContext {
        final String element;
        final ComponentDefinition component;
        ComponentContext(String element, ComponentDefinition component) {
            this.element = element;
            this.component = component;
        }
    }

    private static class PropertyContext extends ParseContext {
        final String name;
        final ComponentDefinition owner;
        boolean hasChild;
        PropertyContext(String name, ComponentDefinition owner) {
            this.name = name;
            this.owner = owner;
        }
    }

    private static class MapContext extends ParseContext {
        final MapValue value;
        MapContext(MapValue value) {
            this.value = value;
        }
    }
}
