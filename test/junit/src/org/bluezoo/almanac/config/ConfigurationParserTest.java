/*
 * ConfigurationParserTest.java
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

import org.bluezoo.almanac.TimekeepingEngine;
import org.bluezoo.almanac.backfill.MemoryEventStore;
import org.bluezoo.almanac.drift.DriftDetector;
import org.bluezoo.almanac.tz.MapTimezoneDatabase;
import org.bluezoo.almanac.tz.TimezoneDatabase;
import org.junit.Before;
import org.junit.Test;
import org.xml.sax.SAXException;

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;

import static org.junit.Assert.*;

/**
 * Unit tests for {@link ConfigurationParser} and {@link ComponentRegistry}.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class ConfigurationParserTest {

    private static final String MAP_DB = "org.bluezoo.almanac.tz.MapTimezoneDatabase";

    private ConfigurationParser parser;

    @Before
    public void setUp() {
        parser = new ConfigurationParser();
    }

    private ParseResult parse(String xml) throws Exception {
        InputStream in = new ByteArrayInputStream(xml.getBytes(StandardCharsets.UTF_8));
        return parser.parse(in, null);
    }

    @Test
    public void testParseFixture() throws Exception {
        InputStream in = getClass().getResourceAsStream("/almanacrc.xml");
        assertNotNull("almanacrc.xml fixture missing", in);
        ParseResult result;
        try {
            result = parser.parse(in, "almanacrc.xml");
        } finally {
            in.close();
        }

        EngineConfiguration config = result.getEngineConfiguration();
        assertEquals(90000L, config.getDriftTolerance());
        assertEquals(500, config.getMaxQueryResults());
        assertEquals(50, config.getDefaultLimit());
        assertEquals(200, config.getBackfillChunkSize());
        assertFalse(config.isPinTimezone());
        assertEquals("Test/Plus3", config.getDefaultTimezone());

        TimezoneDatabase db = config.getTimezoneDatabase();
        assertTrue(db instanceof MapTimezoneDatabase);
        assertEquals("test-1", db.getVersion());
        assertNotNull(db.getRules("Test/Minus5"));
        assertNotNull("parent zones visible", db.getRules("Europe/Paris"));
        assertSame(db, result.getComponent("tzdb", TimezoneDatabase.class));
        assertEquals(2, result.getComponentsOfType(TimezoneDatabase.class).size());
    }

    @Test
    public void testEngineFromFixture() throws Exception {
        InputStream in = getClass().getResourceAsStream("/almanacrc.xml");
        ParseResult result;
        try {
            result = parser.parse(in, "almanacrc.xml");
        } finally {
            in.close();
        }

        TimekeepingEngine engine = new TimekeepingEngine(result.getEngineConfiguration());
        assertEquals("Test/Plus3", engine.getResolver().getDefaultTz());
        assertEquals(90000L, engine.getDriftDetector().getToleranceMs());
        assertFalse(engine.newBackfill(new MemoryEventStore()).isPinTimezone());
        assertEquals(200, engine.newBackfillOptions().getChunkSize());
    }

    @Test
    public void testDefaultsWithoutEngine() throws Exception {
        EngineConfiguration config = parse("<almanac/>").getEngineConfiguration();

        assertEquals(DriftDetector.DEFAULT_TOLERANCE_MS, config.getDriftTolerance());
        assertTrue(config.isPinTimezone());
        assertNull(config.getDefaultTimezone());
    }

    @Test
    public void testAnonymousEngineGetsId() throws Exception {
        ParseResult result = parse("<almanac><engine drift-tolerance='2m'/></almanac>");

        assertTrue(result.getRegistry().hasComponent("engine-1"));
        assertEquals(120000L, result.getEngineConfiguration().getDriftTolerance());
    }

    @Test
    public void testInlineComponent() throws Exception {
        ParseResult result = parse("<almanac><engine>"
                + "<property name='timezone-database'>"
                + "<component class='" + MAP_DB + "' version='inline'/>"
                + "</property></engine></almanac>");

        assertEquals("inline", result.getEngineConfiguration().getTimezoneDatabase().getVersion());
    }

    @Test
    public void testInvalidSettingFailsInit() throws Exception {
        ParseResult result = parse("<almanac><engine default-limit='0'/></almanac>");
        try {
            result.getEngineConfiguration();
            fail("Expected ConfigurationException");
        } catch (ConfigurationException e) {
            assertTrue(e.getMessage(), e.getMessage().contains("default-limit"));
        }
    }

    @Test
    public void testUnknownDefaultTimezone() throws Exception {
        ParseResult result = parse("<almanac><engine default-timezone='Mars/Olympus'/></almanac>");
        try {
            result.getEngineConfiguration();
            fail("Expected ConfigurationException");
        } catch (ConfigurationException e) {
            // expected
        }
    }

    @Test
    public void testBadDuration() throws Exception {
        ParseResult result = parse("<almanac><engine drift-tolerance='soon'/></almanac>");
        try {
            result.getEngineConfiguration();
            fail("Expected ConfigurationException");
        } catch (ConfigurationException e) {
            assertTrue(e.getCause() instanceof IllegalArgumentException);
        }
    }

    @Test
    public void testUnknownProperty() throws Exception {
        ParseResult result = parse("<almanac><engine colour='blue'/></almanac>");
        try {
            result.getEngineConfiguration();
            fail("Expected ConfigurationException");
        } catch (ConfigurationException e) {
            assertTrue(e.getMessage(), e.getMessage().contains("colour"));
        }
    }

    @Test
    public void testMultipleEngines() throws Exception {
        ParseResult result = parse("<almanac><engine id='a'/><engine id='b'/></almanac>");
        try {
            result.getEngineConfiguration();
            fail("Expected ConfigurationException");
        } catch (ConfigurationException e) {
            // expected
        }
    }

    @Test
    public void testUnknownReference() throws Exception {
        ParseResult result = parse("<almanac><engine>"
                + "<property name='timezone-database' ref='#nowhere'/>"
                + "</engine></almanac>");
        try {
            result.getEngineConfiguration();
            fail("Expected IllegalArgumentException");
        } catch (IllegalArgumentException e) {
            assertTrue(e.getMessage().contains("nowhere"));
        }
    }

    @Test
    public void testCircularReference() throws Exception {
        ParseResult result = parse("<almanac>"
                + "<component id='a' class='" + MAP_DB + "'><property name='parent' ref='#b'/></component>"
                + "<component id='b' class='" + MAP_DB + "'><property name='parent' ref='#a'/></component>"
                + "</almanac>");
        try {
            result.getComponent("a", TimezoneDatabase.class);
            fail("Expected ConfigurationException");
        } catch (ConfigurationException e) {
            assertTrue(e.getMessage(), e.getMessage().contains("Circular"));
        }
    }

    @Test(expected = SAXException.class)
    public void testComponentNeedsClass() throws Exception {
        parse("<almanac><component id='x'/></almanac>");
    }

    @Test(expected = SAXException.class)
    public void testClassNotFound() throws Exception {
        parse("<almanac><component id='x' class='org.example.Missing'/></almanac>");
    }

    @Test(expected = SAXException.class)
    public void testEntryOutsideMap() throws Exception {
        parse("<almanac><engine><entry key='k' value='v'/></engine></almanac>");
    }

    @Test
    public void testCamelCase() {
        assertEquals("setDriftTolerance", ComponentRegistry.toCamelCase("setDrift-tolerance"));
        assertEquals("setMaxOccurrencesPerSeries",
                ComponentRegistry.toCamelCase("setMax-occurrences-per-series"));
        assertEquals("setParent", ComponentRegistry.toCamelCase("setParent"));
    }

    @Test
    public void testParseDuration() {
        assertEquals(1500L, EngineConfiguration.parseDuration("1500"));
        assertEquals(1500L, EngineConfiguration.parseDuration("1500ms"));
        assertEquals(90000L, EngineConfiguration.parseDuration(" 90s "));
        assertEquals(120000L, EngineConfiguration.parseDuration("2m"));
        assertEquals(3600000L, EngineConfiguration.parseDuration("1H"));
        try {
            EngineConfiguration.parseDuration("ten");
            fail("Expected IllegalArgumentException");
        } catch (IllegalArgumentException e) {
            // expected
        }
    }
}
