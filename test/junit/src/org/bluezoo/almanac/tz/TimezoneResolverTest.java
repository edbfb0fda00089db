/*
 * TimezoneResolverTest.java
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

package org.bluezoo.almanac.tz;

import org.bluezoo.almanac.Event;
import org.bluezoo.almanac.Household;
import org.bluezoo.almanac.TimeErrorCode;
import org.bluezoo.almanac.TimekeepingException;
import org.junit.Before;
import org.junit.Test;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;

import static org.junit.Assert.*;

/**
 * Unit tests for {@link TimezoneResolver}.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class TimezoneResolverTest {

    private TimezoneResolver resolver;

    @Before
    public void setUp() {
        resolver = new TimezoneResolver(new SystemTimezoneDatabase());
    }

    @Test
    public void testEventZoneWins() throws Exception {
        ResolvedZone zone = resolver.resolve("Europe/London", "America/New_York");

        assertEquals("Europe/London", zone.getId());
        assertEquals(ZoneSource.EVENT, zone.getSource());
        assertFalse(zone.isFloating());
        assertEquals(resolver.getDatabase().getVersion(), zone.getDatabaseVersion());
    }

    @Test
    public void testHouseholdFallback() throws Exception {
        Event event = new Event("e1", "h1", 0L);
        event.setTz("  ");
        ResolvedZone zone = resolver.resolve(event, new Household("h1", "Asia/Tokyo"));

        assertEquals("Asia/Tokyo", zone.getId());
        assertEquals(ZoneSource.HOUSEHOLD, zone.getSource());
    }

    @Test
    public void testDefaultFallback() throws Exception {
        TimezoneResolver withDefault = new TimezoneResolver(new SystemTimezoneDatabase(), "Europe/Paris");
        ResolvedZone zone = withDefault.resolve((String) null, null);

        assertEquals("Europe/Paris", zone.getId());
        assertEquals(ZoneSource.DEFAULT, zone.getSource());
        assertEquals("Europe/Paris", withDefault.getDefaultTz());
    }

    @Test
    public void testFloating() throws Exception {
        ResolvedZone zone = resolver.resolve((String) null, null);

        assertSame(ResolvedZone.FLOATING, zone);
        assertTrue(zone.isFloating());
        LocalDateTime local = LocalDateTime.of(2024, 3, 10, 2, 30);
        assertEquals(local.toInstant(ZoneOffset.UTC), zone.toInstant(local));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testUnknownDefault() {
        new TimezoneResolver(new SystemTimezoneDatabase(), "Mars/Olympus_Mons");
    }

    @Test
    public void testUnknownZone() {
        try {
            resolver.resolve("Mars/Olympus_Mons", "Europe/London");
            fail("Expected E_TZ_UNKNOWN");
        } catch (TimekeepingException e) {
            assertEquals(TimeErrorCode.TZ_UNKNOWN, e.getCode());
            assertEquals("Mars/Olympus_Mons", e.getDetail());
        }
    }

    @Test
    public void testUnknownHouseholdZone() {
        try {
            resolver.resolve(null, "Nowhere/Special");
            fail("Expected E_TZ_UNKNOWN");
        } catch (TimekeepingException e) {
            assertEquals(TimeErrorCode.TZ_UNKNOWN, e.getCode());
        }
    }

    @Test
    public void testValidate() throws Exception {
        resolver.validate(null);
        resolver.validate("America/Sao_Paulo");
        resolver.validate("UTC");
        assertTrue(resolver.isKnown(" Europe/Berlin "));
        assertFalse(resolver.isKnown("EST5EDT/Bogus"));
        try {
            resolver.validate("Bogus/Zone");
            fail("Expected E_TZ_UNKNOWN");
        } catch (TimekeepingException e) {
            assertEquals(TimeErrorCode.TZ_UNKNOWN, e.getCode());
        }
    }

    @Test
    public void testSpringForwardGapMovesToTransition() throws Exception {
        ResolvedZone ny = resolver.lookup("America/New_York");
        LocalDateTime missing = LocalDateTime.of(2024, 3, 10, 2, 30);

        assertTrue(ny.isGap(missing));
        // 02:00 EST becomes 03:00 EDT at 07:00Z
        assertEquals(Instant.parse("2024-03-10T07:00:00Z"), ny.toInstant(missing));
    }

    @Test
    public void testFallBackOverlapPicksEarlier() throws Exception {
        ResolvedZone ny = resolver.lookup("America/New_York");
        LocalDateTime ambiguous = LocalDateTime.of(2024, 11, 3, 1, 30);

        assertFalse(ny.isGap(ambiguous));
        // 01:30 EDT (-04:00) comes before 01:30 EST (-05:00)
        assertEquals(Instant.parse("2024-11-03T05:30:00Z"), ny.toInstant(ambiguous));
    }

    @Test
    public void testLocalMillisRoundTrip() throws Exception {
        ResolvedZone london = resolver.lookup("Europe/London");
        LocalDateTime local = LocalDateTime.of(2024, 7, 1, 9, 0);
        long localMs = TimezoneResolver.toLocalMillis(local);

        assertEquals(local, TimezoneResolver.toLocalDateTime(localMs));
        long utcMs = resolver.toUtcMillis(localMs, london);
        assertEquals(Instant.parse("2024-07-01T08:00:00Z").toEpochMilli(), utcMs);
        assertEquals(localMs, resolver.toLocalMillis(utcMs, london));
    }

    @Test
    public void testMapDatabaseOverridesParent() throws Exception {
        MapTimezoneDatabase db = new MapTimezoneDatabase("test-1", new SystemTimezoneDatabase());
        db.putFixed("America/New_York", ZoneOffset.ofHours(-5));
        TimezoneResolver pinned = new TimezoneResolver(db);

        ResolvedZone ny = pinned.lookup("America/New_York");
        assertEquals("test-1", ny.getDatabaseVersion());
        assertEquals(ZoneOffset.ofHours(-5), ny.getOffset(Instant.parse("2024-07-01T12:00:00Z")));
        // Zones not overridden come from the parent
        assertTrue(pinned.isKnown("Europe/London"));
        assertTrue(db.getZoneIds().contains("America/New_York"));
    }
}
