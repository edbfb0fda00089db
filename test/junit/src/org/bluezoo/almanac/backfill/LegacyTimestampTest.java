/*
 * LegacyTimestampTest.java
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

package org.bluezoo.almanac.backfill;

import org.bluezoo.almanac.tz.ResolvedZone;
import org.bluezoo.almanac.tz.SystemTimezoneDatabase;
import org.bluezoo.almanac.tz.TimezoneResolver;
import org.junit.Test;

import java.time.DateTimeException;
import java.time.LocalDateTime;

import static org.junit.Assert.*;

/**
 * Unit tests for {@link LegacyTimestamp}.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class LegacyTimestampTest {

    private static final LocalDateTime NINE = LocalDateTime.of(2024, 3, 1, 9, 0);
    private static final long NINE_MS = TimezoneResolver.toLocalMillis(NINE);

    @Test
    public void testClassifiesByMagnitude() {
        assertEquals(LegacyTimestamp.Kind.EPOCH_SECONDS, LegacyTimestamp.of(NINE_MS / 1000L).getKind());
        assertEquals(LegacyTimestamp.Kind.EPOCH_MILLIS, LegacyTimestamp.of(NINE_MS).getKind());
        assertEquals(LegacyTimestamp.Kind.EPOCH_SECONDS, LegacyTimestamp.of(-5L).getKind());
        assertTrue(LegacyTimestamp.of(NINE_MS).isCanonical());
        assertFalse(LegacyTimestamp.of(NINE_MS / 1000L).isCanonical());
    }

    @Test
    public void testParsesNumericText() {
        assertEquals(LegacyTimestamp.of(NINE_MS / 1000L), LegacyTimestamp.parse(" " + (NINE_MS / 1000L) + " "));
        assertEquals(LegacyTimestamp.millis(NINE_MS), LegacyTimestamp.parse(Long.toString(NINE_MS)));
    }

    @Test
    public void testLocalForms() {
        ResolvedZone zone = ResolvedZone.FLOATING;

        assertEquals(NINE_MS, LegacyTimestamp.of(NINE_MS / 1000L).toLocalMillis(zone));
        assertEquals(NINE_MS, LegacyTimestamp.parse("2024-03-01T09:00").toLocalMillis(zone));
        assertEquals(NINE_MS, LegacyTimestamp.parse("2024-03-01 09:00:00").toLocalMillis(zone));
        assertEquals(NINE_MS + 250L, LegacyTimestamp.parse("2024-03-01T09:00:00.250").toLocalMillis(zone));
        assertEquals(TimezoneResolver.toLocalMillis(NINE.toLocalDate().atStartOfDay()),
                LegacyTimestamp.parse("2024-03-01").toLocalMillis(zone));
    }

    @Test
    public void testAbsoluteFormsUseZoneWallClock() throws Exception {
        ResolvedZone ny = new TimezoneResolver(new SystemTimezoneDatabase()).lookup("America/New_York");

        assertEquals(NINE_MS, LegacyTimestamp.parse("2024-03-01T14:00:00Z").toLocalMillis(ny));
        assertEquals(NINE_MS, LegacyTimestamp.parse("2024-03-01T15:00:00+01:00").toLocalMillis(ny));
        assertEquals(NINE_MS, LegacyTimestamp.parse("2024-03-01T09:00:00-05:00").toLocalMillis(ny));
    }

    @Test(expected = DateTimeException.class)
    public void testGarbage() {
        LegacyTimestamp.parse("yesterday").toLocalMillis(ResolvedZone.FLOATING);
    }

    @Test
    public void testStorageString() {
        assertEquals("2024-03-01 09:00", LegacyTimestamp.parse("2024-03-01 09:00").toStorageString());
        assertEquals("ISO_TEXT:2024-03-01 09:00", LegacyTimestamp.parse("2024-03-01 09:00").toString());
        assertEquals(Long.toString(NINE_MS), LegacyTimestamp.millis(NINE_MS).toStorageString());
    }
}
