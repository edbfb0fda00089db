/*
 * ZoneConversionMatrixTest.java
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

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.Parameterized;
import org.junit.runners.Parameterized.Parameters;

import java.time.Instant;
import java.time.LocalDateTime;
import java.util.Arrays;
import java.util.Collection;

import static org.junit.Assert.*;

/**
 * Wall-clock to UTC conversion across zones and transitions.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
@RunWith(Parameterized.class)
public class ZoneConversionMatrixTest {

    @Parameters(name = "{0} {1}")
    public static Collection<Object[]> data() {
        return Arrays.asList(new Object[][] {
            { "America/New_York", "2024-03-09T09:00", "2024-03-09T14:00:00Z" },
            { "America/New_York", "2024-03-11T09:00", "2024-03-11T13:00:00Z" },
            { "America/New_York", "2024-03-10T02:00", "2024-03-10T07:00:00Z" },
            { "America/New_York", "2024-11-03T01:00", "2024-11-03T05:00:00Z" },
            { "Europe/London", "2024-03-31T01:30", "2024-03-31T01:00:00Z" },
            { "Europe/London", "2024-10-27T01:30", "2024-10-27T00:30:00Z" },
            { "Europe/London", "2024-01-15T12:00", "2024-01-15T12:00:00Z" },
            { "Australia/Sydney", "2024-04-07T02:30", "2024-04-06T15:30:00Z" },
            { "Australia/Sydney", "2024-10-06T02:30", "2024-10-05T16:00:00Z" },
            { "Asia/Kolkata", "2024-06-01T09:00", "2024-06-01T03:30:00Z" },
            { "Asia/Tokyo", "2024-12-31T23:59", "2024-12-31T14:59:00Z" },
            { "UTC", "2024-02-29T00:00", "2024-02-29T00:00:00Z" },
        });
    }

    private final String zoneId;
    private final LocalDateTime local;
    private final Instant expected;

    public ZoneConversionMatrixTest(String zoneId, String local, String expected) {
        this.zoneId = zoneId;
        this.local = LocalDateTime.parse(local);
        this.expected = Instant.parse(expected);
    }

    @Test
    public void testToInstant() throws Exception {
        TimezoneResolver resolver = new TimezoneResolver(new SystemTimezoneDatabase());
        ResolvedZone zone = resolver.lookup(zoneId);

        assertEquals(expected, zone.toInstant(local));
    }
}
