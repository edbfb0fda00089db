/*
 * TimekeepingEngineTest.java
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

package org.bluezoo.almanac;

import org.bluezoo.almanac.backfill.BackfillSummary;
import org.bluezoo.almanac.backfill.LegacyTimestamp;
import org.bluezoo.almanac.backfill.MemoryEventStore;
import org.bluezoo.almanac.backfill.StoredEvent;
import org.bluezoo.almanac.config.EngineConfiguration;
import org.bluezoo.almanac.query.EventQuery;
import org.bluezoo.almanac.query.QueryPage;
import org.bluezoo.almanac.tz.ResolvedZone;
import org.bluezoo.almanac.tz.TimezoneResolver;
import org.bluezoo.almanac.tz.ZoneSource;
import org.junit.Before;
import org.junit.Test;

import java.time.Instant;
import java.time.LocalDateTime;
import java.util.Collections;
import java.util.List;

import static org.junit.Assert.*;

/**
 * Unit tests for {@link TimekeepingEngine}.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class TimekeepingEngineTest {

    private static final long HOUR = 3600000L;

    private TimekeepingEngine engine;
    private Household household;

    @Before
    public void setUp() {
        engine = new TimekeepingEngine();
        household = new Household("h1", "America/New_York");
    }

    private static long utc(String text) {
        return Instant.parse(text).toEpochMilli();
    }

    @Test
    public void testValidateQueryAndCheck() throws Exception {
        long start = TimezoneResolver.toLocalMillis(LocalDateTime.of(2024, 3, 8, 9, 0));
        Event event = new Event("standup", "h1", start);
        event.setEndAt(Long.valueOf(start + HOUR));
        event.setRrule("FREQ=DAILY;COUNT=5");

        assertTrue(engine.validate(event, household).isClean());
        assertEquals(Long.valueOf(utc("2024-03-08T14:00:00Z")), event.getStartAtUtc());

        EventQuery query = new EventQuery("h1", Instant.parse("2024-03-08T00:00:00Z"),
                Instant.parse("2024-03-14T00:00:00Z"));
        QueryPage page = engine.query(query, household, Collections.singletonList(event));
        List<Occurrence> occurrences = page.getOccurrences();
        assertEquals(5, occurrences.size());
        assertEquals(utc("2024-03-09T14:00:00Z"), occurrences.get(1).getStartUtc());
        assertEquals(utc("2024-03-10T13:00:00Z"), occurrences.get(2).getStartUtc());
        assertEquals("America/New_York", occurrences.get(2).getZoneId());

        assertFalse(engine.detectDrift(Collections.singletonList(event), household).hasDrift());
    }

    @Test
    public void testConfiguredDefaultTimezone() throws Exception {
        EngineConfiguration config = new EngineConfiguration();
        config.setDefaultTimezone("Europe/London");
        config.init();
        TimekeepingEngine london = new TimekeepingEngine(config);

        ResolvedZone zone = london.getResolver().resolve((String) null, null);

        assertEquals("Europe/London", zone.getId());
        assertEquals(ZoneSource.DEFAULT, zone.getSource());
    }

    @Test
    public void testBackfillUsesConfiguredOptions() throws Exception {
        MemoryEventStore store = new MemoryEventStore();
        store.putHousehold(household);
        store.put(new StoredEvent(1L, "legacy", "h1", LegacyTimestamp.parse("2024-07-01 09:30"),
                null, null, null, null, null, null, null));

        BackfillSummary summary = engine.newBackfill(store).run(engine.newBackfillOptions());

        assertEquals(1L, summary.getUpdated());
        StoredEvent row = store.getRow("legacy");
        assertTrue(row.hasCanonicalDates());
        assertEquals("America/New_York", row.getTz());
        assertEquals(Long.valueOf(utc("2024-07-01T13:30:00Z")), row.getStartAtUtc());
    }
}
