/*
 * EventValidatorTest.java
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

import org.bluezoo.almanac.exdate.ExdateInspection;
import org.bluezoo.almanac.expand.OccurrenceExpander;
import org.bluezoo.almanac.tz.SystemTimezoneDatabase;
import org.bluezoo.almanac.tz.TimezoneResolver;
import org.junit.Before;
import org.junit.Test;

import java.time.Instant;
import java.time.LocalDateTime;
import java.util.Arrays;

import static org.junit.Assert.*;

/**
 * Unit tests for {@link EventValidator}.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class EventValidatorTest {

    private static final long HOUR = 3600000L;

    private EventValidator validator;
    private Household household;

    @Before
    public void setUp() {
        validator = new EventValidator(new TimezoneResolver(new SystemTimezoneDatabase()),
                new OccurrenceExpander());
        household = new Household("h1", "America/New_York");
    }

    private static Event event(String id, LocalDateTime start) {
        long startAt = TimezoneResolver.toLocalMillis(start);
        Event event = new Event(id, "h1", startAt);
        event.setEndAt(Long.valueOf(startAt + HOUR));
        return event;
    }

    @Test
    public void testSingleEventCaches() throws Exception {
        Event e = event("e1", LocalDateTime.of(2024, 7, 1, 9, 0));
        e.setTz("Europe/London");

        ExdateInspection inspection = validator.validate(e, household);

        assertTrue(inspection.isClean());
        assertEquals(Long.valueOf(Instant.parse("2024-07-01T08:00:00Z").toEpochMilli()), e.getStartAtUtc());
        assertEquals(Long.valueOf(Instant.parse("2024-07-01T09:00:00Z").toEpochMilli()), e.getEndAtUtc());
    }

    @Test
    public void testRecurringUsesHouseholdZone() throws Exception {
        Event e = event("e2", LocalDateTime.of(2024, 3, 4, 9, 0));
        e.setRrule("FREQ=WEEKLY;COUNT=6;BYDAY=MO,WE,FR");
        e.setExdates("2024-03-06T14:00:00Z");

        ExdateInspection inspection = validator.validate(e, household);

        assertEquals(1, inspection.getValid().size());
        assertTrue(inspection.getUnmatched().isEmpty());
        assertEquals(Long.valueOf(Instant.parse("2024-03-04T14:00:00Z").toEpochMilli()), e.getStartAtUtc());
    }

    @Test
    public void testOpenEndedEventHasNoEndCache() throws Exception {
        Event e = new Event("e3", "h1", TimezoneResolver.toLocalMillis(LocalDateTime.of(2024, 1, 1, 0, 0)));

        validator.validate(e, null);

        // Floating: wall-clock and UTC coincide
        assertEquals(Long.valueOf(e.getStartAt()), e.getStartAtUtc());
        assertNull(e.getEndAtUtc());
    }

    @Test
    public void testUnmatchedExdateTolerated() throws Exception {
        Event e = event("e4", LocalDateTime.of(2024, 3, 1, 9, 0));
        e.setRrule("FREQ=DAILY;COUNT=5");
        e.setExdates("2024-03-03T15:00:00Z");

        ExdateInspection inspection = validator.validate(e, household);

        assertEquals(Arrays.asList(Instant.parse("2024-03-03T15:00:00Z")), inspection.getUnmatched());
    }

    @Test
    public void testEndBeforeStart() {
        Event e = event("e5", LocalDateTime.of(2024, 3, 1, 9, 0));
        e.setEndAt(Long.valueOf(e.getStartAt() - 1L));
        assertRejected(e, TimeErrorCode.RANGE_INVALID, "e5");
    }

    @Test
    public void testUnknownTimezone() {
        Event e = event("e6", LocalDateTime.of(2024, 3, 1, 9, 0));
        e.setTz("America/Gotham");
        assertRejected(e, TimeErrorCode.TZ_UNKNOWN, "America/Gotham");
    }

    @Test
    public void testBadRule() {
        Event e = event("e7", LocalDateTime.of(2024, 3, 1, 9, 0));
        e.setRrule("FREQ=DAILY;BYMONTHDAY=3");
        assertRejected(e, TimeErrorCode.RRULE_UNSUPPORTED_FIELD, "BYMONTHDAY");
    }

    @Test
    public void testExdateFormat() {
        Event e = event("e8", LocalDateTime.of(2024, 3, 1, 9, 0));
        e.setRrule("FREQ=DAILY;COUNT=5");
        e.setExdates("2024-03-03T09:00:00");
        assertRejected(e, TimeErrorCode.EXDATE_INVALID_FORMAT, "2024-03-03T09:00:00");
    }

    @Test
    public void testExdateOutOfRange() {
        Event e = event("e9", LocalDateTime.of(2024, 3, 1, 9, 0));
        e.setRrule("FREQ=DAILY;COUNT=5");
        e.setExdates("2024-03-06T14:00:00Z");
        assertRejected(e, TimeErrorCode.EXDATE_OUT_OF_RANGE, "2024-03-06T14:00:00Z");

        e.setExdates("2024-02-29T14:00:00Z");
        assertRejected(e, TimeErrorCode.EXDATE_OUT_OF_RANGE, "2024-02-29T14:00:00Z");
    }

    @Test(timeout = 5000)
    public void testLargeCountValidatesExdatesQuickly() throws Exception {
        Event e = event("e10", LocalDateTime.of(2024, 3, 1, 9, 0));
        e.setRrule("FREQ=DAILY;COUNT=999999999");
        e.setExdates("2024-03-03T14:00:00Z");

        ExdateInspection inspection = validator.validate(e, household);

        assertEquals(1, inspection.getValid().size());
        assertTrue(inspection.getUnmatched().isEmpty());
        assertEquals(Long.valueOf(Instant.parse("2024-03-01T14:00:00Z").toEpochMilli()), e.getStartAtUtc());

        e.setExdates("2024-02-01T14:00:00Z");
        assertRejected(e, TimeErrorCode.EXDATE_OUT_OF_RANGE, "2024-02-01T14:00:00Z");

        e.setRrule("FREQ=WEEKLY;BYDAY=MO,WE,FR;UNTIL=99991231T000000Z");
        e.setExdates("2031-06-06T13:00:00Z");
        assertTrue(validator.validate(e, household).isClean());
    }

    @Test
    public void testLargeCountWithoutExdates() throws Exception {
        Event e = event("e11", LocalDateTime.of(2024, 3, 1, 9, 0));
        e.setRrule("FREQ=WEEKLY;INTERVAL=999999999;COUNT=999999999");

        assertTrue(validator.validate(e, household).isClean());
        assertEquals(Long.valueOf(Instant.parse("2024-03-01T14:00:00Z").toEpochMilli()), e.getStartAtUtc());
    }

    private void assertRejected(Event e, TimeErrorCode code, String detail) {
        try {
            validator.validate(e, household);
            fail("Expected " + code.getCode());
        } catch (TimekeepingException ex) {
            assertEquals(code, ex.getCode());
            assertEquals(detail, ex.getDetail());
            assertNull(e.getStartAtUtc());
        }
    }
}
