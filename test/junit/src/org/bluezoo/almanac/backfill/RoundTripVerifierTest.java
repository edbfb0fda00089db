/*
 * RoundTripVerifierTest.java
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

import org.bluezoo.almanac.Event;
import org.bluezoo.almanac.expand.ExpandedOccurrence;
import org.bluezoo.almanac.expand.OccurrenceExpander;
import org.bluezoo.almanac.tz.ResolvedZone;
import org.bluezoo.almanac.tz.SystemTimezoneDatabase;
import org.bluezoo.almanac.tz.TimezoneResolver;
import org.junit.Before;
import org.junit.Test;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.junit.Assert.*;

/**
 * Unit tests for {@link RoundTripVerifier}.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class RoundTripVerifierTest {

    private static final long NINE_MS = TimezoneResolver.toLocalMillis(LocalDateTime.of(2024, 3, 1, 9, 0));

    private TimezoneResolver resolver;
    private RoundTripVerifier verifier;
    private OccurrenceExpander expander;
    private ResolvedZone ny;

    @Before
    public void setUp() throws Exception {
        resolver = new TimezoneResolver(new SystemTimezoneDatabase());
        verifier = new RoundTripVerifier(resolver);
        expander = new OccurrenceExpander();
        ny = resolver.lookup("America/New_York");
    }

    private Event canonical(long startAt) throws Exception {
        Event event = new Event("e1", "h1", startAt);
        event.setTz("America/New_York");
        ExpandedOccurrence first = expander.firstOccurrence(event, ny);
        event.setStartAtUtc(Long.valueOf(first.getStartMillis()));
        return event;
    }

    @Test
    public void testRowRoundTrips() throws Exception {
        StoredEvent before = new StoredEvent(1L, "e1", "h1", LegacyTimestamp.of(NINE_MS / 1000L),
                null, null, null, null, null, null, null);
        Event after = canonical(NINE_MS);

        assertNull(verifier.verifyRow(before, after, ny, expander.firstOccurrence(after, ny)));
    }

    @Test
    public void testRowStartMismatch() throws Exception {
        StoredEvent before = new StoredEvent(1L, "e1", "h1", LegacyTimestamp.of(NINE_MS / 1000L),
                null, null, null, null, null, null, null);
        Event after = canonical(NINE_MS + 60000L);

        assertNotNull(verifier.verifyRow(before, after, ny, expander.firstOccurrence(after, ny)));
    }

    @Test
    public void testRowCacheMismatch() throws Exception {
        StoredEvent before = StoredEvent.of(1L, canonical(NINE_MS));
        Event after = canonical(NINE_MS);
        ExpandedOccurrence first = expander.firstOccurrence(after, ny);
        after.setStartAtUtc(Long.valueOf(first.getStartMillis() + 3600000L));

        assertNotNull(verifier.verifyRow(before, after, ny, first));
    }

    @Test
    public void testDataset() throws Exception {
        StoredEvent legacy = new StoredEvent(1L, "e1", "h1", LegacyTimestamp.of(NINE_MS / 1000L),
                null, null, null, null, null, null, null);
        StoredEvent normalized = StoredEvent.of(1L, canonical(NINE_MS));
        StoredEvent other = new StoredEvent(2L, "e2", "h1", LegacyTimestamp.millis(NINE_MS),
                null, "Europe/London", null, null, null, null, null);
        StoredEvent moved = new StoredEvent(2L, "e2", "h1", LegacyTimestamp.millis(NINE_MS + 1000L),
                null, "Europe/London", null, null, null, null, null);
        StoredEvent extra = new StoredEvent(3L, "e3", "h1", LegacyTimestamp.millis(NINE_MS),
                null, null, null, null, null, null, null);

        RoundTripReport clean = verifier.verifyDataset(Arrays.asList(legacy, other),
                Arrays.asList(normalized, other));
        assertTrue(clean.isConsistent());
        assertEquals(2, clean.getBeforeCount());

        RoundTripReport broken = verifier.verifyDataset(Arrays.asList(legacy, other),
                Arrays.asList(moved, extra));
        assertFalse(broken.isConsistent());
        assertEquals(Arrays.asList("e1"), broken.getMissingIds());
        assertEquals(Arrays.asList("e3"), broken.getExtraIds());
        assertEquals(Arrays.asList("e2"), broken.getMismatchedIds());
    }

    @Test
    public void testEmptyDatasets() {
        RoundTripReport report = verifier.verifyDataset(new ArrayList<StoredEvent>(), new ArrayList<StoredEvent>());
        assertTrue(report.isConsistent());
        List<String> none = report.getMissingIds();
        assertTrue(none.isEmpty());
    }
}
