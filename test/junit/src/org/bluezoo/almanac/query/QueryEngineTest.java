/*
 * QueryEngineTest.java
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

package org.bluezoo.almanac.query;

import org.bluezoo.almanac.Event;
import org.bluezoo.almanac.Household;
import org.bluezoo.almanac.Occurrence;
import org.bluezoo.almanac.TimeErrorCode;
import org.bluezoo.almanac.TimekeepingException;
import org.bluezoo.almanac.expand.OccurrenceExpander;
import org.bluezoo.almanac.tz.SystemTimezoneDatabase;
import org.bluezoo.almanac.tz.TimezoneResolver;
import org.junit.Before;
import org.junit.Test;

import java.time.Instant;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.junit.Assert.*;

/**
 * Unit tests for {@link QueryEngine}.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class QueryEngineTest {

    private static final long HOUR = 3600000L;
    private static final Instant FROM = Instant.parse("2024-03-01T00:00:00Z");
    private static final Instant TO = Instant.parse("2024-03-10T00:00:00Z");

    private TimezoneResolver resolver;
    private OccurrenceExpander expander;
    private QueryEngine engine;
    private Household household;
    private List<Event> events;

    @Before
    public void setUp() {
        resolver = new TimezoneResolver(new SystemTimezoneDatabase());
        expander = new OccurrenceExpander();
        engine = new QueryEngine(resolver, expander);
        household = new Household("h1", "America/New_York");

        events = new ArrayList<Event>();
        Event daily = event("a", "h1", LocalDateTime.of(2024, 3, 1, 9, 0));
        daily.setRrule("FREQ=DAILY;COUNT=5");
        events.add(daily);
        Event single = event("b", "h1", LocalDateTime.of(2024, 3, 2, 12, 0));
        single.setTz("Europe/London");
        events.add(single);
        events.add(event("x", "h2", LocalDateTime.of(2024, 3, 3, 9, 0)));
    }

    private static Event event(String id, String householdId, LocalDateTime start) {
        long startAt = TimezoneResolver.toLocalMillis(start);
        Event event = new Event(id, householdId, startAt);
        event.setEndAt(Long.valueOf(startAt + HOUR));
        return event;
    }

    private static long utc(String text) {
        return Instant.parse(text).toEpochMilli();
    }

    @Test
    public void testMergedOrder() throws Exception {
        QueryPage page = engine.query(new EventQuery("h1", FROM, TO), household, events);

        List<Occurrence> list = page.getOccurrences();
        assertEquals(6, list.size());
        assertFalse(page.mayHaveMore());
        assertNull(page.getNextCursor());
        assertEquals("a::" + utc("2024-03-01T14:00:00Z"), list.get(0).getInstanceId());
        assertEquals("b", list.get(1).getEventId());
        assertEquals(utc("2024-03-02T12:00:00Z"), list.get(1).getStartUtc());
        assertEquals("Europe/London", list.get(1).getZoneId());
        assertFalse(list.get(1).isRecurring());
        assertEquals(utc("2024-03-05T14:00:00Z"), list.get(5).getStartUtc());
        assertEquals(utc("2024-03-05T15:00:00Z"), list.get(5).getEndUtc());
        assertTrue(list.get(5).isRecurring());
        for (int i = 1; i < list.size(); i++) {
            assertTrue(list.get(i - 1).compareTo(list.get(i)) < 0);
        }
    }

    @Test
    public void testHouseholdFallbackThenUtc() throws Exception {
        Event lunch = event("c", "h1", LocalDateTime.of(2024, 3, 4, 12, 0));
        List<Event> one = new ArrayList<Event>();
        one.add(lunch);

        Occurrence withFallback = engine.query(new EventQuery("h1", FROM, TO), household, one)
                .getOccurrences().get(0);
        assertEquals("America/New_York", withFallback.getZoneId());
        assertEquals(utc("2024-03-04T17:00:00Z"), withFallback.getStartUtc());

        Occurrence floating = engine.query(new EventQuery("h1", FROM, TO), new Household("h1"), one)
                .getOccurrences().get(0);
        assertEquals("UTC", floating.getZoneId());
        assertEquals(utc("2024-03-04T12:00:00Z"), floating.getStartUtc());
    }

    @Test
    public void testCursorPagination() throws Exception {
        EventQuery query = new EventQuery("h1", FROM, TO);
        query.setLimit(2);

        QueryPage first = engine.query(query, household, events);
        assertEquals(2, first.size());
        assertTrue(first.mayHaveMore());
        QueryCursor cursor = first.getNextCursor();
        assertEquals("b", cursor.getEventId());

        QueryPage second = engine.query(query.after(QueryCursor.parse(cursor.toString())), household, events);
        assertEquals(2, second.size());
        assertEquals(utc("2024-03-02T14:00:00Z"), second.getOccurrences().get(0).getStartUtc());

        QueryPage third = engine.query(query.after(second.getNextCursor()), household, events);
        assertEquals(2, third.size());
        assertFalse(third.mayHaveMore());
        assertEquals(utc("2024-03-05T14:00:00Z"), third.getOccurrences().get(1).getStartUtc());

        List<Occurrence> all = engine.queryAll(query, household, events);
        assertEquals(engine.query(new EventQuery("h1", FROM, TO), household, events).getOccurrences(), all);
    }

    @Test
    public void testOffset() throws Exception {
        EventQuery query = new EventQuery("h1", FROM, TO);
        query.setOffset(4);

        QueryPage page = engine.query(query, household, events);

        assertEquals(2, page.size());
        assertEquals(utc("2024-03-04T14:00:00Z"), page.getOccurrences().get(0).getStartUtc());
    }

    @Test
    public void testTieBreakByEventId() throws Exception {
        List<Event> twins = new ArrayList<Event>();
        twins.add(event("z", "h1", LocalDateTime.of(2024, 3, 4, 9, 0)));
        twins.add(event("m", "h1", LocalDateTime.of(2024, 3, 4, 9, 0)));

        List<Occurrence> list = engine.query(new EventQuery("h1", FROM, TO), household, twins).getOccurrences();

        assertEquals("m", list.get(0).getEventId());
        assertEquals("z", list.get(1).getEventId());
    }

    @Test
    public void testPerSeriesCap() throws Exception {
        QueryEngine capped = new QueryEngine(resolver, expander, 3, 100, 50);
        List<Event> endless = new ArrayList<Event>();
        Event e = event("d", "h1", LocalDateTime.of(2024, 3, 1, 9, 0));
        e.setRrule("FREQ=DAILY");
        endless.add(e);

        QueryPage page = capped.query(new EventQuery("h1", FROM, TO), household, endless);
        assertEquals(3, page.size());
        assertTrue(page.mayHaveMore());
        assertEquals(new QueryCursor(utc("2024-03-03T14:00:00Z"), "d"), page.getNextCursor());
    }

    @Test
    public void testCappedSeriesContinuesOnNextPage() throws Exception {
        QueryEngine capped = new QueryEngine(resolver, expander, 3, 100, 50);
        QueryEngine uncapped = new QueryEngine(resolver, expander, -1, 100, 50);
        List<Event> mixed = new ArrayList<Event>();
        Event e = event("d", "h1", LocalDateTime.of(2024, 3, 1, 9, 0));
        e.setRrule("FREQ=DAILY");
        mixed.add(e);
        Event single = event("b", "h1", LocalDateTime.of(2024, 3, 5, 12, 0));
        single.setTz("Europe/London");
        mixed.add(single);
        EventQuery query = new EventQuery("h1", FROM, TO);

        List<Occurrence> all = capped.queryAll(query, household, mixed);

        assertEquals(10, all.size());
        assertEquals(uncapped.query(query, household, mixed).getOccurrences(), all);
    }

    @Test
    public void testPagingPastSeriesCapIsComplete() throws Exception {
        List<Event> yearly = new ArrayList<Event>();
        Event e = event("daily", "h1", LocalDateTime.of(2024, 1, 1, 9, 0));
        e.setRrule("FREQ=DAILY");
        yearly.add(e);
        EventQuery query = new EventQuery("h1", Instant.parse("2024-01-01T00:00:00Z"),
                Instant.parse("2026-01-01T00:00:00Z"));
        query.setLimit(1000);

        QueryPage first = engine.query(query, household, yearly);
        assertEquals(QueryEngine.DEFAULT_MAX_OCCURRENCES_PER_SERIES, first.size());
        assertTrue(first.mayHaveMore());
        assertNotNull(first.getNextCursor());

        QueryPage second = engine.query(query.after(first.getNextCursor()), household, yearly);
        assertEquals(231, second.size());
        assertFalse(second.mayHaveMore());
        assertNull(second.getNextCursor());

        List<Occurrence> all = engine.queryAll(query, household, yearly);
        assertEquals(731, all.size());
        assertEquals(utc("2024-01-01T14:00:00Z"), all.get(0).getStartUtc());
        assertEquals(utc("2025-12-31T14:00:00Z"), all.get(730).getStartUtc());
        for (int i = 1; i < all.size(); i++) {
            assertTrue(all.get(i - 1).compareTo(all.get(i)) < 0);
        }
    }

    @Test(expected = IllegalArgumentException.class)
    public void testZeroSeriesCapRejected() {
        new QueryEngine(resolver, expander, 0, 100, 50);
    }

    @Test
    public void testLimitCeiling() throws Exception {
        QueryEngine small = new QueryEngine(resolver, expander, -1, 4, 2);
        EventQuery query = new EventQuery("h1", FROM, TO);

        assertEquals(2, small.query(query, household, events).getLimit());
        query.setLimit(1000);
        assertEquals(4, small.query(query, household, events).size());
    }

    @Test
    public void testBadRowSkipped() throws Exception {
        Event broken = event("bad", "h1", LocalDateTime.of(2024, 3, 3, 9, 0));
        broken.setTz("Atlantis/Capital");
        events.add(broken);

        QueryPage page = engine.query(new EventQuery("h1", FROM, TO), household, events);

        assertEquals(6, page.size());
    }

    @Test
    public void testEmptyRange() {
        try {
            engine.query(new EventQuery("h1", TO, TO), household, events);
            fail("Expected E_RANGE_INVALID");
        } catch (TimekeepingException e) {
            assertEquals(TimeErrorCode.RANGE_INVALID, e.getCode());
        }
    }

    @Test(expected = IllegalArgumentException.class)
    public void testHouseholdMismatch() throws Exception {
        engine.query(new EventQuery("h2", FROM, TO), household, events);
    }

    @Test
    public void testConcurrentQueriesAgree() throws Exception {
        final EventQuery query = new EventQuery("h1", FROM, TO);
        final List<Occurrence> expected = engine.query(query, household, events).getOccurrences();
        ExecutorService executor = Executors.newFixedThreadPool(8);
        try {
            List<Future<List<Occurrence>>> futures = new ArrayList<Future<List<Occurrence>>>();
            for (int i = 0; i < 32; i++) {
                futures.add(executor.submit(new Callable<List<Occurrence>>() {
                    @Override
                    public List<Occurrence> call() throws Exception {
                        return engine.query(query, household, events).getOccurrences();
                    }
                }));
            }
            for (Future<List<Occurrence>> future : futures) {
                assertEquals(expected, future.get());
            }
        } finally {
            executor.shutdown();
        }
    }

    @Test
    public void testCursorToken() {
        QueryCursor cursor = QueryCursor.parse("1709301600000:a");

        assertEquals(1709301600000L, cursor.getStartUtc());
        assertEquals("a", cursor.getEventId());
        assertEquals("1709301600000:a", cursor.toString());
        try {
            QueryCursor.parse("nonsense");
            fail("Expected IllegalArgumentException");
        } catch (IllegalArgumentException e) {
            // expected
        }
    }
}
