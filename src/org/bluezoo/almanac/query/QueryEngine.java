/*
 * QueryEngine.java
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
import org.bluezoo.almanac.exdate.ExdateParser;
import org.bluezoo.almanac.exdate.ExdateSet;
import org.bluezoo.almanac.expand.ExpandedOccurrence;
import org.bluezoo.almanac.expand.OccurrenceExpander;
import org.bluezoo.almanac.rrule.RecurrenceRule;
import org.bluezoo.almanac.rrule.RecurrenceRuleParser;
import org.bluezoo.almanac.tz.ResolvedZone;
import org.bluezoo.almanac.tz.TimezoneResolver;

import java.text.MessageFormat;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Iterator;
import java.util.List;
import java.util.PriorityQueue;
import java.util.ResourceBundle;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Lists the occurrences of a household's events within a window.
 *
 * <p>Non-recurring events contribute their single occurrence; recurring
 * events contribute the occurrences produced by the
 * {@link OccurrenceExpander}. The cached {@code start_at_utc} and
 * {@code end_at_utc} values serve only as a pre-filter: every occurrence
 * returned is recomputed from {@code start_at}, {@code tz} and
 * {@code rrule}. Per-series sequences are merged lazily, ordered by start
 * instant with ties broken by event id, so a page costs roughly
 * {@code limit} conversions however long the window.
 *
 * <p>A series may contribute at most {@code maxOccurrencesPerSeries}
 * occurrences to one page. When a series reaches that cap the page ends at
 * its last contributed occurrence, possibly short of the limit, and carries
 * a cursor from which the next page continues. An offset is applied to the
 * first page only.
 *
 * <p>Rows that cannot be interpreted (unknown zone, unparseable rule) are
 * logged and left out; they were rejected at write time and can only come
 * from legacy data. Events of other households are ignored.
 *
 * <p>The engine does not mutate its inputs and may be used concurrently.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class QueryEngine {

    private static final Logger LOGGER = Logger.getLogger(QueryEngine.class.getName());
    private static final ResourceBundle L10N = ResourceBundle.getBundle("org.bluezoo.almanac.query.L10N");

    /**
     * Largest wall-clock shift a zone transition can cause, used to widen
     * the cache pre-filter.
     */
    private static final long PREFILTER_SLACK_MS = Duration.ofHours(26).toMillis();

    public static final int DEFAULT_MAX_OCCURRENCES_PER_SERIES = 500;
    public static final int DEFAULT_MAX_QUERY_RESULTS = 10000;
    public static final int DEFAULT_LIMIT = 100;

    private final TimezoneResolver resolver;
    private final OccurrenceExpander expander;
    private final int maxOccurrencesPerSeries;
    private final int maxQueryResults;
    private final int defaultLimit;

    public QueryEngine(TimezoneResolver resolver, OccurrenceExpander expander) {
        this(resolver, expander, DEFAULT_MAX_OCCURRENCES_PER_SERIES, DEFAULT_MAX_QUERY_RESULTS,
                DEFAULT_LIMIT);
    }

    /**
     * Creates a query engine.
     *
     * @param resolver the timezone resolver
     * @param expander the occurrence expander
     * @param maxOccurrencesPerSeries the most occurrences one series may
     *        contribute to a query, or -1 for no cap
     * @param maxQueryResults the ceiling on the page size
     * @param defaultLimit the page size when the query has none
     */
    public QueryEngine(TimezoneResolver resolver, OccurrenceExpander expander,
                       int maxOccurrencesPerSeries, int maxQueryResults, int defaultLimit) {
        if (maxQueryResults < 1) {
            throw new IllegalArgumentException("maxQueryResults: " + maxQueryResults);
        }
        if (defaultLimit < 1) {
            throw new IllegalArgumentException("defaultLimit: " + defaultLimit);
        }
        if (maxOccurrencesPerSeries < 1 && maxOccurrencesPerSeries != OccurrenceExpander.UNLIMITED) {
            throw new IllegalArgumentException("maxOccurrencesPerSeries: " + maxOccurrencesPerSeries);
        }
        this.resolver = resolver;
        this.expander = expander;
        this.maxOccurrencesPerSeries = maxOccurrencesPerSeries;
        this.maxQueryResults = maxQueryResults;
        this.defaultLimit = defaultLimit;
    }

    /**
     * Runs a query.
     *
     * @param query the query
     * @param household the household, supplying the fallback zone; may be
     *        null
     * @param events the candidate events
     * @return one page of occurrences
     * @throws TimekeepingException E_RANGE_INVALID if the window is empty
     */
    public QueryPage query(EventQuery query, Household household, Collection<Event> events)
            throws TimekeepingException {
        Instant from = query.getFrom();
        Instant to = query.getTo();
        if (!from.isBefore(to)) {
            throw new TimekeepingException(TimeErrorCode.RANGE_INVALID, from + " >= " + to);
        }
        if (household != null && !household.getId().equals(query.getHouseholdId())) {
            throw new IllegalArgumentException("household " + household.getId()
                    + " does not match query household " + query.getHouseholdId());
        }
        int limit = query.getLimit() > 0 ? Math.min(query.getLimit(), maxQueryResults) : defaultLimit;
        QueryCursor cursor = query.getCursor();
        Instant expandFrom = from;
        if (cursor != null && cursor.getStartUtc() > from.toEpochMilli()) {
            expandFrom = Instant.ofEpochMilli(cursor.getStartUtc());
        }

        PriorityQueue<Source> heap = new PriorityQueue<Source>();
        int skipped = 0;
        for (Event event : events) {
            if (!query.getHouseholdId().equals(event.getHouseholdId())) {
                continue;
            }
            try {
                Source source = open(event, household, from, expandFrom, to, cursor);
                if (source != null && source.advance()) {
                    heap.add(source);
                }
            } catch (TimekeepingException e) {
                skipped++;
                LOGGER.log(Level.WARNING, MessageFormat.format(L10N.getString("warn.skip_event"),
                        event.getId(), e.getCode().getCode(), e.getDetail()));
            }
        }

        List<Occurrence> page = new ArrayList<Occurrence>(Math.min(limit, 256));
        int toSkip = query.getOffset();
        QueryCursor next = null;
        while (!heap.isEmpty() && page.size() < limit) {
            Source source = heap.poll();
            Occurrence occurrence = source.current;
            boolean advanced = source.advance();
            if (advanced) {
                heap.add(source);
            }
            if (toSkip > 0) {
                toSkip--;
            } else {
                page.add(occurrence);
            }
            if (!advanced && source.capped) {
                // Later occurrences of this series were not expanded, so
                // nothing after this one can be merged in order
                next = QueryCursor.of(occurrence);
                if (LOGGER.isLoggable(Level.FINE)) {
                    LOGGER.fine(MessageFormat.format(L10N.getString("log.capped"),
                            source.event.getId(), maxOccurrencesPerSeries, next));
                }
                break;
            }
        }
        if (next == null && page.size() == limit && !heap.isEmpty()) {
            next = QueryCursor.of(page.get(page.size() - 1));
        }
        if (LOGGER.isLoggable(Level.FINE)) {
            LOGGER.fine(MessageFormat.format(L10N.getString("log.query"),
                    query.getHouseholdId(), from, to, page.size(), skipped, next != null));
        }
        return new QueryPage(page, limit, next);
    }

    /**
     * Lists every occurrence in the window, following cursors page by page
     * up to the configured ceiling.
     */
    public List<Occurrence> queryAll(EventQuery query, Household household, Collection<Event> events)
            throws TimekeepingException {
        List<Occurrence> all = new ArrayList<Occurrence>();
        EventQuery current = query;
        while (all.size() < maxQueryResults) {
            QueryPage page = query(current, household, events);
            all.addAll(page.getOccurrences());
            QueryCursor next = page.getNextCursor();
            if (next == null) {
                break;
            }
            current = query.after(next);
        }
        return all;
    }

    private Source open(Event event, Household household, Instant from, Instant expandFrom,
                        Instant to, QueryCursor cursor) throws TimekeepingException {
        long toMs = to.toEpochMilli();
        Long cachedStart = event.getStartAtUtc();
        if (cachedStart != null && cachedStart.longValue() - PREFILTER_SLACK_MS >= toMs) {
            return null;
        }
        if (!event.isRecurring()) {
            Long cachedLast = event.getEndAtUtc() != null ? event.getEndAtUtc() : cachedStart;
            if (cachedLast != null && cachedLast.longValue() + PREFILTER_SLACK_MS < from.toEpochMilli()) {
                return null;
            }
        }
        ResolvedZone zone = resolver.resolve(event, household);
        if (!event.isRecurring()) {
            ExpandedOccurrence single = expander.firstOccurrence(event, zone);
            Occurrence occurrence = toOccurrence(event, zone, single);
            if (!intersects(occurrence, from.toEpochMilli(), toMs)) {
                return null;
            }
            List<ExpandedOccurrence> one = new ArrayList<ExpandedOccurrence>(1);
            one.add(single);
            return new Source(event, zone, one.iterator(), cursor, OccurrenceExpander.UNLIMITED);
        }
        RecurrenceRule rule = RecurrenceRuleParser.parse(event.getRrule());
        ExdateSet exdates = ExdateParser.inspect(event.getExdates(), null, null, null).getValid();
        LocalDateTime anchor = TimezoneResolver.toLocalDateTime(event.getStartAt());
        Duration duration = Duration.ofMillis(Math.max(0L, event.getDurationMs()));
        Iterable<ExpandedOccurrence> sequence = expander.expand(rule, anchor, duration, zone,
                exdates, expandFrom, to);
        return new Source(event, zone, sequence.iterator(), cursor, maxOccurrencesPerSeries);
    }

    private static boolean intersects(Occurrence occurrence, long from, long to) {
        long start = occurrence.getStartUtc();
        long end = occurrence.getEndUtc();
        if (start == end) {
            return start >= from && start < to;
        }
        return start < to && end > from;
    }

    private static Occurrence toOccurrence(Event event, ResolvedZone zone, ExpandedOccurrence o) {
        return new Occurrence(event.getId(), o.getStartMillis(), o.getEndMillis(), zone.getId(),
                event.isRecurring());
    }

    /**
     * The occurrences of one event after the cursor, positioned on the next
     * one to merge. A source stops at the per-series cap and remembers that
     * it did.
     */
    private static class Source implements Comparable<Source> {

        final Event event;
        final ResolvedZone zone;
        final Iterator<ExpandedOccurrence> occurrences;
        final QueryCursor cursor;
        final int cap;
        int emitted;
        boolean capped;
        Occurrence current;

        Source(Event event, ResolvedZone zone, Iterator<ExpandedOccurrence> occurrences,
               QueryCursor cursor, int cap) {
            this.event = event;
            this.zone = zone;
            this.occurrences = occurrences;
            this.cursor = cursor;
            this.cap = cap;
        }

        boolean advance() {
            current = null;
            while (occurrences.hasNext()) {
                Occurrence occurrence = toOccurrence(event, zone, occurrences.next());
                if (cursor != null && !cursor.precedes(occurrence)) {
                    continue;
                }
                if (cap >= 0 && emitted >= cap) {
                    capped = true;
                    return false;
                }
                emitted++;
                current = occurrence;
                return true;
            }
            return false;
        }

        @Override
        public int compareTo(Source other) {
            return current.compareTo(other.current);
        }
    }
}
