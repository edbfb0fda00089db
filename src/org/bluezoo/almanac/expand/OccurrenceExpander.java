/*
 * OccurrenceExpander.java
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

package org.bluezoo.almanac.expand;

import org.bluezoo.almanac.Event;
import org.bluezoo.almanac.TimekeepingException;
import org.bluezoo.almanac.exdate.ExdateSet;
import org.bluezoo.almanac.rrule.RecurrenceRule;
import org.bluezoo.almanac.rrule.RecurrenceRuleParser;
import org.bluezoo.almanac.tz.ResolvedZone;
import org.bluezoo.almanac.tz.TimezoneResolver;

import java.text.MessageFormat;
import java.time.DateTimeException;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.util.Iterator;
import java.util.ResourceBundle;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Expands recurring series into concrete occurrences.
 *
 * <p>Starting from the anchor, the expander steps forward by INTERVAL days
 * or weeks; a weekly rule with BYDAY instead enumerates the matching
 * weekdays of each interval-week in ascending order. Every candidate is a
 * wall-clock time converted to UTC through the series zone, so stepping one
 * day always means the same local time on the next day. The series stops
 * when COUNT candidates have been produced or a candidate passes UNTIL,
 * whichever comes first. Excluded candidates consume COUNT like any other.
 *
 * <p>A BYDAY rule whose anchor weekday is not listed does not produce the
 * anchor itself; its first occurrence is the first listed weekday on or
 * after the anchor date.
 *
 * <p>The expander holds no state and may be shared between threads.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class OccurrenceExpander {

    private static final Logger LOGGER = Logger.getLogger(OccurrenceExpander.class.getName());
    private static final ResourceBundle L10N = ResourceBundle.getBundle("org.bluezoo.almanac.expand.L10N");

    /**
     * Value of {@code maxOccurrences} meaning no cap.
     */
    public static final int UNLIMITED = -1;

    /**
     * Returns the occurrences of a series intersecting a window.
     *
     * @param rule the recurrence rule
     * @param anchor the wall-clock start of the first occurrence
     * @param duration the wall-clock duration of each occurrence
     * @param zone the series zone
     * @param exdates the excluded instants, or null
     * @param from the inclusive window start, or null for unbounded
     * @param to the exclusive window end, or null for unbounded
     * @param maxOccurrences the maximum number of occurrences to yield, or
     *        {@link #UNLIMITED}
     * @return a lazy, restartable sequence
     */
    public OccurrenceSequence expand(RecurrenceRule rule, LocalDateTime anchor, Duration duration,
                                     ResolvedZone zone, ExdateSet exdates, Instant from, Instant to,
                                     int maxOccurrences) {
        if (rule == null) {
            throw new NullPointerException("rule");
        }
        if (anchor == null) {
            throw new NullPointerException("anchor");
        }
        if (zone == null) {
            throw new NullPointerException("zone");
        }
        if (duration == null) {
            duration = Duration.ZERO;
        } else if (duration.isNegative()) {
            throw new IllegalArgumentException("negative duration: " + duration);
        }
        if (from != null && to != null && !from.isBefore(to)) {
            throw new IllegalArgumentException("empty window: " + from + " >= " + to);
        }
        if (LOGGER.isLoggable(Level.FINEST)) {
            LOGGER.finest(MessageFormat.format(L10N.getString("log.expand"),
                    rule.toRuleString(), anchor, zone.getId(), from, to));
        }
        return new OccurrenceSequence(rule, anchor, duration, zone,
                exdates == null ? ExdateSet.EMPTY : exdates, from, to, maxOccurrences);
    }

    /**
     * Returns the occurrences of a series intersecting a window, uncapped.
     */
    public OccurrenceSequence expand(RecurrenceRule rule, LocalDateTime anchor, Duration duration,
                                     ResolvedZone zone, ExdateSet exdates, Instant from, Instant to) {
        return expand(rule, anchor, duration, zone, exdates, from, to, UNLIMITED);
    }

    /**
     * Returns the first occurrence of a series, ignoring exclusions.
     *
     * @return the first occurrence, or null if UNTIL precedes it
     */
    public ExpandedOccurrence firstOccurrence(RecurrenceRule rule, LocalDateTime anchor,
                                              Duration duration, ResolvedZone zone) {
        Iterator<ExpandedOccurrence> i =
            new CandidateIterator(rule, anchor, durationOrZero(duration), zone);
        return i.hasNext() ? i.next() : null;
    }

    /**
     * Returns the first occurrence of an event: the first generated
     * occurrence of a series, or the event itself when it does not recur.
     * A series whose UNTIL precedes every candidate falls back to its
     * anchor. The UTC caches of an event row describe this occurrence.
     *
     * @param event the event
     * @param zone the effective zone of the event
     * @return the first occurrence
     * @throws TimekeepingException if the rule cannot be parsed
     */
    public ExpandedOccurrence firstOccurrence(Event event, ResolvedZone zone)
            throws TimekeepingException {
        LocalDateTime anchor = TimezoneResolver.toLocalDateTime(event.getStartAt());
        Duration duration = Duration.ofMillis(Math.max(0L, event.getDurationMs()));
        if (event.isRecurring()) {
            RecurrenceRule rule = RecurrenceRuleParser.parse(event.getRrule());
            ExpandedOccurrence first = firstOccurrence(rule, anchor, duration, zone);
            if (first != null) {
                return first;
            }
        }
        Instant start = zone.toInstant(anchor);
        Instant end = zone.toInstant(anchor.plus(duration));
        return new ExpandedOccurrence(0L, anchor, start, end.isBefore(start) ? start : end);
    }

    /**
     * Returns the last occurrence of a bounded series, ignoring exclusions.
     * The occurrence is computed from the bound, so the cost does not grow
     * with COUNT or with the distance to UNTIL.
     *
     * @return the last occurrence, or null if the series is unbounded,
     *         empty, or ends beyond the supported date range
     */
    public ExpandedOccurrence lastOccurrence(RecurrenceRule rule, LocalDateTime anchor,
                                             Duration duration, ResolvedZone zone) {
        try {
            return new CandidateIterator(rule, anchor, durationOrZero(duration), zone).last();
        } catch (ArithmeticException | DateTimeException e) {
            if (LOGGER.isLoggable(Level.FINE)) {
                LOGGER.fine(MessageFormat.format(L10N.getString("log.beyond_range"),
                        rule.toRuleString(), e.getMessage()));
            }
            return null;
        }
    }

    /**
     * Returns true if an instant is exactly the start of some occurrence of
     * the series, excluded or not.
     */
    public boolean isOccurrence(RecurrenceRule rule, LocalDateTime anchor, ResolvedZone zone,
                                Instant instant) {
        CandidateIterator i = new CandidateIterator(rule, anchor, Duration.ZERO, zone);
        i.skipTo(instant);
        while (i.hasNext()) {
            Instant start = i.next().getStart();
            int cmp = start.compareTo(instant);
            if (cmp == 0) {
                return true;
            }
            if (cmp > 0) {
                return false;
            }
        }
        return false;
    }

    private static Duration durationOrZero(Duration duration) {
        return duration == null ? Duration.ZERO : duration;
    }
}
