/*
 * OccurrenceSequence.java
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

import org.bluezoo.almanac.exdate.ExdateSet;
import org.bluezoo.almanac.rrule.RecurrenceRule;
import org.bluezoo.almanac.tz.ResolvedZone;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * A lazy, restartable sequence of the occurrences of one series that
 * intersect a window, with excluded instants removed.
 *
 * <p>Each call to {@link #iterator()} starts a fresh walk from the anchor,
 * so the same sequence may be iterated any number of times, from any
 * thread, and always yields the same occurrences in ascending order.
 *
 * <p>An occurrence with no duration intersects the window
 * {@code [from, to)} when {@code from <= start < to}; otherwise when
 * {@code start < to && end > from}.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 * @see OccurrenceExpander#expand
 */
public final class OccurrenceSequence implements Iterable<ExpandedOccurrence> {

    private final RecurrenceRule rule;
    private final LocalDateTime anchor;
    private final Duration duration;
    private final ResolvedZone zone;
    private final ExdateSet exdates;
    private final Instant from;
    private final Instant to;
    private final int maxOccurrences;

    OccurrenceSequence(RecurrenceRule rule, LocalDateTime anchor, Duration duration,
                       ResolvedZone zone, ExdateSet exdates, Instant from, Instant to,
                       int maxOccurrences) {
        this.rule = rule;
        this.anchor = anchor;
        this.duration = duration;
        this.zone = zone;
        this.exdates = exdates;
        this.from = from;
        this.to = to;
        this.maxOccurrences = maxOccurrences;
    }

    public RecurrenceRule getRule() {
        return rule;
    }

    public ResolvedZone getZone() {
        return zone;
    }

    /**
     * Returns the start of the window, or null if unbounded.
     */
    public Instant getFrom() {
        return from;
    }

    /**
     * Returns the exclusive end of the window, or null if unbounded.
     */
    public Instant getTo() {
        return to;
    }

    @Override
    public Iterator<ExpandedOccurrence> iterator() {
        CandidateIterator candidates = new CandidateIterator(rule, anchor, duration, zone);
        if (from != null) {
            candidates.skipTo(from);
        }
        return new WindowIterator(candidates);
    }

    /**
     * Materializes the sequence. The rule must be bounded, or the window
     * closed, or the sequence capped.
     *
     * @return the occurrences in ascending order
     */
    public List<ExpandedOccurrence> toList() {
        if (to == null && maxOccurrences < 0 && !rule.isBounded()) {
            throw new IllegalStateException("Unbounded sequence: " + rule.toRuleString());
        }
        List<ExpandedOccurrence> list = new ArrayList<ExpandedOccurrence>();
        for (ExpandedOccurrence occurrence : this) {
            list.add(occurrence);
        }
        return list;
    }

    private boolean intersects(ExpandedOccurrence occurrence) {
        Instant start = occurrence.getStart();
        Instant end = occurrence.getEnd();
        if (start.equals(end)) {
            return (from == null || !start.isBefore(from)) && (to == null || start.isBefore(to));
        }
        return (to == null || start.isBefore(to)) && (from == null || end.isAfter(from));
    }

    private class WindowIterator implements Iterator<ExpandedOccurrence> {

        private final CandidateIterator candidates;
        private ExpandedOccurrence next;
        private int emitted;
        private boolean done;

        WindowIterator(CandidateIterator candidates) {
            this.candidates = candidates;
        }

        @Override
        public boolean hasNext() {
            while (next == null && !done) {
                if (!candidates.hasNext()
                        || (maxOccurrences >= 0 && emitted >= maxOccurrences)) {
                    done = true;
                    break;
                }
                ExpandedOccurrence candidate = candidates.next();
                if (to != null && !candidate.getStart().isBefore(to)) {
                    done = true;
                    break;
                }
                if (exdates.contains(candidate.getStart()) || !intersects(candidate)) {
                    continue;
                }
                next = candidate;
                emitted++;
            }
            return next != null;
        }

        @Override
        public ExpandedOccurrence next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            ExpandedOccurrence result = next;
            next = null;
            return result;
        }
    }
}
