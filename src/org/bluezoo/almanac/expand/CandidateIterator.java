/*
 * CandidateIterator.java
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

import org.bluezoo.almanac.rrule.Frequency;
import org.bluezoo.almanac.rrule.RecurrenceRule;
import org.bluezoo.almanac.tz.ResolvedZone;

import java.time.DayOfWeek;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.temporal.ChronoUnit;
import java.time.temporal.TemporalAdjusters;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * Walks every occurrence of a series in order, excluded ones included,
 * stopping at the COUNT or UNTIL bound.
 *
 * <p>Each candidate is produced as a wall-clock time and converted to UTC on
 * its own, so a daily series keeps its local time across offset changes.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
class CandidateIterator implements Iterator<ExpandedOccurrence> {

    private final RecurrenceRule rule;
    private final LocalDateTime anchor;
    private final Duration duration;
    private final ResolvedZone zone;
    private final LocalTime time;

    // Simple stepping: DAILY, or WEEKLY without BYDAY
    private final long stepDays;

    // BYDAY stepping: candidate k falls in an interval-week and on one of
    // the listed days, both derived from k
    private final boolean byDay;
    private final List<DayOfWeek> days;
    private final LocalDate weekStart;
    private final long periodDays;
    private final int firstPeriodCount;
    private final int firstDayIndex;

    private long index;
    private ExpandedOccurrence next;
    private boolean done;

    CandidateIterator(RecurrenceRule rule, LocalDateTime anchor, Duration duration, ResolvedZone zone) {
        this.rule = rule;
        this.anchor = anchor;
        this.duration = duration;
        this.zone = zone;
        this.time = anchor.toLocalTime();
        int interval = rule.getInterval();
        stepDays = (long) rule.getFrequency().getPeriodDays() * interval;
        byDay = rule.getFrequency() == Frequency.WEEKLY && !rule.getByDay().isEmpty();
        days = new ArrayList<DayOfWeek>(rule.getEffectiveByDay(anchor.getDayOfWeek()));
        weekStart = anchor.toLocalDate().with(TemporalAdjusters.previousOrSame(DayOfWeek.MONDAY));
        periodDays = 7L * interval;
        int count = 0;
        int first = -1;
        for (int i = 0; i < days.size(); i++) {
            if (days.get(i).compareTo(anchor.getDayOfWeek()) >= 0) {
                count++;
                if (first < 0) {
                    first = i;
                }
            }
        }
        // Days before the anchor in its own week are not candidates
        firstPeriodCount = count;
        firstDayIndex = first < 0 ? 0 : first;
    }

    /**
     * Skips candidates that certainly end before the given instant.
     * Must be called before the first call to {@link #next}.
     *
     * @param from the earliest instant of interest
     */
    void skipTo(Instant from) {
        LocalDate target = zone.toLocal(from).minus(duration).toLocalDate().minusDays(2);
        LocalDate anchorDate = anchor.toLocalDate();
        if (!target.isAfter(anchorDate)) {
            return;
        }
        long skip;
        if (byDay) {
            long p = ChronoUnit.DAYS.between(weekStart, target) / periodDays;
            if (p < 1) {
                return;
            }
            skip = firstPeriodCount + (p - 1) * days.size();
        } else {
            skip = ChronoUnit.DAYS.between(anchorDate, target) / stepDays;
        }
        if (skip > index) {
            index = skip;
        }
    }

    /**
     * Returns the last candidate of a bounded series without walking it.
     * The COUNT bound gives the last index directly; an UNTIL bound gives an
     * index from its local date, corrected by the few candidates that fall
     * after UNTIL on that date.
     *
     * @return the last candidate, or null if the series is unbounded or
     *         empty
     * @throws ArithmeticException if the last candidate lies beyond the
     *         supported date range
     * @throws java.time.DateTimeException likewise
     */
    ExpandedOccurrence last() {
        if (!rule.isBounded()) {
            return null;
        }
        long k = Long.MAX_VALUE;
        Instant until = rule.getUntil();
        if (until != null) {
            // An offset change can put a candidate one local day past UNTIL
            LocalDate untilDate = zone.toLocal(until).toLocalDate().plusDays(1);
            if (byDay) {
                long d = ChronoUnit.DAYS.between(weekStart, untilDate);
                if (d < 0L) {
                    return null;
                }
                k = firstPeriodCount + Math.multiplyExact(d / periodDays, (long) days.size()) - 1L;
            } else {
                long d = ChronoUnit.DAYS.between(anchor.toLocalDate(), untilDate);
                if (d < 0L) {
                    return null;
                }
                k = d / stepDays;
            }
        }
        if (rule.hasCount()) {
            k = Math.min(k, rule.getCount() - 1L);
        }
        for (; k >= 0L; k--) {
            ExpandedOccurrence candidate = candidate(k);
            if (until == null || !candidate.getStart().isAfter(until)) {
                return candidate;
            }
        }
        return null;
    }

    @Override
    public boolean hasNext() {
        if (next == null && !done) {
            next = advance();
            if (next == null) {
                done = true;
            }
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

    private ExpandedOccurrence advance() {
        if (rule.hasCount() && index >= rule.getCount()) {
            return null;
        }
        ExpandedOccurrence candidate = candidate(index);
        Instant until = rule.getUntil();
        if (until != null && candidate.getStart().isAfter(until)) {
            return null;
        }
        index++;
        return candidate;
    }

    /**
     * Returns candidate k of the series, ignoring the bound.
     */
    ExpandedOccurrence candidate(long k) {
        LocalDateTime local = localAt(k);
        Instant start = zone.toInstant(local);
        Instant end = zone.toInstant(local.plus(duration));
        if (end.isBefore(start)) {
            end = start;
        }
        return new ExpandedOccurrence(k, local, start, end);
    }

    private LocalDateTime localAt(long k) {
        if (!byDay) {
            return anchor.plusDays(Math.multiplyExact(k, stepDays));
        }
        long period;
        int dayIndex;
        if (k < firstPeriodCount) {
            period = 0L;
            dayIndex = firstDayIndex + (int) k;
        } else {
            long j = k - firstPeriodCount;
            period = 1L + j / days.size();
            dayIndex = (int) (j % days.size());
        }
        LocalDate base = weekStart.plusDays(Math.multiplyExact(period, periodDays));
        return LocalDateTime.of(base.plusDays(days.get(dayIndex).ordinal()), time);
    }
}
