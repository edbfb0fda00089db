/*
 * RecurrenceRule.java
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

package org.bluezoo.almanac.rrule;

import java.time.DayOfWeek;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Iterator;
import java.util.Set;

/**
 * A parsed, validated recurrence rule.
 *
 * <p>A rule has a frequency, an interval, an optional bound and, for weekly
 * rules, an optional set of weekdays. The bound is a {@code COUNT}, an
 * {@code UNTIL} instant, both (the series ends at whichever is reached
 * first) or neither (the series is unbounded and only a query window stops
 * expansion).
 *
 * <p>Instances are immutable and safe to share between threads.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 * @see RecurrenceRuleParser
 */
public final class RecurrenceRule {

    /**
     * Value of {@link #getCount()} when the rule has no {@code COUNT}.
     */
    public static final int NO_COUNT = -1;

    static final DateTimeFormatter UNTIL_FORMAT =
        DateTimeFormatter.ofPattern("yyyyMMdd'T'HHmmss'Z'").withZone(ZoneOffset.UTC);

    private final Frequency frequency;
    private final int interval;
    private final int count;
    private final Instant until;
    private final Set<DayOfWeek> byDay;

    /**
     * Creates a rule.
     *
     * @param frequency the frequency
     * @param interval the interval, at least 1
     * @param count the occurrence count, or {@link #NO_COUNT}
     * @param until the inclusive end instant, or null
     * @param byDay the weekdays for a weekly rule, may be null or empty
     */
    public RecurrenceRule(Frequency frequency, int interval, int count, Instant until,
                          Set<DayOfWeek> byDay) {
        if (frequency == null) {
            throw new NullPointerException("frequency");
        }
        if (interval < 1) {
            throw new IllegalArgumentException("interval must be at least 1");
        }
        if (count != NO_COUNT && count < 1) {
            throw new IllegalArgumentException("count must be at least 1");
        }
        EnumSet<DayOfWeek> days = EnumSet.noneOf(DayOfWeek.class);
        if (byDay != null) {
            days.addAll(byDay);
        }
        if (frequency != Frequency.WEEKLY && !days.isEmpty()) {
            throw new IllegalArgumentException("BYDAY requires FREQ=WEEKLY");
        }
        this.frequency = frequency;
        this.interval = interval;
        this.count = count;
        this.until = until;
        this.byDay = Collections.unmodifiableSet(days);
    }

    public Frequency getFrequency() {
        return frequency;
    }

    public int getInterval() {
        return interval;
    }

    /**
     * Returns the maximum number of occurrences, or {@link #NO_COUNT}.
     * Occurrences later removed by EXDATE still count.
     */
    public int getCount() {
        return count;
    }

    public boolean hasCount() {
        return count != NO_COUNT;
    }

    /**
     * Returns the inclusive end instant, or null.
     */
    public Instant getUntil() {
        return until;
    }

    /**
     * Returns true if the series has a finite number of occurrences.
     */
    public boolean isBounded() {
        return count != NO_COUNT || until != null;
    }

    /**
     * Returns the explicit weekdays, in ascending order from Monday.
     * The set is empty when the rule has no {@code BYDAY}.
     */
    public Set<DayOfWeek> getByDay() {
        return byDay;
    }

    /**
     * Returns the weekdays a weekly series actually lands on: the explicit
     * {@code BYDAY} set, or the weekday of the anchor when that set is empty.
     *
     * @param anchorDay the weekday of the series anchor
     * @return the effective weekdays, ascending from Monday
     */
    public Set<DayOfWeek> getEffectiveByDay(DayOfWeek anchorDay) {
        if (byDay.isEmpty()) {
            return Collections.unmodifiableSet(EnumSet.of(anchorDay));
        }
        return byDay;
    }

    /**
     * Returns the canonical rule string for this rule.
     */
    public String toRuleString() {
        StringBuilder buf = new StringBuilder();
        buf.append("FREQ=").append(frequency.name());
        if (interval != 1) {
            buf.append(";INTERVAL=").append(interval);
        }
        if (count != NO_COUNT) {
            buf.append(";COUNT=").append(count);
        }
        if (until != null) {
            buf.append(";UNTIL=").append(UNTIL_FORMAT.format(until));
        }
        if (!byDay.isEmpty()) {
            buf.append(";BYDAY=");
            for (Iterator<DayOfWeek> i = byDay.iterator(); i.hasNext(); ) {
                buf.append(RecurrenceRuleParser.dayCode(i.next()));
                if (i.hasNext()) {
                    buf.append(',');
                }
            }
        }
        return buf.toString();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof RecurrenceRule)) {
            return false;
        }
        RecurrenceRule other = (RecurrenceRule) obj;
        return frequency == other.frequency
            && interval == other.interval
            && count == other.count
            && (until == null ? other.until == null : until.equals(other.until))
            && byDay.equals(other.byDay);
    }

    @Override
    public int hashCode() {
        return toRuleString().hashCode();
    }

    @Override
    public String toString() {
        return toRuleString();
    }
}
