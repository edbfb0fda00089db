/*
 * Frequency.java
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

/**
 * Supported recurrence frequencies.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 * @see RecurrenceRule
 */
public enum Frequency {

    /**
     * The series repeats every {@code INTERVAL} days.
     */
    DAILY(1),

    /**
     * The series repeats every {@code INTERVAL} weeks, optionally on
     * several weekdays.
     */
    WEEKLY(7);

    private final int days;

    Frequency(int days) {
        this.days = days;
    }

    /**
     * Returns the length of one period of this frequency in days.
     *
     * @return 1 for daily, 7 for weekly
     */
    public int getPeriodDays() {
        return days;
    }
}
