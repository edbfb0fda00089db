/*
 * ExpandedOccurrence.java
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

import java.time.Instant;
import java.time.LocalDateTime;

/**
 * A single generated occurrence of a series.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class ExpandedOccurrence {

    private final long index;
    private final LocalDateTime localStart;
    private final Instant start;
    private final Instant end;

    ExpandedOccurrence(long index, LocalDateTime localStart, Instant start, Instant end) {
        this.index = index;
        this.localStart = localStart;
        this.start = start;
        this.end = end;
    }

    /**
     * Returns the zero-based position of this occurrence in the series.
     * Excluded occurrences keep their position, so this is also the number
     * of COUNT units consumed before it.
     */
    public long getIndex() {
        return index;
    }

    /**
     * Returns the wall-clock start in the series zone.
     */
    public LocalDateTime getLocalStart() {
        return localStart;
    }

    public Instant getStart() {
        return start;
    }

    public Instant getEnd() {
        return end;
    }

    public long getStartMillis() {
        return start.toEpochMilli();
    }

    public long getEndMillis() {
        return end.toEpochMilli();
    }

    @Override
    public boolean equals(Object obj) {
        if (!(obj instanceof ExpandedOccurrence)) {
            return false;
        }
        ExpandedOccurrence other = (ExpandedOccurrence) obj;
        return index == other.index && start.equals(other.start) && end.equals(other.end);
    }

    @Override
    public int hashCode() {
        return start.hashCode() * 31 + (int) index;
    }

    @Override
    public String toString() {
        return "#" + index + " " + localStart + " [" + start + ", " + end + ")";
    }
}
