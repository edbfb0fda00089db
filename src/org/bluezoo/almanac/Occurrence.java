/*
 * Occurrence.java
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

/**
 * One concrete, dated instance of an event, as returned to callers.
 *
 * <p>A recurring event appears once per occurrence; all instances share
 * the series' event id and are distinguished by their start instant.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class Occurrence implements Comparable<Occurrence> {

    private final String eventId;
    private final long startUtc;
    private final long endUtc;
    private final String zoneId;
    private final boolean recurring;

    /**
     * Creates an occurrence.
     *
     * @param eventId the id of the event or series
     * @param startUtc the absolute start instant in epoch milliseconds
     * @param endUtc the absolute end instant in epoch milliseconds
     * @param zoneId the zone the occurrence was resolved in
     * @param recurring whether the occurrence belongs to a series
     */
    public Occurrence(String eventId, long startUtc, long endUtc, String zoneId, boolean recurring) {
        if (eventId == null) {
            throw new NullPointerException("eventId");
        }
        if (endUtc < startUtc) {
            throw new IllegalArgumentException("end precedes start: " + endUtc + " < " + startUtc);
        }
        this.eventId = eventId;
        this.startUtc = startUtc;
        this.endUtc = endUtc;
        this.zoneId = zoneId;
        this.recurring = recurring;
    }

    public String getEventId() {
        return eventId;
    }

    public long getStartUtc() {
        return startUtc;
    }

    /**
     * Returns the end instant. Events without an end report their start.
     */
    public long getEndUtc() {
        return endUtc;
    }

    public String getZoneId() {
        return zoneId;
    }

    public boolean isRecurring() {
        return recurring;
    }

    /**
     * Returns an identifier unique to this instance within its household,
     * of the form {@code <event id>::<start utc ms>}.
     */
    public String getInstanceId() {
        return eventId + "::" + startUtc;
    }

    /**
     * Orders by start instant, then by event id.
     */
    @Override
    public int compareTo(Occurrence other) {
        int c = Long.compare(startUtc, other.startUtc);
        if (c != 0) {
            return c;
        }
        return eventId.compareTo(other.eventId);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof Occurrence)) {
            return false;
        }
        Occurrence other = (Occurrence) obj;
        return eventId.equals(other.eventId)
            && startUtc == other.startUtc
            && endUtc == other.endUtc;
    }

    @Override
    public int hashCode() {
        return eventId.hashCode() * 31 + Long.hashCode(startUtc);
    }

    @Override
    public String toString() {
        return getInstanceId() + "[" + startUtc + "-" + endUtc + " " + zoneId + "]";
    }
}
