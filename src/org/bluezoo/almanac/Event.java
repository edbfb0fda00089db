/*
 * Event.java
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

import java.util.Objects;

/**
 * A canonical event row: the authoritative definition of a single event or
 * of a recurring series.
 *
 * <p>{@code startAt} and {@code endAt} are wall-clock anchors: epoch
 * milliseconds read as if the event's zone were UTC, so 09:00 on
 * 2024-03-01 in any zone is stored as the epoch value of
 * 2024-03-01T09:00Z. {@code startAtUtc} and {@code endAtUtc} are a cache of
 * the absolute instants of the first occurrence; the source of truth is
 * always {@code startAt} + {@code tz} + {@code rrule}.
 *
 * <p>Field names mirror the storage schema columns {@code start_at},
 * {@code end_at}, {@code tz}, {@code rrule}, {@code exdates},
 * {@code start_at_utc} and {@code end_at_utc}.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class Event {

    private final String id;
    private final String householdId;
    private long startAt;
    private Long endAt;
    private String tz;
    private String rrule;
    private String exdates;
    private Long startAtUtc;
    private Long endAtUtc;
    private Long reminder;

    /**
     * Creates a new event.
     *
     * @param id the stable event identifier
     * @param householdId the owning household
     * @param startAt the wall-clock start anchor in local-naive milliseconds
     */
    public Event(String id, String householdId, long startAt) {
        if (id == null) {
            throw new NullPointerException("id");
        }
        if (householdId == null) {
            throw new NullPointerException("householdId");
        }
        this.id = id;
        this.householdId = householdId;
        this.startAt = startAt;
    }

    /**
     * Copy constructor.
     *
     * @param other the event to copy
     */
    public Event(Event other) {
        this(other.id, other.householdId, other.startAt);
        this.endAt = other.endAt;
        this.tz = other.tz;
        this.rrule = other.rrule;
        this.exdates = other.exdates;
        this.startAtUtc = other.startAtUtc;
        this.endAtUtc = other.endAtUtc;
        this.reminder = other.reminder;
    }

    public String getId() {
        return id;
    }

    public String getHouseholdId() {
        return householdId;
    }

    public long getStartAt() {
        return startAt;
    }

    public void setStartAt(long startAt) {
        this.startAt = startAt;
    }

    /**
     * Returns the wall-clock end anchor, or null for an open-ended event.
     */
    public Long getEndAt() {
        return endAt;
    }

    public void setEndAt(Long endAt) {
        this.endAt = endAt;
    }

    /**
     * Returns the IANA zone name, or null for a floating event.
     */
    public String getTz() {
        return tz;
    }

    public void setTz(String tz) {
        this.tz = tz;
    }

    /**
     * Returns the recurrence rule, or null for a single event.
     */
    public String getRrule() {
        return rrule;
    }

    public void setRrule(String rrule) {
        this.rrule = rrule;
    }

    /**
     * Returns the comma-separated excluded UTC instants, or null.
     */
    public String getExdates() {
        return exdates;
    }

    public void setExdates(String exdates) {
        this.exdates = exdates;
    }

    public Long getStartAtUtc() {
        return startAtUtc;
    }

    public void setStartAtUtc(Long startAtUtc) {
        this.startAtUtc = startAtUtc;
    }

    public Long getEndAtUtc() {
        return endAtUtc;
    }

    public void setEndAtUtc(Long endAtUtc) {
        this.endAtUtc = endAtUtc;
    }

    /**
     * Returns the absolute reminder instant in epoch milliseconds, or null.
     * Reminders are independent of recurrence.
     */
    public Long getReminder() {
        return reminder;
    }

    public void setReminder(Long reminder) {
        this.reminder = reminder;
    }

    /**
     * Returns true if this event defines a recurring series.
     */
    public boolean isRecurring() {
        return rrule != null && !rrule.trim().isEmpty();
    }

    /**
     * Returns the wall-clock duration of each occurrence in milliseconds.
     * Open-ended events have zero duration.
     */
    public long getDurationMs() {
        return (endAt == null) ? 0L : endAt - startAt;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof Event)) {
            return false;
        }
        Event other = (Event) obj;
        return id.equals(other.id)
            && householdId.equals(other.householdId)
            && startAt == other.startAt
            && Objects.equals(endAt, other.endAt)
            && Objects.equals(tz, other.tz)
            && Objects.equals(rrule, other.rrule)
            && Objects.equals(exdates, other.exdates)
            && Objects.equals(startAtUtc, other.startAtUtc)
            && Objects.equals(endAtUtc, other.endAtUtc)
            && Objects.equals(reminder, other.reminder);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, householdId, startAt, endAt, tz, rrule);
    }

    @Override
    public String toString() {
        StringBuilder buf = new StringBuilder("Event[");
        buf.append("id=").append(id);
        buf.append(",household_id=").append(householdId);
        buf.append(",start_at=").append(startAt);
        buf.append(",end_at=").append(endAt);
        buf.append(",tz=").append(tz);
        buf.append(",rrule=").append(rrule);
        buf.append(",exdates=").append(exdates);
        buf.append(",start_at_utc=").append(startAtUtc);
        buf.append(",end_at_utc=").append(endAtUtc);
        buf.append(",reminder=").append(reminder);
        buf.append(']');
        return buf.toString();
    }
}
