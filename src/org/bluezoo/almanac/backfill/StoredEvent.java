/*
 * StoredEvent.java
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

package org.bluezoo.almanac.backfill;

import org.bluezoo.almanac.Event;

import java.util.Objects;

/**
 * An event row as held by storage, before or after normalization.
 *
 * <p>Unlike {@link Event}, the date columns may carry any
 * {@link LegacyTimestamp} encoding. The sequence is the storage row order
 * used for batching and checkpoints.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class StoredEvent {

    private final long sequence;
    private final String id;
    private final String householdId;
    private final LegacyTimestamp startAt;
    private final LegacyTimestamp endAt;
    private final String tz;
    private final String rrule;
    private final String exdates;
    private final Long startAtUtc;
    private final Long endAtUtc;
    private final Long reminder;

    public StoredEvent(long sequence, String id, String householdId, LegacyTimestamp startAt,
                       LegacyTimestamp endAt, String tz, String rrule, String exdates,
                       Long startAtUtc, Long endAtUtc, Long reminder) {
        if (id == null) {
            throw new NullPointerException("id");
        }
        if (householdId == null) {
            throw new NullPointerException("householdId");
        }
        if (startAt == null) {
            throw new NullPointerException("startAt");
        }
        this.sequence = sequence;
        this.id = id;
        this.householdId = householdId;
        this.startAt = startAt;
        this.endAt = endAt;
        this.tz = tz;
        this.rrule = rrule;
        this.exdates = exdates;
        this.startAtUtc = startAtUtc;
        this.endAtUtc = endAtUtc;
        this.reminder = reminder;
    }

    /**
     * Returns the row for a canonical event.
     *
     * @param sequence the storage row order
     * @param event the event
     */
    public static StoredEvent of(long sequence, Event event) {
        Long endAt = event.getEndAt();
        return new StoredEvent(sequence, event.getId(), event.getHouseholdId(),
                LegacyTimestamp.millis(event.getStartAt()),
                endAt == null ? null : LegacyTimestamp.millis(endAt.longValue()),
                event.getTz(), event.getRrule(), event.getExdates(),
                event.getStartAtUtc(), event.getEndAtUtc(), event.getReminder());
    }

    public long getSequence() {
        return sequence;
    }

    public String getId() {
        return id;
    }

    public String getHouseholdId() {
        return householdId;
    }

    public LegacyTimestamp getStartAt() {
        return startAt;
    }

    public LegacyTimestamp getEndAt() {
        return endAt;
    }

    public String getTz() {
        return tz;
    }

    public String getRrule() {
        return rrule;
    }

    public String getExdates() {
        return exdates;
    }

    public Long getStartAtUtc() {
        return startAtUtc;
    }

    public Long getEndAtUtc() {
        return endAtUtc;
    }

    public Long getReminder() {
        return reminder;
    }

    /**
     * Returns true if both date columns use the canonical encoding.
     */
    public boolean hasCanonicalDates() {
        return startAt.isCanonical() && (endAt == null || endAt.isCanonical());
    }

    /**
     * Returns the canonical event for this row.
     *
     * @throws IllegalStateException if a date column is not canonical
     */
    public Event toEvent() {
        if (!hasCanonicalDates()) {
            throw new IllegalStateException("Row " + id + " has legacy dates: " + startAt + ", " + endAt);
        }
        Event event = new Event(id, householdId, ((LegacyTimestamp.EpochMillis) startAt).getValue());
        if (endAt != null) {
            event.setEndAt(Long.valueOf(((LegacyTimestamp.EpochMillis) endAt).getValue()));
        }
        event.setTz(tz);
        event.setRrule(rrule);
        event.setExdates(exdates);
        event.setStartAtUtc(startAtUtc);
        event.setEndAtUtc(endAtUtc);
        event.setReminder(reminder);
        return event;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof StoredEvent)) {
            return false;
        }
        StoredEvent other = (StoredEvent) obj;
        return sequence == other.sequence
            && id.equals(other.id)
            && householdId.equals(other.householdId)
            && startAt.equals(other.startAt)
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
        return Objects.hash(Long.valueOf(sequence), id);
    }

    /**
     * Returns a stable, column-ordered rendering of the row.
     */
    @Override
    public String toString() {
        return sequence + "|" + id + "|" + householdId
            + "|start_at=" + startAt
            + "|end_at=" + endAt
            + "|tz=" + tz
            + "|rrule=" + rrule
            + "|exdates=" + exdates
            + "|start_at_utc=" + startAtUtc
            + "|end_at_utc=" + endAtUtc
            + "|reminder=" + reminder;
    }
}
