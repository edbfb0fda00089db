/*
 * EventQuery.java
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

import java.time.Instant;

/**
 * A household-scoped occurrence query over the window {@code [from, to)}.
 *
 * <p>A limit of zero selects the engine's default page size. Pagination may
 * use a keyset cursor, an offset, or both; the offset is applied after the
 * cursor.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class EventQuery {

    private final String householdId;
    private final Instant from;
    private final Instant to;
    private int limit;
    private int offset;
    private QueryCursor cursor;

    public EventQuery(String householdId, Instant from, Instant to) {
        if (householdId == null) {
            throw new NullPointerException("householdId");
        }
        if (from == null) {
            throw new NullPointerException("from");
        }
        if (to == null) {
            throw new NullPointerException("to");
        }
        this.householdId = householdId;
        this.from = from;
        this.to = to;
    }

    public String getHouseholdId() {
        return householdId;
    }

    public Instant getFrom() {
        return from;
    }

    public Instant getTo() {
        return to;
    }

    public int getLimit() {
        return limit;
    }

    public void setLimit(int limit) {
        if (limit < 0) {
            throw new IllegalArgumentException("limit: " + limit);
        }
        this.limit = limit;
    }

    public int getOffset() {
        return offset;
    }

    public void setOffset(int offset) {
        if (offset < 0) {
            throw new IllegalArgumentException("offset: " + offset);
        }
        this.offset = offset;
    }

    public QueryCursor getCursor() {
        return cursor;
    }

    public void setCursor(QueryCursor cursor) {
        this.cursor = cursor;
    }

    /**
     * Returns a copy of this query resuming after the given cursor, with no
     * offset.
     */
    public EventQuery after(QueryCursor next) {
        EventQuery query = new EventQuery(householdId, from, to);
        query.limit = limit;
        query.cursor = next;
        return query;
    }

    @Override
    public String toString() {
        return "EventQuery[household=" + householdId + ", from=" + from + ", to=" + to
            + ", limit=" + limit + ", offset=" + offset + ", cursor=" + cursor + "]";
    }
}
