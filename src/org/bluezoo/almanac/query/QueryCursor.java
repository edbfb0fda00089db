/*
 * QueryCursor.java
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

import org.bluezoo.almanac.Occurrence;

/**
 * Keyset position in an ordered occurrence listing: the start instant and
 * event id of the last occurrence already returned. A query resumed from a
 * cursor returns only occurrences strictly after it.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class QueryCursor {

    private final long startUtc;
    private final String eventId;

    public QueryCursor(long startUtc, String eventId) {
        if (eventId == null) {
            throw new NullPointerException("eventId");
        }
        this.startUtc = startUtc;
        this.eventId = eventId;
    }

    /**
     * Returns the cursor positioned on the given occurrence.
     */
    public static QueryCursor of(Occurrence occurrence) {
        return new QueryCursor(occurrence.getStartUtc(), occurrence.getEventId());
    }

    /**
     * Parses a cursor token produced by {@link #toString()}.
     *
     * @param token the token
     * @return the cursor
     * @throws IllegalArgumentException if the token is malformed
     */
    public static QueryCursor parse(String token) {
        int colon = (token == null) ? -1 : token.indexOf(':');
        if (colon < 1 || colon == token.length() - 1) {
            throw new IllegalArgumentException("Invalid cursor: " + token);
        }
        try {
            long start = Long.parseLong(token.substring(0, colon));
            return new QueryCursor(start, token.substring(colon + 1));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid cursor: " + token, e);
        }
    }

    public long getStartUtc() {
        return startUtc;
    }

    public String getEventId() {
        return eventId;
    }

    /**
     * Returns true if the occurrence sorts strictly after this cursor.
     */
    public boolean precedes(Occurrence occurrence) {
        if (occurrence.getStartUtc() != startUtc) {
            return occurrence.getStartUtc() > startUtc;
        }
        return occurrence.getEventId().compareTo(eventId) > 0;
    }

    @Override
    public boolean equals(Object obj) {
        if (!(obj instanceof QueryCursor)) {
            return false;
        }
        QueryCursor other = (QueryCursor) obj;
        return startUtc == other.startUtc && eventId.equals(other.eventId);
    }

    @Override
    public int hashCode() {
        return Long.hashCode(startUtc) * 31 + eventId.hashCode();
    }

    @Override
    public String toString() {
        return startUtc + ":" + eventId;
    }
}
