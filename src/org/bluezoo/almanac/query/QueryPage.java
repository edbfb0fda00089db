/*
 * QueryPage.java
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

import java.util.Collections;
import java.util.List;

/**
 * One page of an occurrence listing.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class QueryPage {

    private final List<Occurrence> occurrences;
    private final int limit;
    private final QueryCursor nextCursor;

    QueryPage(List<Occurrence> occurrences, int limit, QueryCursor nextCursor) {
        this.occurrences = Collections.unmodifiableList(occurrences);
        this.limit = limit;
        this.nextCursor = nextCursor;
    }

    /**
     * Returns the occurrences, ordered by start instant then event id.
     */
    public List<Occurrence> getOccurrences() {
        return occurrences;
    }

    /**
     * Returns the effective page size used.
     */
    public int getLimit() {
        return limit;
    }

    /**
     * Returns true if further occurrences may follow this page. A page can
     * be short of the limit and still have more when a series reached its
     * per-page cap.
     */
    public boolean mayHaveMore() {
        return nextCursor != null;
    }

    /**
     * Returns the cursor to resume from, or null if this is the last page.
     */
    public QueryCursor getNextCursor() {
        return nextCursor;
    }

    public int size() {
        return occurrences.size();
    }

    @Override
    public String toString() {
        return "QueryPage[" + occurrences.size() + " occurrences, next=" + nextCursor + "]";
    }
}
