/*
 * ExdateSet.java
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

package org.bluezoo.almanac.exdate;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * An immutable set of excluded instants with constant-time membership.
 *
 * <p>Membership is by absolute instant at millisecond resolution, never by
 * wall-clock time. Entries are truncated to the millisecond, and the
 * canonical text keeps a fractional part only when it is non-zero, so
 * {@code 2024-03-03T14:00:00.500Z} survives canonicalization while
 * {@code 2024-03-03T14:00:00.000Z} becomes {@code 2024-03-03T14:00:00Z}.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class ExdateSet {

    /**
     * The canonical text form of a single entry on a whole second.
     */
    public static final DateTimeFormatter CANONICAL_FORMAT =
        DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss'Z'").withZone(ZoneOffset.UTC);

    /**
     * The canonical text form of an entry with a millisecond part.
     */
    public static final DateTimeFormatter MILLIS_FORMAT =
        DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss.SSS'Z'").withZone(ZoneOffset.UTC);

    public static final ExdateSet EMPTY = new ExdateSet(Collections.<Instant>emptySet());

    private final Set<Long> millis;
    private final List<Instant> instants;

    /**
     * Creates a set from the given instants. Duplicates collapse.
     *
     * @param values the instants
     */
    public ExdateSet(Collection<Instant> values) {
        TreeSet<Instant> sorted = new TreeSet<Instant>();
        for (Instant value : values) {
            sorted.add(value.truncatedTo(ChronoUnit.MILLIS));
        }
        millis = new HashSet<Long>(sorted.size() * 2);
        for (Instant instant : sorted) {
            millis.add(instant.toEpochMilli());
        }
        instants = Collections.unmodifiableList(new ArrayList<Instant>(sorted));
    }

    public boolean contains(Instant instant) {
        return millis.contains(instant.toEpochMilli());
    }

    public boolean contains(long epochMillis) {
        return millis.contains(epochMillis);
    }

    public int size() {
        return instants.size();
    }

    public boolean isEmpty() {
        return instants.isEmpty();
    }

    /**
     * Returns the instants in ascending order.
     */
    public List<Instant> getInstants() {
        return instants;
    }

    /**
     * Returns the canonical text: sorted, de-duplicated, comma-joined UTC
     * timestamps, or null if the set is empty.
     */
    public String toCanonicalString() {
        if (instants.isEmpty()) {
            return null;
        }
        StringBuilder buf = new StringBuilder();
        for (Instant instant : instants) {
            if (buf.length() > 0) {
                buf.append(',');
            }
            buf.append(format(instant));
        }
        return buf.toString();
    }

    /**
     * Formats a single instant in canonical form. Digits below the
     * millisecond are dropped.
     *
     * @param instant the instant
     * @return the canonical text
     */
    public static String format(Instant instant) {
        if (instant.getNano() / 1000000 == 0) {
            return CANONICAL_FORMAT.format(instant);
        }
        return MILLIS_FORMAT.format(instant);
    }

    @Override
    public boolean equals(Object obj) {
        return obj instanceof ExdateSet && instants.equals(((ExdateSet) obj).instants);
    }

    @Override
    public int hashCode() {
        return instants.hashCode();
    }

    @Override
    public String toString() {
        return instants.toString();
    }
}
