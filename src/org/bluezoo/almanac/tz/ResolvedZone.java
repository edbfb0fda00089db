/*
 * ResolvedZone.java
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

package org.bluezoo.almanac.tz;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.zone.ZoneOffsetTransition;
import java.time.zone.ZoneRules;
import java.util.List;

/**
 * An effective timezone for an event, bound to the rules of one database
 * version.
 *
 * <p>Wall-clock to UTC conversion uses the offset in force at the given
 * wall-clock date, so every occurrence of a series is resolved on its own.
 * Wall-clock times that do not exist or are ambiguous resolve
 * deterministically:
 * <ul>
 *   <li>in a gap (spring forward) the time moves to the transition instant,
 *       the first valid instant after the gap;</li>
 *   <li>in an overlap (fall back) the earlier of the two instants is
 *       used.</li>
 * </ul>
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 * @see TimezoneResolver
 */
public final class ResolvedZone {

    /**
     * Floating zone: wall-clock and UTC coincide.
     */
    public static final ResolvedZone FLOATING =
        new ResolvedZone("UTC", ZoneRules.of(ZoneOffset.UTC), ZoneSource.FLOATING, null);

    private final String id;
    private final ZoneRules rules;
    private final ZoneSource source;
    private final String databaseVersion;

    ResolvedZone(String id, ZoneRules rules, ZoneSource source, String databaseVersion) {
        this.id = id;
        this.rules = rules;
        this.source = source;
        this.databaseVersion = databaseVersion;
    }

    /**
     * Returns the IANA zone name.
     */
    public String getId() {
        return id;
    }

    public ZoneRules getRules() {
        return rules;
    }

    public ZoneSource getSource() {
        return source;
    }

    /**
     * Returns true if the event has no zone and is compared by its own
     * wall-clock value.
     */
    public boolean isFloating() {
        return source == ZoneSource.FLOATING;
    }

    /**
     * Returns the version of the database the rules came from, or null for
     * the floating zone.
     */
    public String getDatabaseVersion() {
        return databaseVersion;
    }

    /**
     * Converts a wall-clock time to an absolute instant.
     *
     * @param local the wall-clock time
     * @return the instant
     */
    public Instant toInstant(LocalDateTime local) {
        List<ZoneOffset> offsets = rules.getValidOffsets(local);
        if (offsets.size() == 1) {
            return local.toInstant(offsets.get(0));
        }
        ZoneOffsetTransition transition = rules.getTransition(local);
        if (offsets.isEmpty()) {
            return transition.getInstant();
        }
        return local.toInstant(transition.getOffsetBefore());
    }

    /**
     * Converts an absolute instant to the wall-clock time in this zone.
     *
     * @param instant the instant
     * @return the wall-clock time
     */
    public LocalDateTime toLocal(Instant instant) {
        ZoneOffset offset = rules.getOffset(instant);
        return LocalDateTime.ofEpochSecond(instant.getEpochSecond(), instant.getNano(), offset);
    }

    /**
     * Returns the offset in force at an instant.
     *
     * @param instant the instant
     * @return the offset
     */
    public ZoneOffset getOffset(Instant instant) {
        return rules.getOffset(instant);
    }

    /**
     * Returns true if a wall-clock time falls in a gap of this zone.
     *
     * @param local the wall-clock time
     * @return true if the time does not exist in this zone
     */
    public boolean isGap(LocalDateTime local) {
        return rules.getValidOffsets(local).isEmpty();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof ResolvedZone)) {
            return false;
        }
        ResolvedZone other = (ResolvedZone) obj;
        return id.equals(other.id) && source == other.source && rules.equals(other.rules);
    }

    @Override
    public int hashCode() {
        return id.hashCode();
    }

    @Override
    public String toString() {
        return id + " (" + source + ")";
    }
}
