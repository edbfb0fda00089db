/*
 * TimezoneDatabase.java
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

import java.time.zone.ZoneRules;
import java.util.Set;

/**
 * A versioned source of timezone rules.
 *
 * <p>The database is passed explicitly to a {@link TimezoneResolver} rather
 * than read from process-wide state, so that two resolvers bound to
 * different database versions can be compared side by side.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 * @see SystemTimezoneDatabase
 * @see MapTimezoneDatabase
 */
public interface TimezoneDatabase {

    /**
     * Returns the version label of this database, e.g. {@code 2024a}.
     *
     * @return the version
     */
    String getVersion();

    /**
     * Returns the rules for an IANA zone name.
     *
     * @param zoneId the zone name
     * @return the rules, or null if the zone is unknown to this database
     */
    ZoneRules getRules(String zoneId);

    /**
     * Returns the zone names this database can resolve.
     *
     * @return the zone names
     */
    Set<String> getZoneIds();
}
