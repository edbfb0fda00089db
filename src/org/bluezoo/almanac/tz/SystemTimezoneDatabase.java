/*
 * SystemTimezoneDatabase.java
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
import java.time.zone.ZoneRulesException;
import java.time.zone.ZoneRulesProvider;
import java.util.NavigableMap;
import java.util.Set;

/**
 * Timezone database backed by the JVM's installed tzdb rules.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class SystemTimezoneDatabase implements TimezoneDatabase {

    private static final String VERSION_ZONE = "Europe/London";

    private final String version;

    /**
     * Creates a database over the installed rules.
     */
    public SystemTimezoneDatabase() {
        String v;
        try {
            NavigableMap<String, ZoneRules> versions = ZoneRulesProvider.getVersions(VERSION_ZONE);
            v = versions.isEmpty() ? "unknown" : versions.lastKey();
        } catch (ZoneRulesException e) {
            v = "unknown";
        }
        this.version = v;
    }

    @Override
    public String getVersion() {
        return version;
    }

    @Override
    public ZoneRules getRules(String zoneId) {
        if (zoneId == null || zoneId.isEmpty()) {
            return null;
        }
        try {
            return ZoneRulesProvider.getRules(zoneId, false);
        } catch (ZoneRulesException e) {
            return null;
        }
    }

    @Override
    public Set<String> getZoneIds() {
        return ZoneRulesProvider.getAvailableZoneIds();
    }

    @Override
    public String toString() {
        return "tzdb " + version;
    }
}
