/*
 * MapTimezoneDatabase.java
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

import java.time.ZoneOffset;
import java.time.zone.ZoneRules;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Timezone database holding an explicit set of zone rules.
 *
 * <p>This is used to pin a snapshot of rules under a version label, for
 * example to reproduce the rules a cache was computed with, or to model a
 * rules update before it is installed:
 * <pre>
 * MapTimezoneDatabase updated = new MapTimezoneDatabase("2025b", system);
 * updated.putFixed("America/Sao_Paulo", ZoneOffset.ofHours(-3));
 * </pre>
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class MapTimezoneDatabase implements TimezoneDatabase {

    private String version;
    private final Map<String, ZoneRules> zones = new LinkedHashMap<String, ZoneRules>();
    private TimezoneDatabase parent;

    /**
     * Creates an empty, unversioned database. Used when the database is
     * declared as a configuration component.
     */
    public MapTimezoneDatabase() {
        this("unversioned", null);
    }

    /**
     * Creates an empty database.
     *
     * @param version the version label
     */
    public MapTimezoneDatabase(String version) {
        this(version, null);
    }

    /**
     * Creates a database whose zones override those of a parent.
     *
     * @param version the version label
     * @param parent the database consulted for zones not held here, or null
     */
    public MapTimezoneDatabase(String version, TimezoneDatabase parent) {
        if (version == null) {
            throw new NullPointerException("version");
        }
        this.version = version;
        this.parent = parent;
    }

    /**
     * Adds or replaces the rules for a zone.
     *
     * @param zoneId the zone name
     * @param rules the rules
     * @return this database
     */
    public MapTimezoneDatabase put(String zoneId, ZoneRules rules) {
        if (zoneId == null) {
            throw new NullPointerException("zoneId");
        }
        if (rules == null) {
            throw new NullPointerException("rules");
        }
        zones.put(zoneId, rules);
        return this;
    }

    /**
     * Adds or replaces a zone with a fixed offset and no transitions.
     *
     * @param zoneId the zone name
     * @param offset the fixed offset
     * @return this database
     */
    public MapTimezoneDatabase putFixed(String zoneId, ZoneOffset offset) {
        return put(zoneId, ZoneRules.of(offset));
    }

    /**
     * Adds fixed-offset zones given as zone name to offset text, for example
     * {@code "Test/Plus5" -> "+05:00"}.
     *
     * @param fixedZones the zones
     */
    public void setFixedZones(Map<String, String> fixedZones) {
        for (Map.Entry<String, String> entry : fixedZones.entrySet()) {
            putFixed(entry.getKey(), ZoneOffset.of(entry.getValue().trim()));
        }
    }

    public void setVersion(String version) {
        if (version == null) {
            throw new NullPointerException("version");
        }
        this.version = version;
    }

    /**
     * Sets the database consulted for zones not held here.
     */
    public void setParent(TimezoneDatabase parent) {
        this.parent = parent;
    }

    @Override
    public String getVersion() {
        return version;
    }

    @Override
    public ZoneRules getRules(String zoneId) {
        ZoneRules rules = zones.get(zoneId);
        if (rules == null && parent != null) {
            rules = parent.getRules(zoneId);
        }
        return rules;
    }

    @Override
    public Set<String> getZoneIds() {
        if (parent == null) {
            return Collections.unmodifiableSet(zones.keySet());
        }
        Set<String> ids = new TreeSet<String>(parent.getZoneIds());
        ids.addAll(zones.keySet());
        return Collections.unmodifiableSet(ids);
    }

    @Override
    public String toString() {
        return "tzdb " + version + " (" + zones.size() + " zones)";
    }
}
