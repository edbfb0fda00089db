/*
 * TimezoneResolver.java
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

import org.bluezoo.almanac.Event;
import org.bluezoo.almanac.Household;
import org.bluezoo.almanac.TimeErrorCode;
import org.bluezoo.almanac.TimekeepingException;

import java.text.MessageFormat;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.zone.ZoneRules;
import java.util.ResourceBundle;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Resolves the effective timezone of an event and converts between
 * wall-clock anchors and absolute instants.
 *
 * <h4>Resolution Priority</h4>
 * <ol>
 *   <li>The event's own {@code tz}</li>
 *   <li>The household fallback {@code tz}</li>
 *   <li>The configured default timezone, if any</li>
 *   <li>Floating (UTC, no offset conversion)</li>
 * </ol>
 *
 * <p>A zone name that is present but unknown to the database fails with
 * {@link TimeErrorCode#TZ_UNKNOWN}; it is never silently replaced by a
 * fallback.
 *
 * <p>Wall-clock anchors are epoch milliseconds read as if in UTC. The
 * resolver is stateless apart from its database and may be shared between
 * threads.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class TimezoneResolver {

    private static final Logger LOGGER = Logger.getLogger(TimezoneResolver.class.getName());
    private static final ResourceBundle L10N = ResourceBundle.getBundle("org.bluezoo.almanac.tz.L10N");

    private static final String UTC = "UTC";

    private final TimezoneDatabase database;
    private final String defaultTz;

    /**
     * Creates a resolver with no default timezone.
     *
     * @param database the timezone database
     */
    public TimezoneResolver(TimezoneDatabase database) {
        this(database, null);
    }

    /**
     * Creates a resolver.
     *
     * @param database the timezone database
     * @param defaultTz the zone used when neither event nor household has
     *        one, or null to treat such events as floating
     * @throws IllegalArgumentException if the default zone is unknown
     */
    public TimezoneResolver(TimezoneDatabase database, String defaultTz) {
        if (database == null) {
            throw new NullPointerException("database");
        }
        this.database = database;
        String tz = trim(defaultTz);
        if (tz != null && lookupRules(tz) == null) {
            throw new IllegalArgumentException(MessageFormat.format(
                    L10N.getString("err.unknown_default"), tz, database.getVersion()));
        }
        this.defaultTz = tz;
    }

    public TimezoneDatabase getDatabase() {
        return database;
    }

    /**
     * Returns the configured default timezone, or null.
     */
    public String getDefaultTz() {
        return defaultTz;
    }

    /**
     * Resolves the effective zone of an event within its household.
     *
     * @param event the event
     * @param household the household, or null
     * @return the effective zone
     * @throws TimekeepingException if a present zone name is unknown
     */
    public ResolvedZone resolve(Event event, Household household) throws TimekeepingException {
        return resolve(event.getTz(), household == null ? null : household.getTz());
    }

    /**
     * Resolves an effective zone from an event zone and a household fallback.
     *
     * @param eventTz the event zone name, or null
     * @param householdTz the household zone name, or null
     * @return the effective zone
     * @throws TimekeepingException if a present zone name is unknown
     */
    public ResolvedZone resolve(String eventTz, String householdTz) throws TimekeepingException {
        String tz = trim(eventTz);
        if (tz != null) {
            return lookup(tz, ZoneSource.EVENT);
        }
        tz = trim(householdTz);
        if (tz != null) {
            return lookup(tz, ZoneSource.HOUSEHOLD);
        }
        if (defaultTz != null) {
            return lookup(defaultTz, ZoneSource.DEFAULT);
        }
        return ResolvedZone.FLOATING;
    }

    /**
     * Looks up a single zone name.
     *
     * @param tz the zone name
     * @return the zone, attributed to the event
     * @throws TimekeepingException if the name is unknown
     */
    public ResolvedZone lookup(String tz) throws TimekeepingException {
        return lookup(tz, ZoneSource.EVENT);
    }

    /**
     * Looks up a single zone name on behalf of a given source.
     *
     * @param tz the zone name
     * @param source where the name came from
     * @return the zone
     * @throws TimekeepingException if the name is unknown
     */
    public ResolvedZone lookup(String tz, ZoneSource source) throws TimekeepingException {
        String name = trim(tz);
        if (name == null) {
            throw new TimekeepingException(TimeErrorCode.TZ_UNKNOWN, String.valueOf(tz));
        }
        ZoneRules rules = lookupRules(name);
        if (rules == null) {
            if (LOGGER.isLoggable(Level.FINE)) {
                LOGGER.fine(MessageFormat.format(L10N.getString("log.unknown_zone"),
                        name, source, database.getVersion()));
            }
            throw new TimekeepingException(TimeErrorCode.TZ_UNKNOWN, name);
        }
        return new ResolvedZone(name, rules, source, database.getVersion());
    }

    private ZoneRules lookupRules(String tz) {
        ZoneRules rules = database.getRules(tz);
        if (rules == null && UTC.equals(tz)) {
            rules = ZoneRules.of(ZoneOffset.UTC);
        }
        return rules;
    }

    /**
     * Returns true if a zone name resolves against the database.
     *
     * @param tz the zone name
     * @return true if known
     */
    public boolean isKnown(String tz) {
        String name = trim(tz);
        return name != null && lookupRules(name) != null;
    }

    /**
     * Checks a zone name at write time. Absent names are valid (the event
     * falls back); present names must resolve.
     *
     * @param tz the zone name, or null
     * @throws TimekeepingException if the name is present and unknown
     */
    public void validate(String tz) throws TimekeepingException {
        String name = trim(tz);
        if (name != null && lookupRules(name) == null) {
            throw new TimekeepingException(TimeErrorCode.TZ_UNKNOWN, name);
        }
    }

    /**
     * Converts a wall-clock anchor to an absolute instant in a zone.
     *
     * @param localMs the wall-clock anchor in local-naive milliseconds
     * @param zone the zone
     * @return the UTC instant in epoch milliseconds
     */
    public long toUtcMillis(long localMs, ResolvedZone zone) {
        return zone.toInstant(toLocalDateTime(localMs)).toEpochMilli();
    }

    /**
     * Converts an absolute instant to a wall-clock anchor in a zone.
     *
     * @param utcMs the UTC instant in epoch milliseconds
     * @param zone the zone
     * @return the wall-clock anchor in local-naive milliseconds
     */
    public long toLocalMillis(long utcMs, ResolvedZone zone) {
        return toLocalMillis(zone.toLocal(Instant.ofEpochMilli(utcMs)));
    }

    /**
     * Returns the wall-clock time denoted by a local-naive millisecond value.
     *
     * @param localMs the wall-clock anchor
     * @return the wall-clock time
     */
    public static LocalDateTime toLocalDateTime(long localMs) {
        Instant instant = Instant.ofEpochMilli(localMs);
        return LocalDateTime.ofEpochSecond(instant.getEpochSecond(), instant.getNano(), ZoneOffset.UTC);
    }

    /**
     * Returns the local-naive millisecond value of a wall-clock time.
     *
     * @param local the wall-clock time
     * @return the wall-clock anchor
     */
    public static long toLocalMillis(LocalDateTime local) {
        return local.toInstant(ZoneOffset.UTC).toEpochMilli();
    }

    private static String trim(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }
}
