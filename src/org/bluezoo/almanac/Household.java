/*
 * Household.java
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

package org.bluezoo.almanac;

/**
 * The owning scope of a set of events.
 *
 * <p>A household carries the fallback timezone used by events that have
 * none of their own.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class Household {

    private final String id;
    private String tz;

    /**
     * Creates a household with no fallback timezone.
     *
     * @param id the household identifier
     */
    public Household(String id) {
        this(id, null);
    }

    /**
     * Creates a household.
     *
     * @param id the household identifier
     * @param tz the fallback IANA zone name, or null
     */
    public Household(String id, String tz) {
        if (id == null) {
            throw new NullPointerException("id");
        }
        this.id = id;
        this.tz = tz;
    }

    public String getId() {
        return id;
    }

    /**
     * Returns the fallback IANA zone name, or null if none is set.
     */
    public String getTz() {
        return tz;
    }

    public void setTz(String tz) {
        this.tz = tz;
    }

    @Override
    public String toString() {
        return "Household[id=" + id + ",tz=" + tz + "]";
    }
}
