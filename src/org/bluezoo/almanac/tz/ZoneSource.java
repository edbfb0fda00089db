/*
 * ZoneSource.java
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

/**
 * Where an effective zone came from.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 * @see ResolvedZone
 */
public enum ZoneSource {

    /**
     * The event's own {@code tz}.
     */
    EVENT,

    /**
     * The household fallback {@code tz}.
     */
    HOUSEHOLD,

    /**
     * The configured default timezone.
     */
    DEFAULT,

    /**
     * No zone was available; the event floats and resolves as UTC.
     */
    FLOATING
}
