/*
 * SkipReason.java
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

package org.bluezoo.almanac.backfill;

/**
 * Why the backfill left a row untouched.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public enum SkipReason {

    /**
     * The row has no zone and no fallback zone is available.
     */
    MISSING_TIMEZONE,

    /**
     * The row's zone is unknown and no fallback zone is available.
     */
    INVALID_TIMEZONE,

    /**
     * A date column could not be interpreted, or the end precedes the
     * start.
     */
    INVALID_TIMESTAMP,

    /**
     * The recurrence rule could not be parsed.
     */
    INVALID_RULE,

    /**
     * The canonical row does not carry the same wall-clock meaning.
     */
    ROUNDTRIP_MISMATCH
}
