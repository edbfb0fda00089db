/*
 * DriftCategory.java
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

package org.bluezoo.almanac.drift;

/**
 * Kinds of cache drift.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public enum DriftCategory {

    /**
     * A timed event whose cached instant differs from the recomputed one by
     * at least the tolerance.
     */
    TIMED_MISMATCH("timed_mismatch"),

    /**
     * An all-day event whose cached boundary is no longer a local midnight
     * within a day of the recomputed one.
     */
    ALLDAY_BOUNDARY_ERROR("allday_boundary_error"),

    /**
     * An event whose zone cannot be resolved with the current database.
     */
    TZ_MISSING("tz_missing");

    private final String label;

    DriftCategory(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    @Override
    public String toString() {
        return label;
    }
}
