/*
 * DriftFinding.java
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

import org.bluezoo.almanac.TimeErrorCode;

/**
 * A single drifted event. Findings are advisory and never corrected
 * automatically.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class DriftFinding {

    private final String eventId;
    private final String householdId;
    private final DriftCategory category;
    private final Long cachedStartUtc;
    private final Long recomputedStartUtc;
    private final Long cachedEndUtc;
    private final Long recomputedEndUtc;
    private final long deltaMs;

    DriftFinding(String eventId, String householdId, DriftCategory category,
                 Long cachedStartUtc, Long recomputedStartUtc,
                 Long cachedEndUtc, Long recomputedEndUtc, long deltaMs) {
        this.eventId = eventId;
        this.householdId = householdId;
        this.category = category;
        this.cachedStartUtc = cachedStartUtc;
        this.recomputedStartUtc = recomputedStartUtc;
        this.cachedEndUtc = cachedEndUtc;
        this.recomputedEndUtc = recomputedEndUtc;
        this.deltaMs = deltaMs;
    }

    /**
     * Returns {@link TimeErrorCode#TZ_DRIFT_DETECTED}.
     */
    public TimeErrorCode getCode() {
        return TimeErrorCode.TZ_DRIFT_DETECTED;
    }

    public String getEventId() {
        return eventId;
    }

    public String getHouseholdId() {
        return householdId;
    }

    public DriftCategory getCategory() {
        return category;
    }

    public Long getCachedStartUtc() {
        return cachedStartUtc;
    }

    /**
     * Returns the recomputed first-occurrence start, or null if the zone
     * could not be resolved.
     */
    public Long getRecomputedStartUtc() {
        return recomputedStartUtc;
    }

    public Long getCachedEndUtc() {
        return cachedEndUtc;
    }

    public Long getRecomputedEndUtc() {
        return recomputedEndUtc;
    }

    /**
     * Returns the larger of the start and end differences in milliseconds.
     */
    public long getDeltaMs() {
        return deltaMs;
    }

    @Override
    public String toString() {
        return getCode() + " " + category + " event=" + eventId + " household=" + householdId
            + " cached=" + cachedStartUtc + " recomputed=" + recomputedStartUtc
            + " delta=" + deltaMs + "ms";
    }
}
