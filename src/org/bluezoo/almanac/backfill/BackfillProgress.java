/*
 * BackfillProgress.java
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
 * Progress reported after each batch.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class BackfillProgress {

    private final String scope;
    private final long scanned;
    private final long updated;
    private final long skipped;
    private final long remaining;
    private final long elapsedMs;

    public BackfillProgress(String scope, long scanned, long updated, long skipped, long remaining,
                            long elapsedMs) {
        this.scope = scope;
        this.scanned = scanned;
        this.updated = updated;
        this.skipped = skipped;
        this.remaining = remaining;
        this.elapsedMs = elapsedMs;
    }

    public String getScope() {
        return scope;
    }

    public long getScanned() {
        return scanned;
    }

    public long getUpdated() {
        return updated;
    }

    public long getSkipped() {
        return skipped;
    }

    public long getRemaining() {
        return remaining;
    }

    public long getElapsedMs() {
        return elapsedMs;
    }

    @Override
    public String toString() {
        return scope + ": scanned=" + scanned + " updated=" + updated + " skipped=" + skipped
            + " remaining=" + remaining;
    }
}
