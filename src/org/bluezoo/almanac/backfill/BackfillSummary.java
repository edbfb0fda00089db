/*
 * BackfillSummary.java
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

import java.util.Collections;
import java.util.List;

/**
 * Outcome of a backfill run. Counters cover this run only.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class BackfillSummary {

    /**
     * Maximum number of skip examples kept.
     */
    public static final int MAX_SKIP_EXAMPLES = 50;

    private final String scope;
    private final BackfillStatus status;
    private final boolean dryRun;
    private final long scanned;
    private final long updated;
    private final long skipped;
    private final long elapsedMs;
    private final List<SkipExample> skipExamples;

    BackfillSummary(String scope, BackfillStatus status, boolean dryRun, long scanned, long updated,
                    long skipped, long elapsedMs, List<SkipExample> skipExamples) {
        this.scope = scope;
        this.status = status;
        this.dryRun = dryRun;
        this.scanned = scanned;
        this.updated = updated;
        this.skipped = skipped;
        this.elapsedMs = elapsedMs;
        this.skipExamples = Collections.unmodifiableList(skipExamples);
    }

    public String getScope() {
        return scope;
    }

    public BackfillStatus getStatus() {
        return status;
    }

    public boolean isDryRun() {
        return dryRun;
    }

    public long getScanned() {
        return scanned;
    }

    /**
     * Returns the number of rows written, or that would be written in a
     * dry run.
     */
    public long getUpdated() {
        return updated;
    }

    public long getSkipped() {
        return skipped;
    }

    /**
     * Returns the number of rows already canonical.
     */
    public long getUnchanged() {
        return scanned - updated - skipped;
    }

    public long getElapsedMs() {
        return elapsedMs;
    }

    public List<SkipExample> getSkipExamples() {
        return skipExamples;
    }

    @Override
    public String toString() {
        return "BackfillSummary[" + scope + " " + status + (dryRun ? " (dry run)" : "")
            + " scanned=" + scanned + " updated=" + updated + " skipped=" + skipped + "]";
    }
}
