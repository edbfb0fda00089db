/*
 * RoundTripReport.java
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
 * Comparison of a dataset before and after normalization.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 * @see RoundTripVerifier#verifyDataset
 */
public final class RoundTripReport {

    private final int beforeCount;
    private final int afterCount;
    private final List<String> missingIds;
    private final List<String> extraIds;
    private final List<String> mismatchedIds;

    RoundTripReport(int beforeCount, int afterCount, List<String> missingIds,
                    List<String> extraIds, List<String> mismatchedIds) {
        this.beforeCount = beforeCount;
        this.afterCount = afterCount;
        this.missingIds = Collections.unmodifiableList(missingIds);
        this.extraIds = Collections.unmodifiableList(extraIds);
        this.mismatchedIds = Collections.unmodifiableList(mismatchedIds);
    }

    public int getBeforeCount() {
        return beforeCount;
    }

    public int getAfterCount() {
        return afterCount;
    }

    /**
     * Returns ids present before but not after.
     */
    public List<String> getMissingIds() {
        return missingIds;
    }

    /**
     * Returns ids present after but not before.
     */
    public List<String> getExtraIds() {
        return extraIds;
    }

    /**
     * Returns ids whose wall-clock meaning changed.
     */
    public List<String> getMismatchedIds() {
        return mismatchedIds;
    }

    public boolean isConsistent() {
        return beforeCount == afterCount && missingIds.isEmpty() && extraIds.isEmpty()
            && mismatchedIds.isEmpty();
    }

    @Override
    public String toString() {
        return "RoundTripReport[before=" + beforeCount + ", after=" + afterCount
            + ", missing=" + missingIds + ", extra=" + extraIds
            + ", mismatched=" + mismatchedIds + "]";
    }
}
