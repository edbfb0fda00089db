/*
 * ExdateInspection.java
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

package org.bluezoo.almanac.exdate;

import java.time.Instant;
import java.util.Collections;
import java.util.List;

/**
 * Result of a lenient inspection of an EXDATE list.
 *
 * <p>Entries are sorted into buckets: valid (UTC, in range, de-duplicated),
 * invalid format, non-UTC, out of range. Valid entries that do not equal any
 * generated occurrence are additionally reported as unmatched; they stay in
 * the canonical text but never exclude anything.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 * @see ExdateParser#inspect
 */
public final class ExdateInspection {

    private final int totalInputs;
    private final ExdateSet valid;
    private final List<String> invalidFormat;
    private final List<String> nonUtc;
    private final List<String> outOfRange;
    private final int duplicates;
    private final List<Instant> unmatched;

    ExdateInspection(int totalInputs, ExdateSet valid, List<String> invalidFormat,
                     List<String> nonUtc, List<String> outOfRange, int duplicates,
                     List<Instant> unmatched) {
        this.totalInputs = totalInputs;
        this.valid = valid;
        this.invalidFormat = Collections.unmodifiableList(invalidFormat);
        this.nonUtc = Collections.unmodifiableList(nonUtc);
        this.outOfRange = Collections.unmodifiableList(outOfRange);
        this.duplicates = duplicates;
        this.unmatched = Collections.unmodifiableList(unmatched);
    }

    /**
     * Returns the number of non-empty entries inspected.
     */
    public int getTotalInputs() {
        return totalInputs;
    }

    public ExdateSet getValid() {
        return valid;
    }

    public List<String> getInvalidFormat() {
        return invalidFormat;
    }

    /**
     * Returns entries that parsed as instants but carried a non-UTC offset.
     */
    public List<String> getNonUtc() {
        return nonUtc;
    }

    public List<String> getOutOfRange() {
        return outOfRange;
    }

    /**
     * Returns the number of valid entries dropped as duplicates.
     */
    public int getDuplicates() {
        return duplicates;
    }

    /**
     * Returns valid entries that match no generated occurrence.
     */
    public List<Instant> getUnmatched() {
        return unmatched;
    }

    /**
     * Returns the number of entries dropped from the canonical text.
     */
    public int getSkipped() {
        return invalidFormat.size() + nonUtc.size() + outOfRange.size();
    }

    /**
     * Returns true if every entry was a valid, in-range UTC instant.
     */
    public boolean isClean() {
        return getSkipped() == 0;
    }

    /**
     * Returns the canonical text of the valid entries, or null if none.
     */
    public String getCanonical() {
        return valid.toCanonicalString();
    }

    @Override
    public String toString() {
        return "ExdateInspection[total=" + totalInputs
            + ", valid=" + valid.size()
            + ", invalidFormat=" + invalidFormat
            + ", nonUtc=" + nonUtc
            + ", outOfRange=" + outOfRange
            + ", duplicates=" + duplicates
            + ", unmatched=" + unmatched + "]";
    }
}
