/*
 * BackfillOptions.java
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
 * Options for a backfill run.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class BackfillOptions {

    public static final int MIN_CHUNK_SIZE = 100;
    public static final int MAX_CHUNK_SIZE = 5000;
    public static final int DEFAULT_CHUNK_SIZE = 500;

    private String householdId;
    private String defaultTimezone;
    private int chunkSize = DEFAULT_CHUNK_SIZE;
    private boolean dryRun;
    private boolean resetCheckpoint;

    /**
     * Returns the household to process, or null for all households.
     */
    public String getHouseholdId() {
        return householdId;
    }

    public void setHouseholdId(String householdId) {
        this.householdId = householdId;
    }

    /**
     * Returns the zone used for rows whose own zone is missing or unknown,
     * taking precedence over the household zone; null for none.
     */
    public String getDefaultTimezone() {
        return defaultTimezone;
    }

    public void setDefaultTimezone(String defaultTimezone) {
        this.defaultTimezone = defaultTimezone;
    }

    public int getChunkSize() {
        return chunkSize;
    }

    /**
     * Sets the number of rows per transaction.
     *
     * @throws IllegalArgumentException if outside 100 to 5000
     */
    public void setChunkSize(int chunkSize) {
        if (chunkSize < MIN_CHUNK_SIZE || chunkSize > MAX_CHUNK_SIZE) {
            throw new IllegalArgumentException("chunk size " + chunkSize + " outside "
                    + MIN_CHUNK_SIZE + ".." + MAX_CHUNK_SIZE);
        }
        this.chunkSize = chunkSize;
    }

    /**
     * Returns true if the run only counts what would change.
     */
    public boolean isDryRun() {
        return dryRun;
    }

    public void setDryRun(boolean dryRun) {
        this.dryRun = dryRun;
    }

    /**
     * Returns true if the run discards any checkpoint and starts over.
     */
    public boolean isResetCheckpoint() {
        return resetCheckpoint;
    }

    public void setResetCheckpoint(boolean resetCheckpoint) {
        this.resetCheckpoint = resetCheckpoint;
    }

    String getScope() {
        return Checkpoint.scopeOf(householdId);
    }
}
