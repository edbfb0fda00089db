/*
 * Checkpoint.java
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
 * Progress of a backfill over one scope, committed together with each
 * batch so that a retry resumes after the last committed row.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class Checkpoint {

    /**
     * Scope key of a backfill across all households.
     */
    public static final String GLOBAL_SCOPE = "*";

    private final String scope;
    private final long lastSequence;
    private final long processed;
    private final long updated;
    private final long skipped;
    private final long total;

    public Checkpoint(String scope, long lastSequence, long processed, long updated, long skipped,
                      long total) {
        if (scope == null) {
            throw new NullPointerException("scope");
        }
        this.scope = scope;
        this.lastSequence = lastSequence;
        this.processed = processed;
        this.updated = updated;
        this.skipped = skipped;
        this.total = total;
    }

    /**
     * Returns the scope key for a household, or the global scope for null.
     */
    public static String scopeOf(String householdId) {
        return householdId == null ? GLOBAL_SCOPE : householdId;
    }

    /**
     * Returns an empty checkpoint for a scope.
     */
    public static Checkpoint start(String scope, long total) {
        return new Checkpoint(scope, 0L, 0L, 0L, 0L, total);
    }

    public String getScope() {
        return scope;
    }

    /**
     * Returns the sequence of the last row processed.
     */
    public long getLastSequence() {
        return lastSequence;
    }

    public long getProcessed() {
        return processed;
    }

    public long getUpdated() {
        return updated;
    }

    public long getSkipped() {
        return skipped;
    }

    public long getTotal() {
        return total;
    }

    public long getRemaining() {
        return Math.max(0L, total - processed);
    }

    /**
     * Returns the checkpoint after a batch.
     */
    Checkpoint advance(long sequence, long batchProcessed, long batchUpdated, long batchSkipped) {
        long p = processed + batchProcessed;
        return new Checkpoint(scope, sequence, p, updated + batchUpdated, skipped + batchSkipped,
                Math.max(total, p));
    }

    Checkpoint withTotal(long newTotal) {
        return new Checkpoint(scope, lastSequence, processed, updated, skipped, newTotal);
    }

    @Override
    public boolean equals(Object obj) {
        if (!(obj instanceof Checkpoint)) {
            return false;
        }
        Checkpoint other = (Checkpoint) obj;
        return scope.equals(other.scope) && lastSequence == other.lastSequence
            && processed == other.processed && updated == other.updated
            && skipped == other.skipped && total == other.total;
    }

    @Override
    public int hashCode() {
        return scope.hashCode() * 31 + Long.hashCode(lastSequence);
    }

    @Override
    public String toString() {
        return "Checkpoint[" + scope + " last=" + lastSequence + " processed=" + processed
            + " updated=" + updated + " skipped=" + skipped + " total=" + total + "]";
    }
}
