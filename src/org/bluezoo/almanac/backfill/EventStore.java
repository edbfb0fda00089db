/*
 * EventStore.java
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

import org.bluezoo.almanac.Household;

import java.util.List;

/**
 * Storage consumed by the backfill.
 *
 * <p>Rows are read in ascending sequence order. Writes happen only inside a
 * {@link Transaction}; a transaction that is rolled back, or never
 * committed, leaves storage unchanged.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public interface EventStore {

    /**
     * Returns the household with the given id, or null.
     */
    Household getHousehold(String householdId) throws EventStoreException;

    /**
     * Counts the rows in a scope with a sequence greater than the one
     * given.
     *
     * @param householdId the household, or null for all
     * @param afterSequence the exclusive lower bound
     */
    long count(String householdId, long afterSequence) throws EventStoreException;

    /**
     * Reads the next batch of rows in a scope.
     *
     * @param householdId the household, or null for all
     * @param afterSequence the exclusive lower bound
     * @param limit the maximum number of rows
     * @return the rows, in ascending sequence order
     */
    List<StoredEvent> read(String householdId, long afterSequence, int limit)
        throws EventStoreException;

    /**
     * Returns the checkpoint for a scope, or null.
     */
    Checkpoint getCheckpoint(String scope) throws EventStoreException;

    /**
     * Begins a transaction.
     */
    Transaction begin() throws EventStoreException;

    /**
     * A unit of writes.
     */
    interface Transaction {

        /**
         * Replaces the row with the same sequence.
         */
        void update(StoredEvent row) throws EventStoreException;

        void saveCheckpoint(Checkpoint checkpoint) throws EventStoreException;

        void deleteCheckpoint(String scope) throws EventStoreException;

        void commit() throws EventStoreException;

        /**
         * Discards the writes of this transaction. Never fails.
         */
        void rollback();
    }
}
