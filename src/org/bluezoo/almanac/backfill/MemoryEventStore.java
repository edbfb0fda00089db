/*
 * MemoryEventStore.java
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

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * In-memory event storage.
 *
 * <p>Transactions buffer their writes and apply them atomically on commit.
 * Failures can be injected on commit or on the update of a given row to
 * exercise rollback and resume.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class MemoryEventStore implements EventStore {

    private final TreeMap<Long, StoredEvent> rows = new TreeMap<Long, StoredEvent>();
    private final Map<String, Household> households = new HashMap<String, Household>();
    private final Map<String, Checkpoint> checkpoints = new HashMap<String, Checkpoint>();
    private int commits;
    private int failAfterCommits = -1;
    private String failOnUpdate;

    /**
     * Adds or replaces a row.
     */
    public synchronized void put(StoredEvent row) {
        rows.put(Long.valueOf(row.getSequence()), row);
    }

    public synchronized void putHousehold(Household household) {
        households.put(household.getId(), household);
    }

    /**
     * Returns the row with the given event id, or null.
     */
    public synchronized StoredEvent getRow(String id) {
        for (StoredEvent row : rows.values()) {
            if (row.getId().equals(id)) {
                return row;
            }
        }
        return null;
    }

    /**
     * Returns all rows in sequence order.
     */
    public synchronized List<StoredEvent> getRows() {
        return new ArrayList<StoredEvent>(rows.values());
    }

    /**
     * Returns a stable text rendering of every row and checkpoint.
     */
    public synchronized String dump() {
        StringBuilder buf = new StringBuilder();
        for (StoredEvent row : rows.values()) {
            buf.append(row).append('\n');
        }
        for (Checkpoint checkpoint : new TreeMap<String, Checkpoint>(checkpoints).values()) {
            buf.append(checkpoint).append('\n');
        }
        return buf.toString();
    }

    /**
     * Returns the number of successful commits.
     */
    public synchronized int getCommitCount() {
        return commits;
    }

    /**
     * Makes the commit following {@code n} further successful commits fail.
     *
     * @param n the number of commits to allow, or -1 to disable
     */
    public synchronized void setFailAfterCommits(int n) {
        failAfterCommits = n;
    }

    /**
     * Makes any update of the given event fail, or clears the failure with
     * null.
     */
    public synchronized void setFailOnUpdate(String eventId) {
        failOnUpdate = eventId;
    }

    @Override
    public synchronized Household getHousehold(String householdId) {
        return households.get(householdId);
    }

    @Override
    public synchronized long count(String householdId, long afterSequence) {
        long n = 0L;
        for (StoredEvent row : rows.tailMap(Long.valueOf(afterSequence), false).values()) {
            if (householdId == null || householdId.equals(row.getHouseholdId())) {
                n++;
            }
        }
        return n;
    }

    @Override
    public synchronized List<StoredEvent> read(String householdId, long afterSequence, int limit) {
        List<StoredEvent> batch = new ArrayList<StoredEvent>();
        for (StoredEvent row : rows.tailMap(Long.valueOf(afterSequence), false).values()) {
            if (batch.size() >= limit) {
                break;
            }
            if (householdId == null || householdId.equals(row.getHouseholdId())) {
                batch.add(row);
            }
        }
        return batch;
    }

    @Override
    public synchronized Checkpoint getCheckpoint(String scope) {
        return checkpoints.get(scope);
    }

    @Override
    public Transaction begin() {
        return new MemoryTransaction();
    }

    private synchronized void apply(MemoryTransaction tx) throws EventStoreException {
        if (failAfterCommits == 0) {
            failAfterCommits = -1;
            throw new EventStoreException("Injected commit failure");
        }
        for (StoredEvent row : tx.updates.values()) {
            rows.put(Long.valueOf(row.getSequence()), row);
        }
        for (Map.Entry<String, Checkpoint> entry : tx.checkpoints.entrySet()) {
            if (entry.getValue() == null) {
                checkpoints.remove(entry.getKey());
            } else {
                checkpoints.put(entry.getKey(), entry.getValue());
            }
        }
        commits++;
        if (failAfterCommits > 0) {
            failAfterCommits--;
        }
    }

    private synchronized boolean exists(long sequence) {
        return rows.containsKey(Long.valueOf(sequence));
    }

    private synchronized boolean failsOnUpdate(String id) {
        return id.equals(failOnUpdate);
    }

    private class MemoryTransaction implements Transaction {

        final Map<Long, StoredEvent> updates = new LinkedHashMap<Long, StoredEvent>();
        final Map<String, Checkpoint> checkpoints = new LinkedHashMap<String, Checkpoint>();
        boolean closed;

        @Override
        public void update(StoredEvent row) throws EventStoreException {
            checkOpen();
            if (!exists(row.getSequence())) {
                throw new EventStoreException("No row with sequence " + row.getSequence());
            }
            if (failsOnUpdate(row.getId())) {
                throw new EventStoreException("Injected update failure for " + row.getId());
            }
            updates.put(Long.valueOf(row.getSequence()), row);
        }

        @Override
        public void saveCheckpoint(Checkpoint checkpoint) throws EventStoreException {
            checkOpen();
            checkpoints.put(checkpoint.getScope(), checkpoint);
        }

        @Override
        public void deleteCheckpoint(String scope) throws EventStoreException {
            checkOpen();
            checkpoints.put(scope, null);
        }

        @Override
        public void commit() throws EventStoreException {
            checkOpen();
            closed = true;
            apply(this);
        }

        @Override
        public void rollback() {
            closed = true;
            updates.clear();
            checkpoints.clear();
        }

        private void checkOpen() throws EventStoreException {
            if (closed) {
                throw new EventStoreException("Transaction already closed");
            }
        }
    }
}
