/*
 * DriftReport.java
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
import org.bluezoo.almanac.TimekeepingException;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Result of a drift check.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class DriftReport {

    private final String databaseVersion;
    private final int totalEvents;
    private final List<DriftFinding> findings;
    private final Map<DriftCategory, Integer> countsByCategory;
    private final Map<String, Integer> countsByHousehold;

    DriftReport(String databaseVersion, int totalEvents, List<DriftFinding> findings) {
        this.databaseVersion = databaseVersion;
        this.totalEvents = totalEvents;
        this.findings = Collections.unmodifiableList(findings);
        Map<DriftCategory, Integer> byCategory = new EnumMap<DriftCategory, Integer>(DriftCategory.class);
        Map<String, Integer> byHousehold = new TreeMap<String, Integer>();
        for (DriftFinding finding : findings) {
            increment(byCategory, finding.getCategory());
            increment(byHousehold, finding.getHouseholdId());
        }
        this.countsByCategory = Collections.unmodifiableMap(byCategory);
        this.countsByHousehold = Collections.unmodifiableMap(byHousehold);
    }

    private static <K> void increment(Map<K, Integer> map, K key) {
        Integer count = map.get(key);
        map.put(key, Integer.valueOf(count == null ? 1 : count.intValue() + 1));
    }

    /**
     * Returns the version of the timezone database the check ran against.
     */
    public String getDatabaseVersion() {
        return databaseVersion;
    }

    /**
     * Returns the number of events checked.
     */
    public int getTotalEvents() {
        return totalEvents;
    }

    public List<DriftFinding> getFindings() {
        return findings;
    }

    public Map<DriftCategory, Integer> getCountsByCategory() {
        return countsByCategory;
    }

    public Map<String, Integer> getCountsByHousehold() {
        return countsByHousehold;
    }

    public boolean hasDrift() {
        return !findings.isEmpty();
    }

    /**
     * Fails if any drift was found.
     *
     * @throws TimekeepingException E_TZ_DRIFT_DETECTED listing the affected
     *         event ids
     */
    public void requireNoDrift() throws TimekeepingException {
        if (findings.isEmpty()) {
            return;
        }
        StringBuilder ids = new StringBuilder();
        for (DriftFinding finding : findings) {
            if (ids.length() > 0) {
                ids.append(',');
            }
            ids.append(finding.getEventId());
        }
        throw new TimekeepingException(TimeErrorCode.TZ_DRIFT_DETECTED, ids.toString());
    }

    /**
     * Renders a plain-text summary for operators.
     */
    public String formatSummary() {
        StringBuilder out = new StringBuilder();
        out.append("Time Invariants Drift Report\n");
        out.append("============================\n");
        out.append("Timezone data:  ").append(databaseVersion).append('\n');
        out.append("Events checked: ").append(totalEvents).append('\n');
        out.append("Drift events:   ").append(findings.size()).append('\n');
        if (findings.isEmpty()) {
            out.append("Status:         OK (no drift detected)\n");
        } else {
            out.append("Status:         Drift detected\n");
            out.append(TimeErrorCode.TZ_DRIFT_DETECTED.getUserMessage()).append('\n');
        }
        out.append("\nBy category:\n");
        appendCounts(out, countsByCategory);
        out.append("\nBy household:\n");
        appendCounts(out, countsByHousehold);
        return out.toString();
    }

    private static void appendCounts(StringBuilder out, Map<?, Integer> counts) {
        if (counts.isEmpty()) {
            out.append("  (none)\n");
            return;
        }
        for (Map.Entry<?, Integer> entry : counts.entrySet()) {
            out.append("  ").append(entry.getKey()).append(": ").append(entry.getValue()).append('\n');
        }
    }

    @Override
    public String toString() {
        return "DriftReport[" + databaseVersion + ", checked=" + totalEvents
            + ", drift=" + findings.size() + ", " + countsByCategory + "]";
    }
}
