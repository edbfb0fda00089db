/*
 * RoundTripVerifier.java
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

import org.bluezoo.almanac.Event;
import org.bluezoo.almanac.TimekeepingException;
import org.bluezoo.almanac.expand.ExpandedOccurrence;
import org.bluezoo.almanac.tz.ResolvedZone;
import org.bluezoo.almanac.tz.TimezoneResolver;

import java.text.MessageFormat;
import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.ResourceBundle;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Checks that normalization preserved the wall-clock meaning of rows.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class RoundTripVerifier {

    private static final Logger LOGGER = Logger.getLogger(RoundTripVerifier.class.getName());
    private static final ResourceBundle L10N = ResourceBundle.getBundle("org.bluezoo.almanac.backfill.L10N");

    private final TimezoneResolver resolver;

    public RoundTripVerifier(TimezoneResolver resolver) {
        this.resolver = resolver;
    }

    /**
     * Verifies one normalized row.
     *
     * <p>The legacy dates, read in the event zone, must equal the canonical
     * anchors, and the UTC caches must convert back to the wall-clock time
     * of the first occurrence. A first occurrence inside a gap is exempt
     * from the cache check since its wall-clock time does not exist.
     *
     * @param before the row as stored
     * @param after the canonical event
     * @param zone the event zone
     * @param first the first occurrence of the canonical event
     * @return a description of the mismatch, or null if the row round-trips
     */
    public String verifyRow(StoredEvent before, Event after, ResolvedZone zone,
                            ExpandedOccurrence first) {
        long start = before.getStartAt().toLocalMillis(zone);
        if (start != after.getStartAt()) {
            return MessageFormat.format(L10N.getString("roundtrip.start"),
                    before.getStartAt(), after.getStartAt());
        }
        if (before.getEndAt() != null) {
            long end = before.getEndAt().toLocalMillis(zone);
            if (after.getEndAt() == null || end != after.getEndAt().longValue()) {
                return MessageFormat.format(L10N.getString("roundtrip.end"),
                        before.getEndAt(), after.getEndAt());
            }
        }
        LocalDateTime local = first.getLocalStart();
        if (!zone.isGap(local) && after.getStartAtUtc() != null) {
            LocalDateTime cached = zone.toLocal(Instant.ofEpochMilli(after.getStartAtUtc().longValue()));
            if (!cached.equals(local)) {
                return MessageFormat.format(L10N.getString("roundtrip.start_utc"),
                        after.getStartAtUtc(), cached, local);
            }
        }
        return null;
    }

    /**
     * Compares a dataset before and after normalization. Rows are matched
     * by event id; a row that was rewritten must read, in its new zone, as
     * the same wall-clock anchor it had before.
     *
     * @param before the rows before
     * @param after the rows after
     * @return the report
     */
    public RoundTripReport verifyDataset(List<StoredEvent> before, List<StoredEvent> after) {
        Map<String, StoredEvent> beforeById = index(before);
        Map<String, StoredEvent> afterById = index(after);
        List<String> missing = new ArrayList<String>();
        List<String> mismatched = new ArrayList<String>();
        for (StoredEvent row : beforeById.values()) {
            StoredEvent normalized = afterById.get(row.getId());
            if (normalized == null) {
                missing.add(row.getId());
            } else if (!row.equals(normalized) && !sameMeaning(row, normalized)) {
                mismatched.add(row.getId());
            }
        }
        List<String> extra = new ArrayList<String>();
        for (String id : afterById.keySet()) {
            if (!beforeById.containsKey(id)) {
                extra.add(id);
            }
        }
        RoundTripReport report = new RoundTripReport(before.size(), after.size(), missing,
                extra, mismatched);
        if (!report.isConsistent()) {
            LOGGER.warning(MessageFormat.format(L10N.getString("roundtrip.dataset"), report));
        }
        return report;
    }

    private boolean sameMeaning(StoredEvent before, StoredEvent after) {
        ResolvedZone zone;
        try {
            zone = resolver.resolve(after.getTz(), null);
        } catch (TimekeepingException e) {
            if (LOGGER.isLoggable(Level.FINE)) {
                LOGGER.fine(MessageFormat.format(L10N.getString("roundtrip.zone"),
                        after.getId(), e.getDetail()));
            }
            return false;
        }
        try {
            if (before.getStartAt().toLocalMillis(zone) != after.getStartAt().toLocalMillis(zone)) {
                return false;
            }
            if (before.getEndAt() == null || after.getEndAt() == null) {
                return before.getEndAt() == null && after.getEndAt() == null;
            }
            return before.getEndAt().toLocalMillis(zone) == after.getEndAt().toLocalMillis(zone);
        } catch (DateTimeException e) {
            if (LOGGER.isLoggable(Level.FINE)) {
                LOGGER.fine(MessageFormat.format(L10N.getString("roundtrip.unreadable"),
                        after.getId(), e.getMessage()));
            }
            return false;
        }
    }

    private static Map<String, StoredEvent> index(List<StoredEvent> rows) {
        Map<String, StoredEvent> map = new LinkedHashMap<String, StoredEvent>();
        for (StoredEvent row : rows) {
            map.put(row.getId(), row);
        }
        return map;
    }
}
