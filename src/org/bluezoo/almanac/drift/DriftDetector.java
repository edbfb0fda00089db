/*
 * DriftDetector.java
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

import org.bluezoo.almanac.Event;
import org.bluezoo.almanac.Household;
import org.bluezoo.almanac.TimekeepingException;
import org.bluezoo.almanac.expand.ExpandedOccurrence;
import org.bluezoo.almanac.expand.OccurrenceExpander;
import org.bluezoo.almanac.tz.ResolvedZone;
import org.bluezoo.almanac.tz.TimezoneResolver;

import java.text.MessageFormat;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.ResourceBundle;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Recomputes the first-occurrence instants of events with the resolver's
 * timezone database and compares them with the cached
 * {@code start_at_utc} and {@code end_at_utc} values.
 *
 * <p>Only rows carrying caches are checked. Floating events have nothing to
 * drift and are counted but never flagged. All-day events, running from
 * local midnight to local midnight over whole days, tolerate a cached
 * boundary on any local midnight within one day of the recomputed one.
 *
 * <p>The detector never modifies events.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class DriftDetector {

    private static final Logger LOGGER = Logger.getLogger(DriftDetector.class.getName());
    private static final ResourceBundle L10N = ResourceBundle.getBundle("org.bluezoo.almanac.drift.L10N");

    /**
     * Default tolerance: one minute.
     */
    public static final long DEFAULT_TOLERANCE_MS = 60000L;

    private static final long DAY_MS = 86400000L;

    private final TimezoneResolver resolver;
    private final OccurrenceExpander expander;
    private final long toleranceMs;

    public DriftDetector(TimezoneResolver resolver, OccurrenceExpander expander) {
        this(resolver, expander, DEFAULT_TOLERANCE_MS);
    }

    public DriftDetector(TimezoneResolver resolver, OccurrenceExpander expander, long toleranceMs) {
        if (toleranceMs < 0L) {
            throw new IllegalArgumentException("tolerance: " + toleranceMs);
        }
        this.resolver = resolver;
        this.expander = expander;
        this.toleranceMs = toleranceMs;
    }

    public long getToleranceMs() {
        return toleranceMs;
    }

    /**
     * Checks the events of one household.
     */
    public DriftReport detect(Collection<Event> events, Household household) {
        Map<String, Household> households = Collections.emptyMap();
        if (household != null) {
            households = Collections.singletonMap(household.getId(), household);
        }
        return detect(events, households);
    }

    /**
     * Checks events across households.
     *
     * @param events the events
     * @param households households by id, supplying fallback zones
     * @return the report
     */
    public DriftReport detect(Collection<Event> events, Map<String, Household> households) {
        List<DriftFinding> findings = new ArrayList<DriftFinding>();
        int checked = 0;
        for (Event event : events) {
            Long cachedStart = event.getStartAtUtc();
            if (cachedStart == null || (event.getEndAt() != null && event.getEndAtUtc() == null)) {
                continue;
            }
            checked++;
            DriftFinding finding = check(event, households.get(event.getHouseholdId()));
            if (finding != null) {
                findings.add(finding);
                if (LOGGER.isLoggable(Level.FINE)) {
                    LOGGER.fine(finding.toString());
                }
            }
        }
        DriftReport report = new DriftReport(resolver.getDatabase().getVersion(), checked, findings);
        if (report.hasDrift()) {
            LOGGER.warning(MessageFormat.format(L10N.getString("warn.drift"),
                    findings.size(), checked, report.getDatabaseVersion(),
                    report.getCountsByCategory()));
        } else {
            LOGGER.info(MessageFormat.format(L10N.getString("info.no_drift"),
                    checked, report.getDatabaseVersion()));
        }
        return report;
    }

    /**
     * Checks a single event.
     *
     * @return the finding, or null if the caches are current
     */
    DriftFinding check(Event event, Household household) {
        ResolvedZone zone;
        try {
            zone = resolver.resolve(event, household);
        } catch (TimekeepingException e) {
            return new DriftFinding(event.getId(), event.getHouseholdId(), DriftCategory.TZ_MISSING,
                    event.getStartAtUtc(), null, event.getEndAtUtc(), null, 0L);
        }
        if (zone.isFloating()) {
            return null;
        }
        ExpandedOccurrence first;
        try {
            first = expander.firstOccurrence(event, zone);
        } catch (TimekeepingException e) {
            LOGGER.warning(MessageFormat.format(L10N.getString("warn.unreadable"),
                    event.getId(), e.getCode(), e.getDetail()));
            return null;
        }
        long cachedStart = event.getStartAtUtc().longValue();
        Long cachedEnd = event.getEndAtUtc();
        long recomputedStart = first.getStartMillis();
        Long recomputedEnd = event.getEndAt() == null ? null : Long.valueOf(first.getEndMillis());
        long delta = Math.abs(cachedStart - recomputedStart);
        if (cachedEnd != null && recomputedEnd != null) {
            delta = Math.max(delta, Math.abs(cachedEnd.longValue() - recomputedEnd.longValue()));
        }

        if (isAllDay(event)) {
            boolean ok = allowAllDayShift(zone, cachedStart, first.getLocalStart());
            if (cachedEnd != null) {
                LocalDateTime localEnd = first.getLocalStart().plus(
                        event.getDurationMs(), ChronoUnit.MILLIS);
                ok &= allowAllDayShift(zone, cachedEnd.longValue(), localEnd);
            }
            if (ok) {
                return null;
            }
            return new DriftFinding(event.getId(), event.getHouseholdId(),
                    DriftCategory.ALLDAY_BOUNDARY_ERROR, Long.valueOf(cachedStart),
                    Long.valueOf(recomputedStart), cachedEnd, recomputedEnd, delta);
        }
        if (delta >= toleranceMs && delta > 0L) {
            return new DriftFinding(event.getId(), event.getHouseholdId(),
                    DriftCategory.TIMED_MISMATCH, Long.valueOf(cachedStart),
                    Long.valueOf(recomputedStart), cachedEnd, recomputedEnd, delta);
        }
        return null;
    }

    private static boolean isAllDay(Event event) {
        Long endAt = event.getEndAt();
        if (endAt == null) {
            return false;
        }
        long start = event.getStartAt();
        long end = endAt.longValue();
        long duration = end - start;
        return Math.floorMod(start, DAY_MS) == 0L && Math.floorMod(end, DAY_MS) == 0L
            && duration >= DAY_MS && duration % DAY_MS == 0L;
    }

    private static boolean allowAllDayShift(ResolvedZone zone, long cachedUtc, LocalDateTime expected) {
        LocalDateTime cached = zone.toLocal(Instant.ofEpochMilli(cachedUtc));
        if (!cached.toLocalTime().equals(LocalTime.MIDNIGHT)) {
            return false;
        }
        long days = ChronoUnit.DAYS.between(expected.toLocalDate(), cached.toLocalDate());
        return Math.abs(days) <= 1L;
    }
}
