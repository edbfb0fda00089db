/*
 * BackfillNormalizer.java
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
import org.bluezoo.almanac.Household;
import org.bluezoo.almanac.TimekeepingException;
import org.bluezoo.almanac.exdate.ExdateInspection;
import org.bluezoo.almanac.exdate.ExdateParser;
import org.bluezoo.almanac.expand.ExpandedOccurrence;
import org.bluezoo.almanac.expand.OccurrenceExpander;
import org.bluezoo.almanac.rrule.RecurrenceRule;
import org.bluezoo.almanac.rrule.RecurrenceRuleParser;
import org.bluezoo.almanac.tz.ResolvedZone;
import org.bluezoo.almanac.tz.TimezoneResolver;
import org.bluezoo.almanac.tz.ZoneSource;

import java.text.MessageFormat;
import java.time.DateTimeException;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.ResourceBundle;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Rewrites stored event rows into canonical form.
 *
 * <p>For each row the normalizer:
 * <ol>
 *   <li>chooses a zone: the row's own zone if known, otherwise the
 *       fallback (the run's default timezone, the household zone, or the
 *       resolver's default, in that order); a row with no usable zone is
 *       skipped</li>
 *   <li>converts legacy date encodings to local-naive milliseconds</li>
 *   <li>canonicalizes the EXDATE list, dropping malformed, non-UTC and
 *       out-of-range entries and duplicates</li>
 *   <li>computes the UTC caches of the first occurrence</li>
 *   <li>verifies the round trip</li>
 * </ol>
 * and writes the row only if something changed. Each row's result depends
 * only on the row, so re-running over canonical rows writes nothing.
 *
 * <p>Rows are processed in batches, one transaction per batch. The batch's
 * checkpoint is saved in the same transaction, so after a failure a new run
 * resumes after the last committed batch. A storage failure rolls back the
 * current batch and is rethrown.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class BackfillNormalizer {

    private static final Logger LOGGER = Logger.getLogger(BackfillNormalizer.class.getName());
    private static final ResourceBundle L10N = ResourceBundle.getBundle("org.bluezoo.almanac.backfill.L10N");

    private final EventStore store;
    private final TimezoneResolver resolver;
    private final OccurrenceExpander expander;
    private final RoundTripVerifier verifier;
    private boolean pinTimezone = true;

    public BackfillNormalizer(EventStore store, TimezoneResolver resolver, OccurrenceExpander expander) {
        this.store = store;
        this.resolver = resolver;
        this.expander = expander;
        this.verifier = new RoundTripVerifier(resolver);
    }

    /**
     * Returns true if the chosen zone is written into each row's
     * {@code tz} column.
     */
    public boolean isPinTimezone() {
        return pinTimezone;
    }

    /**
     * Sets whether the chosen zone is written into each row's {@code tz}
     * column. When false, rows without a zone are normalized as floating
     * and keep their empty zone.
     */
    public void setPinTimezone(boolean pinTimezone) {
        this.pinTimezone = pinTimezone;
    }

    public BackfillSummary run(BackfillOptions options) throws EventStoreException {
        return run(options, null, null);
    }

    /**
     * Runs a backfill.
     *
     * @param options the options
     * @param listener receives progress after each batch, or null
     * @param control allows cancellation between batches, or null
     * @return the summary
     * @throws EventStoreException if storage fails; the current batch is
     *         rolled back
     * @throws IllegalArgumentException if the default timezone is unknown
     */
    public BackfillSummary run(BackfillOptions options, BackfillListener listener,
                               BackfillControl control) throws EventStoreException {
        String scope = options.getScope();
        String householdId = options.getHouseholdId();
        ResolvedZone override = null;
        if (options.getDefaultTimezone() != null) {
            try {
                override = resolver.lookup(options.getDefaultTimezone(), ZoneSource.DEFAULT);
            } catch (TimekeepingException e) {
                throw new IllegalArgumentException(MessageFormat.format(
                        L10N.getString("err.default_timezone"), e.getDetail()), e);
            }
        }
        Run run = new Run(options, override, listener);
        LOGGER.info(MessageFormat.format(L10N.getString("info.start"), scope,
                options.isDryRun(), options.getChunkSize()));

        BackfillStatus status;
        if (options.isDryRun()) {
            status = dryRun(run, control);
        } else {
            if (options.isResetCheckpoint()) {
                EventStore.Transaction tx = store.begin();
                try {
                    tx.deleteCheckpoint(scope);
                    tx.commit();
                } catch (EventStoreException e) {
                    tx.rollback();
                    throw e;
                }
            }
            status = backfill(run, control);
        }

        BackfillSummary summary = new BackfillSummary(scope, status, options.isDryRun(),
                run.scanned, run.updated, run.skipped, run.elapsed(), run.examples);
        LOGGER.info(MessageFormat.format(L10N.getString("info.summary"), scope, status,
                options.isDryRun(), run.scanned, run.updated, run.skipped, run.elapsed()));
        if (householdId == null && run.households.size() > 1 && LOGGER.isLoggable(Level.FINE)) {
            LOGGER.fine(MessageFormat.format(L10N.getString("log.households"),
                    run.households.size()));
        }
        return summary;
    }

    private BackfillStatus backfill(Run run, BackfillControl control) throws EventStoreException {
        BackfillOptions options = run.options;
        String householdId = options.getHouseholdId();
        String scope = options.getScope();
        Checkpoint checkpoint = store.getCheckpoint(scope);
        if (checkpoint == null) {
            checkpoint = Checkpoint.start(scope, store.count(householdId, 0L));
        } else {
            long pending = store.count(householdId, checkpoint.getLastSequence());
            checkpoint = checkpoint.withTotal(checkpoint.getProcessed() + pending);
            LOGGER.info(MessageFormat.format(L10N.getString("info.resume"), scope,
                    checkpoint.getLastSequence(), checkpoint.getProcessed(), pending));
        }
        while (true) {
            if (control != null && control.isCancelled()) {
                return BackfillStatus.CANCELLED;
            }
            List<StoredEvent> batch = store.read(householdId, checkpoint.getLastSequence(),
                    options.getChunkSize());
            if (batch.isEmpty()) {
                return BackfillStatus.COMPLETED;
            }
            long batchUpdated = 0L;
            long batchSkipped = 0L;
            Checkpoint next;
            EventStore.Transaction tx = store.begin();
            try {
                for (StoredEvent row : batch) {
                    Outcome outcome = normalize(row, run.fallback(row.getHouseholdId()));
                    if (outcome.reason != null) {
                        batchSkipped++;
                        run.skip(row, outcome);
                    } else if (outcome.changed) {
                        tx.update(outcome.row);
                        batchUpdated++;
                    }
                }
                long last = batch.get(batch.size() - 1).getSequence();
                next = checkpoint.advance(last, batch.size(), batchUpdated, batchSkipped);
                tx.saveCheckpoint(next);
                tx.commit();
            } catch (EventStoreException e) {
                tx.rollback();
                LOGGER.log(Level.SEVERE, MessageFormat.format(L10N.getString("err.batch"),
                        scope, checkpoint.getLastSequence()), e);
                throw e;
            }
            checkpoint = next;
            run.batch(batch.size(), batchUpdated, batchSkipped, checkpoint.getRemaining());
        }
    }

    private BackfillStatus dryRun(Run run, BackfillControl control) throws EventStoreException {
        BackfillOptions options = run.options;
        String householdId = options.getHouseholdId();
        long total = store.count(householdId, 0L);
        long last = 0L;
        long seen = 0L;
        while (true) {
            if (control != null && control.isCancelled()) {
                return BackfillStatus.CANCELLED;
            }
            List<StoredEvent> batch = store.read(householdId, last, options.getChunkSize());
            if (batch.isEmpty()) {
                return BackfillStatus.COMPLETED;
            }
            long batchUpdated = 0L;
            long batchSkipped = 0L;
            for (StoredEvent row : batch) {
                Outcome outcome = normalize(row, run.fallback(row.getHouseholdId()));
                if (outcome.reason != null) {
                    batchSkipped++;
                    run.skip(row, outcome);
                } else if (outcome.changed) {
                    batchUpdated++;
                }
            }
            last = batch.get(batch.size() - 1).getSequence();
            seen += batch.size();
            run.batch(batch.size(), batchUpdated, batchSkipped, Math.max(0L, total - seen));
        }
    }

    /**
     * Normalizes one row without touching storage.
     *
     * @param row the stored row
     * @param fallback the zone for rows whose own zone is missing or
     *        unknown, or null
     * @return the outcome
     */
    Outcome normalize(StoredEvent row, ResolvedZone fallback) {
        String rowTz = row.getTz() == null ? null : row.getTz().trim();
        if (rowTz != null && rowTz.isEmpty()) {
            rowTz = null;
        }
        ResolvedZone zone;
        if (rowTz != null) {
            try {
                zone = resolver.lookup(rowTz);
            } catch (TimekeepingException e) {
                if (fallback == null) {
                    return Outcome.skip(SkipReason.INVALID_TIMEZONE, rowTz);
                }
                zone = fallback;
            }
        } else if (fallback != null) {
            zone = fallback;
        } else if (pinTimezone) {
            return Outcome.skip(SkipReason.MISSING_TIMEZONE, "no zone and no fallback");
        } else {
            zone = ResolvedZone.FLOATING;
        }

        long startAt;
        Long endAt = null;
        try {
            startAt = row.getStartAt().toLocalMillis(zone);
            if (row.getEndAt() != null) {
                endAt = Long.valueOf(row.getEndAt().toLocalMillis(zone));
            }
        } catch (DateTimeException e) {
            return Outcome.skip(SkipReason.INVALID_TIMESTAMP, e.getMessage());
        }
        if (endAt != null && endAt.longValue() < startAt) {
            return Outcome.skip(SkipReason.INVALID_TIMESTAMP, "end_at precedes start_at");
        }

        Event event = new Event(row.getId(), row.getHouseholdId(), startAt);
        event.setEndAt(endAt);
        event.setTz(pinTimezone ? zone.getId() : row.getTz());
        event.setRrule(row.getRrule());
        event.setReminder(row.getReminder());

        ExpandedOccurrence first;
        try {
            first = expander.firstOccurrence(event, zone);
            event.setExdates(canonicalExdates(row, event, zone, first));
        } catch (TimekeepingException e) {
            return Outcome.skip(SkipReason.INVALID_RULE, e.getDetail());
        }
        event.setStartAtUtc(Long.valueOf(first.getStartMillis()));
        event.setEndAtUtc(endAt == null ? null : Long.valueOf(first.getEndMillis()));

        String mismatch = verifier.verifyRow(row, event, zone, first);
        if (mismatch != null) {
            return Outcome.skip(SkipReason.ROUNDTRIP_MISMATCH, mismatch);
        }
        StoredEvent canonical = StoredEvent.of(row.getSequence(), event);
        return Outcome.normalized(canonical, !canonical.equals(row));
    }

    private String canonicalExdates(StoredEvent row, Event event, ResolvedZone zone,
                                    ExpandedOccurrence first) throws TimekeepingException {
        String text = row.getExdates();
        if (text == null) {
            return null;
        }
        Instant lower = null;
        Instant upper = null;
        if (event.isRecurring() && !ExdateParser.split(text).isEmpty()) {
            RecurrenceRule rule = RecurrenceRuleParser.parse(event.getRrule());
            Duration duration = Duration.ofMillis(event.getDurationMs());
            LocalDateTime anchor = TimezoneResolver.toLocalDateTime(event.getStartAt());
            ExpandedOccurrence last = expander.lastOccurrence(rule, anchor, duration, zone);
            lower = first.getStart();
            if (last != null) {
                upper = last.getStart();
            } else if (rule.isBounded()
                    && expander.firstOccurrence(rule, anchor, duration, zone) == null) {
                // UNTIL precedes every candidate: nothing can be excluded
                upper = lower.minusMillis(1L);
            }
        }
        ExdateInspection inspection = ExdateParser.inspect(text, lower, upper, null);
        if (!inspection.isClean() || inspection.getDuplicates() > 0) {
            if (LOGGER.isLoggable(Level.FINE)) {
                LOGGER.fine(MessageFormat.format(L10N.getString("log.exdates"), row.getId(),
                        inspection.getInvalidFormat().size() + inspection.getNonUtc().size(),
                        inspection.getOutOfRange().size(), inspection.getDuplicates()));
            }
        }
        return inspection.getCanonical();
    }

    /**
     * Result of normalizing one row.
     */
    static final class Outcome {

        final StoredEvent row;
        final boolean changed;
        final SkipReason reason;
        final String detail;

        private Outcome(StoredEvent row, boolean changed, SkipReason reason, String detail) {
            this.row = row;
            this.changed = changed;
            this.reason = reason;
            this.detail = detail;
        }

        static Outcome normalized(StoredEvent row, boolean changed) {
            return new Outcome(row, changed, null, null);
        }

        static Outcome skip(SkipReason reason, String detail) {
            return new Outcome(null, false, reason, detail);
        }
    }

    /**
     * State of one run.
     */
    private class Run {

        final BackfillOptions options;
        final ResolvedZone override;
        final BackfillListener listener;
        final long startTime = System.currentTimeMillis();
        final Map<String, ResolvedZone> households = new HashMap<String, ResolvedZone>();
        final List<SkipExample> examples = new ArrayList<SkipExample>();
        long scanned;
        long updated;
        long skipped;

        Run(BackfillOptions options, ResolvedZone override, BackfillListener listener) {
            this.options = options;
            this.override = override;
            this.listener = listener;
        }

        long elapsed() {
            return System.currentTimeMillis() - startTime;
        }

        ResolvedZone fallback(String householdId) throws EventStoreException {
            if (override != null) {
                return override;
            }
            if (households.containsKey(householdId)) {
                return households.get(householdId);
            }
            ResolvedZone zone = null;
            Household household = store.getHousehold(householdId);
            String tz = household == null ? null : household.getTz();
            if (tz != null && !tz.trim().isEmpty()) {
                try {
                    zone = resolver.lookup(tz, ZoneSource.HOUSEHOLD);
                } catch (TimekeepingException e) {
                    LOGGER.warning(MessageFormat.format(L10N.getString("warn.household_tz"),
                            householdId, e.getDetail()));
                }
            }
            if (zone == null && resolver.getDefaultTz() != null) {
                try {
                    zone = resolver.lookup(resolver.getDefaultTz(), ZoneSource.DEFAULT);
                } catch (TimekeepingException e) {
                    // The resolver validates its default on construction
                    throw new IllegalStateException(e);
                }
            }
            households.put(householdId, zone);
            return zone;
        }

        void skip(StoredEvent row, Outcome outcome) {
            LOGGER.warning(MessageFormat.format(L10N.getString("warn.skip"), row.getId(),
                    row.getSequence(), outcome.reason, outcome.detail));
            if (examples.size() < BackfillSummary.MAX_SKIP_EXAMPLES) {
                examples.add(new SkipExample(row.getId(), row.getSequence(), outcome.reason,
                        outcome.detail));
            }
        }

        void batch(long batchScanned, long batchUpdated, long batchSkipped, long remaining) {
            scanned += batchScanned;
            updated += batchUpdated;
            skipped += batchSkipped;
            if (LOGGER.isLoggable(Level.FINE)) {
                LOGGER.fine(MessageFormat.format(L10N.getString("log.batch"), options.getScope(),
                        batchScanned, batchUpdated, batchSkipped, remaining));
            }
            if (listener != null) {
                listener.progress(new BackfillProgress(options.getScope(), scanned, updated,
                        skipped, remaining, elapsed()));
            }
        }
    }
}
