/*
 * EventValidator.java
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

package org.bluezoo.almanac;

import org.bluezoo.almanac.exdate.ExdateInspection;
import org.bluezoo.almanac.exdate.ExdateParser;
import org.bluezoo.almanac.exdate.ExdateSet;
import org.bluezoo.almanac.expand.ExpandedOccurrence;
import org.bluezoo.almanac.expand.OccurrenceExpander;
import org.bluezoo.almanac.rrule.RecurrenceRule;
import org.bluezoo.almanac.rrule.RecurrenceRuleParser;
import org.bluezoo.almanac.tz.ResolvedZone;
import org.bluezoo.almanac.tz.TimezoneResolver;

import java.text.MessageFormat;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.util.ResourceBundle;
import java.util.function.Predicate;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Write-time validation of event definitions.
 *
 * <p>The authoring path calls {@link #validate} before persisting an event.
 * Any failure blocks persistence; nothing is coerced. Checks run in this
 * order:
 * <ol>
 *   <li>{@code start_at <= end_at} ({@code E_RANGE_INVALID})</li>
 *   <li>the event and household zones resolve ({@code E_TZ_UNKNOWN})</li>
 *   <li>the rule parses ({@code E_RRULE_PARSE},
 *       {@code E_RRULE_UNSUPPORTED_FIELD})</li>
 *   <li>every EXDATE entry is a UTC instant
 *       ({@code E_EXDATE_INVALID_FORMAT})</li>
 *   <li>every EXDATE entry lies between the first and last occurrence
 *       ({@code E_EXDATE_OUT_OF_RANGE})</li>
 * </ol>
 *
 * <p>On success the event's {@code start_at_utc} and {@code end_at_utc}
 * caches are set from its first occurrence. EXDATE entries that are in
 * range but match no occurrence are tolerated: they are logged and
 * returned in {@link ExdateInspection#getUnmatched()}.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class EventValidator {

    private static final Logger LOGGER = Logger.getLogger(EventValidator.class.getName());
    private static final ResourceBundle L10N = ResourceBundle.getBundle("org.bluezoo.almanac.L10N");

    private final TimezoneResolver resolver;
    private final OccurrenceExpander expander;

    public EventValidator(TimezoneResolver resolver, OccurrenceExpander expander) {
        this.resolver = resolver;
        this.expander = expander;
    }

    /**
     * Validates an event and refreshes its UTC caches.
     *
     * @param event the event to validate, updated in place on success
     * @param household the owning household, or null
     * @return the inspection of the event's EXDATE list
     * @throws TimekeepingException if the event must not be persisted
     */
    public ExdateInspection validate(Event event, Household household) throws TimekeepingException {
        Long endAt = event.getEndAt();
        if (endAt != null && endAt.longValue() < event.getStartAt()) {
            throw new TimekeepingException(TimeErrorCode.RANGE_INVALID, event.getId());
        }
        resolver.validate(event.getTz());
        final ResolvedZone zone = resolver.resolve(event, household);
        final LocalDateTime anchor = TimezoneResolver.toLocalDateTime(event.getStartAt());
        Duration duration = Duration.ofMillis(event.getDurationMs());

        ExpandedOccurrence first = expander.firstOccurrence(event, zone);
        ExdateSet exdates = ExdateParser.parse(event.getExdates());
        ExdateInspection inspection;
        if (event.isRecurring() && !exdates.isEmpty()) {
            final RecurrenceRule rule = RecurrenceRuleParser.parse(event.getRrule());
            Instant firstStart = first.getStart();
            Instant lastStart = lastStart(rule, anchor, duration, zone, firstStart);
            ExdateParser.checkRange(exdates, firstStart, lastStart);
            Predicate<Instant> occurrence = new Predicate<Instant>() {
                @Override
                public boolean test(Instant instant) {
                    return expander.isOccurrence(rule, anchor, zone, instant);
                }
            };
            inspection = ExdateParser.inspect(event.getExdates(), firstStart, lastStart, occurrence);
            for (Instant unmatched : inspection.getUnmatched()) {
                LOGGER.warning(MessageFormat.format(L10N.getString("validator.exdate_unmatched"),
                        event.getId(), ExdateSet.format(unmatched)));
            }
        } else {
            inspection = ExdateParser.inspect(event.getExdates(), null, null, null);
        }

        event.setStartAtUtc(Long.valueOf(first.getStartMillis()));
        event.setEndAtUtc(endAt == null ? null : Long.valueOf(first.getEndMillis()));
        if (LOGGER.isLoggable(Level.FINE)) {
            LOGGER.fine(MessageFormat.format(L10N.getString("validator.validated"),
                    event.getId(), zone, event.isRecurring()));
        }
        return inspection;
    }

    /**
     * Returns the start of the last occurrence, null when the series has
     * no representable end, or an instant before the first occurrence when
     * UNTIL precedes every candidate so that nothing can be excluded.
     */
    private Instant lastStart(RecurrenceRule rule, LocalDateTime anchor, Duration duration,
                              ResolvedZone zone, Instant firstStart) {
        ExpandedOccurrence last = expander.lastOccurrence(rule, anchor, duration, zone);
        if (last != null) {
            return last.getStart();
        }
        if (rule.isBounded() && expander.firstOccurrence(rule, anchor, duration, zone) == null) {
            return firstStart.minusMillis(1L);
        }
        return null;
    }
}
