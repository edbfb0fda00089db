/*
 * RecurrenceRuleParser.java
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

package org.bluezoo.almanac.rrule;

import org.bluezoo.almanac.TimeErrorCode;
import org.bluezoo.almanac.TimekeepingException;

import java.time.DayOfWeek;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.Locale;
import java.util.Set;

/**
 * Parser for the restricted recurrence rule grammar.
 *
 * <p>A rule is a list of {@code KEY=VALUE} pairs separated by semicolons,
 * optionally prefixed with {@code RRULE:}. Keys are case-insensitive.
 * Recognised keys:
 * <ul>
 *   <li>{@code FREQ} - {@code DAILY} or {@code WEEKLY} (required)</li>
 *   <li>{@code INTERVAL} - a positive integer, default 1</li>
 *   <li>{@code COUNT} - a positive integer</li>
 *   <li>{@code UNTIL} - a UTC instant, {@code 20241117T063000Z} or
 *       {@code 2024-11-17T06:30:00Z}</li>
 *   <li>{@code BYDAY} - comma-separated weekday codes {@code MO}..{@code SU},
 *       weekly rules only</li>
 * </ul>
 *
 * <p>Examples:
 * <ul>
 *   <li>{@code FREQ=DAILY;COUNT=5}</li>
 *   <li>{@code FREQ=WEEKLY;INTERVAL=2;BYDAY=MO,WE,FR;UNTIL=20241117T063000Z}</li>
 * </ul>
 *
 * <p>Any other key, or a recognised key with a value outside this grammar,
 * fails with {@link TimeErrorCode#RRULE_UNSUPPORTED_FIELD} naming the key.
 * Structural problems (a pair without {@code =}, a repeated key, a missing
 * {@code FREQ}) fail with {@link TimeErrorCode#RRULE_PARSE}. Parsing is all
 * or nothing.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class RecurrenceRuleParser {

    private static final String PREFIX = "RRULE:";

    private RecurrenceRuleParser() {
    }

    /**
     * Parses a recurrence rule.
     *
     * @param rule the rule string
     * @return the parsed rule
     * @throws TimekeepingException if the rule is malformed or unsupported
     */
    public static RecurrenceRule parse(String rule) throws TimekeepingException {
        if (rule == null) {
            throw new NullPointerException("rule");
        }
        String text = rule.trim();
        if (text.regionMatches(true, 0, PREFIX, 0, PREFIX.length())) {
            text = text.substring(PREFIX.length()).trim();
        }

        Frequency frequency = null;
        int interval = 1;
        int count = RecurrenceRule.NO_COUNT;
        Instant until = null;
        Set<DayOfWeek> byDay = null;
        Set<String> seen = new HashSet<String>();

        for (String part : text.split(";")) {
            part = part.trim();
            if (part.isEmpty()) {
                continue;
            }
            int eq = part.indexOf('=');
            if (eq < 1) {
                throw new TimekeepingException(TimeErrorCode.RRULE_PARSE, part);
            }
            String key = part.substring(0, eq).trim().toUpperCase(Locale.ROOT);
            String value = part.substring(eq + 1).trim();
            if (!seen.add(key)) {
                throw new TimekeepingException(TimeErrorCode.RRULE_PARSE, key);
            }
            switch (key) {
                case "FREQ":
                    frequency = parseFrequency(value);
                    break;
                case "INTERVAL":
                    interval = parsePositive(key, value);
                    break;
                case "COUNT":
                    count = parsePositive(key, value);
                    break;
                case "UNTIL":
                    until = parseUntil(value);
                    break;
                case "BYDAY":
                    byDay = parseByDay(value);
                    break;
                default:
                    throw new TimekeepingException(TimeErrorCode.RRULE_UNSUPPORTED_FIELD, key);
            }
        }

        if (frequency == null) {
            throw new TimekeepingException(TimeErrorCode.RRULE_PARSE, "FREQ");
        }
        if (byDay != null && frequency != Frequency.WEEKLY) {
            throw new TimekeepingException(TimeErrorCode.RRULE_UNSUPPORTED_FIELD, "BYDAY");
        }
        return new RecurrenceRule(frequency, interval, count, until, byDay);
    }

    private static Frequency parseFrequency(String value) throws TimekeepingException {
        String upper = value.toUpperCase(Locale.ROOT);
        if ("DAILY".equals(upper)) {
            return Frequency.DAILY;
        }
        if ("WEEKLY".equals(upper)) {
            return Frequency.WEEKLY;
        }
        throw new TimekeepingException(TimeErrorCode.RRULE_UNSUPPORTED_FIELD, "FREQ");
    }

    private static int parsePositive(String key, String value) throws TimekeepingException {
        if (value.isEmpty() || value.length() > 9) {
            throw new TimekeepingException(TimeErrorCode.RRULE_UNSUPPORTED_FIELD, key);
        }
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (c < '0' || c > '9') {
                throw new TimekeepingException(TimeErrorCode.RRULE_UNSUPPORTED_FIELD, key);
            }
        }
        int n = Integer.parseInt(value);
        if (n < 1) {
            throw new TimekeepingException(TimeErrorCode.RRULE_UNSUPPORTED_FIELD, key);
        }
        return n;
    }

    private static Instant parseUntil(String value) throws TimekeepingException {
        // Floating (local) UNTIL values have no absolute meaning
        if (!value.endsWith("Z") && !value.endsWith("z")) {
            throw new TimekeepingException(TimeErrorCode.RRULE_UNSUPPORTED_FIELD, "UNTIL");
        }
        String upper = value.toUpperCase(Locale.ROOT);
        try {
            if (upper.indexOf('-') > 0) {
                return Instant.parse(upper);
            }
            return Instant.from(RecurrenceRule.UNTIL_FORMAT.parse(upper));
        } catch (DateTimeParseException e) {
            throw new TimekeepingException(TimeErrorCode.RRULE_UNSUPPORTED_FIELD, "UNTIL", e);
        }
    }

    private static Set<DayOfWeek> parseByDay(String value) throws TimekeepingException {
        Set<DayOfWeek> days = EnumSet.noneOf(DayOfWeek.class);
        if (value.isEmpty()) {
            return days;
        }
        for (String code : value.split(",")) {
            DayOfWeek day = parseDay(code.trim());
            if (day == null) {
                throw new TimekeepingException(TimeErrorCode.RRULE_UNSUPPORTED_FIELD, "BYDAY");
            }
            days.add(day);
        }
        return days;
    }

    /**
     * Returns the weekday for a two-letter code, or null if the code is not
     * one of {@code MO TU WE TH FR SA SU}.
     *
     * @param code the weekday code
     * @return the weekday, or null
     */
    static DayOfWeek parseDay(String code) {
        switch (code.toUpperCase(Locale.ROOT)) {
            case "MO":
                return DayOfWeek.MONDAY;
            case "TU":
                return DayOfWeek.TUESDAY;
            case "WE":
                return DayOfWeek.WEDNESDAY;
            case "TH":
                return DayOfWeek.THURSDAY;
            case "FR":
                return DayOfWeek.FRIDAY;
            case "SA":
                return DayOfWeek.SATURDAY;
            case "SU":
                return DayOfWeek.SUNDAY;
            default:
                return null;
        }
    }

    /**
     * Returns the two-letter code for a weekday.
     *
     * @param day the weekday
     * @return the code, e.g. {@code MO}
     */
    static String dayCode(DayOfWeek day) {
        return day.name().substring(0, 2);
    }
}
