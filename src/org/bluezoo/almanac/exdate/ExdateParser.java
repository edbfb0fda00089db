/*
 * ExdateParser.java
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

package org.bluezoo.almanac.exdate;

import org.bluezoo.almanac.TimeErrorCode;
import org.bluezoo.almanac.TimekeepingException;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Parser for EXDATE lists: comma-separated ISO-8601 UTC instants such as
 * {@code 2024-03-05T14:00:00Z,2024-03-07T14:00:00Z}.
 *
 * <p>Two modes are provided. {@link #parse} is strict and is used on the
 * write path: the first malformed entry fails the whole list with
 * {@link TimeErrorCode#EXDATE_INVALID_FORMAT}. {@link #inspect} is lenient
 * and is used by the backfill to classify and canonicalize stored lists
 * without failing.
 *
 * <p>Whitespace around entries is ignored, as are empty entries.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class ExdateParser {

    private ExdateParser() {
    }

    /**
     * Splits an EXDATE list into trimmed, non-empty entries.
     *
     * @param text the list, may be null
     * @return the entries
     */
    public static List<String> split(String text) {
        List<String> entries = new ArrayList<String>();
        if (text == null) {
            return entries;
        }
        for (String token : text.split(",")) {
            String entry = token.trim();
            if (!entry.isEmpty()) {
                entries.add(entry);
            }
        }
        return entries;
    }

    /**
     * Parses an EXDATE list strictly.
     *
     * @param text the list, may be null or empty
     * @return the set of excluded instants
     * @throws TimekeepingException E_EXDATE_INVALID_FORMAT naming the first
     *         entry that is not a UTC instant
     */
    public static ExdateSet parse(String text) throws TimekeepingException {
        List<String> entries = split(text);
        if (entries.isEmpty()) {
            return ExdateSet.EMPTY;
        }
        List<Instant> instants = new ArrayList<Instant>(entries.size());
        for (String entry : entries) {
            Instant instant = parseEntry(entry);
            if (instant == null || !isUtc(entry)) {
                throw new TimekeepingException(TimeErrorCode.EXDATE_INVALID_FORMAT, entry);
            }
            instants.add(instant);
        }
        return new ExdateSet(instants);
    }

    /**
     * Checks that every instant lies within the series bound.
     *
     * @param set the parsed set
     * @param first the first occurrence of the series
     * @param last the last occurrence, or null if the series is unbounded
     * @throws TimekeepingException E_EXDATE_OUT_OF_RANGE naming the first
     *         entry outside the bound
     */
    public static void checkRange(ExdateSet set, Instant first, Instant last)
            throws TimekeepingException {
        for (Instant instant : set.getInstants()) {
            if (!inRange(instant, first, last)) {
                throw new TimekeepingException(TimeErrorCode.EXDATE_OUT_OF_RANGE,
                        ExdateSet.format(instant));
            }
        }
    }

    /**
     * Inspects an EXDATE list leniently.
     *
     * @param text the list, may be null
     * @param first the first occurrence of the series, or null to skip the
     *        lower range check
     * @param last the last occurrence, or null if unbounded
     * @param occurrence tests whether an instant is a generated occurrence,
     *        or null to skip the match check
     * @return the inspection
     */
    public static ExdateInspection inspect(String text, Instant first, Instant last,
                                           Predicate<Instant> occurrence) {
        List<String> entries = split(text);
        List<String> invalidFormat = new ArrayList<String>();
        List<String> nonUtc = new ArrayList<String>();
        List<String> outOfRange = new ArrayList<String>();
        Set<Instant> seen = new LinkedHashSet<Instant>();
        int duplicates = 0;
        for (String entry : entries) {
            Instant instant = parseEntry(entry);
            if (instant == null) {
                invalidFormat.add(entry);
            } else if (!isUtc(entry)) {
                nonUtc.add(entry);
            } else if (!inRange(instant, first, last)) {
                outOfRange.add(entry);
            } else if (!seen.add(instant)) {
                duplicates++;
            }
        }
        ExdateSet valid = new ExdateSet(seen);
        List<Instant> unmatched = new ArrayList<Instant>();
        if (occurrence != null) {
            for (Instant instant : valid.getInstants()) {
                if (!occurrence.test(instant)) {
                    unmatched.add(instant);
                }
            }
        }
        return new ExdateInspection(entries.size(), valid, invalidFormat, nonUtc,
                outOfRange, duplicates, unmatched);
    }

    private static Instant parseEntry(String entry) {
        try {
            return OffsetDateTime.parse(entry).toInstant();
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    private static boolean isUtc(String entry) {
        return entry.endsWith("Z");
    }

    private static boolean inRange(Instant instant, Instant first, Instant last) {
        if (first != null && instant.isBefore(first)) {
            return false;
        }
        return last == null || !instant.isAfter(last);
    }
}
