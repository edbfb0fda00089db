/*
 * LegacyTimestamp.java
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

import org.bluezoo.almanac.tz.ResolvedZone;
import org.bluezoo.almanac.tz.TimezoneResolver;

import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;

/**
 * A stored date value in one of the encodings accumulated across schema
 * migrations.
 *
 * <p>The three variants are:
 * <dl>
 *   <dt>{@link EpochMillis}</dt>
 *   <dd>the canonical encoding: a wall-clock anchor in local-naive
 *       milliseconds</dd>
 *   <dt>{@link EpochSeconds}</dt>
 *   <dd>a wall-clock anchor in local-naive seconds</dd>
 *   <dt>{@link IsoText}</dt>
 *   <dd>ISO-8601 text: a local date-time ({@code 2024-03-01T09:00},
 *       seconds and fraction optional, a space may replace the
 *       {@code T}), a date meaning local midnight ({@code 2024-03-01}), or
 *       an absolute instant with {@code Z} or an offset, which denotes the
 *       wall-clock time of that instant in the event zone</dd>
 * </dl>
 *
 * <p>Raw numbers, and text consisting only of digits, are classified by
 * magnitude: below {@value #SECONDS_THRESHOLD} they are seconds, otherwise
 * milliseconds.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public abstract class LegacyTimestamp {

    /**
     * Magnitude below which a raw number is taken to be seconds.
     */
    public static final long SECONDS_THRESHOLD = 100000000000L;

    /**
     * The encoding of a stored value.
     */
    public enum Kind {
        EPOCH_MILLIS,
        EPOCH_SECONDS,
        ISO_TEXT
    }

    LegacyTimestamp() {
    }

    /**
     * Returns a canonical value.
     *
     * @param localMillis the wall-clock anchor in local-naive milliseconds
     */
    public static LegacyTimestamp millis(long localMillis) {
        return new EpochMillis(localMillis);
    }

    /**
     * Classifies a raw number by magnitude.
     */
    public static LegacyTimestamp of(long value) {
        if (Math.abs(value) < SECONDS_THRESHOLD) {
            return new EpochSeconds(value);
        }
        return new EpochMillis(value);
    }

    /**
     * Classifies stored text.
     *
     * @param text the stored text
     * @return the timestamp
     */
    public static LegacyTimestamp parse(String text) {
        String value = text.trim();
        if (isInteger(value)) {
            try {
                return of(Long.parseLong(value));
            } catch (NumberFormatException e) {
                // Too many digits for a long: leave it to conversion to reject
                return new IsoText(value);
            }
        }
        return new IsoText(value);
    }

    private static boolean isInteger(String value) {
        int start = value.startsWith("-") ? 1 : 0;
        if (value.length() == start) {
            return false;
        }
        for (int i = start; i < value.length(); i++) {
            char c = value.charAt(i);
            if (c < '0' || c > '9') {
                return false;
            }
        }
        return true;
    }

    public abstract Kind getKind();

    /**
     * Returns true if this is the canonical encoding.
     */
    public boolean isCanonical() {
        return getKind() == Kind.EPOCH_MILLIS;
    }

    /**
     * Converts this value to a wall-clock anchor.
     *
     * @param zone the event zone, used only for absolute instants
     * @return the anchor in local-naive milliseconds
     * @throws DateTimeException if the value cannot be interpreted
     */
    public abstract long toLocalMillis(ResolvedZone zone);

    /**
     * Returns the value as it is written to storage.
     */
    public abstract String toStorageString();

    @Override
    public String toString() {
        return getKind() + ":" + toStorageString();
    }

    /**
     * Canonical epoch milliseconds.
     */
    public static final class EpochMillis extends LegacyTimestamp {

        private final long value;

        EpochMillis(long value) {
            this.value = value;
        }

        public long getValue() {
            return value;
        }

        @Override
        public Kind getKind() {
            return Kind.EPOCH_MILLIS;
        }

        @Override
        public long toLocalMillis(ResolvedZone zone) {
            return value;
        }

        @Override
        public String toStorageString() {
            return Long.toString(value);
        }

        @Override
        public boolean equals(Object obj) {
            return obj instanceof EpochMillis && ((EpochMillis) obj).value == value;
        }

        @Override
        public int hashCode() {
            return Long.hashCode(value);
        }
    }

    /**
     * Epoch seconds.
     */
    public static final class EpochSeconds extends LegacyTimestamp {

        private final long value;

        EpochSeconds(long value) {
            this.value = value;
        }

        public long getValue() {
            return value;
        }

        @Override
        public Kind getKind() {
            return Kind.EPOCH_SECONDS;
        }

        @Override
        public long toLocalMillis(ResolvedZone zone) {
            try {
                return Math.multiplyExact(value, 1000L);
            } catch (ArithmeticException e) {
                throw new DateTimeException("Epoch seconds out of range: " + value, e);
            }
        }

        @Override
        public String toStorageString() {
            return Long.toString(value);
        }

        @Override
        public boolean equals(Object obj) {
            return obj instanceof EpochSeconds && ((EpochSeconds) obj).value == value;
        }

        @Override
        public int hashCode() {
            return Long.hashCode(value) ^ 0x5eed;
        }
    }

    /**
     * ISO-8601 text.
     */
    public static final class IsoText extends LegacyTimestamp {

        private final String text;

        IsoText(String text) {
            this.text = text;
        }

        public String getText() {
            return text;
        }

        @Override
        public Kind getKind() {
            return Kind.ISO_TEXT;
        }

        @Override
        public long toLocalMillis(ResolvedZone zone) {
            String value = text.replace(' ', 'T');
            if (value.length() == 10) {
                return TimezoneResolver.toLocalMillis(LocalDate.parse(value).atStartOfDay());
            }
            if (hasOffset(value)) {
                OffsetDateTime absolute = OffsetDateTime.parse(value);
                return TimezoneResolver.toLocalMillis(zone.toLocal(absolute.toInstant()));
            }
            return TimezoneResolver.toLocalMillis(LocalDateTime.parse(value));
        }

        private static boolean hasOffset(String value) {
            if (value.endsWith("Z")) {
                return true;
            }
            int t = value.indexOf('T');
            return t >= 0 && (value.indexOf('+', t) > 0 || value.indexOf('-', t) > 0);
        }

        @Override
        public String toStorageString() {
            return text;
        }

        @Override
        public boolean equals(Object obj) {
            return obj instanceof IsoText && ((IsoText) obj).text.equals(text);
        }

        @Override
        public int hashCode() {
            return text.hashCode();
        }
    }
}
