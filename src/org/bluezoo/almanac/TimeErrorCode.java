/*
 * TimeErrorCode.java
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

import java.util.ResourceBundle;

/**
 * Stable taxonomy of timekeeping error codes.
 *
 * <p>The code strings are matched by presentation layers and must never
 * change. Input validation codes block persistence of the offending event;
 * {@link #TZ_DRIFT_DETECTED} is advisory and only ever reported.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 * @see TimekeepingException
 */
public enum TimeErrorCode {

    /**
     * An EXDATE entry is not an ISO-8601 UTC instant.
     */
    EXDATE_INVALID_FORMAT("E_EXDATE_INVALID_FORMAT", "exdate_invalid_format"),

    /**
     * An EXDATE entry lies outside the bound of its series.
     */
    EXDATE_OUT_OF_RANGE("E_EXDATE_OUT_OF_RANGE", "exdate_out_of_range"),

    /**
     * A recurrence rule is syntactically malformed.
     */
    RRULE_PARSE("E_RRULE_PARSE", "rrule_parse"),

    /**
     * A recurrence rule names a key, or a value, outside the supported grammar.
     */
    RRULE_UNSUPPORTED_FIELD("E_RRULE_UNSUPPORTED_FIELD", "rrule_unsupported_field"),

    /**
     * A timezone name does not resolve against the timezone database.
     */
    TZ_UNKNOWN("E_TZ_UNKNOWN", "tz_unknown"),

    /**
     * A cached UTC instant no longer matches its recomputed value.
     */
    TZ_DRIFT_DETECTED("E_TZ_DRIFT_DETECTED", "tz_drift_detected"),

    /**
     * A time range has its end before its start.
     */
    RANGE_INVALID("E_RANGE_INVALID", "range_invalid");

    private static final ResourceBundle L10N = ResourceBundle.getBundle("org.bluezoo.almanac.L10N");

    private final String code;
    private final String key;

    TimeErrorCode(String code, String key) {
        this.code = code;
        this.key = key;
    }

    /**
     * Returns the stable machine-readable code, e.g. {@code E_TZ_UNKNOWN}.
     *
     * @return the code string
     */
    public String getCode() {
        return code;
    }

    /**
     * Returns the developer-facing description of this code.
     *
     * @return the developer message
     */
    public String getDeveloperMessage() {
        return L10N.getString("error." + key + ".developer");
    }

    /**
     * Returns the user-facing copy for this code.
     *
     * @return the user message
     */
    public String getUserMessage() {
        return L10N.getString("error." + key + ".user");
    }

    /**
     * Looks up a code by its string form.
     *
     * @param code the code string
     * @return the matching code, or null if there is none
     */
    public static TimeErrorCode forCode(String code) {
        for (TimeErrorCode value : values()) {
            if (value.code.equals(code)) {
                return value;
            }
        }
        return null;
    }

    @Override
    public String toString() {
        return code;
    }
}
