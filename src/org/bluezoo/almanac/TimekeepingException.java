/*
 * TimekeepingException.java
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

import java.text.MessageFormat;
import java.util.ResourceBundle;

/**
 * Exception raised when temporal input fails validation or a consistency
 * check.
 *
 * <p>Every instance carries a {@link TimeErrorCode} and a detail naming what
 * was rejected: the offending rule key, EXDATE entry, zone name or event id.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class TimekeepingException extends Exception {

    private static final long serialVersionUID = 1L;
    private static final ResourceBundle L10N = ResourceBundle.getBundle("org.bluezoo.almanac.L10N");

    private final TimeErrorCode code;
    private final String detail;

    /**
     * Creates a new timekeeping exception.
     *
     * @param code the error code
     * @param detail what was rejected, may be null
     */
    public TimekeepingException(TimeErrorCode code, String detail) {
        super(buildMessage(code, detail));
        this.code = code;
        this.detail = detail;
    }

    /**
     * Creates a new timekeeping exception with an underlying cause.
     *
     * @param code the error code
     * @param detail what was rejected, may be null
     * @param cause the cause
     */
    public TimekeepingException(TimeErrorCode code, String detail, Throwable cause) {
        super(buildMessage(code, detail), cause);
        this.code = code;
        this.detail = detail;
    }

    private static String buildMessage(TimeErrorCode code, String detail) {
        if (code == null) {
            throw new NullPointerException("code");
        }
        if (detail == null) {
            return MessageFormat.format(L10N.getString("exception.message"),
                    code.getCode(), code.getDeveloperMessage());
        }
        return MessageFormat.format(L10N.getString("exception.message_detail"),
                code.getCode(), code.getDeveloperMessage(), detail);
    }

    /**
     * Returns the error code.
     *
     * @return the code
     */
    public TimeErrorCode getCode() {
        return code;
    }

    /**
     * Returns the detail: the rejected key, entry, zone or event id.
     *
     * @return the detail, or null if not specified
     */
    public String getDetail() {
        return detail;
    }
}
