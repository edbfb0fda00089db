/*
 * EngineConfiguration.java
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

package org.bluezoo.almanac.config;

import org.bluezoo.almanac.backfill.BackfillOptions;
import org.bluezoo.almanac.drift.DriftDetector;
import org.bluezoo.almanac.query.QueryEngine;
import org.bluezoo.almanac.tz.SystemTimezoneDatabase;
import org.bluezoo.almanac.tz.TimezoneDatabase;
import org.bluezoo.almanac.tz.TimezoneResolver;

import java.text.MessageFormat;
import java.util.ResourceBundle;

/**
 * Settings for a {@link org.bluezoo.almanac.TimekeepingEngine}, declared
 * by the {@code engine} element of almanacrc.xml.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class EngineConfiguration {

    private static final ResourceBundle L10N = ResourceBundle.getBundle("org.bluezoo.almanac.config.L10N");

    private long driftToleranceMs = DriftDetector.DEFAULT_TOLERANCE_MS;
    private int maxOccurrencesPerSeries = QueryEngine.DEFAULT_MAX_OCCURRENCES_PER_SERIES;
    private int maxQueryResults = QueryEngine.DEFAULT_MAX_QUERY_RESULTS;
    private int defaultLimit = QueryEngine.DEFAULT_LIMIT;
    private int backfillChunkSize = BackfillOptions.DEFAULT_CHUNK_SIZE;
    private boolean pinTimezone = true;
    private String defaultTimezone;
    private TimezoneDatabase timezoneDatabase;

    public long getDriftTolerance() {
        return driftToleranceMs;
    }

    /**
     * Sets the drift tolerance in milliseconds.
     */
    public void setDriftTolerance(long driftToleranceMs) {
        this.driftToleranceMs = driftToleranceMs;
    }

    /**
     * Sets the drift tolerance from text such as {@code 90s}, {@code 2m}
     * or {@code 1500ms}. A bare number is milliseconds.
     *
     * @throws IllegalArgumentException if the text is not a duration
     */
    public void setDriftTolerance(String text) {
        this.driftToleranceMs = parseDuration(text);
    }

    static long parseDuration(String text) {
        String s = text.trim().toLowerCase();
        long unit = 1L;
        if (s.endsWith("ms")) {
            s = s.substring(0, s.length() - 2);
        } else if (s.endsWith("s")) {
            unit = 1000L;
            s = s.substring(0, s.length() - 1);
        } else if (s.endsWith("m")) {
            unit = 60000L;
            s = s.substring(0, s.length() - 1);
        } else if (s.endsWith("h")) {
            unit = 3600000L;
            s = s.substring(0, s.length() - 1);
        }
        try {
            return Long.parseLong(s.trim()) * unit;
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(MessageFormat.format(
                    L10N.getString("err.duration"), text), e);
        }
    }

    public int getMaxOccurrencesPerSeries() {
        return maxOccurrencesPerSeries;
    }

    /**
     * Sets the most occurrences one series may contribute to a query;
     * -1 removes the cap.
     */
    public void setMaxOccurrencesPerSeries(int maxOccurrencesPerSeries) {
        this.maxOccurrencesPerSeries = maxOccurrencesPerSeries;
    }

    public int getMaxQueryResults() {
        return maxQueryResults;
    }

    public void setMaxQueryResults(int maxQueryResults) {
        this.maxQueryResults = maxQueryResults;
    }

    public int getDefaultLimit() {
        return defaultLimit;
    }

    public void setDefaultLimit(int defaultLimit) {
        this.defaultLimit = defaultLimit;
    }

    public int getBackfillChunkSize() {
        return backfillChunkSize;
    }

    public void setBackfillChunkSize(int backfillChunkSize) {
        this.backfillChunkSize = backfillChunkSize;
    }

    /**
     * Returns true if the backfill writes the resolved zone into rows
     * that had none.
     */
    public boolean isPinTimezone() {
        return pinTimezone;
    }

    public void setPinTimezone(boolean pinTimezone) {
        this.pinTimezone = pinTimezone;
    }

    public String getDefaultTimezone() {
        return defaultTimezone;
    }

    public void setDefaultTimezone(String defaultTimezone) {
        this.defaultTimezone = defaultTimezone;
    }

    /**
     * Returns the timezone database, the JVM's tzdb unless one was set.
     */
    public TimezoneDatabase getTimezoneDatabase() {
        if (timezoneDatabase == null) {
            timezoneDatabase = new SystemTimezoneDatabase();
        }
        return timezoneDatabase;
    }

    public void setTimezoneDatabase(TimezoneDatabase timezoneDatabase) {
        this.timezoneDatabase = timezoneDatabase;
    }

    /**
     * Checks the settings once they have been injected.
     *
     * @throws ConfigurationException if a setting is out of range
     */
    public void init() {
        if (driftToleranceMs < 0L) {
            throw invalid("drift-tolerance", driftToleranceMs);
        }
        if (maxOccurrencesPerSeries < 1 && maxOccurrencesPerSeries != -1) {
            throw invalid("max-occurrences-per-series", maxOccurrencesPerSeries);
        }
        if (maxQueryResults < 1) {
            throw invalid("max-query-results", maxQueryResults);
        }
        if (defaultLimit < 1 || defaultLimit > maxQueryResults) {
            throw invalid("default-limit", defaultLimit);
        }
        if (backfillChunkSize < BackfillOptions.MIN_CHUNK_SIZE
                || backfillChunkSize > BackfillOptions.MAX_CHUNK_SIZE) {
            throw invalid("backfill-chunk-size", backfillChunkSize);
        }
        if (defaultTimezone != null) {
            try {
                new TimezoneResolver(getTimezoneDatabase(), defaultTimezone);
            } catch (IllegalArgumentException e) {
                throw new ConfigurationException(e.getMessage(), e);
            }
        }
    }

    private static ConfigurationException invalid(String property, Object value) {
        return new ConfigurationException(MessageFormat.format(
                L10N.getString("err.invalid_property"), property, String.valueOf(value)));
    }
}
