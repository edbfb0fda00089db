/*
 * TimekeepingEngine.java
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

import org.bluezoo.almanac.backfill.BackfillNormalizer;
import org.bluezoo.almanac.backfill.BackfillOptions;
import org.bluezoo.almanac.backfill.EventStore;
import org.bluezoo.almanac.config.EngineConfiguration;
import org.bluezoo.almanac.drift.DriftDetector;
import org.bluezoo.almanac.drift.DriftReport;
import org.bluezoo.almanac.exdate.ExdateInspection;
import org.bluezoo.almanac.expand.OccurrenceExpander;
import org.bluezoo.almanac.query.EventQuery;
import org.bluezoo.almanac.query.QueryEngine;
import org.bluezoo.almanac.query.QueryPage;
import org.bluezoo.almanac.tz.TimezoneResolver;

import java.text.MessageFormat;
import java.util.Collection;
import java.util.ResourceBundle;
import java.util.logging.Logger;

/**
 * Entry point wiring the timekeeping components from one
 * {@link EngineConfiguration}.
 *
 * <p>An engine is immutable once created and safe for concurrent use;
 * backfill normalizers it creates are not shared.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class TimekeepingEngine {

    private static final Logger LOGGER = Logger.getLogger(TimekeepingEngine.class.getName());
    private static final ResourceBundle L10N = ResourceBundle.getBundle("org.bluezoo.almanac.L10N");

    private final EngineConfiguration configuration;
    private final TimezoneResolver resolver;
    private final OccurrenceExpander expander;
    private final QueryEngine queryEngine;
    private final EventValidator validator;
    private final DriftDetector driftDetector;

    public TimekeepingEngine() {
        this(defaults());
    }

    public TimekeepingEngine(EngineConfiguration configuration) {
        this.configuration = configuration;
        this.resolver = new TimezoneResolver(configuration.getTimezoneDatabase(),
                configuration.getDefaultTimezone());
        this.expander = new OccurrenceExpander();
        this.queryEngine = new QueryEngine(resolver, expander,
                configuration.getMaxOccurrencesPerSeries(),
                configuration.getMaxQueryResults(),
                configuration.getDefaultLimit());
        this.validator = new EventValidator(resolver, expander);
        this.driftDetector = new DriftDetector(resolver, expander, configuration.getDriftTolerance());
        LOGGER.info(MessageFormat.format(L10N.getString("engine.created"),
                resolver.getDatabase().getVersion()));
    }

    private static EngineConfiguration defaults() {
        EngineConfiguration configuration = new EngineConfiguration();
        configuration.init();
        return configuration;
    }

    public EngineConfiguration getConfiguration() {
        return configuration;
    }

    public TimezoneResolver getResolver() {
        return resolver;
    }

    public OccurrenceExpander getExpander() {
        return expander;
    }

    public QueryEngine getQueryEngine() {
        return queryEngine;
    }

    public EventValidator getValidator() {
        return validator;
    }

    public DriftDetector getDriftDetector() {
        return driftDetector;
    }

    /**
     * Validates an event before it is persisted.
     *
     * @see EventValidator#validate
     */
    public ExdateInspection validate(Event event, Household household) throws TimekeepingException {
        return validator.validate(event, household);
    }

    /**
     * Runs a calendar query.
     *
     * @see QueryEngine#query
     */
    public QueryPage query(EventQuery query, Household household, Collection<Event> events)
            throws TimekeepingException {
        return queryEngine.query(query, household, events);
    }

    /**
     * Checks stored UTC caches against the current timezone data.
     *
     * @see DriftDetector#detect(Collection, Household)
     */
    public DriftReport detectDrift(Collection<Event> events, Household household) {
        return driftDetector.detect(events, household);
    }

    /**
     * Creates a backfill normalizer over a store, configured with this
     * engine's timezone pinning policy.
     */
    public BackfillNormalizer newBackfill(EventStore store) {
        BackfillNormalizer normalizer = new BackfillNormalizer(store, resolver, expander);
        normalizer.setPinTimezone(configuration.isPinTimezone());
        return normalizer;
    }

    /**
     * Returns backfill options carrying the configured chunk size.
     */
    public BackfillOptions newBackfillOptions() {
        BackfillOptions options = new BackfillOptions();
        options.setChunkSize(configuration.getBackfillChunkSize());
        return options;
    }
}
