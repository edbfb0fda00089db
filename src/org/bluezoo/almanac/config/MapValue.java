/*
 * MapValue.java
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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Map-valued property. Entry values may be strings or component
 * references, resolved at injection time.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class MapValue {

    private final Map<Object, Object> entries = new LinkedHashMap<Object, Object>();

    public void put(Object key, Object value) {
        entries.put(key, value);
    }

    public Map<Object, Object> getEntries() {
        return Collections.unmodifiableMap(entries);
    }

    @Override
    public String toString() {
        return entries.toString();
    }
}
