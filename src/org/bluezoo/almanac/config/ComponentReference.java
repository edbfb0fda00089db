/*
 * ComponentReference.java
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

/**
 * Reference to another component by id, written {@code #id} in
 * configuration.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class ComponentReference {

    private final String refId;

    public ComponentReference(String refId) {
        if (refId == null || refId.isEmpty()) {
            throw new IllegalArgumentException("refId");
        }
        this.refId = refId;
    }

    public String getRefId() {
        return refId;
    }

    @Override
    public boolean equals(Object obj) {
        return obj instanceof ComponentReference && refId.equals(((ComponentReference) obj).refId);
    }

    @Override
    public int hashCode() {
        return refId.hashCode();
    }

    @Override
    public String toString() {
        return "#" + refId;
    }
}
