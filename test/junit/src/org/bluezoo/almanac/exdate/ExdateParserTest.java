/*
 * ExdateParserTest.java
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
import org.junit.Test;

import java.time.Instant;
import java.util.Arrays;
import java.util.function.Predicate;

import static org.junit.Assert.*;

/**
 * Unit tests for {@link ExdateParser}.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class ExdateParserTest {

    private static final Instant FIRST = Instant.parse("2024-03-01T14:00:00Z");
    private static final Instant LAST = Instant.parse("2024-03-05T14:00:00Z");

    @Test
    public void testSplitIgnoresBlanks() {
        assertEquals(Arrays.asList("a", "b"), ExdateParser.split(" a, ,b ,"));
        assertTrue(ExdateParser.split(null).isEmpty());
    }

    @Test
    public void testParseEmpty() throws Exception {
        assertSame(ExdateSet.EMPTY, ExdateParser.parse(null));
        assertSame(ExdateSet.EMPTY, ExdateParser.parse("  "));
    }

    @Test
    public void testParse() throws Exception {
        ExdateSet set = ExdateParser.parse("2024-03-05T14:00:00Z, 2024-03-03T14:00:00Z");

        assertEquals(2, set.size());
        assertTrue(set.contains(Instant.parse("2024-03-03T14:00:00Z")));
        assertTrue(set.contains(Instant.parse("2024-03-05T14:00:00Z").toEpochMilli()));
        assertFalse(set.contains(Instant.parse("2024-03-04T14:00:00Z")));
        assertEquals("2024-03-03T14:00:00Z,2024-03-05T14:00:00Z", set.toCanonicalString());
    }

    @Test
    public void testFractionalEntryKeepsMillis() throws Exception {
        ExdateSet set = ExdateParser.parse("2024-03-03T14:00:00.500Z,2024-03-03T14:00:00.000Z,"
                + "2024-03-04T14:00:00.123456Z");

        assertEquals(3, set.size());
        assertTrue(set.contains(Instant.parse("2024-03-03T14:00:00.500Z")));
        assertFalse(set.contains(Instant.parse("2024-03-03T14:00:01Z")));
        assertEquals("2024-03-03T14:00:00Z,2024-03-03T14:00:00.500Z,2024-03-04T14:00:00.123Z",
                set.toCanonicalString());

        // The canonical text parses back to the same set
        assertEquals(set, ExdateParser.parse(set.toCanonicalString()));
        assertEquals("2024-03-05T14:00:00.050Z",
                ExdateSet.format(Instant.parse("2024-03-05T14:00:00.050Z")));
    }

    @Test
    public void testParseRejectsOffset() {
        try {
            ExdateParser.parse("2024-03-03T14:00:00Z,2024-03-05T09:00:00-05:00");
            fail("Expected E_EXDATE_INVALID_FORMAT");
        } catch (TimekeepingException e) {
            assertEquals(TimeErrorCode.EXDATE_INVALID_FORMAT, e.getCode());
            assertEquals("2024-03-05T09:00:00-05:00", e.getDetail());
        }
    }

    @Test
    public void testParseRejectsGarbage() {
        try {
            ExdateParser.parse("20240305");
            fail("Expected E_EXDATE_INVALID_FORMAT");
        } catch (TimekeepingException e) {
            assertEquals(TimeErrorCode.EXDATE_INVALID_FORMAT, e.getCode());
            assertEquals("20240305", e.getDetail());
        }
    }

    @Test
    public void testCheckRange() throws Exception {
        ExdateSet inside = ExdateParser.parse("2024-03-01T14:00:00Z,2024-03-05T14:00:00Z");
        ExdateParser.checkRange(inside, FIRST, LAST);

        ExdateSet before = ExdateParser.parse("2024-02-29T14:00:00Z");
        try {
            ExdateParser.checkRange(before, FIRST, LAST);
            fail("Expected E_EXDATE_OUT_OF_RANGE");
        } catch (TimekeepingException e) {
            assertEquals(TimeErrorCode.EXDATE_OUT_OF_RANGE, e.getCode());
            assertEquals("2024-02-29T14:00:00Z", e.getDetail());
        }
    }

    @Test
    public void testCheckRangeUnbounded() throws Exception {
        ExdateSet far = ExdateParser.parse("2099-01-01T14:00:00Z");
        ExdateParser.checkRange(far, FIRST, null);
    }

    @Test
    public void testInspectClassifies() {
        Predicate<Instant> occurrence = new Predicate<Instant>() {
            @Override
            public boolean test(Instant instant) {
                return !instant.equals(Instant.parse("2024-03-04T15:00:00Z"));
            }
        };
        ExdateInspection inspection = ExdateParser.inspect(
                "2024-03-03T14:00:00Z, bogus, 2024-03-02T09:00:00-05:00,"
                + "2024-03-09T14:00:00Z, 2024-03-03T14:00:00Z, 2024-03-04T15:00:00Z",
                FIRST, LAST, occurrence);

        assertEquals(6, inspection.getTotalInputs());
        assertEquals(Arrays.asList("bogus"), inspection.getInvalidFormat());
        assertEquals(Arrays.asList("2024-03-02T09:00:00-05:00"), inspection.getNonUtc());
        assertEquals(Arrays.asList("2024-03-09T14:00:00Z"), inspection.getOutOfRange());
        assertEquals(1, inspection.getDuplicates());
        assertEquals(3, inspection.getSkipped());
        assertFalse(inspection.isClean());
        assertEquals(Arrays.asList(Instant.parse("2024-03-04T15:00:00Z")), inspection.getUnmatched());
        assertEquals("2024-03-03T14:00:00Z,2024-03-04T15:00:00Z", inspection.getCanonical());
    }

    @Test
    public void testInspectEmpty() {
        ExdateInspection inspection = ExdateParser.inspect(null, null, null, null);

        assertEquals(0, inspection.getTotalInputs());
        assertTrue(inspection.isClean());
        assertNull(inspection.getCanonical());
    }
}
