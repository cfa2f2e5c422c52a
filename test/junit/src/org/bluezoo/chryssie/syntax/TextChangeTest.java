/*
 * TextChangeTest.java
 * Copyright (C) 2025 Chris Burdess
 *
 * This file is part of chryssie, an incremental template parser.
 *
 * chryssie is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Lesser General Public License as published by
 * the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * chryssie is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU Lesser General Public License for more details.
 *
 * You should have received a copy of the GNU Lesser General Public License
 * along with chryssie.  If not, see <http://www.gnu.org/licenses/>.
 */

package org.bluezoo.chryssie.syntax;

import org.junit.Test;

import java.util.Arrays;
import java.util.Collections;

import static org.junit.Assert.*;

/**
 * Unit tests for {@link TextChange}.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class TextChangeTest {

    @Test
    public void testInsert() {
        TextChange change = TextChange.insert(1, "x");
        assertEquals(1, change.getStart());
        assertEquals(1, change.getOldEnd());
        assertEquals(1, change.getDelta());
        assertEquals("ax<#b#>c", TextChange.apply("a<#b#>c", Collections.singletonList(change)));
    }

    @Test
    public void testDeleteAndReplace() {
        assertEquals("ac", TextChange.apply("a<#b#>c",
                Collections.singletonList(TextChange.delete(1, 5))));
        assertEquals("a<#=b=#>c", TextChange.apply("a<#b#>c",
                Arrays.asList(new TextChange(1, 2, "<#="), new TextChange(4, 2, "=#>"))));
    }

    @Test
    public void testAtEnd() {
        assertEquals("abc", TextChange.apply("ab",
                Collections.singletonList(TextChange.insert(2, "c"))));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testOverlapping() {
        TextChange.apply("abcdef", Arrays.asList(new TextChange(1, 3, "x"), new TextChange(2, 1, "y")));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testUnsorted() {
        TextChange.apply("abcdef", Arrays.asList(TextChange.insert(4, "x"), TextChange.insert(1, "y")));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testPastEnd() {
        TextChange.apply("abc", Collections.singletonList(TextChange.delete(2, 2)));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testNegativeStart() {
        new TextChange(-1, 0, "");
    }

    @Test
    public void testEquality() {
        assertEquals(new TextChange(3, 0, "x"), TextChange.insert(3, "x"));
        assertEquals(new TextChange(3, 0, "x").hashCode(), TextChange.insert(3, "x").hashCode());
        assertFalse(TextChange.insert(3, "x").equals(TextChange.insert(4, "x")));
    }

}
