/*
 * TemplateSyntaxKindTest.java
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

import static org.junit.Assert.*;

/**
 * Unit tests for {@link TemplateSyntaxKind}.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class TemplateSyntaxKindTest {

    @Test
    public void testLiteralAtHostBase() {
        assertEquals(24058, TemplateSyntaxKind.LITERAL_TEXT.getValue());
        assertEquals(TemplateSyntaxKind.HOST_KIND_BASE, TemplateSyntaxKind.LITERAL_TEXT.getValue());
    }

    @Test
    public void testEndFollowsStart() {
        for (TemplateSyntaxKind kind : TemplateSyntaxKind.values()) {
            if (kind.isStartDelimiter()) {
                TemplateSyntaxKind end = kind.getMatchingEnd();
                assertTrue(end.isEndDelimiter());
                assertEquals(kind.getValue() + 1, end.getValue());
                assertSame(kind, end.getMatchingStart());
            }
        }
    }

    @Test
    public void testDelimiterPairs() {
        assertSame(TemplateSyntaxKind.DIRECTIVE_END, TemplateSyntaxKind.DIRECTIVE_START.getMatchingEnd());
        assertSame(TemplateSyntaxKind.STANDARD_BLOCK_END, TemplateSyntaxKind.STANDARD_BLOCK_START.getMatchingEnd());
        assertSame(TemplateSyntaxKind.EXPRESSION_BLOCK_END, TemplateSyntaxKind.EXPRESSION_BLOCK_START.getMatchingEnd());
        assertSame(TemplateSyntaxKind.CLASS_FEATURE_BLOCK_END,
                TemplateSyntaxKind.CLASS_FEATURE_BLOCK_START.getMatchingEnd());
    }

    @Test
    public void testBlockKinds() {
        assertSame(TemplateSyntaxKind.DIRECTIVE_BLOCK, TemplateSyntaxKind.DIRECTIVE_START.getBlockKind());
        assertSame(TemplateSyntaxKind.STANDARD_BLOCK, TemplateSyntaxKind.STANDARD_BLOCK_START.getBlockKind());
        assertSame(TemplateSyntaxKind.EXPRESSION_BLOCK, TemplateSyntaxKind.EXPRESSION_BLOCK_START.getBlockKind());
        assertSame(TemplateSyntaxKind.CLASS_FEATURE_BLOCK,
                TemplateSyntaxKind.CLASS_FEATURE_BLOCK_START.getBlockKind());
        for (TemplateSyntaxKind kind : TemplateSyntaxKind.values()) {
            if (kind.isBlock()) {
                assertSame(kind, kind.getStartDelimiter().getBlockKind());
            }
        }
    }

    @Test
    public void testCategories() {
        int tokens = 0;
        int starts = 0;
        int ends = 0;
        int blocks = 0;
        for (TemplateSyntaxKind kind : TemplateSyntaxKind.values()) {
            if (kind.isToken()) {
                tokens++;
            }
            if (kind.isStartDelimiter()) {
                starts++;
                assertFalse(kind.isEndDelimiter());
            }
            if (kind.isEndDelimiter()) {
                ends++;
            }
            if (kind.isBlock()) {
                blocks++;
                assertFalse(kind.isToken());
            }
        }
        assertEquals(10, tokens);
        assertEquals(4, starts);
        assertEquals(4, ends);
        assertEquals(4, blocks);
        assertTrue(TemplateSyntaxKind.END_OF_FILE.isToken());
        assertFalse(TemplateSyntaxKind.END_OF_FILE.isDelimiter());
        assertFalse(TemplateSyntaxKind.LITERAL_TEXT.isDelimiter());
        assertFalse(TemplateSyntaxKind.DOCUMENT.isToken());
    }

    @Test
    public void testFromValue() {
        for (TemplateSyntaxKind kind : TemplateSyntaxKind.values()) {
            assertSame(kind, TemplateSyntaxKind.fromValue(kind.getValue()));
        }
    }

    @Test(expected = IllegalArgumentException.class)
    public void testFromValueBelowBase() {
        TemplateSyntaxKind.fromValue(TemplateSyntaxKind.HOST_KIND_BASE - 1);
    }

    @Test(expected = IllegalStateException.class)
    public void testMatchingEndOfNonStart() {
        TemplateSyntaxKind.LITERAL_TEXT.getMatchingEnd();
    }

    @Test(expected = IllegalStateException.class)
    public void testBlockKindOfEnd() {
        TemplateSyntaxKind.STANDARD_BLOCK_END.getBlockKind();
    }

}
