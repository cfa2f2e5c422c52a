/*
 * GreenNodeTest.java
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

import org.junit.Before;
import org.junit.Test;

import java.io.IOException;
import java.io.StringWriter;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.junit.Assert.*;

/**
 * Unit tests for the green node types.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class GreenNodeTest {

    private GreenToken a;
    private GreenToken start;
    private GreenToken b;
    private GreenToken end;
    private GreenToken c;
    private GreenBlock block;
    private GreenDocument document;

    @Before
    public void setUp() {
        a = new GreenToken(TemplateSyntaxKind.LITERAL_TEXT, "a");
        start = new GreenToken(TemplateSyntaxKind.STANDARD_BLOCK_START, "<#");
        b = new GreenToken(TemplateSyntaxKind.LITERAL_TEXT, "b");
        end = new GreenToken(TemplateSyntaxKind.STANDARD_BLOCK_END, "#>");
        c = new GreenToken(TemplateSyntaxKind.LITERAL_TEXT, "c");
        block = new GreenBlock(TemplateSyntaxKind.STANDARD_BLOCK, start,
                content(b), end, null);
        document = new GreenDocument(Arrays.<GreenNode>asList(run(a), block, run(c)),
                GreenToken.endOfFile());
    }

    private static GreenListNode run(GreenToken... tokens) {
        return new GreenListNode(TemplateSyntaxKind.TEXT_RUN, Arrays.asList(tokens), null);
    }

    private static GreenListNode content(GreenToken... tokens) {
        return new GreenListNode(TemplateSyntaxKind.BLOCK_CONTENT, Arrays.asList(tokens), null);
    }

    @Test
    public void testTokenWidth() {
        assertEquals(2, start.getFullWidth());
        assertEquals(0, GreenToken.endOfFile().getFullWidth());
        assertTrue(a.isToken());
        assertEquals(0, a.getSlotCount());
    }

    @Test
    public void testWidthIsSumOfChildren() {
        assertEquals(5, block.getFullWidth());
        assertEquals(7, document.getFullWidth());
        assertWidthAdditive(document);
    }

    private static void assertWidthAdditive(GreenNode node) {
        if (node.isToken()) {
            return;
        }
        int sum = 0;
        for (int i = 0; i < node.getSlotCount(); i++) {
            GreenNode child = node.getSlot(i);
            if (child != null) {
                sum += child.getFullWidth();
                assertWidthAdditive(child);
            }
        }
        assertEquals(node.getFullWidth(), sum);
    }

    @Test
    public void testRoundTrip() throws IOException {
        assertEquals("a<#b#>c", document.toFullString());
        StringWriter out = new StringWriter();
        document.writeTo(out);
        assertEquals("a<#b#>c", out.toString());
        assertEquals("<#b#>", block.toFullString());
    }

    @Test
    public void testDeepTreeWrite() {
        // Long documents must not exhaust the call stack
        List<GreenNode> items = new ArrayList<GreenNode>();
        StringBuilder expected = new StringBuilder();
        for (int i = 0; i < 5000; i++) {
            items.add(new GreenBlock(TemplateSyntaxKind.EXPRESSION_BLOCK,
                    new GreenToken(TemplateSyntaxKind.EXPRESSION_BLOCK_START, "<#="),
                    content(new GreenToken(TemplateSyntaxKind.LITERAL_TEXT, "x" + i)),
                    new GreenToken(TemplateSyntaxKind.EXPRESSION_BLOCK_END, "=#>"), null));
            expected.append("<#=x").append(i).append("=#>");
        }
        GreenDocument doc = new GreenDocument(items, GreenToken.endOfFile());
        assertEquals(expected.toString(), doc.toFullString());
    }

    @Test
    public void testSlotOffsets() {
        assertEquals(0, block.getSlotOffset(GreenBlock.START_SLOT));
        assertEquals(2, block.getSlotOffset(GreenBlock.CONTENT_SLOT));
        assertEquals(3, block.getSlotOffset(GreenBlock.END_SLOT));
        assertEquals(0, document.getSlotOffset(0));
        assertEquals(1, document.getSlotOffset(1));
        assertEquals(6, document.getSlotOffset(2));
        assertEquals(7, document.getSlotOffset(3));
    }

    @Test
    public void testAbsentSlots() {
        GreenBlock empty = new GreenBlock(TemplateSyntaxKind.DIRECTIVE_BLOCK,
                new GreenToken(TemplateSyntaxKind.DIRECTIVE_START, "<#@"), null, null, null);
        assertEquals(3, empty.getSlotCount());
        assertNull(empty.getSlot(GreenBlock.CONTENT_SLOT));
        assertNull(empty.getSlot(GreenBlock.END_SLOT));
        assertFalse(empty.isTerminated());
        assertEquals(3, empty.getFullWidth());
        assertEquals(3, empty.getSlotOffset(GreenBlock.END_SLOT));
        assertSame(empty.getStart(), empty.getRequiredSlot(GreenBlock.START_SLOT));
    }

    @Test(expected = IllegalStateException.class)
    public void testRequiredSlotAbsent() {
        GreenBlock empty = new GreenBlock(TemplateSyntaxKind.STANDARD_BLOCK, start, null, null, null);
        empty.getRequiredSlot(GreenBlock.END_SLOT);
    }

    @Test(expected = IndexOutOfBoundsException.class)
    public void testSlotOutOfRange() {
        block.getSlot(3);
    }

    @Test(expected = IndexOutOfBoundsException.class)
    public void testTokenHasNoSlots() {
        a.getSlot(0);
    }

    @Test
    public void testDocumentEndOfFile() {
        assertEquals(4, document.getSlotCount());
        assertEquals(3, document.getItemCount());
        assertSame(document.getEndOfFile(), document.getSlot(3));
        assertSame(block, document.getItem(1));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testEmptyLiteralRejected() {
        new GreenToken(TemplateSyntaxKind.LITERAL_TEXT, "");
    }

    @Test(expected = IllegalArgumentException.class)
    public void testNodeKindTokenRejected() {
        new GreenToken(TemplateSyntaxKind.DOCUMENT, "x");
    }

    @Test(expected = IllegalArgumentException.class)
    public void testMismatchedEndRejected() {
        new GreenBlock(TemplateSyntaxKind.STANDARD_BLOCK, start, null,
                new GreenToken(TemplateSyntaxKind.DIRECTIVE_END, "@#>"), null);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testWrongStartRejected() {
        new GreenBlock(TemplateSyntaxKind.EXPRESSION_BLOCK, start, null, null, null);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testEmptyListRejected() {
        new GreenListNode(TemplateSyntaxKind.TEXT_RUN, Collections.<GreenToken>emptyList(), null);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testEndOfFileInListRejected() {
        run(a, GreenToken.endOfFile());
    }

    @Test
    public void testDiagnostics() {
        DiagnosticInfo info = new DiagnosticInfo(DiagnosticCode.UNEXPECTED_END_DELIMITER, 1, 2, "#>");
        GreenListNode stray = new GreenListNode(TemplateSyntaxKind.TEXT_RUN, Arrays.asList(a, end),
                new DiagnosticInfo[] { info });
        assertTrue(stray.containsDiagnostics());
        assertEquals(Collections.singletonList(info), stray.getDiagnostics());
        assertFalse(block.containsDiagnostics());
        assertTrue(block.getDiagnostics().isEmpty());

        GreenDocument doc = new GreenDocument(Collections.<GreenNode>singletonList(stray),
                GreenToken.endOfFile());
        assertTrue(doc.containsDiagnostics());
        assertTrue(doc.getDiagnostics().isEmpty());
        assertEquals("End delimiter #> outside any block", info.getMessage());
    }

    @Test
    public void testEquivalence() {
        GreenBlock copy = new GreenBlock(TemplateSyntaxKind.STANDARD_BLOCK,
                new GreenToken(TemplateSyntaxKind.STANDARD_BLOCK_START, "<#"),
                content(new GreenToken(TemplateSyntaxKind.LITERAL_TEXT, "b")),
                new GreenToken(TemplateSyntaxKind.STANDARD_BLOCK_END, "#>"), null);
        assertTrue(block.isEquivalentTo(copy));
        assertNotSame(block, copy);

        GreenBlock other = new GreenBlock(TemplateSyntaxKind.STANDARD_BLOCK, start,
                content(new GreenToken(TemplateSyntaxKind.LITERAL_TEXT, "x")), end, null);
        assertFalse(block.isEquivalentTo(other));

        GreenBlock unterminated = new GreenBlock(TemplateSyntaxKind.STANDARD_BLOCK, start,
                content(b, new GreenToken(TemplateSyntaxKind.LITERAL_TEXT, "##")), null, null);
        assertFalse(block.isEquivalentTo(unterminated));
    }

}
